package co.repogen.core.validation;

import co.repogen.core.diagnostics.Diagnostics;
import co.repogen.core.model.EntityDefinition;
import co.repogen.core.model.FieldDefinition;
import co.repogen.core.model.SchemaDocument;
import co.repogen.core.usage.UsageData;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Checks a usage data document against the schema it illustrates.
 *
 * <pre>
 * { "entities": { "User": { "sample_data": {...}, "access_pattern_data": {...}, "update_data": {...} } } }
 * </pre>
 */
public final class UsageDataValidator {
  private static final List<String> SECTIONS = List.of(UsageData.SAMPLE, UsageData.ALTERNATE, UsageData.UPDATE);

  public Diagnostics validate(JsonNode usage, SchemaDocument schema) {
    Diagnostics diagnostics = new Diagnostics();
    validate(usage, schema, diagnostics);
    return diagnostics;
  }

  public void validate(JsonNode usage, SchemaDocument schema, Diagnostics diagnostics) {
    if (usage == null || !usage.isObject()) {
      diagnostics.structural("usage", "usage data must be a JSON object");
      return;
    }
    JsonNode entities = usage.get("entities");
    if (entities == null || !entities.isObject()) {
      diagnostics.structural("usage.entities", "usage data needs an 'entities' object keyed by entity name");
      return;
    }
    List<String> entityNames = schema.entityNames();

    Iterator<Map.Entry<String, JsonNode>> it = entities.fields();
    while (it.hasNext()) {
      Map.Entry<String, JsonNode> e = it.next();
      String path = "usage.entities." + e.getKey();
      Optional<EntityDefinition> entity = schema.entities().filter(d -> d.name().equals(e.getKey())).findFirst();
      if (entity.isEmpty()) {
        diagnostics.reference(path, "usage data for unknown entity '" + e.getKey() + "'", e.getKey(), entityNames);
        continue;
      }
      checkEntity(entity.get(), e.getValue(), path, diagnostics);
    }

    for (String name : entityNames) {
      if (!entities.has(name)) {
        diagnostics.structural("usage.entities." + name, "usage data is missing entity '" + name + "'");
      }
    }
  }

  private void checkEntity(EntityDefinition entity, JsonNode node, String path, Diagnostics diagnostics) {
    if (!node.isObject()) {
      diagnostics.structural(path, "usage data for " + entity.name() + " must be an object");
      return;
    }
    Iterator<String> keys = node.fieldNames();
    while (keys.hasNext()) {
      String key = keys.next();
      if (!SECTIONS.contains(key)) {
        diagnostics.enumViolation(path + "." + key, "usage data section", key, SECTIONS);
      }
    }
    for (String section : SECTIONS) {
      JsonNode values = node.get(section);
      String sectionPath = path + "." + section;
      if (values == null || values.isNull()) {
        diagnostics.structural(sectionPath, "missing required section '" + section + "'");
        continue;
      }
      if (!values.isObject()) {
        diagnostics.structural(sectionPath, "'" + section + "' must be an object");
        continue;
      }
      if (UsageData.SAMPLE.equals(section)) {
        if (values.isEmpty()) diagnostics.structural(sectionPath, "'" + section + "' must not be empty");
        for (FieldDefinition f : entity.fields()) {
          if (f.required() && !values.isEmpty() && !values.has(f.name())) {
            diagnostics.structural(sectionPath, "sample data for " + entity.name() + " is missing required field '"
                + f.name() + "'");
          }
        }
      }
      Iterator<String> fields = values.fieldNames();
      while (fields.hasNext()) {
        String field = fields.next();
        if (entity.field(field).isEmpty()) {
          diagnostics.reference(sectionPath + "." + field, "'" + field + "' is not a field of entity " + entity.name(),
              field, entity.fieldNames());
        }
      }
    }
  }
}
