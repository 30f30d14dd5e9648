package co.repogen.core.template;

import co.repogen.core.diagnostics.Diagnostics;
import co.repogen.core.model.EntityDefinition;
import co.repogen.core.model.FieldDefinition;
import co.repogen.core.model.FieldKind;
import co.repogen.core.model.KeySpec;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Binds parsed key templates to an entity's fields.
 *
 * <p>The reporting variants append syntax, reference and cardinality problems to a
 * {@link Diagnostics} sink. The strict variants are for already validated documents and
 * throw {@link IllegalStateException} on any problem.
 */
public final class KeyTemplateCompiler {
  public static final int MAX_KEY_ATTRIBUTES = 4;

  private KeyTemplateCompiler() {
  }

  /**
   * Compile one template string against {@code entity}, reporting problems under {@code path}.
   */
  public static Optional<KeyTemplate> compile(String template, EntityDefinition entity, String path,
      Diagnostics diagnostics) {
    KeyTemplate parsed;
    try {
      parsed = KeyTemplateParser.parse(template);
    } catch (TemplateSyntaxException e) {
      diagnostics.structural(path, "invalid key template '" + template + "': " + e.getMessage());
      return Optional.empty();
    }
    boolean resolved = true;
    for (String name : parsed.fieldNames()) {
      if (entity.field(name).isEmpty()) {
        diagnostics.reference(path,
            "template '" + template + "' references unknown field '" + name + "' of entity " + entity.name(),
            name, entity.fieldNames());
        resolved = false;
      }
    }
    return resolved ? Optional.of(bind(parsed, entity)) : Optional.empty();
  }

  /**
   * Compile a single or multi-attribute key. {@code owner} names the index (or table key)
   * in cardinality messages.
   */
  public static Optional<CompiledKey> compile(KeySpec spec, EntityDefinition entity, String owner, String path,
      Diagnostics diagnostics) {
    if (spec.multiAttribute() && (spec.size() < 1 || spec.size() > MAX_KEY_ATTRIBUTES)) {
      diagnostics.cardinality(path, "multi-attribute key for " + owner + " has " + spec.size()
          + " templates, expected 1-" + MAX_KEY_ATTRIBUTES);
      return Optional.empty();
    }
    List<KeyTemplate> parts = new ArrayList<>();
    boolean ok = true;
    for (int i = 0; i < spec.size(); i++) {
      String elementPath = spec.multiAttribute() ? path + "[" + i + "]" : path;
      Optional<KeyTemplate> t = compile(spec.values().get(i), entity, elementPath, diagnostics);
      if (t.isPresent()) parts.add(t.get());
      else ok = false;
    }
    return ok ? Optional.of(new CompiledKey(parts, spec.multiAttribute())) : Optional.empty();
  }

  public static KeyTemplate compileStrict(String template, EntityDefinition entity) {
    Diagnostics diagnostics = new Diagnostics();
    return compile(template, entity, entity.name(), diagnostics)
        .orElseThrow(() -> new IllegalStateException("unvalidated key template: " + diagnostics));
  }

  public static CompiledKey compileStrict(KeySpec spec, EntityDefinition entity, String owner) {
    Diagnostics diagnostics = new Diagnostics();
    return compile(spec, entity, owner, entity.name(), diagnostics)
        .orElseThrow(() -> new IllegalStateException("unvalidated key template: " + diagnostics));
  }

  private static KeyTemplate bind(KeyTemplate parsed, EntityDefinition entity) {
    if (!parsed.isPureFieldReference()) return parsed;
    boolean numeric = entity.field(parsed.segments().get(0).text())
        .flatMap(FieldDefinition::kind)
        .map(FieldKind::isNumeric)
        .orElse(false);
    return parsed.withNumericPassthrough(numeric);
  }
}
