package co.repogen.core;

import co.repogen.core.diagnostics.Diagnostic;
import co.repogen.core.diagnostics.DiagnosticKind;
import co.repogen.core.model.AccessPatternDefinition;
import co.repogen.core.model.EntityDefinition;
import co.repogen.core.model.IndexDefinition;
import co.repogen.core.model.SchemaDocument;
import co.repogen.core.model.TableDefinition;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

public class SchemaLoaderTest {

  @TempDir
  Path tempDir;

  @Test
  void loadsTablesEntitiesAndPatternsInDocumentOrder() {
    LoadResult result = SchemaLoader.load(Fixtures.ecommerce());

    assertThat(result.diagnostics().isEmpty()).isTrue();
    SchemaDocument doc = result.document();
    assertThat(doc.tableNames()).containsExactly("AppTable", "Inventory");
    assertThat(doc.entityNames()).containsExactly("User", "Order", "Product");

    TableDefinition app = doc.tables().get(0);
    assertThat(app.partitionKey()).isEqualTo("PK");
    assertThat(app.sortKey()).isEqualTo("SK");
    assertThat(app.indexNames()).containsExactly("StatusIndex", "EmailIndex", "TenantIndex");

    EntityDefinition user = app.entity("User").orElseThrow();
    assertThat(user.pkTemplate()).isEqualTo("USER#{user_id}");
    assertThat(user.fieldNames()).containsExactly("user_id", "email", "status", "created_at", "tags");
    assertThat(user.accessPatterns()).extracting(AccessPatternDefinition::name)
      .containsExactly("get_user", "create_user", "get_users_by_status", "get_user_by_email", "update_user");
    assertThat(user.accessPatterns().get(0).isConsistentRead()).isTrue();

    assertThat(doc.crossTablePatterns()).hasSize(1);
    assertThat(doc.crossTablePatterns().get(0).participants()).hasSize(2);
    assertThat(doc.crossTablePatterns().get(0).participants().get(1).condition()).isEqualTo("attribute_exists(product_id)");
  }

  @Test
  void readsMultiAttributeKeysAndProjectionDefaults() {
    SchemaDocument doc = Fixtures.ecommerceDocument();
    TableDefinition app = doc.tables().get(0);

    IndexDefinition tenant = app.index("TenantIndex").orElseThrow();
    assertThat(tenant.partitionKey().multiAttribute()).isTrue();
    assertThat(tenant.partitionKey().values()).containsExactly("tenant_id", "region");
    assertThat(tenant.includedAttributes()).containsExactly("total");

    IndexDefinition email = app.index("EmailIndex").orElseThrow();
    assertThat(email.partitionKey().multiAttribute()).isFalse();
    assertThat(email.sortKey()).isNull();

    assertThat(doc.tables().get(1).hasSortKey()).isFalse();
  }

  @Test
  void defaultsProjectionToAll() {
    String json = """
      {
        "tables": [{
          "table_config": { "table_name": "T", "partition_key": "PK" },
          "gsi_list": [{ "name": "ByName", "partition_key": "GSI1PK" }],
          "entities": {
            "Thing": {
              "entity_type": "THING",
              "pk_template": "THING#{id}",
              "fields": [{ "name": "id", "type": "string", "required": true }]
            }
          }
        }]
      }
      """;

    LoadResult result = SchemaLoader.load(json);

    assertThat(result.diagnostics().isEmpty()).isTrue();
    assertThat(result.document().tables().get(0).indexes().get(0).projection()).isEqualTo("ALL");
  }

  @Test
  void loadsFromFile() throws IOException {
    Path file = tempDir.resolve("schema.json");
    Files.writeString(file, Fixtures.ecommerce().toString());

    LoadResult result = SchemaLoader.load(file);

    assertThat(result.diagnostics().hasErrors()).isFalse();
    assertThat(result.document().entityNames()).hasSize(3);
  }

  @Test
  void propagatesMissingFile() {
    assertThatThrownBy(() -> SchemaLoader.load(tempDir.resolve("missing.json")))
      .isInstanceOf(IOException.class);
  }

  @Test
  void loadsFromPlainMaps() {
    Map<String, Object> doc = Map.of("tables", List.of(Map.of(
        "table_config", Map.of("table_name", "T", "partition_key", "PK"),
        "entities", Map.of("Thing", Map.of(
            "entity_type", "THING",
            "pk_template", "{id}",
            "fields", List.of(Map.of("name", "id", "type", "string", "required", true)))))));

    LoadResult result = SchemaLoader.load(doc);

    assertThat(result.diagnostics().isEmpty()).isTrue();
    assertThat(result.document().entityNames()).containsExactly("Thing");
  }

  @Test
  void reportsMalformedJsonAtRoot() {
    LoadResult result = SchemaLoader.load("{ \"tables\": [ ");

    assertThat(result.document().tables()).isEmpty();
    assertThat(result.diagnostics().sorted()).singleElement()
      .satisfies(d -> {
        assertThat(d.kind()).isEqualTo(DiagnosticKind.STRUCTURAL);
        assertThat(d.path()).isEqualTo("$");
      });
  }

  @Test
  void reportsWrongContainerShapes() {
    assertThat(SchemaLoader.load("[]").diagnostics().sorted())
      .extracting(Diagnostic::path).containsExactly("$");
    assertThat(SchemaLoader.load("{\"tables\": {}}").diagnostics().sorted())
      .extracting(Diagnostic::path).containsExactly("tables");
    assertThat(SchemaLoader.load("{\"tables\": [], \"cross_table_access_patterns\": 3}").diagnostics().sorted())
      .extracting(Diagnostic::path).containsExactly("cross_table_access_patterns");
  }

  @Test
  void reportsMissingRequiredKeysWithPaths() {
    ObjectNode schema = Fixtures.ecommerce();
    Fixtures.entity(schema, 0, "User").remove("pk_template");
    Fixtures.pattern(schema, 0, "Order", 1).remove("operation");
    ((ObjectNode) Fixtures.entity(schema, 0, "User").get("fields").get(1)).put("required", "yes");

    LoadResult result = SchemaLoader.load(schema);

    assertThat(result.diagnostics().sorted())
      .allMatch(d -> d.kind() == DiagnosticKind.STRUCTURAL)
      .extracting(Diagnostic::path)
      .containsExactly(
        "tables[0].entities.Order.access_patterns[1].operation",
        "tables[0].entities.User.fields[1].required",
        "tables[0].entities.User.pk_template");
  }

  @Test
  void ignoresUnknownKeys() {
    ObjectNode schema = Fixtures.ecommerce();
    schema.put("generator_hint", "ignored");
    Fixtures.entity(schema, 0, "User").put("color", "blue");

    assertThat(SchemaLoader.load(schema).diagnostics().isEmpty()).isTrue();
  }

  @Test
  void keepsEnumValuesRawForTheValidator() {
    ObjectNode schema = Fixtures.ecommerce();
    Fixtures.pattern(schema, 0, "User", 0).put("operation", "FetchItem");

    LoadResult result = SchemaLoader.load(schema);

    assertThat(result.diagnostics().isEmpty()).isTrue();
    assertThat(result.document().tables().get(0).entity("User").orElseThrow()
      .accessPatterns().get(0).operation()).isEqualTo("FetchItem");
  }
}
