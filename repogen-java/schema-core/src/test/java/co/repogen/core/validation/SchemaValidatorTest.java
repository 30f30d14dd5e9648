package co.repogen.core.validation;

import co.repogen.core.Fixtures;
import co.repogen.core.SchemaLoader;
import co.repogen.core.diagnostics.Diagnostic;
import co.repogen.core.diagnostics.DiagnosticKind;
import co.repogen.core.diagnostics.Diagnostics;
import co.repogen.core.diagnostics.Severity;
import co.repogen.core.model.SchemaDocument;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

public class SchemaValidatorTest {

  private SchemaValidator validator;
  private ObjectNode schema;

  @BeforeEach
  void setUp() {
    validator = new SchemaValidator();
    schema = Fixtures.ecommerce();
  }

  private Diagnostics validate(ObjectNode json) {
    SchemaDocument doc = SchemaLoader.load(json).document();
    return validator.validate(doc);
  }

  /** Errors of one kind; the fixture's unsafe INCLUDE warning is also CONSISTENCY. */
  private static List<Diagnostic> errors(Diagnostics d, DiagnosticKind kind) {
    return d.errors().stream().filter(e -> e.kind() == kind).toList();
  }

  private ObjectNode firstIndex() {
    return (ObjectNode) schema.get("tables").get(0).get("gsi_list").get(0);
  }

  // =========================================================================
  // Clean documents
  // =========================================================================

  @Test
  void acceptsValidSchema() {
    Diagnostics d = validate(schema);

    assertThat(d.errors()).isEmpty();
  }

  @Test
  void warnsAboutIncludeProjectionThatDropsRequiredFields() {
    Diagnostics d = validate(schema);

    assertThat(d.warnings()).singleElement().satisfies(w -> {
      assertThat(w.severity()).isEqualTo(Severity.WARNING);
      assertThat(w.path()).isEqualTo("tables[0].entities.Order.gsi_mappings[0]");
      assertThat(w.message()).contains("TenantIndex", "user_id", "order_id");
    });
    assertThat(d.hasErrors()).isFalse();
  }

  @Test
  void parallelRunReportsTheSameDiagnostics() {
    ObjectNode broken = Fixtures.ecommerce();
    Fixtures.pattern(broken, 0, "User", 0).put("operation", "Fetch");
    Fixtures.pattern(broken, 0, "User", 1).put("pattern_id", 1);
    SchemaDocument doc = SchemaLoader.load(broken).document();

    List<Diagnostic> serial = new SchemaValidator(new ValidatorOptions(false)).validate(doc).sorted();
    List<Diagnostic> parallel = new SchemaValidator(new ValidatorOptions(true)).validate(doc).sorted();

    assertThat(parallel).isEqualTo(serial);
  }

  // =========================================================================
  // Enum and reference suggestions
  // =========================================================================

  @Test
  void suggestsIndexNameForTypo() {
    Fixtures.pattern(schema, 0, "User", 2).put("index_name", "StatusIdx");

    Diagnostics d = validate(schema);

    assertThat(d.ofKind(DiagnosticKind.REFERENCE)).singleElement().satisfies(r -> {
      assertThat(r.path()).isEqualTo("tables[0].entities.User.access_patterns[2].index_name");
      assertThat(r.suggestion()).isEqualTo("StatusIndex");
    });
  }

  @Test
  void suggestsOperationForTypo() {
    Fixtures.pattern(schema, 0, "Order", 0).put("operation", "Qeury");

    Diagnostics d = validate(schema);

    assertThat(d.ofKind(DiagnosticKind.ENUM)).singleElement().satisfies(e -> {
      assertThat(e.path()).isEqualTo("tables[0].entities.Order.access_patterns[0].operation");
      assertThat(e.suggestion()).isEqualTo("Query");
    });
  }

  @Test
  void rejectsUnknownFieldType() {
    ((ObjectNode) Fixtures.entity(schema, 1, "Product").get("fields").get(2)).put("type", "int");

    Diagnostics d = validate(schema);

    assertThat(d.ofKind(DiagnosticKind.ENUM)).extracting(Diagnostic::path)
      .containsExactly("tables[1].entities.Product.fields[2].type");
  }

  @Test
  void reportsTemplateFieldThatDoesNotExist() {
    Fixtures.entity(schema, 0, "Order").put("sk_template", "ORDER#{ordr_id}");

    Diagnostics d = validate(schema);

    assertThat(d.ofKind(DiagnosticKind.REFERENCE)).singleElement().satisfies(r -> {
      assertThat(r.path()).isEqualTo("tables[0].entities.Order.sk_template");
      assertThat(r.suggestion()).isEqualTo("order_id");
    });
  }

  // =========================================================================
  // Uniqueness
  // =========================================================================

  @Test
  void duplicatePatternIdAcrossEntitiesIsReportedOnce() {
    Fixtures.pattern(schema, 1, "Product", 0).put("pattern_id", 3);

    Diagnostics d = validate(schema);

    assertThat(d.ofKind(DiagnosticKind.UNIQUENESS)).singleElement().satisfies(u -> {
      assertThat(u.path()).isEqualTo("tables[1].entities.Product.access_patterns[0].pattern_id");
      assertThat(u.relatedPath()).isEqualTo("tables[0].entities.User.access_patterns[2].pattern_id");
      assertThat(u.message()).contains("3");
    });
  }

  @Test
  void crossTablePatternIdsShareTheIdSpace() {
    ((ObjectNode) schema.get("cross_table_access_patterns").get(0)).put("pattern_id", 1);

    Diagnostics d = validate(schema);

    assertThat(d.ofKind(DiagnosticKind.UNIQUENESS)).singleElement()
      .satisfies(u -> assertThat(u.path()).isEqualTo("cross_table_access_patterns[0].pattern_id"));
  }

  @Test
  void duplicateFieldNamesAreRejected() {
    ((ObjectNode) Fixtures.entity(schema, 1, "Product").get("fields").get(3)).put("name", "stock");
    ((ObjectNode) Fixtures.entity(schema, 1, "Product").get("fields").get(3)).put("type", "integer");

    Diagnostics d = validate(schema);

    assertThat(d.ofKind(DiagnosticKind.UNIQUENESS)).extracting(Diagnostic::path)
      .containsExactly("tables[1].entities.Product.fields[3].name");
  }

  // =========================================================================
  // Cardinality
  // =========================================================================

  @Test
  void indexKeyArrayLongerThanFourNamesTheIndex() {
    ArrayNode wide = firstIndex().putArray("partition_key");
    wide.add("a").add("b").add("c").add("d").add("e");

    Diagnostics d = validate(schema);

    assertThat(d.ofKind(DiagnosticKind.CARDINALITY)).anySatisfy(c -> {
      assertThat(c.path()).isEqualTo("tables[0].gsi_list[0].partition_key");
      assertThat(c.message()).contains("StatusIndex");
    });
  }

  @Test
  void betweenWithTwoParametersOnMainTableIsCardinalityError() {
    ObjectNode orders = Fixtures.pattern(schema, 0, "Order", 0);
    orders.put("range_condition", "between");

    Diagnostics d = validate(schema);

    assertThat(d.ofKind(DiagnosticKind.CARDINALITY)).singleElement().satisfies(c -> {
      assertThat(c.path()).isEqualTo("tables[0].entities.Order.access_patterns[0].parameters");
      assertThat(c.message()).contains("needs exactly 3", "found 2");
    });
  }

  @Test
  void mainTableRangeTakesOnePartitionValueWhateverTheTemplate() {
    Fixtures.entity(schema, 0, "Order").put("pk_template", "TENANT#{tenant_id}#USER#{user_id}");
    ObjectNode orders = Fixtures.pattern(schema, 0, "Order", 0);

    assertThat(validate(schema).ofKind(DiagnosticKind.CARDINALITY)).isEmpty();

    ((ArrayNode) orders.get("parameters")).insertObject(0).put("name", "tenant_id").put("type", "string");

    assertThat(validate(schema).ofKind(DiagnosticKind.CARDINALITY)).singleElement().satisfies(c -> {
      assertThat(c.path()).isEqualTo("tables[0].entities.Order.access_patterns[0].parameters");
      assertThat(c.message()).contains("needs exactly 2", "found 3");
    });
  }

  @Test
  void rangeCountIncludesFilterParameters() {
    ObjectNode byStatus = Fixtures.pattern(schema, 0, "User", 2);
    ((ArrayNode) byStatus.get("parameters")).addObject().put("name", "wanted_email").put("type", "string");
    byStatus.putObject("filter_expression").putArray("conditions").addObject()
      .put("field", "email").put("operator", "=").put("param", "wanted_email");

    assertThat(validate(schema).ofKind(DiagnosticKind.CARDINALITY)).singleElement()
      .satisfies(c -> assertThat(c.message()).contains("needs 2", "found 3"));
  }

  @Test
  void multiAttributeSortKeyAllowsLeadingEqualities() {
    ArrayNode params = (ArrayNode) Fixtures.pattern(schema, 0, "Order", 1).get("parameters");
    params.remove(2);

    assertThat(validate(schema).errors()).isEmpty();

    params.remove(0);
    assertThat(validate(schema).ofKind(DiagnosticKind.CARDINALITY)).singleElement()
      .satisfies(c -> assertThat(c.message()).contains("needs 4-5"));
  }

  @Test
  void mappingArityMustMatchIndex() {
    ArrayNode pk = (ArrayNode) Fixtures.entity(schema, 0, "Order").get("gsi_mappings").get(0).get("pk_template");
    pk.remove(1);

    Diagnostics d = validate(schema);

    assertThat(d.ofKind(DiagnosticKind.CARDINALITY)).extracting(Diagnostic::path)
      .contains("tables[0].entities.Order.gsi_mappings[0].pk_template");
  }

  // =========================================================================
  // Consistency
  // =========================================================================

  @Test
  void consistentReadOnIndexIsRejected() {
    Fixtures.pattern(schema, 0, "User", 2).put("consistent_read", true);

    Diagnostics d = validate(schema);

    assertThat(errors(d, DiagnosticKind.CONSISTENCY)).singleElement()
      .satisfies(c -> assertThat(c.path()).isEqualTo("tables[0].entities.User.access_patterns[2].consistent_read"));
  }

  @Test
  void fieldsWithSameGeneratedNameAreRejected() {
    ((ArrayNode) Fixtures.entity(schema, 0, "User").get("fields")).addObject()
      .put("name", "userId").put("type", "string");

    Diagnostics d = validate(schema);

    assertThat(errors(d, DiagnosticKind.CONSISTENCY)).singleElement().satisfies(c -> {
      assertThat(c.path()).startsWith("tables[0].entities.User.fields[").endsWith("].name");
      assertThat(c.message()).contains("userId", "user_id");
    });
  }

  @Test
  void consistentReadFalseOnIndexIsFine() {
    Fixtures.pattern(schema, 0, "User", 2).put("consistent_read", false);

    assertThat(validate(schema).errors()).isEmpty();
  }

  @Test
  void rangeConditionOnlyOnQuery() {
    Fixtures.pattern(schema, 1, "Product", 0).put("range_condition", "begins_with");

    Diagnostics d = validate(schema);

    assertThat(errors(d, DiagnosticKind.CONSISTENCY)).extracting(Diagnostic::path)
      .containsExactly("tables[1].entities.Product.access_patterns[0].range_condition");
  }

  @Test
  void filterOnKeyAttributeInQueryIsRejected() {
    ObjectNode pattern = Fixtures.pattern(schema, 0, "Order", 0);
    ((ArrayNode) pattern.get("parameters")).addObject().put("name", "wanted").put("type", "string");
    ObjectNode condition = pattern.putObject("filter_expression").putArray("conditions").addObject();
    condition.put("field", "order_id").put("operator", "=").put("param", "wanted");

    Diagnostics d = validate(schema);

    assertThat(errors(d, DiagnosticKind.CONSISTENCY)).extracting(Diagnostic::path)
      .containsExactly("tables[0].entities.Order.access_patterns[0].filter_expression.conditions[0].field");
  }

  @Test
  void crossTableParameterTypeMustMatchField() {
    ObjectNode param = (ObjectNode) schema.get("cross_table_access_patterns").get(0).get("parameters").get(1);
    param.put("type", "integer");

    Diagnostics d = validate(schema);

    assertThat(errors(d, DiagnosticKind.CONSISTENCY)).extracting(Diagnostic::path)
      .containsExactly("cross_table_access_patterns[0].parameters[1].type");
  }

  @Test
  void transactGetAllowsOnlyGet() {
    ObjectNode tx = (ObjectNode) schema.get("cross_table_access_patterns").get(0);
    tx.put("operation", "TransactGet");

    Diagnostics d = validate(schema);

    assertThat(d.ofKind(DiagnosticKind.ENUM)).extracting(Diagnostic::path).containsExactly(
      "cross_table_access_patterns[0].entities_involved[0].action",
      "cross_table_access_patterns[0].entities_involved[1].action");
  }

  // =========================================================================
  // Robustness
  // =========================================================================

  @Test
  void accumulatesEverythingAndNeverThrows() {
    Fixtures.pattern(schema, 0, "User", 0).put("operation", "Fetch");
    Fixtures.pattern(schema, 0, "User", 1).put("return_type", "many");
    Fixtures.entity(schema, 0, "User").put("pk_template", "USER#{");
    Fixtures.pattern(schema, 0, "User", 3).put("index_name", "Nope");
    firstIndex().putArray("sort_key");

    Diagnostics d = assertDoesNotThrowValidate(schema);

    assertThat(d.sorted()).extracting(Diagnostic::kind)
      .contains(DiagnosticKind.ENUM, DiagnosticKind.STRUCTURAL, DiagnosticKind.REFERENCE, DiagnosticKind.CARDINALITY);
  }

  @Test
  void emptyDocumentValidatesWithoutErrors() {
    assertThat(validator.validate(SchemaDocument.empty()).isEmpty()).isTrue();
  }

  private Diagnostics assertDoesNotThrowValidate(ObjectNode json) {
    Diagnostics[] out = new Diagnostics[1];
    assertThatCode(() -> out[0] = validate(json)).doesNotThrowAnyException();
    return out[0];
  }
}
