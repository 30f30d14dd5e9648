package co.repogen.core.resolve;

import co.repogen.core.Fixtures;
import co.repogen.core.SchemaLoader;
import co.repogen.core.model.Operation;
import co.repogen.core.model.ParameterKind;
import co.repogen.core.model.ProjectionKind;
import co.repogen.core.model.RangeCondition;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

public class PatternResolverTest {

  private ResolvedModel model;

  @BeforeEach
  void setUp() {
    model = new PatternResolver().resolve(Fixtures.ecommerceDocument());
  }

  private ResolvedEntity entity(String name) {
    return model.entities().stream().filter(e -> e.name().equals(name)).findFirst().orElseThrow();
  }

  private ResolvedPattern pattern(int id) {
    return model.patterns().filter(p -> p.id() == id).findFirst().orElseThrow();
  }

  // =========================================================================
  // Entities
  // =========================================================================

  @Test
  void compilesEntityKeys() {
    ResolvedEntity order = entity("Order");

    assertThat(order.partitionKey().apply(Map.of("user_id", "u1"))).isEqualTo("USER#u1");
    assertThat(order.sortKey().apply(Map.of("order_id", "o9"))).isEqualTo("ORDER#o9");
    assertThat(order.primaryKeyFields()).containsExactly("user_id", "order_id");
    assertThat(order.sortKeyPrefix()).isEqualTo("ORDER#");
    assertThat(entity("Product").sortKey()).isNull();
  }

  @Test
  void detectsItemCollections() {
    assertThat(entity("User").itemCollection()).isTrue();
    assertThat(entity("Order").itemCollection()).isTrue();
    assertThat(entity("Product").itemCollection()).isFalse();
  }

  @Test
  void compilesMultiAttributeIndexKeys() {
    ResolvedIndexKey tenant = entity("Order").indexKey("TenantIndex").orElseThrow();

    assertThat(tenant.partitionKey().multiAttribute()).isTrue();
    assertThat(tenant.partitionKey().apply(Map.of("tenant_id", "acme", "region", "eu")))
      .isEqualTo(List.of("acme", "eu"));
    assertThat(tenant.rawProjection()).isTrue();
  }

  @Test
  void keysOnlyIndexIsRawAndAllIsNot() {
    ResolvedEntity user = entity("User");

    assertThat(user.indexKey("EmailIndex").orElseThrow().rawProjection()).isTrue();
    assertThat(user.indexKey("StatusIndex").orElseThrow().rawProjection()).isFalse();
  }

  @Test
  void includeProjectionCoveringRequiredFieldsStaysTyped() {
    ObjectNode schema = Fixtures.ecommerce();
    ObjectNode tenant = (ObjectNode) schema.get("tables").get(0).get("gsi_list").get(2);
    tenant.putArray("included_attributes").add("total").add("user_id").add("order_id");

    ResolvedModel resolved = new PatternResolver().resolve(SchemaLoader.load(schema).document());
    ResolvedPattern byTenant = resolved.patterns().filter(p -> p.id() == 7).findFirst().orElseThrow();

    assertThat(byTenant.responseShape()).isEqualTo(ResponseShape.ENTITY_LIST);
  }

  // =========================================================================
  // Parameter partition and key plans
  // =========================================================================

  @Test
  void getItemBindsPartitionKeyAndConstantSortKey() {
    ResolvedPattern get = pattern(1);

    assertThat(get.parameters()).extracting(ResolvedParameter::name, ResolvedParameter::role)
      .containsExactly(tuple("user_id", ParameterRole.KEY));
    assertThat(get.keyPlan()).extracting(KeyPlanStep::role, KeyPlanStep::attribute)
      .containsExactly(tuple(KeyRole.PARTITION, "PK"), tuple(KeyRole.SORT, "SK"));
    assertThat(get.keyPlan().get(1).template().isConstant()).isTrue();
  }

  @Test
  void queryOnIndexSplitsKeyAndRangeParameters() {
    ResolvedPattern byStatus = pattern(3);

    assertThat(byStatus.operation()).isEqualTo(Operation.QUERY);
    assertThat(byStatus.indexName()).isEqualTo("StatusIndex");
    assertThat(byStatus.projection()).isEqualTo(ProjectionKind.ALL);
    assertThat(byStatus.parameters(ParameterRole.KEY)).extracting(ResolvedParameter::name).containsExactly("status");
    assertThat(byStatus.parameters(ParameterRole.RANGE)).extracting(ResolvedParameter::name).containsExactly("since");

    KeyPlanStep range = byStatus.keyPlan().get(1);
    assertThat(range.isRange()).isTrue();
    assertThat(range.attribute()).isEqualTo("GSI1SK");
    assertThat(range.condition()).isEqualTo(RangeCondition.GREATER_THAN_OR_EQUAL);
    assertThat(range.rangeParameters()).containsExactly("since");
  }

  @Test
  void multiAttributeQueryUsesLeadingEqualitiesThenRange() {
    ResolvedPattern byTenant = pattern(7);

    assertThat(byTenant.keyPlan())
      .extracting(KeyPlanStep::role, KeyPlanStep::attribute, KeyPlanStep::isRange)
      .containsExactly(
        tuple(KeyRole.PARTITION, "tenant_id", false),
        tuple(KeyRole.PARTITION, "region", false),
        tuple(KeyRole.SORT, "category", false),
        tuple(KeyRole.SORT, "created_at", true));
    assertThat(byTenant.keyPlan().get(3).rangeParameters()).containsExactly("start_date", "end_date");
    assertThat(byTenant.responseShape()).isEqualTo(ResponseShape.ATTRIBUTE_MAP_LIST);
  }

  @Test
  void mainTableQueryUsesBeginsWithOnSortKey() {
    ResolvedPattern orders = pattern(6);

    assertThat(orders.keyPlan()).hasSize(2);
    assertThat(orders.keyPlan().get(0).bindings()).containsExactly(entry("user_id", "user_id"));
    assertThat(orders.keyPlan().get(1).condition()).isEqualTo(RangeCondition.BEGINS_WITH);
    assertThat(orders.keyPlan().get(1).template().literalPrefix()).isEqualTo("ORDER#");
  }

  @Test
  void keysOnlyReadReturnsRawMap() {
    assertThat(pattern(4).responseShape()).isEqualTo(ResponseShape.ATTRIBUTE_MAP);
    assertThat(pattern(4).projection()).isEqualTo(ProjectionKind.KEYS_ONLY);
  }

  @Test
  void scanParametersAreFilterParameters() {
    ResolvedPattern scan = pattern(8);

    assertThat(scan.keyPlan()).isEmpty();
    assertThat(scan.parameters()).extracting(ResolvedParameter::role).containsExactly(ParameterRole.FILTER);
  }

  @Test
  void updateKeepsNonKeyParametersAsBody() {
    ResolvedPattern update = pattern(5);

    assertThat(update.parameters()).extracting(ResolvedParameter::name, ResolvedParameter::role)
      .containsExactly(tuple("user_id", ParameterRole.KEY), tuple("status", ParameterRole.BODY));
  }

  @Test
  void unmatchedKeyFieldBecomesImplicitParameter() {
    ObjectNode schema = Fixtures.ecommerce();
    ObjectNode param = (ObjectNode) Fixtures.pattern(schema, 1, "Product", 0).get("parameters").get(0);
    param.put("name", "id");

    ResolvedModel resolved = new PatternResolver().resolve(SchemaLoader.load(schema).document());
    ResolvedPattern get = resolved.patterns().filter(p -> p.id() == 10).findFirst().orElseThrow();

    assertThat(get.keyPlan().get(0).bindings()).containsExactly(entry("product_id", "product_id"));
    assertThat(get.parameters()).extracting(ResolvedParameter::name, ResolvedParameter::role)
      .containsExactly(tuple("id", ParameterRole.BODY), tuple("product_id", ParameterRole.KEY));
    assertThat(get.isFolded()).isFalse();
    assertThat(get.methodName()).isEqualTo("get_product_with_id");
  }

  @Test
  void filterParameterSharedWithIndexSortKeyStillBindsTheKey() {
    ObjectNode schema = Fixtures.ecommerce();
    Fixtures.pattern(schema, 0, "Order", 1).putObject("filter_expression").putArray("conditions").addObject()
      .put("field", "note").put("function", "contains").put("param", "category");

    ResolvedModel resolved = new PatternResolver().resolve(SchemaLoader.load(schema).document());
    ResolvedPattern byTenant = resolved.patterns().filter(p -> p.id() == 7).findFirst().orElseThrow();

    assertThat(byTenant.keyPlan())
      .extracting(KeyPlanStep::role, KeyPlanStep::attribute, KeyPlanStep::isRange)
      .containsExactly(
        tuple(KeyRole.PARTITION, "tenant_id", false),
        tuple(KeyRole.PARTITION, "region", false),
        tuple(KeyRole.SORT, "category", false),
        tuple(KeyRole.SORT, "created_at", true));
    assertThat(byTenant.keyPlan().get(2).bindings()).containsExactly(entry("category", "category"));
    assertThat(byTenant.keyPlan().get(3).rangeParameters()).containsExactly("start_date", "end_date");
    assertThat(byTenant.parameters()).filteredOn(p -> p.name().equals("category"))
      .extracting(ResolvedParameter::role).containsExactly(ParameterRole.KEY);
  }

  @Test
  void deleteWithEntityParameterReadsKeysFromEntity() {
    ObjectNode schema = Fixtures.ecommerce();
    ObjectNode delete = Fixtures.pattern(schema, 0, "Order", 3);
    delete.putArray("parameters").addObject().put("name", "order").put("type", "entity").put("entity_type", "Order");

    ResolvedModel resolved = new PatternResolver().resolve(SchemaLoader.load(schema).document());
    ResolvedPattern p = resolved.patterns().filter(x -> x.id() == 9).findFirst().orElseThrow();

    assertThat(p.keyPlan()).allMatch(KeyPlanStep::readsEntity);
    assertThat(p.keyPlan()).extracting(KeyPlanStep::entityParameter).containsOnly("order");
    assertThat(p.methodName()).isEqualTo("delete_order_with_refs");
  }

  // =========================================================================
  // CRUD conflicts
  // =========================================================================

  @Test
  void equivalentPatternsFoldIntoCrudMethods() {
    ResolvedEntity user = entity("User");

    assertThat(pattern(1).crudMethod()).isEqualTo("get_user");
    assertThat(pattern(2).crudMethod()).isEqualTo("create_user");
    assertThat(pattern(9).crudMethod()).isEqualTo("delete_order");
    assertThat(user.consistentCrudGet()).isTrue();
    assertThat(entity("Product").consistentCrudGet()).isFalse();
    assertThat(user.ownMethods()).extracting(ResolvedPattern::methodName)
      .containsExactly("get_users_by_status", "get_user_by_email", "update_user_with_status");
  }

  @Test
  void conflictingPutIsRenamed() {
    ObjectNode schema = Fixtures.ecommerce();
    ObjectNode create = Fixtures.pattern(schema, 0, "User", 1);
    create.putArray("parameters").addObject().put("name", "email").put("type", "string");

    ResolvedModel resolved = new PatternResolver().resolve(SchemaLoader.load(schema).document());

    assertThat(resolved.patterns().filter(p -> p.id() == 2).findFirst().orElseThrow().methodName())
      .isEqualTo("put_user");
  }

  @Test
  void listReturnGetsListSuffix() {
    ObjectNode schema = Fixtures.ecommerce();
    Fixtures.pattern(schema, 0, "Order", 0).put("name", "get_order");

    ResolvedModel resolved = new PatternResolver().resolve(SchemaLoader.load(schema).document());

    assertThat(resolved.patterns().filter(p -> p.id() == 6).findFirst().orElseThrow().methodName())
      .isEqualTo("get_order_list");
  }

  // =========================================================================
  // Transactions and registry
  // =========================================================================

  @Test
  void resolvesTransactionParticipants() {
    ResolvedTransaction tx = model.transactions().get(0);

    assertThat(tx.methodName()).isEqualTo("place_order");
    assertThat(tx.participants().get(0).entityParameter()).isEqualTo("order");
    assertThat(tx.participants().get(1).keyBindings()).containsExactly(entry("product_id", "product_id"));
    assertThat(tx.parameters()).extracting(ResolvedParameter::name, ResolvedParameter::kind, ResolvedParameter::role)
      .containsExactly(
        tuple("order", ParameterKind.ENTITY, ParameterRole.BODY),
        tuple("product_id", ParameterKind.STRING, ParameterRole.KEY),
        tuple("stock", ParameterKind.INTEGER, ParameterRole.BODY));
  }

  @Test
  void registryListsEveryPatternInDocumentOrder() {
    assertThat(model.registry()).extracting(PatternRegistryEntry::patternId)
      .containsExactly(1, 2, 3, 4, 5, 6, 7, 8, 9, 10, 11);

    PatternRegistryEntry get = model.registry().get(0);
    assertThat(get.repository()).isEqualTo("UserRepository");
    assertThat(get.methodName()).isEqualTo("get_user");
    assertThat(get.consistentRead()).isTrue();

    PatternRegistryEntry update = model.registry().get(4);
    assertThat(update.methodName()).isEqualTo("update_user_with_status");

    PatternRegistryEntry tx = model.registry().get(10);
    assertThat(tx.isTransaction()).isTrue();
    assertThat(tx.service()).isEqualTo("TransactionService");
    assertThat(tx.entitiesInvolved()).extracting(PatternRegistryEntry.Participant::action)
      .containsExactly("Put", "Update");
  }

  @Test
  void registrySerializesWithSnakeCaseAndWithoutNulls() throws Exception {
    String json = Fixtures.JSON.writeValueAsString(model.registry().get(2));

    assertThat(json).contains("\"pattern_id\":3", "\"index_name\":\"StatusIndex\"", "\"range_condition\":\">=\"");
    assertThat(json).doesNotContain("service", "entities_involved", "consistent_read");
  }

  @Test
  void resolvingTwiceGivesEqualModels() {
    ResolvedModel again = new PatternResolver().resolve(Fixtures.ecommerceDocument());

    assertThat(again.registry()).isEqualTo(model.registry());
  }
}
