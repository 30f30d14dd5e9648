package co.repogen.generators;

import co.repogen.core.resolve.ResolvedEntity;
import co.repogen.core.resolve.ResolvedModel;
import co.repogen.core.resolve.ResolvedTransaction;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

public class ExpressionPlannerTest {

  private ResolvedModel model;

  @BeforeEach
  void setUp() {
    model = Fixtures.model();
  }

  private ExpressionPlan plan(String entity, int patternId) {
    return ExpressionPlanner.plan(Fixtures.entity(model, entity), Fixtures.pattern(model, patternId));
  }

  // =========================================================================
  // Key conditions
  // =========================================================================

  @Test
  void indexQueryWithRangeCondition() {
    ExpressionPlan plan = plan("User", 3);

    assertThat(plan.keyCondition()).isEqualTo("#k0 = :k0 AND #k1 >= :k1");
    assertThat(plan.names()).containsExactly(entry("#k0", "GSI1PK"), entry("#k1", "GSI1SK"));
    assertThat(plan.values()).extracting(ExpressionPlan.NamedValue::name).containsExactly(":k0", ":k1");

    ValueSource partition = plan.values().get(0).source();
    assertThat(partition.kind()).isEqualTo(ValueSource.Kind.TEMPLATE);
    assertThat(partition.template().source()).isEqualTo("STATUS#{status}");
    assertThat(partition.bindings()).containsExactly(entry("status", "status"));

    ValueSource range = plan.values().get(1).source();
    assertThat(range.kind()).isEqualTo(ValueSource.Kind.PARAMETER);
    assertThat(range.parameter()).isEqualTo("since");
    assertThat(range.literal()).isEmpty();
  }

  @Test
  void beginsWithKeepsTheSortKeyPrefix() {
    ExpressionPlan plan = plan("Order", 6);

    assertThat(plan.keyCondition()).isEqualTo("#k0 = :k0 AND begins_with(#k1, :k1)");
    ValueSource prefix = plan.values().get(1).source();
    assertThat(prefix.parameter()).isEqualTo("order_prefix");
    assertThat(prefix.literal()).isEqualTo("ORDER#");
  }

  @Test
  void multiAttributeKeyConditionEndsWithBetween() {
    ExpressionPlan plan = plan("Order", 7);

    assertThat(plan.keyCondition())
      .isEqualTo("#k0 = :k0 AND #k1 = :k1 AND #k2 = :k2 AND #k3 BETWEEN :k3 AND :k3_2");
    assertThat(plan.names()).containsValues("tenant_id", "region", "category", "created_at");
    assertThat(plan.values()).extracting(ExpressionPlan.NamedValue::name)
      .containsExactly(":k0", ":k1", ":k2", ":k3", ":k3_2");
  }

  @Test
  void itemCollectionQueryWithoutSortConditionGetsPrefix() {
    ObjectNode schema = Fixtures.ecommerce();
    ObjectNode byUser = Fixtures.patternNode(schema, 0, "Order", 0);
    byUser.remove("range_condition");
    ((ArrayNode) byUser.get("parameters")).remove(1);
    ResolvedModel resolved = Fixtures.model(schema);

    ExpressionPlan plan = ExpressionPlanner.plan(Fixtures.entity(resolved, "Order"), Fixtures.pattern(resolved, 6));

    assertThat(plan.keyCondition()).isEqualTo("#k0 = :k0 AND begins_with(#k1, :k1)");
    assertThat(plan.values().get(1).source().kind()).isEqualTo(ValueSource.Kind.LITERAL);
    assertThat(plan.values().get(1).source().literal()).isEqualTo("ORDER#");
  }

  // =========================================================================
  // Items, filters and updates
  // =========================================================================

  @Test
  void deleteAddressesTheFullPrimaryKey() {
    ExpressionPlan plan = plan("Order", 9);

    assertThat(plan.key()).extracting(ExpressionPlan.NamedValue::name).containsExactly("PK", "SK");
    assertThat(plan.keyCondition()).isNull();
    assertThat(plan.hasNames()).isFalse();
  }

  @Test
  void scanFilterUsesPlaceholders() {
    ExpressionPlan plan = plan("Order", 8);

    assertThat(plan.filter()).isEqualTo("#f0 > :f0");
    assertThat(plan.names()).containsExactly(entry("#f0", "total"));
    assertThat(plan.values().get(0).source().parameter()).isEqualTo("min_total");
  }

  @Test
  void updateRefreshesIndexKeysBuiltFromWrittenFields() {
    ExpressionPlan plan = plan("User", 5);

    assertThat(plan.update()).isEqualTo("SET #u0 = :u0, #u1 = :u1");
    assertThat(plan.attributes()).extracting(ExpressionPlan.NamedValue::name).containsExactly("status", "GSI1PK");
    assertThat(plan.attributes().get(1).source().template().source()).isEqualTo("STATUS#{status}");
    assertThat(plan.updateEntity()).isNull();
  }

  // =========================================================================
  // Transactions
  // =========================================================================

  @Test
  void transactionPutWritesTheWholeEntity() {
    ResolvedTransaction tx = model.transactions().get(0);
    ResolvedEntity order = Fixtures.entity(model, "Order");

    ExpressionPlan plan = ExpressionPlanner.plan(order, tx.participants().get(0), tx);

    assertThat(plan.updateEntity()).isEqualTo("order");
    assertThat(plan.key()).extracting(e -> e.source().kind())
      .containsOnly(ValueSource.Kind.ENTITY_TEMPLATE);
    assertThat(plan.condition()).isNull();
  }

  @Test
  void transactionUpdateSetsScalarParametersUnderCondition() {
    ResolvedTransaction tx = model.transactions().get(0);
    ResolvedEntity product = Fixtures.entity(model, "Product");

    ExpressionPlan plan = ExpressionPlanner.plan(product, tx.participants().get(1), tx);

    assertThat(plan.key()).extracting(ExpressionPlan.NamedValue::name).containsExactly("product_id");
    assertThat(plan.update()).isEqualTo("SET #u0 = :u0");
    assertThat(plan.names()).containsExactly(entry("#u0", "stock"));
    assertThat(plan.condition()).isEqualTo("attribute_exists(product_id)");
  }
}
