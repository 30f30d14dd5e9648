package co.repogen.generators;

import co.repogen.core.model.EntityDefinition;
import co.repogen.core.model.FieldKind;
import co.repogen.core.usage.UsageData;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

public class SampleValueStrategyTest {

  private final SampleValueStrategy samples = new SampleValueStrategy();

  @Test
  void guessesFromFieldNames() {
    assertThat(samples.guess("id", FieldKind.STRING)).isEqualTo(SampleValueStrategy.SAMPLE_UUID);
    assertThat(samples.guess("order_id", FieldKind.STRING)).isEqualTo("order-001");
    assertThat(samples.guess("contact_email", FieldKind.STRING)).isEqualTo("user@example.com");
    assertThat(samples.guess("status", FieldKind.STRING)).isEqualTo("ACTIVE");
    assertThat(samples.guess("created_at", FieldKind.STRING)).isEqualTo(SampleValueStrategy.SAMPLE_TIMESTAMP);
    assertThat(samples.guess("nickname", FieldKind.STRING)).isEqualTo("sample-nickname");
  }

  @Test
  void rangeWordsPickBounds() {
    assertThat(samples.guess("start_date", FieldKind.STRING)).isEqualTo(SampleValueStrategy.RANGE_START_DATE);
    assertThat(samples.guess("end_date", FieldKind.STRING)).isEqualTo(SampleValueStrategy.RANGE_END_DATE);
    assertThat(samples.guess("min_total", FieldKind.DECIMAL)).isEqualTo(BigDecimal.ZERO);
    assertThat(samples.guess("max_count", FieldKind.INTEGER)).isEqualTo(9999L);
  }

  @Test
  void typeDefaultsForOtherKinds() {
    assertThat(samples.guess("stock", FieldKind.INTEGER)).isEqualTo(1L);
    assertThat(samples.guess("active", FieldKind.BOOLEAN)).isEqualTo(true);
    assertThat(samples.guess("tags", FieldKind.ARRAY)).isEqualTo(List.of());
  }

  @Test
  void usageDataWins() {
    UsageData usage = Fixtures.usage();

    assertThat(samples.parameterValue("User", "email", FieldKind.STRING, usage)).isEqualTo("sam@example.com");
    assertThat(samples.parameterValue("Product", "name", FieldKind.STRING, usage)).isEqualTo("Mouse");
    assertThat(samples.parameterValue("Product", "sku", FieldKind.STRING, usage)).isEqualTo("sample-sku");
    assertThat(samples.updateValue("User", "status", FieldKind.STRING, usage)).isEqualTo("SUSPENDED");
    assertThat(samples.updateValue("User", "email", FieldKind.STRING, usage)).isEqualTo("sam@example.com");
  }

  @Test
  void entityValuesCoverRequiredFieldsAndProvidedOptionals() {
    EntityDefinition order = Fixtures.entity(Fixtures.model(), "Order").definition();

    assertThat(samples.entityValues(order, UsageData.empty()))
      .containsOnlyKeys("user_id", "order_id", "tenant_id", "region", "category", "created_at", "total");
    assertThat(samples.entityValues(order, Fixtures.usage()))
      .containsEntry("quantity", 2)
      .containsEntry("region", "eu-west-1")
      .doesNotContainKey("note");
  }
}
