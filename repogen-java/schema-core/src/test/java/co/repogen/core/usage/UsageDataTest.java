package co.repogen.core.usage;

import co.repogen.core.Fixtures;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

public class UsageDataTest {

  @Test
  void readsSectionsPerEntity() {
    UsageData data = UsageData.from(Fixtures.ecommerceUsage());

    EntityUsage user = data.entity("User").orElseThrow();
    assertThat(user.sample()).containsEntry("email", "jane@example.com").containsEntry("tags", List.of("vip"));
    assertThat(user.alternate()).containsEntry("user_id", "user-456");
    assertThat(user.update()).containsOnlyKeys("status");
    assertThat(data.entities().keySet()).containsExactly("User", "Order", "Product");
  }

  @Test
  void missingDocumentGivesEmptyData() {
    assertThat(UsageData.from(null).isEmpty()).isTrue();
    assertThat(UsageData.from(Fixtures.JSON.createObjectNode()).isEmpty()).isTrue();
    assertThat(UsageData.empty().entity("User")).isEmpty();
  }
}
