package co.repogen.generators.python;

import co.repogen.core.resolve.ResolvedModel;
import co.repogen.core.usage.UsageData;
import co.repogen.generators.Fixtures;
import co.repogen.generators.GeneratedArtifact;
import co.repogen.generators.GenerationManifest;
import co.repogen.generators.LanguageProfiles;
import co.repogen.generators.OutputRole;
import co.repogen.generators.RenderOptions;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

public class PythonRendererTest {

  private final PythonRenderer renderer = new PythonRenderer();
  private final PythonProfile profile = (PythonProfile) LanguageProfiles.get("python");

  private GenerationManifest render(ResolvedModel model, RenderOptions options) {
    return renderer.render(model, profile, options, Fixtures.usage());
  }

  private String content(GenerationManifest manifest, String pathHint) {
    return manifest.find(pathHint).map(GeneratedArtifact::content)
      .orElseThrow(() -> new AssertionError("no artifact " + pathHint + " in " + manifest.pathHints()));
  }

  // ==================== Layout ====================

  @Test
  void rendersOneModulePerRole() {
    GenerationManifest manifest = render(Fixtures.model(), RenderOptions.defaults());

    assertThat(manifest.language()).isEqualTo("python");
    assertThat(manifest.pathHints()).containsExactly(
      "entities.py",
      "repositories.py",
      "base_repository.py",
      "transaction_service.py",
      "access_pattern_mapping.json");
    assertThat(manifest.count(OutputRole.ENTITIES)).isEqualTo(3);
    assertThat(manifest.count(OutputRole.REPOSITORIES)).isEqualTo(3);
    assertThat(manifest.count(OutputRole.TRANSACTIONS)).isEqualTo(1);
    assertThat(manifest.count(OutputRole.MAPPING)).isEqualTo(11);
  }

  @Test
  void noTransactionModuleWithoutCrossTablePatterns() {
    ObjectNode schema = Fixtures.ecommerce();
    schema.remove("cross_table_access_patterns");

    GenerationManifest manifest = render(Fixtures.model(schema), RenderOptions.defaults());

    assertThat(manifest.pathHints()).doesNotContain("transaction_service.py");
    assertThat(manifest.size()).isEqualTo(4);
  }

  // ==================== Content ====================

  @Test
  void entitiesAreDataclasses() {
    String entities = content(render(Fixtures.model(), RenderOptions.defaults()), "entities.py");

    assertThat(entities)
      .contains("@dataclass")
      .contains("class User:")
      .contains("ENTITY_TYPE: ClassVar[str] = 'USER'")
      .contains("tags: list[str] | None = None")
      .contains("def key_for(")
      .contains("def to_item(self) -> dict[str, Any]:")
      .doesNotContain("{{");
  }

  @Test
  void queryMethodBuildsKeyCondition() {
    String repositories = content(render(Fixtures.model(), RenderOptions.defaults()), "repositories.py");

    assertThat(repositories)
      .contains("class UserRepository(BaseRepository):")
      .contains("def get_users_by_status(self, status: str, since: str) -> list[User]:")
      .contains("'IndexName': 'StatusIndex',")
      .contains("'KeyConditionExpression': '#k0 = :k0 AND #k1 >= :k1',")
      .contains("{':k0': f'STATUS#{status}', ':k1': since}")
      .doesNotContain("{{");
  }

  @Test
  void rawReadStopsAtFirstItem() {
    String repositories = content(render(Fixtures.model(), RenderOptions.defaults()), "repositories.py");

    assertThat(repositories)
      .contains("def get_user_by_email(self, email: str) -> dict[str, Any] | None:")
      .contains("self._query(params, first_only=True)");
  }

  @Test
  void scanCarriesFilter() {
    String repositories = content(render(Fixtures.model(), RenderOptions.defaults()), "repositories.py");

    assertThat(repositories)
      .contains("def find_large_orders(")
      .contains("'FilterExpression':")
      .contains("self._scan(params)");
  }

  @Test
  void baseRepositoryReadsTableNamesFromEnvironment() {
    String base = content(render(Fixtures.model(), RenderOptions.defaults()), "base_repository.py");

    assertThat(base)
      .contains("APP_TABLE_TABLE_NAME = os.environ.get('APP_TABLE_TABLE_NAME', 'AppTable')")
      .contains("INVENTORY_TABLE_NAME = os.environ.get('INVENTORY_TABLE_NAME', 'Inventory')")
      .contains("class BaseRepository");
  }

  @Test
  void transactionServiceUsesLowLevelClient() {
    String service = content(render(Fixtures.model(), RenderOptions.defaults()), "transaction_service.py");

    assertThat(service)
      .contains("class TransactionService:")
      .contains("def place_order(self, order: Order, product_id: str, stock: int) -> bool:")
      .contains("TransactionCanceledException")
      .contains("'ConditionExpression': 'attribute_exists(product_id)'");
  }

  // ==================== Options ====================

  @Test
  void usageExamplesOnlyWhenRequested() {
    GenerationManifest without = render(Fixtures.model(), RenderOptions.defaults());
    GenerationManifest with = render(Fixtures.model(), RenderOptions.defaults().withUsageExamples(true));

    assertThat(without.pathHints()).doesNotContain("usage_examples.py");
    assertThat(content(with, "usage_examples.py"))
      .contains("from transaction_service import TransactionService")
      .contains("user_repository = UserRepository()")
      .contains("run('place_order', lambda: transaction_service.place_order(")
      .contains("if __name__ == '__main__':");
  }

  @Test
  void usageExamplesRenderWithoutUsageData() {
    GenerationManifest manifest = renderer.render(Fixtures.model(), profile,
      RenderOptions.defaults().withUsageExamples(true), UsageData.empty());

    assertThat(content(manifest, "usage_examples.py")).contains("def main() -> None:");
  }

  @Test
  void renderingIsDeterministic() {
    ResolvedModel model = Fixtures.model();

    assertThat(render(model, RenderOptions.defaults())).isEqualTo(render(model, RenderOptions.defaults()));
  }

  @Test
  void parallelRenderingMatchesSequential() {
    ResolvedModel model = Fixtures.model();
    RenderOptions options = RenderOptions.defaults().withUsageExamples(true);

    assertThat(render(model, options.withParallel(true)).artifacts())
      .containsExactlyElementsOf(render(model, options).artifacts());
  }

  @Test
  void rejectsForeignProfile() {
    assertThatThrownBy(() -> renderer.render(Fixtures.model(), LanguageProfiles.get("java"),
      RenderOptions.defaults(), UsageData.empty()))
      .isInstanceOf(IllegalArgumentException.class);
  }
}
