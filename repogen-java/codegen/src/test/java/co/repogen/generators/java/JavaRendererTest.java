package co.repogen.generators.java;

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

public class JavaRendererTest {

  private final JavaRenderer renderer = new JavaRenderer();
  private final JavaProfile profile = (JavaProfile) LanguageProfiles.get("java");

  private GenerationManifest render(ResolvedModel model, RenderOptions options) {
    return renderer.render(model, profile, options, Fixtures.usage());
  }

  private String content(GenerationManifest manifest, String pathHint) {
    return manifest.find(pathHint).map(GeneratedArtifact::content)
      .orElseThrow(() -> new AssertionError("no artifact " + pathHint + " in " + manifest.pathHints()));
  }

  // ==================== Layout ====================

  @Test
  void rendersOneFilePerEntityTableAndSupportClass() {
    GenerationManifest manifest = render(Fixtures.model(), RenderOptions.defaults());

    assertThat(manifest.language()).isEqualTo("java");
    assertThat(manifest.size()).isEqualTo(15);
    assertThat(manifest.count(OutputRole.ENTITIES)).isEqualTo(3);
    assertThat(manifest.count(OutputRole.KEYS)).isEqualTo(3);
    assertThat(manifest.count(OutputRole.REPOSITORIES)).isEqualTo(3);
    assertThat(manifest.count(OutputRole.CONFIG)).isEqualTo(2);
    assertThat(manifest.count(OutputRole.TRANSACTIONS)).isEqualTo(1);
    assertThat(manifest.count(OutputRole.MAPPING)).isEqualTo(11);
    assertThat(manifest.pathHints()).contains(
      "com/example/data/User.java",
      "com/example/data/keys/UserKeys.java",
      "com/example/data/repository/UserRepository.java",
      "com/example/data/config/AppTableConfig.java",
      "com/example/data/config/InventoryConfig.java",
      "com/example/data/client/RepositoryClient.java",
      "com/example/data/client/AttributeValues.java",
      "com/example/data/transaction/TransactionService.java",
      "access_pattern_mapping.json");
  }

  @Test
  void artifactsFollowRoleOrderThenDocumentOrder() {
    GenerationManifest manifest = render(Fixtures.model(), RenderOptions.defaults());

    assertThat(manifest.pathHints()).startsWith(
      "com/example/data/User.java",
      "com/example/data/Order.java",
      "com/example/data/Product.java",
      "com/example/data/keys/UserKeys.java");
    assertThat(manifest.pathHints().get(manifest.size() - 1)).isEqualTo("access_pattern_mapping.json");
  }

  @Test
  void basePackageMovesEveryJavaFile() {
    GenerationManifest manifest = render(Fixtures.model(), RenderOptions.defaults().withBasePackage("com.acme.store"));

    assertThat(manifest.pathHints()).contains("com/acme/store/User.java");
    assertThat(content(manifest, "com/acme/store/User.java")).startsWith("package com.acme.store;");
    assertThat(content(manifest, "com/acme/store/repository/UserRepository.java"))
      .startsWith("package com.acme.store.repository;");
  }

  // ==================== Content ====================

  @Test
  void entityCarriesItsTypeDiscriminator() {
    String user = content(render(Fixtures.model(), RenderOptions.defaults()), "com/example/data/User.java");

    assertThat(user)
      .contains("public class User")
      .contains("public static final String ENTITY_TYPE = \"USER\";");
  }

  @Test
  void keysClassBuildsPrimaryKey() {
    String keys = content(render(Fixtures.model(), RenderOptions.defaults()), "com/example/data/keys/UserKeys.java");

    assertThat(keys)
      .contains("public final class UserKeys")
      .contains("PARTITION_KEY_ATTRIBUTE = \"PK\"")
      .contains("SORT_KEY_ATTRIBUTE = \"SK\"")
      .contains("public static Map<String, AttributeValue> key(");
  }

  @Test
  void repositoryMethodsFollowReturnShapes() {
    String repository = content(render(Fixtures.model(), RenderOptions.defaults()),
      "com/example/data/repository/UserRepository.java");

    assertThat(repository)
      .contains("public List<User> getUsersByStatus(String status, String since)")
      .contains("public Optional<Map<String, AttributeValue>> getUserByEmail(String email)")
      .contains("public boolean updateUserWithStatus(String userId, String status)");
  }

  @Test
  void configReadsTableNameFromEnvironment() {
    String config = content(render(Fixtures.model(), RenderOptions.defaults()),
      "com/example/data/config/AppTableConfig.java");

    assertThat(config)
      .contains("Objects.requireNonNullElse(System.getenv(\"APP_TABLE_TABLE_NAME\"), \"AppTable\")")
      .contains("public static RepositoryClient getClient()")
      .contains("public static UserRepository userRepository()")
      .contains("public static OrderRepository orderRepository(RepositoryClient client)")
      .doesNotContain("productRepository");
  }

  @Test
  void transactionServiceRendersCrossTablePatterns() {
    String service = content(render(Fixtures.model(), RenderOptions.defaults()),
      "com/example/data/transaction/TransactionService.java");

    assertThat(service)
      .contains("public class TransactionService")
      .contains("placeOrder(")
      .contains("TransactionCanceledException");
  }

  @Test
  void noTransactionServiceWithoutCrossTablePatterns() {
    ObjectNode schema = Fixtures.ecommerce();
    schema.remove("cross_table_access_patterns");

    GenerationManifest manifest = render(Fixtures.model(schema), RenderOptions.defaults());

    assertThat(manifest.size()).isEqualTo(14);
    assertThat(manifest.byCategory(OutputRole.TRANSACTIONS)).isEmpty();
    assertThat(manifest.count(OutputRole.MAPPING)).isEqualTo(10);
  }

  // ==================== Options ====================

  @Test
  void usageExamplesOnlyWhenRequested() {
    GenerationManifest without = render(Fixtures.model(), RenderOptions.defaults());
    GenerationManifest with = render(Fixtures.model(), RenderOptions.defaults().withUsageExamples(true));

    assertThat(without.byCategory(OutputRole.USAGE_EXAMPLES)).isEmpty();
    assertThat(with.size()).isEqualTo(16);
    assertThat(content(with, "com/example/data/examples/UsageExamples.java"))
      .contains("public static void main(String[] args)")
      .contains("placeOrder(");
  }

  @Test
  void usageExamplesRenderWithoutUsageData() {
    GenerationManifest manifest = renderer.render(Fixtures.model(), profile,
      RenderOptions.defaults().withUsageExamples(true), UsageData.empty());

    assertThat(manifest.find("com/example/data/examples/UsageExamples.java")).isPresent();
  }

  @Test
  void renderingIsDeterministic() {
    ResolvedModel model = Fixtures.model();

    GenerationManifest first = render(model, RenderOptions.defaults());
    GenerationManifest second = render(model, RenderOptions.defaults());

    assertThat(second).isEqualTo(first);
  }

  @Test
  void parallelRenderingMatchesSequential() {
    ResolvedModel model = Fixtures.model();
    RenderOptions options = RenderOptions.defaults().withUsageExamples(true);

    GenerationManifest sequential = render(model, options);
    GenerationManifest parallel = render(model, options.withParallel(true));

    assertThat(parallel.artifacts()).containsExactlyElementsOf(sequential.artifacts());
  }

  @Test
  void rejectsForeignProfile() {
    assertThatThrownBy(() -> renderer.render(Fixtures.model(), LanguageProfiles.get("python"),
      RenderOptions.defaults(), UsageData.empty()))
      .isInstanceOf(IllegalArgumentException.class)
      .hasMessageContaining("python");
  }
}
