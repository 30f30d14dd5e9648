package co.repogen.generators;

import co.repogen.core.resolve.ResolvedModel;
import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

public class AccessPatternMappingTest {

  private final ResolvedModel model = Fixtures.model();

  @Test
  void keyedByPatternIdUnderRoot() throws Exception {
    JsonNode json = Fixtures.JSON.readTree(AccessPatternMapping.render(model, LanguageProfiles.get("java")));

    JsonNode mapping = json.get(AccessPatternMapping.ROOT);
    assertThat(mapping.size()).isEqualTo(11);
    assertThat(mapping.fieldNames()).toIterable().startsWith("1", "2", "3");
    assertThat(mapping.get("5").get("method_name").asText()).isEqualTo("updateUserWithStatus");
    assertThat(mapping.get("3").get("index_name").asText()).isEqualTo("StatusIndex");
    assertThat(mapping.get("11").get("service").asText()).isEqualTo("TransactionService");
  }

  @Test
  void methodNamesFollowTheLanguage() {
    assertThat(AccessPatternMapping.entries(model, LanguageProfiles.get("python")).get("3").methodName())
      .isEqualTo("get_users_by_status");
    assertThat(AccessPatternMapping.entries(model, LanguageProfiles.get("java")).get("3").methodName())
      .isEqualTo("getUsersByStatus");
  }

  @Test
  void artifactCountsEveryPattern() {
    GeneratedArtifact artifact = AccessPatternMapping.artifact(model, LanguageProfiles.get("python"));

    assertThat(artifact.pathHint()).isEqualTo(AccessPatternMapping.FILE_NAME);
    assertThat(artifact.category()).isEqualTo(OutputRole.MAPPING);
    assertThat(artifact.count()).isEqualTo(11);
    assertThat(artifact.content()).endsWith("}\n");
  }
}
