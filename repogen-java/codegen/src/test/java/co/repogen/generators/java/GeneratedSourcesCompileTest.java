package co.repogen.generators.java;

import co.repogen.generators.Fixtures;
import co.repogen.generators.GeneratedArtifact;
import co.repogen.generators.GenerationManifest;
import co.repogen.generators.LanguageProfiles;
import co.repogen.generators.RenderOptions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import javax.tools.JavaCompiler;
import javax.tools.ToolProvider;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;
import static org.assertj.core.api.Assumptions.assumeThat;

/**
 * Compiles the rendered Java sources against the AWS SDK on the test classpath.
 */
public class GeneratedSourcesCompileTest {

  @TempDir
  Path tempDir;

  @Test
  void clientBuilderUsesSdkBuilderInterface() {
    GenerationManifest manifest = new JavaRenderer().render(Fixtures.model(), LanguageProfiles.get("java"),
      RenderOptions.defaults(), Fixtures.usage());

    String client = manifest.find("com/example/data/client/RepositoryClient.java").orElseThrow().content();

    assertThat(client)
      .contains("DynamoDbClientBuilder ddbBuilder = DynamoDbClient.builder()")
      .doesNotContain("DynamoDbClient.Builder");
  }

  @Test
  void renderedSourcesCompile() throws IOException {
    JavaCompiler compiler = ToolProvider.getSystemJavaCompiler();
    assumeThat(compiler).as("system Java compiler").isNotNull();

    GenerationManifest manifest = new JavaRenderer().render(Fixtures.model(), LanguageProfiles.get("java"),
      RenderOptions.defaults(), Fixtures.usage());

    Path sources = tempDir.resolve("src");
    Path classes = Files.createDirectories(tempDir.resolve("classes"));
    List<String> args = new ArrayList<>(List.of(
      "-d", classes.toString(),
      "-cp", System.getProperty("java.class.path"),
      "-proc:none"));
    for (GeneratedArtifact artifact : manifest.artifacts()) {
      if (!artifact.pathHint().endsWith(".java")) continue;
      Path file = sources.resolve(artifact.pathHint());
      Files.createDirectories(file.getParent());
      Files.writeString(file, artifact.content());
      args.add(file.toString());
    }

    ByteArrayOutputStream errors = new ByteArrayOutputStream();
    int exit = compiler.run(null, null, errors, args.toArray(new String[0]));

    assertThat(exit).as(errors.toString(StandardCharsets.UTF_8)).isZero();
    assertThat(classes.resolve("com/example/data/client/RepositoryClient.class")).exists();
  }
}
