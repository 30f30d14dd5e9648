package co.repogen.generators;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

public class RenderOptionsTest {

  @TempDir
  Path tempDir;

  @Test
  void defaults() {
    RenderOptions options = RenderOptions.defaults();

    assertThat(options.basePackage()).isEqualTo("com.example.data");
    assertThat(options.generateUsageExamples()).isFalse();
    assertThat(options.parallel()).isFalse();
  }

  @Test
  void loadsFromJsonAndFillsGaps() throws Exception {
    Path file = tempDir.resolve("options.json");
    Files.writeString(file, """
      { "basePackage": "com.acme.store", "generateUsageExamples": true, "unknown": 1 }
      """);

    RenderOptions options = RenderOptions.load(file);

    assertThat(options.basePackage()).isEqualTo("com.acme.store");
    assertThat(options.generateUsageExamples()).isTrue();
    assertThat(options.parallel()).isFalse();
  }

  @Test
  void blankPackageFallsBackToDefault() throws Exception {
    Path file = tempDir.resolve("options.json");
    Files.writeString(file, "{ \"basePackage\": \" \" }");

    assertThat(RenderOptions.load(file).basePackage()).isEqualTo(RenderOptions.DEFAULT_PACKAGE);
  }

  @Test
  void withersCopy() {
    RenderOptions options = RenderOptions.defaults().withBasePackage("a.b").withUsageExamples(true).withParallel(true);

    assertThat(options).isEqualTo(new RenderOptions("a.b", true, true));
  }
}
