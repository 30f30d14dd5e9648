package co.repogen.core.template;

import co.repogen.core.diagnostics.Diagnostic;
import co.repogen.core.diagnostics.DiagnosticKind;
import co.repogen.core.diagnostics.Diagnostics;
import co.repogen.core.model.EntityDefinition;
import co.repogen.core.model.FieldDefinition;
import co.repogen.core.model.KeySpec;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;

public class KeyTemplateCompilerTest {

  private EntityDefinition score;
  private Diagnostics diagnostics;

  @BeforeEach
  void setUp() {
    score = new EntityDefinition("Score", "SCORE", "GAME#{game_id}", "{score}", List.of(),
        List.of(
          new FieldDefinition("game_id", "string", true, null),
          new FieldDefinition("player_id", "string", true, null),
          new FieldDefinition("score", "integer", true, null),
          new FieldDefinition("ratio", "decimal", false, null),
          new FieldDefinition("region", "string", true, null),
          new FieldDefinition("created_at", "string", true, null)),
        List.of());
    diagnostics = new Diagnostics();
  }

  @Test
  void numericFieldReferenceIsPassthrough() {
    KeyTemplate t = KeyTemplateCompiler.compile("{score}", score, "p", diagnostics).orElseThrow();

    assertThat(diagnostics.isEmpty()).isTrue();
    assertThat(t.numericPassthrough()).isTrue();
    assertThat(t.apply(Map.of("score", 17))).isEqualTo(17);
  }

  @Test
  void stringFieldReferenceIsNotPassthrough() {
    KeyTemplate t = KeyTemplateCompiler.compile("{player_id}", score, "p", diagnostics).orElseThrow();

    assertThat(t.numericPassthrough()).isFalse();
    assertThat(t.apply(Map.of("player_id", "p1"))).isEqualTo("p1");
  }

  @Test
  void decimalValuesArePrintedPlainInsideTemplates() {
    KeyTemplate t = KeyTemplateCompiler.compile("RATIO#{ratio}", score, "p", diagnostics).orElseThrow();

    assertThat(t.apply(Map.of("ratio", new BigDecimal("1E+3")))).isEqualTo("RATIO#1000");
  }

  @Test
  void unknownFieldIsReferenceErrorWithSuggestion() {
    Optional<KeyTemplate> t = KeyTemplateCompiler.compile("PLAYER#{playerid}", score, "tables[0].x", diagnostics);

    assertThat(t).isEmpty();
    assertThat(diagnostics.sorted()).singleElement().satisfies(d -> {
      assertThat(d.kind()).isEqualTo(DiagnosticKind.REFERENCE);
      assertThat(d.path()).isEqualTo("tables[0].x");
      assertThat(d.suggestion()).isEqualTo("player_id");
    });
  }

  @Test
  void syntaxErrorIsStructural() {
    assertThat(KeyTemplateCompiler.compile("GAME#{game_id", score, "p", diagnostics)).isEmpty();
    assertThat(diagnostics.sorted()).extracting(Diagnostic::kind).containsExactly(DiagnosticKind.STRUCTURAL);
  }

  @Test
  void multiAttributeKeyYieldsTuple() {
    CompiledKey key = KeyTemplateCompiler.compile(KeySpec.multi(List.of("{region}", "{score}")), score,
        "index 'ByRegion'", "p", diagnostics).orElseThrow();

    assertThat(key.multiAttribute()).isTrue();
    assertThat(key.fieldNames()).containsExactly("region", "score");
    assertThat(key.apply(Map.of("region", "eu", "score", 5))).isEqualTo(List.of("eu", 5));
  }

  @Test
  void multiAttributeKeyReportsElementPath() {
    KeyTemplateCompiler.compile(KeySpec.multi(List.of("{region}", "{regoin}")), score, "index 'ByRegion'", "m",
        diagnostics);

    assertThat(diagnostics.sorted()).extracting(Diagnostic::path).containsExactly("m[1]");
  }

  @Test
  void tooManyKeyAttributesIsCardinalityError() {
    List<String> five = List.of("{game_id}", "{player_id}", "{score}", "{region}", "{created_at}");

    Optional<CompiledKey> key = KeyTemplateCompiler.compile(KeySpec.multi(five), score, "index 'Wide'", "m",
        diagnostics);

    assertThat(key).isEmpty();
    assertThat(diagnostics.sorted()).singleElement().satisfies(d -> {
      assertThat(d.kind()).isEqualTo(DiagnosticKind.CARDINALITY);
      assertThat(d.message()).contains("Wide");
    });
  }

  @Test
  void strictCompileThrowsOnUnvalidatedInput() {
    assertThatThrownBy(() -> KeyTemplateCompiler.compileStrict("{nope}", score))
      .isInstanceOf(IllegalStateException.class);
  }
}
