package co.repogen.core.template;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.*;

public class KeyTemplateParserTest {

  @Test
  void splitsLiteralsAndPlaceholders() {
    KeyTemplate t = KeyTemplateParser.parse("TENANT#{tenant_id}#USER#{user_id}");

    assertThat(t.segments()).containsExactly(
      Segment.literal("TENANT#"),
      Segment.field("tenant_id"),
      Segment.literal("#USER#"),
      Segment.field("user_id"));
    assertThat(t.fieldNames()).containsExactly("tenant_id", "user_id");
    assertThat(t.literalPrefix()).isEqualTo("TENANT#");
    assertThat(t.isPureFieldReference()).isFalse();
  }

  @Test
  void appliesValuesByConcatenation() {
    KeyTemplate t = KeyTemplateParser.parse("TENANT#{tenant_id}#USER#{user_id}");

    assertThat(t.apply(Map.of("tenant_id", "acme", "user_id", 42))).isEqualTo("TENANT#acme#USER#42");
  }

  @Test
  void constantTemplateHasNoFields() {
    KeyTemplate t = KeyTemplateParser.parse("PROFILE");

    assertThat(t.isConstant()).isTrue();
    assertThat(t.fieldNames()).isEmpty();
    assertThat(t.apply(Map.of())).isEqualTo("PROFILE");
  }

  @Test
  void repeatedFieldIsListedOnce() {
    assertThat(KeyTemplateParser.parse("{a}#{b}#{a}").fieldNames()).containsExactly("a", "b");
  }

  @Test
  void missingValueIsRejected() {
    KeyTemplate t = KeyTemplateParser.parse("USER#{user_id}");

    assertThatThrownBy(() -> t.apply(Map.of()))
      .isInstanceOf(IllegalArgumentException.class)
      .hasMessageContaining("user_id");
  }

  @ParameterizedTest
  @CsvSource(delimiter = '|', value = {
    "USER#{user_id      | unterminated",
    "USER#{}            | empty placeholder",
    "USER#{a{b}}        | nested",
    "USER#user_id}      | unmatched",
    "USER#{user-id}     | not a field name",
    "{1st}              | not a field name"
  })
  void rejectsMalformedTemplates(String template, String message) {
    assertThatThrownBy(() -> KeyTemplateParser.parse(template))
      .isInstanceOf(TemplateSyntaxException.class)
      .hasMessageContaining(message);
    assertThat(KeyTemplateParser.tryParse(template)).isEmpty();
  }

  @Test
  void reportsPositionOfProblem() {
    assertThatThrownBy(() -> KeyTemplateParser.parse("AB}"))
      .isInstanceOfSatisfying(TemplateSyntaxException.class, e -> assertThat(e.getPosition()).isEqualTo(2));
  }
}
