package co.repogen.core.diagnostics;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.*;

public class DiagnosticsTest {

  @Test
  void sortsByPathThenKindThenMessage() {
    Diagnostics d = new Diagnostics();
    d.consistency("tables[1]", "b");
    d.structural("tables[0].x", "z");
    d.cardinality("tables[0].x", "a");
    d.structural("tables[0].x", "a");

    assertThat(d.sorted()).extracting(Diagnostic::path, Diagnostic::kind, Diagnostic::message).containsExactly(
      tuple("tables[0].x", DiagnosticKind.STRUCTURAL, "a"),
      tuple("tables[0].x", DiagnosticKind.STRUCTURAL, "z"),
      tuple("tables[0].x", DiagnosticKind.CARDINALITY, "a"),
      tuple("tables[1]", DiagnosticKind.CONSISTENCY, "b"));
  }

  @Test
  void warningsDoNotCountAsErrors() {
    Diagnostics d = new Diagnostics();
    d.warning(DiagnosticKind.CONSISTENCY, "tables[0]", "raw reads");

    assertThat(d.isEmpty()).isFalse();
    assertThat(d.hasErrors()).isFalse();
    assertThat(d.warnings()).hasSize(1);
    assertThat(d.errors()).isEmpty();
  }

  @Test
  void enumViolationCarriesSuggestionAndValidValues() {
    Diagnostics d = new Diagnostics();
    d.enumViolation("p.operation", "operation", "Querry", List.of("GetItem", "Query"));

    Diagnostic only = d.sorted().get(0);
    assertThat(only.kind()).isEqualTo(DiagnosticKind.ENUM);
    assertThat(only.value()).isEqualTo("Querry");
    assertThat(only.suggestion()).isEqualTo("Query");
    assertThat(only.message()).contains("GetItem", "Query");
    assertThat(only.toString()).contains("did you mean 'Query'");
  }

  @Test
  void uniquenessNamesBothLocations() {
    Diagnostics d = new Diagnostics();
    d.uniqueness("b.pattern_id", "a.pattern_id", "duplicate", "7");

    assertThat(d.ofKind(DiagnosticKind.UNIQUENESS)).singleElement()
      .satisfies(x -> assertThat(x.relatedPath()).isEqualTo("a.pattern_id"));
    assertThat(d.toString()).contains("also at a.pattern_id");
  }

  @Test
  void acceptsConcurrentAppends() {
    Diagnostics d = new Diagnostics();

    IntStream.range(0, 1000).parallel().forEach(i -> d.structural("p" + i, "m"));

    assertThat(d.size()).isEqualTo(1000);
  }
}
