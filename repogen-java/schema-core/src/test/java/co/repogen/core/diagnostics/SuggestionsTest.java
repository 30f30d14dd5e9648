package co.repogen.core.diagnostics;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

public class SuggestionsTest {

  @Test
  void computesEditDistance() {
    assertThat(Suggestions.distance("kitten", "sitting")).isEqualTo(3);
    assertThat(Suggestions.distance("", "abc")).isEqualTo(3);
    assertThat(Suggestions.distance("same", "same")).isZero();
  }

  @Test
  void suggestsClosestCandidate() {
    assertThat(Suggestions.closest("StatusIdx", List.of("EmailIndex", "StatusIndex"))).contains("StatusIndex");
    assertThat(Suggestions.closest("Qurey", List.of("GetItem", "Query", "Scan"))).contains("Query");
  }

  @Test
  void ignoresCase() {
    assertThat(Suggestions.closest("getitem", List.of("GetItem", "PutItem"))).contains("GetItem");
  }

  @Test
  void offersNothingWhenTooFar() {
    assertThat(Suggestions.closest("completely_different", List.of("Query", "Scan"))).isEmpty();
    assertThat(Suggestions.closest("x", List.of())).isEmpty();
  }
}
