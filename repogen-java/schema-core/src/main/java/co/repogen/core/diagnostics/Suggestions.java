package co.repogen.core.diagnostics;

import java.util.Collection;
import java.util.Locale;
import java.util.Optional;

/**
 * "Did you mean" lookups by Levenshtein distance.
 */
public final class Suggestions {

  private Suggestions() {
  }

  /**
   * Return the candidate closest to {@code value}, if its distance is at most
   * {@code max(2, value.length() / 3)}. Ties go to the earlier candidate.
   */
  public static Optional<String> closest(String value, Collection<String> candidates) {
    if (value == null || candidates == null || candidates.isEmpty()) return Optional.empty();
    String needle = value.toLowerCase(Locale.ROOT);
    int threshold = Math.max(2, value.length() / 3);
    String best = null;
    int bestDistance = Integer.MAX_VALUE;
    for (String candidate : candidates) {
      if (candidate == null) continue;
      int d = distance(needle, candidate.toLowerCase(Locale.ROOT));
      if (d < bestDistance) {
        best = candidate;
        bestDistance = d;
      }
    }
    return bestDistance <= threshold ? Optional.ofNullable(best) : Optional.empty();
  }

  static int distance(String a, String b) {
    int[] prev = new int[b.length() + 1];
    int[] curr = new int[b.length() + 1];
    for (int j = 0; j <= b.length(); j++) prev[j] = j;
    for (int i = 1; i <= a.length(); i++) {
      curr[0] = i;
      for (int j = 1; j <= b.length(); j++) {
        int cost = a.charAt(i - 1) == b.charAt(j - 1) ? 0 : 1;
        curr[j] = Math.min(Math.min(curr[j - 1] + 1, prev[j] + 1), prev[j - 1] + cost);
      }
      int[] tmp = prev;
      prev = curr;
      curr = tmp;
    }
    return prev[b.length()];
  }
}
