package co.repogen.core;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Identifier case conversions shared by the resolver and the renderers.
 */
public final class Names {

  private Names() {
  }

  /**
   * Split on separators ({@code -}, {@code _}, space, {@code #}) and lower-to-upper case
   * boundaries: {@code "UserProfile"}, {@code "user-profile"} and {@code "user_profile"}
   * all give {@code [user, profile]}.
   */
  public static List<String> words(String name) {
    List<String> words = new ArrayList<>();
    if (name == null) return words;
    StringBuilder current = new StringBuilder();
    for (int i = 0; i < name.length(); i++) {
      char c = name.charAt(i);
      if (c == '-' || c == '_' || c == ' ' || c == '#' || c == '.') {
        flush(words, current);
        continue;
      }
      if (Character.isUpperCase(c) && current.length() > 0) {
        char prev = name.charAt(i - 1);
        boolean nextLower = i + 1 < name.length() && Character.isLowerCase(name.charAt(i + 1));
        if (Character.isLowerCase(prev) || Character.isDigit(prev) || (Character.isUpperCase(prev) && nextLower)) {
          flush(words, current);
        }
      }
      current.append(c);
    }
    flush(words, current);
    return words;
  }

  private static void flush(List<String> words, StringBuilder current) {
    if (current.length() > 0) {
      words.add(current.toString().toLowerCase(Locale.ROOT));
      current.setLength(0);
    }
  }

  public static String toSnakeCase(String name) {
    return String.join("_", words(name));
  }

  /** UPPER_SNAKE_CASE for constant names. */
  public static String toConstantCase(String name) {
    return toSnakeCase(name).toUpperCase(Locale.ROOT);
  }

  public static String toCamelCase(String name) {
    StringBuilder sb = new StringBuilder();
    for (String w : words(name)) {
      sb.append(sb.length() == 0 ? w : cap(w));
    }
    return sb.toString();
  }

  public static String toPascalCase(String name) {
    return cap(toCamelCase(name));
  }

  public static String cap(String s) {
    if (s == null || s.isEmpty()) return s;
    return s.substring(0, 1).toUpperCase(Locale.ROOT) + s.substring(1);
  }

  public static String uncap(String s) {
    if (s == null || s.isEmpty()) return s;
    return s.substring(0, 1).toLowerCase(Locale.ROOT) + s.substring(1);
  }
}
