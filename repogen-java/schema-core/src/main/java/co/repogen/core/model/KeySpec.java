package co.repogen.core.model;

import java.util.List;

/**
 * A key attribute name or key template as written in the document: either a single string
 * or an array of strings (multi-attribute form).
 *
 * @param values          the string, or the array elements in order
 * @param multiAttribute  true when the document used the array form
 */
public record KeySpec(List<String> values, boolean multiAttribute) {

  public KeySpec {
    values = List.copyOf(values);
  }

  public static KeySpec single(String value) {
    return new KeySpec(List.of(value), false);
  }

  public static KeySpec multi(List<String> values) {
    return new KeySpec(values, true);
  }

  public int size() {
    return values.size();
  }

  /** The single value, or the first element of an array. */
  public String first() {
    return values.isEmpty() ? null : values.get(0);
  }
}
