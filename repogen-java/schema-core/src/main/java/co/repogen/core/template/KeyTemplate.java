package co.repogen.core.template;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A parsed single-attribute key template.
 *
 * @param source              the template as written
 * @param segments            literals and field references in document order
 * @param numericPassthrough  true when the template is a pure field reference to a numeric
 *                            field, so the key value is the raw number
 */
public record KeyTemplate(String source, List<Segment> segments, boolean numericPassthrough) {

  public KeyTemplate {
    segments = List.copyOf(segments);
  }

  /** Referenced field names, first occurrence order, without duplicates. */
  public List<String> fieldNames() {
    Set<String> names = new LinkedHashSet<>();
    for (Segment s : segments) {
      if (s.isField()) names.add(s.text());
    }
    return new ArrayList<>(names);
  }

  /** True for templates like {@code {score}}: one placeholder and no literal text. */
  public boolean isPureFieldReference() {
    return segments.size() == 1 && segments.get(0).isField();
  }

  /** Literal text before the first placeholder, empty if the template starts with one. */
  public String literalPrefix() {
    if (segments.isEmpty() || segments.get(0).isField()) return "";
    return segments.get(0).text();
  }

  public boolean isConstant() {
    return segments.stream().noneMatch(Segment::isField);
  }

  KeyTemplate withNumericPassthrough(boolean passthrough) {
    return new KeyTemplate(source, segments, passthrough);
  }

  /**
   * Build the key value from field values. Passthrough templates return the raw value;
   * all others return the concatenated string.
   *
   * @throws IllegalArgumentException if a referenced field has no value
   */
  public Object apply(Map<String, ?> values) {
    if (numericPassthrough) {
      return require(values, segments.get(0).text());
    }
    StringBuilder sb = new StringBuilder();
    for (Segment s : segments) {
      if (s.isField()) {
        sb.append(stringify(require(values, s.text())));
      } else {
        sb.append(s.text());
      }
    }
    return sb.toString();
  }

  private static Object require(Map<String, ?> values, String field) {
    Object v = values.get(field);
    if (v == null) throw new IllegalArgumentException("no value for key field '" + field + "'");
    return v;
  }

  private static String stringify(Object value) {
    if (value instanceof BigDecimal d) return d.toPlainString();
    return value.toString();
  }
}
