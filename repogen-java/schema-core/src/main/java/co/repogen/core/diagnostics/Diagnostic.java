package co.repogen.core.diagnostics;

import java.util.Comparator;
import java.util.Objects;

/**
 * One problem found in a schema or usage data document.
 *
 * @param kind         problem class
 * @param severity     errors block generation, warnings do not
 * @param path         location in the document, e.g. {@code tables[0].entities.User.fields[1]}
 * @param message      human readable description
 * @param value        offending value, when there is one
 * @param suggestion   closest valid value or name, when one is close enough
 * @param relatedPath  second location involved (uniqueness violations)
 */
public record Diagnostic(
    DiagnosticKind kind,
    Severity severity,
    String path,
    String message,
    String value,
    String suggestion,
    String relatedPath
) {
  public static final Comparator<Diagnostic> ORDER = Comparator
      .comparing(Diagnostic::path)
      .thenComparing(Diagnostic::kind)
      .thenComparing(Diagnostic::message);

  public Diagnostic {
    Objects.requireNonNull(kind, "kind");
    Objects.requireNonNull(severity, "severity");
    Objects.requireNonNull(path, "path");
    Objects.requireNonNull(message, "message");
  }

  public static Diagnostic error(DiagnosticKind kind, String path, String message) {
    return new Diagnostic(kind, Severity.ERROR, path, message, null, null, null);
  }

  public boolean isError() {
    return severity == Severity.ERROR;
  }

  public Diagnostic withSuggestion(String suggestion) {
    return new Diagnostic(kind, severity, path, message, value, suggestion, relatedPath);
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    sb.append(severity).append(' ').append(kind).append(" at ").append(path).append(": ").append(message);
    if (relatedPath != null) sb.append(" (also at ").append(relatedPath).append(')');
    if (suggestion != null) sb.append(" - did you mean '").append(suggestion).append("'?");
    return sb.toString();
  }
}
