package co.repogen.core.diagnostics;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;

/**
 * Append-only sink for diagnostics. Safe for concurrent appends from parallel rule groups;
 * readers get a stable order through {@link #sorted()}.
 */
public final class Diagnostics {
  private final Queue<Diagnostic> entries = new ConcurrentLinkedQueue<>();

  public void add(Diagnostic diagnostic) {
    entries.add(diagnostic);
  }

  public void addAll(Diagnostics other) {
    entries.addAll(other.entries);
  }

  public void structural(String path, String message) {
    add(Diagnostic.error(DiagnosticKind.STRUCTURAL, path, message));
  }

  public void cardinality(String path, String message) {
    add(Diagnostic.error(DiagnosticKind.CARDINALITY, path, message));
  }

  public void consistency(String path, String message) {
    add(Diagnostic.error(DiagnosticKind.CONSISTENCY, path, message));
  }

  /**
   * Report a value outside its closed set, suggesting the nearest valid value.
   */
  public void enumViolation(String path, String what, String value, Collection<String> validValues) {
    String suggestion = Suggestions.closest(value, validValues).orElse(null);
    add(new Diagnostic(DiagnosticKind.ENUM, Severity.ERROR, path,
        "invalid " + what + " '" + value + "', expected one of " + validValues,
        value, suggestion, null));
  }

  /**
   * Report a name that does not resolve, suggesting the nearest existing name.
   */
  public void reference(String path, String message, String name, Collection<String> candidates) {
    String suggestion = Suggestions.closest(name, candidates).orElse(null);
    add(new Diagnostic(DiagnosticKind.REFERENCE, Severity.ERROR, path, message, name, suggestion, null));
  }

  public void uniqueness(String path, String relatedPath, String message, String value) {
    add(new Diagnostic(DiagnosticKind.UNIQUENESS, Severity.ERROR, path, message, value, null, relatedPath));
  }

  public void warning(DiagnosticKind kind, String path, String message) {
    add(new Diagnostic(kind, Severity.WARNING, path, message, null, null, null));
  }

  public boolean isEmpty() {
    return entries.isEmpty();
  }

  public boolean hasErrors() {
    return entries.stream().anyMatch(Diagnostic::isError);
  }

  public int size() {
    return entries.size();
  }

  /** All entries ordered by path, kind and message. */
  public List<Diagnostic> sorted() {
    List<Diagnostic> out = new ArrayList<>(entries);
    out.sort(Diagnostic.ORDER);
    return out;
  }

  public List<Diagnostic> errors() {
    return sorted().stream().filter(Diagnostic::isError).toList();
  }

  public List<Diagnostic> warnings() {
    return sorted().stream().filter(d -> !d.isError()).toList();
  }

  public List<Diagnostic> ofKind(DiagnosticKind kind) {
    return sorted().stream().filter(d -> d.kind() == kind).toList();
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    for (Diagnostic d : sorted()) sb.append(d).append('\n');
    return sb.toString();
  }
}
