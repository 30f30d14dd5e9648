package co.repogen.core.diagnostics;

public enum Severity {
  ERROR,
  WARNING
}
