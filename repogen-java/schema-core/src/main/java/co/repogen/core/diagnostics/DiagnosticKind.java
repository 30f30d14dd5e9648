package co.repogen.core.diagnostics;

/**
 * Classes of problems the loader and validator report.
 */
public enum DiagnosticKind {
  /** Required section or field missing, or a value has the wrong shape. */
  STRUCTURAL,
  /** Value outside a closed set. */
  ENUM,
  /** Duplicate id or name within a uniqueness scope. */
  UNIQUENESS,
  /** A field, entity, index or table name does not resolve. */
  REFERENCE,
  /** Wrong number of parameters or key attributes. */
  CARDINALITY,
  /** Individually valid values that are invalid together. */
  CONSISTENCY
}
