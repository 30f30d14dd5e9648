package co.repogen.core.resolve;

/**
 * What a pattern parameter is used for.
 */
public enum ParameterRole {
  /** Binds a partition or sort key field by equality. */
  KEY,
  /** Operand of the sort key range condition. */
  RANGE,
  /** Value referenced by the filter expression. */
  FILTER,
  /** Whole entities and any other values passed through to the operation. */
  BODY
}
