package co.repogen.core.model;

import java.util.List;
import java.util.Optional;

/**
 * Single-table operations an access pattern can perform.
 */
public enum Operation implements WireValue {
  GET_ITEM("GetItem"),
  PUT_ITEM("PutItem"),
  DELETE_ITEM("DeleteItem"),
  QUERY("Query"),
  SCAN("Scan"),
  UPDATE_ITEM("UpdateItem"),
  BATCH_GET_ITEM("BatchGetItem"),
  BATCH_WRITE_ITEM("BatchWriteItem");

  private final String wire;

  Operation(String wire) {
    this.wire = wire;
  }

  @Override
  public String wire() {
    return wire;
  }

  public boolean isRead() {
    return switch (this) {
      case GET_ITEM, QUERY, SCAN, BATCH_GET_ITEM -> true;
      case PUT_ITEM, DELETE_ITEM, UPDATE_ITEM, BATCH_WRITE_ITEM -> false;
    };
  }

  /** Only Query and Scan accept a filter expression. */
  public boolean supportsFilter() {
    return this == QUERY || this == SCAN;
  }

  public static Optional<Operation> of(String value) {
    return WireValue.parse(Operation.class, value);
  }

  public static List<String> wireValues() {
    return WireValue.values(Operation.class);
  }
}
