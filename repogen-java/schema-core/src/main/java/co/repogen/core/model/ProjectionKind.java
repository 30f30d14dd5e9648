package co.repogen.core.model;

import java.util.List;
import java.util.Optional;

public enum ProjectionKind implements WireValue {
  ALL("ALL"),
  KEYS_ONLY("KEYS_ONLY"),
  INCLUDE("INCLUDE");

  private final String wire;

  ProjectionKind(String wire) {
    this.wire = wire;
  }

  @Override
  public String wire() {
    return wire;
  }

  public static Optional<ProjectionKind> of(String value) {
    return WireValue.parse(ProjectionKind.class, value);
  }

  public static List<String> wireValues() {
    return WireValue.values(ProjectionKind.class);
  }
}
