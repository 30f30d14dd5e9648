package co.repogen.core.model;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Which entity attributes a secondary index carries.
 */
public final class Projections {

  private Projections() {
  }

  /**
   * Attribute names present on index items for {@code INCLUDE} and {@code KEYS_ONLY}
   * projections: table keys, index keys and, for {@code INCLUDE}, the listed attributes.
   */
  public static Set<String> projectedAttributes(TableDefinition table, IndexDefinition index) {
    Set<String> projected = new LinkedHashSet<>(table.keyAttributes());
    projected.addAll(index.keyAttributes());
    if (index.projectionKind().orElse(ProjectionKind.ALL) == ProjectionKind.INCLUDE
        && index.includedAttributes() != null) {
      projected.addAll(index.includedAttributes());
    }
    return projected;
  }

  /**
   * Required fields of {@code entity} missing from index items. Empty for {@code ALL}.
   * A typed entity can be rebuilt from index items only when this list is empty.
   */
  public static List<String> unprojectedRequiredFields(TableDefinition table, IndexDefinition index,
      EntityDefinition entity) {
    List<String> missing = new ArrayList<>();
    if (index.projectionKind().orElse(ProjectionKind.ALL) == ProjectionKind.ALL) return missing;
    Set<String> projected = projectedAttributes(table, index);
    for (FieldDefinition f : entity.fields()) {
      if (f.required() && !projected.contains(f.name())) missing.add(f.name());
    }
    return missing;
  }
}
