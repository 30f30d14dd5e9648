package co.repogen.core.resolve;

import co.repogen.core.model.RangeCondition;
import co.repogen.core.template.KeyTemplate;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One key attribute condition of an operation.
 *
 * <p>Equality steps build the attribute value from {@code template} with each template field
 * bound to a parameter ({@code bindings}: field name to parameter name). Range steps carry the
 * {@code condition} and its operand parameters; operands are prefixed with the template's
 * literal prefix unless the template is a numeric passthrough.
 *
 * <p>When {@code entityParameter} is set, template fields are read from that entity
 * parameter instead of from scalar parameters, and {@code bindings} is empty.
 *
 * @param attribute        stored attribute name
 * @param condition        null for equality
 * @param rangeParameters  range operands, empty for equality
 * @param entityParameter  entity parameter supplying the template fields, or null
 */
public record KeyPlanStep(
    KeyRole role,
    String attribute,
    KeyTemplate template,
    Map<String, String> bindings,
    RangeCondition condition,
    List<String> rangeParameters,
    String entityParameter
) {

  public KeyPlanStep {
    bindings = Collections.unmodifiableMap(new LinkedHashMap<>(bindings));
    rangeParameters = List.copyOf(rangeParameters);
  }

  public static KeyPlanStep equality(KeyRole role, String attribute, KeyTemplate template, Map<String, String> bindings) {
    return new KeyPlanStep(role, attribute, template, bindings, null, List.of(), null);
  }

  public static KeyPlanStep fromEntity(KeyRole role, String attribute, KeyTemplate template, String entityParameter) {
    return new KeyPlanStep(role, attribute, template, Map.of(), null, List.of(), entityParameter);
  }

  public static KeyPlanStep range(String attribute, KeyTemplate template, RangeCondition condition,
      List<String> parameters) {
    return new KeyPlanStep(KeyRole.SORT, attribute, template, Map.of(), condition, parameters, null);
  }

  public boolean isRange() {
    return condition != null;
  }

  public boolean readsEntity() {
    return entityParameter != null;
  }

  /** Parameter names in the template's field order. */
  public List<String> boundParameters() {
    return template.fieldNames().stream().map(bindings::get).toList();
  }
}
