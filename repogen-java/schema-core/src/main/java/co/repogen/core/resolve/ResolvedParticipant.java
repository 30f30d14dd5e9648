package co.repogen.core.resolve;

import co.repogen.core.model.TransactionAction;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One item of a cross-table transaction.
 *
 * @param entityParameter  parameter carrying the whole entity (Put, Update), or null
 * @param keyBindings      key field name to parameter name, for actions addressed by key
 */
public record ResolvedParticipant(
    String table,
    String entity,
    TransactionAction action,
    String condition,
    String entityParameter,
    Map<String, String> keyBindings
) {

  public ResolvedParticipant {
    keyBindings = Collections.unmodifiableMap(new LinkedHashMap<>(keyBindings));
  }
}
