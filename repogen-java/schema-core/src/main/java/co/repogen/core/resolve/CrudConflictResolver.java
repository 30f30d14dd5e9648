package co.repogen.core.resolve;

import co.repogen.core.model.EntityDefinition;
import co.repogen.core.model.Operation;
import co.repogen.core.model.ReturnShape;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Keeps generated method names unique per repository.
 *
 * <p>A pattern named like one of the CRUD methods either folds into it, when it does exactly
 * what the CRUD method does, or is renamed after what makes it different.
 */
final class CrudConflictResolver {
  private static final Logger log = LoggerFactory.getLogger(CrudConflictResolver.class);

  record Result(List<ResolvedPattern> patterns, boolean consistentGet) {
  }

  private CrudConflictResolver() {
  }

  static Result apply(EntityDefinition entity, CrudMethods crud, List<ResolvedPattern> patterns,
      List<String> primaryKeyFields) {
    Set<String> taken = new HashSet<>(crud.all());
    List<ResolvedPattern> out = new ArrayList<>();
    boolean consistentGet = false;

    for (ResolvedPattern p : patterns) {
      ResolvedPattern resolved = p;
      if (crud.all().contains(p.methodName())) {
        if (isEquivalent(p, entity, crud, primaryKeyFields)) {
          log.debug("Pattern {} of {} folds into {}", p.id(), entity.name(), p.methodName());
          if (p.methodName().equals(crud.get()) && p.consistentRead()) consistentGet = true;
          out.add(p.foldedInto(p.methodName()));
          continue;
        }
        String renamed = rename(p, crud, primaryKeyFields);
        log.debug("Pattern {} of {} renamed from {} to {}", p.id(), entity.name(), p.methodName(), renamed);
        resolved = p.renamed(renamed);
      }
      if (!taken.add(resolved.methodName())) {
        resolved = resolved.renamed(resolved.methodName() + "_pattern_" + resolved.id());
        taken.add(resolved.methodName());
      }
      out.add(resolved);
    }
    return new Result(out, consistentGet);
  }

  private static boolean isEquivalent(ResolvedPattern p, EntityDefinition entity, CrudMethods crud,
      List<String> primaryKeyFields) {
    String name = p.methodName();
    if (name.equals(crud.get())) {
      return p.operation() == Operation.GET_ITEM
          && !p.usesIndex()
          && p.returnShape() == ReturnShape.SINGLE_ENTITY
          && addressesByKeyOnly(p, primaryKeyFields);
    }
    if (name.equals(crud.delete())) {
      return p.operation() == Operation.DELETE_ITEM && addressesByKeyOnly(p, primaryKeyFields);
    }
    Operation expected = name.equals(crud.create()) ? Operation.PUT_ITEM : Operation.UPDATE_ITEM;
    return p.operation() == expected
        && p.parameters().size() == 1
        && p.parameters().get(0).isEntity()
        && entity.name().equals(p.parameters().get(0).entityType());
  }

  private static boolean addressesByKeyOnly(ResolvedPattern p, List<String> primaryKeyFields) {
    List<String> names = p.parameters().stream().map(ResolvedParameter::name).toList();
    return p.parameters().stream().allMatch(r -> r.role() == ParameterRole.KEY)
        && names.size() == primaryKeyFields.size()
        && names.containsAll(primaryKeyFields);
  }

  private static String rename(ResolvedPattern p, CrudMethods crud, List<String> primaryKeyFields) {
    String base = p.methodName();
    if (base.equals(crud.create()) && p.operation() == Operation.PUT_ITEM) {
      return "put_" + base.substring("create_".length());
    }
    if (p.parameters().stream().anyMatch(ResolvedParameter::isEntity)) return base + "_with_refs";
    if (p.returnShape() == ReturnShape.ENTITY_LIST) return base + "_list";
    List<String> extra = p.parameters().stream()
        .map(ResolvedParameter::name)
        .filter(n -> !primaryKeyFields.contains(n))
        .toList();
    if (!extra.isEmpty()) return base + "_with_" + String.join("_and_", extra);
    return base + "_pattern_" + p.id();
  }
}
