package co.repogen.core.resolve;

import co.repogen.core.Names;
import co.repogen.core.model.AccessPatternDefinition;
import co.repogen.core.model.CrossTableTransactionPattern;
import co.repogen.core.model.EntityDefinition;
import co.repogen.core.model.FieldDefinition;
import co.repogen.core.model.FieldKind;
import co.repogen.core.model.IndexDefinition;
import co.repogen.core.model.IndexKeyMapping;
import co.repogen.core.model.Operation;
import co.repogen.core.model.ParameterDefinition;
import co.repogen.core.model.ParameterKind;
import co.repogen.core.model.ProjectionKind;
import co.repogen.core.model.Projections;
import co.repogen.core.model.RangeCondition;
import co.repogen.core.model.ReturnShape;
import co.repogen.core.model.SchemaDocument;
import co.repogen.core.model.TableDefinition;
import co.repogen.core.model.TransactionAction;
import co.repogen.core.model.TransactionOperation;
import co.repogen.core.model.TransactionParticipant;
import co.repogen.core.model.TransactionReturnType;
import co.repogen.core.template.CompiledKey;
import co.repogen.core.template.KeyTemplate;
import co.repogen.core.template.KeyTemplateCompiler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Projects a validated {@link SchemaDocument} into a {@link ResolvedModel}.
 *
 * <p>Resolution adds no diagnostics. Anything the validator should have rejected surfaces
 * as an {@link IllegalStateException}.
 */
public final class PatternResolver {
  private static final Logger log = LoggerFactory.getLogger(PatternResolver.class);

  public ResolvedModel resolve(SchemaDocument document) {
    List<ResolvedTable> tables = new ArrayList<>();
    List<PatternRegistryEntry> registry = new ArrayList<>();

    for (TableDefinition table : document.tables()) {
      Map<String, Integer> pkTemplateUse = new HashMap<>();
      for (EntityDefinition e : table.entities()) pkTemplateUse.merge(e.pkTemplate(), 1, Integer::sum);

      List<ResolvedEntity> entities = new ArrayList<>();
      for (EntityDefinition entity : table.entities()) {
        ResolvedEntity resolved = resolveEntity(table, entity, pkTemplateUse.get(entity.pkTemplate()) > 1);
        entities.add(resolved);
        for (ResolvedPattern p : resolved.patterns()) registry.add(registryEntry(resolved, p));
      }
      tables.add(new ResolvedTable(table, entities));
    }

    List<ResolvedTransaction> transactions = new ArrayList<>();
    for (CrossTableTransactionPattern pattern : document.crossTablePatterns()) {
      ResolvedTransaction tx = resolveTransaction(document, pattern);
      transactions.add(tx);
      registry.add(registryEntry(tx));
    }

    log.info("Resolved {} entities, {} access pattern(s), {} transaction(s)",
        tables.stream().mapToInt(t -> t.entities().size()).sum(), registry.size() - transactions.size(),
        transactions.size());
    return new ResolvedModel(tables, transactions, registry);
  }

  // =========================================================================
  // Entities
  // =========================================================================

  private ResolvedEntity resolveEntity(TableDefinition table, EntityDefinition entity, boolean itemCollection) {
    CompiledKey pk = CompiledKey.single(KeyTemplateCompiler.compileStrict(entity.pkTemplate(), entity));
    CompiledKey sk = entity.skTemplate() == null
        ? null
        : CompiledKey.single(KeyTemplateCompiler.compileStrict(entity.skTemplate(), entity));

    List<ResolvedIndexKey> indexKeys = new ArrayList<>();
    for (IndexKeyMapping mapping : entity.indexMappings()) {
      IndexDefinition index = table.index(mapping.indexName())
          .orElseThrow(() -> invariant("entity " + entity.name() + " maps unknown index " + mapping.indexName()));
      String owner = "index '" + index.name() + "'";
      CompiledKey ipk = KeyTemplateCompiler.compileStrict(mapping.pkTemplate(), entity, owner);
      CompiledKey isk = mapping.skTemplate() == null
          ? null
          : KeyTemplateCompiler.compileStrict(mapping.skTemplate(), entity, owner);
      indexKeys.add(new ResolvedIndexKey(index, ipk, isk, isRawProjection(table, index, entity)));
    }

    CrudMethods crud = CrudMethods.forEntity(entity.name());
    List<ResolvedPattern> patterns = new ArrayList<>();
    for (AccessPatternDefinition def : entity.accessPatterns()) {
      patterns.add(resolvePattern(table, entity, pk, sk, indexKeys, def));
    }

    List<String> primaryKeyFields = new ArrayList<>(pk.fieldNames());
    if (sk != null) sk.fieldNames().stream().filter(f -> !primaryKeyFields.contains(f)).forEach(primaryKeyFields::add);
    CrudConflictResolver.Result crudResult = CrudConflictResolver.apply(entity, crud, patterns, primaryKeyFields);

    String prefix = sk == null ? "" : sk.first().literalPrefix();
    return new ResolvedEntity(entity, table, pk, sk, indexKeys, crudResult.patterns(), crud, itemCollection, prefix,
        crudResult.consistentGet());
  }

  private static boolean isRawProjection(TableDefinition table, IndexDefinition index, EntityDefinition entity) {
    ProjectionKind kind = index.projectionKind().orElseThrow(() -> invariant("projection " + index.projection()));
    return switch (kind) {
      case ALL -> false;
      case KEYS_ONLY -> true;
      case INCLUDE -> !Projections.unprojectedRequiredFields(table, index, entity).isEmpty();
    };
  }

  // =========================================================================
  // Access patterns
  // =========================================================================

  private ResolvedPattern resolvePattern(TableDefinition table, EntityDefinition entity, CompiledKey pk, CompiledKey sk,
      List<ResolvedIndexKey> indexKeys, AccessPatternDefinition def) {
    Operation op = def.operationKind().orElseThrow(() -> invariant("operation " + def.operation()));
    ReturnShape declared = def.returnShape().orElseThrow(() -> invariant("return type " + def.returnType()));
    RangeCondition range = def.rangeCondition() == null
        ? null
        : def.rangeConditionKind().orElseThrow(() -> invariant("range condition " + def.rangeCondition()));

    ResolvedIndexKey indexKey = null;
    if (def.usesIndex()) {
      indexKey = indexKeys.stream().filter(k -> k.indexName().equals(def.indexName())).findFirst()
          .orElseThrow(() -> invariant("pattern " + def.name() + " queries unmapped index " + def.indexName()));
    }

    Set<String> filterParams = def.filterExpression() == null ? Set.of() : def.filterExpression().parameterNames();
    List<KeyPlanStep> plan = new ArrayList<>();
    List<ResolvedParameter> implicit = new ArrayList<>();
    List<String> rangeParams = new ArrayList<>();

    switch (op) {
      case GET_ITEM, DELETE_ITEM, UPDATE_ITEM -> {
        ParameterPool pool = new ParameterPool(def.keyCandidateParameters(fieldsOf(pk, sk)));
        List<KeyPart> parts = new ArrayList<>(partsOf(KeyRole.PARTITION, List.of(table.partitionKey()), pk));
        if (sk != null) parts.addAll(partsOf(KeyRole.SORT, List.of(table.sortKey()), sk));
        planEqualities(parts, pool, entity, def, plan, implicit);
      }
      case QUERY -> {
        CompiledKey partition = indexKey == null ? pk : indexKey.partitionKey();
        List<String> partitionAttrs = indexKey == null
            ? List.of(table.partitionKey())
            : indexKey.index().partitionKey().values();
        CompiledKey sort = indexKey == null ? sk : indexKey.sortKey();
        List<String> sortAttrs = indexKey == null
            ? (table.hasSortKey() ? List.of(table.sortKey()) : List.of())
            : (indexKey.index().hasSortKey() ? indexKey.index().sortKey().values() : List.of());

        ParameterPool pool = new ParameterPool(def.keyCandidateParameters(fieldsOf(partition, sort)));
        if (range != null) rangeParams.addAll(pool.takeLast(range.valueCount()));
        planEqualities(partsOf(KeyRole.PARTITION, partitionAttrs, partition), pool, entity, def, plan, implicit);
        if (sort != null) planSort(sort, sortAttrs, range, rangeParams, pool, plan);
      }
      case PUT_ITEM, SCAN, BATCH_GET_ITEM, BATCH_WRITE_ITEM -> {
        // no key condition
      }
    }

    Set<String> keyParams = new LinkedHashSet<>();
    for (KeyPlanStep step : plan) keyParams.addAll(step.bindings().values());

    List<ResolvedParameter> params = new ArrayList<>();
    for (ParameterDefinition p : def.parameters()) {
      ParameterKind kind = p.kind().orElseThrow(() -> invariant("parameter type " + p.type()));
      ParameterRole role;
      if (p.isEntity()) role = ParameterRole.BODY;
      else if (rangeParams.contains(p.name())) role = ParameterRole.RANGE;
      else if (keyParams.contains(p.name())) role = ParameterRole.KEY;
      else if (filterParams.contains(p.name())) role = ParameterRole.FILTER;
      else role = ParameterRole.BODY;
      params.add(new ResolvedParameter(p.name(), kind, p.entityType(), role));
    }
    params.addAll(implicit);

    ProjectionKind projection = indexKey == null ? null : indexKey.index().projectionKind().orElse(ProjectionKind.ALL);
    boolean raw = indexKey != null && indexKey.rawProjection();
    return new ResolvedPattern(def.patternId(), Names.toSnakeCase(def.name()), def.name(), def.description(), op,
        declared, responseShape(declared, raw), indexKey == null ? null : indexKey.indexName(), projection, range,
        def.isConsistentRead(), def.filterExpression(), params, plan, null);
  }

  private static ResponseShape responseShape(ReturnShape declared, boolean raw) {
    return switch (declared) {
      case SINGLE_ENTITY -> raw ? ResponseShape.ATTRIBUTE_MAP : ResponseShape.ENTITY;
      case ENTITY_LIST -> raw ? ResponseShape.ATTRIBUTE_MAP_LIST : ResponseShape.ENTITY_LIST;
      case SUCCESS_FLAG -> ResponseShape.SUCCESS_FLAG;
      case MIXED_DATA -> ResponseShape.MIXED;
      case VOID -> ResponseShape.NONE;
    };
  }

  private record KeyPart(KeyRole role, String attribute, KeyTemplate template) {
  }

  /** Field names referenced by the templates of the given keys; null keys are skipped. */
  private static Set<String> fieldsOf(CompiledKey... keys) {
    Set<String> fields = new LinkedHashSet<>();
    for (CompiledKey key : keys) {
      if (key == null) continue;
      for (KeyTemplate part : key.parts()) fields.addAll(part.fieldNames());
    }
    return fields;
  }

  private static List<KeyPart> partsOf(KeyRole role, List<String> attributes, CompiledKey key) {
    List<KeyPart> parts = new ArrayList<>();
    for (int i = 0; i < key.size(); i++) {
      String attribute = i < attributes.size() ? attributes.get(i) : attributes.get(attributes.size() - 1);
      parts.add(new KeyPart(role, attribute, key.parts().get(i)));
    }
    return parts;
  }

  /**
   * Bind every field of {@code parts} to a scalar parameter. Falls back to an entity parameter
   * of the same entity, then to implicit parameters named after the missing fields.
   */
  private static void planEqualities(List<KeyPart> parts, ParameterPool pool, EntityDefinition entity,
      AccessPatternDefinition def, List<KeyPlanStep> plan, List<ResolvedParameter> implicit) {
    List<String> fields = new ArrayList<>();
    for (KeyPart part : parts) {
      for (String f : part.template().fieldNames()) if (!fields.contains(f)) fields.add(f);
    }
    Map<String, String> bindings = pool.bind(fields);
    if (bindings.size() < fields.size()) {
      Optional<ParameterDefinition> entityParam = def.parameters().stream()
          .filter(ParameterDefinition::isEntity)
          .filter(p -> entity.name().equals(p.entityType()))
          .findFirst();
      if (entityParam.isPresent()) {
        pool.release(bindings.values());
        for (KeyPart part : parts) {
          plan.add(KeyPlanStep.fromEntity(part.role(), part.attribute(), part.template(), entityParam.get().name()));
        }
        return;
      }
      Set<String> declared = new LinkedHashSet<>();
      def.parameters().forEach(p -> declared.add(p.name()));
      for (String field : fields) {
        if (bindings.containsKey(field)) continue;
        bindings.put(field, field);
        boolean known = implicit.stream().anyMatch(p -> p.name().equals(field));
        if (!declared.contains(field) && !known) {
          FieldKind kind = entity.field(field).flatMap(FieldDefinition::kind)
              .orElseThrow(() -> invariant("key field " + field + " of " + entity.name()));
          implicit.add(new ResolvedParameter(field, ParameterKind.valueOf(kind.name()), null, ParameterRole.KEY));
        }
      }
    }
    for (KeyPart part : parts) {
      Map<String, String> stepBindings = new LinkedHashMap<>();
      for (String f : part.template().fieldNames()) stepBindings.put(f, bindings.get(f));
      plan.add(KeyPlanStep.equality(part.role(), part.attribute(), part.template(), stepBindings));
    }
  }

  /**
   * Sort key conditions of a Query. Multi-attribute sort keys take equality values for
   * leading attributes, then the range on the next one.
   */
  private static void planSort(CompiledKey sort, List<String> sortAttrs, RangeCondition range, List<String> rangeParams,
      ParameterPool pool, List<KeyPlanStep> plan) {
    List<KeyPart> parts = partsOf(KeyRole.SORT, sortAttrs, sort);
    int position = 0;
    if (sort.multiAttribute()) {
      int limit = range == null ? parts.size() : parts.size() - 1;
      while (position < limit && !pool.isEmpty()) {
        KeyPart part = parts.get(position);
        Map<String, String> bindings = pool.bind(part.template().fieldNames());
        if (bindings.size() < part.template().fieldNames().size()) {
          pool.release(bindings.values());
          break;
        }
        plan.add(KeyPlanStep.equality(KeyRole.SORT, part.attribute(), part.template(), bindings));
        position++;
      }
    } else if (range == null) {
      KeyPart part = parts.get(0);
      List<String> fields = part.template().fieldNames();
      if (!fields.isEmpty() && pool.hasAllByName(fields)) {
        plan.add(KeyPlanStep.equality(KeyRole.SORT, part.attribute(), part.template(), pool.bind(fields)));
      }
    }
    if (range != null && position < parts.size()) {
      KeyPart part = parts.get(position);
      plan.add(KeyPlanStep.range(part.attribute(), part.template(), range, rangeParams));
    }
  }

  /**
   * Ordered scalar parameters not yet bound. A key field binds only to the parameter of the
   * same name.
   */
  private static final class ParameterPool {
    private final List<String> available = new ArrayList<>();

    ParameterPool(List<ParameterDefinition> candidates) {
      candidates.forEach(p -> available.add(p.name()));
    }

    boolean isEmpty() {
      return available.isEmpty();
    }

    boolean hasAllByName(List<String> fields) {
      return available.containsAll(fields);
    }

    List<String> takeLast(int count) {
      List<String> taken = new ArrayList<>();
      int from = Math.max(0, available.size() - count);
      while (available.size() > from) taken.add(0, available.remove(available.size() - 1));
      return taken;
    }

    Map<String, String> bind(List<String> fields) {
      Map<String, String> bindings = new LinkedHashMap<>();
      for (String f : fields) {
        if (available.remove(f)) bindings.put(f, f);
      }
      return bindings;
    }

    void release(Iterable<String> names) {
      names.forEach(available::add);
    }
  }

  // =========================================================================
  // Cross-table transactions
  // =========================================================================

  private ResolvedTransaction resolveTransaction(SchemaDocument document, CrossTableTransactionPattern pattern) {
    TransactionOperation op = pattern.operationKind()
        .orElseThrow(() -> invariant("transaction operation " + pattern.operation()));
    TransactionReturnType returnType = pattern.returnTypeKind()
        .orElseThrow(() -> invariant("transaction return type " + pattern.returnType()));

    Set<String> keyParams = new LinkedHashSet<>();
    List<ResolvedParticipant> participants = new ArrayList<>();
    List<ResolvedParameter> implicit = new ArrayList<>();
    for (TransactionParticipant participant : pattern.participants()) {
      TransactionAction action = participant.actionKind()
          .orElseThrow(() -> invariant("transaction action " + participant.action()));
      EntityDefinition entity = document.table(participant.table())
          .flatMap(t -> t.entity(participant.entity()))
          .orElseThrow(() -> invariant("participant " + participant.table() + "." + participant.entity()));

      String entityParam = pattern.parameters().stream()
          .filter(ParameterDefinition::isEntity)
          .filter(p -> participant.entity().equals(p.entityType()))
          .map(ParameterDefinition::name)
          .findFirst().orElse(null);

      Map<String, String> keyBindings = new LinkedHashMap<>();
      if (entityParam == null) {
        for (String field : keyFields(entity)) {
          keyBindings.put(field, field);
          keyParams.add(field);
          boolean declared = pattern.parameters().stream().anyMatch(p -> p.name().equals(field));
          boolean known = implicit.stream().anyMatch(p -> p.name().equals(field));
          if (!declared && !known) {
            FieldKind kind = entity.field(field).flatMap(FieldDefinition::kind)
                .orElseThrow(() -> invariant("key field " + field + " of " + entity.name()));
            implicit.add(new ResolvedParameter(field, ParameterKind.valueOf(kind.name()), null, ParameterRole.KEY));
          }
        }
      }
      participants.add(new ResolvedParticipant(participant.table(), participant.entity(), action,
          participant.condition(), entityParam, keyBindings));
    }

    List<ResolvedParameter> params = new ArrayList<>();
    for (ParameterDefinition p : pattern.parameters()) {
      ParameterKind kind = p.kind().orElseThrow(() -> invariant("parameter type " + p.type()));
      ParameterRole role = keyParams.contains(p.name()) ? ParameterRole.KEY : ParameterRole.BODY;
      params.add(new ResolvedParameter(p.name(), kind, p.entityType(), role));
    }
    params.addAll(implicit);
    return new ResolvedTransaction(pattern.patternId(), Names.toSnakeCase(pattern.name()), pattern.description(), op,
        returnType, participants, params);
  }

  private static List<String> keyFields(EntityDefinition entity) {
    List<String> fields = new ArrayList<>(KeyTemplateCompiler.compileStrict(entity.pkTemplate(), entity).fieldNames());
    if (entity.skTemplate() != null) {
      for (String f : KeyTemplateCompiler.compileStrict(entity.skTemplate(), entity).fieldNames()) {
        if (!fields.contains(f)) fields.add(f);
      }
    }
    return fields;
  }

  // =========================================================================
  // Registry
  // =========================================================================

  private static PatternRegistryEntry registryEntry(ResolvedEntity entity, ResolvedPattern p) {
    return new PatternRegistryEntry(p.id(), p.description(), entity.name(), entity.name() + "Repository", null,
        p.targetMethod(), registryParameters(p.parameters()), p.returnShape().wire(), p.operation().wire(),
        p.indexName(), p.rangeCondition() == null ? null : p.rangeCondition().wire(),
        p.consistentRead() ? Boolean.TRUE : null, null, null);
  }

  private static PatternRegistryEntry registryEntry(ResolvedTransaction tx) {
    List<PatternRegistryEntry.Participant> involved = tx.participants().stream()
        .map(p -> new PatternRegistryEntry.Participant(p.table(), p.entity(), p.action().wire()))
        .toList();
    return new PatternRegistryEntry(tx.id(), tx.description(), null, null, PatternRegistryEntry.TRANSACTION_SERVICE,
        tx.methodName(), registryParameters(tx.parameters()), tx.returnType().wire(), tx.operation().wire(),
        null, null, null, involved, PatternRegistryEntry.CROSS_TABLE);
  }

  private static List<PatternRegistryEntry.Parameter> registryParameters(List<ResolvedParameter> params) {
    return params.stream()
        .map(p -> new PatternRegistryEntry.Parameter(p.name(), p.kind().wire(), p.entityType()))
        .toList();
  }

  private static IllegalStateException invariant(String what) {
    return new IllegalStateException("unvalidated schema reached the resolver: " + what);
  }
}
