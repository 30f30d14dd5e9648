package co.repogen.core.validation;

import co.repogen.core.diagnostics.Diagnostics;
import co.repogen.core.model.SchemaDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.stream.Stream;

/**
 * Runs every rule group over a loaded document and collects all diagnostics.
 *
 * <p>Groups are independent and share only the diagnostics sink, so they may run in
 * parallel. The walk never stops early; callers decide what to do with the result.
 */
public final class SchemaValidator {
  private static final Logger log = LoggerFactory.getLogger(SchemaValidator.class);

  private final List<ValidationRule> rules;
  private final ValidatorOptions options;

  public SchemaValidator() {
    this(ValidatorOptions.defaults());
  }

  public SchemaValidator(ValidatorOptions options) {
    this(options, List.of(
        new StructuralRules(),
        new EnumRules(),
        new UniquenessRules(),
        new ReferenceRules(),
        new CardinalityRules(),
        new ConsistencyRules()));
  }

  public SchemaValidator(ValidatorOptions options, List<ValidationRule> rules) {
    this.options = options;
    this.rules = List.copyOf(rules);
  }

  public Diagnostics validate(SchemaDocument document) {
    Diagnostics diagnostics = new Diagnostics();
    validate(document, diagnostics);
    return diagnostics;
  }

  public void validate(SchemaDocument document, Diagnostics diagnostics) {
    Stream<ValidationRule> stream = options.parallel() ? rules.parallelStream() : rules.stream();
    stream.forEach(rule -> {
      int before = diagnostics.size();
      rule.check(document, diagnostics);
      log.debug("Rule group '{}' finished ({} diagnostics so far, {} before)", rule.name(), diagnostics.size(), before);
    });
    log.info("Validated {} table(s): {} error(s), {} warning(s)", document.tables().size(),
        diagnostics.errors().size(), diagnostics.warnings().size());
  }

  public List<ValidationRule> rules() {
    return rules;
  }
}
