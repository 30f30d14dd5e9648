package co.repogen.core.validation;

import co.repogen.core.diagnostics.Diagnostics;
import co.repogen.core.model.SchemaDocument;

/**
 * One independent group of checks. Implementations read the document and append to the
 * sink; they never throw for a problem in the document and never stop early.
 */
public interface ValidationRule {

  String name();

  void check(SchemaDocument document, Diagnostics diagnostics);
}
