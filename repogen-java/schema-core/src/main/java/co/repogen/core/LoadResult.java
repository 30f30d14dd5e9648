package co.repogen.core;

import co.repogen.core.diagnostics.Diagnostics;
import co.repogen.core.model.SchemaDocument;

/**
 * Output of {@link SchemaLoader}: the normalized document and any structural diagnostics.
 */
public record LoadResult(SchemaDocument document, Diagnostics diagnostics) {
}
