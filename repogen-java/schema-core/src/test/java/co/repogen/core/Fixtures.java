package co.repogen.core;

import co.repogen.core.model.SchemaDocument;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;

/**
 * Test schemas from {@code src/test/resources/schemas}.
 */
public final class Fixtures {
  public static final ObjectMapper JSON = new ObjectMapper();

  private Fixtures() {
  }

  /** A fresh, mutable copy of the e-commerce schema. */
  public static ObjectNode ecommerce() {
    return read("/schemas/ecommerce.json");
  }

  public static ObjectNode ecommerceUsage() {
    return read("/schemas/ecommerce_usage.json");
  }

  public static SchemaDocument ecommerceDocument() {
    LoadResult result = SchemaLoader.load(ecommerce());
    if (result.diagnostics().hasErrors()) throw new IllegalStateException(result.diagnostics().toString());
    return result.document();
  }

  /** The first entity node named {@code name} in table {@code table}. */
  public static ObjectNode entity(ObjectNode schema, int table, String name) {
    return (ObjectNode) schema.get("tables").get(table).get("entities").get(name);
  }

  public static ObjectNode pattern(ObjectNode schema, int table, String entity, int index) {
    return (ObjectNode) entity(schema, table, entity).get("access_patterns").get(index);
  }

  private static ObjectNode read(String resource) {
    try (InputStream in = Fixtures.class.getResourceAsStream(resource)) {
      if (in == null) throw new IllegalStateException("missing test resource " + resource);
      return (ObjectNode) JSON.readTree(in);
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }
}
