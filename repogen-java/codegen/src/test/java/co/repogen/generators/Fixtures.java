package co.repogen.generators;

import co.repogen.core.LoadResult;
import co.repogen.core.SchemaLoader;
import co.repogen.core.resolve.PatternResolver;
import co.repogen.core.resolve.ResolvedEntity;
import co.repogen.core.resolve.ResolvedModel;
import co.repogen.core.resolve.ResolvedPattern;
import co.repogen.core.usage.UsageData;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;

/**
 * Test schemas from {@code src/test/resources/schemas}, loaded and resolved.
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

  public static UsageData usage() {
    return UsageData.from(ecommerceUsage());
  }

  public static ResolvedModel model() {
    return model(ecommerce());
  }

  public static ResolvedModel model(ObjectNode schema) {
    LoadResult result = SchemaLoader.load(schema);
    if (result.diagnostics().hasErrors()) throw new IllegalStateException(result.diagnostics().toString());
    return new PatternResolver().resolve(result.document());
  }

  public static ResolvedEntity entity(ResolvedModel model, String name) {
    return model.entities().stream().filter(e -> e.name().equals(name)).findFirst().orElseThrow();
  }

  public static ResolvedPattern pattern(ResolvedModel model, int id) {
    return model.patterns().filter(p -> p.id() == id).findFirst().orElseThrow();
  }

  /** The entity node named {@code name} in table {@code table}. */
  public static ObjectNode entityNode(ObjectNode schema, int table, String name) {
    return (ObjectNode) schema.get("tables").get(table).get("entities").get(name);
  }

  public static ObjectNode patternNode(ObjectNode schema, int table, String entity, int index) {
    return (ObjectNode) entityNode(schema, table, entity).get("access_patterns").get(index);
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
