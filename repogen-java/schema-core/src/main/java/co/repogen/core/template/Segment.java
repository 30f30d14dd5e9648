package co.repogen.core.template;

/**
 * One piece of a key template: literal text or a field placeholder.
 *
 * @param type  segment type
 * @param text  the literal text, or the referenced field name
 */
public record Segment(Type type, String text) {

  public enum Type { LITERAL, FIELD }

  public static Segment literal(String text) {
    return new Segment(Type.LITERAL, text);
  }

  public static Segment field(String name) {
    return new Segment(Type.FIELD, name);
  }

  public boolean isField() {
    return type == Type.FIELD;
  }
}
