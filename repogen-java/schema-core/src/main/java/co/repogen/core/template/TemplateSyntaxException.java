package co.repogen.core.template;

/**
 * Thrown by {@link KeyTemplateParser} for malformed template strings.
 */
public class TemplateSyntaxException extends IllegalArgumentException {
  private final int position;

  public TemplateSyntaxException(String message, int position) {
    super(message + " at position " + position);
    this.position = position;
  }

  public int getPosition() {
    return position;
  }
}
