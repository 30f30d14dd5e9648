package co.repogen.core.template;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Scanner for key templates such as {@code TENANT#{tenant_id}#USER#{user_id}}.
 *
 * <p>Grammar: literal text interleaved with {@code {identifier}} placeholders. Braces
 * cannot be nested or escaped, and placeholders must be identifiers
 * ({@code [A-Za-z_][A-Za-z0-9_]*}).
 */
public final class KeyTemplateParser {

  private KeyTemplateParser() {
  }

  public static KeyTemplate parse(String template) {
    if (template == null) throw new TemplateSyntaxException("template is null", 0);
    if (template.isEmpty()) throw new TemplateSyntaxException("template is empty", 0);

    List<Segment> segments = new ArrayList<>();
    StringBuilder literal = new StringBuilder();
    int i = 0;
    while (i < template.length()) {
      char c = template.charAt(i);
      if (c == '}') {
        throw new TemplateSyntaxException("unmatched '}'", i);
      }
      if (c != '{') {
        literal.append(c);
        i++;
        continue;
      }
      int open = i;
      int close = -1;
      for (int j = i + 1; j < template.length(); j++) {
        char d = template.charAt(j);
        if (d == '{') throw new TemplateSyntaxException("nested '{'", j);
        if (d == '}') {
          close = j;
          break;
        }
      }
      if (close < 0) throw new TemplateSyntaxException("unterminated placeholder", open);
      String name = template.substring(open + 1, close);
      if (name.isEmpty()) throw new TemplateSyntaxException("empty placeholder", open);
      if (!isIdentifier(name)) {
        throw new TemplateSyntaxException("placeholder '" + name + "' is not a field name", open);
      }
      if (literal.length() > 0) {
        segments.add(Segment.literal(literal.toString()));
        literal.setLength(0);
      }
      segments.add(Segment.field(name));
      i = close + 1;
    }
    if (literal.length() > 0) segments.add(Segment.literal(literal.toString()));
    return new KeyTemplate(template, segments, false);
  }

  /** Parse, or empty when the template is malformed. */
  public static Optional<KeyTemplate> tryParse(String template) {
    try {
      return Optional.of(parse(template));
    } catch (TemplateSyntaxException e) {
      return Optional.empty();
    }
  }

  static boolean isIdentifier(String s) {
    if (s.isEmpty()) return false;
    char first = s.charAt(0);
    if (!(Character.isLetter(first) || first == '_')) return false;
    for (int k = 1; k < s.length(); k++) {
      char c = s.charAt(k);
      if (!(Character.isLetterOrDigit(c) || c == '_')) return false;
    }
    return true;
  }
}
