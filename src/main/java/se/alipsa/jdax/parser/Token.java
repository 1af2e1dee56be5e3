package se.alipsa.jdax.parser;

/**
 * A lexical token.
 *
 * @param type
 *          token category
 * @param text
 *          unescaped token text; the operator symbol for {@link Type#OPERATOR}
 * @param number
 *          parsed value for {@link Type#NUMBER}
 * @param position
 *          zero based offset of the first character
 */
public record Token(Type type, String text, double number, int position) {

  /** Token categories. */
  public enum Type {
    IDENTIFIER, QUOTED_IDENTIFIER, BRACKET_IDENTIFIER, STRING, NUMBER, OPERATOR, LPAREN, RPAREN, COMMA, EOF
  }

  boolean is(Type expected) {
    return type == expected;
  }

  boolean isOperator(String symbol) {
    return type == Type.OPERATOR && text.equals(symbol);
  }

  String describe() {
    return switch (type) {
      case EOF -> "end of input";
      case STRING -> "string \"" + text + "\"";
      case NUMBER -> "number " + text;
      case BRACKET_IDENTIFIER -> "[" + text + "]";
      case QUOTED_IDENTIFIER -> "'" + text + "'";
      default -> "'" + text + "'";
    };
  }
}
