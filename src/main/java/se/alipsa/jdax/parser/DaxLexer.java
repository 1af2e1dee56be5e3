package se.alipsa.jdax.parser;

import se.alipsa.jdax.DaxException;

/** Splits formula text into {@link Token}s. */
final class DaxLexer {

  private final String input;
  private int pos;

  DaxLexer(String input) {
    this.input = input;
  }

  Token next() {
    skipWhitespace();
    if (pos >= input.length()) {
      return new Token(Token.Type.EOF, "", 0, pos);
    }
    int start = pos;
    char c = input.charAt(pos);
    switch (c) {
      case '(':
        pos++;
        return new Token(Token.Type.LPAREN, "(", 0, start);
      case ')':
        pos++;
        return new Token(Token.Type.RPAREN, ")", 0, start);
      case ',':
      case ';':
        pos++;
        return new Token(Token.Type.COMMA, String.valueOf(c), 0, start);
      case '+':
      case '-':
      case '*':
      case '/':
      case '=':
        pos++;
        return operator(String.valueOf(c), start);
      case '<':
        pos++;
        if (peek('=')) {
          pos++;
          return operator("<=", start);
        }
        if (peek('>')) {
          pos++;
          return operator("<>", start);
        }
        return operator("<", start);
      case '>':
        pos++;
        if (peek('=')) {
          pos++;
          return operator(">=", start);
        }
        return operator(">", start);
      case '&':
        pos++;
        if (peek('&')) {
          pos++;
          return operator("&&", start);
        }
        return operator("&", start);
      case '|':
        pos++;
        if (peek('|')) {
          pos++;
          return operator("||", start);
        }
        throw DaxException.parse("unexpected '|', did you mean '||'", start);
      case '"':
        return new Token(Token.Type.STRING, delimited('"', '"', "string literal"), 0, start);
      case '\'':
        return new Token(Token.Type.QUOTED_IDENTIFIER, delimited('\'', '\'', "quoted table name"), 0, start);
      case '[':
        return new Token(Token.Type.BRACKET_IDENTIFIER, delimited('[', ']', "bracket identifier").trim(), 0,
            start);
      default:
        break;
    }
    if (Character.isDigit(c) || c == '.') {
      return number(start);
    }
    if (isIdentifierStart(c)) {
      while (pos < input.length() && isIdentifierPart(input.charAt(pos))) {
        pos++;
      }
      return new Token(Token.Type.IDENTIFIER, input.substring(start, pos), 0, start);
    }
    throw DaxException.parse("unexpected character '" + c + "'", start);
  }

  private Token operator(String symbol, int start) {
    return new Token(Token.Type.OPERATOR, symbol, 0, start);
  }

  private boolean peek(char expected) {
    return pos < input.length() && input.charAt(pos) == expected;
  }

  private void skipWhitespace() {
    while (pos < input.length() && Character.isWhitespace(input.charAt(pos))) {
      pos++;
    }
  }

  /** Reads text between delimiters; a doubled closing delimiter is an escaped literal one. */
  private String delimited(char open, char close, String what) {
    int start = pos;
    pos++;
    StringBuilder sb = new StringBuilder();
    while (pos < input.length()) {
      char ch = input.charAt(pos);
      if (ch == close) {
        if (pos + 1 < input.length() && input.charAt(pos + 1) == close) {
          sb.append(close);
          pos += 2;
          continue;
        }
        pos++;
        return sb.toString();
      }
      sb.append(ch);
      pos++;
    }
    throw DaxException.parse("unterminated " + what, start);
  }

  private Token number(int start) {
    while (pos < input.length() && (Character.isDigit(input.charAt(pos)) || input.charAt(pos) == '.')) {
      pos++;
    }
    String text = input.substring(start, pos);
    try {
      return new Token(Token.Type.NUMBER, text, Double.parseDouble(text), start);
    } catch (NumberFormatException e) {
      throw new DaxException(DaxException.ErrorKind.PARSE, "invalid number '" + text + "' at position " + start, e);
    }
  }

  private static boolean isIdentifierStart(char c) {
    return Character.isLetter(c) || c == '_';
  }

  private static boolean isIdentifierPart(char c) {
    return Character.isLetterOrDigit(c) || c == '_' || c == '.';
  }
}
