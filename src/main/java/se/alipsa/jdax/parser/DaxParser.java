package se.alipsa.jdax.parser;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import se.alipsa.jdax.DaxException;

/**
 * Precedence climbing parser for the formula subset: literals, table, column
 * and measure references, function calls, unary minus, binary operators and
 * parentheses.
 *
 * <p>
 * Binding power from loosest to tightest: {@code ||}, {@code &&}, comparisons,
 * {@code &}, {@code + -}, {@code * /}, then unary minus. Binary operators are
 * left associative.
 * </p>
 */
public final class DaxParser {

  private static final int UNARY_PRECEDENCE = 7;

  private final DaxLexer lexer;
  private Token lookahead;

  private DaxParser(String text) {
    this.lexer = new DaxLexer(text);
    this.lookahead = lexer.next();
  }

  /**
   * Parse formula text into an expression tree.
   *
   * @param text
   *          the formula, optionally starting with {@code =}
   * @return the parsed expression
   * @throws DaxException
   *           of kind {@code PARSE} on malformed input
   */
  public static Expr parse(String text) {
    Objects.requireNonNull(text, "text");
    String source = text.strip();
    if (source.startsWith("=")) {
      source = source.substring(1);
    }
    DaxParser parser = new DaxParser(source);
    Expr expr = parser.parseExpression(0);
    if (!parser.lookahead.is(Token.Type.EOF)) {
      throw DaxException.parse("unexpected " + parser.lookahead.describe(), parser.lookahead.position());
    }
    return expr;
  }

  private Token bump() {
    Token current = lookahead;
    lookahead = lexer.next();
    return current;
  }

  private void expect(Token.Type type, String what) {
    if (!lookahead.is(type)) {
      throw DaxException.parse("expected " + what + ", found " + lookahead.describe(), lookahead.position());
    }
    bump();
  }

  private Expr parseExpression(int minPrecedence) {
    Expr left = parsePrefix();
    while (lookahead.is(Token.Type.OPERATOR)) {
      BinaryOperator op = BinaryOperator.fromSymbol(lookahead.text());
      if (op == null || op.precedence() < minPrecedence) {
        break;
      }
      bump();
      Expr right = parseExpression(op.precedence() + 1);
      left = new Expr.Binary(op, left, right);
    }
    return left;
  }

  private Expr parsePrefix() {
    Token token = lookahead;
    switch (token.type()) {
      case OPERATOR:
        if (token.isOperator("-")) {
          bump();
          return new Expr.Negate(parseExpression(UNARY_PRECEDENCE));
        }
        if (token.isOperator("+")) {
          bump();
          return parseExpression(UNARY_PRECEDENCE);
        }
        break;
      case NUMBER:
        bump();
        return new Expr.NumberLiteral(token.number());
      case STRING:
        bump();
        return new Expr.TextLiteral(token.text());
      case BRACKET_IDENTIFIER:
        bump();
        return new Expr.MeasureRef(token.text());
      case IDENTIFIER:
        return parseIdentifier();
      case QUOTED_IDENTIFIER:
        bump();
        return tableOrColumn(token.text());
      case LPAREN:
        bump();
        Expr inner = parseExpression(0);
        expect(Token.Type.RPAREN, "')'");
        return inner;
      default:
        break;
    }
    throw DaxException.parse("unexpected " + token.describe() + " in expression", token.position());
  }

  private Expr parseIdentifier() {
    Token ident = bump();
    if (lookahead.is(Token.Type.LPAREN)) {
      bump();
      List<Expr> args = new ArrayList<>();
      if (!lookahead.is(Token.Type.RPAREN)) {
        args.add(parseExpression(0));
        while (lookahead.is(Token.Type.COMMA)) {
          bump();
          args.add(parseExpression(0));
        }
      }
      expect(Token.Type.RPAREN, "')' to close " + ident.text() + "(");
      return new Expr.Call(ident.text(), args);
    }
    return tableOrColumn(ident.text());
  }

  private Expr tableOrColumn(String table) {
    if (lookahead.is(Token.Type.BRACKET_IDENTIFIER)) {
      Token column = bump();
      return new Expr.ColumnRef(table, column.text());
    }
    return new Expr.TableName(table);
  }
}
