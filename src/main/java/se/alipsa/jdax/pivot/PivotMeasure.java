package se.alipsa.jdax.pivot;

import java.util.Objects;
import se.alipsa.jdax.parser.DaxParser;
import se.alipsa.jdax.parser.Expr;

/**
 * A named expression evaluated once per pivot group.
 *
 * @param name
 *          column caption in the result
 * @param expression
 *          expression text
 * @param parsed
 *          parsed expression
 */
public record PivotMeasure(String name, String expression, Expr parsed) {

  public PivotMeasure {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(expression, "expression");
    Objects.requireNonNull(parsed, "parsed");
  }

  /**
   * Parse a measure expression.
   *
   * @param name
   *          caption
   * @param expression
   *          expression text, for example {@code [Total]} or
   *          {@code SUM(Fact[Amount])}
   * @return the measure
   * @throws se.alipsa.jdax.DaxException
   *           of kind {@code PARSE} for malformed text
   */
  public static PivotMeasure of(String name, String expression) {
    return new PivotMeasure(name, expression, DaxParser.parse(expression));
  }
}
