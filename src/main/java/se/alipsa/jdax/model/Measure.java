package se.alipsa.jdax.model;

import java.util.Objects;
import se.alipsa.jdax.parser.Expr;

/**
 * A named expression evaluated under a filter context.
 *
 * @param name
 *          normalized measure name
 * @param expression
 *          the formula text as registered
 * @param parsed
 *          the parsed formula
 */
public record Measure(String name, String expression, Expr parsed) {

  public Measure {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(expression, "expression");
    Objects.requireNonNull(parsed, "parsed");
  }
}
