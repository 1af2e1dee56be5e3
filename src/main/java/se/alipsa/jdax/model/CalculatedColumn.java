package se.alipsa.jdax.model;

import java.util.Objects;
import se.alipsa.jdax.parser.Expr;

/**
 * Definition of a calculated column. Hosts persist {@code (table, name,
 * expression)} and replay it on load.
 *
 * @param table
 *          owning table, canonical name
 * @param name
 *          column name, canonical
 * @param expression
 *          the formula text
 * @param parsed
 *          the parsed formula
 */
public record CalculatedColumn(String table, String name, String expression, Expr parsed) {

  public CalculatedColumn {
    Objects.requireNonNull(table, "table");
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(expression, "expression");
    Objects.requireNonNull(parsed, "parsed");
  }
}
