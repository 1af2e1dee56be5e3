package se.alipsa.jdax.parser;

import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.stream.Collectors;
import se.alipsa.jdax.value.Value;

/** Abstract syntax tree of a formula. */
public sealed interface Expr permits Expr.NumberLiteral, Expr.TextLiteral, Expr.TableName, Expr.MeasureRef,
    Expr.ColumnRef, Expr.Call, Expr.Negate, Expr.Binary {

  /**
   * Numeric literal.
   *
   * @param value
   *          the number
   */
  record NumberLiteral(double value) implements Expr {
    @Override
    public String toString() {
      return Value.NumberValue.formatNumber(value);
    }
  }

  /**
   * String literal.
   *
   * @param value
   *          the unescaped text
   */
  record TextLiteral(String value) implements Expr {
    public TextLiteral {
      Objects.requireNonNull(value, "value");
    }

    @Override
    public String toString() {
      return "\"" + value.replace("\"", "\"\"") + "\"";
    }
  }

  /**
   * Bare or quoted table reference.
   *
   * @param name
   *          table name
   */
  record TableName(String name) implements Expr {
    public TableName {
      Objects.requireNonNull(name, "name");
    }

    @Override
    public String toString() {
      return "'" + name.replace("'", "''") + "'";
    }
  }

  /**
   * Bracketed name without a table. Resolves to a measure, or to a column of the
   * current row when no measure has that name.
   *
   * @param name
   *          the bracketed name, trimmed
   */
  record MeasureRef(String name) implements Expr {
    public MeasureRef {
      Objects.requireNonNull(name, "name");
    }

    @Override
    public String toString() {
      return "[" + name.replace("]", "]]") + "]";
    }
  }

  /**
   * Qualified column reference {@code Table[Column]}.
   *
   * @param table
   *          table name
   * @param column
   *          column name
   */
  record ColumnRef(String table, String column) implements Expr {
    public ColumnRef {
      Objects.requireNonNull(table, "table");
      Objects.requireNonNull(column, "column");
    }

    @Override
    public String toString() {
      return "'" + table.replace("'", "''") + "'[" + column.replace("]", "]]") + "]";
    }
  }

  /**
   * Function call.
   *
   * @param name
   *          function name as written
   * @param args
   *          arguments
   */
  record Call(String name, List<Expr> args) implements Expr {
    public Call {
      Objects.requireNonNull(name, "name");
      args = List.copyOf(args);
    }

    /**
     * Upper-cased function name used for dispatch.
     *
     * @return the normalized name
     */
    public String upperName() {
      return name.toUpperCase(Locale.ROOT);
    }

    @Override
    public String toString() {
      return name + "(" + args.stream().map(Object::toString).collect(Collectors.joining(", ")) + ")";
    }
  }

  /**
   * Unary minus.
   *
   * @param operand
   *          negated expression
   */
  record Negate(Expr operand) implements Expr {
    public Negate {
      Objects.requireNonNull(operand, "operand");
    }

    @Override
    public String toString() {
      return "-" + operand;
    }
  }

  /**
   * Binary operation.
   *
   * @param op
   *          the operator
   * @param left
   *          left operand
   * @param right
   *          right operand
   */
  record Binary(BinaryOperator op, Expr left, Expr right) implements Expr {
    public Binary {
      Objects.requireNonNull(op, "op");
      Objects.requireNonNull(left, "left");
      Objects.requireNonNull(right, "right");
    }

    @Override
    public String toString() {
      return "(" + left + " " + op.symbol() + " " + right + ")";
    }
  }
}
