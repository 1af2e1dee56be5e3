package se.alipsa.jdax.engine;

import java.util.List;
import java.util.Locale;
import java.util.Objects;
import se.alipsa.jdax.DaxException;
import se.alipsa.jdax.parser.BinaryOperator;
import se.alipsa.jdax.parser.Expr;
import se.alipsa.jdax.parser.Expr.Binary;
import se.alipsa.jdax.parser.Expr.Call;
import se.alipsa.jdax.parser.Expr.ColumnRef;
import se.alipsa.jdax.parser.Expr.TableName;
import se.alipsa.jdax.parser.Expr.TextLiteral;

/**
 * The shape of one {@code CALCULATE} filter argument, decided from its syntax
 * alone. {@link #classify(Expr)} rejects malformed arguments before anything is
 * evaluated.
 */
public sealed interface FilterArgument {

  /**
   * {@code USERELATIONSHIP(a, b)}: activate the relationship joining the two
   * columns.
   *
   * @param left
   *          one endpoint
   * @param right
   *          the other endpoint
   */
  record UseRelationship(ColumnRef left, ColumnRef right) implements FilterArgument {
  }

  /**
   * {@code CROSSFILTER(a, b, direction)}: override or disable a relationship.
   *
   * @param left
   *          left column as written
   * @param right
   *          right column as written
   * @param direction
   *          direction keyword, trimmed and upper-cased
   */
  record CrossFilter(ColumnRef left, ColumnRef right, String direction) implements FilterArgument {
  }

  /**
   * {@code ALL(Table)} or {@code REMOVEFILTERS(Table)}.
   *
   * @param table
   *          the table to clear
   */
  record ClearTable(String table) implements FilterArgument {
  }

  /**
   * {@code ALL(Table[Column])} or {@code REMOVEFILTERS(Table[Column])}.
   *
   * @param column
   *          the column to clear
   */
  record ClearColumn(ColumnRef column) implements FilterArgument {
  }

  /**
   * {@code ALLNOBLANKROW(Table)}: clear the table and hide its virtual blank
   * row.
   *
   * @param table
   *          the table
   */
  record NoBlankRowTable(String table) implements FilterArgument {
  }

  /**
   * {@code ALLNOBLANKROW(Table[Column])}: every non-blank value of the column.
   *
   * @param column
   *          the column
   */
  record NoBlankRowColumn(ColumnRef column) implements FilterArgument {
  }

  /**
   * {@code KEEPFILTERS(inner)}: intersect with existing filters instead of
   * replacing them.
   *
   * @param inner
   *          the wrapped argument
   */
  record KeepFilters(FilterArgument inner) implements FilterArgument {
  }

  /**
   * {@code Table[Column] op value}.
   *
   * @param column
   *          the filtered column
   * @param op
   *          a comparison operator
   * @param value
   *          the scalar compared against
   */
  record Comparison(ColumnRef column, BinaryOperator op, Expr value) implements FilterArgument {
  }

  /**
   * {@code VALUES(Table[Column])} or {@code DISTINCT(Table[Column])}.
   *
   * @param column
   *          the column
   */
  record ValueSet(ColumnRef column) implements FilterArgument {
  }

  /**
   * {@code TREATAS(VALUES(source), target)}.
   *
   * @param source
   *          column supplying the values
   * @param target
   *          column receiving them as a filter
   */
  record TreatAs(ColumnRef source, ColumnRef target) implements FilterArgument {
  }

  /**
   * A boolean predicate over the columns of one table, such as
   * {@code T[a] = 1 || T[b] > 2}.
   *
   * @param predicate
   *          the predicate
   */
  record BooleanFilter(Expr predicate) implements FilterArgument {
  }

  /**
   * Any other table expression; its rows become the filter.
   *
   * @param table
   *          the table expression
   */
  record TableFilter(Expr table) implements FilterArgument {
  }

  /**
   * Classify a filter argument.
   *
   * @param arg
   *          the argument expression
   * @return its shape
   * @throws DaxException
   *           of kind {@code TYPE} or {@code EVAL} for an argument no shape
   *           accepts
   */
  static FilterArgument classify(Expr arg) {
    Objects.requireNonNull(arg, "arg");
    if (arg instanceof TableName table) {
      return new TableFilter(table);
    }
    if (arg instanceof Binary binary) {
      return classifyBinary(binary);
    }
    if (!(arg instanceof Call call)) {
      throw DaxException.eval("unsupported CALCULATE filter argument " + arg);
    }
    List<Expr> args = call.args();
    switch (call.upperName()) {
      case "KEEPFILTERS":
        if (args.size() != 1) {
          throw DaxException.eval("KEEPFILTERS expects exactly 1 argument");
        }
        return new KeepFilters(classify(args.get(0)));
      case "USERELATIONSHIP":
        return useRelationship(call);
      case "CROSSFILTER":
        return crossFilter(call);
      case "ALL":
      case "REMOVEFILTERS": {
        Expr inner = single(call);
        if (inner instanceof TableName table) {
          return new ClearTable(table.name());
        }
        if (inner instanceof ColumnRef column) {
          return new ClearColumn(column);
        }
        throw DaxException.type(call.upperName() + " expects a table name or column reference, got " + inner);
      }
      case "ALLNOBLANKROW": {
        Expr inner = single(call);
        if (inner instanceof TableName table) {
          return new NoBlankRowTable(table.name());
        }
        if (inner instanceof ColumnRef column) {
          return new NoBlankRowColumn(column);
        }
        throw DaxException.type("ALLNOBLANKROW expects a table name or column reference, got " + inner);
      }
      case "NOT":
      case "AND":
      case "OR":
        return new BooleanFilter(call);
      case "TREATAS":
        return treatAs(call);
      case "VALUES":
      case "DISTINCT":
        if (args.size() == 1 && args.get(0) instanceof ColumnRef column) {
          return new ValueSet(column);
        }
        return new TableFilter(call);
      default:
        return new TableFilter(call);
    }
  }

  private static FilterArgument classifyBinary(Binary binary) {
    if (binary.op() == BinaryOperator.AND || binary.op() == BinaryOperator.OR) {
      return new BooleanFilter(binary);
    }
    if (!(binary.left() instanceof ColumnRef column)) {
      throw DaxException.eval("CALCULATE filter must be a column comparison");
    }
    if (!binary.op().isComparison()) {
      throw DaxException.eval("unsupported CALCULATE filter operator " + binary.op().symbol());
    }
    return new Comparison(column, binary.op(), binary.right());
  }

  private static Expr single(Call call) {
    if (call.args().size() != 1) {
      throw DaxException.eval(call.upperName() + " expects 1 argument");
    }
    return call.args().get(0);
  }

  /**
   * Parse a {@code USERELATIONSHIP} call.
   *
   * @param call
   *          the call
   * @return the argument
   */
  static UseRelationship useRelationship(Call call) {
    List<Expr> args = call.args();
    if (args.size() != 2) {
      throw DaxException.eval("USERELATIONSHIP expects 2 arguments");
    }
    if (!(args.get(0) instanceof ColumnRef left) || !(args.get(1) instanceof ColumnRef right)) {
      throw DaxException.type("USERELATIONSHIP expects column references");
    }
    return new UseRelationship(left, right);
  }

  /**
   * Parse a {@code CROSSFILTER} call. The direction may be a bare keyword or a
   * string.
   *
   * @param call
   *          the call
   * @return the argument
   */
  static CrossFilter crossFilter(Call call) {
    List<Expr> args = call.args();
    if (args.size() != 3) {
      throw DaxException.eval("CROSSFILTER expects 3 arguments");
    }
    if (!(args.get(0) instanceof ColumnRef left) || !(args.get(1) instanceof ColumnRef right)) {
      throw DaxException.type("CROSSFILTER expects column references");
    }
    String direction;
    if (args.get(2) instanceof TableName name) {
      direction = name.name();
    } else if (args.get(2) instanceof TextLiteral text) {
      direction = text.value();
    } else {
      throw DaxException.type("CROSSFILTER expects a direction identifier or string, got " + args.get(2));
    }
    return new CrossFilter(left, right, direction.trim().toUpperCase(Locale.ROOT));
  }

  private static TreatAs treatAs(Call call) {
    List<Expr> args = call.args();
    if (args.size() != 2) {
      throw DaxException.eval("TREATAS expects 2 arguments");
    }
    ColumnRef source = null;
    if (args.get(0) instanceof Call inner && ("VALUES".equals(inner.upperName())
        || "DISTINCT".equals(inner.upperName())) && inner.args().size() == 1
        && inner.args().get(0) instanceof ColumnRef ref) {
      source = ref;
    }
    if (source == null) {
      throw DaxException.type(
          "TREATAS currently only supports VALUES(column) or DISTINCT(column) as its first argument");
    }
    if (!(args.get(1) instanceof ColumnRef target)) {
      throw DaxException.type("TREATAS expects a target column reference as its second argument");
    }
    return new TreatAs(source, target);
  }
}
