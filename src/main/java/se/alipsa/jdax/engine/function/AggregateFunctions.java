package se.alipsa.jdax.engine.function;

import java.util.BitSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.OptionalLong;
import java.util.Set;
import se.alipsa.jdax.DaxException;
import se.alipsa.jdax.engine.FilterContext;
import se.alipsa.jdax.engine.RowSetResolver;
import se.alipsa.jdax.engine.function.FunctionArguments.BoundColumn;
import se.alipsa.jdax.helper.DaxUtil;
import se.alipsa.jdax.model.DataModel;
import se.alipsa.jdax.parser.Expr;
import se.alipsa.jdax.parser.Expr.ColumnRef;
import se.alipsa.jdax.table.AggregationKind;
import se.alipsa.jdax.table.AggregationState;
import se.alipsa.jdax.table.Table;
import se.alipsa.jdax.value.Value;

/**
 * Column aggregations. These read the filter context only; a row context does
 * not restrict them unless a context transition turned it into filters first.
 *
 * <p>
 * When nothing is filtered the column statistics of an accelerated backend are
 * used where available, otherwise the allowed rows are scanned.
 * </p>
 */
public final class AggregateFunctions {

  private AggregateFunctions() {
    // Utility class
  }

  static Value sum(FunctionArguments args) {
    args.requireCount(1);
    BoundColumn col = column(args, "SUM");
    if (args.filter().isEmpty()) {
      OptionalDouble sum = col.table().backend().statsSum(col.index());
      OptionalLong count = col.table().backend().statsNumericCount(col.index());
      if (sum.isPresent() && count.isPresent()) {
        return count.getAsLong() == 0 ? Value.BLANK : Value.of(sum.getAsDouble());
      }
    }
    return scan(args, col, AggregationKind.SUM);
  }

  static Value average(FunctionArguments args) {
    args.requireCount(1);
    BoundColumn col = column(args, "AVERAGE");
    if (args.filter().isEmpty()) {
      OptionalDouble sum = col.table().backend().statsSum(col.index());
      OptionalLong count = col.table().backend().statsNumericCount(col.index());
      if (sum.isPresent() && count.isPresent()) {
        return count.getAsLong() == 0 ? Value.BLANK : Value.of(sum.getAsDouble() / count.getAsLong());
      }
    }
    return scan(args, col, AggregationKind.AVERAGE);
  }

  static Value min(FunctionArguments args) {
    args.requireCount(1);
    BoundColumn col = column(args, "MIN");
    if (args.filter().isEmpty()) {
      OptionalDouble min = col.table().backend().statsMin(col.index());
      if (min.isPresent()) {
        return Value.of(min.getAsDouble());
      }
    }
    return scan(args, col, AggregationKind.MIN);
  }

  static Value max(FunctionArguments args) {
    args.requireCount(1);
    BoundColumn col = column(args, "MAX");
    if (args.filter().isEmpty()) {
      OptionalDouble max = col.table().backend().statsMax(col.index());
      if (max.isPresent()) {
        return Value.of(max.getAsDouble());
      }
    }
    return scan(args, col, AggregationKind.MAX);
  }

  /**
   * {@code COUNT(col)}: the number of numeric values. Tables carry no column
   * types, so only the numeric-count statistic may stand in for a scan.
   *
   * @param args
   *          the call arguments
   * @return the count
   */
  static Value count(FunctionArguments args) {
    args.requireCount(1);
    BoundColumn col = column(args, "COUNT");
    if (args.filter().isEmpty()) {
      OptionalLong numbers = col.table().backend().statsNumericCount(col.index());
      if (numbers.isPresent()) {
        return Value.of(numbers.getAsLong());
      }
    }
    return scan(args, col, AggregationKind.COUNT_NUMBERS);
  }

  static Value countA(FunctionArguments args) {
    args.requireCount(1);
    BoundColumn col = column(args, "COUNTA");
    if (args.filter().isEmpty()) {
      OptionalLong nonBlank = col.table().backend().statsNonBlankCount(col.index());
      if (nonBlank.isPresent()) {
        return Value.of(nonBlank.getAsLong());
      }
    }
    return scan(args, col, AggregationKind.COUNT_NON_BLANK);
  }

  /**
   * {@code COUNTBLANK(col)}: blank cells among the allowed rows, plus one for
   * the virtual blank row when it is visible.
   *
   * @param args
   *          the call arguments
   * @return the count
   */
  static Value countBlank(FunctionArguments args) {
    args.requireCount(1);
    BoundColumn col = column(args, "COUNTBLANK");
    DataModel model = args.model();
    FilterContext filter = args.filter();
    Table table = col.table();
    long blanks;
    Map<String, BitSet> sets = null;
    if (filter.isEmpty()) {
      OptionalLong nonBlank = table.backend().statsNonBlankCount(col.index());
      if (nonBlank.isPresent()) {
        blanks = Math.max(0, table.rowCount() - nonBlank.getAsLong());
      } else {
        blanks = countBlanks(table, col.index(), null);
      }
    } else {
      sets = RowSetResolver.resolve(model, filter);
      blanks = countBlanks(table, col.index(), sets.get(DaxUtil.normalize(table.name())));
    }
    if (RowSetResolver.blankRowAllowed(filter, table.name())
        && RowSetResolver.virtualBlankRowExists(model, filter, table.name(), sets)) {
      blanks++;
    }
    return Value.of(blanks);
  }

  static Value countRows(FunctionArguments args) {
    args.requireCount(1);
    return Value.of(args.table(0).size());
  }

  /**
   * {@code DISTINCTCOUNT(col)}: distinct values including blank, where blank
   * also counts when only the virtual blank row supplies it.
   *
   * @param args
   *          the call arguments
   * @return the count
   */
  static Value distinctCount(FunctionArguments args) {
    args.requireCount(1);
    if (args.filter().isEmpty() && args.expression(0) instanceof ColumnRef ref) {
      BoundColumn col = FunctionArguments.bind(args.model(), ref);
      OptionalLong distinct = col.table().backend().statsDistinctCount(col.index());
      Optional<Boolean> hasBlank = col.table().backend().statsHasBlank(col.index());
      if (distinct.isPresent() && hasBlank.isPresent()) {
        long count = distinct.getAsLong();
        if (hasBlank.get()) {
          count++;
        } else if (RowSetResolver.virtualBlankRowExists(args.model(), args.filter(), col.tableName(),
            null)) {
          count++;
        }
        return Value.of(count);
      }
    }
    return Value.of(distinctColumnValues(args.model(), args.expression(0), args.filter()).size());
  }

  static Value distinctCountNoBlank(FunctionArguments args) {
    args.requireCount(1);
    ColumnRef ref = args.columnRef(0, "DISTINCTCOUNTNOBLANK expects a column reference");
    BoundColumn col = FunctionArguments.bind(args.model(), ref);
    if (args.filter().isEmpty()) {
      OptionalLong distinct = col.table().backend().statsDistinctCount(col.index());
      if (distinct.isPresent()) {
        return Value.of(distinct.getAsLong());
      }
    }
    BitSet rows = RowSetResolver.resolveTableRows(args.model(), args.filter(), col.tableName());
    Set<Value> seen = new LinkedHashSet<>();
    for (int row = rows.nextSetBit(0); row >= 0; row = rows.nextSetBit(row + 1)) {
      Value v = col.table().value(row, col.index());
      if (!v.isBlank()) {
        seen.add(v);
      }
    }
    return Value.of(seen.size());
  }

  static Value hasOneValue(FunctionArguments args) {
    args.requireCount(1);
    return Value.of(distinctColumnValues(args.model(), args.expression(0), args.filter()).size() == 1);
  }

  /**
   * {@code SELECTEDVALUE(col[, alternate])}: the only visible value of a column.
   *
   * @param args
   *          the call arguments
   * @return the value, the alternate result or blank
   */
  static Value selectedValue(FunctionArguments args) {
    args.requireRange(1, 2);
    Set<Value> values = distinctColumnValues(args.model(), args.expression(0), args.filter());
    if (values.size() == 1) {
      return values.iterator().next();
    }
    return args.size() == 2 ? args.value(1) : Value.BLANK;
  }

  /**
   * Distinct values of a column visible under a filter context. Blank is
   * included when a visible row holds it, or when the table's virtual blank row
   * is visible.
   *
   * @param model
   *          the data model
   * @param expr
   *          the column reference
   * @param filter
   *          the filter context
   * @return distinct values in first-seen order
   * @throws DaxException
   *           of kind {@code TYPE} when {@code expr} is not a column reference
   */
  public static Set<Value> distinctColumnValues(DataModel model, Expr expr, FilterContext filter) {
    if (!(expr instanceof ColumnRef ref)) {
      throw DaxException.type("expected a column reference, got " + expr);
    }
    BoundColumn col = FunctionArguments.bind(model, ref);
    Table table = col.table();
    Map<String, BitSet> sets = filter.isEmpty() ? null : RowSetResolver.resolve(model, filter);
    BitSet rows = sets == null ? null : sets.get(DaxUtil.normalize(table.name()));
    Set<Value> values = new LinkedHashSet<>();
    Optional<List<Value>> fast = table.backend().distinctValuesFiltered(col.index(), rows);
    if (fast.isPresent()) {
      values.addAll(fast.get());
    } else {
      BitSet scan = rows == null ? RowSetResolver.resolveTableRows(model, filter, table.name()) : rows;
      for (int row = scan.nextSetBit(0); row >= 0; row = scan.nextSetBit(row + 1)) {
        values.add(table.value(row, col.index()));
      }
    }
    if (!values.contains(Value.BLANK) && RowSetResolver.blankRowAllowed(filter, table.name())
        && RowSetResolver.virtualBlankRowExists(model, filter, table.name(), sets)) {
      values.add(Value.BLANK);
    }
    return values;
  }

  private static BoundColumn column(FunctionArguments args, String name) {
    ColumnRef ref = args.columnRef(0, name + " currently only supports a column reference");
    return FunctionArguments.bind(args.model(), ref);
  }

  private static Value scan(FunctionArguments args, BoundColumn col, AggregationKind kind) {
    BitSet rows = RowSetResolver.resolveTableRows(args.model(), args.filter(), col.tableName());
    AggregationState state = new AggregationState(kind);
    for (int row = rows.nextSetBit(0); row >= 0; row = rows.nextSetBit(row + 1)) {
      state.update(col.table().value(row, col.index()));
    }
    return state.result();
  }

  private static long countBlanks(Table table, int column, BitSet rows) {
    long blanks = 0;
    if (rows == null) {
      for (int row = 0; row < table.rowCount(); row++) {
        if (table.value(row, column).isBlank()) {
          blanks++;
        }
      }
      return blanks;
    }
    for (int row = rows.nextSetBit(0); row >= 0; row = rows.nextSetBit(row + 1)) {
      if (table.value(row, column).isBlank()) {
        blanks++;
      }
    }
    return blanks;
  }
}
