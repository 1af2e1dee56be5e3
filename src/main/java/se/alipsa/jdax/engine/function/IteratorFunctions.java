package se.alipsa.jdax.engine.function;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import se.alipsa.jdax.DaxException;
import se.alipsa.jdax.engine.FilterContext;
import se.alipsa.jdax.engine.RowContext;
import se.alipsa.jdax.engine.TableResult;
import se.alipsa.jdax.parser.Expr;
import se.alipsa.jdax.parser.Expr.TableName;
import se.alipsa.jdax.table.AggregationKind;
import se.alipsa.jdax.table.AggregationState;
import se.alipsa.jdax.value.Coercions;
import se.alipsa.jdax.value.Value;
import se.alipsa.jdax.value.Value.NumberValue;
import se.alipsa.jdax.value.Value.TextValue;

/**
 * Row iterators: {@code SUMX}, {@code AVERAGEX}, {@code MINX}, {@code MAXX},
 * {@code COUNTX} and {@code CONCATENATEX}. The per-row expression sees each row
 * of the table argument as the innermost row context.
 */
public final class IteratorFunctions {

  private IteratorFunctions() {
    // Utility class
  }

  /**
   * Push one row of a table result onto a row context, exposing only the
   * columns the result makes visible.
   *
   * @param base
   *          the enclosing row context
   * @param result
   *          the table result
   * @param row
   *          the row index within the table
   * @return the extended row context
   */
  static RowContext pushRow(RowContext base, TableResult result, int row) {
    return base.push(result.table(), row, result.visibleColumns());
  }

  /**
   * Filter context for expressions evaluated per row. A measure referenced
   * there transitions the new row even inside {@code CALCULATE}.
   *
   * @param filter
   *          the enclosing filter context
   * @return the filter context for row expressions
   */
  static FilterContext rowFilter(FilterContext filter) {
    return filter.withTransitionSuppressed(false);
  }

  static Value aggregate(FunctionArguments args, AggregationKind kind) {
    args.requireCount(2);
    TableResult table = args.table(0);
    Expr expr = args.expression(1);
    FilterContext filter = rowFilter(args.filter());
    AggregationState state = new AggregationState(kind);
    for (int row : table.rows()) {
      Value v = args.evaluator().evaluate(expr, filter, pushRow(args.row(), table, row));
      if (kind != AggregationKind.COUNT_NON_BLANK && !(v instanceof NumberValue) && !v.isBlank()) {
        throw DaxException.type("iterator expected numeric expression, got " + Coercions.describe(v));
      }
      state.update(v);
    }
    return state.result();
  }

  /**
   * {@code CONCATENATEX(table, expr[, delimiter[, orderBy[, ASC|DESC]]])}.
   * When any sort key is text all keys sort as text, case-insensitively with a
   * case-sensitive tiebreak; otherwise keys must be finite numbers.
   *
   * @param args
   *          the call arguments
   * @return the joined text
   */
  static Value concatenateX(FunctionArguments args) {
    args.requireRange(2, 5);
    String delimiter = args.size() >= 3 ? Coercions.toText(args.value(2)) : "";
    TableResult table = args.table(0);
    boolean descending = args.size() == 5 && descending(args);
    FilterContext filter = rowFilter(args.filter());
    Expr textExpr = args.expression(1);

    List<String> texts = new ArrayList<>(table.size());
    if (args.size() < 4) {
      for (int row : table.rows()) {
        texts.add(Coercions.toText(args.evaluator().evaluate(textExpr, filter, pushRow(args.row(), table, row))));
      }
      return Value.of(String.join(delimiter, texts));
    }

    Expr orderExpr = args.expression(3);
    List<Value> keys = new ArrayList<>(table.size());
    boolean sawText = false;
    for (int row : table.rows()) {
      RowContext rowCtx = pushRow(args.row(), table, row);
      texts.add(Coercions.toText(args.evaluator().evaluate(textExpr, filter, rowCtx)));
      Value key = args.evaluator().evaluate(orderExpr, filter, rowCtx);
      sawText |= key instanceof TextValue;
      keys.add(key);
    }

    List<Integer> order = new ArrayList<>(texts.size());
    for (int i = 0; i < texts.size(); i++) {
      order.add(i);
    }
    Comparator<Integer> cmp;
    if (sawText) {
      List<String> textKeys = keys.stream().map(Coercions::toText).toList();
      cmp = Comparator.comparing(textKeys::get, String.CASE_INSENSITIVE_ORDER);
      cmp = cmp.thenComparing(textKeys::get);
    } else {
      double[] numericKeys = new double[keys.size()];
      for (int i = 0; i < keys.size(); i++) {
        double n = Coercions.toNumber(keys.get(i));
        if (!Double.isFinite(n)) {
          throw DaxException.eval("CONCATENATEX order_by_expr must return a finite number");
        }
        numericKeys[i] = n;
      }
      cmp = Comparator.comparingDouble(i -> numericKeys[i]);
    }
    order.sort(descending ? cmp.reversed() : cmp);

    List<String> sorted = new ArrayList<>(texts.size());
    for (int i : order) {
      sorted.add(texts.get(i));
    }
    return Value.of(String.join(delimiter, sorted));
  }

  private static boolean descending(FunctionArguments args) {
    String order;
    if (args.expression(4) instanceof TableName name) {
      // ASC and DESC parse as bare identifiers
      order = name.name();
    } else {
      order = Coercions.toText(args.value(4));
    }
    return switch (order.toUpperCase(Locale.ROOT)) {
      case "ASC" -> false;
      case "DESC" -> true;
      default -> throw DaxException.eval("CONCATENATEX order must be ASC or DESC, got " + order);
    };
  }
}
