package se.alipsa.jdax.pivot;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import se.alipsa.jdax.DaxException;
import se.alipsa.jdax.helper.DaxUtil;
import se.alipsa.jdax.model.DataModel;
import se.alipsa.jdax.model.Measure;
import se.alipsa.jdax.parser.BinaryOperator;
import se.alipsa.jdax.parser.Expr;
import se.alipsa.jdax.parser.Expr.Call;
import se.alipsa.jdax.parser.Expr.ColumnRef;
import se.alipsa.jdax.parser.Expr.MeasureRef;
import se.alipsa.jdax.parser.Expr.NumberLiteral;
import se.alipsa.jdax.parser.Expr.TableName;
import se.alipsa.jdax.parser.Expr.TextLiteral;
import se.alipsa.jdax.table.AggregationKind;
import se.alipsa.jdax.table.AggregationSpec;
import se.alipsa.jdax.table.Table;
import se.alipsa.jdax.value.Value;

/**
 * Rewrites measure expressions into {@link PlannedExpr} trees over a shared
 * list of base-table aggregations. An expression that cannot be expressed this
 * way is reported as not plannable ({@code null}) and the pivot falls back to a
 * strategy using the general evaluator.
 */
final class MeasurePlanner {

  private final DataModel model;
  private final Table baseTable;
  private final int maxDepth;
  private final List<AggregationSpec> aggregations = new ArrayList<>();
  private final Map<AggregationSpec, Integer> aggregationIndex = new LinkedHashMap<>();
  private boolean usesAverage;

  MeasurePlanner(DataModel model, Table baseTable, int maxDepth) {
    this.model = model;
    this.baseTable = baseTable;
    this.maxDepth = maxDepth;
  }

  /**
   * Plan every measure.
   *
   * @param measures
   *          the measures
   * @return one plan per measure, or {@code null} when any is not plannable
   */
  List<PlannedExpr> planAll(List<PivotMeasure> measures) {
    List<PlannedExpr> plans = new ArrayList<>(measures.size());
    for (PivotMeasure measure : measures) {
      PlannedExpr plan = plan(measure.parsed(), 0);
      if (plan == null) {
        return null;
      }
      plans.add(plan);
    }
    return plans;
  }

  /**
   * The aggregations referenced by the plans so far, indexed by
   * {@link PlannedExpr.AggRef#index()}.
   *
   * @return the aggregation specs
   */
  List<AggregationSpec> aggregations() {
    return aggregations;
  }

  /**
   * Whether a planned measure averages a column. Dimension rollups do not
   * accept such plans.
   *
   * @return {@code true} when {@code AVERAGE} was planned
   */
  boolean usesAverage() {
    return usesAverage;
  }

  private int aggregation(AggregationKind kind, int column) {
    AggregationSpec spec = new AggregationSpec(kind, column);
    return aggregationIndex.computeIfAbsent(spec, s -> {
      aggregations.add(s);
      return aggregations.size() - 1;
    });
  }

  PlannedExpr plan(Expr expr, int depth) {
    if (depth > maxDepth) {
      return null;
    }
    if (expr instanceof NumberLiteral number) {
      return new PlannedExpr.Const(Value.of(number.value()));
    }
    if (expr instanceof TextLiteral text) {
      return new PlannedExpr.Const(Value.of(text.value()));
    }
    if (expr instanceof MeasureRef ref) {
      Measure measure = model.measure(ref.name());
      if (measure == null) {
        throw DaxException.unknownMeasure(ref.name());
      }
      return plan(measure.parsed(), depth + 1);
    }
    if (expr instanceof Expr.Negate negate) {
      PlannedExpr operand = plan(negate.operand(), depth + 1);
      return operand == null ? null : new PlannedExpr.Negate(operand);
    }
    if (expr instanceof Expr.Binary binary) {
      PlannedExpr left = plan(binary.left(), depth + 1);
      PlannedExpr right = left == null ? null : plan(binary.right(), depth + 1);
      return right == null ? null : new PlannedExpr.Binary(binary.op(), left, right);
    }
    if (expr instanceof Call call) {
      return planCall(call, depth);
    }
    return null;
  }

  private PlannedExpr planCall(Call call, int depth) {
    List<Expr> args = call.args();
    switch (call.upperName()) {
      case "BLANK":
        return args.isEmpty() ? new PlannedExpr.Const(Value.BLANK) : null;
      case "TRUE":
        return args.isEmpty() ? new PlannedExpr.Const(Value.of(true)) : null;
      case "FALSE":
        return args.isEmpty() ? new PlannedExpr.Const(Value.of(false)) : null;
      case "ISBLANK": {
        PlannedExpr operand = args.size() == 1 ? plan(args.get(0), depth + 1) : null;
        return operand == null ? null : new PlannedExpr.IsBlank(operand);
      }
      case "NOT": {
        PlannedExpr operand = args.size() == 1 ? plan(args.get(0), depth + 1) : null;
        return operand == null ? null : new PlannedExpr.Not(operand);
      }
      case "AND":
      case "OR": {
        if (args.size() != 2) {
          return null;
        }
        PlannedExpr left = plan(args.get(0), depth + 1);
        PlannedExpr right = left == null ? null : plan(args.get(1), depth + 1);
        BinaryOperator op = "AND".equals(call.upperName()) ? BinaryOperator.AND : BinaryOperator.OR;
        return right == null ? null : new PlannedExpr.Binary(op, left, right);
      }
      case "IF": {
        List<PlannedExpr> planned = planArgs(args, 2, 3, depth);
        if (planned == null) {
          return null;
        }
        return new PlannedExpr.If(planned.get(0), planned.get(1), planned.size() == 3 ? planned.get(2) : null);
      }
      case "DIVIDE": {
        List<PlannedExpr> planned = planArgs(args, 2, 3, depth);
        if (planned == null) {
          return null;
        }
        return new PlannedExpr.Divide(planned.get(0), planned.get(1), planned.size() == 3 ? planned.get(2) : null);
      }
      case "COALESCE": {
        List<PlannedExpr> planned = planArgs(args, 1, Integer.MAX_VALUE, depth);
        return planned == null ? null : new PlannedExpr.Coalesce(planned);
      }
      case "AVERAGE": {
        // SUM / COUNT keeps the plan composable when groups are rolled up
        int column = baseColumn(args);
        if (column < 0) {
          return null;
        }
        usesAverage = true;
        return new PlannedExpr.Divide(new PlannedExpr.AggRef(aggregation(AggregationKind.SUM, column)),
            new PlannedExpr.AggRef(aggregation(AggregationKind.COUNT_NUMBERS, column)), null);
      }
      case "SUM":
        return columnAggregation(args, AggregationKind.SUM);
      case "MIN":
        return columnAggregation(args, AggregationKind.MIN);
      case "MAX":
        return columnAggregation(args, AggregationKind.MAX);
      case "COUNT":
        return columnAggregation(args, AggregationKind.COUNT_NUMBERS);
      case "COUNTA":
        return columnAggregation(args, AggregationKind.COUNT_NON_BLANK);
      case "DISTINCTCOUNT":
        return columnAggregation(args, AggregationKind.DISTINCT_COUNT);
      case "COUNTBLANK": {
        int column = baseColumn(args);
        if (column < 0) {
          return null;
        }
        return new PlannedExpr.Binary(BinaryOperator.SUBTRACT,
            new PlannedExpr.AggRef(aggregation(AggregationKind.COUNT_ROWS, -1)),
            new PlannedExpr.AggRef(aggregation(AggregationKind.COUNT_NON_BLANK, column)));
      }
      case "COUNTROWS":
        if (args.size() == 1 && args.get(0) instanceof TableName table && isBaseTable(table.name())) {
          return new PlannedExpr.AggRef(aggregation(AggregationKind.COUNT_ROWS, -1));
        }
        return null;
      default:
        return null;
    }
  }

  private List<PlannedExpr> planArgs(List<Expr> args, int min, int max, int depth) {
    if (args.size() < min || args.size() > max) {
      return null;
    }
    List<PlannedExpr> planned = new ArrayList<>(args.size());
    for (Expr arg : args) {
      PlannedExpr p = plan(arg, depth + 1);
      if (p == null) {
        return null;
      }
      planned.add(p);
    }
    return planned;
  }

  private PlannedExpr columnAggregation(List<Expr> args, AggregationKind kind) {
    int column = baseColumn(args);
    return column < 0 ? null : new PlannedExpr.AggRef(aggregation(kind, column));
  }

  /** Index of the single base-table column argument, or -1. */
  private int baseColumn(List<Expr> args) {
    if (args.size() != 1 || !(args.get(0) instanceof ColumnRef ref) || !isBaseTable(ref.table())) {
      return -1;
    }
    return baseTable.requireColumn(ref.column());
  }

  private boolean isBaseTable(String table) {
    return DaxUtil.normalize(table).equals(DaxUtil.normalize(baseTable.name()));
  }
}
