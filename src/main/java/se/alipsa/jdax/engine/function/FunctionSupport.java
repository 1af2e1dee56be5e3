package se.alipsa.jdax.engine.function;

import java.util.List;
import se.alipsa.jdax.DaxException;
import se.alipsa.jdax.engine.FilterContext;
import se.alipsa.jdax.engine.RowContext;
import se.alipsa.jdax.engine.TableResult;
import se.alipsa.jdax.parser.Expr;
import se.alipsa.jdax.parser.Expr.Call;
import se.alipsa.jdax.table.AggregationKind;
import se.alipsa.jdax.value.Value;

/**
 * Central dispatch for evaluating function calls, in scalar and in table
 * position.
 */
public final class FunctionSupport {

  private final Evaluator evaluator;

  /**
   * Create a new function support instance.
   *
   * @param evaluator
   *          evaluator used to resolve argument expressions
   */
  public FunctionSupport(Evaluator evaluator) {
    this.evaluator = evaluator;
  }

  /**
   * Evaluate a call whose result is a scalar.
   *
   * @param call
   *          the call
   * @param filter
   *          the filter context
   * @param row
   *          the row context
   * @return the value
   * @throws DaxException
   *           of kind {@code EVAL} for an unknown function
   */
  public Value evaluate(Call call, FilterContext filter, RowContext row) {
    FunctionArguments args = new FunctionArguments(call, filter, row, evaluator);
    return switch (call.upperName()) {
      case "TRUE" -> ScalarFunctions.constant(args, Value.of(true));
      case "FALSE" -> ScalarFunctions.constant(args, Value.of(false));
      case "BLANK" -> ScalarFunctions.constant(args, Value.BLANK);
      case "ISBLANK" -> ScalarFunctions.isBlank(args);
      case "IF" -> ScalarFunctions.ifFunction(args);
      case "SWITCH" -> ScalarFunctions.switchFunction(args);
      case "DIVIDE" -> ScalarFunctions.divide(args);
      case "COALESCE" -> ScalarFunctions.coalesce(args);
      case "NOT" -> ScalarFunctions.not(args);
      case "AND" -> ScalarFunctions.and(args);
      case "OR" -> ScalarFunctions.or(args);
      case "SUM" -> AggregateFunctions.sum(args);
      case "AVERAGE" -> AggregateFunctions.average(args);
      case "MIN" -> AggregateFunctions.min(args);
      case "MAX" -> AggregateFunctions.max(args);
      case "COUNT" -> AggregateFunctions.count(args);
      case "COUNTA" -> AggregateFunctions.countA(args);
      case "COUNTBLANK" -> AggregateFunctions.countBlank(args);
      case "COUNTROWS" -> AggregateFunctions.countRows(args);
      case "DISTINCTCOUNT" -> AggregateFunctions.distinctCount(args);
      case "DISTINCTCOUNTNOBLANK" -> AggregateFunctions.distinctCountNoBlank(args);
      case "HASONEVALUE" -> AggregateFunctions.hasOneValue(args);
      case "SELECTEDVALUE" -> AggregateFunctions.selectedValue(args);
      case "SUMX" -> IteratorFunctions.aggregate(args, AggregationKind.SUM);
      case "AVERAGEX" -> IteratorFunctions.aggregate(args, AggregationKind.AVERAGE);
      case "MINX" -> IteratorFunctions.aggregate(args, AggregationKind.MIN);
      case "MAXX" -> IteratorFunctions.aggregate(args, AggregationKind.MAX);
      case "COUNTX" -> IteratorFunctions.aggregate(args, AggregationKind.COUNT_NON_BLANK);
      case "CONCATENATEX" -> IteratorFunctions.concatenateX(args);
      case "RELATED" -> LookupFunctions.related(args);
      case "LOOKUPVALUE" -> LookupFunctions.lookupValue(args);
      case "CONTAINSROW" -> LookupFunctions.containsRow(args);
      case "EARLIER" -> LookupFunctions.earlier(args);
      case "EARLIEST" -> LookupFunctions.earliest(args);
      case "CALCULATE" -> calculate(args);
      default -> throw DaxException.eval("unsupported function " + call.upperName());
    };
  }

  /**
   * Evaluate a call whose result is a table.
   *
   * @param call
   *          the call
   * @param filter
   *          the filter context
   * @param row
   *          the row context
   * @return the rows
   * @throws DaxException
   *           of kind {@code EVAL} for an unknown table function
   */
  public TableResult evaluateTable(Call call, FilterContext filter, RowContext row) {
    FunctionArguments args = new FunctionArguments(call, filter, row, evaluator);
    return switch (call.upperName()) {
      case "FILTER" -> TableFunctions.filter(args);
      case "ALL", "REMOVEFILTERS" -> TableFunctions.all(args);
      case "ALLNOBLANKROW" -> TableFunctions.allNoBlankRow(args);
      case "VALUES", "DISTINCT" -> TableFunctions.values(args);
      case "ALLEXCEPT" -> TableFunctions.allExcept(args);
      case "CALCULATETABLE" -> TableFunctions.calculateTable(args);
      case "RELATEDTABLE" -> TableFunctions.relatedTable(args);
      default -> throw DaxException.eval("unsupported table function " + call.upperName());
    };
  }

  /**
   * {@code CALCULATE(expr, filters...)}. Measures referenced directly by
   * {@code expr} do not transition again, since the filter context already holds
   * the transitioned row.
   *
   * @param args
   *          the call arguments
   * @return the value of {@code expr}
   */
  private Value calculate(FunctionArguments args) {
    args.requireAtLeast(1);
    List<Expr> filterArgs = args.expressions().subList(1, args.size());
    FilterContext filter = evaluator.calculateFilter(args.filter(), args.row(), filterArgs)
        .withTransitionSuppressed(true);
    return evaluator.evaluate(args.expression(0), filter, args.row());
  }
}
