package se.alipsa.jdax.engine.function;

import java.util.List;
import se.alipsa.jdax.engine.FilterContext;
import se.alipsa.jdax.engine.RowContext;
import se.alipsa.jdax.engine.TableResult;
import se.alipsa.jdax.model.DataModel;
import se.alipsa.jdax.parser.Expr;
import se.alipsa.jdax.value.Value;

/**
 * Callback into the expression evaluator used by the function implementations
 * to evaluate their arguments.
 */
public interface Evaluator {

  DataModel model();

  /**
   * Evaluate a scalar expression.
   *
   * @param expr
   *          the expression
   * @param filter
   *          the filter context
   * @param row
   *          the row context
   * @return the value
   */
  Value evaluate(Expr expr, FilterContext filter, RowContext row);

  /**
   * Evaluate a table expression.
   *
   * @param expr
   *          the expression
   * @param filter
   *          the filter context
   * @param row
   *          the row context
   * @return the rows produced
   */
  TableResult evaluateTable(Expr expr, FilterContext filter, RowContext row);

  /**
   * Build the filter context {@code CALCULATE} evaluates its expression under:
   * context transition followed by the filter arguments.
   *
   * @param filter
   *          the ambient filter context
   * @param row
   *          the ambient row context
   * @param filterArgs
   *          the filter arguments
   * @return the new filter context
   */
  FilterContext calculateFilter(FilterContext filter, RowContext row, List<Expr> filterArgs);
}
