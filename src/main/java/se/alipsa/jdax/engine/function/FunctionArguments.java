package se.alipsa.jdax.engine.function;

import java.util.List;
import se.alipsa.jdax.DaxException;
import se.alipsa.jdax.engine.FilterContext;
import se.alipsa.jdax.engine.RowContext;
import se.alipsa.jdax.engine.TableResult;
import se.alipsa.jdax.model.DataModel;
import se.alipsa.jdax.parser.Expr;
import se.alipsa.jdax.parser.Expr.Call;
import se.alipsa.jdax.parser.Expr.ColumnRef;
import se.alipsa.jdax.parser.Expr.TableName;
import se.alipsa.jdax.table.Table;
import se.alipsa.jdax.value.Value;

/**
 * The arguments of one function call together with the contexts they are
 * evaluated under. Arguments are evaluated lazily, on request, since many
 * functions interpret their arguments as column or table references rather
 * than values.
 */
public final class FunctionArguments {

  private final Call call;
  private final FilterContext filter;
  private final RowContext row;
  private final Evaluator evaluator;

  /**
   * Create arguments for a call.
   *
   * @param call
   *          the call expression
   * @param filter
   *          the filter context of the call
   * @param row
   *          the row context of the call
   * @param evaluator
   *          evaluation callback for the argument expressions
   */
  public FunctionArguments(Call call, FilterContext filter, RowContext row, Evaluator evaluator) {
    this.call = call;
    this.filter = filter;
    this.row = row;
    this.evaluator = evaluator;
  }

  /**
   * Upper-cased function name.
   *
   * @return the name used in error messages
   */
  public String name() {
    return call.upperName();
  }

  public List<Expr> expressions() {
    return call.args();
  }

  public Expr expression(int index) {
    return call.args().get(index);
  }

  public int size() {
    return call.args().size();
  }

  public FilterContext filter() {
    return filter;
  }

  public RowContext row() {
    return row;
  }

  public Evaluator evaluator() {
    return evaluator;
  }

  public DataModel model() {
    return evaluator.model();
  }

  /**
   * Evaluate an argument as a scalar under the call's contexts.
   *
   * @param index
   *          argument position
   * @return the value
   */
  public Value value(int index) {
    return evaluator.evaluate(expression(index), filter, row);
  }

  /**
   * Evaluate an argument as a table under the call's contexts.
   *
   * @param index
   *          argument position
   * @return the rows
   */
  public TableResult table(int index) {
    return evaluator.evaluateTable(expression(index), filter, row);
  }

  /**
   * Fail unless the call has exactly {@code count} arguments.
   *
   * @param count
   *          the required argument count
   */
  public void requireCount(int count) {
    if (size() != count) {
      throw DaxException.eval(name() + " expects " + count + (count == 1 ? " argument" : " arguments"));
    }
  }

  /**
   * Fail unless the argument count lies in {@code [min, max]}.
   *
   * @param min
   *          minimum count
   * @param max
   *          maximum count
   */
  public void requireRange(int min, int max) {
    if (size() < min || size() > max) {
      throw DaxException.eval(name() + " expects " + min + " to " + max + " arguments");
    }
  }

  /**
   * Fail unless the call has at least {@code min} arguments.
   *
   * @param min
   *          minimum count
   */
  public void requireAtLeast(int min) {
    if (size() < min) {
      throw DaxException.eval(name() + " expects at least " + min + (min == 1 ? " argument" : " arguments"));
    }
  }

  /**
   * An argument that must be written as a column reference.
   *
   * @param index
   *          argument position
   * @param message
   *          message of the {@code TYPE} error raised otherwise
   * @return the reference
   */
  public ColumnRef columnRef(int index, String message) {
    if (expression(index) instanceof ColumnRef ref) {
      return ref;
    }
    throw DaxException.type(message);
  }

  /**
   * An argument that must be written as a table name.
   *
   * @param index
   *          argument position
   * @param message
   *          message of the {@code TYPE} error raised otherwise
   * @return the table name
   */
  public TableName tableName(int index, String message) {
    if (expression(index) instanceof TableName ref) {
      return ref;
    }
    throw DaxException.type(message);
  }

  /**
   * A column resolved against the model.
   *
   * @param table
   *          the table holding the column
   * @param index
   *          column index within the table
   */
  public record BoundColumn(Table table, int index) {

    public String column() {
      return table.columns().get(index);
    }

    public String tableName() {
      return table.name();
    }
  }

  /**
   * Resolve a column reference.
   *
   * @param model
   *          the data model
   * @param ref
   *          the reference
   * @return the bound column
   * @throws DaxException
   *           of kind {@code UNKNOWN_TABLE} or {@code UNKNOWN_COLUMN}
   */
  public static BoundColumn bind(DataModel model, ColumnRef ref) {
    Table table = model.requireTable(ref.table());
    return new BoundColumn(table, table.requireColumn(ref.column()));
  }
}
