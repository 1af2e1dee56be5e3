package se.alipsa.jdax.engine;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import se.alipsa.jdax.DaxException;
import se.alipsa.jdax.engine.RowContext.Frame;
import se.alipsa.jdax.engine.function.Evaluator;
import se.alipsa.jdax.engine.function.FunctionSupport;
import se.alipsa.jdax.engine.function.TableFunctions;
import se.alipsa.jdax.helper.DaxUtil;
import se.alipsa.jdax.model.DataModel;
import se.alipsa.jdax.model.Measure;
import se.alipsa.jdax.parser.BinaryOperator;
import se.alipsa.jdax.parser.DaxParser;
import se.alipsa.jdax.parser.Expr;
import se.alipsa.jdax.parser.Expr.Binary;
import se.alipsa.jdax.parser.Expr.Call;
import se.alipsa.jdax.parser.Expr.ColumnRef;
import se.alipsa.jdax.parser.Expr.MeasureRef;
import se.alipsa.jdax.parser.Expr.Negate;
import se.alipsa.jdax.parser.Expr.NumberLiteral;
import se.alipsa.jdax.parser.Expr.TableName;
import se.alipsa.jdax.parser.Expr.TextLiteral;
import se.alipsa.jdax.table.Table;
import se.alipsa.jdax.value.Coercions;
import se.alipsa.jdax.value.Value;

/**
 * Evaluates expressions against a {@link DataModel} under a filter context and
 * a row context.
 *
 * <p>
 * The engine itself is stateless and may be shared between threads as long as
 * the model is not mutated concurrently. Each top level call gets its own
 * evaluation state holding the recursion depth of nested measure calls.
 * </p>
 */
public final class DaxEngine {

  private static final Logger log = LoggerFactory.getLogger(DaxEngine.class);

  private final Options options;

  /** Create an engine with default options. */
  public DaxEngine() {
    this(Options.defaults());
  }

  /**
   * Create an engine.
   *
   * @param options
   *          engine settings
   */
  public DaxEngine(Options options) {
    this.options = Objects.requireNonNull(options, "options");
  }

  /**
   * Parse and evaluate an expression.
   *
   * @param model
   *          the data model
   * @param expression
   *          expression text
   * @param filter
   *          the filter context
   * @param row
   *          the row context
   * @return the value
   * @throws DaxException
   *           when parsing or evaluation fails
   */
  public Value evaluate(DataModel model, String expression, FilterContext filter, RowContext row) {
    return evaluateExpr(model, DaxParser.parse(expression), filter, row);
  }

  /**
   * Evaluate a parsed expression.
   *
   * @param model
   *          the data model
   * @param expr
   *          the expression
   * @param filter
   *          the filter context
   * @param row
   *          the row context
   * @return the value
   */
  public Value evaluateExpr(DataModel model, Expr expr, FilterContext filter, RowContext row) {
    Objects.requireNonNull(model, "model");
    return new Evaluation(model).evaluate(expr, filter, row);
  }

  /**
   * Evaluate a registered measure with an empty row context.
   *
   * @param model
   *          the data model
   * @param name
   *          measure name, with or without brackets
   * @param filter
   *          the filter context
   * @return the value
   * @throws DaxException
   *           {@code UNKNOWN_MEASURE} when no such measure exists
   */
  public Value evaluateMeasure(DataModel model, String name, FilterContext filter) {
    Objects.requireNonNull(model, "model");
    Measure measure = model.measure(name);
    if (measure == null) {
      throw DaxException.unknownMeasure(name);
    }
    if (log.isDebugEnabled()) {
      log.debug("Evaluating measure [{}] under {}", measure.name(), filter);
    }
    return new Evaluation(model).evaluateMeasure(measure, filter);
  }

  /**
   * Apply {@code CALCULATE} style filter arguments to a filter context, as if
   * they were the filter arguments of a {@code CALCULATE} call evaluated with
   * no row context.
   *
   * @param model
   *          the data model
   * @param base
   *          the starting filter context
   * @param filterArgs
   *          filter argument expressions
   * @return the modified filter context
   */
  public FilterContext applyCalculateFilters(DataModel model, FilterContext base, String... filterArgs) {
    Objects.requireNonNull(model, "model");
    List<Expr> args = Arrays.stream(filterArgs).map(DaxParser::parse).toList();
    return new Evaluation(model).calculateFilter(base, RowContext.empty(), args);
  }

  /**
   * Engine settings.
   *
   * @return the options in use
   */
  public Options options() {
    return options;
  }

  /** State of one top level evaluation. */
  private final class Evaluation implements Evaluator {

    private final DataModel model;
    private final FunctionSupport functions;
    private final CalculateFilters calculateFilters;
    private int depth;

    Evaluation(DataModel model) {
      this.model = model;
      this.functions = new FunctionSupport(this);
      this.calculateFilters = new CalculateFilters(this);
    }

    @Override
    public DataModel model() {
      return model;
    }

    @Override
    public Value evaluate(Expr expr, FilterContext filter, RowContext row) {
      if (expr instanceof NumberLiteral number) {
        return Value.of(number.value());
      }
      if (expr instanceof TextLiteral text) {
        return Value.of(text.value());
      }
      if (expr instanceof TableName table) {
        throw DaxException.type("table " + table.name() + " used in scalar context");
      }
      if (expr instanceof MeasureRef ref) {
        return measureRef(ref, filter, row);
      }
      if (expr instanceof ColumnRef ref) {
        Frame frame = row.frameFor(ref.table());
        if (frame == null) {
          throw DaxException.eval("no row context for " + DaxUtil.columnRef(ref.table(), ref.column()));
        }
        return frame.read(frame.table().requireColumn(ref.column()));
      }
      if (expr instanceof Call call) {
        return functions.evaluate(call, filter, row);
      }
      if (expr instanceof Negate negate) {
        return Value.of(-Coercions.toNumber(evaluate(negate.operand(), filter, row)));
      }
      if (expr instanceof Binary binary) {
        return binary(binary, filter, row);
      }
      throw DaxException.eval("unsupported expression " + expr);
    }

    private Value binary(Binary binary, FilterContext filter, RowContext row) {
      Value left = evaluate(binary.left(), filter, row);
      if (binary.op() == BinaryOperator.AND) {
        return Value.of(Coercions.truthy(left) && Coercions.truthy(evaluate(binary.right(), filter, row)));
      }
      if (binary.op() == BinaryOperator.OR) {
        return Value.of(Coercions.truthy(left) || Coercions.truthy(evaluate(binary.right(), filter, row)));
      }
      return Operators.apply(binary.op(), left, evaluate(binary.right(), filter, row));
    }

    /**
     * A bracketed name is a measure when one is registered, otherwise a column
     * of the innermost row.
     */
    private Value measureRef(MeasureRef ref, FilterContext filter, RowContext row) {
      Measure measure = model.measure(ref.name());
      if (measure != null) {
        FilterContext effective = filter;
        if (!row.isEmpty() && !filter.isTransitionSuppressed()) {
          effective = CalculateFilters.contextTransition(filter, row);
        }
        return evaluateMeasure(measure, effective);
      }
      Frame frame = row.current();
      if (frame == null) {
        throw DaxException.unknownMeasure(ref.name());
      }
      int column = frame.table().columnIndex(ref.name());
      if (column < 0) {
        throw DaxException.eval("unknown measure [" + ref.name() + "] and no column "
            + DaxUtil.columnRef(frame.table().name(), ref.name()));
      }
      return frame.read(column);
    }

    Value evaluateMeasure(Measure measure, FilterContext filter) {
      if (depth >= options.maxRecursionDepth()) {
        throw DaxException.eval("maximum measure recursion depth " + options.maxRecursionDepth()
            + " exceeded while evaluating [" + measure.name() + "]");
      }
      depth++;
      try {
        return evaluate(measure.parsed(), filter.withTransitionSuppressed(false), RowContext.empty());
      } finally {
        depth--;
      }
    }

    @Override
    public TableResult evaluateTable(Expr expr, FilterContext filter, RowContext row) {
      if (expr instanceof TableName name) {
        return TableFunctions.tableRows(model, filter, name.name());
      }
      if (expr instanceof Call call) {
        return functions.evaluateTable(call, filter, row);
      }
      throw DaxException.type("expression " + expr + " cannot be evaluated as a table");
    }

    @Override
    public FilterContext calculateFilter(FilterContext filter, RowContext row, List<Expr> filterArgs) {
      FilterContext transitioned = CalculateFilters.contextTransition(filter.withTransitionSuppressed(false), row);
      return calculateFilters.apply(transitioned, row, filterArgs);
    }
  }

  /** Engine settings. */
  public static final class Options {

    private final int maxRecursionDepth;

    private Options(Builder builder) {
      this.maxRecursionDepth = builder.maxRecursionDepth;
    }

    public static Options defaults() {
      return builder().build();
    }

    public static Builder builder() {
      return new Builder();
    }

    /**
     * How deeply measures may call other measures before evaluation fails.
     *
     * @return the limit
     */
    public int maxRecursionDepth() {
      return maxRecursionDepth;
    }

    /** Builder for {@link Options}. */
    public static final class Builder {
      private int maxRecursionDepth = 64;

      private Builder() {
      }

      public Builder maxRecursionDepth(int depth) {
        if (depth < 1) {
          throw new IllegalArgumentException("maxRecursionDepth must be positive: " + depth);
        }
        this.maxRecursionDepth = depth;
        return this;
      }

      public Options build() {
        return new Options(this);
      }
    }
  }
}
