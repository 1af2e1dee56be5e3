package se.alipsa.jdax.engine;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;
import java.util.Set;
import java.util.TreeSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import se.alipsa.jdax.DaxException;
import se.alipsa.jdax.engine.FilterArgument.BooleanFilter;
import se.alipsa.jdax.engine.FilterArgument.ClearColumn;
import se.alipsa.jdax.engine.FilterArgument.ClearTable;
import se.alipsa.jdax.engine.FilterArgument.Comparison;
import se.alipsa.jdax.engine.FilterArgument.CrossFilter;
import se.alipsa.jdax.engine.FilterArgument.KeepFilters;
import se.alipsa.jdax.engine.FilterArgument.NoBlankRowColumn;
import se.alipsa.jdax.engine.FilterArgument.NoBlankRowTable;
import se.alipsa.jdax.engine.FilterArgument.TableFilter;
import se.alipsa.jdax.engine.FilterArgument.TreatAs;
import se.alipsa.jdax.engine.FilterArgument.UseRelationship;
import se.alipsa.jdax.engine.FilterArgument.ValueSet;
import se.alipsa.jdax.engine.RowContext.Frame;
import se.alipsa.jdax.engine.function.AggregateFunctions;
import se.alipsa.jdax.engine.function.Evaluator;
import se.alipsa.jdax.engine.function.FunctionArguments;
import se.alipsa.jdax.engine.function.FunctionArguments.BoundColumn;
import se.alipsa.jdax.helper.DaxUtil;
import se.alipsa.jdax.model.DataModel;
import se.alipsa.jdax.model.Relationship;
import se.alipsa.jdax.parser.BinaryOperator;
import se.alipsa.jdax.parser.Expr;
import se.alipsa.jdax.parser.Expr.Binary;
import se.alipsa.jdax.parser.Expr.Call;
import se.alipsa.jdax.parser.Expr.ColumnRef;
import se.alipsa.jdax.parser.Expr.Negate;
import se.alipsa.jdax.table.Table;
import se.alipsa.jdax.value.Coercions;
import se.alipsa.jdax.value.Value;

/**
 * Builds the filter context of a {@code CALCULATE} call from its filter
 * arguments.
 *
 * <p>
 * Relationship modifiers ({@code USERELATIONSHIP}, {@code CROSSFILTER}) are
 * applied first, wherever they appear inside the arguments. Every other
 * argument is then evaluated against that same context, so arguments do not
 * see each other's effects and their order does not matter. The collected
 * effects are applied last: table clears, column clears, row filters, column
 * filters.
 * </p>
 */
final class CalculateFilters {

  private static final Logger log = LoggerFactory.getLogger(CalculateFilters.class);

  private final Evaluator evaluator;

  CalculateFilters(Evaluator evaluator) {
    this.evaluator = evaluator;
  }

  /**
   * Promote a row context into equality filters. For each table only the
   * innermost frame counts. A frame exposing every column replaces all filters
   * on its table; a frame restricted to some columns replaces the filters of
   * those columns only.
   *
   * @param filter
   *          the filter context to extend
   * @param row
   *          the row context
   * @return the transitioned filter context
   */
  static FilterContext contextTransition(FilterContext filter, RowContext row) {
    FilterContext result = filter;
    Set<String> seen = new HashSet<>();
    List<Frame> frames = row.frames();
    for (int i = frames.size() - 1; i >= 0; i--) {
      Frame frame = frames.get(i);
      Table table = frame.table();
      if (!seen.add(DaxUtil.normalize(table.name()))) {
        continue;
      }
      if (frame.visibleColumns() == null) {
        result = result.withoutTable(table.name());
      }
      List<String> columns = table.columns();
      for (int c = 0; c < columns.size(); c++) {
        if (frame.isColumnVisible(c)) {
          result = result.withColumnEquals(table.name(), columns.get(c), table.value(frame.row(), c));
        }
      }
    }
    return result;
  }

  /**
   * Apply filter arguments to a filter context.
   *
   * @param base
   *          the context after context transition
   * @param row
   *          the ambient row context
   * @param args
   *          the filter arguments
   * @return the resulting filter context
   */
  FilterContext apply(FilterContext base, RowContext row, List<Expr> args) {
    FilterContext filter = base;
    for (Expr arg : args) {
      filter = applyRelationshipModifiers(filter, arg);
    }
    Effects effects = new Effects();
    for (Expr arg : args) {
      collect(FilterArgument.classify(arg), false, filter, row, effects);
    }
    FilterContext result = effects.applyTo(filter);
    if (log.isDebugEnabled()) {
      log.debug("CALCULATE filter arguments {} turned {} into {}", args, base, result);
    }
    return result;
  }

  private FilterContext applyRelationshipModifiers(FilterContext filter, Expr expr) {
    FilterContext result = filter;
    if (expr instanceof Call call) {
      String name = call.upperName();
      if ("USERELATIONSHIP".equals(name)) {
        result = useRelationship(result, FilterArgument.useRelationship(call));
      } else if ("CROSSFILTER".equals(name)) {
        result = crossFilter(result, FilterArgument.crossFilter(call));
      }
      for (Expr arg : call.args()) {
        result = applyRelationshipModifiers(result, arg);
      }
    } else if (expr instanceof Binary binary) {
      result = applyRelationshipModifiers(result, binary.left());
      result = applyRelationshipModifiers(result, binary.right());
    } else if (expr instanceof Negate negate) {
      result = applyRelationshipModifiers(result, negate.operand());
    }
    return result;
  }

  private FilterContext useRelationship(FilterContext filter, UseRelationship arg) {
    int index = relationshipIndex(arg.left(), arg.right());
    return filter.withActivatedRelationship(index);
  }

  private FilterContext crossFilter(FilterContext filter, CrossFilter arg) {
    int index = relationshipIndex(arg.left(), arg.right());
    Relationship rel = evaluator.model().relationship(index).relationship();
    RelationshipOverride override = switch (arg.direction()) {
      case "BOTH" -> RelationshipOverride.BOTH;
      case "ONEWAY", "SINGLE" -> RelationshipOverride.SINGLE;
      case "NONE" -> RelationshipOverride.DISABLED;
      case "ONEWAY_LEFTFILTERSRIGHT" -> oneWay(rel, arg.left(), arg.right(), arg.direction());
      case "ONEWAY_RIGHTFILTERSLEFT" -> oneWay(rel, arg.right(), arg.left(), arg.direction());
      default -> throw DaxException.eval("unsupported CROSSFILTER direction " + arg.direction());
    };
    return filter.withOverride(index, override);
  }

  private static RelationshipOverride oneWay(Relationship rel, ColumnRef source, ColumnRef target,
      String direction) {
    if (rel.isTo(source.table(), source.column()) && rel.isFrom(target.table(), target.column())) {
      return RelationshipOverride.SINGLE;
    }
    if (rel.isFrom(source.table(), source.column()) && rel.isTo(target.table(), target.column())) {
      return RelationshipOverride.ONE_WAY_REVERSE;
    }
    throw DaxException.eval("CROSSFILTER direction " + direction + " does not match relationship " + rel.name());
  }

  private int relationshipIndex(ColumnRef left, ColumnRef right) {
    OptionalInt index = evaluator.model().findRelationshipIndex(left.table(), left.column(), right.table(),
        right.column());
    if (index.isEmpty()) {
      throw DaxException.eval("no relationship found between " + DaxUtil.columnRef(left.table(), left.column())
          + " and " + DaxUtil.columnRef(right.table(), right.column()));
    }
    return index.getAsInt();
  }

  private void collect(FilterArgument arg, boolean keep, FilterContext filter, RowContext row, Effects effects) {
    DataModel model = evaluator.model();
    if (arg instanceof KeepFilters keepFilters) {
      collect(keepFilters.inner(), true, filter, row, effects);
    } else if (arg instanceof UseRelationship || arg instanceof CrossFilter) {
      // already applied
      return;
    } else if (arg instanceof ClearTable clear) {
      Table table = model.requireTable(clear.table());
      if (!keep) {
        effects.clearTable(table.name());
      }
    } else if (arg instanceof ClearColumn clear) {
      BoundColumn col = FunctionArguments.bind(model, clear.column());
      if (!keep) {
        effects.clearColumn(col);
      }
    } else if (arg instanceof NoBlankRowTable noBlank) {
      Table table = model.requireTable(noBlank.table());
      if (!keep) {
        effects.clearTable(table.name());
      }
      effects.rowFilter(table.name(), RowSetResolver.allRows(table.rowCount()));
    } else if (arg instanceof NoBlankRowColumn noBlank) {
      BoundColumn col = FunctionArguments.bind(model, noBlank.column());
      if (!keep) {
        effects.clearColumn(col);
      }
      Set<Value> values = AggregateFunctions.distinctColumnValues(model, noBlank.column(),
          filter.withoutColumn(col.tableName(), col.column()));
      values.remove(Value.BLANK);
      effects.columnFilter(col, values);
    } else if (arg instanceof BooleanFilter bool) {
      booleanFilter(bool.predicate(), keep, filter, row, effects);
    } else if (arg instanceof Comparison comparison) {
      comparison(comparison, keep, filter, row, effects);
    } else if (arg instanceof TreatAs treatAs) {
      BoundColumn target = FunctionArguments.bind(model, treatAs.target());
      Set<Value> values = AggregateFunctions.distinctColumnValues(model, treatAs.source(), filter);
      if (!keep) {
        effects.clearColumn(target);
      }
      effects.columnFilter(target, values);
    } else if (arg instanceof ValueSet valueSet) {
      BoundColumn col = FunctionArguments.bind(model, valueSet.column());
      Set<Value> values = AggregateFunctions.distinctColumnValues(model, valueSet.column(), filter);
      if (!keep) {
        effects.clearColumn(col);
      }
      effects.columnFilter(col, values);
    } else if (arg instanceof TableFilter tableFilter) {
      tableFilter(tableFilter.table(), keep, filter, row, effects);
    }
  }

  private void comparison(Comparison arg, boolean keep, FilterContext filter, RowContext row, Effects effects) {
    BoundColumn col = FunctionArguments.bind(evaluator.model(), arg.column());
    if (!keep) {
      effects.clearColumn(col);
    }
    Value rhs = evaluator.evaluate(arg.value(), filter, row);
    if (arg.op() == BinaryOperator.EQUALS) {
      effects.columnFilter(col, Set.of(rhs));
      return;
    }
    FilterContext base = filter.withoutColumn(col.tableName(), col.column());
    BitSet candidates = RowSetResolver.resolveTableRows(evaluator.model(), base, col.tableName());
    Set<Value> allowed = new LinkedHashSet<>();
    for (int r = candidates.nextSetBit(0); r >= 0; r = candidates.nextSetBit(r + 1)) {
      Value lhs = col.table().value(r, col.index());
      if (Operators.compare(arg.op(), lhs, rhs)) {
        allowed.add(lhs);
      }
    }
    effects.columnFilter(col, allowed);
  }

  private void booleanFilter(Expr predicate, boolean keep, FilterContext filter, RowContext row, Effects effects) {
    Map<String, String> tables = new LinkedHashMap<>();
    List<ColumnRef> columns = new ArrayList<>();
    collectColumnRefs(predicate, tables, columns);
    if (tables.size() != 1) {
      throw DaxException.eval("CALCULATE boolean filter expression must reference columns from exactly one table, got "
          + (tables.isEmpty() ? "no tables" : "tables: " + String.join(", ", new TreeSet<>(tables.values()))));
    }
    Table table = evaluator.model().requireTable(tables.values().iterator().next());
    FilterContext base = filter;
    for (ColumnRef ref : columns) {
      BoundColumn col = FunctionArguments.bind(evaluator.model(), ref);
      base = base.withoutColumn(col.tableName(), col.column());
      if (!keep) {
        effects.clearColumn(col);
      }
    }
    BitSet candidates = RowSetResolver.resolveTableRows(evaluator.model(), base, table.name());
    BitSet allowed = new BitSet();
    for (int r = candidates.nextSetBit(0); r >= 0; r = candidates.nextSetBit(r + 1)) {
      if (Coercions.truthy(evaluator.evaluate(predicate, base, row.push(table, r)))) {
        allowed.set(r);
      }
    }
    effects.rowFilter(table.name(), allowed);
  }

  private static void collectColumnRefs(Expr expr, Map<String, String> tables, List<ColumnRef> columns) {
    if (expr instanceof ColumnRef ref) {
      tables.putIfAbsent(DaxUtil.normalize(ref.table()), ref.table());
      columns.add(ref);
    } else if (expr instanceof Binary binary) {
      collectColumnRefs(binary.left(), tables, columns);
      collectColumnRefs(binary.right(), tables, columns);
    } else if (expr instanceof Negate negate) {
      collectColumnRefs(negate.operand(), tables, columns);
    } else if (expr instanceof Call call) {
      for (Expr arg : call.args()) {
        collectColumnRefs(arg, tables, columns);
      }
    }
  }

  /**
   * A table expression used as a filter. A result exposing a single column, such
   * as {@code FILTER(ALL(T[c]), ...)}, filters that column by value; any other
   * result filters its table by row.
   */
  private void tableFilter(Expr expr, boolean keep, FilterContext filter, RowContext row, Effects effects) {
    TableResult result = evaluator.evaluateTable(expr, filter, row);
    Table table = result.table();
    if (result.visibleColumns() != null && result.visibleColumns().size() == 1) {
      int column = result.visibleColumns().iterator().next();
      BoundColumn col = new BoundColumn(table, column);
      Set<Value> values = new LinkedHashSet<>();
      for (int r : result.rows()) {
        values.add(table.value(r, column));
      }
      if (!keep) {
        effects.clearColumn(col);
      }
      effects.columnFilter(col, values);
      return;
    }
    BitSet rows = new BitSet();
    for (int r : result.rows()) {
      rows.set(r);
    }
    if (!keep) {
      effects.clearTable(table.name());
    }
    effects.rowFilter(table.name(), rows);
  }

  /** Effects collected from all arguments, applied together at the end. */
  private static final class Effects {

    private final Set<String> clearTables = new LinkedHashSet<>();
    private final Set<BoundColumn> clearColumns = new LinkedHashSet<>();
    private final List<Map.Entry<String, BitSet>> rowFilters = new ArrayList<>();
    private final List<Map.Entry<BoundColumn, Set<Value>>> columnFilters = new ArrayList<>();

    void clearTable(String table) {
      clearTables.add(table);
    }

    void clearColumn(BoundColumn column) {
      clearColumns.add(column);
    }

    void rowFilter(String table, BitSet rows) {
      rowFilters.add(Map.entry(table, rows));
    }

    void columnFilter(BoundColumn column, Set<Value> values) {
      columnFilters.add(Map.entry(column, values));
    }

    FilterContext applyTo(FilterContext filter) {
      FilterContext result = filter;
      for (String table : clearTables) {
        result = result.withoutTable(table);
      }
      for (BoundColumn col : clearColumns) {
        result = result.withoutColumn(col.tableName(), col.column());
      }
      for (Map.Entry<String, BitSet> entry : rowFilters) {
        result = result.intersectRowFilter(entry.getKey(), entry.getValue());
      }
      for (Map.Entry<BoundColumn, Set<Value>> entry : columnFilters) {
        result = result.intersectColumn(entry.getKey().tableName(), entry.getKey().column(), entry.getValue());
      }
      return result;
    }
  }
}
