package se.alipsa.jdax.engine.function;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import se.alipsa.jdax.DaxException;
import se.alipsa.jdax.engine.FilterContext;
import se.alipsa.jdax.engine.FilterContext.ColumnKey;
import se.alipsa.jdax.engine.RowContext;
import se.alipsa.jdax.engine.RowContext.Frame;
import se.alipsa.jdax.engine.RowSetResolver;
import se.alipsa.jdax.engine.TableResult;
import se.alipsa.jdax.engine.function.FunctionArguments.BoundColumn;
import se.alipsa.jdax.helper.DaxUtil;
import se.alipsa.jdax.model.DataModel;
import se.alipsa.jdax.model.DataModel.PathDirection;
import se.alipsa.jdax.model.RelationshipInfo;
import se.alipsa.jdax.parser.Expr;
import se.alipsa.jdax.parser.Expr.ColumnRef;
import se.alipsa.jdax.parser.Expr.TableName;
import se.alipsa.jdax.table.Table;
import se.alipsa.jdax.value.Coercions;
import se.alipsa.jdax.value.Value;

/**
 * Functions producing tables. Every result is a set of rows of one physical
 * table; the virtual blank row appears as the index equal to the row count.
 */
public final class TableFunctions {

  private TableFunctions() {
    // Utility class
  }

  /**
   * Rows of a table allowed by a filter context.
   *
   * @param model
   *          the data model
   * @param filter
   *          the filter context
   * @param name
   *          table name
   * @return the rows, every column visible
   */
  public static TableResult tableRows(DataModel model, FilterContext filter, String name) {
    Table table = model.requireTable(name);
    return new TableResult(table, toList(RowSetResolver.resolveTableRows(model, filter, table.name())));
  }

  static TableResult filter(FunctionArguments args) {
    args.requireCount(2);
    TableResult base = args.table(0);
    Expr predicate = args.expression(1);
    FilterContext filter = IteratorFunctions.rowFilter(args.filter());
    List<Integer> kept = new ArrayList<>();
    for (int row : base.rows()) {
      RowContext rowCtx = IteratorFunctions.pushRow(args.row(), base, row);
      if (Coercions.truthy(args.evaluator().evaluate(predicate, filter, rowCtx))) {
        kept.add(row);
      }
    }
    return new TableResult(base.table(), kept, base.visibleColumns());
  }

  /**
   * {@code ALL(Table)} returns every physical row; {@code ALL(Table[Column])}
   * returns one row per distinct value of the column under the remaining
   * filters, plus the virtual blank row when it is visible.
   *
   * @param args
   *          the call arguments
   * @return the rows
   */
  static TableResult all(FunctionArguments args) {
    args.requireCount(1);
    Expr arg = args.expression(0);
    if (arg instanceof TableName name) {
      Table table = args.model().requireTable(name.name());
      return new TableResult(table, toList(RowSetResolver.allRows(table.rowCount())));
    }
    if (arg instanceof ColumnRef ref) {
      BoundColumn col = FunctionArguments.bind(args.model(), ref);
      FilterContext cleared = args.filter().withoutColumn(ref.table(), ref.column());
      return distinctRows(args.model(), cleared, col, true);
    }
    throw DaxException.type(args.name() + " expects a table name or column reference, got " + arg);
  }

  static TableResult allNoBlankRow(FunctionArguments args) {
    args.requireCount(1);
    Expr arg = args.expression(0);
    if (arg instanceof TableName name) {
      Table table = args.model().requireTable(name.name());
      return new TableResult(table, toList(RowSetResolver.allRows(table.rowCount())));
    }
    if (arg instanceof ColumnRef ref) {
      BoundColumn col = FunctionArguments.bind(args.model(), ref);
      FilterContext cleared = args.filter().withoutColumn(ref.table(), ref.column());
      BitSet rows = RowSetResolver.resolveTableRows(args.model(), cleared, col.tableName());
      Set<Value> seen = new HashSet<>();
      List<Integer> out = new ArrayList<>();
      for (int row = rows.nextSetBit(0); row >= 0; row = rows.nextSetBit(row + 1)) {
        Value v = col.table().value(row, col.index());
        if (!v.isBlank() && seen.add(v)) {
          out.add(row);
        }
      }
      return new TableResult(col.table(), out, Set.of(col.index()));
    }
    throw DaxException.type("ALLNOBLANKROW expects a table name or column reference, got " + arg);
  }

  /**
   * {@code VALUES} and {@code DISTINCT}. Over a column: one row per visible
   * value, including the virtual blank row when visible. Over a table
   * expression: its rows deduplicated on the visible columns.
   *
   * @param args
   *          the call arguments
   * @return the rows
   */
  static TableResult values(FunctionArguments args) {
    args.requireCount(1);
    if (args.expression(0) instanceof ColumnRef ref) {
      return distinctRows(args.model(), args.filter(), FunctionArguments.bind(args.model(), ref), true);
    }
    return distinctRowsByVisibleColumns(args.table(0));
  }

  /**
   * {@code ALLEXCEPT(Table, col...)}: every filter on the table is removed
   * except those on the listed columns.
   *
   * @param args
   *          the call arguments
   * @return the rows
   */
  static TableResult allExcept(FunctionArguments args) {
    args.requireAtLeast(2);
    TableName name = args.tableName(0, "ALLEXCEPT expects a table name as the first argument");
    Table table = args.model().requireTable(name.name());
    String tableKey = DaxUtil.normalize(table.name());
    Set<String> keep = new HashSet<>();
    for (int i = 1; i < args.size(); i++) {
      ColumnRef ref = args.columnRef(i, "ALLEXCEPT expects column references after the table name");
      if (!DaxUtil.normalize(ref.table()).equals(tableKey)) {
        throw DaxException.eval("ALLEXCEPT column must belong to " + table.name() + ", got "
            + DaxUtil.columnRef(ref.table(), ref.column()));
      }
      table.requireColumn(ref.column());
      keep.add(DaxUtil.normalize(ref.column()));
    }
    FilterContext filter = args.filter();
    FilterContext modified = filter.withoutTable(table.name());
    for (Map.Entry<ColumnKey, Set<Value>> entry : filter.columnFilters().entrySet()) {
      ColumnKey key = entry.getKey();
      if (key.table().equals(tableKey) && keep.contains(key.column())) {
        modified = modified.withColumnIn(key.table(), key.column(), entry.getValue());
      }
    }
    return tableRows(args.model(), modified, table.name());
  }

  static TableResult calculateTable(FunctionArguments args) {
    args.requireAtLeast(1);
    List<Expr> filterArgs = args.expressions().subList(1, args.size());
    FilterContext filter = args.evaluator().calculateFilter(args.filter(), args.row(), filterArgs)
        .withTransitionSuppressed(true);
    return args.evaluator().evaluateTable(args.expression(0), filter, args.row());
  }

  /**
   * {@code RELATEDTABLE(Table)}: rows of {@code Table} reached from the current
   * row over the unique active chain of one-to-many relationships, restricted to
   * the rows the filter context allows. A blank key on the way reaches the rows
   * whose foreign key is blank or unmatched.
   *
   * @param args
   *          the call arguments
   * @return the related rows
   */
  static TableResult relatedTable(FunctionArguments args) {
    args.requireCount(1);
    TableName target = args.tableName(0, "RELATEDTABLE currently expects a table name");
    Frame current = args.row().current();
    if (current == null) {
      throw DaxException.eval("RELATEDTABLE requires row context");
    }
    DataModel model = args.model();
    FilterContext filter = args.filter();
    Table targetTable = model.requireTable(target.name());
    String currentTable = current.table().name();
    Optional<List<Integer>> path = model.findUniqueActiveRelationshipPath(currentTable, targetTable.name(),
        PathDirection.ONE_TO_MANY, idx -> RowSetResolver.isRelationshipActive(model, filter, idx));
    if (path.isEmpty()) {
      throw DaxException.eval("no active relationship between " + currentTable + " and " + targetTable.name());
    }

    Map<String, BitSet> sets = filter.isEmpty() ? null : RowSetResolver.resolve(model, filter);
    List<Integer> hops = path.get();
    Set<Integer> currentRows = new LinkedHashSet<>();
    currentRows.add(current.row());
    boolean firstHop = true;
    for (int relIdx : hops) {
      RelationshipInfo info = model.relationship(relIdx);
      Table toTable = model.requireTable(info.relationship().toTable());
      Table fromTable = model.requireTable(info.relationship().fromTable());
      Set<Value> keys = new LinkedHashSet<>();
      boolean includeBlank = false;
      for (int row : currentRows) {
        Value key = firstHop ? current.read(info.toColumnIndex()) : toTable.value(row, info.toColumnIndex());
        if (key.isBlank()) {
          includeBlank = true;
        } else {
          keys.add(key);
        }
      }
      firstHop = false;

      BitSet next = new BitSet();
      for (Value key : keys) {
        for (int row : info.fromRows(key)) {
          next.set(row);
        }
      }
      if (includeBlank) {
        next.or(info.unmatchedFactRows());
        // the virtual blank row of an intermediate table carries blank keys onwards
        if (hops.size() > 1 && RowSetResolver.blankRowAllowed(filter, fromTable.name())
            && RowSetResolver.virtualBlankRowExists(model, filter, fromTable.name(), sets)) {
          next.set(fromTable.rowCount());
        }
      }
      currentRows = new LinkedHashSet<>(toList(next));
      if (currentRows.isEmpty()) {
        break;
      }
    }

    List<Integer> rows = new ArrayList<>();
    BitSet allowed = sets == null ? null : sets.get(DaxUtil.normalize(targetTable.name()));
    for (int row : currentRows) {
      if (row < targetTable.rowCount() && (allowed == null || allowed.get(row))) {
        rows.add(row);
      }
    }
    return new TableResult(targetTable, rows);
  }

  /**
   * One row per distinct value of a column among the rows a filter allows.
   *
   * @param model
   *          the data model
   * @param filter
   *          the filter context
   * @param col
   *          the column
   * @param withBlankRow
   *          whether to add the virtual blank row when it is visible and no
   *          physical row holds blank
   * @return the rows, only the column visible
   */
  static TableResult distinctRows(DataModel model, FilterContext filter, BoundColumn col, boolean withBlankRow) {
    Table table = col.table();
    Map<String, BitSet> sets = filter.isEmpty() ? null : RowSetResolver.resolve(model, filter);
    BitSet rows = sets == null ? RowSetResolver.allRows(table.rowCount())
        : sets.get(DaxUtil.normalize(table.name()));
    Set<Value> seen = new HashSet<>();
    List<Integer> out = new ArrayList<>();
    for (int row = rows.nextSetBit(0); row >= 0; row = rows.nextSetBit(row + 1)) {
      if (seen.add(table.value(row, col.index()))) {
        out.add(row);
      }
    }
    if (withBlankRow && !seen.contains(Value.BLANK) && RowSetResolver.blankRowAllowed(filter, table.name())
        && RowSetResolver.virtualBlankRowExists(model, filter, table.name(), sets)) {
      out.add(table.rowCount());
    }
    return new TableResult(table, out, Set.of(col.index()));
  }

  private static TableResult distinctRowsByVisibleColumns(TableResult base) {
    Table table = base.table();
    List<Integer> visible = new ArrayList<>();
    for (int c = 0; c < table.columns().size(); c++) {
      if (base.isColumnVisible(c)) {
        visible.add(c);
      }
    }
    Set<List<Value>> seen = new HashSet<>();
    List<Integer> out = new ArrayList<>();
    for (int row : base.rows()) {
      List<Value> key = new ArrayList<>(visible.size());
      for (int c : visible) {
        key.add(table.value(row, c));
      }
      if (seen.add(key)) {
        out.add(row);
      }
    }
    return new TableResult(table, out, base.visibleColumns());
  }

  static List<Integer> toList(BitSet rows) {
    List<Integer> out = new ArrayList<>(rows.cardinality());
    for (int row = rows.nextSetBit(0); row >= 0; row = rows.nextSetBit(row + 1)) {
      out.add(row);
    }
    return out;
  }
}
