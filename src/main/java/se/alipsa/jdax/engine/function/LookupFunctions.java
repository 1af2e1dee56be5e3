package se.alipsa.jdax.engine.function;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;
import java.util.Optional;
import se.alipsa.jdax.DaxException;
import se.alipsa.jdax.engine.Operators;
import se.alipsa.jdax.engine.RowContext;
import se.alipsa.jdax.engine.RowContext.Frame;
import se.alipsa.jdax.engine.RowSetResolver;
import se.alipsa.jdax.engine.TableResult;
import se.alipsa.jdax.engine.function.FunctionArguments.BoundColumn;
import se.alipsa.jdax.helper.DaxUtil;
import se.alipsa.jdax.model.DataModel;
import se.alipsa.jdax.model.DataModel.PathDirection;
import se.alipsa.jdax.model.RelationshipInfo;
import se.alipsa.jdax.parser.Expr.ColumnRef;
import se.alipsa.jdax.table.Table;
import se.alipsa.jdax.value.Coercions;
import se.alipsa.jdax.value.Value;

/**
 * Functions that look up single values: through relationships, by search
 * columns, in outer row contexts or in a one-column table.
 */
public final class LookupFunctions {

  private LookupFunctions() {
    // Utility class
  }

  /**
   * {@code RELATED(Table[Column])}: follow the unique active many-to-one path
   * from the current row to {@code Table} and read the column there.
   *
   * @param args
   *          the call arguments
   * @return the related value, blank when a key on the path is blank or has no
   *         match
   */
  static Value related(FunctionArguments args) {
    args.requireCount(1);
    ColumnRef ref = args.columnRef(0, "RELATED expects a column reference");
    Frame current = args.row().current();
    if (current == null) {
      throw DaxException.eval("RELATED requires row context");
    }
    DataModel model = args.model();
    String currentTable = current.table().name();
    Optional<List<Integer>> path = model.findUniqueActiveRelationshipPath(currentTable, ref.table(),
        PathDirection.MANY_TO_ONE, idx -> RowSetResolver.isRelationshipActive(model, args.filter(), idx));
    if (path.isEmpty()) {
      throw DaxException.eval("no active relationship from " + currentTable + " to " + ref.table() + " for RELATED");
    }

    int row = current.row();
    boolean firstHop = true;
    for (int relIdx : path.get()) {
      RelationshipInfo info = model.relationship(relIdx);
      Value key;
      if (firstHop) {
        key = current.read(info.fromColumnIndex());
        firstHop = false;
      } else {
        key = model.requireTable(info.relationship().fromTable()).value(row, info.fromColumnIndex());
      }
      if (key.isBlank()) {
        return Value.BLANK;
      }
      int toRow = info.toRow(key);
      if (toRow < 0) {
        return Value.BLANK;
      }
      row = toRow;
    }
    BoundColumn target = FunctionArguments.bind(model, ref);
    return target.table().value(row, target.index());
  }

  /**
   * {@code LOOKUPVALUE(result, search1, value1, ...[, alternate])}. Every search
   * column must live in the result column's table. Several matching rows are
   * accepted when their non-blank results agree.
   *
   * @param args
   *          the call arguments
   * @return the found value, the alternate result or blank
   */
  static Value lookupValue(FunctionArguments args) {
    args.requireAtLeast(3);
    ColumnRef resultRef = args.columnRef(0, "LOOKUPVALUE expects a column reference as the first argument");
    boolean hasAlternate = args.size() % 2 == 0;
    int searchEnd = hasAlternate ? args.size() - 1 : args.size();
    if (searchEnd - 1 < 2) {
      throw DaxException.eval("LOOKUPVALUE expects at least one (search_column, search_value) pair");
    }
    BoundColumn result = FunctionArguments.bind(args.model(), resultRef);
    Table table = result.table();

    List<Integer> searchColumns = new ArrayList<>();
    List<Value> searchValues = new ArrayList<>();
    for (int i = 1; i < searchEnd; i += 2) {
      ColumnRef searchRef = args.columnRef(i, "LOOKUPVALUE expects search columns to be column references");
      if (!DaxUtil.normalize(searchRef.table()).equals(DaxUtil.normalize(table.name()))) {
        throw DaxException.eval(
            "LOOKUPVALUE requires all search columns to be in the same table as the result column");
      }
      searchColumns.add(table.requireColumn(searchRef.column()));
      searchValues.add(args.value(i + 1));
    }

    BitSet candidates = RowSetResolver.resolveTableRows(args.model(), args.filter(), table.name());
    List<Integer> matched = new ArrayList<>();
    for (int row = candidates.nextSetBit(0); row >= 0; row = candidates.nextSetBit(row + 1)) {
      boolean matches = true;
      for (int i = 0; i < searchColumns.size() && matches; i++) {
        matches = Operators.valueEquals(table.value(row, searchColumns.get(i)), searchValues.get(i));
      }
      if (matches) {
        matched.add(row);
      }
    }

    if (matched.isEmpty()) {
      return hasAlternate ? args.value(args.size() - 1) : Value.BLANK;
    }
    if (matched.size() == 1) {
      return table.value(matched.get(0), result.index());
    }
    Value found = Value.BLANK;
    for (int row : matched) {
      Value v = table.value(row, result.index());
      if (v.isBlank()) {
        continue;
      }
      if (found.isBlank()) {
        found = v;
      } else if (!found.equals(v)) {
        throw DaxException.eval("LOOKUPVALUE found multiple values for " + DaxUtil.columnRef(table.name(),
            result.column()));
      }
    }
    return found;
  }

  /**
   * {@code CONTAINSROW(table, value)} over a table exposing exactly one column.
   *
   * @param args
   *          the call arguments
   * @return {@code TRUE} when some row holds the value
   */
  static Value containsRow(FunctionArguments args) {
    args.requireAtLeast(2);
    if (args.size() != 2) {
      throw DaxException.eval("CONTAINSROW currently only supports one-column tables");
    }
    Value needle = args.value(1);
    TableResult table = args.table(0);
    List<Integer> visible = new ArrayList<>();
    for (int c = 0; c < table.table().columns().size(); c++) {
      if (table.isColumnVisible(c)) {
        visible.add(c);
      }
    }
    if (visible.size() != 1) {
      throw DaxException.eval("CONTAINSROW currently only supports one-column tables");
    }
    int column = visible.get(0);
    for (int row : table.rows()) {
      if (Operators.valueEquals(table.table().value(row, column), needle)) {
        return Value.of(true);
      }
    }
    return Value.of(false);
  }

  /**
   * {@code EARLIER(Table[Column][, n])}: the column in the n-th enclosing row of
   * {@code Table}, counting outwards from the innermost one.
   *
   * @param args
   *          the call arguments
   * @return the value
   */
  static Value earlier(FunctionArguments args) {
    args.requireRange(1, 2);
    ColumnRef ref = args.columnRef(0, "EARLIER expects a column reference as the first argument");
    int level = 1;
    if (args.size() == 2) {
      double n = Coercions.toNumber(args.value(1));
      if (!Double.isFinite(n)) {
        throw DaxException.eval("EARLIER expects a finite number for the optional second argument");
      }
      if ((long) n < 1) {
        throw DaxException.eval("EARLIER expects the optional second argument to be >= 1");
      }
      level = (int) Math.min(Integer.MAX_VALUE, (long) n);
    }
    RowContext row = args.row();
    Frame frame = row.earlier(ref.table(), level);
    if (frame == null) {
      String key = DaxUtil.normalize(ref.table());
      long available = row.frames().stream().filter(f -> DaxUtil.normalize(f.table().name()).equals(key)).count();
      throw DaxException.eval("EARLIER refers to an outer row context that does not exist for "
          + DaxUtil.columnRef(ref.table(), ref.column()) + " (requested level " + level + ", available " + available
          + ")");
    }
    return frame.read(frame.table().requireColumn(ref.column()));
  }

  static Value earliest(FunctionArguments args) {
    args.requireCount(1);
    ColumnRef ref = args.columnRef(0, "EARLIEST expects a column reference as the first argument");
    Frame frame = args.row().earliest(ref.table());
    if (frame == null) {
      throw DaxException.eval("EARLIEST requires row context for " + DaxUtil.columnRef(ref.table(), ref.column()));
    }
    return frame.read(frame.table().requireColumn(ref.column()));
  }
}
