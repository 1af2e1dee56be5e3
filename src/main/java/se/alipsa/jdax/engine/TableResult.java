package se.alipsa.jdax.engine;

import java.util.List;
import java.util.Objects;
import java.util.Set;
import se.alipsa.jdax.table.Table;

/**
 * Rows of one physical table produced by a table expression.
 *
 * @param table
 *          the table the rows belong to
 * @param rows
 *          row indices; the index equal to the row count denotes the virtual
 *          blank row
 * @param visibleColumns
 *          column indices a row context over these rows may read, {@code null}
 *          when every column is visible
 */
public record TableResult(Table table, List<Integer> rows, Set<Integer> visibleColumns) {

  public TableResult {
    Objects.requireNonNull(table, "table");
    rows = List.copyOf(rows);
    visibleColumns = visibleColumns == null ? null : Set.copyOf(visibleColumns);
  }

  public TableResult(Table table, List<Integer> rows) {
    this(table, rows, null);
  }

  public int size() {
    return rows.size();
  }

  public boolean isColumnVisible(int column) {
    return visibleColumns == null || visibleColumns.contains(column);
  }
}
