package se.alipsa.jdax.table;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import se.alipsa.jdax.DaxException;
import se.alipsa.jdax.helper.DaxUtil;
import se.alipsa.jdax.value.Value;

/**
 * A named table: an ordered list of column names over one storage backend.
 * Column names resolve case-insensitively.
 */
public final class Table {

  private final String name;
  private final List<String> columns;
  private final Map<String, Integer> columnIndex = new HashMap<>();
  private final TableBackend backend;

  /**
   * Create an empty mutable table.
   *
   * @param name
   *          table name
   * @param columns
   *          column names
   */
  public Table(String name, List<String> columns) {
    this(name, columns, new InMemoryTableBackend(columns.size()));
  }

  /**
   * Create a table over an existing backend.
   *
   * @param name
   *          table name
   * @param columns
   *          column names, one per backend column
   * @param backend
   *          the storage
   */
  public Table(String name, List<String> columns, TableBackend backend) {
    this.name = Objects.requireNonNull(name, "name");
    this.backend = Objects.requireNonNull(backend, "backend");
    Objects.requireNonNull(columns, "columns");
    if (columns.size() != backend.columnCount()) {
      throw new IllegalArgumentException(
          "table " + name + " declares " + columns.size() + " columns but storage has " + backend.columnCount());
    }
    this.columns = new ArrayList<>(columns.size());
    for (String column : columns) {
      registerColumn(column);
    }
  }

  /**
   * Build an accelerated, immutable table from column-major data.
   *
   * @param name
   *          table name
   * @param columns
   *          column names
   * @param columnValues
   *          values per column
   * @return the table
   */
  public static Table columnar(String name, List<String> columns, List<List<Value>> columnValues) {
    if (columns.size() != columnValues.size()) {
      throw DaxException.schemaMismatch(name, columns.size(), columnValues.size());
    }
    int expected = columnValues.isEmpty() ? 0 : columnValues.get(0).size();
    for (int i = 0; i < columnValues.size(); i++) {
      if (columnValues.get(i).size() != expected) {
        throw DaxException.columnLengthMismatch(name, columns.get(i), expected, columnValues.get(i).size());
      }
    }
    return new Table(name, columns, ColumnarTableBackend.fromColumns(columnValues));
  }

  private void registerColumn(String column) {
    String key = DaxUtil.normalize(column);
    if (columnIndex.containsKey(key)) {
      throw DaxException.duplicateColumn(name, column);
    }
    columnIndex.put(key, columns.size());
    columns.add(column);
  }

  public String name() {
    return name;
  }

  public List<String> columns() {
    return Collections.unmodifiableList(columns);
  }

  public TableBackend backend() {
    return backend;
  }

  public int rowCount() {
    return backend.rowCount();
  }

  public boolean isMutable() {
    return backend.isMutable();
  }

  /**
   * Index of a column.
   *
   * @param column
   *          column name, matched case-insensitively
   * @return the index or {@code -1} when the column does not exist
   */
  public int columnIndex(String column) {
    Integer idx = columnIndex.get(DaxUtil.normalize(column));
    return idx == null ? -1 : idx;
  }

  /**
   * Index of a column that must exist.
   *
   * @param column
   *          column name
   * @return the index
   * @throws DaxException
   *           of kind {@code UNKNOWN_COLUMN}
   */
  public int requireColumn(String column) {
    int idx = columnIndex(column);
    if (idx < 0) {
      throw DaxException.unknownColumn(name, column);
    }
    return idx;
  }

  /**
   * Read a cell. Rows past the end, including the virtual blank row, read as
   * blank.
   *
   * @param row
   *          row index
   * @param column
   *          column index
   * @return the value
   */
  public Value value(int row, int column) {
    if (row < 0 || row >= backend.rowCount()) {
      return Value.BLANK;
    }
    return backend.value(row, column);
  }

  public Value value(int row, String column) {
    return value(row, requireColumn(column));
  }

  /**
   * Append a row.
   *
   * @param values
   *          one value per column
   * @throws DaxException
   *           {@code READ_ONLY_TABLE} on accelerated storage,
   *           {@code SCHEMA_MISMATCH} on a wrong value count
   */
  public void pushRow(List<Value> values) {
    MutableTableBackend mutable = mutable("append rows");
    if (values.size() != columns.size()) {
      throw DaxException.schemaMismatch(name, columns.size(), values.size());
    }
    mutable.pushRow(values);
  }

  /**
   * Convenience variant of {@link #pushRow(List)} converting plain Java objects.
   *
   * @param values
   *          one value per column
   */
  public void pushRow(Object... values) {
    List<Value> converted = new ArrayList<>(values.length);
    for (Object v : values) {
      converted.add(Value.fromObject(v));
    }
    pushRow(converted);
  }

  /**
   * Append a materialized column.
   *
   * @param column
   *          column name
   * @param values
   *          one value per row
   */
  public void addColumn(String column, List<Value> values) {
    MutableTableBackend mutable = mutable("add column " + column);
    if (columnIndex(column) >= 0) {
      throw DaxException.duplicateColumn(name, column);
    }
    if (values.size() != rowCount()) {
      throw DaxException.columnLengthMismatch(name, column, rowCount(), values.size());
    }
    mutable.addColumn(values);
    registerColumn(column);
  }

  /**
   * Drop the most recently added column; used to roll back a rejected
   * calculated column.
   */
  public void rollbackLastColumn() {
    mutable("remove columns").removeLastColumn();
    String removed = columns.remove(columns.size() - 1);
    columnIndex.remove(DaxUtil.normalize(removed));
  }

  public void setValue(int row, int column, Value value) {
    mutable("write cells").setValue(row, column, value);
  }

  /**
   * Remove the last row; used to roll back a rejected insert.
   */
  public void rollbackLastRow() {
    mutable("remove rows").removeLastRow();
  }

  private MutableTableBackend mutable(String operation) {
    if (backend instanceof MutableTableBackend mutable) {
      return mutable;
    }
    throw DaxException.readOnlyTable(name, operation);
  }

  @Override
  public String toString() {
    return "Table[" + name + ", columns=" + columns + ", rows=" + rowCount() + "]";
  }
}
