package se.alipsa.jdax.table;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import se.alipsa.jdax.value.Value;

/**
 * Row oriented mutable storage. It offers no acceleration so every capability
 * query answers "unsupported" and callers scan.
 */
public final class InMemoryTableBackend implements MutableTableBackend {

  private final List<List<Value>> rows = new ArrayList<>();
  private int columnCount;

  /**
   * Create an empty backend.
   *
   * @param columnCount
   *          number of columns each row carries
   */
  public InMemoryTableBackend(int columnCount) {
    if (columnCount < 0) {
      throw new IllegalArgumentException("columnCount must not be negative");
    }
    this.columnCount = columnCount;
  }

  @Override
  public int rowCount() {
    return rows.size();
  }

  @Override
  public int columnCount() {
    return columnCount;
  }

  @Override
  public Value value(int row, int column) {
    if (row < 0 || row >= rows.size() || column < 0 || column >= columnCount) {
      return Value.BLANK;
    }
    return rows.get(row).get(column);
  }

  @Override
  public void pushRow(List<Value> values) {
    Objects.requireNonNull(values, "values");
    if (values.size() != columnCount) {
      throw new IllegalArgumentException("expected " + columnCount + " values, got " + values.size());
    }
    List<Value> row = new ArrayList<>(columnCount);
    for (Value v : values) {
      row.add(v == null ? Value.BLANK : v);
    }
    rows.add(row);
  }

  @Override
  public void removeLastRow() {
    if (!rows.isEmpty()) {
      rows.remove(rows.size() - 1);
    }
  }

  @Override
  public void setValue(int row, int column, Value value) {
    Objects.checkIndex(row, rows.size());
    Objects.checkIndex(column, columnCount);
    rows.get(row).set(column, value == null ? Value.BLANK : value);
  }

  @Override
  public void addColumn(List<Value> values) {
    Objects.requireNonNull(values, "values");
    if (values.size() != rows.size()) {
      throw new IllegalArgumentException("expected " + rows.size() + " values, got " + values.size());
    }
    for (int i = 0; i < rows.size(); i++) {
      Value v = values.get(i);
      rows.get(i).add(v == null ? Value.BLANK : v);
    }
    columnCount++;
  }

  @Override
  public void removeLastColumn() {
    if (columnCount == 0) {
      return;
    }
    for (List<Value> row : rows) {
      row.remove(columnCount - 1);
    }
    columnCount--;
  }
}
