package se.alipsa.jdax.table;

import java.util.List;
import se.alipsa.jdax.value.Value;

/** Storage that accepts row appends, cell writes and new columns. */
public interface MutableTableBackend extends TableBackend {

  @Override
  default boolean isMutable() {
    return true;
  }

  /**
   * Append a row.
   *
   * @param values
   *          one value per column
   */
  void pushRow(List<Value> values);

  /** Remove the most recently appended row. */
  void removeLastRow();

  /**
   * Overwrite a cell.
   *
   * @param row
   *          row index
   * @param column
   *          column index
   * @param value
   *          new value
   */
  void setValue(int row, int column, Value value);

  /**
   * Append a column.
   *
   * @param values
   *          one value per existing row
   */
  void addColumn(List<Value> values);

  /** Remove the most recently appended column. */
  void removeLastColumn();
}
