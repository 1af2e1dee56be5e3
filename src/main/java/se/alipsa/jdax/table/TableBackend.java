package se.alipsa.jdax.table;

import java.util.BitSet;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.OptionalLong;
import se.alipsa.jdax.value.Value;

/**
 * Storage behind a {@link Table}. Only {@link #rowCount()}, {@link #columnCount()}
 * and {@link #value(int, int)} are mandatory. The remaining methods form an
 * optional acceleration surface: each returns an empty result when the backend
 * cannot answer natively and callers must then fall back to scanning. An empty
 * result is never an error.
 */
public interface TableBackend {

  /**
   * Number of physical rows.
   *
   * @return the row count
   */
  int rowCount();

  /**
   * Number of physical columns.
   *
   * @return the column count
   */
  int columnCount();

  /**
   * Read a single cell.
   *
   * @param row
   *          zero based row index
   * @param column
   *          zero based column index
   * @return the cell value, {@link Value#BLANK} when the row is out of range
   */
  Value value(int row, int column);

  /**
   * Whether rows may be appended and columns materialized.
   *
   * @return {@code true} for mutable storage
   */
  default boolean isMutable() {
    return false;
  }

  default OptionalDouble statsSum(int column) {
    return OptionalDouble.empty();
  }

  default OptionalLong statsNonBlankCount(int column) {
    return OptionalLong.empty();
  }

  /**
   * Number of cells holding a number. Text and boolean cells are not counted.
   *
   * @param column
   *          column index
   * @return the count, or empty when unsupported
   */
  default OptionalLong statsNumericCount(int column) {
    return OptionalLong.empty();
  }

  /**
   * Numeric minimum of a column.
   *
   * @param column
   *          column index
   * @return the minimum, empty when unsupported or when no number exists
   */
  default OptionalDouble statsMin(int column) {
    return OptionalDouble.empty();
  }

  /**
   * Numeric maximum of a column.
   *
   * @param column
   *          column index
   * @return the maximum, empty when unsupported or when no number exists
   */
  default OptionalDouble statsMax(int column) {
    return OptionalDouble.empty();
  }

  /**
   * Distinct count of non-blank values.
   *
   * @param column
   *          column index
   * @return the count, or empty when unsupported
   */
  default OptionalLong statsDistinctCount(int column) {
    return OptionalLong.empty();
  }

  default Optional<Boolean> statsHasBlank(int column) {
    return Optional.empty();
  }

  /**
   * All distinct values of a column, blank included when present.
   *
   * @param column
   *          column index
   * @return the dictionary, or empty when unsupported
   */
  default Optional<List<Value>> dictionaryValues(int column) {
    return Optional.empty();
  }

  /**
   * Rows whose value equals {@code value}.
   *
   * @param column
   *          column index
   * @param value
   *          value to match
   * @return matching rows, or empty when unsupported
   */
  default Optional<BitSet> filterEq(int column, Value value) {
    return Optional.empty();
  }

  /**
   * Rows whose value is one of {@code values}.
   *
   * @param column
   *          column index
   * @param values
   *          values to match
   * @return matching rows, or empty when unsupported
   */
  default Optional<BitSet> filterIn(int column, Collection<Value> values) {
    return Optional.empty();
  }

  /**
   * Distinct values of a column restricted to a row set.
   *
   * @param column
   *          column index
   * @param rows
   *          rows to consider, {@code null} for all rows
   * @return distinct values (blank included when present), or empty when
   *         unsupported
   */
  default Optional<List<Value>> distinctValuesFiltered(int column, BitSet rows) {
    return Optional.empty();
  }

  /**
   * Grouped aggregation. Each output row holds the group key values followed by
   * one value per requested aggregation, in order.
   *
   * @param groupBy
   *          grouping column indices
   * @param aggregations
   *          aggregations to compute per group
   * @param rows
   *          rows to consider, {@code null} for all rows
   * @return grouped rows in unspecified order, or empty when unsupported
   */
  default Optional<List<List<Value>>> groupByAggregations(int[] groupBy, List<AggregationSpec> aggregations,
      BitSet rows) {
    return Optional.empty();
  }
}
