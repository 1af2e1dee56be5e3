package se.alipsa.jdax.table;

import java.util.Objects;

/**
 * One aggregate requested from {@link TableBackend#groupByAggregations}.
 *
 * @param kind
 *          the aggregation to compute
 * @param columnIndex
 *          the aggregated column, or {@code -1} for {@link AggregationKind#COUNT_ROWS}
 */
public record AggregationSpec(AggregationKind kind, int columnIndex) {

  public AggregationSpec {
    Objects.requireNonNull(kind, "kind");
    if (kind != AggregationKind.COUNT_ROWS && columnIndex < 0) {
      throw new IllegalArgumentException(kind + " requires a column");
    }
  }

  /**
   * Row count over the group.
   *
   * @return a COUNT_ROWS spec
   */
  public static AggregationSpec countRows() {
    return new AggregationSpec(AggregationKind.COUNT_ROWS, -1);
  }
}
