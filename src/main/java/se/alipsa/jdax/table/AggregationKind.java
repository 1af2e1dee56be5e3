package se.alipsa.jdax.table;

/** Aggregations a backend may compute natively while grouping. */
public enum AggregationKind {
  SUM, AVERAGE, MIN, MAX, COUNT_ROWS, COUNT_NON_BLANK, COUNT_NUMBERS, DISTINCT_COUNT
}
