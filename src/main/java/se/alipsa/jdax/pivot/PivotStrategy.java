package se.alipsa.jdax.pivot;

/** Execution strategies of the pivot planner, in the order they are tried. */
public enum PivotStrategy {
  /** Backend group-by over base table columns with planned measures. */
  COLUMNAR_GROUP_BY("columnar_group_by"),
  /** Backend group-by for the keys, the evaluator for each measure. */
  COLUMNAR_GROUPS_WITH_MEASURE_EVAL("columnar_groups_with_measure_eval"),
  /** Backend group-by on foreign keys rolled up to one-hop dimension attributes. */
  STAR_SCHEMA_ROLLUP("columnar_star_schema_group_by"),
  /** Row by row aggregation of planned measures. */
  PLANNED_ROW_GROUP_BY("planned_row_group_by"),
  /** Distinct keys from a row scan, the evaluator for every cell. */
  ROW_SCAN("row_scan");

  private final String label;

  PivotStrategy(String label) {
    this.label = label;
  }

  public String label() {
    return label;
  }
}
