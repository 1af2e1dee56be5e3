package se.alipsa.jdax.pivot;

import java.util.List;
import java.util.Objects;
import se.alipsa.jdax.value.Value;

/**
 * Grouped pivot output. Each row holds the group key values followed by one
 * value per measure, sorted by the group key.
 *
 * @param columns
 *          group-by captions followed by measure names
 * @param rows
 *          the rows
 * @param strategy
 *          the execution strategy that produced the rows
 */
public record PivotResult(List<String> columns, List<List<Value>> rows, PivotStrategy strategy) {

  public PivotResult {
    columns = List.copyOf(columns);
    rows = rows.stream().map(List::copyOf).toList();
    Objects.requireNonNull(strategy, "strategy");
  }
}
