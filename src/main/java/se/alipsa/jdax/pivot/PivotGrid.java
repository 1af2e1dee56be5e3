package se.alipsa.jdax.pivot;

import java.util.List;
import se.alipsa.jdax.value.Value;

/**
 * A pivot reshaped as a crosstab: a header row followed by one row per row-axis
 * key.
 *
 * @param data
 *          header row first, then body rows
 */
public record PivotGrid(List<List<Value>> data) {

  public PivotGrid {
    data = data.stream().map(List::copyOf).toList();
  }

  public List<Value> header() {
    return data.get(0);
  }

  public List<List<Value>> body() {
    return data.subList(1, data.size());
  }
}
