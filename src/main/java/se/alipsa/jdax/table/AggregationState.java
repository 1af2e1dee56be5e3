package se.alipsa.jdax.table;

import java.util.HashSet;
import java.util.Set;
import se.alipsa.jdax.value.Value;
import se.alipsa.jdax.value.Value.NumberValue;

/**
 * Running accumulator for one {@link AggregationSpec} within one group. Numeric
 * aggregations only consider number values; everything else is skipped.
 */
public final class AggregationState {

  private final AggregationKind kind;
  private double sum;
  private long count;
  private double best;
  private boolean hasBest;
  private Set<Value> distinct;

  /**
   * Create an empty accumulator.
   *
   * @param kind
   *          the aggregation to accumulate
   */
  public AggregationState(AggregationKind kind) {
    this.kind = kind;
    if (kind == AggregationKind.DISTINCT_COUNT) {
      distinct = new HashSet<>();
    }
  }

  /**
   * Feed one row into the accumulator.
   *
   * @param value
   *          the aggregated column's value, ignored for COUNT_ROWS
   */
  public void update(Value value) {
    switch (kind) {
      case COUNT_ROWS -> count++;
      case COUNT_NON_BLANK -> {
        if (!value.isBlank()) {
          count++;
        }
      }
      case COUNT_NUMBERS -> {
        if (value instanceof NumberValue) {
          count++;
        }
      }
      case SUM, AVERAGE -> {
        if (value instanceof NumberValue n) {
          sum += n.value();
          count++;
        }
      }
      case MIN -> {
        if (value instanceof NumberValue n && (!hasBest || n.value() < best)) {
          best = n.value();
          hasBest = true;
        }
      }
      case MAX -> {
        if (value instanceof NumberValue n && (!hasBest || n.value() > best)) {
          best = n.value();
          hasBest = true;
        }
      }
      case DISTINCT_COUNT -> distinct.add(value);
      default -> throw new IllegalStateException("Unhandled aggregation " + kind);
    }
  }

  /**
   * The aggregate over everything fed so far.
   *
   * @return the result; SUM, AVERAGE, MIN and MAX are blank when no number was
   *         seen
   */
  public Value result() {
    return switch (kind) {
      case COUNT_ROWS, COUNT_NON_BLANK, COUNT_NUMBERS -> Value.of(count);
      case SUM -> count == 0 ? Value.BLANK : Value.of(sum);
      case AVERAGE -> count == 0 ? Value.BLANK : Value.of(sum / count);
      case MIN, MAX -> hasBest ? Value.of(best) : Value.BLANK;
      case DISTINCT_COUNT -> Value.of(distinct.size());
    };
  }
}
