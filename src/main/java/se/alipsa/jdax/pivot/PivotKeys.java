package se.alipsa.jdax.pivot;

import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;
import se.alipsa.jdax.value.Value;
import se.alipsa.jdax.value.Value.BooleanValue;
import se.alipsa.jdax.value.Value.NumberValue;
import se.alipsa.jdax.value.Value.TextValue;

/** Ordering and display of pivot group keys. */
final class PivotKeys {

  /**
   * Total order over values: blank, then numbers, then text, then booleans. Text
   * compares case-insensitively with a case-sensitive tiebreak.
   */
  static final Comparator<Value> VALUE_ORDER = PivotKeys::compareValues;

  /** Lexicographic order over keys using {@link #VALUE_ORDER}. */
  static final Comparator<List<Value>> KEY_ORDER = PivotKeys::compareKeys;

  private PivotKeys() {
    // Utility class
  }

  private static int rank(Value value) {
    if (value.isBlank()) {
      return 0;
    }
    if (value instanceof NumberValue) {
      return 1;
    }
    if (value instanceof TextValue) {
      return 2;
    }
    return 3;
  }

  static int compareValues(Value a, Value b) {
    int ra = rank(a);
    int rb = rank(b);
    if (ra != rb) {
      return Integer.compare(ra, rb);
    }
    if (a instanceof NumberValue na && b instanceof NumberValue nb) {
      return Double.compare(na.value(), nb.value());
    }
    if (a instanceof TextValue ta && b instanceof TextValue tb) {
      int cmp = ta.value().toUpperCase(Locale.ROOT).compareTo(tb.value().toUpperCase(Locale.ROOT));
      return cmp != 0 ? cmp : ta.value().compareTo(tb.value());
    }
    if (a instanceof BooleanValue ba && b instanceof BooleanValue bb) {
      return Boolean.compare(ba.value(), bb.value());
    }
    return 0;
  }

  static int compareKeys(List<Value> a, List<Value> b) {
    int n = Math.min(a.size(), b.size());
    for (int i = 0; i < n; i++) {
      int cmp = compareValues(a.get(i), b.get(i));
      if (cmp != 0) {
        return cmp;
      }
    }
    return Integer.compare(a.size(), b.size());
  }

  /**
   * Header text of a key value.
   *
   * @param value
   *          the value
   * @return {@code (blank)} for blank, whole numbers without a fraction,
   *         {@code TRUE}/{@code FALSE} for booleans
   */
  static String display(Value value) {
    if (value.isBlank()) {
      return "(blank)";
    }
    if (value instanceof NumberValue number) {
      return NumberValue.formatNumber(number.value());
    }
    if (value instanceof BooleanValue bool) {
      return bool.value() ? "TRUE" : "FALSE";
    }
    return ((TextValue) value).value();
  }

  static String display(List<Value> key, String separator) {
    return key.stream().map(PivotKeys::display).filter(s -> !s.isEmpty()).collect(Collectors.joining(separator));
  }
}
