package se.alipsa.jdax.table;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.BitSet;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.OptionalLong;
import se.alipsa.jdax.value.Value;
import se.alipsa.jdax.value.Value.NumberValue;

/**
 * Immutable, dictionary encoded column store. Statistics are computed once at
 * construction; equality and membership filters, distinct enumeration and
 * grouped aggregation run on the integer codes.
 */
public final class ColumnarTableBackend implements TableBackend {

  private final int rowCount;
  private final EncodedColumn[] columns;

  private ColumnarTableBackend(int rowCount, EncodedColumn[] columns) {
    this.rowCount = rowCount;
    this.columns = columns;
  }

  /**
   * Build a backend from column-major data.
   *
   * @param columnValues
   *          one list per column, all of the same length
   * @return the encoded backend
   */
  public static ColumnarTableBackend fromColumns(List<List<Value>> columnValues) {
    Objects.requireNonNull(columnValues, "columnValues");
    int rows = columnValues.isEmpty() ? 0 : columnValues.get(0).size();
    EncodedColumn[] encoded = new EncodedColumn[columnValues.size()];
    for (int c = 0; c < encoded.length; c++) {
      List<Value> values = columnValues.get(c);
      if (values.size() != rows) {
        throw new IllegalArgumentException(
            "column " + c + " has " + values.size() + " values but column 0 has " + rows);
      }
      encoded[c] = EncodedColumn.encode(values);
    }
    return new ColumnarTableBackend(rows, encoded);
  }

  @Override
  public int rowCount() {
    return rowCount;
  }

  @Override
  public int columnCount() {
    return columns.length;
  }

  @Override
  public Value value(int row, int column) {
    if (row < 0 || row >= rowCount || column < 0 || column >= columns.length) {
      return Value.BLANK;
    }
    EncodedColumn col = columns[column];
    return col.dictionary[col.codes[row]];
  }

  @Override
  public OptionalDouble statsSum(int column) {
    EncodedColumn col = columns[column];
    return col.numericCount == 0 ? OptionalDouble.empty() : OptionalDouble.of(col.sum);
  }

  @Override
  public OptionalLong statsNonBlankCount(int column) {
    return OptionalLong.of(columns[column].nonBlankCount);
  }

  @Override
  public OptionalLong statsNumericCount(int column) {
    return OptionalLong.of(columns[column].numericCount);
  }

  @Override
  public OptionalDouble statsMin(int column) {
    EncodedColumn col = columns[column];
    return col.numericCount == 0 ? OptionalDouble.empty() : OptionalDouble.of(col.min);
  }

  @Override
  public OptionalDouble statsMax(int column) {
    EncodedColumn col = columns[column];
    return col.numericCount == 0 ? OptionalDouble.empty() : OptionalDouble.of(col.max);
  }

  @Override
  public OptionalLong statsDistinctCount(int column) {
    EncodedColumn col = columns[column];
    return OptionalLong.of(col.blankCode >= 0 ? col.dictionary.length - 1L : col.dictionary.length);
  }

  @Override
  public Optional<Boolean> statsHasBlank(int column) {
    return Optional.of(columns[column].blankCode >= 0);
  }

  @Override
  public Optional<List<Value>> dictionaryValues(int column) {
    return Optional.of(List.of(columns[column].dictionary));
  }

  @Override
  public Optional<BitSet> filterEq(int column, Value value) {
    EncodedColumn col = columns[column];
    Integer code = col.codeOf.get(value);
    BitSet out = new BitSet(rowCount);
    if (code == null) {
      return Optional.of(out);
    }
    int target = code;
    for (int row = 0; row < rowCount; row++) {
      if (col.codes[row] == target) {
        out.set(row);
      }
    }
    return Optional.of(out);
  }

  @Override
  public Optional<BitSet> filterIn(int column, Collection<Value> values) {
    EncodedColumn col = columns[column];
    boolean[] wanted = new boolean[col.dictionary.length];
    boolean any = false;
    for (Value v : values) {
      Integer code = col.codeOf.get(v);
      if (code != null) {
        wanted[code] = true;
        any = true;
      }
    }
    BitSet out = new BitSet(rowCount);
    if (!any) {
      return Optional.of(out);
    }
    for (int row = 0; row < rowCount; row++) {
      if (wanted[col.codes[row]]) {
        out.set(row);
      }
    }
    return Optional.of(out);
  }

  @Override
  public Optional<List<Value>> distinctValuesFiltered(int column, BitSet rows) {
    EncodedColumn col = columns[column];
    if (rows == null) {
      return Optional.of(List.of(col.dictionary));
    }
    boolean[] seen = new boolean[col.dictionary.length];
    List<Value> out = new ArrayList<>();
    for (int row = rows.nextSetBit(0); row >= 0 && row < rowCount; row = rows.nextSetBit(row + 1)) {
      int code = col.codes[row];
      if (!seen[code]) {
        seen[code] = true;
        out.add(col.dictionary[code]);
      }
    }
    return Optional.of(out);
  }

  @Override
  public Optional<List<List<Value>>> groupByAggregations(int[] groupBy, List<AggregationSpec> aggregations,
      BitSet rows) {
    Map<GroupCodes, AggregationState[]> groups = new LinkedHashMap<>();
    int row = rows == null ? 0 : rows.nextSetBit(0);
    while (row >= 0 && row < rowCount) {
      int[] codes = new int[groupBy.length];
      for (int i = 0; i < groupBy.length; i++) {
        codes[i] = columns[groupBy[i]].codes[row];
      }
      AggregationState[] states = groups.computeIfAbsent(new GroupCodes(codes), k -> newStates(aggregations));
      for (int i = 0; i < states.length; i++) {
        AggregationSpec spec = aggregations.get(i);
        states[i].update(spec.columnIndex() < 0 ? Value.BLANK : value(row, spec.columnIndex()));
      }
      row = rows == null ? row + 1 : rows.nextSetBit(row + 1);
    }
    List<List<Value>> out = new ArrayList<>(groups.size());
    for (Map.Entry<GroupCodes, AggregationState[]> entry : groups.entrySet()) {
      List<Value> line = new ArrayList<>(groupBy.length + aggregations.size());
      int[] codes = entry.getKey().codes();
      for (int i = 0; i < groupBy.length; i++) {
        line.add(columns[groupBy[i]].dictionary[codes[i]]);
      }
      for (AggregationState state : entry.getValue()) {
        line.add(state.result());
      }
      out.add(line);
    }
    return Optional.of(out);
  }

  private static AggregationState[] newStates(List<AggregationSpec> aggregations) {
    AggregationState[] states = new AggregationState[aggregations.size()];
    for (int i = 0; i < states.length; i++) {
      states[i] = new AggregationState(aggregations.get(i).kind());
    }
    return states;
  }

  /** Group key made of dictionary codes. */
  private record GroupCodes(int[] codes) {

    @Override
    public boolean equals(Object o) {
      return o instanceof GroupCodes other && Arrays.equals(codes, other.codes);
    }

    @Override
    public int hashCode() {
      return Arrays.hashCode(codes);
    }
  }

  /** One dictionary encoded column with its precomputed statistics. */
  private static final class EncodedColumn {
    private final Value[] dictionary;
    private final Map<Value, Integer> codeOf;
    private final int[] codes;
    private final int blankCode;
    private final double sum;
    private final long nonBlankCount;
    private final long numericCount;
    private final double min;
    private final double max;

    private EncodedColumn(Value[] dictionary, Map<Value, Integer> codeOf, int[] codes, double sum,
        long nonBlankCount, long numericCount, double min, double max) {
      this.dictionary = dictionary;
      this.codeOf = codeOf;
      this.codes = codes;
      Integer blank = codeOf.get(Value.BLANK);
      this.blankCode = blank == null ? -1 : blank;
      this.sum = sum;
      this.nonBlankCount = nonBlankCount;
      this.numericCount = numericCount;
      this.min = min;
      this.max = max;
    }

    static EncodedColumn encode(List<Value> values) {
      Map<Value, Integer> codeOf = new HashMap<>();
      List<Value> dictionary = new ArrayList<>();
      int[] codes = new int[values.size()];
      double sum = 0;
      long nonBlank = 0;
      long numeric = 0;
      double min = Double.POSITIVE_INFINITY;
      double max = Double.NEGATIVE_INFINITY;
      for (int i = 0; i < codes.length; i++) {
        Value v = values.get(i) == null ? Value.BLANK : values.get(i);
        Integer code = codeOf.get(v);
        if (code == null) {
          code = dictionary.size();
          dictionary.add(v);
          codeOf.put(v, code);
        }
        codes[i] = code;
        if (!v.isBlank()) {
          nonBlank++;
        }
        if (v instanceof NumberValue n) {
          numeric++;
          sum += n.value();
          min = Math.min(min, n.value());
          max = Math.max(max, n.value());
        }
      }
      return new EncodedColumn(dictionary.toArray(new Value[0]), Map.copyOf(codeOf), codes, sum, nonBlank,
          numeric, min, max);
    }
  }
}
