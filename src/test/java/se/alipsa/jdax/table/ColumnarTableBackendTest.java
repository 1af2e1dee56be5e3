package se.alipsa.jdax.table;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static se.alipsa.jdax.TestModels.values;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;
import se.alipsa.jdax.DaxException;
import se.alipsa.jdax.value.Value;

/** Tests for {@link ColumnarTableBackend} and the read-only table it backs. */
class ColumnarTableBackendTest {

  private final Table sales = Table.columnar("Sales", List.of("Region", "Amount"),
      List.of(values("North", "South", "North", null), values(10, 4, 6, "n/a")));

  @Test
  void exposesStatistics() {
    TableBackend backend = sales.backend();
    assertEquals(20.0, backend.statsSum(1).getAsDouble());
    assertEquals(4.0, backend.statsMin(1).getAsDouble());
    assertEquals(10.0, backend.statsMax(1).getAsDouble());
    assertEquals(4, backend.statsNonBlankCount(1).getAsLong());
    assertEquals(3, backend.statsNonBlankCount(0).getAsLong());
    assertEquals(3, backend.statsNumericCount(1).getAsLong());
    assertEquals(0, backend.statsNumericCount(0).getAsLong());
    assertEquals(2, backend.statsDistinctCount(0).getAsLong());
    assertTrue(backend.statsHasBlank(0).orElseThrow());
    assertFalse(backend.statsHasBlank(1).orElseThrow());
  }

  @Test
  void numericStatisticsAreEmptyWithoutNumbers() {
    assertTrue(sales.backend().statsSum(0).isEmpty());
    assertTrue(sales.backend().statsMin(0).isEmpty());
  }

  @Test
  void filtersByEqualityAndMembership() {
    BitSet north = sales.backend().filterEq(0, Value.of("North")).orElseThrow();
    assertEquals(Set.of(0, 2), north.stream().boxed().collect(Collectors.toSet()));
    BitSet blankOrSouth = sales.backend().filterIn(0, List.of(Value.BLANK, Value.of("South"))).orElseThrow();
    assertEquals(2, blankOrSouth.cardinality());
    assertTrue(sales.backend().filterEq(0, Value.of("East")).orElseThrow().isEmpty());
  }

  @Test
  void distinctValuesRespectRowSet() {
    BitSet rows = new BitSet();
    rows.set(1);
    rows.set(3);
    List<Value> distinct = sales.backend().distinctValuesFiltered(0, rows).orElseThrow();
    assertEquals(List.of(Value.of("South"), Value.BLANK), distinct);
    assertEquals(3, sales.backend().distinctValuesFiltered(0, null).orElseThrow().size());
  }

  @Test
  void groupsWithAggregations() {
    List<AggregationSpec> specs = List.of(AggregationSpec.countRows(), new AggregationSpec(AggregationKind.SUM, 1),
        new AggregationSpec(AggregationKind.COUNT_NUMBERS, 1));
    List<List<Value>> groups = new ArrayList<>(sales.backend().groupByAggregations(new int[] {0}, specs, null)
        .orElseThrow());
    groups.sort(Comparator.comparing(row -> row.get(0).toString()));
    assertEquals(List.of(Value.BLANK, Value.of(1), Value.BLANK, Value.of(0)), groups.get(0));
    assertEquals(List.of(Value.of("North"), Value.of(2), Value.of(16), Value.of(2)), groups.get(1));
    assertEquals(List.of(Value.of("South"), Value.of(1), Value.of(4), Value.of(1)), groups.get(2));
  }

  @Test
  void groupByHonoursRowSet() {
    BitSet rows = new BitSet();
    rows.set(0);
    List<List<Value>> groups = sales.backend().groupByAggregations(new int[] {0},
        List.of(new AggregationSpec(AggregationKind.MAX, 1)), rows).orElseThrow();
    assertEquals(List.of(List.of(Value.of("North"), Value.of(10))), groups);
  }

  @Test
  void rowsPastTheEndReadAsBlank() {
    assertEquals(Value.BLANK, sales.value(4, 0));
    assertEquals(Value.of("South"), sales.value(1, "region"));
  }

  @Test
  void columnarTablesAreReadOnly() {
    DaxException e = assertThrows(DaxException.class, () -> sales.pushRow("West", 1));
    assertEquals(DaxException.ErrorKind.READ_ONLY_TABLE, e.getKind());
  }

  @Test
  void rejectsColumnsOfDifferentLength() {
    DaxException e = assertThrows(DaxException.class,
        () -> Table.columnar("Bad", List.of("a", "b"), List.of(values(1, 2), values(1))));
    assertEquals(DaxException.ErrorKind.COLUMN_LENGTH_MISMATCH, e.getKind());
  }
}
