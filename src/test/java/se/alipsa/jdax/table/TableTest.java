package se.alipsa.jdax.table;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static se.alipsa.jdax.TestModels.values;

import java.util.List;
import org.junit.jupiter.api.Test;
import se.alipsa.jdax.DaxException;
import se.alipsa.jdax.value.Value;

/** Tests for mutable in-memory {@link Table}s. */
class TableTest {

  @Test
  void looksUpColumnsCaseInsensitively() {
    Table table = new Table("People", List.of("Name", "Age"));
    assertEquals(1, table.columnIndex("age"));
    assertEquals(-1, table.columnIndex("Height"));
    DaxException e = assertThrows(DaxException.class, () -> table.requireColumn("Height"));
    assertEquals(DaxException.ErrorKind.UNKNOWN_COLUMN, e.getKind());
    assertEquals("unknown column People[Height]", e.getMessage());
  }

  @Test
  void rejectsDuplicateColumnNames() {
    DaxException e = assertThrows(DaxException.class, () -> new Table("T", List.of("a", "A")));
    assertEquals(DaxException.ErrorKind.DUPLICATE_COLUMN, e.getKind());
  }

  @Test
  void appendsAndRollsBackRows() {
    Table table = new Table("People", List.of("Name", "Age"));
    assertTrue(table.isMutable());
    table.pushRow("Ann", 31);
    table.pushRow("Bo", null);
    assertEquals(2, table.rowCount());
    assertEquals(Value.BLANK, table.value(1, "Age"));
    table.rollbackLastRow();
    assertEquals(1, table.rowCount());
  }

  @Test
  void rejectsRowsOfWrongWidth() {
    Table table = new Table("People", List.of("Name", "Age"));
    DaxException e = assertThrows(DaxException.class, () -> table.pushRow("Ann"));
    assertEquals(DaxException.ErrorKind.SCHEMA_MISMATCH, e.getKind());
  }

  @Test
  void addsAndRemovesMaterializedColumns() {
    Table table = new Table("People", List.of("Name"));
    table.pushRow("Ann");
    table.addColumn("Score", values(7));
    assertEquals(Value.of(7), table.value(0, "Score"));
    table.rollbackLastColumn();
    assertEquals(List.of("Name"), table.columns());
    DaxException e = assertThrows(DaxException.class, () -> table.addColumn("Score", values(1, 2)));
    assertEquals(DaxException.ErrorKind.COLUMN_LENGTH_MISMATCH, e.getKind());
  }

  @Test
  void inMemoryBackendOffersNoAcceleration() {
    Table table = new Table("People", List.of("Name"));
    table.pushRow("Ann");
    assertTrue(table.backend().statsSum(0).isEmpty());
    assertTrue(table.backend().filterEq(0, Value.of("Ann")).isEmpty());
    assertTrue(table.backend().groupByAggregations(new int[] {0}, List.of(), null).isEmpty());
  }
}
