package se.alipsa.jdax.model;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;
import se.alipsa.jdax.DaxException;
import se.alipsa.jdax.DaxException.ErrorKind;
import se.alipsa.jdax.TestModels;
import se.alipsa.jdax.engine.DaxEngine;
import se.alipsa.jdax.engine.FilterContext;
import se.alipsa.jdax.table.InMemoryTableBackend;
import se.alipsa.jdax.table.MutableTableBackend;
import se.alipsa.jdax.table.Table;
import se.alipsa.jdax.value.Value;

/** Tests for calculated columns. */
class CalculatedColumnTest {

  private static DataModel orders() {
    Table orders = new Table("Orders", List.of("Qty", "Price"));
    orders.pushRow(2, 3.5);
    orders.pushRow(1, 10);
    return new DataModel().addTable(orders);
  }

  @Test
  void computesValuesForExistingRows() {
    DataModel model = orders();
    model.addCalculatedColumn("Orders", "LineTotal", "Orders[Qty] * Orders[Price]");
    Table orders = model.requireTable("Orders");
    assertEquals(Value.of(7), orders.value(0, "LineTotal"));
    assertEquals(Value.of(10), orders.value(1, "LineTotal"));
    assertTrue(model.isCalculatedColumn("orders", "linetotal"));
  }

  @Test
  void insertComputesCalculatedColumnsInDependencyOrder() {
    DataModel model = orders();
    model.addCalculatedColumn("Orders", "LineTotal", "Orders[Qty] * Orders[Price]");
    model.addCalculatedColumn("Orders", "Label", "\"total \" & [LineTotal]");
    model.insertRow("Orders", 3, 2);
    Table orders = model.requireTable("Orders");
    assertEquals(Value.of(6), orders.value(2, "LineTotal"));
    assertEquals(Value.of("total 6"), orders.value(2, "Label"));
  }

  @Test
  void insertAcceptsFullRowsToo() {
    DataModel model = orders();
    model.addCalculatedColumn("Orders", "LineTotal", "Orders[Qty] * Orders[Price]");
    model.insertRow("Orders", 4, 1, 999);
    assertEquals(Value.of(4), model.requireTable("Orders").value(2, "LineTotal"));
  }

  @Test
  void calculatedColumnCanUseRelated() {
    DataModel model = TestModels.categories();
    model.addCalculatedColumn("Fact", "CategoryName", "RELATED(DimCategory[Name])");
    assertEquals(Value.of("Beta"), model.requireTable("Fact").value(1, "CategoryName"));
  }

  @Test
  void calculatedColumnSeesMeasuresThroughContextTransition() {
    DataModel model = TestModels.categories();
    model.addCalculatedColumn("DimCategory", "CategoryTotal", "[Total]");
    Table dim = model.requireTable("DimCategory");
    assertEquals(Value.of(10), dim.value(0, "CategoryTotal"));
    assertEquals(Value.of(5), dim.value(1, "CategoryTotal"));
  }

  @Test
  void dependencyCycleIsRejectedAndRolledBack() {
    Table t = new Table("T", List.of("a", "b"));
    t.pushRow(1, 2);
    DataModel model = new DataModel().addTable(t);
    model.addCalculatedColumnDefinition("T", "a", "T[b] + 1");
    DaxException e = assertThrows(DaxException.class, () -> model.addCalculatedColumnDefinition("T", "b", "[a] + 1"));
    assertEquals(ErrorKind.EVAL, e.getKind());
    assertEquals("calculated column dependency cycle in T: a -> b -> a", e.getMessage());
    assertEquals(1, model.calculatedColumns().size());
  }

  @Test
  void failedEvaluationLeavesTableUnchanged() {
    DataModel model = orders();
    DaxException e = assertThrows(DaxException.class,
        () -> model.addCalculatedColumn("Orders", "Bad", "Orders[Missing] + 1"));
    assertEquals(ErrorKind.UNKNOWN_COLUMN, e.getKind());
    assertEquals(List.of("Qty", "Price"), model.requireTable("Orders").columns());
  }

  @Test
  void readOnlyTablesRejectCalculatedColumns() {
    DataModel model = TestModels.columnarCategories();
    DaxException e = assertThrows(DaxException.class,
        () -> model.addCalculatedColumn("Fact", "Double", "Fact[Amount] * 2"));
    assertEquals(ErrorKind.READ_ONLY_TABLE, e.getKind());
  }

  @Test
  void duplicateColumnNameIsRejected() {
    DataModel model = orders();
    DaxException e = assertThrows(DaxException.class, () -> model.addCalculatedColumn("Orders", "qty", "1"));
    assertEquals(ErrorKind.DUPLICATE_COLUMN, e.getKind());
  }

  @Test
  void calculatedColumnsFeedMeasures() {
    DataModel model = orders();
    model.addCalculatedColumn("Orders", "LineTotal", "Orders[Qty] * Orders[Price]");
    model.addMeasure("Revenue", "SUM(Orders[LineTotal])");
    assertEquals(Value.of(17), model.evaluateMeasure("Revenue", FilterContext.empty()));
  }

  @Test
  void insertRollsBackWhenStorageRejectsACalculatedValue() {
    Table orders = new Table("Orders", List.of("Qty", "Price"), new ReadMostlyBackend(2));
    orders.pushRow(2, 3.5);
    DataModel model = new DataModel().addTable(orders);
    model.addCalculatedColumn("Orders", "LineTotal", "Orders[Qty] * Orders[Price]");

    IllegalStateException e = assertThrows(IllegalStateException.class, () -> model.insertRow("Orders", 3, 2));
    assertEquals("cells are write-once", e.getMessage());
    assertEquals(1, orders.rowCount());
    assertEquals(Value.of(7), orders.value(0, "LineTotal"));
  }

  @Test
  void calculatedColumnsUseTheModelEngineOptions() {
    DataModel.Options shallow = DataModel.Options.builder()
        .engineOptions(DaxEngine.Options.builder().maxRecursionDepth(1).build())
        .build();
    DataModel limited = orders(shallow);
    limited.addMeasure("Base", "1");
    limited.addMeasure("Wrapped", "[Base] + 1");
    DaxException e = assertThrows(DaxException.class,
        () -> limited.addCalculatedColumn("Orders", "Score", "[Wrapped]"));
    assertTrue(e.getMessage().contains("maximum measure recursion depth 1 exceeded"), e.getMessage());
    assertEquals(-1, limited.requireTable("Orders").columnIndex("Score"));

    DataModel unlimited = orders(DataModel.Options.defaults());
    unlimited.addMeasure("Base", "1");
    unlimited.addMeasure("Wrapped", "[Base] + 1");
    unlimited.addCalculatedColumn("Orders", "Score", "[Wrapped]");
    assertEquals(Value.of(2), unlimited.requireTable("Orders").value(0, "Score"));
  }

  private static DataModel orders(DataModel.Options options) {
    Table orders = new Table("Orders", List.of("Qty", "Price"));
    orders.pushRow(2, 3.5);
    return new DataModel(options).addTable(orders);
  }

  /** Storage that appends rows and columns but refuses to overwrite cells. */
  private static final class ReadMostlyBackend implements MutableTableBackend {
    private final InMemoryTableBackend delegate;

    ReadMostlyBackend(int columnCount) {
      this.delegate = new InMemoryTableBackend(columnCount);
    }

    @Override
    public int rowCount() {
      return delegate.rowCount();
    }

    @Override
    public int columnCount() {
      return delegate.columnCount();
    }

    @Override
    public Value value(int row, int column) {
      return delegate.value(row, column);
    }

    @Override
    public void pushRow(List<Value> values) {
      delegate.pushRow(values);
    }

    @Override
    public void removeLastRow() {
      delegate.removeLastRow();
    }

    @Override
    public void setValue(int row, int column, Value value) {
      throw new IllegalStateException("cells are write-once");
    }

    @Override
    public void addColumn(List<Value> values) {
      delegate.addColumn(values);
    }

    @Override
    public void removeLastColumn() {
      delegate.removeLastColumn();
    }
  }
}
