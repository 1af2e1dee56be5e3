package se.alipsa.jdax.engine;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import se.alipsa.jdax.TestModels;
import se.alipsa.jdax.model.CrossFilterDirection;
import se.alipsa.jdax.model.DataModel;
import se.alipsa.jdax.model.Relationship;
import se.alipsa.jdax.table.Table;
import se.alipsa.jdax.value.Value;

/** Tests for filter propagation across relationships and the virtual blank row. */
class FilterPropagationTest {

  private final DaxEngine engine = new DaxEngine();

  private Value eval(DataModel model, String expression) {
    return eval(model, expression, FilterContext.empty());
  }

  private Value eval(DataModel model, String expression, FilterContext filter) {
    return engine.evaluate(model, expression, filter, RowContext.empty());
  }

  @Test
  void dimensionFilterReachesFactTable() {
    for (DataModel model : List.of(TestModels.categories(), TestModels.columnarCategories())) {
      FilterContext alpha = FilterContext.empty().withColumnEquals("DimCategory", "Name", Value.of("Alpha"));
      assertEquals(Value.of(10), eval(model, "[Total]", alpha));
      assertEquals(Value.of(1), eval(model, "COUNTROWS(Fact)", alpha));
    }
  }

  @Test
  void singleDirectionDoesNotFilterDimensionFromFact() {
    DataModel model = TestModels.categories();
    FilterContext big = FilterContext.empty().withColumnEquals("Fact", "Amount", Value.of(10));
    assertEquals(Value.of(2), eval(model, "COUNTROWS(DimCategory)", big));
  }

  @Test
  void bothDirectionsFilterDimensionFromFact() {
    Table dim = new Table("DimCategory", List.of("CategoryId", "Name"));
    dim.pushRow("A", "Alpha");
    dim.pushRow("B", "Beta");
    Table fact = new Table("Fact", List.of("CategoryId", "Amount"));
    fact.pushRow("A", 10);
    fact.pushRow("B", 5);
    DataModel model = new DataModel().addTable(dim).addTable(fact);
    model.addRelationship(Relationship.of("r", "Fact", "CategoryId", "DimCategory", "CategoryId")
        .withCrossFilterDirection(CrossFilterDirection.BOTH));
    FilterContext big = FilterContext.empty().withColumnEquals("Fact", "Amount", Value.of(10));
    assertEquals(Value.of(1), eval(model, "COUNTROWS(DimCategory)", big));
    assertEquals(Value.of("Alpha"), eval(model, "SELECTEDVALUE(DimCategory[Name])", big));
  }

  @Test
  void filtersChainAcrossSnowflake() {
    Table group = new Table("Group", List.of("GroupId", "Label"));
    group.pushRow(1, "Fruit");
    group.pushRow(2, "Veg");
    Table product = new Table("Product", List.of("ProductId", "GroupId"));
    product.pushRow("apple", 1);
    product.pushRow("pear", 1);
    product.pushRow("leek", 2);
    Table sales = new Table("Sales", List.of("ProductId", "Qty"));
    sales.pushRow("apple", 3);
    sales.pushRow("pear", 4);
    sales.pushRow("leek", 5);
    DataModel model = new DataModel().addTable(group).addTable(product).addTable(sales);
    model.addRelationship(Relationship.of("p", "Product", "GroupId", "Group", "GroupId"));
    model.addRelationship(Relationship.of("s", "Sales", "ProductId", "Product", "ProductId"));
    FilterContext fruit = FilterContext.empty().withColumnEquals("Group", "Label", Value.of("Fruit"));
    assertEquals(Value.of(7), eval(model, "SUM(Sales[Qty])", fruit));
    Map<String, BitSet> sets = RowSetResolver.resolve(model, fruit);
    assertEquals(2, sets.get("sales").cardinality());
    assertEquals(2, sets.get("product").cardinality());
  }

  @Test
  void virtualBlankRowAppearsForUnmatchedFactRows() {
    for (DataModel model : List.of(TestModels.categoriesWithUnmatched(),
        TestModels.columnarCategoriesWithUnmatched())) {
      assertEquals(Value.of(3), eval(model, "COUNTROWS(VALUES(DimCategory[CategoryId]))"));
      assertEquals(Value.of(2), eval(model, "COUNTROWS(DimCategory)"));
      assertEquals(Value.of(2), eval(model, "COUNTROWS(ALLNOBLANKROW(DimCategory[CategoryId]))"));
      assertEquals(Value.of(3), eval(model, "DISTINCTCOUNT(DimCategory[CategoryId])"));
      assertEquals(Value.of(2), eval(model, "DISTINCTCOUNTNOBLANK(DimCategory[CategoryId])"));
      assertEquals(Value.of(1), eval(model, "COUNTBLANK(DimCategory[Name])"));
    }
  }

  @Test
  void noVirtualBlankRowWhenEveryFactRowMatches() {
    DataModel model = TestModels.categories();
    assertEquals(Value.of(2), eval(model, "COUNTROWS(VALUES(DimCategory[CategoryId]))"));
    assertEquals(Value.of(0), eval(model, "COUNTBLANK(DimCategory[Name])"));
    assertFalse(RowSetResolver.virtualBlankRowExists(model, FilterContext.empty(), "DimCategory", null));
  }

  @Test
  void blankDimensionFilterSelectsUnmatchedFactRows() {
    DataModel model = TestModels.categoriesWithUnmatched();
    FilterContext blank = FilterContext.empty().withColumnEquals("DimCategory", "CategoryId", Value.BLANK);
    assertEquals(Value.of(10), eval(model, "[Total]", blank));
    assertEquals(Value.of(25), eval(model, "[Total]"));
  }

  @Test
  void filterExcludingBlankHidesVirtualRow() {
    DataModel model = TestModels.categoriesWithUnmatched();
    FilterContext alpha = FilterContext.empty().withColumnEquals("DimCategory", "Name", Value.of("Alpha"));
    assertEquals(Value.of(1), eval(model, "COUNTROWS(VALUES(DimCategory[CategoryId]))", alpha));
    assertFalse(RowSetResolver.blankRowAllowed(alpha, "DimCategory"));
    assertTrue(RowSetResolver.blankRowAllowed(alpha, "Fact"));
  }

  @Test
  void virtualRowDependsOnVisibleFactRows() {
    DataModel model = TestModels.categoriesWithUnmatched();
    FilterContext matchedOnly = FilterContext.empty().withColumnIn("Fact", "Amount",
        List.of(Value.of(10), Value.of(5)));
    assertEquals(Value.of(2), eval(model, "COUNTROWS(VALUES(DimCategory[CategoryId]))", matchedOnly));
    FilterContext unmatched = FilterContext.empty().withColumnEquals("Fact", "Amount", Value.of(7));
    assertEquals(Value.of(3), eval(model, "COUNTROWS(VALUES(DimCategory[CategoryId]))", unmatched));
  }

  @Test
  void inactiveRelationshipDoesNotPropagate() {
    Table dim = new Table("Dim", List.of("Id"));
    dim.pushRow(1);
    dim.pushRow(2);
    Table fact = new Table("F", List.of("Id", "V"));
    fact.pushRow(1, 100);
    fact.pushRow(2, 1);
    DataModel model = new DataModel().addTable(dim).addTable(fact);
    model.addRelationship(Relationship.of("r", "F", "Id", "Dim", "Id").withActive(false));
    FilterContext one = FilterContext.empty().withColumnEquals("Dim", "Id", Value.of(1));
    assertEquals(Value.of(101), eval(model, "SUM(F[V])", one));
  }

  @Test
  void addingFiltersNeverWidensAnyTable() {
    Table category = new Table("DimCategory", List.of("CategoryId", "Name"));
    category.pushRow("A", "Alpha");
    category.pushRow("B", "Beta");
    Table region = new Table("DimRegion", List.of("Region", "Name"));
    region.pushRow("N", "North");
    region.pushRow("S", "South");
    Table fact = new Table("Fact", List.of("CategoryId", "Region", "Amount"));
    fact.pushRow("A", "N", 10);
    fact.pushRow("B", "S", 5);
    fact.pushRow("X", "N", 7);
    fact.pushRow(null, "S", 3);
    DataModel model = new DataModel().addTable(category).addTable(region).addTable(fact);
    model.addRelationship(Relationship.of("Fact_Category", "Fact", "CategoryId", "DimCategory", "CategoryId"));
    model.addRelationship(Relationship.of("Fact_Region", "Fact", "Region", "DimRegion", "Region")
        .withCrossFilterDirection(CrossFilterDirection.BOTH));

    List<FilterContext> steps = new ArrayList<>();
    FilterContext filter = FilterContext.empty();
    steps.add(filter);
    filter = filter.withColumnIn("DimCategory", "Name", TestModels.values("Alpha", null));
    steps.add(filter);
    filter = filter.withColumnIn("Fact", "Amount", TestModels.values(10, 7, 3));
    steps.add(filter);
    filter = filter.withColumnEquals("DimRegion", "Name", Value.of("North"));
    steps.add(filter);
    filter = filter.withColumnEquals("DimCategory", "CategoryId", Value.of("A"));
    steps.add(filter);

    Map<String, BitSet> previous = RowSetResolver.resolve(model, steps.get(0));
    for (FilterContext step : steps.subList(1, steps.size())) {
      Map<String, BitSet> current = RowSetResolver.resolve(model, step);
      for (Map.Entry<String, BitSet> entry : previous.entrySet()) {
        BitSet now = current.get(entry.getKey());
        assertTrue(now.cardinality() <= entry.getValue().cardinality(), entry.getKey() + " grew under " + step);
        BitSet added = (BitSet) now.clone();
        added.andNot(entry.getValue());
        assertTrue(added.isEmpty(), entry.getKey() + " gained rows " + added + " under " + step);
      }
      previous = current;
    }

    Map<String, BitSet> withBlank = RowSetResolver.resolve(model, steps.get(1));
    assertEquals(BitSet.valueOf(new long[] {0b1101}), withBlank.get("fact"));
    assertEquals(BitSet.valueOf(new long[] {0b11}), withBlank.get("dimregion"));
    assertEquals(BitSet.valueOf(new long[] {0b1}), previous.get("fact"));
    assertEquals(BitSet.valueOf(new long[] {0b1}), previous.get("dimregion"));
  }
}
