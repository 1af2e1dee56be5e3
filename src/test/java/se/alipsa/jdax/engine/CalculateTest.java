package se.alipsa.jdax.engine;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import se.alipsa.jdax.DaxException;
import se.alipsa.jdax.DaxException.ErrorKind;
import se.alipsa.jdax.TestModels;
import se.alipsa.jdax.model.DataModel;
import se.alipsa.jdax.model.Relationship;
import se.alipsa.jdax.table.Table;
import se.alipsa.jdax.value.Value;

/** Tests for {@code CALCULATE}, its filter arguments and context transition. */
class CalculateTest {

  private final DaxEngine engine = new DaxEngine();
  private DataModel model;

  @BeforeEach
  void setUp() {
    model = TestModels.categories();
  }

  private Value eval(String expression) {
    return eval(expression, FilterContext.empty());
  }

  private Value eval(String expression, FilterContext filter) {
    return engine.evaluate(model, expression, filter, RowContext.empty());
  }

  private static FilterContext name(String name) {
    return FilterContext.empty().withColumnEquals("DimCategory", "Name", Value.of(name));
  }

  @Test
  void columnComparisonReplacesExistingFilter() {
    assertEquals(Value.of(5), eval("CALCULATE([Total], DimCategory[Name] = \"Beta\")", name("Alpha")));
    assertEquals(Value.of(10), eval("CALCULATE([Total], Fact[Amount] > 6)"));
    assertEquals(Value.of(15), eval("CALCULATE([Total], Fact[Amount] >= 5)"));
  }

  @Test
  void keepFiltersIntersects() {
    assertEquals(Value.BLANK,
        eval("CALCULATE([Total], KEEPFILTERS(DimCategory[Name] = \"Beta\"))", name("Alpha")));
    assertEquals(Value.of(10),
        eval("CALCULATE([Total], KEEPFILTERS(DimCategory[Name] = \"Alpha\"))", name("Alpha")));
  }

  @Test
  void argumentOrderDoesNotMatter() {
    Value first = eval("CALCULATE([Total], ALL(DimCategory), DimCategory[Name] = \"Beta\")", name("Alpha"));
    Value second = eval("CALCULATE([Total], DimCategory[Name] = \"Beta\", ALL(DimCategory))", name("Alpha"));
    assertEquals(Value.of(5), first);
    assertEquals(first, second);
  }

  @Test
  void allRemovesFilters() {
    assertEquals(Value.of(15), eval("CALCULATE([Total], ALL(DimCategory))", name("Alpha")));
    assertEquals(Value.of(15), eval("CALCULATE([Total], REMOVEFILTERS(DimCategory[Name]))", name("Alpha")));
    assertEquals(Value.of(15), eval("CALCULATE([Total], ALLEXCEPT(DimCategory, DimCategory[CategoryId]))",
        name("Alpha")));
  }

  @Test
  void allExceptKeepsListedColumns() {
    FilterContext filter = FilterContext.empty().withColumnEquals("DimCategory", "CategoryId", Value.of("B"))
        .withColumnEquals("DimCategory", "Name", Value.of("Beta"));
    assertEquals(Value.of(5), eval("CALCULATE([Total], ALLEXCEPT(DimCategory, DimCategory[CategoryId]))", filter));
  }

  @Test
  void booleanFilterOverSeveralColumnsOfOneTable() {
    assertEquals(Value.of(10),
        eval("CALCULATE([Total], DimCategory[Name] = \"Alpha\" || DimCategory[CategoryId] = \"Z\")"));
    DaxException e = assertThrows(DaxException.class,
        () -> eval("CALCULATE([Total], DimCategory[Name] = \"Alpha\" && Fact[Amount] > 1)"));
    assertEquals(ErrorKind.EVAL, e.getKind());
    assertTrue(e.getMessage().contains("exactly one table"), e.getMessage());
  }

  @Test
  void filterTableArgumentFiltersRows() {
    assertEquals(Value.of(5), eval("CALCULATE([Total], FILTER(Fact, Fact[Amount] < 6))"));
    assertEquals(Value.of(10),
        eval("CALCULATE([Total], FILTER(ALL(DimCategory[Name]), DimCategory[Name] <> \"Beta\"))"));
  }

  @Test
  void valuesAndTreatAsFilterByValue() {
    assertEquals(Value.of(10), eval("CALCULATE([Total], VALUES(DimCategory[Name]))", name("Alpha")));
    Table other = new Table("Other", List.of("Code"));
    other.pushRow("B");
    model.addTable(other);
    assertEquals(Value.of(5), eval("CALCULATE([Total], TREATAS(VALUES(Other[Code]), DimCategory[CategoryId]))"));
  }

  @Test
  void contextTransitionInsideIterator() {
    assertEquals(Value.of(15), eval("SUMX(DimCategory, [Total])"));
    assertEquals(Value.of(15), eval("SUMX(DimCategory, CALCULATE(SUM(Fact[Amount])))"));
    assertEquals(Value.of(30), eval("SUMX(DimCategory, SUM(Fact[Amount]))"));
  }

  @Test
  void contextTransitionIgnoresUnmatchedRowsOfIteratedTable() {
    model = TestModels.categoriesWithUnmatched();
    assertEquals(Value.of(25), eval("[Total]"));
    assertEquals(Value.of(15), eval("SUMX(DimCategory, [Total])"));
  }

  @Test
  void measureInsideFilterPredicateTransitions() {
    assertEquals(Value.of(1), eval("COUNTROWS(FILTER(DimCategory, [Total] > 7))"));
    assertEquals(Value.of(1), eval("CALCULATE(COUNTROWS(FILTER(DimCategory, [Total] > 7)))"));
  }

  @Test
  void contextTransitionOfSingleColumnRowsOnlyReplacesThatColumn() {
    FilterContext filter = FilterContext.empty().withColumnEquals("DimCategory", "CategoryId", Value.of("A"));
    assertEquals(Value.of(10), eval("SUMX(VALUES(DimCategory[Name]), [Total])", filter));
  }

  @Test
  void applyCalculateFiltersExposesResultingContext() {
    FilterContext result = engine.applyCalculateFilters(model, name("Alpha"), "DimCategory[Name] = \"Beta\"",
        "KEEPFILTERS(DimCategory[CategoryId] = \"B\")");
    assertEquals(Set.of(Value.of("Beta")), result.columnFilter("DimCategory", "Name"));
    assertEquals(Set.of(Value.of("B")), result.columnFilter("DimCategory", "CategoryId"));

    FilterContext cleared = engine.applyCalculateFilters(model, name("Alpha"), "ALL(DimCategory)");
    assertNull(cleared.columnFilter("DimCategory", "Name"));
    assertTrue(cleared.isEmpty());
  }

  @Test
  void rejectsUnsupportedFilterShapes() {
    DaxException e = assertThrows(DaxException.class, () -> eval("CALCULATE([Total], 1 + 1)"));
    assertEquals(ErrorKind.EVAL, e.getKind());
  }

  @Test
  void crossFilterBothLetsFactFilterDimension() {
    assertEquals(Value.of(2), eval("CALCULATE(COUNTROWS(DimCategory), Fact[Amount] > 6)"));
    assertEquals(Value.of(1), eval("CALCULATE(COUNTROWS(DimCategory), Fact[Amount] > 6, "
        + "CROSSFILTER(Fact[CategoryId], DimCategory[CategoryId], BOTH))"));
  }

  @Test
  void crossFilterNoneDisablesRelationship() {
    assertEquals(Value.of(15), eval(
        "CALCULATE([Total], CROSSFILTER(Fact[CategoryId], DimCategory[CategoryId], NONE))", name("Alpha")));
  }

  @Test
  void crossFilterOneWayReverse() {
    String fromFact = "CALCULATE(COUNTROWS(DimCategory), Fact[Amount] > 6, "
        + "CROSSFILTER(Fact[CategoryId], DimCategory[CategoryId], ONEWAY_LEFTFILTERSRIGHT))";
    assertEquals(Value.of(1), eval(fromFact));
    String fromDim = "CALCULATE([Total], CROSSFILTER(Fact[CategoryId], DimCategory[CategoryId], "
        + "ONEWAY_LEFTFILTERSRIGHT))";
    assertEquals(Value.of(15), eval(fromDim, name("Alpha")));
  }

  @Test
  void crossFilterRequiresExistingRelationship() {
    DaxException e = assertThrows(DaxException.class, () -> eval(
        "CALCULATE([Total], CROSSFILTER(Fact[Amount], DimCategory[Name], BOTH))"));
    assertEquals(ErrorKind.EVAL, e.getKind());
    assertTrue(e.getMessage().startsWith("no relationship found between Fact[Amount] and DimCategory[Name]"));
  }

  @Test
  void useRelationshipActivatesInactiveRelationship() {
    Table date = new Table("Date", List.of("Day"));
    date.pushRow(1);
    date.pushRow(2);
    date.pushRow(3);
    Table sales = new Table("Sales", List.of("OrderDay", "ShipDay", "Amount"));
    sales.pushRow(1, 2, 10);
    sales.pushRow(2, 3, 20);
    model = new DataModel().addTable(date).addTable(sales);
    model.addRelationship(Relationship.of("order", "Sales", "OrderDay", "Date", "Day"));
    int ship = model.addRelationship(Relationship.of("ship", "Sales", "ShipDay", "Date", "Day").withActive(false));
    FilterContext day2 = FilterContext.empty().withColumnEquals("Date", "Day", Value.of(2));

    assertEquals(Value.of(20), eval("SUM(Sales[Amount])", day2));
    assertEquals(Value.of(10),
        eval("CALCULATE(SUM(Sales[Amount]), USERELATIONSHIP(Sales[ShipDay], 'Date'[Day]))", day2));
    FilterContext applied = engine.applyCalculateFilters(model, day2, "USERELATIONSHIP(Date[Day], Sales[ShipDay])");
    assertTrue(applied.isActivated(ship));
    assertFalse(RowSetResolver.isRelationshipActive(model, applied, 0));
  }
}
