package se.alipsa.jdax.pivot;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static se.alipsa.jdax.TestModels.values;

import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import se.alipsa.jdax.DaxException;
import se.alipsa.jdax.DaxException.ErrorKind;
import se.alipsa.jdax.TestModels;
import se.alipsa.jdax.engine.FilterContext;
import se.alipsa.jdax.model.DataModel;
import se.alipsa.jdax.table.Table;
import se.alipsa.jdax.value.Value;

/** Tests for grouped measure evaluation and strategy selection. */
class PivotEngineTest {

  private static final List<PivotMeasure> TOTAL = List.of(PivotMeasure.of("Total", "[Total]"));
  private static final List<GroupByColumn> BY_NAME = List.of(GroupByColumn.of("DimCategory", "Name"));
  private static final List<GroupByColumn> BY_KEY = List.of(GroupByColumn.of("Fact", "CategoryId"));

  private static PivotResult pivot(DataModel model, List<GroupByColumn> groupBy, List<PivotMeasure> measures,
      PivotEngine.Options options) {
    return new PivotEngine(options).pivot(model, "Fact", groupBy, measures, FilterContext.empty());
  }

  private static PivotResult pivot(DataModel model, List<GroupByColumn> groupBy, List<PivotMeasure> measures) {
    return pivot(model, groupBy, measures, PivotEngine.Options.defaults());
  }

  @Test
  void groupsOnBaseColumnsUseColumnarGroupBy() {
    PivotResult result = pivot(TestModels.columnarCategories(), BY_KEY, TOTAL);
    assertEquals(PivotStrategy.COLUMNAR_GROUP_BY, result.strategy());
    assertEquals(List.of("Fact[CategoryId]", "Total"), result.columns());
    assertEquals(List.of(values("A", 10), values("B", 5)), result.rows());
  }

  @Test
  void unplannableMeasureIsEvaluatedPerColumnarGroup() {
    List<PivotMeasure> measures = List.of(PivotMeasure.of("Iterated", "SUMX(Fact, Fact[Amount] * 2)"));
    PivotResult result = pivot(TestModels.columnarCategories(), BY_KEY, measures);
    assertEquals(PivotStrategy.COLUMNAR_GROUPS_WITH_MEASURE_EVAL, result.strategy());
    assertEquals(List.of(values("A", 20), values("B", 10)), result.rows());
  }

  @Test
  void planDepthLimitsMeasureExpansion() {
    PivotEngine.Options options = PivotEngine.Options.builder().maxPlanDepth(0).build();
    PivotResult result = pivot(TestModels.columnarCategories(), BY_KEY, TOTAL, options);
    assertEquals(PivotStrategy.COLUMNAR_GROUPS_WITH_MEASURE_EVAL, result.strategy());
    assertEquals(List.of(values("A", 10), values("B", 5)), result.rows());
  }

  @Test
  void dimensionAttributesRollUpFromForeignKeys() {
    PivotResult result = pivot(TestModels.columnarCategories(), BY_NAME, TOTAL);
    assertEquals(PivotStrategy.STAR_SCHEMA_ROLLUP, result.strategy());
    assertEquals(List.of("DimCategory[Name]", "Total"), result.columns());
    assertEquals(List.of(values("Alpha", 10), values("Beta", 5)), result.rows());
  }

  @Test
  void averagesAreNotRolledUp() {
    List<PivotMeasure> measures = List.of(PivotMeasure.of("Avg", "AVERAGE(Fact[Amount])"));
    PivotResult result = pivot(TestModels.columnarCategoriesWithUnmatched(), BY_NAME, measures);
    assertEquals(PivotStrategy.PLANNED_ROW_GROUP_BY, result.strategy());
    assertEquals(List.of(values(null, 5), values("Alpha", 10), values("Beta", 5)), result.rows());
  }

  @Test
  void inMemoryTablesUsePlannedRowGroupBy() {
    PivotResult result = pivot(TestModels.categories(), BY_NAME, TOTAL);
    assertEquals(PivotStrategy.PLANNED_ROW_GROUP_BY, result.strategy());
    assertEquals(List.of(values("Alpha", 10), values("Beta", 5)), result.rows());
  }

  @Test
  void unplannableMeasureOnInMemoryTablesFallsBackToRowScan() {
    List<PivotMeasure> measures = List.of(PivotMeasure.of("Share",
        "DIVIDE([Total], CALCULATE([Total], ALL(DimCategory)))"));
    PivotResult result = pivot(TestModels.categories(), BY_NAME, measures);
    assertEquals(PivotStrategy.ROW_SCAN, result.strategy());
    assertEquals(List.of(values("Alpha", 10.0 / 15), values("Beta", 5.0 / 15)), result.rows());
  }

  @Test
  void grandTotalWithoutGroupColumns() {
    PivotResult result = pivot(TestModels.categories(), List.of(), TOTAL);
    assertEquals(PivotStrategy.ROW_SCAN, result.strategy());
    assertEquals(List.of(values(15)), result.rows());
  }

  @Test
  void unmatchedFactRowsFormABlankGroupSortedFirst() {
    List<List<Value>> expected = List.of(values(null, 10), values("Alpha", 10), values("Beta", 5));
    assertEquals(expected, pivot(TestModels.columnarCategoriesWithUnmatched(), BY_NAME, TOTAL).rows());
    assertEquals(expected, pivot(TestModels.categoriesWithUnmatched(), BY_NAME, TOTAL).rows());
  }

  @ParameterizedTest
  @EnumSource(PivotStrategy.class)
  void everyStrategyProducesTheSameRows(PivotStrategy strategy) {
    List<PivotMeasure> measures = List.of(
        PivotMeasure.of("Total", "[Total]"),
        PivotMeasure.of("Avg", "AVERAGE(Fact[Amount])"),
        PivotMeasure.of("Rows", "COUNTROWS(Fact)"),
        PivotMeasure.of("Keys", "DISTINCTCOUNT(Fact[CategoryId])"));
    List<GroupByColumn> groupBy = List.of(GroupByColumn.of("Fact", "CategoryId"),
        GroupByColumn.of("DimCategory", "Name"));
    PivotEngine.Options options = PivotEngine.Options.builder().only(strategy).build();
    PivotResult result = pivot(TestModels.columnarCategoriesWithUnmatched(), groupBy, measures, options);

    assertEquals(List.of(
        values(null, null, 3, 3, 1, 1),
        values("A", "Alpha", 10, 10, 1, 1),
        values("B", "Beta", 5, 5, 1, 1),
        values("X", null, 7, 7, 1, 1)), result.rows());
  }

  @Test
  void starSchemaRollupUsedWhenForced() {
    PivotEngine.Options options = PivotEngine.Options.builder().only(PivotStrategy.STAR_SCHEMA_ROLLUP).build();
    List<GroupByColumn> groupBy = List.of(GroupByColumn.of("Fact", "CategoryId"),
        GroupByColumn.of("DimCategory", "Name"));
    PivotResult result = pivot(TestModels.columnarCategoriesWithUnmatched(), groupBy, TOTAL, options);
    assertEquals(PivotStrategy.STAR_SCHEMA_ROLLUP, result.strategy());
  }

  @Test
  void outerFilterRestrictsGroups() {
    FilterContext alpha = FilterContext.empty().withColumnEquals("DimCategory", "Name", Value.of("Alpha"));
    PivotResult columnar = new PivotEngine().pivot(TestModels.columnarCategories(), "Fact", BY_NAME, TOTAL, alpha);
    assertEquals(List.of(values("Alpha", 10)), columnar.rows());
    PivotResult scanned = new PivotEngine().pivot(TestModels.categories(), "Fact", BY_NAME, TOTAL, alpha);
    assertEquals(List.of(values("Alpha", 10)), scanned.rows());
  }

  @Test
  void disablingStrategies() {
    PivotEngine.Options options = PivotEngine.Options.builder().disable(PivotStrategy.COLUMNAR_GROUP_BY).build();
    assertEquals(PivotStrategy.COLUMNAR_GROUPS_WITH_MEASURE_EVAL,
        pivot(TestModels.columnarCategories(), BY_KEY, TOTAL, options).strategy());
    assertThrows(IllegalArgumentException.class,
        () -> PivotEngine.Options.builder().disable(PivotStrategy.ROW_SCAN));
  }

  @Test
  void evaluationErrorsPropagateFromEvaluatedMeasures() {
    List<PivotMeasure> measures = List.of(PivotMeasure.of("Bad", "SUMX(Fact, Fact[CategoryId])"));
    DaxException e = assertThrows(DaxException.class,
        () -> pivot(TestModels.categories(), BY_NAME, measures));
    assertEquals(ErrorKind.TYPE, e.getKind());
  }

  @Test
  void plannedMeasuresYieldBlankInsteadOfTypeErrors() {
    List<PivotMeasure> measures = List.of(PivotMeasure.of("Odd", "[Total] + \"x\""));
    PivotResult result = pivot(TestModels.categories(), BY_NAME, measures);
    assertEquals(PivotStrategy.PLANNED_ROW_GROUP_BY, result.strategy());
    assertEquals(List.of(values("Alpha", null), values("Beta", null)), result.rows());
  }

  private static DataModel sales() {
    Table sales = new Table("Sales", List.of("Region", "Year", "Amount"));
    sales.pushRow("North", 2023, 10.0);
    sales.pushRow("North", 2024, 5.0);
    sales.pushRow("South", 2024, 7.0);
    DataModel model = new DataModel();
    model.addTable(sales);
    model.addMeasure("Total", "SUM(Sales[Amount])");
    return model;
  }

  @Test
  void crosstabFillsMissingCombinationsWithBlank() {
    PivotGrid grid = new PivotEngine().pivotCrosstab(sales(), "Sales", List.of(GroupByColumn.of("Sales", "Region")),
        List.of(GroupByColumn.of("Sales", "Year")), TOTAL, FilterContext.empty());
    assertEquals(values("Sales[Region]", "2023", "2024"), grid.header());
    assertEquals(List.of(values("North", 10, 5), values("South", null, 7)), grid.body());
  }

  @Test
  void crosstabHeadersCarryMeasureNamesForSeveralMeasures() {
    List<PivotMeasure> measures = List.of(PivotMeasure.of("Total", "[Total]"),
        PivotMeasure.of("Rows", "COUNTROWS(Sales)"));
    PivotGrid grid = new PivotEngine().pivotCrosstab(sales(), "Sales", List.of(GroupByColumn.of("Sales", "Region")),
        List.of(GroupByColumn.of("Sales", "Year")), measures, FilterContext.empty());
    assertEquals(values("Sales[Region]", "2023 - Total", "2023 - Rows", "2024 - Total", "2024 - Rows"),
        grid.header());
    assertEquals(values("South", null, null, 7, 1), grid.body().get(1));
  }

  @Test
  void crosstabFormattingOptions() {
    CrosstabOptions options = CrosstabOptions.builder().columnFieldSeparator("|")
        .includeMeasureNameWhenSingle(true).columnMeasureSeparator(": ").build();
    PivotGrid grid = new PivotEngine().pivotCrosstab(sales(), "Sales", List.of(),
        List.of(GroupByColumn.of("Sales", "Region"), GroupByColumn.of("Sales", "Year")), TOTAL,
        FilterContext.empty(), options);
    assertEquals(values("North|2023: Total", "North|2024: Total", "South|2024: Total"), grid.header());
    assertEquals(List.of(values(10, 5, 7)), grid.body());
  }

  @Test
  void crosstabWithoutColumnFieldsListsMeasures() {
    PivotGrid grid = new PivotEngine().pivotCrosstab(sales(), "Sales", List.of(GroupByColumn.of("Sales", "Year")),
        List.of(), TOTAL, FilterContext.empty());
    assertEquals(values("Sales[Year]", "Total"), grid.header());
    assertEquals(List.of(values(2023, 10), values(2024, 12)), grid.body());
  }

  @Test
  void crosstabRequiresAMeasure() {
    DaxException e = assertThrows(DaxException.class, () -> new PivotEngine().pivotCrosstab(sales(), "Sales",
        List.of(GroupByColumn.of("Sales", "Region")), List.of(), List.of(), FilterContext.empty()));
    assertEquals(ErrorKind.EVAL, e.getKind());
    assertEquals("pivot_crosstab requires at least one measure", e.getMessage());
  }
}
