package se.alipsa.jdax;

import java.util.Arrays;
import java.util.List;
import se.alipsa.jdax.model.DataModel;
import se.alipsa.jdax.model.Relationship;
import se.alipsa.jdax.table.Table;
import se.alipsa.jdax.value.Value;

/** Small star schemas shared by the tests. */
public final class TestModels {

  private TestModels() {
    // Utility class
  }

  /**
   * DimCategory(CategoryId, Name) with A/Alpha and B/Beta, Fact(CategoryId,
   * Amount) with A/10 and B/5, a relationship from Fact to DimCategory and the
   * measure {@code Total := SUM(Fact[Amount])}.
   *
   * @return an in-memory model
   */
  public static DataModel categories() {
    Table dim = new Table("DimCategory", List.of("CategoryId", "Name"));
    dim.pushRow("A", "Alpha");
    dim.pushRow("B", "Beta");
    Table fact = new Table("Fact", List.of("CategoryId", "Amount"));
    fact.pushRow("A", 10.0);
    fact.pushRow("B", 5.0);
    return wire(dim, fact);
  }

  /**
   * Same data as {@link #categories()} but held in columnar tables.
   *
   * @return a columnar model
   */
  public static DataModel columnarCategories() {
    Table dim = Table.columnar("DimCategory", List.of("CategoryId", "Name"),
        List.of(values("A", "B"), values("Alpha", "Beta")));
    Table fact = Table.columnar("Fact", List.of("CategoryId", "Amount"),
        List.of(values("A", "B"), values(10.0, 5.0)));
    return wire(dim, fact);
  }

  /**
   * {@link #categories()} plus a fact row with an unknown key ("X", 7) and one
   * with a blank key (blank, 3), so DimCategory gets a virtual blank row.
   *
   * @return a model with unmatched fact rows
   */
  public static DataModel categoriesWithUnmatched() {
    DataModel model = categories();
    model.insertRow("Fact", "X", 7.0);
    model.insertRow("Fact", null, 3.0);
    return model;
  }

  /**
   * Columnar variant of {@link #categoriesWithUnmatched()}.
   *
   * @return a columnar model with unmatched fact rows
   */
  public static DataModel columnarCategoriesWithUnmatched() {
    Table dim = Table.columnar("DimCategory", List.of("CategoryId", "Name"),
        List.of(values("A", "B"), values("Alpha", "Beta")));
    Table fact = Table.columnar("Fact", List.of("CategoryId", "Amount"),
        List.of(values("A", "B", "X", null), values(10.0, 5.0, 7.0, 3.0)));
    return wire(dim, fact);
  }

  public static List<Value> values(Object... objects) {
    return Arrays.stream(objects).map(Value::fromObject).toList();
  }

  private static DataModel wire(Table dim, Table fact) {
    DataModel model = new DataModel();
    model.addTable(dim).addTable(fact);
    model.addRelationship(Relationship.of("Fact_Category", "Fact", "CategoryId", "DimCategory", "CategoryId"));
    model.addMeasure("Total", "SUM(Fact[Amount])");
    return model;
  }
}
