package se.alipsa.jdax.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.Set;
import java.util.function.IntPredicate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import se.alipsa.jdax.DaxException;
import se.alipsa.jdax.engine.DaxEngine;
import se.alipsa.jdax.engine.FilterContext;
import se.alipsa.jdax.engine.RowContext;
import se.alipsa.jdax.helper.DaxUtil;
import se.alipsa.jdax.parser.DaxParser;
import se.alipsa.jdax.parser.Expr;
import se.alipsa.jdax.table.Table;
import se.alipsa.jdax.value.Coercions;
import se.alipsa.jdax.value.Value;

/**
 * The container for tables, relationships, measures and calculated columns.
 * It is the only long lived object of the engine; evaluation contexts are
 * created per call and never stored here.
 *
 * <p>
 * The model performs no locking. Mutations must be serialized by the caller
 * against every concurrent read.
 * </p>
 */
public final class DataModel {

  private static final Logger log = LoggerFactory.getLogger(DataModel.class);

  private final Options options;
  private final DaxEngine engine;
  private final Map<String, Table> tables = new LinkedHashMap<>();
  private final List<RelationshipInfo> relationships = new ArrayList<>();
  private final Map<String, Measure> measures = new LinkedHashMap<>();
  private final List<CalculatedColumn> calculatedColumns = new ArrayList<>();
  private final Map<String, List<CalculatedColumn>> calculatedColumnOrder = new HashMap<>();

  /** Direction in which a relationship path is walked. */
  public enum PathDirection {
    /** From a fact table towards its dimensions. */
    MANY_TO_ONE,
    /** From a dimension towards the fact tables referencing it. */
    ONE_TO_MANY
  }

  public DataModel() {
    this(Options.defaults());
  }

  public DataModel(Options options) {
    this.options = Objects.requireNonNull(options, "options");
    this.engine = new DaxEngine(options.engineOptions());
  }

  public Options options() {
    return options;
  }

  /**
   * Register a table.
   *
   * @param table
   *          the table
   * @return this model
   * @throws DaxException
   *           {@code DUPLICATE_TABLE} when a table of that name exists
   */
  public DataModel addTable(Table table) {
    Objects.requireNonNull(table, "table");
    String key = DaxUtil.normalize(table.name());
    if (tables.containsKey(key)) {
      throw DaxException.duplicateTable(table.name());
    }
    tables.put(key, table);
    return this;
  }

  /**
   * Look up a table.
   *
   * @param name
   *          table name, matched case-insensitively
   * @return the table or {@code null}
   */
  public Table table(String name) {
    return name == null ? null : tables.get(DaxUtil.normalize(name));
  }

  /**
   * Look up a table that must exist.
   *
   * @param name
   *          table name
   * @return the table
   * @throws DaxException
   *           {@code UNKNOWN_TABLE}
   */
  public Table requireTable(String name) {
    Table table = table(name);
    if (table == null) {
      throw DaxException.unknownTable(name);
    }
    return table;
  }

  public Collection<Table> tables() {
    return Collections.unmodifiableCollection(tables.values());
  }

  public List<RelationshipInfo> relationships() {
    return Collections.unmodifiableList(relationships);
  }

  public RelationshipInfo relationship(int index) {
    return relationships.get(index);
  }

  public Collection<Measure> measures() {
    return Collections.unmodifiableCollection(measures.values());
  }

  /**
   * Look up a measure.
   *
   * @param name
   *          measure name, with or without enclosing brackets
   * @return the measure or {@code null}
   */
  public Measure measure(String name) {
    if (name == null) {
      return null;
    }
    return measures.get(measureKey(name));
  }

  public List<CalculatedColumn> calculatedColumns() {
    return Collections.unmodifiableList(calculatedColumns);
  }

  /**
   * Whether {@code table[column]} is a calculated column.
   *
   * @param table
   *          table name
   * @param column
   *          column name
   * @return {@code true} when a definition exists
   */
  public boolean isCalculatedColumn(String table, String column) {
    return findCalculatedColumn(table, column) != null;
  }

  /**
   * Register a relationship and build its indices.
   *
   * @param relationship
   *          the relationship
   * @return the index of the relationship; the index identifies it in
   *         activation and override maps
   */
  public int addRelationship(Relationship relationship) {
    Objects.requireNonNull(relationship, "relationship");
    if (relationship.cardinality() == Cardinality.MANY_TO_MANY) {
      throw DaxException.unsupportedCardinality(relationship.name(), relationship.cardinality().name());
    }
    Table from = requireTable(relationship.fromTable());
    Table to = requireTable(relationship.toTable());
    int fromIdx = from.requireColumn(relationship.fromColumn());
    int toIdx = to.requireColumn(relationship.toColumn());
    validateJoinColumnTypes(relationship, from, fromIdx, to, toIdx);

    Relationship canonical = new Relationship(relationship.name(), from.name(), from.columns().get(fromIdx),
        to.name(), to.columns().get(toIdx), relationship.cardinality(), relationship.crossFilterDirection(),
        relationship.active(), relationship.enforceReferentialIntegrity());
    RelationshipInfo info = RelationshipInfo.empty(canonical, fromIdx, toIdx);
    for (int row = 0; row < to.rowCount(); row++) {
      Value key = to.value(row, toIdx);
      if (info.containsToKey(key)) {
        throw DaxException.nonUniqueKey(to.name(), canonical.toColumn(), key);
      }
      info.putToKey(key, row);
    }
    for (int row = 0; row < from.rowCount(); row++) {
      Value key = from.value(row, fromIdx);
      if (canonical.cardinality() == Cardinality.ONE_TO_ONE && !info.fromRows(key).isEmpty()) {
        throw DaxException.nonUniqueKey(from.name(), canonical.fromColumn(), key);
      }
      if (canonical.enforceReferentialIntegrity() && !key.isBlank() && !info.containsToKey(key)) {
        throw DaxException.referentialIntegrity(canonical.name(), from.name(), canonical.fromColumn(), to.name(),
            canonical.toColumn(), key);
      }
      info.addFromKey(key, row);
    }
    relationships.add(info);
    if (log.isDebugEnabled()) {
      log.debug("Registered relationship {} with {} dimension keys and {} unmatched fact rows", canonical,
          info.toIndexSize(), info.unmatchedFactRows().cardinality());
    }
    return relationships.size() - 1;
  }

  private void validateJoinColumnTypes(Relationship relationship, Table from, int fromIdx, Table to, int toIdx) {
    Value fromSample = firstNonBlank(from, fromIdx);
    Value toSample = firstNonBlank(to, toIdx);
    if (fromSample == null || toSample == null) {
      return;
    }
    String fromKind = Coercions.kindName(fromSample);
    String toKind = Coercions.kindName(toSample);
    if (!fromKind.equals(toKind)) {
      throw DaxException.joinColumnTypeMismatch(relationship.name(), fromKind, toKind);
    }
  }

  private Value firstNonBlank(Table table, int column) {
    int limit = Math.min(table.rowCount(), options.joinTypeCheckSampleRows());
    for (int row = 0; row < limit; row++) {
      Value v = table.value(row, column);
      if (!v.isBlank()) {
        return v;
      }
    }
    return null;
  }

  /**
   * Register a measure. The expression is parsed immediately.
   *
   * @param name
   *          measure name; surrounding brackets are stripped
   * @param expression
   *          the formula
   * @return this model
   */
  public DataModel addMeasure(String name, String expression) {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(expression, "expression");
    String bare = DaxUtil.normalizeMeasureName(name);
    String key = DaxUtil.normalize(bare);
    if (measures.containsKey(key)) {
      throw DaxException.duplicateMeasure(bare);
    }
    measures.put(key, new Measure(bare, expression, DaxParser.parse(expression)));
    return this;
  }

  /**
   * Add a calculated column to a mutable table, evaluating it for every
   * existing row.
   *
   * @param table
   *          table name
   * @param name
   *          new column name
   * @param expression
   *          the formula, evaluated per row with an empty filter context
   * @return this model
   */
  public DataModel addCalculatedColumn(String table, String name, String expression) {
    Table target = requireTable(table);
    if (!target.isMutable()) {
      throw DaxException.readOnlyTable(target.name(), "add calculated column " + name);
    }
    if (target.columnIndex(name) >= 0) {
      throw DaxException.duplicateColumn(target.name(), name);
    }
    Expr parsed = DaxParser.parse(expression);
    List<Value> values = new ArrayList<>(target.rowCount());
    for (int row = 0; row < target.rowCount(); row++) {
      values.add(engine.evaluateExpr(this, parsed, FilterContext.empty(), RowContext.empty().push(target, row)));
    }
    target.addColumn(name, values);
    calculatedColumns.add(new CalculatedColumn(target.name(), name, expression, parsed));
    try {
      refreshCalculatedColumnOrder(target.name());
    } catch (DaxException e) {
      calculatedColumns.remove(calculatedColumns.size() - 1);
      target.rollbackLastColumn();
      throw e;
    }
    return this;
  }

  /**
   * Attach a calculated column definition without recomputing values. Used for
   * tables whose values were persisted by the host.
   *
   * @param table
   *          table name
   * @param name
   *          existing column name
   * @param expression
   *          the formula
   * @return this model
   */
  public DataModel addCalculatedColumnDefinition(String table, String name, String expression) {
    Table target = requireTable(table);
    if (findCalculatedColumn(target.name(), name) != null) {
      throw DaxException.duplicateColumn(target.name(), name);
    }
    int idx = target.requireColumn(name);
    Expr parsed = DaxParser.parse(expression);
    calculatedColumns.add(new CalculatedColumn(target.name(), target.columns().get(idx), expression, parsed));
    try {
      refreshCalculatedColumnOrder(target.name());
    } catch (DaxException e) {
      calculatedColumns.remove(calculatedColumns.size() - 1);
      throw e;
    }
    return this;
  }

  /**
   * Append a row to a mutable table, computing its calculated columns and
   * extending every relationship index. On any failure the row is removed and
   * no index is changed.
   *
   * @param table
   *          table name
   * @param values
   *          either one value per column, or one value per non-calculated
   *          column in schema order
   */
  public void insertRow(String table, List<Value> values) {
    Objects.requireNonNull(values, "values");
    Table target = requireTable(table);
    if (!target.isMutable()) {
      throw DaxException.readOnlyTable(target.name(), "insert rows");
    }
    List<Value> row = expandRow(target, values);
    target.pushRow(row);
    int rowIndex = target.rowCount() - 1;
    try {
      for (CalculatedColumn calc : calculatedColumnOrder.getOrDefault(DaxUtil.normalize(target.name()), List.of())) {
        Value v = engine.evaluateExpr(this, calc.parsed(), FilterContext.empty(),
            RowContext.empty().push(target, rowIndex));
        target.setValue(rowIndex, target.requireColumn(calc.name()), v);
      }
      validateInsert(target, rowIndex);
    } catch (RuntimeException e) {
      target.rollbackLastRow();
      if (log.isDebugEnabled()) {
        log.debug("Rolled back insert into {}: {}", target.name(), e.getMessage());
      }
      throw e;
    }
    for (RelationshipInfo info : relationships) {
      Relationship rel = info.relationship();
      if (rel.toTable().equals(target.name())) {
        info.putToKey(target.value(rowIndex, info.toColumnIndex()), rowIndex);
      }
      if (rel.fromTable().equals(target.name())) {
        info.addFromKey(target.value(rowIndex, info.fromColumnIndex()), rowIndex);
      }
    }
  }

  /**
   * Convenience variant of {@link #insertRow(String, List)} converting plain
   * Java objects.
   *
   * @param table
   *          table name
   * @param values
   *          the row values
   */
  public void insertRow(String table, Object... values) {
    List<Value> converted = new ArrayList<>(values.length);
    for (Object v : values) {
      converted.add(Value.fromObject(v));
    }
    insertRow(table, converted);
  }

  private List<Value> expandRow(Table target, List<Value> values) {
    List<String> columns = target.columns();
    if (values.size() == columns.size()) {
      return values;
    }
    int baseCount = 0;
    for (String column : columns) {
      if (!isCalculatedColumn(target.name(), column)) {
        baseCount++;
      }
    }
    if (values.size() != baseCount) {
      throw DaxException.schemaMismatch(target.name(), baseCount, values.size());
    }
    List<Value> row = new ArrayList<>(columns.size());
    int next = 0;
    for (String column : columns) {
      row.add(isCalculatedColumn(target.name(), column) ? Value.BLANK : values.get(next++));
    }
    return row;
  }

  private void validateInsert(Table target, int rowIndex) {
    for (RelationshipInfo info : relationships) {
      Relationship rel = info.relationship();
      if (rel.toTable().equals(target.name())) {
        Value key = target.value(rowIndex, info.toColumnIndex());
        if (info.containsToKey(key)) {
          throw DaxException.nonUniqueKey(rel.toTable(), rel.toColumn(), key);
        }
      }
      if (rel.fromTable().equals(target.name())) {
        Value key = target.value(rowIndex, info.fromColumnIndex());
        if (rel.cardinality() == Cardinality.ONE_TO_ONE && !info.fromRows(key).isEmpty()) {
          throw DaxException.nonUniqueKey(rel.fromTable(), rel.fromColumn(), key);
        }
        if (rel.enforceReferentialIntegrity() && !key.isBlank() && !info.containsToKey(key)) {
          throw DaxException.referentialIntegrity(rel.name(), rel.fromTable(), rel.fromColumn(), rel.toTable(),
              rel.toColumn(), key);
        }
      }
    }
  }

  /**
   * Evaluate a registered measure with an empty row context.
   *
   * @param name
   *          measure name
   * @param filter
   *          the filter context
   * @return the measure value
   */
  public Value evaluateMeasure(String name, FilterContext filter) {
    return engine.evaluateMeasure(this, name, filter);
  }

  /**
   * Find the single path of relationships from one table to another.
   *
   * @param fromTable
   *          start table
   * @param toTable
   *          target table
   * @param direction
   *          which side of each relationship to walk from
   * @param isActive
   *          decides per relationship index whether it may be used
   * @return relationship indices along the path, empty when none exists or
   *         when both tables are the same
   * @throws DaxException
   *           {@code EVAL} when more than one path exists
   */
  public Optional<List<Integer>> findUniqueActiveRelationshipPath(String fromTable, String toTable,
      PathDirection direction, IntPredicate isActive) {
    Table start = requireTable(fromTable);
    Table target = requireTable(toTable);
    if (start == target) {
      return Optional.empty();
    }
    PathSearch search = new PathSearch(start.name(), target.name(), direction, isActive);
    search.visited.add(start.name());
    search.tablePath.add(start.name());
    search.walk(start.name());
    return Optional.ofNullable(search.found);
  }

  /** Depth first search collecting at most one path. */
  private final class PathSearch {
    private final String start;
    private final String target;
    private final PathDirection direction;
    private final IntPredicate isActive;
    private final Set<String> visited = new HashSet<>();
    private final List<Integer> path = new ArrayList<>();
    private final List<String> tablePath = new ArrayList<>();
    private List<Integer> found;
    private List<String> foundTables;

    PathSearch(String start, String target, PathDirection direction, IntPredicate isActive) {
      this.start = start;
      this.target = target;
      this.direction = direction;
      this.isActive = isActive;
    }

    void walk(String current) {
      if (current.equals(target)) {
        if (found != null) {
          throw DaxException.eval("ambiguous active relationship path between " + start + " and " + target + ": "
              + String.join(" -> ", foundTables) + "; " + String.join(" -> ", tablePath));
        }
        found = List.copyOf(path);
        foundTables = List.copyOf(tablePath);
        return;
      }
      for (int i = 0; i < relationships.size(); i++) {
        if (!isActive.test(i)) {
          continue;
        }
        Relationship rel = relationships.get(i).relationship();
        String next;
        if (direction == PathDirection.MANY_TO_ONE) {
          if (!rel.fromTable().equals(current)) {
            continue;
          }
          next = rel.toTable();
        } else {
          if (!rel.toTable().equals(current)) {
            continue;
          }
          next = rel.fromTable();
        }
        if (!visited.add(next)) {
          continue;
        }
        path.add(i);
        tablePath.add(next);
        walk(next);
        tablePath.remove(tablePath.size() - 1);
        path.remove(path.size() - 1);
        visited.remove(next);
      }
    }
  }

  /**
   * Index of the relationship joining two columns, in either orientation.
   *
   * @param tableA
   *          first table
   * @param columnA
   *          first column
   * @param tableB
   *          second table
   * @param columnB
   *          second column
   * @return the relationship index, empty when none joins the columns
   */
  public OptionalInt findRelationshipIndex(String tableA, String columnA, String tableB, String columnB) {
    for (int i = 0; i < relationships.size(); i++) {
      Relationship rel = relationships.get(i).relationship();
      boolean forward = rel.isFrom(tableA, columnA) && rel.isTo(tableB, columnB);
      boolean reverse = rel.isFrom(tableB, columnB) && rel.isTo(tableA, columnA);
      if (forward || reverse) {
        return OptionalInt.of(i);
      }
    }
    return OptionalInt.empty();
  }

  private CalculatedColumn findCalculatedColumn(String table, String column) {
    String t = DaxUtil.normalize(table);
    String c = DaxUtil.normalize(column);
    for (CalculatedColumn calc : calculatedColumns) {
      if (DaxUtil.normalize(calc.table()).equals(t) && DaxUtil.normalize(calc.name()).equals(c)) {
        return calc;
      }
    }
    return null;
  }

  private static String measureKey(String name) {
    return DaxUtil.normalize(DaxUtil.normalizeMeasureName(name));
  }

  private void refreshCalculatedColumnOrder(String table) {
    String tableKey = DaxUtil.normalize(table);
    Map<String, CalculatedColumn> byName = new LinkedHashMap<>();
    for (CalculatedColumn calc : calculatedColumns) {
      if (DaxUtil.normalize(calc.table()).equals(tableKey)) {
        byName.put(DaxUtil.normalize(calc.name()), calc);
      }
    }
    Map<String, Boolean> visiting = new HashMap<>();
    List<String> stack = new ArrayList<>();
    List<CalculatedColumn> order = new ArrayList<>(byName.size());
    for (String name : byName.keySet()) {
      orderVisit(name, table, byName, visiting, stack, order);
    }
    calculatedColumnOrder.put(tableKey, order);
  }

  private void orderVisit(String name, String table, Map<String, CalculatedColumn> byName,
      Map<String, Boolean> visiting, List<String> stack, List<CalculatedColumn> order) {
    Boolean state = visiting.get(name);
    if (Boolean.FALSE.equals(state)) {
      return;
    }
    if (Boolean.TRUE.equals(state)) {
      List<String> cycle = new ArrayList<>(stack.subList(stack.indexOf(name), stack.size()));
      cycle.add(name);
      List<String> display = new ArrayList<>(cycle.size());
      for (String n : cycle) {
        display.add(byName.get(n).name());
      }
      throw DaxException.eval("calculated column dependency cycle in " + table + ": " + String.join(" -> ", display));
    }
    visiting.put(name, Boolean.TRUE);
    stack.add(name);
    CalculatedColumn calc = byName.get(name);
    Set<String> deps = new HashSet<>();
    collectSameTableDependencies(calc.parsed(), calc.table(), deps);
    List<String> sorted = new ArrayList<>(deps);
    Collections.sort(sorted);
    for (String dep : sorted) {
      if (byName.containsKey(dep)) {
        orderVisit(dep, table, byName, visiting, stack, order);
      }
    }
    stack.remove(stack.size() - 1);
    visiting.put(name, Boolean.FALSE);
    order.add(calc);
  }

  private void collectSameTableDependencies(Expr expr, String table, Set<String> out) {
    if (expr instanceof Expr.ColumnRef ref) {
      if (DaxUtil.normalize(ref.table()).equals(DaxUtil.normalize(table))) {
        out.add(DaxUtil.normalize(ref.column()));
      }
    } else if (expr instanceof Expr.MeasureRef ref) {
      if (measure(ref.name()) == null) {
        Table t = table(table);
        String column = DaxUtil.normalizeMeasureName(ref.name());
        if (t != null && t.columnIndex(column) >= 0) {
          out.add(DaxUtil.normalize(column));
        }
      }
    } else if (expr instanceof Expr.Call call) {
      for (Expr arg : call.args()) {
        collectSameTableDependencies(arg, table, out);
      }
    } else if (expr instanceof Expr.Negate negate) {
      collectSameTableDependencies(negate.operand(), table, out);
    } else if (expr instanceof Expr.Binary binary) {
      collectSameTableDependencies(binary.left(), table, out);
      collectSameTableDependencies(binary.right(), table, out);
    }
  }

  /** Data model settings. */
  public static final class Options {

    private final int joinTypeCheckSampleRows;
    private final DaxEngine.Options engineOptions;

    private Options(Builder builder) {
      this.joinTypeCheckSampleRows = builder.joinTypeCheckSampleRows;
      this.engineOptions = builder.engineOptions;
    }

    public static Options defaults() {
      return builder().build();
    }

    public static Builder builder() {
      return new Builder();
    }

    /**
     * Number of leading rows scanned on each side of a new relationship to
     * compare the join column types.
     *
     * @return the sample size
     */
    public int joinTypeCheckSampleRows() {
      return joinTypeCheckSampleRows;
    }

    /**
     * Engine settings used when the model itself evaluates formulas, i.e. when
     * calculated columns are computed on creation and on row inserts.
     *
     * @return the engine options
     */
    public DaxEngine.Options engineOptions() {
      return engineOptions;
    }

    /** Builder for {@link Options}. */
    public static final class Builder {
      private int joinTypeCheckSampleRows = 1000;
      private DaxEngine.Options engineOptions = DaxEngine.Options.defaults();

      private Builder() {
      }

      public Builder joinTypeCheckSampleRows(int rows) {
        if (rows < 1) {
          throw new IllegalArgumentException("joinTypeCheckSampleRows must be positive: " + rows);
        }
        this.joinTypeCheckSampleRows = rows;
        return this;
      }

      public Builder engineOptions(DaxEngine.Options options) {
        this.engineOptions = Objects.requireNonNull(options, "engineOptions");
        return this;
      }

      public Options build() {
        return new Options(this);
      }
    }
  }
}
