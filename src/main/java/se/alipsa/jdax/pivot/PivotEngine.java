package se.alipsa.jdax.pivot;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.Collections;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import se.alipsa.jdax.DaxException;
import se.alipsa.jdax.engine.DaxEngine;
import se.alipsa.jdax.engine.FilterContext;
import se.alipsa.jdax.engine.RowContext;
import se.alipsa.jdax.engine.RowSetResolver;
import se.alipsa.jdax.helper.DaxUtil;
import se.alipsa.jdax.model.DataModel;
import se.alipsa.jdax.model.DataModel.PathDirection;
import se.alipsa.jdax.model.RelationshipInfo;
import se.alipsa.jdax.table.AggregationKind;
import se.alipsa.jdax.table.AggregationSpec;
import se.alipsa.jdax.table.AggregationState;
import se.alipsa.jdax.table.Table;
import se.alipsa.jdax.value.Value;
import se.alipsa.jdax.value.Value.NumberValue;

/**
 * Grouped evaluation of measures, the engine behind pivot tables.
 *
 * <p>
 * {@link #pivot} tries the {@link PivotStrategy strategies} in declaration
 * order and uses the first whose preconditions hold. The accelerated
 * strategies need a backend that supports group-by and measures the
 * {@link MeasurePlanner planner} can rewrite into aggregations; the row scan
 * always applies and evaluates every cell with the general evaluator. All
 * strategies produce the same rows.
 * </p>
 */
public final class PivotEngine {

  private static final Logger log = LoggerFactory.getLogger(PivotEngine.class);

  private final Options options;
  private final DaxEngine engine;

  /** Create a pivot engine with default options. */
  public PivotEngine() {
    this(Options.defaults());
  }

  /**
   * Create a pivot engine.
   *
   * @param options
   *          planner settings
   */
  public PivotEngine(Options options) {
    this(options, new DaxEngine());
  }

  /**
   * Create a pivot engine evaluating cells with the given engine.
   *
   * @param options
   *          planner settings
   * @param engine
   *          evaluator for strategies that evaluate measures per group
   */
  public PivotEngine(Options options, DaxEngine engine) {
    this.options = Objects.requireNonNull(options, "options");
    this.engine = Objects.requireNonNull(engine, "engine");
  }

  /**
   * Group the rows of {@code baseTable} and evaluate each measure per group.
   *
   * @param model
   *          the data model
   * @param baseTable
   *          the table whose rows are grouped
   * @param groupBy
   *          grouping columns, on the base table or reachable from it over
   *          many-to-one relationships
   * @param measures
   *          measures to evaluate
   * @param filter
   *          the outer filter context
   * @return the grouped rows, sorted by group key
   * @throws DaxException
   *           the first evaluation error of any group
   */
  public PivotResult pivot(DataModel model, String baseTable, List<GroupByColumn> groupBy,
      List<PivotMeasure> measures, FilterContext filter) {
    Table base = model.requireTable(baseTable);
    return pivot(model, base, canonical(model, groupBy), measures, filter);
  }

  private PivotResult pivot(DataModel model, Table base, List<GroupByColumn> groupBy, List<PivotMeasure> measures,
      FilterContext filter) {
    List<String> columns = new ArrayList<>();
    groupBy.forEach(c -> columns.add(c.caption()));
    measures.forEach(m -> columns.add(m.name()));
    Pivot pivot = new Pivot(model, base, groupBy, measures, filter);

    for (PivotStrategy strategy : PivotStrategy.values()) {
      if (!options.isEnabled(strategy)) {
        continue;
      }
      List<List<Value>> rows = switch (strategy) {
        case COLUMNAR_GROUP_BY -> pivot.columnarGroupBy();
        case COLUMNAR_GROUPS_WITH_MEASURE_EVAL -> pivot.columnarGroupsWithMeasureEval();
        case STAR_SCHEMA_ROLLUP -> pivot.starSchemaRollup();
        case PLANNED_ROW_GROUP_BY -> pivot.plannedRowGroupBy();
        case ROW_SCAN -> pivot.rowScan();
      };
      if (rows != null) {
        if (log.isDebugEnabled()) {
          log.debug("Pivot over {} by {} used {} ({} groups)", base.name(), columns.subList(0, groupBy.size()),
              strategy.label(), rows.size());
        }
        return new PivotResult(columns, rows, strategy);
      }
    }
    throw new IllegalStateException("row scan must always be enabled");
  }

  /**
   * Pivot shaped as a crosstab with default header formatting.
   *
   * @param model
   *          the data model
   * @param baseTable
   *          the table whose rows are grouped
   * @param rowFields
   *          fields of the row axis
   * @param columnFields
   *          fields of the column axis
   * @param measures
   *          measures, at least one
   * @param filter
   *          the outer filter context
   * @return the grid
   */
  public PivotGrid pivotCrosstab(DataModel model, String baseTable, List<GroupByColumn> rowFields,
      List<GroupByColumn> columnFields, List<PivotMeasure> measures, FilterContext filter) {
    return pivotCrosstab(model, baseTable, rowFields, columnFields, measures, filter, CrosstabOptions.defaults());
  }

  /**
   * Pivot shaped as a crosstab. The header row holds the row field captions and
   * one header per column key (and measure, when there are several). Each body
   * row holds a row key and its cells; combinations without data are blank.
   *
   * @param model
   *          the data model
   * @param baseTable
   *          the table whose rows are grouped
   * @param rowFields
   *          fields of the row axis
   * @param columnFields
   *          fields of the column axis
   * @param measures
   *          measures, at least one
   * @param filter
   *          the outer filter context
   * @param crosstabOptions
   *          header formatting
   * @return the grid
   */
  public PivotGrid pivotCrosstab(DataModel model, String baseTable, List<GroupByColumn> rowFields,
      List<GroupByColumn> columnFields, List<PivotMeasure> measures, FilterContext filter,
      CrosstabOptions crosstabOptions) {
    if (measures.isEmpty()) {
      throw DaxException.eval("pivot_crosstab requires at least one measure");
    }
    Table base = model.requireTable(baseTable);
    List<GroupByColumn> rows = canonical(model, rowFields);
    List<GroupByColumn> cols = canonical(model, columnFields);
    List<GroupByColumn> groupBy = new ArrayList<>(rows);
    groupBy.addAll(cols);
    PivotResult grouped = pivot(model, base, groupBy, measures, filter);

    int rowKeyLen = rows.size();
    int valueStart = rowKeyLen + cols.size();
    Set<List<Value>> rowKeys = new HashSet<>();
    Set<List<Value>> colKeys = new HashSet<>();
    Map<List<Value>, Map<List<Value>, List<Value>>> cells = new HashMap<>();
    for (List<Value> row : grouped.rows()) {
      List<Value> rowKey = row.subList(0, rowKeyLen);
      List<Value> colKey = row.subList(rowKeyLen, valueStart);
      rowKeys.add(rowKey);
      colKeys.add(colKey);
      cells.computeIfAbsent(rowKey, k -> new HashMap<>()).put(colKey, row.subList(valueStart, row.size()));
    }
    List<List<Value>> sortedRowKeys = new ArrayList<>(rowKeys);
    sortedRowKeys.sort(PivotKeys.KEY_ORDER);
    List<List<Value>> sortedColKeys = new ArrayList<>(colKeys);
    sortedColKeys.sort(PivotKeys.KEY_ORDER);
    if (sortedColKeys.isEmpty()) {
      sortedColKeys.add(List.of());
    }
    boolean measureSuffix = measures.size() > 1 || crosstabOptions.includeMeasureNameWhenSingle();

    List<List<Value>> data = new ArrayList<>();
    List<Value> header = new ArrayList<>();
    rows.forEach(c -> header.add(Value.of(c.caption())));
    if (cols.isEmpty()) {
      measures.forEach(m -> header.add(Value.of(m.name())));
    } else {
      for (List<Value> colKey : sortedColKeys) {
        String label = PivotKeys.display(colKey, crosstabOptions.columnFieldSeparator());
        if (label.isEmpty()) {
          measures.forEach(m -> header.add(Value.of(m.name())));
        } else if (!measureSuffix) {
          header.add(Value.of(label));
        } else {
          measures.forEach(m -> header.add(Value.of(label + crosstabOptions.columnMeasureSeparator() + m.name())));
        }
      }
    }
    data.add(header);

    List<Value> missing = Collections.nCopies(measures.size(), Value.BLANK);
    for (List<Value> rowKey : sortedRowKeys) {
      List<Value> line = new ArrayList<>(rowKey);
      Map<List<Value>, List<Value>> byColumn = cells.getOrDefault(rowKey, Map.of());
      for (List<Value> colKey : sortedColKeys) {
        List<Value> values = byColumn.getOrDefault(colKey, missing);
        if (!measureSuffix && !cols.isEmpty()) {
          line.add(values.get(0));
        } else {
          line.addAll(values);
        }
      }
      data.add(line);
    }
    return new PivotGrid(data);
  }

  private static List<GroupByColumn> canonical(DataModel model, List<GroupByColumn> columns) {
    List<GroupByColumn> out = new ArrayList<>(columns.size());
    for (GroupByColumn col : columns) {
      Table table = model.requireTable(col.table());
      out.add(new GroupByColumn(table.name(), table.columns().get(table.requireColumn(col.column()))));
    }
    return out;
  }

  public Options options() {
    return options;
  }

  /** One pivot call: the inputs shared by every strategy. */
  private final class Pivot {
    private final DataModel model;
    private final Table base;
    private final List<GroupByColumn> groupBy;
    private final List<PivotMeasure> measures;
    private final FilterContext filter;
    private final String baseKey;
    private BitSet allowed;
    private boolean allowedResolved;

    Pivot(DataModel model, Table base, List<GroupByColumn> groupBy, List<PivotMeasure> measures,
        FilterContext filter) {
      this.model = model;
      this.base = base;
      this.groupBy = groupBy;
      this.measures = measures;
      this.filter = filter;
      this.baseKey = DaxUtil.normalize(base.name());
    }

    /** Allowed base rows, {@code null} when the filter is empty. */
    BitSet allowedRows() {
      if (!allowedResolved) {
        allowed = filter.isEmpty() ? null : RowSetResolver.resolveTableRows(model, filter, base.name());
        allowedResolved = true;
      }
      return allowed;
    }

    boolean allOnBase() {
      return groupBy.stream().allMatch(c -> DaxUtil.normalize(c.table()).equals(baseKey));
    }

    int[] baseGroupIndexes() {
      int[] idx = new int[groupBy.size()];
      for (int i = 0; i < idx.length; i++) {
        idx[i] = base.requireColumn(groupBy.get(i).column());
      }
      return idx;
    }

    MeasurePlanner planner() {
      return new MeasurePlanner(model, base, options.maxPlanDepth());
    }

    List<List<Value>> columnarGroupBy() {
      if (!allOnBase()) {
        return null;
      }
      MeasurePlanner planner = planner();
      List<PlannedExpr> plans = planner.planAll(measures);
      if (plans == null) {
        return null;
      }
      int keyLen = groupBy.size();
      Optional<List<List<Value>>> grouped = base.backend().groupByAggregations(baseGroupIndexes(),
          planner.aggregations(), allowedRows());
      if (grouped.isEmpty()) {
        return null;
      }
      List<List<Value>> out = new ArrayList<>(grouped.get().size());
      for (List<Value> row : grouped.get()) {
        out.add(finish(row.subList(0, keyLen), plans, row.subList(keyLen, row.size())));
      }
      return sorted(out, groupBy.size());
    }

    List<List<Value>> columnarGroupsWithMeasureEval() {
      if (groupBy.isEmpty() || !allOnBase()) {
        return null;
      }
      Optional<List<List<Value>>> keys = base.backend().groupByAggregations(baseGroupIndexes(), List.of(),
          allowedRows());
      if (keys.isEmpty()) {
        return null;
      }
      return evaluateGroups(keys.get());
    }

    /**
     * Backend group-by on the base columns plus the foreign key of each one-hop
     * dimension column, then a rollup of those groups onto the dimension
     * attributes.
     */
    List<List<Value>> starSchemaRollup() {
      if (groupBy.isEmpty()) {
        return null;
      }
      List<Integer> groupIdx = new ArrayList<>();
      Map<Integer, Integer> positionOf = new LinkedHashMap<>();
      Set<Integer> baseGroupColumns = new HashSet<>();
      List<RollupKey> keys = new ArrayList<>(groupBy.size());
      for (GroupByColumn col : groupBy) {
        if (DaxUtil.normalize(col.table()).equals(baseKey)) {
          int idx = base.requireColumn(col.column());
          baseGroupColumns.add(idx);
          keys.add(new RollupKey(position(idx, groupIdx, positionOf), null, null, -1));
          continue;
        }
        Optional<List<Integer>> path = model.findUniqueActiveRelationshipPath(base.name(), col.table(),
            PathDirection.MANY_TO_ONE, idx -> RowSetResolver.isRelationshipActive(model, filter, idx));
        if (path.isEmpty() || path.get().size() != 1) {
          return null;
        }
        RelationshipInfo info = model.relationship(path.get().get(0));
        Table dimension = model.requireTable(col.table());
        keys.add(new RollupKey(position(info.fromColumnIndex(), groupIdx, positionOf), info, dimension,
            dimension.requireColumn(col.column())));
      }

      MeasurePlanner planner = planner();
      List<PlannedExpr> plans = planner.planAll(measures);
      if (plans == null) {
        return null;
      }
      if (planner.usesAverage()) {
        return null;
      }
      List<AggregationSpec> specs = planner.aggregations();
      for (AggregationSpec spec : specs) {
        // only constant within a final group when the column is itself a group key
        if (spec.kind() == AggregationKind.DISTINCT_COUNT && !baseGroupColumns.contains(spec.columnIndex())) {
          return null;
        }
      }

      int[] groupArray = groupIdx.stream().mapToInt(Integer::intValue).toArray();
      Optional<List<List<Value>>> grouped = base.backend().groupByAggregations(groupArray, specs, allowedRows());
      if (grouped.isEmpty()) {
        return null;
      }
      int keyLen = groupArray.length;
      Map<List<Value>, RollupState[]> groups = new LinkedHashMap<>();
      for (List<Value> row : grouped.get()) {
        List<Value> key = new ArrayList<>(keys.size());
        for (RollupKey k : keys) {
          key.add(k.read(row));
        }
        RollupState[] states = groups.computeIfAbsent(key, x -> RollupState.create(specs));
        for (int i = 0; i < states.length; i++) {
          states[i].update(row.get(keyLen + i));
        }
      }
      List<List<Value>> out = new ArrayList<>(groups.size());
      for (Map.Entry<List<Value>, RollupState[]> entry : groups.entrySet()) {
        List<Value> aggregations = new ArrayList<>(specs.size());
        for (RollupState state : entry.getValue()) {
          aggregations.add(state.result());
        }
        out.add(finish(entry.getKey(), plans, aggregations));
      }
      return sorted(out, groupBy.size());
    }

    List<List<Value>> plannedRowGroupBy() {
      if (groupBy.isEmpty()) {
        return null;
      }
      GroupKeyReader reader = GroupKeyReader.create(model, base, groupBy, filter);
      MeasurePlanner planner = planner();
      List<PlannedExpr> plans = planner.planAll(measures);
      if (plans == null) {
        return null;
      }
      List<AggregationSpec> specs = planner.aggregations();
      Map<List<Value>, AggregationState[]> groups = new LinkedHashMap<>();
      BitSet rows = allowedRows() == null ? RowSetResolver.allRows(base.rowCount()) : allowedRows();
      for (int row = rows.nextSetBit(0); row >= 0 && row < base.rowCount(); row = rows.nextSetBit(row + 1)) {
        AggregationState[] states = groups.computeIfAbsent(reader.read(row), k -> newStates(specs));
        for (int i = 0; i < states.length; i++) {
          AggregationSpec spec = specs.get(i);
          states[i].update(spec.columnIndex() < 0 ? Value.BLANK : base.value(row, spec.columnIndex()));
        }
      }
      List<List<Value>> out = new ArrayList<>(groups.size());
      for (Map.Entry<List<Value>, AggregationState[]> entry : groups.entrySet()) {
        List<Value> aggregations = new ArrayList<>(specs.size());
        for (AggregationState state : entry.getValue()) {
          aggregations.add(state.result());
        }
        out.add(finish(entry.getKey(), plans, aggregations));
      }
      return sorted(out, groupBy.size());
    }

    List<List<Value>> rowScan() {
      GroupKeyReader reader = GroupKeyReader.create(model, base, groupBy, filter);
      Set<List<Value>> seen = new LinkedHashSet<>();
      BitSet rows = allowedRows() == null ? RowSetResolver.allRows(base.rowCount()) : allowedRows();
      for (int row = rows.nextSetBit(0); row >= 0 && row < base.rowCount(); row = rows.nextSetBit(row + 1)) {
        seen.add(reader.read(row));
      }
      return evaluateGroups(new ArrayList<>(seen));
    }

    /** Evaluate every measure per group under column-equality filters for its key. */
    private List<List<Value>> evaluateGroups(List<List<Value>> keys) {
      List<List<Value>> sortedKeys = new ArrayList<>(keys);
      sortedKeys.sort(PivotKeys.KEY_ORDER);
      List<List<Value>> out = new ArrayList<>(sortedKeys.size());
      for (List<Value> key : sortedKeys) {
        FilterContext groupFilter = filter;
        for (int i = 0; i < groupBy.size(); i++) {
          GroupByColumn col = groupBy.get(i);
          groupFilter = groupFilter.withColumnEquals(col.table(), col.column(), key.get(i));
        }
        List<Value> line = new ArrayList<>(key);
        for (PivotMeasure measure : measures) {
          line.add(engine.evaluateExpr(model, measure.parsed(), groupFilter, RowContext.empty()));
        }
        out.add(line);
      }
      return out;
    }
  }

  private static int position(int column, List<Integer> groupIdx, Map<Integer, Integer> positionOf) {
    return positionOf.computeIfAbsent(column, c -> {
      groupIdx.add(c);
      return groupIdx.size() - 1;
    });
  }

  private static List<Value> finish(List<Value> key, List<PlannedExpr> plans, List<Value> aggregations) {
    List<Value> line = new ArrayList<>(key.size() + plans.size());
    line.addAll(key);
    for (PlannedExpr plan : plans) {
      line.add(plan.evaluate(aggregations));
    }
    return line;
  }

  private static List<List<Value>> sorted(List<List<Value>> rows, int keyLen) {
    rows.sort((a, b) -> PivotKeys.KEY_ORDER.compare(a.subList(0, keyLen), b.subList(0, keyLen)));
    return rows;
  }

  private static AggregationState[] newStates(List<AggregationSpec> specs) {
    AggregationState[] states = new AggregationState[specs.size()];
    for (int i = 0; i < states.length; i++) {
      states[i] = new AggregationState(specs.get(i).kind());
    }
    return states;
  }

  /**
   * One final key column of the rollup: either a base group column or a
   * dimension attribute looked up through a foreign key.
   */
  private record RollupKey(int position, RelationshipInfo relationship, Table dimension, int column) {

    Value read(List<Value> groupedRow) {
      Value key = groupedRow.get(position);
      if (relationship == null) {
        return key;
      }
      if (key.isBlank()) {
        return Value.BLANK;
      }
      int row = relationship.toRow(key);
      return row < 0 ? Value.BLANK : dimension.value(row, column);
    }
  }

  /** Combines per-group aggregation results of finer groups. */
  private static final class RollupState {
    private final AggregationKind kind;
    private double total;
    private boolean seen;

    private RollupState(AggregationKind kind) {
      this.kind = kind;
    }

    static RollupState[] create(List<AggregationSpec> specs) {
      RollupState[] states = new RollupState[specs.size()];
      for (int i = 0; i < states.length; i++) {
        states[i] = new RollupState(specs.get(i).kind());
      }
      return states;
    }

    void update(Value value) {
      if (kind == AggregationKind.DISTINCT_COUNT) {
        seen |= !value.isBlank();
        return;
      }
      if (!(value instanceof NumberValue number)) {
        return;
      }
      double n = number.value();
      switch (kind) {
        case MIN -> total = seen ? Math.min(total, n) : n;
        case MAX -> total = seen ? Math.max(total, n) : n;
        default -> total += n;
      }
      seen = true;
    }

    Value result() {
      return switch (kind) {
        case SUM, MIN, MAX -> seen ? Value.of(total) : Value.BLANK;
        case DISTINCT_COUNT -> seen ? Value.of(1) : Value.BLANK;
        default -> Value.of(total);
      };
    }
  }

  /** Pivot planner settings. */
  public static final class Options {

    private final Set<PivotStrategy> enabled;
    private final int maxPlanDepth;

    private Options(Builder builder) {
      this.enabled = Collections.unmodifiableSet(EnumSet.copyOf(builder.enabled));
      this.maxPlanDepth = builder.maxPlanDepth;
    }

    public static Options defaults() {
      return builder().build();
    }

    public static Builder builder() {
      return new Builder();
    }

    public boolean isEnabled(PivotStrategy strategy) {
      return enabled.contains(strategy);
    }

    public Set<PivotStrategy> enabledStrategies() {
      return enabled;
    }

    /**
     * How deeply measure references are expanded while planning.
     *
     * @return the limit, 32 by default
     */
    public int maxPlanDepth() {
      return maxPlanDepth;
    }

    /** Builder for {@link Options}. */
    public static final class Builder {
      private final EnumSet<PivotStrategy> enabled = EnumSet.allOf(PivotStrategy.class);
      private int maxPlanDepth = 32;

      private Builder() {
      }

      /**
       * Turn off a strategy. The row scan is the fallback for every other
       * strategy and cannot be disabled.
       *
       * @param strategy
       *          the strategy
       * @return this builder
       */
      public Builder disable(PivotStrategy strategy) {
        if (strategy == PivotStrategy.ROW_SCAN) {
          throw new IllegalArgumentException("the row scan strategy cannot be disabled");
        }
        enabled.remove(strategy);
        return this;
      }

      /**
       * Enable only the given strategy, plus the row scan fallback.
       *
       * @param strategy
       *          the strategy to force
       * @return this builder
       */
      public Builder only(PivotStrategy strategy) {
        enabled.clear();
        enabled.add(strategy);
        enabled.add(PivotStrategy.ROW_SCAN);
        return this;
      }

      public Builder maxPlanDepth(int depth) {
        if (depth < 0) {
          throw new IllegalArgumentException("maxPlanDepth must not be negative: " + depth);
        }
        this.maxPlanDepth = depth;
        return this;
      }

      public Options build() {
        return new Options(this);
      }
    }
  }
}
