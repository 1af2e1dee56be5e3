package se.alipsa.jdax.engine;

import java.util.BitSet;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import se.alipsa.jdax.helper.DaxUtil;
import se.alipsa.jdax.value.Value;

/**
 * Immutable set of restrictions an expression is evaluated under. Every
 * {@code with...} method returns a new instance; all constraints combine with
 * logical AND.
 *
 * <p>
 * Table and column names are stored normalized, so lookups are
 * case-insensitive.
 * </p>
 */
public final class FilterContext {

  private static final FilterContext EMPTY = new FilterContext(Map.of(), Map.of(), Set.of(), Map.of(), false);

  private final Map<ColumnKey, Set<Value>> columnFilters;
  private final Map<String, BitSet> rowFilters;
  private final Set<Integer> activatedRelationships;
  private final Map<Integer, RelationshipOverride> overrides;
  private final boolean transitionSuppressed;

  /**
   * A normalized {@code (table, column)} pair.
   *
   * @param table
   *          normalized table name
   * @param column
   *          normalized column name
   */
  public record ColumnKey(String table, String column) {

    public static ColumnKey of(String table, String column) {
      return new ColumnKey(DaxUtil.normalize(table), DaxUtil.normalize(column));
    }
  }

  private FilterContext(Map<ColumnKey, Set<Value>> columnFilters, Map<String, BitSet> rowFilters,
      Set<Integer> activatedRelationships, Map<Integer, RelationshipOverride> overrides,
      boolean transitionSuppressed) {
    this.columnFilters = columnFilters;
    this.rowFilters = rowFilters;
    this.activatedRelationships = activatedRelationships;
    this.overrides = overrides;
    this.transitionSuppressed = transitionSuppressed;
  }

  public static FilterContext empty() {
    return EMPTY;
  }

  /**
   * Whether no column or row filter is present. Relationship activation and
   * overrides do not count.
   *
   * @return {@code true} when nothing restricts rows
   */
  public boolean isEmpty() {
    return columnFilters.isEmpty() && rowFilters.isEmpty();
  }

  public Map<ColumnKey, Set<Value>> columnFilters() {
    return columnFilters;
  }

  /**
   * Allowed values of a column.
   *
   * @param table
   *          table name
   * @param column
   *          column name
   * @return the allowed values or {@code null} when the column is unfiltered
   */
  public Set<Value> columnFilter(String table, String column) {
    return columnFilters.get(ColumnKey.of(table, column));
  }

  /**
   * Allowed rows of a table.
   *
   * @param table
   *          table name
   * @return a copy of the row filter, or {@code null} when there is none
   */
  public BitSet rowFilter(String table) {
    BitSet rows = rowFilters.get(DaxUtil.normalize(table));
    return rows == null ? null : (BitSet) rows.clone();
  }

  public boolean hasRowFilter(String table) {
    return rowFilters.containsKey(DaxUtil.normalize(table));
  }

  /**
   * Tables carrying a row filter.
   *
   * @return normalized table names
   */
  public Set<String> rowFilteredTables() {
    return rowFilters.keySet();
  }

  public Set<Integer> activatedRelationships() {
    return activatedRelationships;
  }

  public boolean isActivated(int relationship) {
    return activatedRelationships.contains(relationship);
  }

  /**
   * Override installed for a relationship.
   *
   * @param relationship
   *          relationship index
   * @return the override or {@code null}
   */
  public RelationshipOverride override(int relationship) {
    return overrides.get(relationship);
  }

  public Map<Integer, RelationshipOverride> overrides() {
    return overrides;
  }

  public boolean isTransitionSuppressed() {
    return transitionSuppressed;
  }

  /**
   * Restrict a column to one value, replacing any previous filter on it.
   *
   * @param table
   *          table name
   * @param column
   *          column name
   * @param value
   *          the allowed value
   * @return the new context
   */
  public FilterContext withColumnEquals(String table, String column, Value value) {
    return withColumnIn(table, column, Set.of(value));
  }

  /**
   * Restrict a column to a value set, replacing any previous filter on it.
   *
   * @param table
   *          table name
   * @param column
   *          column name
   * @param values
   *          allowed values; an empty set allows nothing
   * @return the new context
   */
  public FilterContext withColumnIn(String table, String column, Collection<Value> values) {
    Objects.requireNonNull(values, "values");
    Map<ColumnKey, Set<Value>> next = new LinkedHashMap<>(columnFilters);
    next.put(ColumnKey.of(table, column), Collections.unmodifiableSet(new LinkedHashSet<>(values)));
    return new FilterContext(Collections.unmodifiableMap(next), rowFilters, activatedRelationships, overrides,
        transitionSuppressed);
  }

  /**
   * Intersect a column's filter with a value set, or set it when the column is
   * unfiltered.
   *
   * @param table
   *          table name
   * @param column
   *          column name
   * @param values
   *          values to keep
   * @return the new context
   */
  public FilterContext intersectColumn(String table, String column, Collection<Value> values) {
    Set<Value> existing = columnFilter(table, column);
    if (existing == null) {
      return withColumnIn(table, column, values);
    }
    Set<Value> kept = new LinkedHashSet<>(existing);
    kept.retainAll(new LinkedHashSet<>(values));
    return withColumnIn(table, column, kept);
  }

  /**
   * Remove the filter on one column.
   *
   * @param table
   *          table name
   * @param column
   *          column name
   * @return the new context
   */
  public FilterContext withoutColumn(String table, String column) {
    ColumnKey key = ColumnKey.of(table, column);
    if (!columnFilters.containsKey(key)) {
      return this;
    }
    Map<ColumnKey, Set<Value>> next = new LinkedHashMap<>(columnFilters);
    next.remove(key);
    return new FilterContext(Collections.unmodifiableMap(next), rowFilters, activatedRelationships, overrides,
        transitionSuppressed);
  }

  /**
   * Remove the row filter and every column filter of a table.
   *
   * @param table
   *          table name
   * @return the new context
   */
  public FilterContext withoutTable(String table) {
    String key = DaxUtil.normalize(table);
    Map<ColumnKey, Set<Value>> nextColumns = new LinkedHashMap<>(columnFilters);
    nextColumns.keySet().removeIf(k -> k.table().equals(key));
    Map<String, BitSet> nextRows = new LinkedHashMap<>(rowFilters);
    nextRows.remove(key);
    return new FilterContext(Collections.unmodifiableMap(nextColumns), Collections.unmodifiableMap(nextRows),
        activatedRelationships, overrides, transitionSuppressed);
  }

  /**
   * Replace a table's row filter.
   *
   * @param table
   *          table name
   * @param rows
   *          allowed physical rows
   * @return the new context
   */
  public FilterContext withRowFilter(String table, BitSet rows) {
    Objects.requireNonNull(rows, "rows");
    Map<String, BitSet> next = new LinkedHashMap<>(rowFilters);
    next.put(DaxUtil.normalize(table), (BitSet) rows.clone());
    return new FilterContext(columnFilters, Collections.unmodifiableMap(next), activatedRelationships, overrides,
        transitionSuppressed);
  }

  /**
   * Intersect a table's row filter with a row set, or set it when absent.
   *
   * @param table
   *          table name
   * @param rows
   *          rows to keep
   * @return the new context
   */
  public FilterContext intersectRowFilter(String table, BitSet rows) {
    BitSet existing = rowFilter(table);
    if (existing == null) {
      return withRowFilter(table, rows);
    }
    existing.and(rows);
    return withRowFilter(table, existing);
  }

  /**
   * Activate a relationship for this call.
   *
   * @param relationship
   *          relationship index
   * @return the new context
   */
  public FilterContext withActivatedRelationship(int relationship) {
    Set<Integer> next = new TreeSet<>(activatedRelationships);
    next.add(relationship);
    return new FilterContext(columnFilters, rowFilters, Collections.unmodifiableSet(next), overrides,
        transitionSuppressed);
  }

  /**
   * Install a direction override for a relationship.
   *
   * @param relationship
   *          relationship index
   * @param override
   *          the override
   * @return the new context
   */
  public FilterContext withOverride(int relationship, RelationshipOverride override) {
    Objects.requireNonNull(override, "override");
    Map<Integer, RelationshipOverride> next = new LinkedHashMap<>(overrides);
    next.put(relationship, override);
    return new FilterContext(columnFilters, rowFilters, activatedRelationships, Collections.unmodifiableMap(next),
        transitionSuppressed);
  }

  public FilterContext withTransitionSuppressed(boolean suppressed) {
    if (suppressed == transitionSuppressed) {
      return this;
    }
    return new FilterContext(columnFilters, rowFilters, activatedRelationships, overrides, suppressed);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof FilterContext other)) {
      return false;
    }
    return transitionSuppressed == other.transitionSuppressed && columnFilters.equals(other.columnFilters)
        && rowFilters.equals(other.rowFilters) && activatedRelationships.equals(other.activatedRelationships)
        && overrides.equals(other.overrides);
  }

  @Override
  public int hashCode() {
    return Objects.hash(columnFilters, rowFilters, activatedRelationships, overrides, transitionSuppressed);
  }

  @Override
  public String toString() {
    return "FilterContext[columns=" + columnFilters + ", rows=" + rowFilters + ", activated="
        + activatedRelationships + ", overrides=" + overrides + "]";
  }
}
