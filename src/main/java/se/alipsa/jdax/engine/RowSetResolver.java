package se.alipsa.jdax.engine;

import java.util.BitSet;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import se.alipsa.jdax.DaxException;
import se.alipsa.jdax.engine.FilterContext.ColumnKey;
import se.alipsa.jdax.helper.DaxUtil;
import se.alipsa.jdax.model.CrossFilterDirection;
import se.alipsa.jdax.model.DataModel;
import se.alipsa.jdax.model.Relationship;
import se.alipsa.jdax.model.RelationshipInfo;
import se.alipsa.jdax.table.Table;
import se.alipsa.jdax.value.Value;

/**
 * Turns a {@link FilterContext} into the set of allowed rows per table by
 * seeding each table from its own filters and then propagating across
 * relationships until nothing changes.
 *
 * <p>
 * Row sets are keyed by normalized table name. Every call builds fresh
 * bitmaps, so callers may modify the returned sets.
 * </p>
 */
public final class RowSetResolver {

  private static final Logger log = LoggerFactory.getLogger(RowSetResolver.class);

  private enum Direction {
    TO_MANY, TO_ONE
  }

  private RowSetResolver() {
  }

  /**
   * Resolve allowed rows for every table of the model.
   *
   * @param model
   *          the data model
   * @param filter
   *          the filter context
   * @return allowed physical rows keyed by normalized table name
   */
  public static Map<String, BitSet> resolve(DataModel model, FilterContext filter) {
    Map<String, BitSet> sets = new HashMap<>();
    if (filter.isEmpty()) {
      for (Table table : model.tables()) {
        sets.put(DaxUtil.normalize(table.name()), allRows(table.rowCount()));
      }
      return sets;
    }
    for (Table table : model.tables()) {
      sets.put(DaxUtil.normalize(table.name()), seed(table, filter));
    }
    for (ColumnKey key : filter.columnFilters().keySet()) {
      if (model.table(key.table()) == null) {
        throw DaxException.unknownTable(key.table());
      }
    }
    Set<String> overridePairs = overridePairs(model, filter);
    int iterations = 0;
    int calls = 0;
    boolean changed = true;
    while (changed) {
      iterations++;
      changed = false;
      List<RelationshipInfo> relationships = model.relationships();
      for (int i = 0; i < relationships.size(); i++) {
        RelationshipInfo info = relationships.get(i);
        if (!isActive(info, i, filter, overridePairs)) {
          continue;
        }
        RelationshipOverride override = filter.override(i);
        boolean toMany;
        boolean toOne;
        if (override == RelationshipOverride.ONE_WAY_REVERSE) {
          toMany = false;
          toOne = true;
        } else if (override != null) {
          toMany = true;
          toOne = override == RelationshipOverride.BOTH;
        } else {
          toMany = true;
          toOne = info.relationship().crossFilterDirection() == CrossFilterDirection.BOTH;
        }
        if (toMany) {
          calls++;
          changed |= propagate(model, sets, info, Direction.TO_MANY, filter);
        }
        if (toOne) {
          calls++;
          changed |= propagate(model, sets, info, Direction.TO_ONE, filter);
        }
      }
    }
    if (log.isDebugEnabled()) {
      StringBuilder summary = new StringBuilder();
      for (Table table : model.tables()) {
        BitSet rows = sets.get(DaxUtil.normalize(table.name()));
        summary.append(' ').append(table.name()).append('=').append(rows.cardinality()).append('/')
            .append(table.rowCount());
      }
      log.debug("Resolved row sets in {} iterations with {} propagation calls:{}", iterations, calls, summary);
    }
    return sets;
  }

  /**
   * Allowed rows of one table.
   *
   * @param model
   *          the data model
   * @param filter
   *          the filter context
   * @param table
   *          table name
   * @return allowed physical rows
   */
  public static BitSet resolveTableRows(DataModel model, FilterContext filter, String table) {
    Table target = model.requireTable(table);
    if (filter.isEmpty()) {
      return allRows(target.rowCount());
    }
    return resolve(model, filter).get(DaxUtil.normalize(target.name()));
  }

  /**
   * Whether the virtual blank row of a table may be visible under the filter:
   * the table has no row filter and every column filter on it admits blank.
   *
   * @param filter
   *          the filter context
   * @param table
   *          table name
   * @return {@code true} when blank is allowed
   */
  public static boolean blankRowAllowed(FilterContext filter, String table) {
    String key = DaxUtil.normalize(table);
    if (filter.hasRowFilter(key)) {
      return false;
    }
    for (Map.Entry<ColumnKey, Set<Value>> entry : filter.columnFilters().entrySet()) {
      if (entry.getKey().table().equals(key) && !entry.getValue().contains(Value.BLANK)) {
        return false;
      }
    }
    return true;
  }

  /**
   * Whether a dimension table currently has a virtual blank row: some active
   * relationship into it has a visible fact row whose key is blank or
   * unmatched.
   *
   * @param model
   *          the data model
   * @param filter
   *          the filter context
   * @param table
   *          the dimension table
   * @param sets
   *          already resolved row sets, or {@code null} to resolve on demand
   * @return {@code true} when the virtual row exists
   */
  public static boolean virtualBlankRowExists(DataModel model, FilterContext filter, String table,
      Map<String, BitSet> sets) {
    String key = DaxUtil.normalize(table);
    Set<String> overridePairs = overridePairs(model, filter);
    Map<String, BitSet> resolved = sets;
    List<RelationshipInfo> relationships = model.relationships();
    for (int i = 0; i < relationships.size(); i++) {
      RelationshipInfo info = relationships.get(i);
      Relationship rel = info.relationship();
      if (!DaxUtil.normalize(rel.toTable()).equals(key) || !isActive(info, i, filter, overridePairs)) {
        continue;
      }
      if (filter.isEmpty()) {
        if (info.hasUnmatchedFactRows()) {
          return true;
        }
        continue;
      }
      if (resolved == null) {
        resolved = resolve(model, filter);
      }
      BitSet fromRows = resolved.get(DaxUtil.normalize(rel.fromTable()));
      if (fromRows != null && info.anyUnmatchedIn(fromRows)) {
        return true;
      }
    }
    return false;
  }

  /**
   * Whether a relationship propagates under the filter. An activated
   * relationship deactivates every other relationship between the same two
   * tables; a {@link RelationshipOverride#DISABLED} override always wins.
   *
   * @param model
   *          the data model
   * @param filter
   *          the filter context
   * @param relationship
   *          relationship index
   * @return {@code true} when active
   */
  public static boolean isRelationshipActive(DataModel model, FilterContext filter, int relationship) {
    return isActive(model.relationship(relationship), relationship, filter, overridePairs(model, filter));
  }

  private static boolean isActive(RelationshipInfo info, int index, FilterContext filter, Set<String> overridePairs) {
    Relationship rel = info.relationship();
    boolean active;
    if (overridePairs.contains(pairKey(rel))) {
      active = filter.isActivated(index);
    } else {
      active = rel.active();
    }
    return active && filter.override(index) != RelationshipOverride.DISABLED;
  }

  private static Set<String> overridePairs(DataModel model, FilterContext filter) {
    if (filter.activatedRelationships().isEmpty()) {
      return Collections.emptySet();
    }
    Set<String> pairs = new HashSet<>();
    for (int idx : filter.activatedRelationships()) {
      if (idx >= 0 && idx < model.relationships().size()) {
        pairs.add(pairKey(model.relationship(idx).relationship()));
      }
    }
    return pairs;
  }

  private static String pairKey(Relationship rel) {
    return DaxUtil.normalize(rel.fromTable()) + "\u0000" + DaxUtil.normalize(rel.toTable());
  }

  private static BitSet seed(Table table, FilterContext filter) {
    int rowCount = table.rowCount();
    BitSet allowed;
    BitSet rowFilter = filter.rowFilter(table.name());
    if (rowFilter != null) {
      allowed = rowFilter;
      if (allowed.length() > rowCount) {
        allowed.clear(rowCount, allowed.length());
      }
    } else {
      allowed = allRows(rowCount);
    }
    String tableKey = DaxUtil.normalize(table.name());
    for (Map.Entry<ColumnKey, Set<Value>> entry : filter.columnFilters().entrySet()) {
      if (!entry.getKey().table().equals(tableKey)) {
        continue;
      }
      int idx = table.columnIndex(entry.getKey().column());
      if (idx < 0) {
        throw DaxException.unknownColumn(table.name(), entry.getKey().column());
      }
      Set<Value> values = entry.getValue();
      if (values.isEmpty()) {
        allowed.clear();
        continue;
      }
      Optional<BitSet> indexed = values.size() == 1
          ? table.backend().filterEq(idx, values.iterator().next())
          : table.backend().filterIn(idx, values);
      if (indexed.isPresent()) {
        allowed.and(indexed.get());
        continue;
      }
      BitSet next = new BitSet(rowCount);
      for (int row = allowed.nextSetBit(0); row >= 0; row = allowed.nextSetBit(row + 1)) {
        if (values.contains(table.value(row, idx))) {
          next.set(row);
        }
      }
      allowed = next;
      if (allowed.isEmpty()) {
        break;
      }
    }
    return allowed;
  }

  private static boolean propagate(DataModel model, Map<String, BitSet> sets, RelationshipInfo info,
      Direction direction, FilterContext filter) {
    Relationship rel = info.relationship();
    String toKey = DaxUtil.normalize(rel.toTable());
    String fromKey = DaxUtil.normalize(rel.fromTable());
    Table toTable = model.requireTable(rel.toTable());
    Table fromTable = model.requireTable(rel.fromTable());
    BitSet toSet = sets.get(toKey);
    BitSet fromSet = sets.get(fromKey);
    BitSet next;
    if (direction == Direction.TO_MANY) {
      boolean blankAllowed = blankRowAllowed(filter, rel.toTable());
      if (blankAllowed && toSet.cardinality() == toTable.rowCount()) {
        return false;
      }
      Set<Value> allowedKeys = new LinkedHashSet<>();
      for (int row = toSet.nextSetBit(0); row >= 0; row = toSet.nextSetBit(row + 1)) {
        Value key = toTable.value(row, info.toColumnIndex());
        if (!key.isBlank()) {
          allowedKeys.add(key);
        }
      }
      next = new BitSet(fromTable.rowCount());
      for (Value key : allowedKeys) {
        for (int row : info.fromRows(key)) {
          next.set(row);
        }
      }
      if (blankAllowed) {
        next.or(info.unmatchedFactRows());
      }
      next.and(fromSet);
      if (removedAny(fromSet, next)) {
        sets.put(fromKey, next);
        return true;
      }
      return false;
    }
    if (fromSet.cardinality() == fromTable.rowCount()) {
      return false;
    }
    next = new BitSet(toTable.rowCount());
    for (int row = fromSet.nextSetBit(0); row >= 0; row = fromSet.nextSetBit(row + 1)) {
      Value key = fromTable.value(row, info.fromColumnIndex());
      if (key.isBlank()) {
        continue;
      }
      int toRow = info.toRow(key);
      if (toRow >= 0) {
        next.set(toRow);
      }
    }
    next.and(toSet);
    if (removedAny(toSet, next)) {
      sets.put(toKey, next);
      return true;
    }
    return false;
  }

  private static boolean removedAny(BitSet previous, BitSet next) {
    BitSet removed = (BitSet) previous.clone();
    removed.andNot(next);
    return !removed.isEmpty();
  }

  /**
   * A bitmap with every physical row set.
   *
   * @param rowCount
   *          number of rows
   * @return rows {@code [0, rowCount)}
   */
  public static BitSet allRows(int rowCount) {
    BitSet rows = new BitSet(rowCount);
    rows.set(0, rowCount);
    return rows;
  }
}
