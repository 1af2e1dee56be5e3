package se.alipsa.jdax.model;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import se.alipsa.jdax.value.Value;

/**
 * A registered relationship together with its indices: the unique
 * {@code to}-key index, the multi-valued {@code from}-key index and the set of
 * unmatched fact rows (blank foreign key or no matching dimension row).
 */
public final class RelationshipInfo {

  private final Relationship relationship;
  private final int fromColumnIndex;
  private final int toColumnIndex;
  private final Map<Value, Integer> toIndex;
  private final Map<Value, List<Integer>> fromIndex;
  private final BitSet unmatched;

  RelationshipInfo(Relationship relationship, int fromColumnIndex, int toColumnIndex, Map<Value, Integer> toIndex,
      Map<Value, List<Integer>> fromIndex, BitSet unmatched) {
    this.relationship = relationship;
    this.fromColumnIndex = fromColumnIndex;
    this.toColumnIndex = toColumnIndex;
    this.toIndex = toIndex;
    this.fromIndex = fromIndex;
    this.unmatched = unmatched;
  }

  public Relationship relationship() {
    return relationship;
  }

  public int fromColumnIndex() {
    return fromColumnIndex;
  }

  public int toColumnIndex() {
    return toColumnIndex;
  }

  /**
   * Row of the dimension table holding {@code key}.
   *
   * @param key
   *          the key value
   * @return the row index, or {@code -1} when no row matches
   */
  public int toRow(Value key) {
    Integer row = toIndex.get(key);
    return row == null ? -1 : row;
  }

  public boolean containsToKey(Value key) {
    return toIndex.containsKey(key);
  }

  /**
   * Fact rows carrying {@code key}.
   *
   * @param key
   *          the foreign key value
   * @return the rows in ascending order, empty when none
   */
  public List<Integer> fromRows(Value key) {
    List<Integer> rows = fromIndex.get(key);
    return rows == null ? List.of() : Collections.unmodifiableList(rows);
  }

  public int toIndexSize() {
    return toIndex.size();
  }

  public int fromIndexSize() {
    return fromIndex.size();
  }

  /**
   * Fact rows whose key is blank or has no dimension match.
   *
   * @return a copy of the unmatched row set
   */
  public BitSet unmatchedFactRows() {
    return (BitSet) unmatched.clone();
  }

  public boolean hasUnmatchedFactRows() {
    return !unmatched.isEmpty();
  }

  /**
   * Whether any unmatched fact row is part of {@code allowed}.
   *
   * @param allowed
   *          allowed fact rows
   * @return {@code true} when the sets intersect
   */
  public boolean anyUnmatchedIn(BitSet allowed) {
    return unmatched.intersects(allowed);
  }

  void putToKey(Value key, int row) {
    boolean isNew = !toIndex.containsKey(key);
    toIndex.put(key, row);
    if (isNew && !key.isBlank()) {
      for (int factRow : fromRows(key)) {
        unmatched.clear(factRow);
      }
    }
  }

  void addFromKey(Value key, int row) {
    fromIndex.computeIfAbsent(key, k -> new ArrayList<>()).add(row);
    if (key.isBlank() || !toIndex.containsKey(key)) {
      unmatched.set(row);
    }
  }

  static RelationshipInfo empty(Relationship relationship, int fromColumnIndex, int toColumnIndex) {
    return new RelationshipInfo(relationship, fromColumnIndex, toColumnIndex, new HashMap<>(), new HashMap<>(),
        new BitSet());
  }

  @Override
  public String toString() {
    return "RelationshipInfo[" + relationship + ", keys=" + toIndex.size() + ", unmatched="
        + unmatched.cardinality() + "]";
  }
}
