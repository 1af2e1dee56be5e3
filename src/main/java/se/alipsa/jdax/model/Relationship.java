package se.alipsa.jdax.model;

import java.util.Objects;
import se.alipsa.jdax.helper.DaxUtil;

/**
 * A directed edge {@code fromTable[fromColumn] -> toTable[toColumn]} between
 * a fact table and a dimension table.
 *
 * @param name
 *          relationship name used in messages
 * @param fromTable
 *          the many (fact) side table
 * @param fromColumn
 *          foreign key column on the fact side
 * @param toTable
 *          the one (dimension) side table
 * @param toColumn
 *          key column on the dimension side
 * @param cardinality
 *          key uniqueness rule
 * @param crossFilterDirection
 *          filter propagation direction
 * @param active
 *          whether the relationship propagates filters by default
 * @param enforceReferentialIntegrity
 *          whether every non-blank foreign key must resolve
 */
public record Relationship(String name, String fromTable, String fromColumn, String toTable, String toColumn,
    Cardinality cardinality, CrossFilterDirection crossFilterDirection, boolean active,
    boolean enforceReferentialIntegrity) {

  public Relationship {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(fromTable, "fromTable");
    Objects.requireNonNull(fromColumn, "fromColumn");
    Objects.requireNonNull(toTable, "toTable");
    Objects.requireNonNull(toColumn, "toColumn");
    Objects.requireNonNull(cardinality, "cardinality");
    Objects.requireNonNull(crossFilterDirection, "crossFilterDirection");
  }

  /**
   * An active, single direction one-to-many relationship without integrity
   * enforcement.
   *
   * @param name
   *          relationship name
   * @param fromTable
   *          fact table
   * @param fromColumn
   *          foreign key column
   * @param toTable
   *          dimension table
   * @param toColumn
   *          dimension key column
   * @return the relationship
   */
  public static Relationship of(String name, String fromTable, String fromColumn, String toTable, String toColumn) {
    return new Relationship(name, fromTable, fromColumn, toTable, toColumn, Cardinality.ONE_TO_MANY,
        CrossFilterDirection.SINGLE, true, false);
  }

  public Relationship withCardinality(Cardinality value) {
    return new Relationship(name, fromTable, fromColumn, toTable, toColumn, value, crossFilterDirection, active,
        enforceReferentialIntegrity);
  }

  public Relationship withCrossFilterDirection(CrossFilterDirection value) {
    return new Relationship(name, fromTable, fromColumn, toTable, toColumn, cardinality, value, active,
        enforceReferentialIntegrity);
  }

  public Relationship withActive(boolean value) {
    return new Relationship(name, fromTable, fromColumn, toTable, toColumn, cardinality, crossFilterDirection, value,
        enforceReferentialIntegrity);
  }

  public Relationship withEnforceReferentialIntegrity(boolean value) {
    return new Relationship(name, fromTable, fromColumn, toTable, toColumn, cardinality, crossFilterDirection, active,
        value);
  }

  /**
   * Whether {@code table[column]} is one of the two endpoints.
   *
   * @param table
   *          table name
   * @param column
   *          column name
   * @return {@code true} when the names match either side, case-insensitively
   */
  public boolean hasEndpoint(String table, String column) {
    return isFrom(table, column) || isTo(table, column);
  }

  public boolean isFrom(String table, String column) {
    return DaxUtil.normalize(fromTable).equals(DaxUtil.normalize(table))
        && DaxUtil.normalize(fromColumn).equals(DaxUtil.normalize(column));
  }

  public boolean isTo(String table, String column) {
    return DaxUtil.normalize(toTable).equals(DaxUtil.normalize(table))
        && DaxUtil.normalize(toColumn).equals(DaxUtil.normalize(column));
  }

  @Override
  public String toString() {
    return name + " (" + DaxUtil.columnRef(fromTable, fromColumn) + " -> " + DaxUtil.columnRef(toTable, toColumn)
        + ")";
  }
}
