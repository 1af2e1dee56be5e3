package se.alipsa.jdax.pivot;

import java.util.Objects;
import se.alipsa.jdax.helper.DaxUtil;

/**
 * A column to group a pivot by. The column may live on the base table or on a
 * table reached from it over active many-to-one relationships.
 *
 * @param table
 *          table name
 * @param column
 *          column name
 */
public record GroupByColumn(String table, String column) {

  public GroupByColumn {
    Objects.requireNonNull(table, "table");
    Objects.requireNonNull(column, "column");
  }

  public static GroupByColumn of(String table, String column) {
    return new GroupByColumn(table, column);
  }

  /**
   * Caption used in result headers.
   *
   * @return {@code Table[Column]}
   */
  public String caption() {
    return DaxUtil.columnRef(table, column);
  }
}
