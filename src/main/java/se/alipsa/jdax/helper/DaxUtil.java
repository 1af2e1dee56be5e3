package se.alipsa.jdax.helper;

import java.util.Locale;

/** Utility methods. */
public final class DaxUtil {

  private DaxUtil() {
  }

  /**
   * Normalize a table or column name for case-insensitive lookup.
   *
   * @param identifier
   *          the identifier as written by the user
   * @return the lookup key, or {@code null} for {@code null} input
   */
  public static String normalize(String identifier) {
    if (identifier == null) {
      return null;
    }
    return identifier.trim().toLowerCase(Locale.ROOT);
  }

  /**
   * Normalize a measure name: surrounding whitespace and one pair of enclosing
   * brackets are removed, so {@code "[Total]"} and {@code " Total "} name the
   * same measure.
   *
   * @param name
   *          the measure name as written by the user
   * @return the bare name
   */
  public static String normalizeMeasureName(String name) {
    if (name == null) {
      return null;
    }
    String trimmed = name.trim();
    if (trimmed.startsWith("[") && trimmed.endsWith("]") && trimmed.length() >= 2) {
      trimmed = trimmed.substring(1, trimmed.length() - 1).trim();
    }
    return trimmed;
  }

  /**
   * Render a column reference the way the formula language writes it.
   *
   * @param table
   *          table name
   * @param column
   *          column name
   * @return {@code table[column]}
   */
  public static String columnRef(String table, String column) {
    return table + "[" + column + "]";
  }
}
