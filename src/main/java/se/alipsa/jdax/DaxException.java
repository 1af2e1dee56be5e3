package se.alipsa.jdax;

import java.util.Objects;

/**
 * Error raised while building a data model, parsing an expression or evaluating
 * it. Every failure carries an {@link ErrorKind} so callers can branch on the
 * category without inspecting the message text.
 */
public class DaxException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  /** Failure categories. */
  public enum ErrorKind {
    PARSE, UNKNOWN_TABLE, UNKNOWN_COLUMN, UNKNOWN_MEASURE, DUPLICATE_TABLE, DUPLICATE_COLUMN, DUPLICATE_MEASURE,
    SCHEMA_MISMATCH, COLUMN_LENGTH_MISMATCH, UNSUPPORTED_CARDINALITY, NON_UNIQUE_KEY, REFERENTIAL_INTEGRITY,
    JOIN_COLUMN_TYPE_MISMATCH, READ_ONLY_TABLE, TYPE, EVAL
  }

  private final ErrorKind kind;

  /**
   * Create a new exception.
   *
   * @param kind
   *          the failure category
   * @param message
   *          human readable description
   */
  public DaxException(ErrorKind kind, String message) {
    super(message);
    this.kind = Objects.requireNonNull(kind, "kind");
  }

  /**
   * Create a new exception wrapping a cause.
   *
   * @param kind
   *          the failure category
   * @param message
   *          human readable description
   * @param cause
   *          the underlying failure
   */
  public DaxException(ErrorKind kind, String message, Throwable cause) {
    super(message, cause);
    this.kind = Objects.requireNonNull(kind, "kind");
  }

  /**
   * The failure category.
   *
   * @return the kind of this error
   */
  public ErrorKind getKind() {
    return kind;
  }

  public static DaxException parse(String message, int position) {
    return new DaxException(ErrorKind.PARSE, message + " at position " + position);
  }

  public static DaxException unknownTable(String table) {
    return new DaxException(ErrorKind.UNKNOWN_TABLE, "unknown table: " + table);
  }

  public static DaxException unknownColumn(String table, String column) {
    return new DaxException(ErrorKind.UNKNOWN_COLUMN, "unknown column " + table + "[" + column + "]");
  }

  public static DaxException unknownMeasure(String name) {
    return new DaxException(ErrorKind.UNKNOWN_MEASURE, "unknown measure: " + name);
  }

  public static DaxException duplicateTable(String table) {
    return new DaxException(ErrorKind.DUPLICATE_TABLE, "duplicate table: " + table);
  }

  public static DaxException duplicateColumn(String table, String column) {
    return new DaxException(ErrorKind.DUPLICATE_COLUMN, "duplicate column " + table + "[" + column + "]");
  }

  public static DaxException duplicateMeasure(String name) {
    return new DaxException(ErrorKind.DUPLICATE_MEASURE, "duplicate measure: " + name);
  }

  public static DaxException schemaMismatch(String table, int expected, int actual) {
    return new DaxException(ErrorKind.SCHEMA_MISMATCH,
        "schema mismatch for " + table + ": expected " + expected + " values, got " + actual);
  }

  public static DaxException columnLengthMismatch(String table, String column, int expected, int actual) {
    return new DaxException(ErrorKind.COLUMN_LENGTH_MISMATCH,
        "column " + table + "[" + column + "] has " + actual + " values, expected " + expected);
  }

  public static DaxException unsupportedCardinality(String relationship, String cardinality) {
    return new DaxException(ErrorKind.UNSUPPORTED_CARDINALITY,
        "relationship " + relationship + " has unsupported cardinality " + cardinality);
  }

  public static DaxException nonUniqueKey(String table, String column, Object value) {
    return new DaxException(ErrorKind.NON_UNIQUE_KEY, "non-unique key in " + table + "[" + column + "]: " + value);
  }

  public static DaxException referentialIntegrity(String relationship, String fromTable, String fromColumn,
      String toTable, String toColumn, Object value) {
    return new DaxException(ErrorKind.REFERENTIAL_INTEGRITY,
        "referential integrity violation in relationship " + relationship + ": value " + value + " in " + fromTable
            + "[" + fromColumn + "] has no match in " + toTable + "[" + toColumn + "]");
  }

  public static DaxException joinColumnTypeMismatch(String relationship, String fromType, String toType) {
    return new DaxException(ErrorKind.JOIN_COLUMN_TYPE_MISMATCH, "relationship " + relationship
        + " joins columns of different types: " + fromType + " and " + toType);
  }

  public static DaxException readOnlyTable(String table, String operation) {
    return new DaxException(ErrorKind.READ_ONLY_TABLE, "table " + table + " is read-only: cannot " + operation);
  }

  public static DaxException type(String message) {
    return new DaxException(ErrorKind.TYPE, message);
  }

  public static DaxException eval(String message) {
    return new DaxException(ErrorKind.EVAL, message);
  }
}
