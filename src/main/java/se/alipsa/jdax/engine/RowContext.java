package se.alipsa.jdax.engine;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import se.alipsa.jdax.DaxException;
import se.alipsa.jdax.helper.DaxUtil;
import se.alipsa.jdax.table.Table;
import se.alipsa.jdax.value.Value;

/**
 * Immutable stack of current-row bindings. Iterators push a frame per row;
 * several frames may bind the same table when iterations nest, and the outer
 * ones are reachable through {@link #earlier(String, int)}.
 */
public final class RowContext {

  private static final RowContext EMPTY = new RowContext(List.of());

  private final List<Frame> frames;

  private RowContext(List<Frame> frames) {
    this.frames = frames;
  }

  public static RowContext empty() {
    return EMPTY;
  }

  /**
   * One current-row binding.
   *
   * @param table
   *          the table iterated
   * @param row
   *          the current row; the row count denotes the virtual blank row
   * @param visibleColumns
   *          readable column indices, {@code null} for all
   */
  public record Frame(Table table, int row, Set<Integer> visibleColumns) {

    public Frame {
      Objects.requireNonNull(table, "table");
      visibleColumns = visibleColumns == null ? null : Set.copyOf(visibleColumns);
    }

    public boolean isColumnVisible(int column) {
      return visibleColumns == null || visibleColumns.contains(column);
    }

    /**
     * Read a column of the bound row. The virtual blank row reads blank.
     *
     * @param column
     *          column index
     * @return the value
     * @throws DaxException
     *           of kind {@code EVAL} when the column is not visible
     */
    public Value read(int column) {
      if (!isColumnVisible(column)) {
        throw DaxException.eval("column " + DaxUtil.columnRef(table.name(), table.columns().get(column))
            + " is not available in the current row context");
      }
      return table.value(row, column);
    }
  }

  /**
   * Bind a row with every column visible.
   *
   * @param table
   *          the table
   * @param row
   *          the row index
   * @return a new context with the frame on top
   */
  public RowContext push(Table table, int row) {
    return push(table, row, null);
  }

  /**
   * Bind a row.
   *
   * @param table
   *          the table
   * @param row
   *          the row index
   * @param visibleColumns
   *          readable column indices, {@code null} for all
   * @return a new context with the frame on top
   */
  public RowContext push(Table table, int row, Set<Integer> visibleColumns) {
    List<Frame> next = new ArrayList<>(frames.size() + 1);
    next.addAll(frames);
    next.add(new Frame(table, row, visibleColumns));
    return new RowContext(Collections.unmodifiableList(next));
  }

  public boolean isEmpty() {
    return frames.isEmpty();
  }

  /**
   * Frames from outermost to innermost.
   *
   * @return the frames
   */
  public List<Frame> frames() {
    return frames;
  }

  /**
   * The innermost frame.
   *
   * @return the frame or {@code null} when the context is empty
   */
  public Frame current() {
    return frames.isEmpty() ? null : frames.get(frames.size() - 1);
  }

  /**
   * The innermost frame bound to a table.
   *
   * @param table
   *          table name, matched case-insensitively
   * @return the frame or {@code null}
   */
  public Frame frameFor(String table) {
    return earlier(table, 0);
  }

  /**
   * The frame {@code level} steps out from the innermost frame bound to a
   * table; level 0 is the innermost one.
   *
   * @param table
   *          table name
   * @param level
   *          nesting distance
   * @return the frame or {@code null} when there are not enough frames
   */
  public Frame earlier(String table, int level) {
    String key = DaxUtil.normalize(table);
    int seen = 0;
    for (int i = frames.size() - 1; i >= 0; i--) {
      Frame frame = frames.get(i);
      if (DaxUtil.normalize(frame.table().name()).equals(key)) {
        if (seen == level) {
          return frame;
        }
        seen++;
      }
    }
    return null;
  }

  /**
   * The outermost frame bound to a table.
   *
   * @param table
   *          table name
   * @return the frame or {@code null}
   */
  public Frame earliest(String table) {
    String key = DaxUtil.normalize(table);
    for (Frame frame : frames) {
      if (DaxUtil.normalize(frame.table().name()).equals(key)) {
        return frame;
      }
    }
    return null;
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder("RowContext[");
    for (int i = 0; i < frames.size(); i++) {
      if (i > 0) {
        sb.append(", ");
      }
      sb.append(frames.get(i).table().name()).append('#').append(frames.get(i).row());
    }
    return sb.append(']').toString();
  }
}
