package se.alipsa.fqe.wire;

import java.util.ArrayList;
import java.util.List;

/**
 * A fully materialized query result.
 *
 * @param columns
 *          column metadata in result order
 * @param rows
 *          row-major cells; every row has exactly {@code columns.size()} cells
 * @param rowCount
 *          row count reported by the engine; advisory only, {@code rows.size()} bounds iteration
 * @param stats
 *          execution statistics
 */
public record WireResult(List<ColumnMeta> columns, List<List<WireValue>> rows, int rowCount, ExecutionStats stats) {

  /** Result of a statement without a tabular payload. */
  public static final WireResult EMPTY = new WireResult(List.of(), List.of(), 0, ExecutionStats.NONE);

  public WireResult {
    columns = columns == null ? List.of() : List.copyOf(columns);
    List<List<WireValue>> copy = new ArrayList<>();
    if (rows != null) {
      for (List<WireValue> row : rows) {
        if (row.size() != columns.size()) {
          throw new IllegalArgumentException(
              "Row " + (copy.size() + 1) + " has " + row.size() + " cells, expected " + columns.size());
        }
        copy.add(List.copyOf(row));
      }
    }
    rows = List.copyOf(copy);
    stats = stats == null ? ExecutionStats.NONE : stats;
  }

  /**
   * Build an in-memory result from plain Java values, see {@link WireValue#of(Object)}.
   *
   * @param columns
   *          column metadata
   * @param values
   *          rows of plain values
   * @return the result
   */
  public static WireResult of(List<ColumnMeta> columns, List<List<Object>> values) {
    List<List<WireValue>> rows = new ArrayList<>(values.size());
    for (List<Object> row : values) {
      List<WireValue> cells = new ArrayList<>(row.size());
      for (Object v : row) {
        cells.add(WireValue.of(v));
      }
      rows.add(cells);
    }
    return new WireResult(columns, rows, rows.size(), ExecutionStats.NONE);
  }

  /**
   * Keep at most {@code maxRows} rows.
   *
   * @param maxRows
   *          row limit, 0 meaning unlimited
   * @return this result, or a truncated copy
   */
  public WireResult limit(int maxRows) {
    if (maxRows <= 0 || rows.size() <= maxRows) {
      return this;
    }
    return new WireResult(columns, rows.subList(0, maxRows), rowCount, stats);
  }

  public int columnCount() {
    return columns.size();
  }

  public boolean isEmpty() {
    return columns.isEmpty() && rows.isEmpty();
  }
}
