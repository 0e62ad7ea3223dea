package se.alipsa.fqe;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.sql.Date;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.SQLWarning;
import java.sql.Statement;
import java.sql.Time;
import java.sql.Timestamp;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.util.Calendar;
import java.util.List;
import java.util.Map;
import se.alipsa.fqe.error.ColumnNotFoundException;
import se.alipsa.fqe.error.CursorClosedException;
import se.alipsa.fqe.error.InvalidColumnIndexException;
import se.alipsa.fqe.error.InvalidCursorPositionException;
import se.alipsa.fqe.helper.WireCoercions;
import se.alipsa.fqe.model.ResultSetAdapter;
import se.alipsa.fqe.wire.ExecutionStats;
import se.alipsa.fqe.wire.WireResult;
import se.alipsa.fqe.wire.WireValue;

/**
 * A scrollable, read-only cursor over a fully materialized {@link WireResult}.
 *
 * <p>
 * The position ranges over {@code 0..N+1}: 0 is before the first row, {@code 1..N} are rows and {@code N+1} is after
 * the last row. The rows are an in-memory snapshot, so the cursor stays readable after the connection that produced it
 * has been closed.
 * </p>
 */
@SuppressWarnings({"checkstyle:AbbreviationAsWordInName", "checkstyle:OverloadMethodsDeclarationOrder"})
public class FqeResultSet extends ResultSetAdapter {

  private final Statement statement;
  private final WireResult result;
  private final List<List<WireValue>> rows;
  private final Map<String, Integer> columnIndex;
  private int position = 0;
  private boolean lastWasNull = false;
  private boolean closed = false;
  private int fetchDirection = ResultSet.FETCH_FORWARD;
  private int fetchSize = 0;

  /**
   * Create a cursor positioned before the first row.
   *
   * @param statement
   *          the statement that produced the result ({@code null} for metadata results)
   * @param result
   *          the decoded result
   */
  public FqeResultSet(Statement statement, WireResult result) {
    this.statement = statement;
    this.result = result == null ? WireResult.EMPTY : result;
    this.rows = this.result.rows();
    this.columnIndex = ColumnNameLookup.buildCaseInsensitiveIndex(this.result.columns());
  }

  // --- navigation ---

  @Override
  public boolean next() throws SQLException {
    checkOpen();
    if (position < rows.size()) {
      position++;
      return true;
    }
    position = rows.size() + 1;
    return false;
  }

  @Override
  public boolean previous() throws SQLException {
    checkOpen();
    position = position > 1 ? position - 1 : 0;
    return onRow();
  }

  @Override
  public boolean absolute(int row) throws SQLException {
    checkOpen();
    int n = rows.size();
    if (row == 0) {
      position = 0;
    } else if (row > 0) {
      position = Math.min(row, n + 1);
    } else {
      position = Math.max(n + row + 1, 0);
    }
    return onRow();
  }

  /**
   * Move {@code rows} rows from the current position, i.e. {@code absolute(getRow() + rows)}. A target of zero lands
   * before the first row; a negative target counts back from the last row as {@link #absolute(int)} does.
   */
  @Override
  public boolean relative(int rows) throws SQLException {
    checkOpen();
    long target = (long) position + rows;
    return absolute((int) Math.max(Integer.MIN_VALUE, Math.min(target, Integer.MAX_VALUE)));
  }

  @Override
  public boolean first() throws SQLException {
    return absolute(1);
  }

  @Override
  public boolean last() throws SQLException {
    return absolute(-1);
  }

  @Override
  public void beforeFirst() throws SQLException {
    checkOpen();
    position = 0;
  }

  @Override
  public void afterLast() throws SQLException {
    checkOpen();
    position = rows.size() + 1;
  }

  @Override
  public boolean isBeforeFirst() throws SQLException {
    checkOpen();
    return position == 0 && !rows.isEmpty();
  }

  @Override
  public boolean isAfterLast() throws SQLException {
    checkOpen();
    return position > rows.size() && !rows.isEmpty();
  }

  @Override
  public boolean isFirst() throws SQLException {
    checkOpen();
    return position == 1 && !rows.isEmpty();
  }

  @Override
  public boolean isLast() throws SQLException {
    checkOpen();
    return !rows.isEmpty() && position == rows.size();
  }

  @Override
  public int getRow() throws SQLException {
    checkOpen();
    return onRow() ? position : 0;
  }

  private boolean onRow() {
    return position >= 1 && position <= rows.size();
  }

  // --- value access ---

  private WireValue cell(int column) throws SQLException {
    checkOpen();
    if (!onRow()) {
      throw new InvalidCursorPositionException(position, rows.size());
    }
    if (column < 1 || column > result.columnCount()) {
      throw new InvalidColumnIndexException(column, result.columnCount());
    }
    WireValue v = rows.get(position - 1).get(column - 1);
    lastWasNull = v.isNull();
    return v;
  }

  @Override
  public boolean wasNull() throws SQLException {
    checkOpen();
    return lastWasNull;
  }

  @Override
  public int findColumn(String columnLabel) throws SQLException {
    checkOpen();
    Integer idx = columnIndex.get(ColumnNameLookup.normalizeKey(columnLabel));
    if (idx == null) {
      throw new ColumnNotFoundException(columnLabel);
    }
    return idx;
  }

  @Override
  public String getString(int columnIndex) throws SQLException {
    return WireCoercions.toText(cell(columnIndex));
  }

  @Override
  public String getNString(int columnIndex) throws SQLException {
    return getString(columnIndex);
  }
  @Override
  public boolean getBoolean(int columnIndex) throws SQLException {
    return WireCoercions.toBoolean(cell(columnIndex));
  }
  @Override
  public byte getByte(int columnIndex) throws SQLException {
    return WireCoercions.toByte(cell(columnIndex));
  }
  @Override
  public short getShort(int columnIndex) throws SQLException {
    return WireCoercions.toShort(cell(columnIndex));
  }
  @Override
  public int getInt(int columnIndex) throws SQLException {
    return WireCoercions.toInt(cell(columnIndex));
  }
  @Override
  public long getLong(int columnIndex) throws SQLException {
    return WireCoercions.toLong(cell(columnIndex));
  }
  @Override
  public float getFloat(int columnIndex) throws SQLException {
    return WireCoercions.toFloat(cell(columnIndex));
  }
  @Override
  public double getDouble(int columnIndex) throws SQLException {
    return WireCoercions.toDouble(cell(columnIndex));
  }
  @Override
  public BigDecimal getBigDecimal(int columnIndex) throws SQLException {
    return WireCoercions.toBigDecimal(cell(columnIndex));
  }

  @Override
  @Deprecated
  public BigDecimal getBigDecimal(int columnIndex, int scale) throws SQLException {
    BigDecimal v = getBigDecimal(columnIndex);
    return v == null ? null : v.setScale(scale, RoundingMode.HALF_UP);
  }

  @Override
  public byte[] getBytes(int columnIndex) throws SQLException {
    return WireCoercions.toBytes(cell(columnIndex));
  }
  @Override
  public Date getDate(int columnIndex) throws SQLException {
    return WireCoercions.toDate(cell(columnIndex));
  }
  @Override
  public Date getDate(int columnIndex, Calendar cal) throws SQLException {
    return getDate(columnIndex);
  }
  @Override
  public Time getTime(int columnIndex) throws SQLException {
    return WireCoercions.toTime(cell(columnIndex));
  }
  @Override
  public Time getTime(int columnIndex, Calendar cal) throws SQLException {
    return getTime(columnIndex);
  }
  @Override
  public Timestamp getTimestamp(int columnIndex) throws SQLException {
    return WireCoercions.toTimestamp(cell(columnIndex));
  }
  @Override
  public Timestamp getTimestamp(int columnIndex, Calendar cal) throws SQLException {
    return getTimestamp(columnIndex);
  }

  @Override
  public Object getObject(int columnIndex) throws SQLException {
    WireValue v = cell(columnIndex);
    return WireCoercions.toObject(v, result.columns().get(columnIndex - 1).type());
  }

  @Override
  public <T> T getObject(int columnIndex, Class<T> type) throws SQLException {
    if (type == null) {
      throw new SQLException("Target type must not be null");
    }
    WireValue v = cell(columnIndex);
    if (v.isNull()) {
      return null;
    }
    Object converted;
    if (type == String.class) {
      converted = WireCoercions.toText(v);
    } else if (type == Boolean.class) {
      converted = WireCoercions.toBoolean(v);
    } else if (type == Byte.class) {
      converted = WireCoercions.toByte(v);
    } else if (type == Short.class) {
      converted = WireCoercions.toShort(v);
    } else if (type == Integer.class) {
      converted = WireCoercions.toInt(v);
    } else if (type == Long.class) {
      converted = WireCoercions.toLong(v);
    } else if (type == Float.class) {
      converted = WireCoercions.toFloat(v);
    } else if (type == Double.class) {
      converted = WireCoercions.toDouble(v);
    } else if (type == BigDecimal.class) {
      converted = WireCoercions.toBigDecimal(v);
    } else if (type == BigInteger.class) {
      converted = WireCoercions.toBigDecimal(v).toBigInteger();
    } else if (type == byte[].class) {
      converted = WireCoercions.toBytes(v);
    } else if (type == Date.class) {
      converted = WireCoercions.toDate(v);
    } else if (type == Time.class) {
      converted = WireCoercions.toTime(v);
    } else if (type == Timestamp.class) {
      converted = WireCoercions.toTimestamp(v);
    } else if (type == LocalDate.class) {
      Date d = WireCoercions.toDate(v);
      converted = d == null ? null : d.toLocalDate();
    } else if (type == LocalTime.class) {
      Time t = WireCoercions.toTime(v);
      converted = t == null ? null : t.toLocalTime();
    } else if (type == LocalDateTime.class) {
      Timestamp ts = WireCoercions.toTimestamp(v);
      converted = ts == null ? null : ts.toLocalDateTime();
    } else if (type == OffsetDateTime.class) {
      Timestamp ts = WireCoercions.toTimestamp(v);
      converted = ts == null ? null : ts.toInstant().atZone(ZoneId.systemDefault()).toOffsetDateTime();
    } else {
      converted = getObject(columnIndex);
      if (!type.isInstance(converted)) {
        throw new SQLException("Cannot convert column " + columnIndex + " to " + type.getName());
      }
    }
    return type.cast(converted);
  }

  @Override
  public String getString(String columnLabel) throws SQLException {
    return getString(findColumn(columnLabel));
  }
  @Override
  public String getNString(String columnLabel) throws SQLException {
    return getString(findColumn(columnLabel));
  }
  @Override
  public boolean getBoolean(String columnLabel) throws SQLException {
    return getBoolean(findColumn(columnLabel));
  }
  @Override
  public byte getByte(String columnLabel) throws SQLException {
    return getByte(findColumn(columnLabel));
  }
  @Override
  public short getShort(String columnLabel) throws SQLException {
    return getShort(findColumn(columnLabel));
  }
  @Override
  public int getInt(String columnLabel) throws SQLException {
    return getInt(findColumn(columnLabel));
  }
  @Override
  public long getLong(String columnLabel) throws SQLException {
    return getLong(findColumn(columnLabel));
  }
  @Override
  public float getFloat(String columnLabel) throws SQLException {
    return getFloat(findColumn(columnLabel));
  }
  @Override
  public double getDouble(String columnLabel) throws SQLException {
    return getDouble(findColumn(columnLabel));
  }
  @Override
  public BigDecimal getBigDecimal(String columnLabel) throws SQLException {
    return getBigDecimal(findColumn(columnLabel));
  }
  @Override
  @Deprecated
  public BigDecimal getBigDecimal(String columnLabel, int scale) throws SQLException {
    return getBigDecimal(findColumn(columnLabel), scale);
  }
  @Override
  public byte[] getBytes(String columnLabel) throws SQLException {
    return getBytes(findColumn(columnLabel));
  }
  @Override
  public Date getDate(String columnLabel) throws SQLException {
    return getDate(findColumn(columnLabel));
  }
  @Override
  public Date getDate(String columnLabel, Calendar cal) throws SQLException {
    return getDate(findColumn(columnLabel));
  }
  @Override
  public Time getTime(String columnLabel) throws SQLException {
    return getTime(findColumn(columnLabel));
  }
  @Override
  public Time getTime(String columnLabel, Calendar cal) throws SQLException {
    return getTime(findColumn(columnLabel));
  }
  @Override
  public Timestamp getTimestamp(String columnLabel) throws SQLException {
    return getTimestamp(findColumn(columnLabel));
  }
  @Override
  public Timestamp getTimestamp(String columnLabel, Calendar cal) throws SQLException {
    return getTimestamp(findColumn(columnLabel));
  }
  @Override
  public Object getObject(String columnLabel) throws SQLException {
    return getObject(findColumn(columnLabel));
  }
  @Override
  public <T> T getObject(String columnLabel, Class<T> type) throws SQLException {
    return getObject(findColumn(columnLabel), type);
  }

  // --- cursor properties ---

  @Override
  public ResultSetMetaData getMetaData() throws SQLException {
    checkOpen();
    return new FqeResultSetMetaData(result.columns());
  }

  @Override
  public Statement getStatement() throws SQLException {
    checkOpen();
    return statement;
  }

  /**
   * Execution statistics reported by the engine for the query behind this cursor.
   *
   * @return the statistics, zeros when the engine reported none
   */
  public ExecutionStats getStatistics() {
    return result.stats();
  }

  @Override
  public int getType() throws SQLException {
    checkOpen();
    return ResultSet.TYPE_SCROLL_INSENSITIVE;
  }

  @Override
  public int getConcurrency() throws SQLException {
    checkOpen();
    return ResultSet.CONCUR_READ_ONLY;
  }

  @Override
  public int getHoldability() throws SQLException {
    checkOpen();
    return ResultSet.HOLD_CURSORS_OVER_COMMIT;
  }

  @Override
  public void setFetchDirection(int direction) throws SQLException {
    checkOpen();
    if (direction != ResultSet.FETCH_FORWARD && direction != ResultSet.FETCH_REVERSE
        && direction != ResultSet.FETCH_UNKNOWN) {
      throw new SQLException("Invalid fetch direction: " + direction);
    }
    fetchDirection = direction;
  }

  @Override
  public int getFetchDirection() throws SQLException {
    checkOpen();
    return fetchDirection;
  }

  @Override
  public void setFetchSize(int rows) throws SQLException {
    checkOpen();
    if (rows < 0) {
      throw new SQLException("Fetch size must be >= 0: " + rows);
    }
    fetchSize = rows;
  }

  @Override
  public int getFetchSize() throws SQLException {
    checkOpen();
    return fetchSize;
  }

  @Override
  public SQLWarning getWarnings() throws SQLException {
    checkOpen();
    return null;
  }

  @Override
  public void clearWarnings() throws SQLException {
    checkOpen();
  }

  @Override
  public void close() throws SQLException {
    if (closed) {
      return;
    }
    closed = true;
    if (statement instanceof FqeStatement fqeStatement) {
      fqeStatement.resultSetClosed(this);
    }
  }

  @Override
  public boolean isClosed() {
    return closed;
  }

  private void checkOpen() throws CursorClosedException {
    if (closed) {
      throw new CursorClosedException();
    }
  }

  @Override
  public <T> T unwrap(Class<T> iface) throws SQLException {
    if (iface != null && iface.isInstance(this)) {
      return iface.cast(this);
    }
    throw new SQLException("Not a wrapper for " + iface);
  }

  @Override
  public boolean isWrapperFor(Class<?> iface) {
    return iface != null && iface.isInstance(this);
  }
}
