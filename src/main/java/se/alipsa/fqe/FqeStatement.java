package se.alipsa.fqe;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.SQLFeatureNotSupportedException;
import java.sql.SQLWarning;
import java.sql.Statement;
import java.util.List;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import se.alipsa.fqe.error.StatementClosedException;
import se.alipsa.fqe.wire.WireResult;

/**
 * An implementation of the java.sql.Statement interface. Every execution is one HTTP exchange whose complete result
 * is materialized into a {@link FqeResultSet}.
 */
@SuppressWarnings({"checkstyle:AbbreviationAsWordInName", "checkstyle:OverloadMethodsDeclarationOrder"})
public class FqeStatement implements Statement {

  private static final Logger log = LoggerFactory.getLogger(FqeStatement.class);

  /** Leading keywords of statements that produce a result set. */
  static final List<String> QUERY_KEYWORDS = List.of("SELECT", "SHOW", "DESCRIBE", "EXPLAIN");

  private final FqeConnection connection;
  private final int resultSetType;
  private FqeResultSet currentResultSet;
  private int updateCount = -1;
  private boolean closed = false;
  private boolean closeOnCompletion = false;
  private int maxRows = 0;
  private int queryTimeout = 0;
  private int fetchSize = 0;
  private int fetchDirection = ResultSet.FETCH_FORWARD;
  private int maxFieldSize = 0;
  private boolean poolable = false;

  /**
   * Create a statement producing scroll-insensitive result sets.
   *
   * @param connection
   *          the owning connection
   */
  public FqeStatement(FqeConnection connection) {
    this(connection, ResultSet.TYPE_SCROLL_INSENSITIVE);
  }

  FqeStatement(FqeConnection connection, int resultSetType) {
    this.connection = connection;
    this.resultSetType = resultSetType;
  }

  /**
   * Whether the statement text produces a result set, judged by its leading keyword.
   *
   * @param sql
   *          the statement text
   * @return {@code true} for SELECT, SHOW, DESCRIBE and EXPLAIN statements
   */
  public static boolean isQuery(String sql) {
    if (sql == null) {
      return false;
    }
    String head = sql.trim().toUpperCase(Locale.ROOT);
    for (String keyword : QUERY_KEYWORDS) {
      if (head.startsWith(keyword)) {
        return true;
      }
    }
    return false;
  }

  @Override
  public ResultSet executeQuery(String sql) throws SQLException {
    return runQuery(sql);
  }

  @Override
  public int executeUpdate(String sql) throws SQLException {
    return runUpdate(sql);
  }

  @Override
  public boolean execute(String sql) throws SQLException {
    return runExecute(sql);
  }

  /**
   * Send a query and materialize its result as the current result set.
   *
   * @param sql
   *          the final SQL text
   * @return the new current result set
   * @throws SQLException
   *           if the statement or connection is closed, or the exchange fails
   */
  protected FqeResultSet runQuery(String sql) throws SQLException {
    checkExecutable(sql);
    WireResult result = connection.transport().executeQuery(sql, queryTimeout).limit(maxRows);
    FqeResultSet rs = new FqeResultSet(this, result);
    replaceCurrent(rs, -1);
    log.debug("Query returned {} rows", result.rows().size());
    return rs;
  }

  /**
   * Send a statement without a result. The update count is always 0.
   *
   * @param sql
   *          the final SQL text
   * @return 0
   * @throws SQLException
   *           if the statement or connection is closed, or the exchange fails
   */
  protected int runUpdate(String sql) throws SQLException {
    checkExecutable(sql);
    int count = connection.transport().executeUpdate(sql, queryTimeout);
    replaceCurrent(null, count);
    return count;
  }

  /**
   * Route the statement to {@link #runQuery(String)} or {@link #runUpdate(String)}.
   *
   * @param sql
   *          the final SQL text
   * @return {@code true} if a result set was produced
   * @throws SQLException
   *           if execution fails
   */
  protected boolean runExecute(String sql) throws SQLException {
    if (isQuery(sql)) {
      runQuery(sql);
      return true;
    }
    runUpdate(sql);
    return false;
  }

  private void checkExecutable(String sql) throws SQLException {
    checkOpen();
    connection.checkOpen();
    if (sql == null || sql.isBlank()) {
      throw new SQLException("SQL must not be empty");
    }
  }

  private void replaceCurrent(FqeResultSet rs, int count) throws SQLException {
    FqeResultSet previous = currentResultSet;
    currentResultSet = rs;
    updateCount = count;
    if (previous != null) {
      previous.close();
    }
  }

  /**
   * Called by a result set of this statement when it is closed.
   *
   * @param rs
   *          the closed result set
   * @throws SQLException
   *           if closing the statement fails
   */
  void resultSetClosed(FqeResultSet rs) throws SQLException {
    if (rs == currentResultSet && closeOnCompletion && !closed) {
      close();
    }
  }

  void checkOpen() throws StatementClosedException {
    if (closed) {
      throw new StatementClosedException();
    }
  }

  FqeConnection fqeConnection() {
    return connection;
  }

  @Override
  public void close() throws SQLException {
    if (closed) {
      return;
    }
    closed = true;
    FqeResultSet rs = currentResultSet;
    currentResultSet = null;
    if (rs != null) {
      rs.close();
    }
  }

  @Override
  public boolean isClosed() {
    return closed;
  }

  @Override
  public ResultSet getResultSet() throws SQLException {
    checkOpen();
    return currentResultSet;
  }

  @Override
  public int getUpdateCount() throws SQLException {
    checkOpen();
    return updateCount;
  }

  @Override
  public long getLargeUpdateCount() throws SQLException {
    return getUpdateCount();
  }

  @Override
  public boolean getMoreResults() throws SQLException {
    return getMoreResults(Statement.CLOSE_CURRENT_RESULT);
  }

  @Override
  public boolean getMoreResults(int current) throws SQLException {
    checkOpen();
    FqeResultSet rs = currentResultSet;
    currentResultSet = null;
    updateCount = -1;
    if (rs != null && current != Statement.KEEP_CURRENT_RESULT) {
      rs.close();
    }
    return false;
  }

  @Override
  public Connection getConnection() throws SQLException {
    checkOpen();
    return connection;
  }

  @Override
  public int getMaxRows() throws SQLException {
    checkOpen();
    return maxRows;
  }

  @Override
  public void setMaxRows(int max) throws SQLException {
    checkOpen();
    if (max < 0) {
      throw new SQLException("Max rows must be >= 0: " + max);
    }
    maxRows = max;
  }

  @Override
  public long getLargeMaxRows() throws SQLException {
    return getMaxRows();
  }

  @Override
  public void setLargeMaxRows(long max) throws SQLException {
    setMaxRows((int) Math.min(max, Integer.MAX_VALUE));
  }

  @Override
  public int getQueryTimeout() throws SQLException {
    checkOpen();
    return queryTimeout;
  }

  @Override
  public void setQueryTimeout(int seconds) throws SQLException {
    checkOpen();
    if (seconds < 0) {
      throw new SQLException("Query timeout must be >= 0: " + seconds);
    }
    queryTimeout = seconds;
  }

  @Override
  public int getFetchSize() throws SQLException {
    checkOpen();
    return fetchSize;
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
  public int getFetchDirection() throws SQLException {
    checkOpen();
    return fetchDirection;
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
  public int getMaxFieldSize() throws SQLException {
    checkOpen();
    return maxFieldSize;
  }

  @Override
  public void setMaxFieldSize(int max) throws SQLException {
    checkOpen();
    if (max < 0) {
      throw new SQLException("Max field size must be >= 0: " + max);
    }
    maxFieldSize = max;
  }

  @Override
  public int getResultSetConcurrency() throws SQLException {
    checkOpen();
    return ResultSet.CONCUR_READ_ONLY;
  }

  @Override
  public int getResultSetType() throws SQLException {
    checkOpen();
    return resultSetType;
  }

  @Override
  public int getResultSetHoldability() throws SQLException {
    checkOpen();
    return ResultSet.HOLD_CURSORS_OVER_COMMIT;
  }

  @Override
  public void closeOnCompletion() throws SQLException {
    checkOpen();
    closeOnCompletion = true;
  }

  @Override
  public boolean isCloseOnCompletion() throws SQLException {
    checkOpen();
    return closeOnCompletion;
  }

  @Override
  public void setPoolable(boolean poolable) throws SQLException {
    checkOpen();
    this.poolable = poolable;
  }

  @Override
  public boolean isPoolable() throws SQLException {
    checkOpen();
    return poolable;
  }

  @Override
  public void setEscapeProcessing(boolean enable) throws SQLException {
    checkOpen();
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
  public void cancel() throws SQLException {
    throw new SQLFeatureNotSupportedException("A dispatched request cannot be cancelled");
  }

  @Override
  public void setCursorName(String name) throws SQLException {
    throw new SQLFeatureNotSupportedException("Named cursors are not supported");
  }

  @Override
  public void addBatch(String sql) throws SQLException {
    throw new SQLFeatureNotSupportedException("Batch execution is not supported");
  }

  @Override
  public void clearBatch() throws SQLException {
    throw new SQLFeatureNotSupportedException("Batch execution is not supported");
  }

  @Override
  public int[] executeBatch() throws SQLException {
    throw new SQLFeatureNotSupportedException("Batch execution is not supported");
  }

  @Override
  public ResultSet getGeneratedKeys() throws SQLException {
    throw new SQLFeatureNotSupportedException("Generated keys are not supported");
  }

  @Override
  public long executeLargeUpdate(String sql) throws SQLException {
    return executeUpdate(sql);
  }
  @Override
  public int executeUpdate(String sql, int autoGeneratedKeys) throws SQLException {
    return executeUpdate(sql);
  }
  @Override
  public int executeUpdate(String sql, int[] columnIndexes) throws SQLException {
    return executeUpdate(sql);
  }
  @Override
  public int executeUpdate(String sql, String[] columnNames) throws SQLException {
    return executeUpdate(sql);
  }
  @Override
  public boolean execute(String sql, int autoGeneratedKeys) throws SQLException {
    return execute(sql);
  }
  @Override
  public boolean execute(String sql, int[] columnIndexes) throws SQLException {
    return execute(sql);
  }
  @Override
  public boolean execute(String sql, String[] columnNames) throws SQLException {
    return execute(sql);
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
