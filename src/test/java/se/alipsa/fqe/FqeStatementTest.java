package se.alipsa.fqe;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.SQLFeatureNotSupportedException;
import java.sql.Statement;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import se.alipsa.fqe.error.ConnectionClosedException;
import se.alipsa.fqe.error.RemoteExecutionException;
import se.alipsa.fqe.error.StatementClosedException;
import se.alipsa.fqe.http.FqeHttpClient;
import se.alipsa.fqe.url.ConnectionDescriptor;
import se.alipsa.fqe.wire.ColumnMeta;
import se.alipsa.fqe.wire.WireResult;

/** Tests statement dispatch and lifecycle of {@link FqeStatement}. */
public class FqeStatementTest {

  private static final String URL = "jdbc:duckdb-fqe://localhost:8080";

  private FqeHttpClient transport;
  private FqeConnection connection;
  private FqeStatement statement;

  private static WireResult numbers(int n) {
    List<List<Object>> rows = new java.util.ArrayList<>();
    for (int i = 1; i <= n; i++) {
      rows.add(List.of(i));
    }
    return WireResult.of(List.of(new ColumnMeta("n", "INTEGER")), rows);
  }

  @BeforeEach
  void setUp() throws SQLException {
    transport = mock(FqeHttpClient.class);
    when(transport.getDescriptor()).thenReturn(ConnectionDescriptor.parse(URL));
    when(transport.getBaseUrl()).thenReturn("http://localhost:8080/");
    when(transport.executeQuery(anyString(), anyInt())).thenReturn(numbers(3));
    connection = new FqeConnection(URL, transport);
    statement = (FqeStatement) connection.createStatement();
  }

  @Test
  void classifiesQueries() {
    assertTrue(FqeStatement.isQuery("SELECT 1"));
    assertTrue(FqeStatement.isQuery("  select 1"));
    assertTrue(FqeStatement.isQuery("show tables"));
    assertTrue(FqeStatement.isQuery("Describe t"));
    assertTrue(FqeStatement.isQuery("EXPLAIN SELECT 1"));
    assertFalse(FqeStatement.isQuery("CREATE TABLE t (id INTEGER)"));
    assertFalse(FqeStatement.isQuery("WITH x AS (SELECT 1) SELECT * FROM x"));
    assertFalse(FqeStatement.isQuery(null));
  }

  @Test
  void executeQueryMaterializesResult() throws SQLException {
    ResultSet rs = statement.executeQuery("SELECT n FROM t");
    assertSame(rs, statement.getResultSet());
    assertEquals(-1, statement.getUpdateCount());
    assertSame(statement, rs.getStatement());
    assertTrue(rs.last());
    assertEquals(3, rs.getInt("n"));
    verify(transport).executeQuery("SELECT n FROM t", 0);
  }

  @Test
  void executeRoutesByKeyword() throws SQLException {
    assertTrue(statement.execute("select n from t"));
    assertNotNull(statement.getResultSet());
    assertFalse(statement.execute("CREATE TABLE t (id INTEGER)"));
    assertNull(statement.getResultSet());
    assertEquals(0, statement.getUpdateCount());
    verify(transport).executeUpdate("CREATE TABLE t (id INTEGER)", 0);
  }

  @Test
  void executeUpdateReturnsZero() throws SQLException {
    assertEquals(0, statement.executeUpdate("INSERT INTO t VALUES (1), (2)"));
    assertEquals(0L, statement.executeLargeUpdate("DELETE FROM t"));
  }

  @Test
  void newExecutionClosesPreviousResult() throws SQLException {
    ResultSet first = statement.executeQuery("SELECT 1");
    ResultSet second = statement.executeQuery("SELECT 2");
    assertTrue(first.isClosed());
    assertFalse(second.isClosed());
  }

  @Test
  void failedExecutionKeepsPreviousResult() throws SQLException {
    ResultSet rs = statement.executeQuery("SELECT 1");
    when(transport.executeQuery(eq("SELEC 2"), anyInt())).thenThrow(new RemoteExecutionException(400, "syntax"));
    assertThrows(RemoteExecutionException.class, () -> statement.executeQuery("SELEC 2"));
    assertFalse(rs.isClosed());
    assertSame(rs, statement.getResultSet());
  }

  @Test
  void maxRowsAndQueryTimeout() throws SQLException {
    statement.setMaxRows(2);
    statement.setQueryTimeout(7);
    ResultSet rs = statement.executeQuery("SELECT n FROM t");
    assertTrue(rs.last());
    assertEquals(2, rs.getRow());
    verify(transport).executeQuery("SELECT n FROM t", 7);
    assertThrows(SQLException.class, () -> statement.setMaxRows(-1));
    assertThrows(SQLException.class, () -> statement.setQueryTimeout(-1));
    assertThrows(SQLException.class, () -> statement.setFetchSize(-1));
  }

  @Test
  void getMoreResultsClosesCurrent() throws SQLException {
    ResultSet rs = statement.executeQuery("SELECT 1");
    assertFalse(statement.getMoreResults());
    assertTrue(rs.isClosed());
    assertNull(statement.getResultSet());
    assertEquals(-1, statement.getUpdateCount());

    ResultSet kept = statement.executeQuery("SELECT 1");
    assertFalse(statement.getMoreResults(Statement.KEEP_CURRENT_RESULT));
    assertFalse(kept.isClosed());
  }

  @Test
  void closeOnCompletion() throws SQLException {
    statement.closeOnCompletion();
    assertTrue(statement.isCloseOnCompletion());
    ResultSet rs = statement.executeQuery("SELECT 1");
    rs.close();
    assertTrue(statement.isClosed());
  }

  @Test
  void closedStatementFails() throws SQLException {
    ResultSet rs = statement.executeQuery("SELECT 1");
    statement.close();
    statement.close();
    assertTrue(rs.isClosed());
    assertThrows(StatementClosedException.class, () -> statement.executeQuery("SELECT 1"));
    assertThrows(StatementClosedException.class, () -> statement.getResultSet());
  }

  @Test
  void closedConnectionFails() throws SQLException {
    connection.close();
    ConnectionClosedException e = assertThrows(ConnectionClosedException.class,
        () -> statement.executeQuery("SELECT 1"));
    assertEquals("08003", e.getSQLState());
    assertThrows(ConnectionClosedException.class, () -> statement.executeUpdate("DROP TABLE t"));
  }

  @Test
  void blankSqlIsRejected() {
    assertThrows(SQLException.class, () -> statement.executeQuery(" "));
    assertThrows(SQLException.class, () -> statement.execute(null));
  }

  @Test
  void unsupportedOperations() {
    assertThrows(SQLFeatureNotSupportedException.class, () -> statement.addBatch("INSERT INTO t VALUES (1)"));
    assertThrows(SQLFeatureNotSupportedException.class, statement::executeBatch);
    assertThrows(SQLFeatureNotSupportedException.class, statement::getGeneratedKeys);
    assertThrows(SQLFeatureNotSupportedException.class, statement::cancel);
    assertThrows(SQLFeatureNotSupportedException.class, () -> statement.setCursorName("c"));
  }
}
