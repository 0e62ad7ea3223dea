package se.alipsa.fqe;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

import java.io.ByteArrayInputStream;
import java.math.BigDecimal;
import java.sql.Date;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.SQLFeatureNotSupportedException;
import java.sql.Types;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import se.alipsa.fqe.http.FqeHttpClient;
import se.alipsa.fqe.url.ConnectionDescriptor;
import se.alipsa.fqe.wire.ColumnMeta;
import se.alipsa.fqe.wire.WireResult;

/** Tests parameter substitution and execution of {@link FqePreparedStatement}. */
public class FqePreparedStatementTest {

  private static final String URL = "jdbc:duckdb-fqe://localhost:8080";

  private FqeHttpClient transport;
  private FqeConnection connection;

  @BeforeEach
  void setUp() throws SQLException {
    transport = mock(FqeHttpClient.class);
    when(transport.getDescriptor()).thenReturn(ConnectionDescriptor.parse(URL));
    when(transport.getBaseUrl()).thenReturn("http://localhost:8080/");
    when(transport.executeQuery(anyString(), anyInt()))
        .thenReturn(WireResult.of(List.of(new ColumnMeta("name", "VARCHAR")), List.of(List.of("O'Brien"))));
    connection = new FqeConnection(URL, transport);
  }

  @Test
  void substitutesParametersBeforeDispatch() throws SQLException {
    PreparedStatement ps = connection.prepareStatement(
        "SELECT name FROM people WHERE name = ? AND age > ? AND born < ? AND score = ?");
    ps.setString(1, "O'Brien");
    ps.setInt(2, 30);
    ps.setDate(3, Date.valueOf("2000-01-01"));
    ps.setBigDecimal(4, new BigDecimal("1.50"));
    ResultSet rs = ps.executeQuery();
    assertTrue(rs.next());
    assertEquals("O'Brien", rs.getString(1));
    verify(transport).executeQuery(
        "SELECT name FROM people WHERE name = 'O''Brien' AND age > 30 AND born < '2000-01-01' AND score = 1.50", 0);
  }

  @Test
  void nullsAndBooleans() throws SQLException {
    FqePreparedStatement ps = (FqePreparedStatement) connection.prepareStatement("INSERT INTO t VALUES (?, ?, ?)");
    ps.setNull(1, Types.VARCHAR);
    ps.setBoolean(2, true);
    ps.setObject(3, null);
    assertEquals("INSERT INTO t VALUES (NULL, true, NULL)", ps.buildFinalSql());
    assertEquals(0, ps.executeUpdate());
    verify(transport).executeUpdate("INSERT INTO t VALUES (NULL, true, NULL)", 0);
  }

  @Test
  void unboundPlaceholdersAreLeftInPlace() throws SQLException {
    FqePreparedStatement ps = (FqePreparedStatement) connection.prepareStatement("SELECT ?, ?, ?");
    ps.setInt(1, 1);
    ps.setInt(3, 3);
    assertEquals("SELECT 1, ?, ?", ps.buildFinalSql());
  }

  @Test
  void clearParameters() throws SQLException {
    FqePreparedStatement ps = (FqePreparedStatement) connection.prepareStatement("SELECT ?");
    ps.setLong(1, 5L);
    assertEquals("SELECT 5", ps.buildFinalSql());
    ps.clearParameters();
    assertEquals("SELECT ?", ps.buildFinalSql());
  }

  @Test
  void bytesAreCopiedAtBindTime() throws SQLException {
    FqePreparedStatement ps = (FqePreparedStatement) connection.prepareStatement("SELECT ?");
    byte[] data = {0x0F};
    ps.setBytes(1, data);
    data[0] = 0x10;
    assertEquals("SELECT '\\x0F'::BLOB", ps.buildFinalSql());
  }

  @Test
  void executeRoutesSubstitutedText() throws SQLException {
    PreparedStatement ps = connection.prepareStatement("SELECT * FROM t WHERE id = ?");
    ps.setInt(1, 9);
    assertTrue(ps.execute());
    ArgumentCaptor<String> sql = ArgumentCaptor.forClass(String.class);
    verify(transport).executeQuery(sql.capture(), eq(0));
    assertEquals("SELECT * FROM t WHERE id = 9", sql.getValue());

    PreparedStatement ddl = connection.prepareStatement("CREATE TABLE t (id INTEGER)");
    assertFalse(ddl.execute());
  }

  @Test
  void invalidIndexAndUnsupportedParameters() throws SQLException {
    PreparedStatement ps = connection.prepareStatement("SELECT ?");
    assertThrows(SQLException.class, () -> ps.setInt(0, 1));
    SQLException outOfRange = assertThrows(SQLException.class, () -> ps.setInt(2, 1));
    assertEquals("07009", outOfRange.getSQLState());
    PreparedStatement quoted = connection.prepareStatement("SELECT '?' -- ?\n, ?");
    quoted.setInt(1, 7);
    assertThrows(SQLException.class, () -> quoted.setInt(2, 8));
    assertThrows(SQLFeatureNotSupportedException.class,
        () -> ps.setBinaryStream(1, new ByteArrayInputStream(new byte[0])));
    assertThrows(SQLFeatureNotSupportedException.class,
        () -> ps.setObject(1, new ByteArrayInputStream(new byte[0])));
    assertThrows(SQLFeatureNotSupportedException.class, () -> ps.setBlob(1, (java.sql.Blob) null));
    assertThrows(SQLFeatureNotSupportedException.class, ps::addBatch);
    assertThrows(SQLFeatureNotSupportedException.class, ps::getParameterMetaData);
    assertNull(ps.getMetaData());
  }

  @Test
  void sqlTakingFormsAreRejected() throws SQLException {
    PreparedStatement ps = connection.prepareStatement("SELECT 1");
    assertThrows(SQLException.class, () -> ps.executeQuery("SELECT 2"));
    assertThrows(SQLException.class, () -> ps.executeUpdate("DROP TABLE t"));
    assertThrows(SQLException.class, () -> ps.execute("SELECT 2"));
    verify(transport, never()).executeQuery(anyString(), anyInt());
    verify(transport, never()).executeUpdate(anyString(), anyInt());
  }

  @Test
  void closedStatementRejectsBinding() throws SQLException {
    PreparedStatement ps = connection.prepareStatement("SELECT ?");
    ps.close();
    assertThrows(SQLException.class, () -> ps.setInt(1, 1));
    assertThrows(SQLException.class, ps::executeQuery);
  }
}
