package se.alipsa.fqe;

import java.io.InputStream;
import java.io.Reader;
import java.math.BigDecimal;
import java.net.URL;
import java.sql.Array;
import java.sql.Blob;
import java.sql.Clob;
import java.sql.Date;
import java.sql.NClob;
import java.sql.ParameterMetaData;
import java.sql.PreparedStatement;
import java.sql.Ref;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.RowId;
import java.sql.SQLException;
import java.sql.SQLFeatureNotSupportedException;
import java.sql.SQLXML;
import java.sql.Time;
import java.sql.Timestamp;
import java.util.Calendar;
import java.util.LinkedHashMap;
import java.util.Map;
import se.alipsa.fqe.helper.ParameterBinder;

/**
 * An implementation of the java.sql.PreparedStatement interface.
 *
 * <p>
 * The server has no notion of prepared statements, so this is a {@link FqeStatement} with one extra step: before
 * dispatch the bound parameters are rendered as SQL literals into the statement text (see {@link ParameterBinder}).
 * </p>
 */
@SuppressWarnings({"checkstyle:AbbreviationAsWordInName", "checkstyle:OverloadMethodsDeclarationOrder"})
public class FqePreparedStatement extends FqeStatement implements PreparedStatement {

  private final String sql;
  private final int parameterCount;
  private final Map<Integer, Object> parameterValues = new LinkedHashMap<>();

  /**
   * Constructor.
   *
   * @param connection
   *          the owning connection
   * @param sql
   *          the statement text with {@code ?} placeholders
   * @param resultSetType
   *          the result set type of produced cursors
   */
  FqePreparedStatement(FqeConnection connection, String sql, int resultSetType) {
    super(connection, resultSetType);
    this.sql = sql;
    this.parameterCount = ParameterBinder.countPlaceholders(sql);
  }

  /**
   * The statement text with the currently bound parameters substituted.
   *
   * @return the SQL that the next execution will send
   * @throws SQLException
   *           if a bound value cannot be rendered
   */
  public String buildFinalSql() throws SQLException {
    return ParameterBinder.bind(sql, parameterValues);
  }

  @Override
  public ResultSet executeQuery() throws SQLException {
    checkOpen();
    return runQuery(buildFinalSql());
  }

  @Override
  public int executeUpdate() throws SQLException {
    checkOpen();
    return runUpdate(buildFinalSql());
  }

  @Override
  public long executeLargeUpdate() throws SQLException {
    return executeUpdate();
  }

  @Override
  public boolean execute() throws SQLException {
    checkOpen();
    return runExecute(buildFinalSql());
  }

  private void storeParameter(int parameterIndex, Object value) throws SQLException {
    checkOpen();
    if (parameterIndex < 1) {
      throw new SQLException("Parameter index must be >= 1: " + parameterIndex);
    }
    if (parameterIndex > parameterCount) {
      throw new SQLException(
          "Parameter index " + parameterIndex + " out of range, statement has " + parameterCount + " placeholders",
          "07009");
    }
    parameterValues.put(parameterIndex, value);
  }

  private static SQLFeatureNotSupportedException streamsUnsupported() {
    return new SQLFeatureNotSupportedException("Stream and LOB parameters are not supported");
  }

  @Override
  public void clearParameters() throws SQLException {
    checkOpen();
    parameterValues.clear();
  }

  // --- Parameter Setters ---
  @Override
  public void setNull(int parameterIndex, int sqlType) throws SQLException {
    storeParameter(parameterIndex, null);
  }
  @Override
  public void setNull(int parameterIndex, int sqlType, String typeName) throws SQLException {
    storeParameter(parameterIndex, null);
  }
  @Override
  public void setBoolean(int parameterIndex, boolean x) throws SQLException {
    storeParameter(parameterIndex, x);
  }
  @Override
  public void setByte(int parameterIndex, byte x) throws SQLException {
    storeParameter(parameterIndex, x);
  }
  @Override
  public void setShort(int parameterIndex, short x) throws SQLException {
    storeParameter(parameterIndex, x);
  }
  @Override
  public void setInt(int parameterIndex, int x) throws SQLException {
    storeParameter(parameterIndex, x);
  }
  @Override
  public void setLong(int parameterIndex, long x) throws SQLException {
    storeParameter(parameterIndex, x);
  }
  @Override
  public void setFloat(int parameterIndex, float x) throws SQLException {
    storeParameter(parameterIndex, x);
  }
  @Override
  public void setDouble(int parameterIndex, double x) throws SQLException {
    storeParameter(parameterIndex, x);
  }
  @Override
  public void setBigDecimal(int parameterIndex, BigDecimal x) throws SQLException {
    storeParameter(parameterIndex, x);
  }
  @Override
  public void setString(int parameterIndex, String x) throws SQLException {
    storeParameter(parameterIndex, x);
  }
  @Override
  public void setNString(int parameterIndex, String value) throws SQLException {
    storeParameter(parameterIndex, value);
  }
  @Override
  public void setBytes(int parameterIndex, byte[] x) throws SQLException {
    storeParameter(parameterIndex, x == null ? null : x.clone());
  }
  @Override
  public void setDate(int parameterIndex, Date x) throws SQLException {
    storeParameter(parameterIndex, x);
  }
  @Override
  public void setDate(int parameterIndex, Date x, Calendar cal) throws SQLException {
    storeParameter(parameterIndex, x);
  }
  @Override
  public void setTime(int parameterIndex, Time x) throws SQLException {
    storeParameter(parameterIndex, x);
  }
  @Override
  public void setTime(int parameterIndex, Time x, Calendar cal) throws SQLException {
    storeParameter(parameterIndex, x);
  }
  @Override
  public void setTimestamp(int parameterIndex, Timestamp x) throws SQLException {
    storeParameter(parameterIndex, x);
  }
  @Override
  public void setTimestamp(int parameterIndex, Timestamp x, Calendar cal) throws SQLException {
    storeParameter(parameterIndex, x);
  }
  @Override
  public void setObject(int parameterIndex, Object x) throws SQLException {
    if (x instanceof InputStream || x instanceof Reader || x instanceof Blob || x instanceof Clob) {
      throw streamsUnsupported();
    }
    storeParameter(parameterIndex, x);
  }
  @Override
  public void setObject(int parameterIndex, Object x, int targetSqlType) throws SQLException {
    setObject(parameterIndex, x);
  }
  @Override
  public void setObject(int parameterIndex, Object x, int targetSqlType, int scaleOrLength) throws SQLException {
    setObject(parameterIndex, x);
  }

  // --- Unsupported parameter kinds ---
  @Override
  public void setAsciiStream(int parameterIndex, InputStream x, int length) throws SQLException {
    throw streamsUnsupported();
  }
  @Override
  @Deprecated
  public void setUnicodeStream(int parameterIndex, InputStream x, int length) throws SQLException {
    throw streamsUnsupported();
  }
  @Override
  public void setBinaryStream(int parameterIndex, InputStream x, int length) throws SQLException {
    throw streamsUnsupported();
  }
  @Override
  public void setCharacterStream(int parameterIndex, Reader reader, int length) throws SQLException {
    throw streamsUnsupported();
  }
  @Override
  public void setAsciiStream(int parameterIndex, InputStream x, long length) throws SQLException {
    throw streamsUnsupported();
  }
  @Override
  public void setBinaryStream(int parameterIndex, InputStream x, long length) throws SQLException {
    throw streamsUnsupported();
  }
  @Override
  public void setCharacterStream(int parameterIndex, Reader reader, long length) throws SQLException {
    throw streamsUnsupported();
  }
  @Override
  public void setAsciiStream(int parameterIndex, InputStream x) throws SQLException {
    throw streamsUnsupported();
  }
  @Override
  public void setBinaryStream(int parameterIndex, InputStream x) throws SQLException {
    throw streamsUnsupported();
  }
  @Override
  public void setCharacterStream(int parameterIndex, Reader reader) throws SQLException {
    throw streamsUnsupported();
  }
  @Override
  public void setNCharacterStream(int parameterIndex, Reader value, long length) throws SQLException {
    throw streamsUnsupported();
  }
  @Override
  public void setNCharacterStream(int parameterIndex, Reader value) throws SQLException {
    throw streamsUnsupported();
  }
  @Override
  public void setRef(int parameterIndex, Ref x) throws SQLException {
    throw streamsUnsupported();
  }
  @Override
  public void setBlob(int parameterIndex, Blob x) throws SQLException {
    throw streamsUnsupported();
  }
  @Override
  public void setBlob(int parameterIndex, InputStream inputStream, long length) throws SQLException {
    throw streamsUnsupported();
  }
  @Override
  public void setBlob(int parameterIndex, InputStream inputStream) throws SQLException {
    throw streamsUnsupported();
  }
  @Override
  public void setClob(int parameterIndex, Clob x) throws SQLException {
    throw streamsUnsupported();
  }
  @Override
  public void setClob(int parameterIndex, Reader reader, long length) throws SQLException {
    throw streamsUnsupported();
  }
  @Override
  public void setClob(int parameterIndex, Reader reader) throws SQLException {
    throw streamsUnsupported();
  }
  @Override
  public void setNClob(int parameterIndex, NClob value) throws SQLException {
    throw streamsUnsupported();
  }
  @Override
  public void setNClob(int parameterIndex, Reader reader, long length) throws SQLException {
    throw streamsUnsupported();
  }
  @Override
  public void setNClob(int parameterIndex, Reader reader) throws SQLException {
    throw streamsUnsupported();
  }
  @Override
  public void setArray(int parameterIndex, Array x) throws SQLException {
    throw streamsUnsupported();
  }
  @Override
  public void setURL(int parameterIndex, URL x) throws SQLException {
    throw new SQLFeatureNotSupportedException("URL parameters are not supported");
  }
  @Override
  public void setRowId(int parameterIndex, RowId x) throws SQLException {
    throw new SQLFeatureNotSupportedException("RowId parameters are not supported");
  }
  @Override
  public void setSQLXML(int parameterIndex, SQLXML xmlObject) throws SQLException {
    throw new SQLFeatureNotSupportedException("SQLXML parameters are not supported");
  }

  @Override
  public void addBatch() throws SQLException {
    throw new SQLFeatureNotSupportedException("Batch execution is not supported");
  }

  /** Not known before execution. */
  @Override
  public ResultSetMetaData getMetaData() throws SQLException {
    checkOpen();
    return null;
  }

  @Override
  public ParameterMetaData getParameterMetaData() throws SQLException {
    throw new SQLFeatureNotSupportedException("Parameter metadata is not supported");
  }

  // --- SQL-taking forms are not allowed on a prepared statement ---
  private static SQLException boundToSql() {
    return new SQLException("A PreparedStatement executes its own SQL; use the no-argument execute methods");
  }

  @Override
  public ResultSet executeQuery(String sql) throws SQLException {
    throw boundToSql();
  }
  @Override
  public int executeUpdate(String sql) throws SQLException {
    throw boundToSql();
  }
  @Override
  public boolean execute(String sql) throws SQLException {
    throw boundToSql();
  }
  @Override
  public void addBatch(String sql) throws SQLException {
    throw boundToSql();
  }
}
