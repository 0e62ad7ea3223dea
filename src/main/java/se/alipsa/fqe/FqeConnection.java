package se.alipsa.fqe;

import java.sql.Array;
import java.sql.Blob;
import java.sql.CallableStatement;
import java.sql.ClientInfoStatus;
import java.sql.Clob;
import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.NClob;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLClientInfoException;
import java.sql.SQLException;
import java.sql.SQLFeatureNotSupportedException;
import java.sql.SQLWarning;
import java.sql.SQLXML;
import java.sql.Savepoint;
import java.sql.Statement;
import java.sql.Struct;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Properties;
import java.util.concurrent.Executor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import se.alipsa.fqe.error.ConnectionClosedException;
import se.alipsa.fqe.error.ConnectionFailedException;
import se.alipsa.fqe.http.FqeHttpClient;
import se.alipsa.fqe.url.ConnectionDescriptor;

/**
 * An implementation of the java.sql.Connection interface for the federated query engine HTTP service.
 *
 * <p>
 * The service is stateless, so a connection is an HTTP client plus session flags that are tracked locally and never
 * sent to the server. A connection is only handed out after a successful liveness probe.
 * </p>
 */
@SuppressWarnings({"checkstyle:AbbreviationAsWordInName", "checkstyle:OverloadMethodsDeclarationOrder"})
public class FqeConnection implements Connection {

  private static final Logger log = LoggerFactory.getLogger(FqeConnection.class);

  private final String url;
  private final ConnectionDescriptor descriptor;
  private final FqeHttpClient transport;
  private volatile boolean closed = false;
  private boolean autoCommit = true;
  private boolean readOnly = false;
  private String catalog;
  private String schema;
  private int transactionIsolation = Connection.TRANSACTION_NONE;
  private int networkTimeout;
  private final Properties clientInfo = new Properties();
  private Map<String, Class<?>> typeMap = new HashMap<>();

  /**
   * Open a connection.
   *
   * @param url
   *          the connection descriptor, e.g. {@code jdbc:duckdb-fqe://localhost:8080/db?user=me&password=secret}
   * @param props
   *          optional properties; they override options given in the descriptor
   * @throws ConnectionFailedException
   *           if the descriptor is invalid or the service does not pass the liveness probe
   */
  public FqeConnection(String url, Properties props) throws SQLException {
    this(url, newTransport(url, props));
  }

  /**
   * Open a connection over an existing transport, probing it first. The transport is closed if the probe fails.
   *
   * @param url
   *          the descriptor the transport was created from
   * @param transport
   *          the HTTP transport this connection will own
   * @throws ConnectionFailedException
   *           if the liveness probe fails
   */
  FqeConnection(String url, FqeHttpClient transport) throws SQLException {
    this.url = Objects.requireNonNull(url, "url");
    this.transport = Objects.requireNonNull(transport, "transport");
    this.descriptor = transport.getDescriptor();
    try {
      transport.probe();
    } catch (SQLException e) {
      transport.close();
      throw new ConnectionFailedException("Failed to connect to " + transport.getBaseUrl() + ": " + e.getMessage(), e);
    }
    this.catalog = descriptor.catalog();
    this.networkTimeout = descriptor.timeoutSeconds() * 1000;
    log.info("Connected to {}", transport.getBaseUrl());
  }

  private static FqeHttpClient newTransport(String url, Properties props) throws SQLException {
    try {
      return new FqeHttpClient(ConnectionDescriptor.parse(url, props));
    } catch (SQLException | IllegalArgumentException e) {
      throw new ConnectionFailedException("Failed to connect to " + url + ": " + e.getMessage(), e);
    }
  }

  FqeHttpClient transport() throws ConnectionClosedException {
    checkOpen();
    return transport;
  }

  void checkOpen() throws ConnectionClosedException {
    if (closed) {
      throw new ConnectionClosedException();
    }
  }

  /**
   * The parsed descriptor, with property overrides applied.
   *
   * @return the descriptor this connection was opened with
   */
  public ConnectionDescriptor getDescriptor() {
    return descriptor;
  }

  String getUrl() {
    return url;
  }

  @Override
  public Statement createStatement() throws SQLException {
    checkOpen();
    return new FqeStatement(this);
  }

  @Override
  public Statement createStatement(int resultSetType, int resultSetConcurrency) throws SQLException {
    checkOpen();
    checkResultSetOptions(resultSetType, resultSetConcurrency);
    return new FqeStatement(this, resultSetType);
  }

  @Override
  public Statement createStatement(int resultSetType, int resultSetConcurrency, int resultSetHoldability)
      throws SQLException {
    checkHoldability(resultSetHoldability);
    return createStatement(resultSetType, resultSetConcurrency);
  }

  @Override
  public PreparedStatement prepareStatement(String sql) throws SQLException {
    checkOpen();
    if (sql == null || sql.isBlank()) {
      throw new SQLException("SQL must not be empty");
    }
    return new FqePreparedStatement(this, sql, ResultSet.TYPE_SCROLL_INSENSITIVE);
  }

  @Override
  public PreparedStatement prepareStatement(String sql, int resultSetType, int resultSetConcurrency)
      throws SQLException {
    checkOpen();
    checkResultSetOptions(resultSetType, resultSetConcurrency);
    if (sql == null || sql.isBlank()) {
      throw new SQLException("SQL must not be empty");
    }
    return new FqePreparedStatement(this, sql, resultSetType);
  }

  @Override
  public PreparedStatement prepareStatement(String sql, int resultSetType, int resultSetConcurrency,
      int resultSetHoldability) throws SQLException {
    checkHoldability(resultSetHoldability);
    return prepareStatement(sql, resultSetType, resultSetConcurrency);
  }

  @Override
  public PreparedStatement prepareStatement(String sql, int autoGeneratedKeys) throws SQLException {
    return prepareStatement(sql);
  }

  @Override
  public PreparedStatement prepareStatement(String sql, int[] columnIndexes) throws SQLException {
    return prepareStatement(sql);
  }

  @Override
  public PreparedStatement prepareStatement(String sql, String[] columnNames) throws SQLException {
    return prepareStatement(sql);
  }

  private static void checkResultSetOptions(int resultSetType, int resultSetConcurrency)
      throws SQLFeatureNotSupportedException {
    if (resultSetType != ResultSet.TYPE_FORWARD_ONLY && resultSetType != ResultSet.TYPE_SCROLL_INSENSITIVE) {
      throw new SQLFeatureNotSupportedException(
          "Only TYPE_FORWARD_ONLY and TYPE_SCROLL_INSENSITIVE result sets are supported.");
    }
    if (resultSetConcurrency != ResultSet.CONCUR_READ_ONLY) {
      throw new SQLFeatureNotSupportedException("Only CONCUR_READ_ONLY result sets are supported.");
    }
  }

  private static void checkHoldability(int holdability) throws SQLFeatureNotSupportedException {
    if (holdability != ResultSet.HOLD_CURSORS_OVER_COMMIT) {
      throw new SQLFeatureNotSupportedException("Only HOLD_CURSORS_OVER_COMMIT holdability is supported.");
    }
  }

  @Override
  public CallableStatement prepareCall(String sql) throws SQLException {
    throw new SQLFeatureNotSupportedException("Stored procedures are not supported");
  }

  @Override
  public CallableStatement prepareCall(String sql, int resultSetType, int resultSetConcurrency) throws SQLException {
    throw new SQLFeatureNotSupportedException("Stored procedures are not supported");
  }

  @Override
  public CallableStatement prepareCall(String sql, int resultSetType, int resultSetConcurrency,
      int resultSetHoldability) throws SQLException {
    throw new SQLFeatureNotSupportedException("Stored procedures are not supported");
  }

  @Override
  public String nativeSQL(String sql) throws SQLException {
    checkOpen();
    return sql;
  }

  // --- session flags, tracked locally ---

  @Override
  public void setAutoCommit(boolean autoCommit) throws SQLException {
    checkOpen();
    this.autoCommit = autoCommit;
    log.debug("autoCommit set to {}", autoCommit);
  }

  @Override
  public boolean getAutoCommit() throws SQLException {
    checkOpen();
    return autoCommit;
  }

  /** Nothing to commit on a stateless service; only the auto-commit contract is enforced. */
  @Override
  public void commit() throws SQLException {
    checkOpen();
    if (autoCommit) {
      throw new SQLException("Cannot commit when auto-commit is enabled");
    }
    log.debug("commit is a no-op");
  }

  @Override
  public void rollback() throws SQLException {
    checkOpen();
    if (autoCommit) {
      throw new SQLException("Cannot rollback when auto-commit is enabled");
    }
    log.debug("rollback is a no-op");
  }

  @Override
  public void rollback(Savepoint savepoint) throws SQLException {
    throw new SQLFeatureNotSupportedException("Savepoints are not supported");
  }

  @Override
  public Savepoint setSavepoint() throws SQLException {
    throw new SQLFeatureNotSupportedException("Savepoints are not supported");
  }

  @Override
  public Savepoint setSavepoint(String name) throws SQLException {
    throw new SQLFeatureNotSupportedException("Savepoints are not supported");
  }

  @Override
  public void releaseSavepoint(Savepoint savepoint) throws SQLException {
    throw new SQLFeatureNotSupportedException("Savepoints are not supported");
  }

  @Override
  public void setReadOnly(boolean readOnly) throws SQLException {
    checkOpen();
    this.readOnly = readOnly;
  }

  @Override
  public boolean isReadOnly() throws SQLException {
    checkOpen();
    return readOnly;
  }

  @Override
  public void setCatalog(String catalog) throws SQLException {
    checkOpen();
    this.catalog = catalog;
  }

  @Override
  public String getCatalog() throws SQLException {
    checkOpen();
    return catalog;
  }

  @Override
  public void setSchema(String schema) throws SQLException {
    checkOpen();
    this.schema = schema;
  }

  @Override
  public String getSchema() throws SQLException {
    checkOpen();
    return schema;
  }

  @Override
  public void setTransactionIsolation(int level) throws SQLException {
    checkOpen();
    this.transactionIsolation = level;
  }

  @Override
  public int getTransactionIsolation() throws SQLException {
    checkOpen();
    return transactionIsolation;
  }

  @Override
  public Map<String, Class<?>> getTypeMap() throws SQLException {
    checkOpen();
    return typeMap;
  }

  @Override
  public void setTypeMap(Map<String, Class<?>> map) throws SQLException {
    checkOpen();
    this.typeMap = map == null ? new HashMap<>() : map;
  }

  @Override
  public void setHoldability(int holdability) throws SQLException {
    checkOpen();
    checkHoldability(holdability);
  }

  @Override
  public int getHoldability() throws SQLException {
    checkOpen();
    return ResultSet.HOLD_CURSORS_OVER_COMMIT;
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
  public void setClientInfo(String name, String value) throws SQLClientInfoException {
    if (closed) {
      throw new SQLClientInfoException("Connection is closed", Map.of(name, ClientInfoStatus.REASON_UNKNOWN));
    }
    if (value == null) {
      clientInfo.remove(name);
    } else {
      clientInfo.setProperty(name, value);
    }
  }

  @Override
  public void setClientInfo(Properties properties) throws SQLClientInfoException {
    if (closed) {
      throw new SQLClientInfoException("Connection is closed", Map.of());
    }
    clientInfo.clear();
    if (properties != null) {
      for (String name : properties.stringPropertyNames()) {
        clientInfo.setProperty(name, properties.getProperty(name));
      }
    }
  }

  @Override
  public String getClientInfo(String name) throws SQLException {
    checkOpen();
    return clientInfo.getProperty(name);
  }

  @Override
  public Properties getClientInfo() throws SQLException {
    checkOpen();
    Properties copy = new Properties();
    copy.putAll(clientInfo);
    return copy;
  }

  @Override
  public void setNetworkTimeout(Executor executor, int milliseconds) throws SQLException {
    checkOpen();
    if (milliseconds < 0) {
      throw new SQLException("Network timeout must be >= 0: " + milliseconds);
    }
    this.networkTimeout = milliseconds;
  }

  @Override
  public int getNetworkTimeout() throws SQLException {
    checkOpen();
    return networkTimeout;
  }

  @Override
  public DatabaseMetaData getMetaData() throws SQLException {
    checkOpen();
    return new FqeDatabaseMetaData(this);
  }

  // --- lifecycle ---

  /**
   * Re-run the liveness probe.
   *
   * @param timeout
   *          seconds the probe may take, 0 for the configured transport timeouts
   * @return {@code false} when closed or when the probe fails
   */
  @Override
  public boolean isValid(int timeout) throws SQLException {
    if (timeout < 0) {
      throw new SQLException("Timeout must be >= 0: " + timeout);
    }
    if (closed) {
      return false;
    }
    try {
      transport.probe(timeout);
      return true;
    } catch (SQLException e) {
      log.debug("Connection to {} is not valid: {}", transport.getBaseUrl(), e.getMessage());
      return false;
    }
  }

  @Override
  public void close() {
    if (closed) {
      return;
    }
    closed = true;
    transport.close();
    log.debug("Connection to {} closed", transport.getBaseUrl());
  }

  @Override
  public boolean isClosed() {
    return closed;
  }

  @Override
  public void abort(Executor executor) throws SQLException {
    close();
  }

  @Override
  public Clob createClob() throws SQLException {
    throw new SQLFeatureNotSupportedException("LOBs are not supported");
  }

  @Override
  public Blob createBlob() throws SQLException {
    throw new SQLFeatureNotSupportedException("LOBs are not supported");
  }

  @Override
  public NClob createNClob() throws SQLException {
    throw new SQLFeatureNotSupportedException("LOBs are not supported");
  }

  @Override
  public SQLXML createSQLXML() throws SQLException {
    throw new SQLFeatureNotSupportedException("SQLXML is not supported");
  }

  @Override
  public Array createArrayOf(String typeName, Object[] elements) throws SQLException {
    throw new SQLFeatureNotSupportedException("Arrays are not supported");
  }

  @Override
  public Struct createStruct(String typeName, Object[] attributes) throws SQLException {
    throw new SQLFeatureNotSupportedException("Structs are not supported");
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
