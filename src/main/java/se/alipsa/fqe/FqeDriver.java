package se.alipsa.fqe;

import java.sql.Connection;
import java.sql.Driver;
import java.sql.DriverManager;
import java.sql.DriverPropertyInfo;
import java.sql.SQLException;
import java.util.Properties;
import java.util.logging.Logger;
import org.slf4j.LoggerFactory;
import se.alipsa.fqe.url.ConnectionDescriptor;

/**
 * An implementation of the java.sql.Driver interface for the DuckDB federated query engine HTTP service. JDBC URL
 * format: {@code jdbc:duckdb-fqe://host[:port][/database][?user=u&password=p&timeout=30&ssl=false]}
 *
 * <p>
 * Loading this class does not register it. Call {@link #register()} once during application startup before using
 * {@link DriverManager}, or call {@link #connect(String, Properties)} on an instance directly.
 * </p>
 */
@SuppressWarnings("checkstyle:AbbreviationAsWordInName")
public class FqeDriver implements Driver {

  public static final String URL_PREFIX = ConnectionDescriptor.URL_PREFIX;
  public static final String DRIVER_NAME = "DuckDB FQE JDBC Driver";
  public static final String DRIVER_VERSION = "1.0.0";
  public static final int MAJOR_VERSION = 1;
  public static final int MINOR_VERSION = 0;

  private static final org.slf4j.Logger log = LoggerFactory.getLogger(FqeDriver.class);
  private static FqeDriver registered;

  /**
   * Register a shared driver instance with {@link DriverManager}. Calling this more than once has no further effect.
   *
   * @return the registered instance
   * @throws SQLException
   *           if {@link DriverManager} rejects the driver
   */
  public static synchronized FqeDriver register() throws SQLException {
    if (registered == null) {
      FqeDriver driver = new FqeDriver();
      DriverManager.registerDriver(driver);
      registered = driver;
      log.info("Registered {} {}", DRIVER_NAME, DRIVER_VERSION);
    }
    return registered;
  }

  /**
   * Remove the instance added by {@link #register()}. Does nothing when not registered.
   *
   * @throws SQLException
   *           if {@link DriverManager} fails to deregister the driver
   */
  public static synchronized void deregister() throws SQLException {
    if (registered != null) {
      DriverManager.deregisterDriver(registered);
      registered = null;
      log.debug("Deregistered {}", DRIVER_NAME);
    }
  }

  public static synchronized boolean isRegistered() {
    return registered != null;
  }

  @Override
  public Connection connect(String url, Properties info) throws SQLException {
    if (!acceptsURL(url)) {
      return null; // allow DriverManager to try others
    }
    return new FqeConnection(url, info);
  }

  @Override
  public boolean acceptsURL(String url) {
    return url != null && url.startsWith(URL_PREFIX);
  }

  @Override
  public DriverPropertyInfo[] getPropertyInfo(String url, Properties info) throws SQLException {
    Properties props = info == null ? new Properties() : info;
    DriverPropertyInfo user = new DriverPropertyInfo(ConnectionDescriptor.USER,
        props.getProperty(ConnectionDescriptor.USER));
    user.description = "User name for HTTP basic authentication";
    DriverPropertyInfo password = new DriverPropertyInfo(ConnectionDescriptor.PASSWORD,
        props.getProperty(ConnectionDescriptor.PASSWORD));
    password.description = "Password for HTTP basic authentication";
    DriverPropertyInfo timeout = new DriverPropertyInfo(ConnectionDescriptor.TIMEOUT,
        props.getProperty(ConnectionDescriptor.TIMEOUT, String.valueOf(ConnectionDescriptor.DEFAULT_TIMEOUT_SECONDS)));
    timeout.description = "Connect, read and write timeout in seconds";
    DriverPropertyInfo ssl = new DriverPropertyInfo(ConnectionDescriptor.SSL,
        props.getProperty(ConnectionDescriptor.SSL, "false"));
    ssl.description = "Use https instead of http";
    ssl.choices = new String[]{"true", "false"};
    DriverPropertyInfo maxRows = new DriverPropertyInfo(ConnectionDescriptor.MAX_RESULT_ROWS,
        props.getProperty(ConnectionDescriptor.MAX_RESULT_ROWS,
            String.valueOf(ConnectionDescriptor.DEFAULT_MAX_RESULT_ROWS)));
    maxRows.description = "Maximum number of rows the server returns for a query";
    return new DriverPropertyInfo[]{user, password, timeout, ssl, maxRows};
  }

  @Override
  public int getMajorVersion() {
    return MAJOR_VERSION;
  }

  @Override
  public int getMinorVersion() {
    return MINOR_VERSION;
  }

  @Override
  public boolean jdbcCompliant() {
    return false;
  }

  @Override
  public Logger getParentLogger() {
    return Logger.getLogger("se.alipsa.fqe");
  }
}
