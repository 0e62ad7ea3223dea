package se.alipsa.fqe;

import static org.junit.jupiter.api.Assertions.*;

import java.sql.Driver;
import java.sql.DriverManager;
import java.sql.DriverPropertyInfo;
import java.sql.SQLException;
import java.util.Collections;
import java.util.Properties;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import se.alipsa.fqe.error.ConnectionFailedException;

public class FqeDriverTest {

  private final FqeDriver driver = new FqeDriver();

  @AfterEach
  void tearDown() throws SQLException {
    FqeDriver.deregister();
  }

  @Test
  void acceptsOnlyOwnPrefix() {
    assertTrue(driver.acceptsURL("jdbc:duckdb-fqe://localhost:8080"));
    assertTrue(driver.acceptsURL("jdbc:duckdb-fqe://"));
    assertFalse(driver.acceptsURL("jdbc:duckdb:/tmp/x.db"));
    assertFalse(driver.acceptsURL(null));
  }

  @Test
  void connectReturnsNullForForeignUrl() throws SQLException {
    assertNull(driver.connect("jdbc:postgresql://localhost/db", new Properties()));
  }

  @Test
  void connectFailsWhenServiceIsDown() {
    assertThrows(ConnectionFailedException.class,
        () -> driver.connect("jdbc:duckdb-fqe://127.0.0.1:1?timeout=1", new Properties()));
  }

  @Test
  void versionInfo() {
    assertEquals(1, driver.getMajorVersion());
    assertEquals(0, driver.getMinorVersion());
    assertFalse(driver.jdbcCompliant());
    assertNotNull(driver.getParentLogger());
  }

  @Test
  void propertyInfoListsOptions() throws SQLException {
    Properties props = new Properties();
    props.setProperty("user", "alice");
    DriverPropertyInfo[] info = driver.getPropertyInfo("jdbc:duckdb-fqe://localhost", props);
    assertEquals(5, info.length);
    assertEquals("user", info[0].name);
    assertEquals("alice", info[0].value);
    assertEquals("password", info[1].name);
    assertEquals("30", info[2].value);
    assertEquals("false", info[3].value);
    assertArrayEquals(new String[]{"true", "false"}, info[3].choices);
    assertEquals("maxResultRows", info[4].name);
    assertEquals("10000", info[4].value);
  }

  @Test
  void explicitRegistration() throws SQLException {
    assertFalse(FqeDriver.isRegistered());
    FqeDriver registered = FqeDriver.register();
    assertSame(registered, FqeDriver.register());
    assertTrue(FqeDriver.isRegistered());
    assertTrue(Collections.list(DriverManager.getDrivers()).contains(registered));
    Driver found = DriverManager.getDriver("jdbc:duckdb-fqe://localhost:8080");
    assertSame(registered, found);
    FqeDriver.deregister();
    assertFalse(FqeDriver.isRegistered());
    assertFalse(Collections.list(DriverManager.getDrivers()).contains(registered));
  }
}
