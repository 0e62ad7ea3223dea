package se.alipsa.fqe.url;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Properties;
import org.junit.jupiter.api.Test;
import se.alipsa.fqe.error.InvalidDescriptorException;

public class ConnectionDescriptorTest {

  @Test
  void parsesHostPortPathAndOptions() throws Exception {
    ConnectionDescriptor d = ConnectionDescriptor
        .parse("jdbc:duckdb-fqe://db.example.com:9000/analytics?user=alice&password=s3cret&timeout=5&ssl=true");
    assertEquals("db.example.com", d.host());
    assertEquals(9000, d.port());
    assertEquals("analytics", d.path());
    assertEquals("analytics", d.catalog());
    assertEquals("alice", d.user());
    assertEquals("s3cret", d.password());
    assertTrue(d.hasCredentials());
    assertEquals(5, d.timeoutSeconds());
    assertTrue(d.ssl());
    assertEquals("https://db.example.com:9000/", d.baseUrl());
  }

  @Test
  void missingPortUsesDefault() throws Exception {
    ConnectionDescriptor d = ConnectionDescriptor.parse("jdbc:duckdb-fqe://myhost");
    assertEquals("myhost", d.host());
    assertEquals(ConnectionDescriptor.DEFAULT_PORT, d.port());
    assertEquals("", d.path());
    assertNull(d.catalog());
    assertEquals("http://myhost:8080/", d.baseUrl());
  }

  @Test
  void nonNumericPortFallsBackToDefault() throws Exception {
    ConnectionDescriptor d = ConnectionDescriptor.parse("jdbc:duckdb-fqe://myhost:abc/db");
    assertEquals("myhost", d.host());
    assertEquals(8080, d.port());
    assertEquals("db", d.path());
  }

  @Test
  void emptyHostIsLocalhost() throws Exception {
    ConnectionDescriptor d = ConnectionDescriptor.parse("jdbc:duckdb-fqe://");
    assertEquals("localhost", d.host());
    assertEquals(8080, d.port());
  }

  @Test
  void bracketedIpv6Host() throws Exception {
    ConnectionDescriptor d = ConnectionDescriptor.parse("jdbc:duckdb-fqe://[::1]:9001");
    assertEquals("[::1]", d.host());
    assertEquals(9001, d.port());
    assertEquals(8080, ConnectionDescriptor.parse("jdbc:duckdb-fqe://[::1]").port());
  }

  @Test
  void defaultsWithoutOptions() throws Exception {
    ConnectionDescriptor d = ConnectionDescriptor.parse("jdbc:duckdb-fqe://localhost:8080");
    assertFalse(d.ssl());
    assertFalse(d.hasCredentials());
    assertEquals(30, d.timeoutSeconds());
    assertEquals(10000, d.maxResultRows());
  }

  @Test
  void userWithoutPasswordHasNoCredentials() throws Exception {
    ConnectionDescriptor d = ConnectionDescriptor.parse("jdbc:duckdb-fqe://h:1?user=bob");
    assertEquals("bob", d.user());
    assertFalse(d.hasCredentials());
  }

  @Test
  void optionsWithoutEqualsAreDropped() throws Exception {
    ConnectionDescriptor d = ConnectionDescriptor.parse("jdbc:duckdb-fqe://h:1?flag&user=bob&=x");
    assertEquals(1, d.options().size());
    assertEquals("bob", d.option("user"));
  }

  @Test
  void propertiesOverrideDescriptorOptions() throws Exception {
    Properties props = new Properties();
    props.setProperty("user", "carol");
    props.setProperty("password", "pw");
    ConnectionDescriptor d = ConnectionDescriptor.parse("jdbc:duckdb-fqe://h:1?user=bob&timeout=7", props);
    assertEquals("carol", d.user());
    assertEquals("pw", d.password());
    assertEquals(7, d.timeoutSeconds());
  }

  @Test
  void rejectsForeignPrefix() {
    assertThrows(InvalidDescriptorException.class, () -> ConnectionDescriptor.parse("jdbc:postgresql://h/db"));
    assertThrows(InvalidDescriptorException.class, () -> ConnectionDescriptor.parse(null));
    InvalidDescriptorException e = assertThrows(InvalidDescriptorException.class,
        () -> ConnectionDescriptor.parse("duckdb-fqe://h"));
    assertEquals("08001", e.getSQLState());
  }

  @Test
  void optionsAreImmutable() throws Exception {
    ConnectionDescriptor d = ConnectionDescriptor.parse("jdbc:duckdb-fqe://h?user=a");
    assertThrows(UnsupportedOperationException.class, () -> d.options().put("x", "y"));
  }
}
