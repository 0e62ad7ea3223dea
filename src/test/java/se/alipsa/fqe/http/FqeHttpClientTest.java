package se.alipsa.fqe.http;

import static org.junit.jupiter.api.Assertions.*;

import java.util.concurrent.TimeUnit;
import okhttp3.Credentials;
import okhttp3.HttpUrl;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import se.alipsa.fqe.error.ConnectionClosedException;
import se.alipsa.fqe.error.ConnectionUnavailableException;
import se.alipsa.fqe.error.RemoteExecutionException;
import se.alipsa.fqe.error.ResultDecodeException;
import se.alipsa.fqe.error.TransportException;
import se.alipsa.fqe.url.ConnectionDescriptor;
import se.alipsa.fqe.wire.WireResult;

/** Tests the HTTP exchange against a local mock server. */
public class FqeHttpClientTest {

  private static final String HI = "{\"meta\":[{\"name\":\"msg\",\"type\":\"VARCHAR\"}],\"data\":[[\"hi\"]],\"rows\":1,"
      + "\"statistics\":{\"elapsed\":0.001,\"rows_read\":1,\"bytes_read\":2}}";

  private MockWebServer server;

  @BeforeEach
  void setUp() throws Exception {
    server = new MockWebServer();
    server.start();
  }

  @AfterEach
  void tearDown() throws Exception {
    server.shutdown();
  }

  private FqeHttpClient client(String options) throws Exception {
    String url = "jdbc:duckdb-fqe://" + server.getHostName() + ":" + server.getPort() + options;
    return new FqeHttpClient(ConnectionDescriptor.parse(url));
  }

  @Test
  void probeSendsGetToBaseUrl() throws Exception {
    server.enqueue(new MockResponse().setBody("Ok."));
    try (FqeHttpClient client = client("")) {
      client.probe();
    }
    RecordedRequest request = server.takeRequest();
    assertEquals("GET", request.getMethod());
    assertEquals("/", request.getPath());
  }

  @Test
  void probeFailsOnErrorStatus() throws Exception {
    server.enqueue(new MockResponse().setResponseCode(503));
    try (FqeHttpClient client = client("")) {
      ConnectionUnavailableException e = assertThrows(ConnectionUnavailableException.class, client::probe);
      assertEquals(503, e.getStatusCode());
    }
  }

  @Test
  void queryPostsSqlWithFormatOptionsAndAuth() throws Exception {
    server.enqueue(new MockResponse().setBody(HI));
    try (FqeHttpClient client = client("?user=alice&password=secret&maxResultRows=50")) {
      WireResult result = client.executeQuery("SELECT 'hi' as msg");
      assertEquals(1, result.rows().size());
      assertEquals("msg", result.columns().get(0).name());
    }
    RecordedRequest request = server.takeRequest();
    assertEquals("POST", request.getMethod());
    assertEquals("SELECT 'hi' as msg", request.getBody().readUtf8());
    assertTrue(request.getHeader("Content-Type").startsWith("text/plain"));
    assertEquals(Credentials.basic("alice", "secret"), request.getHeader("Authorization"));
    HttpUrl url = request.getRequestUrl();
    assertEquals("1", url.queryParameter("add_http_cors_header"));
    assertEquals("JSONCompact", url.queryParameter("default_format"));
    assertEquals("50", url.queryParameter("max_result_rows"));
  }

  @Test
  void noAuthHeaderWithoutPassword() throws Exception {
    server.enqueue(new MockResponse().setBody(HI));
    try (FqeHttpClient client = client("?user=alice")) {
      client.executeQuery("SELECT 1");
    }
    assertNull(server.takeRequest().getHeader("Authorization"));
  }

  @Test
  void errorStatusCarriesCodeAndBody() throws Exception {
    server.enqueue(new MockResponse().setResponseCode(400).setBody("Parser Error: syntax error at or near \"SELEC\""));
    try (FqeHttpClient client = client("")) {
      RemoteExecutionException e = assertThrows(RemoteExecutionException.class, () -> client.executeQuery("SELEC 1"));
      assertEquals(400, e.getStatusCode());
      assertEquals(400, e.getErrorCode());
      assertTrue(e.getResponseBody().contains("Parser Error"));
    }
  }

  @Test
  void malformedQueryBodyFails() throws Exception {
    server.enqueue(new MockResponse().setBody("<html>"));
    try (FqeHttpClient client = client("")) {
      assertThrows(ResultDecodeException.class, () -> client.executeQuery("SELECT 1"));
    }
  }

  @Test
  void updateAlwaysReturnsZero() throws Exception {
    server.enqueue(new MockResponse().setBody(""));
    server.enqueue(new MockResponse().setBody("Ok."));
    server.enqueue(new MockResponse().setBody(HI));
    try (FqeHttpClient client = client("")) {
      assertEquals(0, client.executeUpdate("CREATE TABLE t (id INTEGER)"));
      assertEquals(0, client.executeUpdate("INSERT INTO t VALUES (1)"));
      assertEquals(0, client.executeUpdate("DELETE FROM t"));
    }
  }

  @Test
  void unreachableServerIsTransportError() throws Exception {
    MockWebServer stopped = new MockWebServer();
    stopped.start();
    String url = "jdbc:duckdb-fqe://" + stopped.getHostName() + ":" + stopped.getPort() + "?timeout=2";
    stopped.shutdown();
    try (FqeHttpClient client = new FqeHttpClient(ConnectionDescriptor.parse(url))) {
      assertThrows(TransportException.class, client::probe);
      assertThrows(TransportException.class, () -> client.executeQuery("SELECT 1"));
    }
  }

  @Test
  void callTimeoutIsTransportError() throws Exception {
    server.enqueue(new MockResponse().setBody(HI).setBodyDelay(3, TimeUnit.SECONDS));
    try (FqeHttpClient client = client("")) {
      assertThrows(TransportException.class, () -> client.executeQuery("SELECT 1", 1));
    }
  }

  @Test
  void probeTimeoutIsTransportError() throws Exception {
    server.enqueue(new MockResponse().setBody("Ok.").setHeadersDelay(3, TimeUnit.SECONDS));
    try (FqeHttpClient client = client("")) {
      assertThrows(TransportException.class, () -> client.probe(1));
    }
  }

  @Test
  void closedClientRejectsRequests() throws Exception {
    FqeHttpClient client = client("");
    client.close();
    client.close();
    assertTrue(client.isClosed());
    assertThrows(ConnectionClosedException.class, client::probe);
    assertThrows(ConnectionClosedException.class, () -> client.executeUpdate("DROP TABLE t"));
    assertEquals(0, server.getRequestCount());
  }

  @Test
  void urls() throws Exception {
    try (FqeHttpClient client = client("?ssl=false")) {
      assertEquals("http://" + server.getHostName() + ":" + server.getPort() + "/", client.getBaseUrl());
      assertTrue(client.getQueryUrl().contains("default_format=JSONCompact"));
    }
  }
}
