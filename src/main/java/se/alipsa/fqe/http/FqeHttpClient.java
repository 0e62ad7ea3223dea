package se.alipsa.fqe.http;

import java.io.IOException;
import java.sql.SQLException;
import java.util.concurrent.TimeUnit;
import okhttp3.Call;
import okhttp3.Credentials;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import se.alipsa.fqe.error.ConnectionClosedException;
import se.alipsa.fqe.error.ConnectionUnavailableException;
import se.alipsa.fqe.error.RemoteExecutionException;
import se.alipsa.fqe.error.TransportException;
import se.alipsa.fqe.url.ConnectionDescriptor;
import se.alipsa.fqe.wire.WireResult;

/**
 * Blocking HTTP transport for one connection. Every request is a single exchange without retries; the pooled
 * resources are owned by this client and released by {@link #close()}.
 */
public class FqeHttpClient implements AutoCloseable {

  private static final Logger log = LoggerFactory.getLogger(FqeHttpClient.class);
  private static final MediaType TEXT_PLAIN = MediaType.get("text/plain; charset=utf-8");

  private final ConnectionDescriptor descriptor;
  private final OkHttpClient client;
  private final WireResultDecoder decoder;
  private final HttpUrl baseUrl;
  private final HttpUrl queryUrl;
  private final String authorization;
  private volatile boolean closed = false;

  /**
   * Create a client for the supplied descriptor.
   *
   * @param descriptor
   *          the parsed connection descriptor, supplies host, port, scheme, timeout and credentials
   */
  public FqeHttpClient(ConnectionDescriptor descriptor) {
    this(descriptor, new OkHttpClient.Builder()
        .connectTimeout(descriptor.timeoutSeconds(), TimeUnit.SECONDS)
        .readTimeout(descriptor.timeoutSeconds(), TimeUnit.SECONDS)
        .writeTimeout(descriptor.timeoutSeconds(), TimeUnit.SECONDS)
        .build());
  }

  FqeHttpClient(ConnectionDescriptor descriptor, OkHttpClient client) {
    this.descriptor = descriptor;
    this.client = client;
    this.decoder = new WireResultDecoder();
    this.baseUrl = HttpUrl.get(descriptor.baseUrl());
    this.queryUrl = baseUrl.newBuilder()
        .addQueryParameter("add_http_cors_header", "1")
        .addQueryParameter("default_format", "JSONCompact")
        .addQueryParameter("max_result_rows", String.valueOf(descriptor.maxResultRows()))
        .build();
    this.authorization = descriptor.hasCredentials()
        ? Credentials.basic(descriptor.user(), descriptor.password())
        : null;
  }

  /**
   * Liveness probe: a GET against the base URL.
   *
   * @throws ConnectionUnavailableException
   *           if the service answers with a non-success status
   * @throws TransportException
   *           if the service cannot be reached
   * @throws SQLException
   *           if this client is closed
   */
  public void probe() throws SQLException {
    probe(0);
  }

  /**
   * Liveness probe bounded by a deadline for the whole exchange.
   *
   * @param timeoutSeconds
   *          deadline for the complete call, 0 for none beyond the configured timeouts
   * @throws SQLException
   *           see {@link #probe()}
   */
  public void probe(int timeoutSeconds) throws SQLException {
    checkOpen();
    log.debug("Probing {}", baseUrl);
    Request request = newRequest(baseUrl).get().build();
    Call call = client.newCall(request);
    if (timeoutSeconds > 0) {
      call.timeout().timeout(timeoutSeconds, TimeUnit.SECONDS);
    }
    try (Response response = call.execute()) {
      if (!response.isSuccessful()) {
        log.warn("Probe of {} returned HTTP {}", baseUrl, response.code());
        throw new ConnectionUnavailableException(baseUrl.toString(), response.code());
      }
    } catch (IOException e) {
      throw new TransportException("Failed to reach " + baseUrl + ": " + e.getMessage(), e);
    }
  }

  /**
   * Execute a statement and decode its tabular result.
   *
   * @param sql
   *          the SQL text sent as the request body
   * @return the decoded result; {@link WireResult#EMPTY} for an empty body
   * @throws SQLException
   *           {@link RemoteExecutionException} for a non-success status, {@link TransportException} for network
   *           failures, {@link se.alipsa.fqe.error.ResultDecodeException} for a malformed body
   */
  public WireResult executeQuery(String sql) throws SQLException {
    return executeQuery(sql, 0);
  }

  /**
   * Execute a statement and decode its tabular result, bounding the whole exchange.
   *
   * @param sql
   *          the SQL text sent as the request body
   * @param timeoutSeconds
   *          deadline for the complete call, 0 for none beyond the configured timeouts
   * @return the decoded result
   * @throws SQLException
   *           see {@link #executeQuery(String)}
   */
  public WireResult executeQuery(String sql, int timeoutSeconds) throws SQLException {
    return decoder.decode(post(sql, timeoutSeconds));
  }

  /**
   * Execute a statement that produces no result. The wire format carries no affected-row count, so the update count
   * is always 0.
   *
   * @param sql
   *          the SQL text sent as the request body
   * @return 0
   * @throws SQLException
   *           {@link RemoteExecutionException} for a non-success status, {@link TransportException} for network
   *           failures
   */
  public int executeUpdate(String sql) throws SQLException {
    return executeUpdate(sql, 0);
  }

  /**
   * Execute a statement that produces no result, bounding the whole exchange.
   *
   * @param sql
   *          the SQL text sent as the request body
   * @param timeoutSeconds
   *          deadline for the complete call, 0 for none beyond the configured timeouts
   * @return 0
   * @throws SQLException
   *           see {@link #executeUpdate(String)}
   */
  public int executeUpdate(String sql, int timeoutSeconds) throws SQLException {
    WireResult result = decoder.decodeLenient(post(sql, timeoutSeconds));
    log.debug("Update completed, {} rows read", result.stats().rowsRead());
    return 0;
  }

  private String post(String sql, int timeoutSeconds) throws SQLException {
    checkOpen();
    log.debug("Executing: {}", sql);
    Request request = newRequest(queryUrl).post(RequestBody.create(sql, TEXT_PLAIN)).build();
    Call call = client.newCall(request);
    if (timeoutSeconds > 0) {
      call.timeout().timeout(timeoutSeconds, TimeUnit.SECONDS);
    }
    try (Response response = call.execute()) {
      ResponseBody body = response.body();
      String text = body == null ? "" : body.string();
      if (!response.isSuccessful()) {
        log.warn("Query failed with HTTP {}: {}", response.code(), text);
        throw new RemoteExecutionException(response.code(), text);
      }
      return text;
    } catch (IOException e) {
      throw new TransportException("Request to " + baseUrl + " failed: " + e.getMessage(), e);
    }
  }

  private Request.Builder newRequest(HttpUrl url) {
    Request.Builder builder = new Request.Builder().url(url).header("Accept", "application/json");
    if (authorization != null) {
      builder.header("Authorization", authorization);
    }
    return builder;
  }

  private void checkOpen() throws ConnectionClosedException {
    if (closed) {
      throw new ConnectionClosedException();
    }
  }

  public ConnectionDescriptor getDescriptor() {
    return descriptor;
  }

  public String getBaseUrl() {
    return baseUrl.toString();
  }

  /**
   * The URL statements are posted to.
   *
   * @return the query URL including the result format options
   */
  public String getQueryUrl() {
    return queryUrl.toString();
  }

  public boolean isClosed() {
    return closed;
  }

  /** Release the connection pool and dispatcher threads. Idempotent. */
  @Override
  public synchronized void close() {
    if (closed) {
      return;
    }
    closed = true;
    client.dispatcher().executorService().shutdown();
    client.connectionPool().evictAll();
    log.debug("Closed transport for {}", baseUrl);
  }
}
