package se.alipsa.fqe.url;

import java.util.Map;
import java.util.Properties;
import se.alipsa.fqe.error.InvalidDescriptorException;
import se.alipsa.fqe.helper.FqeUtil;

/**
 * Parsed form of a connection descriptor.
 *
 * <p>
 * Grammar: {@code jdbc:duckdb-fqe://[host][:port][/path][?key=value(&key=value)*]}. An empty host resolves to
 * {@value #DEFAULT_HOST}; a missing or non-numeric port resolves to {@value #DEFAULT_PORT}.
 * </p>
 *
 * @param host
 *          server host name, never empty
 * @param port
 *          server port
 * @param path
 *          database path following the first {@code /}, empty when absent
 * @param options
 *          option map, descriptor options merged with explicit overrides
 */
public record ConnectionDescriptor(String host, int port, String path, Map<String, String> options) {

  /** Prefix every accepted descriptor starts with. */
  public static final String URL_PREFIX = "jdbc:duckdb-fqe://";
  public static final String DEFAULT_HOST = "localhost";
  public static final int DEFAULT_PORT = 8080;
  public static final int DEFAULT_TIMEOUT_SECONDS = 30;
  public static final int DEFAULT_MAX_RESULT_ROWS = 10000;

  public static final String USER = "user";
  public static final String PASSWORD = "password";
  public static final String TIMEOUT = "timeout";
  public static final String SSL = "ssl";
  public static final String MAX_RESULT_ROWS = "maxResultRows";

  public ConnectionDescriptor {
    options = options == null ? Map.of() : Map.copyOf(options);
    path = path == null ? "" : path;
  }

  /**
   * Parse a descriptor string.
   *
   * @param url
   *          the descriptor
   * @return the parsed descriptor
   * @throws InvalidDescriptorException
   *           if {@code url} is {@code null} or lacks {@link #URL_PREFIX}
   */
  public static ConnectionDescriptor parse(String url) throws InvalidDescriptorException {
    if (url == null || !url.startsWith(URL_PREFIX)) {
      throw new InvalidDescriptorException(url);
    }
    String rest = url.substring(URL_PREFIX.length());
    Map<String, String> options = Map.of();
    int q = rest.indexOf('?');
    if (q >= 0) {
      options = FqeUtil.parseUrlQuery(rest.substring(q + 1));
      rest = rest.substring(0, q);
    }
    String path = "";
    int slash = rest.indexOf('/');
    if (slash >= 0) {
      path = rest.substring(slash + 1);
      rest = rest.substring(0, slash);
    }
    String host = rest;
    int port = DEFAULT_PORT;
    int colon = rest.lastIndexOf(':');
    if (colon >= 0 && colon > rest.lastIndexOf(']')) {
      host = rest.substring(0, colon);
      port = FqeUtil.parseIntOrDefault(rest.substring(colon + 1), DEFAULT_PORT);
    }
    if (host.isEmpty()) {
      host = DEFAULT_HOST;
    }
    return new ConnectionDescriptor(host, port, path, options);
  }

  /**
   * Parse a descriptor and apply explicit overrides on top of its options.
   *
   * @param url
   *          the descriptor
   * @param overrides
   *          properties that take precedence over descriptor options (may be {@code null})
   * @return the parsed descriptor
   * @throws InvalidDescriptorException
   *           if the descriptor is not accepted
   */
  public static ConnectionDescriptor parse(String url, Properties overrides) throws InvalidDescriptorException {
    ConnectionDescriptor parsed = parse(url);
    return new ConnectionDescriptor(parsed.host, parsed.port, parsed.path,
        FqeUtil.mergeOptions(parsed.options, overrides));
  }

  public String option(String key) {
    return options.get(key);
  }

  public String user() {
    return options.get(USER);
  }

  public String password() {
    return options.get(PASSWORD);
  }

  /**
   * Whether both a user and a password are configured.
   *
   * @return {@code true} when basic authentication applies
   */
  public boolean hasCredentials() {
    return user() != null && password() != null;
  }

  public int timeoutSeconds() {
    return FqeUtil.parseIntOrDefault(options.get(TIMEOUT), DEFAULT_TIMEOUT_SECONDS);
  }

  public boolean ssl() {
    return Boolean.parseBoolean(options.get(SSL));
  }

  public int maxResultRows() {
    return FqeUtil.parseIntOrDefault(options.get(MAX_RESULT_ROWS), DEFAULT_MAX_RESULT_ROWS);
  }

  /**
   * The base URL requests are sent to, {@code http(s)://host:port/}.
   *
   * @return the base URL
   */
  public String baseUrl() {
    return (ssl() ? "https" : "http") + "://" + host + ":" + port + "/";
  }

  /**
   * The database path reported as catalog.
   *
   * @return the path, or {@code null} when the descriptor has none
   */
  public String catalog() {
    return path.isEmpty() ? null : path;
  }
}
