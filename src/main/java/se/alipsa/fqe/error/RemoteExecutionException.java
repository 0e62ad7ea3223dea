package se.alipsa.fqe.error;

import java.sql.SQLException;

/**
 * Raised when the service answers a query or command with a non-success HTTP status. The status is exposed both
 * through {@link #getStatusCode()} and as the vendor error code.
 */
public class RemoteExecutionException extends SQLException {

  private static final long serialVersionUID = 1L;

  private final int statusCode;
  private final String responseBody;

  /**
   * Create a new exception.
   *
   * @param statusCode
   *          the HTTP status returned by the service
   * @param responseBody
   *          the response body text, typically the engine's error message
   */
  public RemoteExecutionException(int statusCode, String responseBody) {
    super("Query failed: HTTP " + statusCode + " - " + responseBody, "HY000", statusCode);
    this.statusCode = statusCode;
    this.responseBody = responseBody == null ? "" : responseBody;
  }

  public int getStatusCode() {
    return statusCode;
  }

  public String getResponseBody() {
    return responseBody;
  }
}
