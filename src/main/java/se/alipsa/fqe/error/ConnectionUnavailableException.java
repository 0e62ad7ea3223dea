package se.alipsa.fqe.error;

import java.sql.SQLNonTransientConnectionException;

/** Raised when the liveness probe reaches the service but receives a non-success status. */
public class ConnectionUnavailableException extends SQLNonTransientConnectionException {

  private static final long serialVersionUID = 1L;

  private final int statusCode;

  /**
   * Create a new exception.
   *
   * @param baseUrl
   *          the probed base URL
   * @param statusCode
   *          the HTTP status returned by the probe
   */
  public ConnectionUnavailableException(String baseUrl, int statusCode) {
    super("Service at " + baseUrl + " is unavailable: HTTP " + statusCode, "08001", statusCode);
    this.statusCode = statusCode;
  }

  public int getStatusCode() {
    return statusCode;
  }
}
