package se.alipsa.fqe.error;

import java.sql.SQLNonTransientConnectionException;

/** Raised when a connection cannot be opened; the cause carries the underlying failure. */
public class ConnectionFailedException extends SQLNonTransientConnectionException {

  private static final long serialVersionUID = 1L;

  /**
   * Create a new exception.
   *
   * @param message
   *          description of the failed attempt
   * @param cause
   *          the failure that prevented the connection from opening
   */
  public ConnectionFailedException(String message, Throwable cause) {
    super(message, "08004", cause);
  }
}
