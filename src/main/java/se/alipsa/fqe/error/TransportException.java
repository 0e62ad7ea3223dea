package se.alipsa.fqe.error;

import java.sql.SQLTransientConnectionException;

/** Network level failure (refused connection, reset, timeout) during an HTTP exchange. */
public class TransportException extends SQLTransientConnectionException {

  private static final long serialVersionUID = 1L;

  /**
   * Create a new exception.
   *
   * @param message
   *          description of the failed exchange
   * @param cause
   *          the I/O failure reported by the HTTP client
   */
  public TransportException(String message, Throwable cause) {
    super(message, "08006", cause);
  }
}
