package se.alipsa.fqe.error;

import java.sql.SQLNonTransientConnectionException;

/** Raised when a closed connection (or a statement of one) is used. */
public class ConnectionClosedException extends SQLNonTransientConnectionException {

  private static final long serialVersionUID = 1L;

  public ConnectionClosedException() {
    super("Connection is closed", "08003");
  }
}
