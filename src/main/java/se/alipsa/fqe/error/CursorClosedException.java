package se.alipsa.fqe.error;

import java.sql.SQLException;

/** Raised when a closed result set is used. */
public class CursorClosedException extends SQLException {

  private static final long serialVersionUID = 1L;

  public CursorClosedException() {
    super("ResultSet is closed", "24000");
  }
}
