package se.alipsa.fqe.error;

import java.sql.SQLException;

/** Raised when a closed statement is used. */
public class StatementClosedException extends SQLException {

  private static final long serialVersionUID = 1L;

  public StatementClosedException() {
    super("Statement is closed", "HY010");
  }
}
