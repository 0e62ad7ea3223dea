package se.alipsa.fqe.error;

import java.sql.SQLException;

/** Raised when a column label matches no column, ignoring case. */
public class ColumnNotFoundException extends SQLException {

  private static final long serialVersionUID = 1L;

  /**
   * Create a new exception.
   *
   * @param label
   *          the label that could not be resolved
   */
  public ColumnNotFoundException(String label) {
    super("Unknown column: " + label, "42S22");
  }
}
