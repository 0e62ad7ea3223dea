package se.alipsa.fqe.error;

import java.sql.SQLException;

/** Raised for a column index outside {@code 1..columnCount}. */
public class InvalidColumnIndexException extends SQLException {

  private static final long serialVersionUID = 1L;

  /**
   * Create a new exception.
   *
   * @param columnIndex
   *          the rejected 1-based index
   * @param columnCount
   *          the number of available columns
   */
  public InvalidColumnIndexException(int columnIndex, int columnCount) {
    super("Invalid column index " + columnIndex + " (column count " + columnCount + ")", "07009");
  }
}
