package se.alipsa.fqe.error;

import java.sql.SQLException;

/** Raised when a cell is read while the cursor is not positioned on a row. */
public class InvalidCursorPositionException extends SQLException {

  private static final long serialVersionUID = 1L;

  /**
   * Create a new exception.
   *
   * @param position
   *          the cursor position at the time of the read
   * @param rowCount
   *          number of rows in the cursor
   */
  public InvalidCursorPositionException(int position, int rowCount) {
    super("Cursor is not on a row (position " + position + " of " + rowCount + ")", "24000");
  }
}
