package se.alipsa.fqe.error;

import java.sql.SQLDataException;

/** Raised when a success response cannot be decoded into a wire result. */
public class ResultDecodeException extends SQLDataException {

  private static final long serialVersionUID = 1L;

  /**
   * Create a new exception.
   *
   * @param message
   *          what was wrong with the payload
   * @param cause
   *          the parser failure (may be {@code null})
   */
  public ResultDecodeException(String message, Throwable cause) {
    super(message, "22000", cause);
  }

  /**
   * Create a new exception without an underlying parser failure.
   *
   * @param message
   *          what was wrong with the payload
   */
  public ResultDecodeException(String message) {
    this(message, null);
  }
}
