package se.alipsa.fqe.error;

import java.sql.SQLNonTransientConnectionException;

/** Raised when a connection descriptor does not carry the driver prefix or cannot be parsed. */
public class InvalidDescriptorException extends SQLNonTransientConnectionException {

  private static final long serialVersionUID = 1L;

  /**
   * Create a new exception for the supplied descriptor.
   *
   * @param descriptor
   *          the rejected descriptor text (may be {@code null})
   */
  public InvalidDescriptorException(String descriptor) {
    super("Invalid connection descriptor: " + descriptor, "08001");
  }
}
