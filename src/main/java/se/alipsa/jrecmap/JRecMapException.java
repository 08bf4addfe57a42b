package se.alipsa.jrecmap;

/**
 * Base class for the failures raised when records, rows, schemas or column names cannot be mapped.
 */
public class JRecMapException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  /**
   * Create a new exception.
   *
   * @param message
   *          description of the failure
   */
  public JRecMapException(String message) {
    super(message);
  }

  /**
   * Create a new exception with a cause.
   *
   * @param message
   *          description of the failure
   * @param cause
   *          the underlying cause
   */
  public JRecMapException(String message, Throwable cause) {
    super(message, cause);
  }
}
