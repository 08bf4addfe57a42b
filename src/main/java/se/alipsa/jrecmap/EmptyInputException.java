package se.alipsa.jrecmap;

/** Thrown when a schema or a table is requested from no data at all. */
public class EmptyInputException extends JRecMapException {

  private static final long serialVersionUID = 1L;

  /**
   * Create a new exception.
   *
   * @param message
   *          description of the failure
   */
  public EmptyInputException(String message) {
    super(message);
  }
}
