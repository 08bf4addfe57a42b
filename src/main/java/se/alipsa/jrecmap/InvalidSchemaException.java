package se.alipsa.jrecmap;

/**
 * Thrown when a type description cannot be read as a flat list of named, typed fields.
 */
public class InvalidSchemaException extends JRecMapException {

  private static final long serialVersionUID = 1L;

  /**
   * Create a new exception.
   *
   * @param message
   *          description of the failure
   */
  public InvalidSchemaException(String message) {
    super(message);
  }
}
