package se.alipsa.jrecmap;

/** Thrown when a type description declares a field type that has no scalar storage type. */
public class UnsupportedTypeException extends JRecMapException {

  private static final long serialVersionUID = 1L;

  /**
   * Create a new exception.
   *
   * @param message
   *          description of the failure
   */
  public UnsupportedTypeException(String message) {
    super(message);
  }
}
