package se.alipsa.jrecmap;

/**
 * Thrown when a quoted column name does not have the {@code FUNC(ARG)} shape of a computed column.
 */
public class UnsupportedColumnNameException extends JRecMapException {

  private static final long serialVersionUID = 1L;

  private final String columnName;

  /**
   * Create a new exception for the supplied raw column name.
   *
   * @param columnName
   *          the raw column name, including its quotes
   */
  public UnsupportedColumnNameException(String columnName) {
    super("Quoted column names are not supported: " + columnName);
    this.columnName = columnName;
  }

  /**
   * The raw column name that could not be normalized.
   *
   * @return the column name as returned by the storage engine
   */
  public String getColumnName() {
    return columnName;
  }
}
