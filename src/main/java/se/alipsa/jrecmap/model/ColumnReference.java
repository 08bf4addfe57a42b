package se.alipsa.jrecmap.model;

import java.util.Objects;

/**
 * Handle to one column of a table, as handed out by the table itself.
 *
 * @param tableName
 *          the name of the table owning the column
 * @param name
 *          the raw storage column name
 * @param type
 *          the column type
 * @param nullable
 *          whether the column allows {@code null}
 * @param position
 *          0-based position of the column in the table schema
 */
public record ColumnReference(String tableName, String name, ScalarType type, boolean nullable, int position) {

  /**
   * Validate the reference components.
   *
   * @param tableName
   *          the name of the table owning the column
   * @param name
   *          the raw storage column name
   * @param type
   *          the column type
   * @param nullable
   *          whether the column allows {@code null}
   * @param position
   *          0-based position of the column in the table schema
   */
  public ColumnReference {
    Objects.requireNonNull(tableName, "tableName");
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(type, "type");
  }

  /**
   * Create a reference to a field of a schema.
   *
   * @param tableName
   *          the table owning the schema
   * @param schema
   *          the table schema
   * @param position
   *          0-based field position
   * @return a reference describing the field
   */
  public static ColumnReference of(String tableName, SchemaDescriptor schema, int position) {
    Field field = schema.field(position);
    return new ColumnReference(tableName, field.name(), field.type(), field.nullable(), position);
  }

  @Override
  public String toString() {
    return tableName + "." + name;
  }
}
