package se.alipsa.jrecmap.model;

import java.util.Objects;

/**
 * One column of a {@link SchemaDescriptor}.
 *
 * @param name
 *          the storage column name
 * @param type
 *          the scalar type of the column
 * @param nullable
 *          whether a row may hold {@code null} in this column
 */
public record Field(String name, ScalarType type, boolean nullable) {

  /**
   * Validate the field components.
   *
   * @param name
   *          the storage column name
   * @param type
   *          the scalar type of the column
   * @param nullable
   *          whether a row may hold {@code null} in this column
   */
  public Field {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(type, "type");
  }
}
