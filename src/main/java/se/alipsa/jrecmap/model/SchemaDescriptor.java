package se.alipsa.jrecmap.model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Ordered list of {@link Field}s describing the shape of a {@link StorageRow}. The position of a field is the
 * position of its value in every row described by this schema.
 */
public final class SchemaDescriptor {

  private final List<Field> fields;

  private SchemaDescriptor(List<Field> fields) {
    this.fields = fields;
  }

  /**
   * Create a schema from the supplied fields.
   *
   * @param fields
   *          the fields in row order
   * @return a new immutable schema
   * @throws IllegalArgumentException
   *           if two fields share the same name
   */
  public static SchemaDescriptor of(Field... fields) {
    Objects.requireNonNull(fields, "fields");
    return of(Arrays.asList(fields));
  }

  /**
   * Create a schema from the supplied fields.
   *
   * @param fields
   *          the fields in row order
   * @return a new immutable schema
   * @throws IllegalArgumentException
   *           if two fields share the same name
   */
  public static SchemaDescriptor of(List<Field> fields) {
    Objects.requireNonNull(fields, "fields");
    Set<String> seen = new HashSet<>();
    for (Field field : fields) {
      Objects.requireNonNull(field, "field");
      if (!seen.add(field.name())) {
        throw new IllegalArgumentException("Duplicate field name: " + field.name());
      }
    }
    return new SchemaDescriptor(List.copyOf(fields));
  }

  /**
   * All fields in row order.
   *
   * @return an immutable list of fields
   */
  public List<Field> fields() {
    return fields;
  }

  /**
   * The number of fields.
   *
   * @return the schema length
   */
  public int size() {
    return fields.size();
  }

  /**
   * Get the field at a position.
   *
   * @param index
   *          0-based position
   * @return the field
   */
  public Field field(int index) {
    return fields.get(index);
  }

  /**
   * The storage names of all fields in row order.
   *
   * @return an immutable list of field names
   */
  public List<String> names() {
    List<String> names = new ArrayList<>(fields.size());
    for (Field field : fields) {
      names.add(field.name());
    }
    return List.copyOf(names);
  }

  /**
   * Find the position of a field by its exact storage name.
   *
   * @param name
   *          the storage name
   * @return the 0-based position, or {@code -1} when no field has that name
   */
  public int indexOf(String name) {
    for (int i = 0; i < fields.size(); i++) {
      if (fields.get(i).name().equals(name)) {
        return i;
      }
    }
    return -1;
  }

  /**
   * Check whether a field with the exact storage name exists.
   *
   * @param name
   *          the storage name
   * @return {@code true} if the schema has such a field
   */
  public boolean contains(String name) {
    return indexOf(name) >= 0;
  }

  /**
   * Verify that a row fits this schema: same length, nulls only in nullable fields and every other value of a Java
   * type accepted by the field type.
   *
   * @param row
   *          the row to check
   * @throws IllegalArgumentException
   *           if the row does not fit
   */
  public void validate(StorageRow row) {
    Objects.requireNonNull(row, "row");
    if (row.size() != fields.size()) {
      throw new IllegalArgumentException(
          "Row has " + row.size() + " values but the schema has " + fields.size() + " fields");
    }
    for (int i = 0; i < fields.size(); i++) {
      Field field = fields.get(i);
      Object value = row.get(i);
      if (value == null) {
        if (!field.nullable()) {
          throw new IllegalArgumentException("Field " + field.name() + " is not nullable");
        }
      } else if (!field.type().accepts(value)) {
        throw new IllegalArgumentException("Field " + field.name() + " of type " + field.type()
            + " cannot hold a value of type " + value.getClass().getName());
      }
    }
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof SchemaDescriptor other)) {
      return false;
    }
    return fields.equals(other.fields);
  }

  @Override
  public int hashCode() {
    return fields.hashCode();
  }

  @Override
  public String toString() {
    return "SchemaDescriptor" + fields;
  }
}
