package se.alipsa.jrecmap.model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * An ordered, schema positioned sequence of values. A {@code null} slot means the column holds no value in this row.
 */
public final class StorageRow {

  private final List<Object> values;

  private StorageRow(List<Object> values) {
    this.values = values;
  }

  /**
   * Create a row from the supplied values.
   *
   * @param values
   *          slot values in schema order, {@code null} allowed
   * @return a new immutable row
   */
  public static StorageRow of(Object... values) {
    Objects.requireNonNull(values, "values");
    return new StorageRow(Collections.unmodifiableList(Arrays.asList(values.clone())));
  }

  /**
   * Create a row from the supplied values.
   *
   * @param values
   *          slot values in schema order, {@code null} allowed
   * @return a new immutable row
   */
  public static StorageRow of(List<?> values) {
    Objects.requireNonNull(values, "values");
    return new StorageRow(Collections.unmodifiableList(new ArrayList<>(values)));
  }

  /**
   * Get the value at the supplied position.
   *
   * @param index
   *          0-based slot index
   * @return the value, or {@code null} for an empty slot
   */
  public Object get(int index) {
    return values.get(index);
  }

  /**
   * Check whether a slot is empty.
   *
   * @param index
   *          0-based slot index
   * @return {@code true} when the slot holds {@code null}
   */
  public boolean isNullAt(int index) {
    return values.get(index) == null;
  }

  /**
   * The number of slots in the row.
   *
   * @return the row length
   */
  public int size() {
    return values.size();
  }

  /**
   * All slot values in order.
   *
   * @return an unmodifiable list that may contain {@code null} elements
   */
  public List<Object> values() {
    return values;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof StorageRow other)) {
      return false;
    }
    return values.equals(other.values);
  }

  @Override
  public int hashCode() {
    return values.hashCode();
  }

  @Override
  public String toString() {
    return "StorageRow" + values;
  }
}
