package se.alipsa.jrecmap.engine;

import java.util.List;
import java.util.Objects;
import se.alipsa.jrecmap.model.ColumnReference;
import se.alipsa.jrecmap.model.SchemaDescriptor;
import se.alipsa.jrecmap.model.StorageRow;

/**
 * {@link RemoteTable} implementation backed by an in-memory list of {@link StorageRow} instances. Used for record
 * tables that have been created in a session but not saved.
 */
public final class InMemoryTable implements RemoteTable {

  private final String name;
  private final SchemaDescriptor schema;
  private final List<StorageRow> rows;

  /**
   * Create a new table holding the supplied rows.
   *
   * @param name
   *          the table name
   * @param schema
   *          the schema describing the rows
   * @param rows
   *          the rows, each of which must fit {@code schema}
   * @throws IllegalArgumentException
   *           if a row does not fit the schema
   */
  public InMemoryTable(String name, SchemaDescriptor schema, List<StorageRow> rows) {
    this.name = Objects.requireNonNull(name, "name");
    this.schema = Objects.requireNonNull(schema, "schema");
    this.rows = List.copyOf(Objects.requireNonNull(rows, "rows"));
    for (StorageRow row : this.rows) {
      schema.validate(row);
    }
  }

  @Override
  public String name() {
    return name;
  }

  @Override
  public SchemaDescriptor schema() {
    return schema;
  }

  @Override
  public ColumnReference column(String storageName) {
    int index = schema.indexOf(storageName);
    if (index < 0) {
      throw new IllegalArgumentException("No column " + storageName + " in table " + name);
    }
    return ColumnReference.of(name, schema, index);
  }

  @Override
  public List<StorageRow> rows() {
    return rows;
  }

  @Override
  public long count() {
    return rows.size();
  }

  @Override
  public String toString() {
    return "InMemoryTable[" + name + ", " + schema.names() + ", rows=" + rows.size() + "]";
  }
}
