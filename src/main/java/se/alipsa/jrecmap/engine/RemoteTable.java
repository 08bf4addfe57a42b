package se.alipsa.jrecmap.engine;

import java.util.List;
import se.alipsa.jrecmap.model.ColumnReference;
import se.alipsa.jrecmap.model.SchemaDescriptor;
import se.alipsa.jrecmap.model.StorageRow;

/**
 * A table held by the storage engine. Every call reflects the current state of the table; implementations do not
 * cache the schema between calls.
 */
public interface RemoteTable {

  /**
   * The table name.
   *
   * @return the name of the table
   */
  String name();

  /**
   * Read the current schema of the table.
   *
   * @return the table schema
   */
  SchemaDescriptor schema();

  /**
   * Get a reference to a column of the table.
   *
   * @param storageName
   *          the raw storage name of the column
   * @return a reference to the column
   * @throws IllegalArgumentException
   *           if the table has no column with that name
   */
  ColumnReference column(String storageName);

  /**
   * Read all rows of the table.
   *
   * @return the rows in storage order
   */
  List<StorageRow> rows();

  /**
   * Count the rows of the table.
   *
   * @return the number of rows
   */
  long count();
}
