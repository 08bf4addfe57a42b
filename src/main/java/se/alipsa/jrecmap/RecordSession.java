package se.alipsa.jrecmap;

import java.io.Closeable;
import java.io.File;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;
import org.apache.avro.Schema;
import org.apache.hadoop.conf.Configuration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import se.alipsa.jrecmap.engine.InMemoryTable;
import se.alipsa.jrecmap.engine.ParquetTable;
import se.alipsa.jrecmap.engine.RecordConverter;
import se.alipsa.jrecmap.engine.RemoteTable;
import se.alipsa.jrecmap.engine.SchemaResolver;
import se.alipsa.jrecmap.helper.JRecMapUtil;
import se.alipsa.jrecmap.model.ColumnReference;
import se.alipsa.jrecmap.model.SchemaDescriptor;
import se.alipsa.jrecmap.model.StorageRow;

/**
 * Entry point for working with application records against a directory of Parquet tables.
 *
 * <p>
 * Example usage:
 * </p>
 *
 * <pre>
 * <code>
 *   try (RecordSession session = RecordSession.open(SessionConfig.fromUrl("jrecmap:/data"))) {
 *     RemoteTable people = session.createRecords(List.of(Map.of("id", 1, "name", "Ada")));
 *     session.saveAsTable(people, "PEOPLE");
 *     List&lt;Map&lt;String, Object&gt;&gt; records = session.collect(session.table("PEOPLE"));
 *   }
 * </code>
 * </pre>
 *
 * <p>
 * All key translation goes through the {@link KeyMapper} of the session configuration.
 * </p>
 */
public final class RecordSession implements Closeable {

  private static final Logger log = LoggerFactory.getLogger(RecordSession.class);

  /** File extension of saved tables. */
  public static final String TABLE_EXTENSION = ".parquet";

  private final SessionConfig config;
  private final Configuration conf;
  private final AtomicInteger tableCounter = new AtomicInteger();
  private volatile boolean closed = false;

  private RecordSession(SessionConfig config) {
    this.config = config;
    this.conf = new Configuration(false);
  }

  /**
   * Open a session.
   *
   * @param config
   *          the session configuration
   * @return a new session
   */
  public static RecordSession open(SessionConfig config) {
    Objects.requireNonNull(config, "config");
    log.debug("Opening session on {}", config.getBaseDir());
    return new RecordSession(config);
  }

  /**
   * The key mapper of this session.
   *
   * @return the key mapper
   */
  public KeyMapper keyMapper() {
    return config.getKeyMapper();
  }

  /**
   * The configuration of this session.
   *
   * @return the configuration
   */
  public SessionConfig config() {
    return config;
  }

  /**
   * Create a record table with a schema inferred from the first record.
   *
   * @param records
   *          the application records
   * @return the record table
   * @throws EmptyInputException
   *           if {@code records} is empty
   */
  public RemoteTable createRecords(List<? extends Map<String, ?>> records) {
    requireData(records);
    return createRecords(records, SchemaResolver.infer(records, keyMapper().encoder()));
  }

  /**
   * Create a record table with a schema derived from an Avro record schema describing the records.
   *
   * @param records
   *          the application records
   * @param recordType
   *          the Avro record schema of the application records
   * @return the record table
   * @throws EmptyInputException
   *           if {@code records} is empty
   */
  public RemoteTable createRecords(List<? extends Map<String, ?>> records, Schema recordType) {
    requireData(records);
    return createRecords(records, SchemaResolver.derive(recordType, keyMapper().encoder()));
  }

  /**
   * Create a record table with an explicit schema.
   *
   * @param records
   *          the application records
   * @param schema
   *          the table schema
   * @return the record table
   * @throws EmptyInputException
   *           if {@code records} is empty
   * @throws IllegalArgumentException
   *           if a record does not fit the schema, e.g. a required value is missing
   */
  public RemoteTable createRecords(List<? extends Map<String, ?>> records, SchemaDescriptor schema) {
    requireData(records);
    return createTable(RecordConverter.recordsToRows(records, schema, keyMapper().encoder()), schema);
  }

  /**
   * Create a table from rows that are already laid out according to {@code schema}.
   *
   * @param rows
   *          the rows
   * @param schema
   *          the table schema
   * @return the table
   * @throws IllegalArgumentException
   *           if a row does not fit the schema
   */
  public RemoteTable createTable(List<StorageRow> rows, SchemaDescriptor schema) {
    checkOpen();
    String name = "RECORDS_" + tableCounter.incrementAndGet();
    InMemoryTable table = new InMemoryTable(name, schema, rows);
    log.debug("Created table {} with {} rows", name, rows.size());
    return table;
  }

  /**
   * Open a saved table. The name is matched case-insensitively against the saved table names.
   *
   * @param name
   *          the table name
   * @return the table
   * @throws IllegalArgumentException
   *           if no such table exists
   */
  public ParquetTable table(String name) {
    checkOpen();
    File file = findTableFile(name);
    if (file == null) {
      throw new IllegalArgumentException("Table not found: " + name);
    }
    return new ParquetTable(JRecMapUtil.baseName(file.getName()), file, conf);
  }

  /**
   * Get a column view of a table keyed by application keys.
   *
   * @param table
   *          the table
   * @return the column view
   */
  public TableColumns columns(RemoteTable table) {
    checkOpen();
    return new TableColumns(table, keyMapper());
  }

  /**
   * Get a column of a table by application key.
   *
   * @param table
   *          the table
   * @param key
   *          the application key
   * @return the column, or {@code null} when the table has no such column
   */
  public ColumnReference col(RemoteTable table, String key) {
    return columns(table).apply(key);
  }

  /**
   * Read the schema of a table.
   *
   * @param table
   *          the table
   * @return the current schema
   */
  public SchemaDescriptor schema(RemoteTable table) {
    checkOpen();
    return table.schema();
  }

  /**
   * Read all rows of a table as application records.
   *
   * @param table
   *          the table
   * @return the records; values that are {@code null} in storage are absent from the records
   */
  public List<Map<String, Object>> collect(RemoteTable table) {
    checkOpen();
    return RecordConverter.rowsToRecords(table.rows(), table.schema(), keyMapper().decoder());
  }

  /**
   * Read the first rows of a table as application records.
   *
   * @param table
   *          the table
   * @param n
   *          the maximum number of records
   * @return at most {@code n} records
   * @throws IllegalArgumentException
   *           if {@code n} is negative
   */
  public List<Map<String, Object>> take(RemoteTable table, int n) {
    if (n < 0) {
      throw new IllegalArgumentException("n must not be negative: " + n);
    }
    checkOpen();
    List<StorageRow> rows = table.rows();
    List<StorageRow> first = rows.subList(0, Math.min(n, rows.size()));
    return RecordConverter.rowsToRecords(first, table.schema(), keyMapper().decoder());
  }

  /**
   * Count the rows of a table.
   *
   * @param table
   *          the table
   * @return the number of rows
   */
  public long count(RemoteTable table) {
    checkOpen();
    return table.count();
  }

  /**
   * Save a table, failing if a table with that name exists.
   *
   * @param table
   *          the table to save
   * @param name
   *          the name of the saved table
   * @return the saved table
   */
  public ParquetTable saveAsTable(RemoteTable table, String name) {
    return saveAsTable(table, name, SaveMode.ERROR_IF_EXISTS);
  }

  /**
   * Save a table as a Parquet file in the base directory.
   *
   * @param table
   *          the table to save
   * @param name
   *          the name of the saved table
   * @param mode
   *          what to do when the table exists
   * @return the saved table
   * @throws IllegalArgumentException
   *           if the name is blank, the table exists and {@code mode} is {@link SaveMode#ERROR_IF_EXISTS}, or rows are
   *           appended to a table with a different schema
   */
  public ParquetTable saveAsTable(RemoteTable table, String name, SaveMode mode) {
    Objects.requireNonNull(table, "table");
    Objects.requireNonNull(mode, "mode");
    if (name == null || name.isBlank()) {
      throw new IllegalArgumentException("Table name must not be blank");
    }
    checkOpen();
    File existing = findTableFile(name);
    if (existing == null) {
      return write(name, new File(config.getBaseDir(), name + TABLE_EXTENSION), table.schema(), table.rows());
    }
    ParquetTable current = new ParquetTable(JRecMapUtil.baseName(existing.getName()), existing, conf);
    switch (mode) {
      case ERROR_IF_EXISTS:
        throw new IllegalArgumentException("Table already exists: " + name);
      case IGNORE:
        log.debug("Table {} exists, leaving it untouched", name);
        return current;
      case APPEND:
        SchemaDescriptor schema = current.schema();
        SchemaDescriptor incoming = table.schema();
        if (!sameColumns(schema, incoming)) {
          throw new IllegalArgumentException(
              "Cannot append to " + name + ": schema " + incoming + " does not match " + schema);
        }
        List<StorageRow> rows = new ArrayList<>(current.rows());
        rows.addAll(table.rows());
        return write(current.name(), existing, schema, rows);
      case OVERWRITE:
        return write(current.name(), existing, table.schema(), table.rows());
      default:
        throw new IllegalArgumentException("Unsupported save mode: " + mode);
    }
  }

  private static boolean sameColumns(SchemaDescriptor a, SchemaDescriptor b) {
    if (a.size() != b.size()) {
      return false;
    }
    for (int i = 0; i < a.size(); i++) {
      if (!a.field(i).name().equals(b.field(i).name()) || a.field(i).type() != b.field(i).type()) {
        return false;
      }
    }
    return true;
  }

  private ParquetTable write(String name, File file, SchemaDescriptor schema, List<StorageRow> rows) {
    log.debug("Saving {} rows as table {}", rows.size(), name);
    return ParquetTable.write(name, file, schema, rows, config.getCompression(), conf);
  }

  private File findTableFile(String name) {
    if (name == null || name.isBlank()) {
      throw new IllegalArgumentException("Table name must not be blank");
    }
    String wanted = name.toLowerCase(Locale.ROOT);
    File[] files = config.getBaseDir()
        .listFiles((d, n) -> n.toLowerCase(Locale.ROOT).endsWith(TABLE_EXTENSION));
    if (files == null) {
      throw new IllegalStateException("Failed to list directory: " + config.getBaseDir());
    }
    for (File f : files) {
      if (f.isFile() && JRecMapUtil.baseName(f.getName()).toLowerCase(Locale.ROOT).equals(wanted)) {
        return f;
      }
    }
    return null;
  }

  private void requireData(List<?> records) {
    if (records == null || records.isEmpty()) {
      throw new EmptyInputException("Cannot create records from empty data");
    }
  }

  private void checkOpen() {
    if (closed) {
      throw new IllegalStateException("Session is closed");
    }
  }

  /**
   * Check whether the session has been closed.
   *
   * @return {@code true} after {@link #close()}
   */
  public boolean isClosed() {
    return closed;
  }

  @Override
  public void close() {
    if (!closed) {
      closed = true;
      log.debug("Closed session on {}", config.getBaseDir());
    }
  }
}
