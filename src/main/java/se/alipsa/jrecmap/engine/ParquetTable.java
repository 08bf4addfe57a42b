package se.alipsa.jrecmap.engine;

import java.io.File;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;
import org.apache.avro.Schema;
import org.apache.avro.generic.GenericData;
import org.apache.avro.generic.GenericRecord;
import org.apache.hadoop.conf.Configuration;
import org.apache.hadoop.fs.Path;
import org.apache.parquet.avro.AvroParquetReader;
import org.apache.parquet.avro.AvroParquetWriter;
import org.apache.parquet.hadoop.ParquetFileWriter;
import org.apache.parquet.hadoop.ParquetReader;
import org.apache.parquet.hadoop.ParquetWriter;
import org.apache.parquet.hadoop.metadata.CompressionCodecName;
import org.apache.parquet.hadoop.util.HadoopInputFile;
import org.apache.parquet.hadoop.util.HadoopOutputFile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import se.alipsa.jrecmap.model.ColumnReference;
import se.alipsa.jrecmap.model.SchemaDescriptor;
import se.alipsa.jrecmap.model.StorageRow;

/**
 * {@link RemoteTable} backed by a Parquet file. The schema is read from the file footer on every call so that the
 * handle always reflects what is currently on disk.
 */
public final class ParquetTable implements RemoteTable {

  private static final Logger log = LoggerFactory.getLogger(ParquetTable.class);

  private final String name;
  private final File file;
  private final Configuration conf;

  /**
   * Create a handle for an existing Parquet file.
   *
   * @param name
   *          the table name
   * @param file
   *          the Parquet file backing the table
   * @param conf
   *          the Hadoop configuration used for reading
   */
  public ParquetTable(String name, File file, Configuration conf) {
    this.name = Objects.requireNonNull(name, "name");
    this.file = Objects.requireNonNull(file, "file");
    this.conf = Objects.requireNonNull(conf, "conf");
  }

  /**
   * Write rows to a Parquet file, replacing any existing file, and return a handle to it.
   *
   * @param name
   *          the table name
   * @param file
   *          the target file
   * @param schema
   *          the schema describing the rows
   * @param rows
   *          the rows to write
   * @param codec
   *          the compression codec
   * @param conf
   *          the Hadoop configuration
   * @return a handle to the written table
   * @throws UncheckedIOException
   *           if the file cannot be written
   */
  public static ParquetTable write(String name, File file, SchemaDescriptor schema, List<StorageRow> rows,
      CompressionCodecName codec, Configuration conf) {
    Schema avroSchema = AvroRows.toAvroSchema(schema, rows);
    Path path = new Path(file.toURI());
    try (ParquetWriter<GenericRecord> writer = AvroParquetWriter
        .<GenericRecord>builder(HadoopOutputFile.fromPath(path, conf)).withSchema(avroSchema)
        .withDataModel(GenericData.get()).withCompressionCodec(codec)
        .withWriteMode(ParquetFileWriter.Mode.OVERWRITE).build()) {
      for (StorageRow row : rows) {
        writer.write(AvroRows.toRecord(row, schema, avroSchema));
      }
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to write table " + name + " to " + file, e);
    }
    log.debug("Wrote {} rows to {}", rows.size(), file);
    return new ParquetTable(name, file, conf);
  }

  @Override
  public String name() {
    return name;
  }

  /**
   * The Parquet file backing this table.
   *
   * @return the file
   */
  public File file() {
    return file;
  }

  @Override
  public SchemaDescriptor schema() {
    try {
      Schema avroSchema = ParquetSchemas.readAvroSchema(hadoopPath(), conf);
      return SchemaResolver.derive(avroSchema, Function.identity());
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to read schema of " + file, e);
    }
  }

  @Override
  public ColumnReference column(String storageName) {
    SchemaDescriptor schema = schema();
    int index = schema.indexOf(storageName);
    if (index < 0) {
      throw new IllegalArgumentException("No column " + storageName + " in table " + name);
    }
    return ColumnReference.of(name, schema, index);
  }

  @Override
  public List<StorageRow> rows() {
    SchemaDescriptor schema = schema();
    List<StorageRow> rows = new ArrayList<>();
    try (ParquetReader<GenericRecord> reader = AvroParquetReader
        .<GenericRecord>builder(HadoopInputFile.fromPath(hadoopPath(), conf)).withDataModel(GenericData.get())
        .build()) {
      GenericRecord rec;
      while ((rec = reader.read()) != null) {
        rows.add(AvroRows.toRow(rec, schema));
      }
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to read rows of " + file, e);
    }
    return rows;
  }

  @Override
  public long count() {
    try {
      return ParquetSchemas.readRowCount(hadoopPath(), conf);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to read row count of " + file, e);
    }
  }

  private Path hadoopPath() {
    return new Path(file.toURI());
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof ParquetTable other)) {
      return false;
    }
    return name.equals(other.name) && file.getAbsoluteFile().equals(other.file.getAbsoluteFile());
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, file.getAbsoluteFile());
  }

  @Override
  public String toString() {
    return "ParquetTable[" + name + ", " + file + "]";
  }
}
