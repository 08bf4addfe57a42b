package se.alipsa.jrecmap.engine;

import java.time.temporal.Temporal;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.apache.avro.LogicalTypes;
import org.apache.avro.Schema;
import org.apache.avro.generic.GenericData;
import org.apache.avro.generic.GenericRecord;
import se.alipsa.jrecmap.model.Field;
import se.alipsa.jrecmap.model.ScalarType;
import se.alipsa.jrecmap.model.SchemaDescriptor;
import se.alipsa.jrecmap.model.StorageRow;

/**
 * Maps schemas and rows to the Avro records that Parquet tables are written with.
 */
public final class AvroRows {

  /** Namespace of the generated Avro record schemas. */
  public static final String NAMESPACE = "se.alipsa.jrecmap";

  private static final String RECORD_NAME = "Row";

  private AvroRows() {
  }

  /**
   * Avro schema property naming the {@code java.time} class a date or timestamp column was written from, so that
   * reading it back restores the same type.
   */
  public static final String JAVA_TYPE_PROP = "jrecmap.javaType";

  /**
   * Build the Avro record schema for a row schema. Nullable fields become {@code ["null", T]} unions with a
   * {@code null} default.
   *
   * @param schema
   *          the row schema
   * @return an Avro schema of type {@link Schema.Type#RECORD}
   */
  public static Schema toAvroSchema(SchemaDescriptor schema) {
    return toAvroSchema(schema, List.of());
  }

  /**
   * Build the Avro record schema for rows about to be written. A date or timestamp column whose non-null values
   * all share one {@code java.time} class is tagged with {@link #JAVA_TYPE_PROP}.
   *
   * @param schema
   *          the row schema
   * @param rows
   *          the rows that will be written with the schema
   * @return an Avro schema of type {@link Schema.Type#RECORD}
   */
  public static Schema toAvroSchema(SchemaDescriptor schema, List<StorageRow> rows) {
    Objects.requireNonNull(schema, "schema");
    Objects.requireNonNull(rows, "rows");
    List<Schema.Field> fields = new ArrayList<>(schema.size());
    for (int i = 0; i < schema.size(); i++) {
      Field field = schema.field(i);
      Schema valueSchema = valueSchema(field.type());
      Class<?> javaType = temporalType(field.type(), i, rows);
      if (javaType != null) {
        valueSchema.addProp(JAVA_TYPE_PROP, javaType.getName());
      }
      if (field.nullable()) {
        Schema union = Schema.createUnion(Schema.create(Schema.Type.NULL), valueSchema);
        fields.add(new Schema.Field(field.name(), union, null, Schema.Field.NULL_DEFAULT_VALUE));
      } else {
        fields.add(new Schema.Field(field.name(), valueSchema));
      }
    }
    return Schema.createRecord(RECORD_NAME, null, NAMESPACE, false, fields);
  }

  private static Class<?> temporalType(ScalarType type, int index, List<StorageRow> rows) {
    if (type != ScalarType.DATE && type != ScalarType.TIMESTAMP) {
      return null;
    }
    Class<?> found = null;
    for (StorageRow row : rows) {
      Object value = row.get(index);
      if (value == null) {
        continue;
      }
      if (!(value instanceof Temporal) || (found != null && found != value.getClass())) {
        return null;
      }
      found = value.getClass();
    }
    return found;
  }

  private static Schema valueSchema(ScalarType type) {
    return switch (type) {
      case INTEGER -> Schema.create(Schema.Type.INT);
      case LONG -> Schema.create(Schema.Type.LONG);
      case DOUBLE -> Schema.create(Schema.Type.DOUBLE);
      case DECIMAL -> LogicalTypes.decimal(ScalarType.DECIMAL_PRECISION, ScalarType.DECIMAL_SCALE)
          .addToSchema(Schema.create(Schema.Type.BYTES));
      case BOOLEAN -> Schema.create(Schema.Type.BOOLEAN);
      case STRING -> Schema.create(Schema.Type.STRING);
      case DATE -> LogicalTypes.date().addToSchema(Schema.create(Schema.Type.INT));
      case TIMESTAMP -> LogicalTypes.timestampMillis().addToSchema(Schema.create(Schema.Type.LONG));
    };
  }

  /**
   * Convert a row to an Avro record.
   *
   * @param row
   *          the row, which must fit {@code schema}
   * @param schema
   *          the row schema
   * @param avroSchema
   *          the Avro schema built by {@link #toAvroSchema(SchemaDescriptor)}
   * @return a new generic record
   */
  public static GenericRecord toRecord(StorageRow row, SchemaDescriptor schema, Schema avroSchema) {
    schema.validate(row);
    GenericRecord record = new GenericData.Record(avroSchema);
    for (int i = 0; i < schema.size(); i++) {
      Field field = schema.field(i);
      record.put(field.name(), AvroCoercions.wrap(row.get(i), field.type()));
    }
    return record;
  }

  /**
   * Convert an Avro record read from storage to a row.
   *
   * @param record
   *          the Avro record
   * @param schema
   *          the row schema; every field must exist in the record schema
   * @return the row
   */
  public static StorageRow toRow(GenericRecord record, SchemaDescriptor schema) {
    Schema avroSchema = record.getSchema();
    List<Object> values = new ArrayList<>(schema.size());
    for (Field field : schema.fields()) {
      Schema.Field avroField = avroSchema.getField(field.name());
      if (avroField == null) {
        throw new IllegalArgumentException("Record has no field " + field.name());
      }
      values.add(AvroCoercions.unwrap(record.get(avroField.pos()), avroField.schema()));
    }
    return StorageRow.of(values);
  }
}
