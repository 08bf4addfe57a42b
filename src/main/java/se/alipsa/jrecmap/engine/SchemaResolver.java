package se.alipsa.jrecmap.engine;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import org.apache.avro.LogicalType;
import org.apache.avro.LogicalTypes;
import org.apache.avro.Schema;
import se.alipsa.jrecmap.EmptyInputException;
import se.alipsa.jrecmap.InvalidSchemaException;
import se.alipsa.jrecmap.UnsupportedTypeException;
import se.alipsa.jrecmap.model.Field;
import se.alipsa.jrecmap.model.ScalarType;
import se.alipsa.jrecmap.model.SchemaDescriptor;

/**
 * Produces {@link SchemaDescriptor}s either by inspecting a sample record or from an Avro record schema describing
 * the application record type. Field names are always the result of the supplied {@code encode} function.
 */
public final class SchemaResolver {

  private SchemaResolver() {
  }

  /**
   * Infer a schema from the first record of a collection.
   *
   * @param records
   *          the records to sample
   * @param encode
   *          application key to storage name
   * @return a schema where every field is nullable
   * @throws EmptyInputException
   *           if {@code records} is {@code null} or empty
   */
  public static SchemaDescriptor infer(List<? extends Map<String, ?>> records, Function<String, String> encode) {
    if (records == null || records.isEmpty()) {
      throw new EmptyInputException("Cannot infer schema from empty collection");
    }
    return infer(records.get(0), encode);
  }

  /**
   * Infer a schema from a single sample record.
   *
   * <p>
   * Fields follow the iteration order of the sample. Every field is nullable since one sample cannot show that a
   * value is always present.
   * </p>
   *
   * @param sample
   *          the sample record
   * @param encode
   *          application key to storage name
   * @return the inferred schema
   * @throws EmptyInputException
   *           if {@code sample} is {@code null}
   */
  public static SchemaDescriptor infer(Map<String, ?> sample, Function<String, String> encode) {
    Objects.requireNonNull(encode, "encode");
    if (sample == null) {
      throw new EmptyInputException("Cannot infer schema without a sample record");
    }
    List<Field> fields = new ArrayList<>(sample.size());
    for (Map.Entry<String, ?> entry : sample.entrySet()) {
      fields.add(new Field(encode.apply(entry.getKey()), inferType(entry.getValue()), true));
    }
    return SchemaDescriptor.of(fields);
  }

  /**
   * Map a runtime value to its storage type. The checks run in a fixed order and anything unrecognised, including
   * {@code null}, is stored as a string.
   *
   * @param value
   *          the value to inspect
   * @return the storage type for the value
   */
  static ScalarType inferType(Object value) {
    if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
      return ScalarType.INTEGER;
    }
    if (value instanceof Long) {
      return ScalarType.LONG;
    }
    if (value instanceof Double || value instanceof Float) {
      return ScalarType.DOUBLE;
    }
    if (value instanceof BigDecimal) {
      return ScalarType.DECIMAL;
    }
    if (value instanceof Boolean) {
      return ScalarType.BOOLEAN;
    }
    if (value instanceof java.sql.Date || value instanceof LocalDate) {
      return ScalarType.DATE;
    }
    if (value instanceof java.sql.Timestamp || value instanceof Instant || value instanceof LocalDateTime) {
      return ScalarType.TIMESTAMP;
    }
    return ScalarType.STRING;
  }

  /**
   * Derive a schema from an Avro record schema describing the application record type.
   *
   * <p>
   * A field is nullable exactly when it is optional, i.e. its type is a union with {@code null}. Field types that
   * have no scalar storage type are rejected rather than stored as strings.
   * </p>
   *
   * @param typeDescription
   *          an Avro schema of type {@link Schema.Type#RECORD}
   * @param encode
   *          application key to storage name
   * @return the derived schema
   * @throws InvalidSchemaException
   *           if the description is {@code null} or not a record schema
   * @throws UnsupportedTypeException
   *           if a field type cannot be mapped to a {@link ScalarType}
   */
  public static SchemaDescriptor derive(Schema typeDescription, Function<String, String> encode) {
    Objects.requireNonNull(encode, "encode");
    if (typeDescription == null) {
      throw new InvalidSchemaException("A type description is required");
    }
    if (typeDescription.getType() != Schema.Type.RECORD) {
      throw new InvalidSchemaException(
          "Only record schemas are supported, got " + typeDescription.getType().getName());
    }
    List<Field> fields = new ArrayList<>(typeDescription.getFields().size());
    for (Schema.Field field : typeDescription.getFields()) {
      Schema fieldSchema = field.schema();
      boolean optional = isOptional(fieldSchema);
      ScalarType type = scalarType(field.name(), nonNullBranch(field.name(), fieldSchema));
      fields.add(new Field(encode.apply(field.name()), type, optional));
    }
    return SchemaDescriptor.of(fields);
  }

  private static boolean isOptional(Schema schema) {
    if (schema.getType() == Schema.Type.NULL) {
      return true;
    }
    return schema.getType() == Schema.Type.UNION
        && schema.getTypes().stream().anyMatch(s -> s.getType() == Schema.Type.NULL);
  }

  private static Schema nonNullBranch(String fieldName, Schema schema) {
    if (schema.getType() != Schema.Type.UNION) {
      return schema;
    }
    List<Schema> branches = schema.getTypes().stream().filter(s -> s.getType() != Schema.Type.NULL).toList();
    if (branches.isEmpty()) {
      return Schema.create(Schema.Type.NULL);
    }
    if (branches.size() > 1) {
      throw new UnsupportedTypeException("Field " + fieldName + " has an unsupported union type " + schema);
    }
    return branches.get(0);
  }

  private static ScalarType scalarType(String fieldName, Schema schema) {
    LogicalType logicalType = schema.getLogicalType();
    return switch (schema.getType()) {
      case INT -> logicalType instanceof LogicalTypes.Date ? ScalarType.DATE : ScalarType.INTEGER;
      case LONG -> (logicalType instanceof LogicalTypes.TimestampMillis
          || logicalType instanceof LogicalTypes.TimestampMicros) ? ScalarType.TIMESTAMP : ScalarType.LONG;
      case FLOAT, DOUBLE -> ScalarType.DOUBLE;
      case BOOLEAN -> ScalarType.BOOLEAN;
      case STRING, ENUM, NULL -> ScalarType.STRING;
      case BYTES, FIXED -> {
        if (logicalType instanceof LogicalTypes.Decimal) {
          yield ScalarType.DECIMAL;
        }
        throw new UnsupportedTypeException("Field " + fieldName + " has an unsupported binary type");
      }
      default -> throw new UnsupportedTypeException(
          "Field " + fieldName + " has an unsupported type " + schema.getType().getName());
    };
  }
}
