package se.alipsa.jrecmap.engine;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.nio.ByteBuffer;
import java.sql.Date;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import org.apache.avro.LogicalTypes;
import org.apache.avro.Schema;
import org.apache.avro.generic.GenericData;
import se.alipsa.jrecmap.model.ScalarType;

/**
 * Utility class for coercing row values to Avro values and vice versa.
 */
public final class AvroCoercions {

  private AvroCoercions() {
  }

  /**
   * Collapse nullable unions to their non-null branch, else return input.
   *
   * @param s
   *          the schema
   * @return effective schema
   */
  static Schema effectiveSchema(Schema s) {
    if (s.getType() == Schema.Type.UNION) {
      for (Schema t : s.getTypes()) {
        if (t.getType() != Schema.Type.NULL) {
          return t;
        }
      }
    }
    return s;
  }

  /**
   * Convert a row value to the representation the generic Avro writer expects for a column of the given type.
   *
   * @param value
   *          the row value (may be {@code null})
   * @param type
   *          the column type
   * @return the Avro value
   * @throws IllegalArgumentException
   *           if a decimal does not fit the decimal column scale
   */
  public static Object wrap(Object value, ScalarType type) {
    if (value == null) {
      return null;
    }
    return switch (type) {
      case INTEGER -> ((Number) value).intValue();
      case LONG -> ((Number) value).longValue();
      case DOUBLE -> ((Number) value).doubleValue();
      case DECIMAL -> decimalBytes((BigDecimal) value);
      case BOOLEAN -> value;
      case STRING -> value.toString();
      case DATE -> value instanceof LocalDate localDate ? (int) localDate.toEpochDay()
          : (int) ((Date) value).toLocalDate().toEpochDay();
      case TIMESTAMP -> epochMillis(value);
    };
  }

  private static ByteBuffer decimalBytes(BigDecimal value) {
    BigDecimal scaled;
    try {
      scaled = value.setScale(ScalarType.DECIMAL_SCALE, RoundingMode.UNNECESSARY);
    } catch (ArithmeticException e) {
      throw new IllegalArgumentException(
          "Decimal " + value + " has more than " + ScalarType.DECIMAL_SCALE + " fraction digits", e);
    }
    return ByteBuffer.wrap(scaled.unscaledValue().toByteArray());
  }

  private static long epochMillis(Object value) {
    if (value instanceof Timestamp timestamp) {
      return timestamp.getTime();
    }
    if (value instanceof Instant instant) {
      return instant.toEpochMilli();
    }
    return Timestamp.valueOf((LocalDateTime) value).getTime();
  }

  /**
   * Unwraps an Avro value read with the generic data model to the Java type used in rows. Dates and timestamps
   * come back as {@link Date} and {@link Timestamp} unless the schema carries {@link AvroRows#JAVA_TYPE_PROP}
   * naming the {@code java.time} class they were written from.
   *
   * @param v
   *          The Avro value to unwrap.
   * @param s
   *          The Avro schema for the value.
   * @return The unwrapped Java object.
   */
  public static Object unwrap(Object v, Schema s) {
    if (v == null) {
      return null;
    }
    Schema effective = effectiveSchema(s);
    String javaType = effective.getProp(AvroRows.JAVA_TYPE_PROP);
    switch (effective.getType()) {
      case STRING, ENUM:
        return v.toString();
      case INT:
        if (LogicalTypes.date().equals(effective.getLogicalType())) {
          LocalDate date = LocalDate.ofEpochDay(((Number) v).intValue());
          return LocalDate.class.getName().equals(javaType) ? date : Date.valueOf(date);
        }
        return ((Number) v).intValue();
      case LONG:
        if (effective.getLogicalType() instanceof LogicalTypes.TimestampMillis
            || effective.getLogicalType() instanceof LogicalTypes.TimestampMicros) {
          long epoch = ((Number) v).longValue();
          if (effective.getLogicalType() instanceof LogicalTypes.TimestampMicros) {
            epoch /= 1000L;
          }
          Instant instant = Instant.ofEpochMilli(epoch);
          if (Instant.class.getName().equals(javaType)) {
            return instant;
          }
          Timestamp timestamp = Timestamp.from(instant);
          return LocalDateTime.class.getName().equals(javaType) ? timestamp.toLocalDateTime() : timestamp;
        }
        return ((Number) v).longValue();
      case FLOAT, DOUBLE:
        return ((Number) v).doubleValue();
      case BYTES:
        return new BigDecimal(new BigInteger(copyBytes((ByteBuffer) v)), decimalScale(effective));
      case FIXED:
        return new BigDecimal(new BigInteger(((GenericData.Fixed) v).bytes()), decimalScale(effective));
      default:
        return v;
    }
  }

  private static int decimalScale(Schema schema) {
    if (schema.getLogicalType() instanceof LogicalTypes.Decimal dec) {
      return dec.getScale();
    }
    throw new IllegalArgumentException("Binary values are only supported as decimals, got " + schema);
  }

  /**
   * Create a copy of the bytes remaining in the supplied {@link ByteBuffer} without mutating its position.
   *
   * @param buffer
   *          source buffer
   * @return copied byte array
   */
  private static byte[] copyBytes(ByteBuffer buffer) {
    ByteBuffer duplicate = buffer.duplicate();
    byte[] bytes = new byte[duplicate.remaining()];
    duplicate.get(bytes);
    return bytes;
  }
}
