package se.alipsa.jrecmap.model;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * The closed set of scalar column types a storage row can hold.
 */
public enum ScalarType {

  /** 32 bit integer. */
  INTEGER,
  /** 64 bit integer. */
  LONG,
  /** Double precision floating point. */
  DOUBLE,
  /** Arbitrary precision decimal stored with {@link #DECIMAL_PRECISION} and {@link #DECIMAL_SCALE}. */
  DECIMAL,
  /** Boolean. */
  BOOLEAN,
  /** Character data. */
  STRING,
  /** Calendar date without time. */
  DATE,
  /** Point in time with millisecond precision. */
  TIMESTAMP;

  /** Precision used for {@link #DECIMAL} columns. */
  public static final int DECIMAL_PRECISION = 38;

  /** Scale used for {@link #DECIMAL} columns. */
  public static final int DECIMAL_SCALE = 18;

  /**
   * Determine whether a non-null value can be stored in a column of this type.
   *
   * @param value
   *          the value to check
   * @return {@code true} when the value is {@code null} or of a Java type this column type holds
   */
  public boolean accepts(Object value) {
    if (value == null) {
      return true;
    }
    return switch (this) {
      case INTEGER -> value instanceof Integer || value instanceof Short || value instanceof Byte;
      case LONG -> value instanceof Long || value instanceof Integer || value instanceof Short
          || value instanceof Byte;
      case DOUBLE -> value instanceof Double || value instanceof Float;
      case DECIMAL -> value instanceof BigDecimal;
      case BOOLEAN -> value instanceof Boolean;
      case STRING -> value instanceof CharSequence;
      case DATE -> value instanceof java.sql.Date || value instanceof LocalDate;
      case TIMESTAMP -> value instanceof java.sql.Timestamp || value instanceof Instant
          || value instanceof LocalDateTime;
    };
  }
}
