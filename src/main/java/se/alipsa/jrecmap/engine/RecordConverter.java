package se.alipsa.jrecmap.engine;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import se.alipsa.jrecmap.model.Field;
import se.alipsa.jrecmap.model.ScalarType;
import se.alipsa.jrecmap.model.SchemaDescriptor;
import se.alipsa.jrecmap.model.StorageRow;

/**
 * Converts application records to schema positioned storage rows and back.
 *
 * <p>
 * An optional value that is absent in a record becomes a {@code null} slot in the row, and a {@code null} slot
 * becomes an absent key in the record, so a record written and read back has exactly the keys it started with.
 * </p>
 */
public final class RecordConverter {

  private RecordConverter() {
  }

  /**
   * Convert a record to a row laid out according to {@code schema}.
   *
   * <p>
   * Keys are matched to fields by comparing the encoded key and the field name case-insensitively. Keys without a
   * matching field are ignored and fields without a matching key get a {@code null} slot. Enum values are stored as
   * their name, all other values are stored as they are.
   * </p>
   *
   * @param record
   *          the application record
   * @param schema
   *          the target schema
   * @param encode
   *          application key to storage name
   * @return a row with one slot per schema field
   */
  public static StorageRow recordToRow(Map<String, ?> record, SchemaDescriptor schema,
      Function<String, String> encode) {
    Objects.requireNonNull(record, "record");
    Objects.requireNonNull(schema, "schema");
    Objects.requireNonNull(encode, "encode");
    Map<String, Object> byStorageName = new HashMap<>();
    for (Map.Entry<String, ?> entry : record.entrySet()) {
      byStorageName.put(lookupKey(encode.apply(entry.getKey())), entry.getValue());
    }
    List<Object> values = new ArrayList<>(schema.size());
    for (Field field : schema.fields()) {
      values.add(toStorageValue(byStorageName.get(lookupKey(field.name())), field.type()));
    }
    return StorageRow.of(values);
  }

  /**
   * Convert a row back to an application record. Slots holding {@code null} are left out of the result.
   *
   * @param row
   *          the storage row
   * @param schema
   *          the schema describing the row
   * @param decode
   *          storage name to application key
   * @return a new record with keys in schema order
   * @throws IllegalArgumentException
   *           if the row length differs from the schema length
   */
  public static Map<String, Object> rowToRecord(StorageRow row, SchemaDescriptor schema,
      Function<String, String> decode) {
    Objects.requireNonNull(row, "row");
    Objects.requireNonNull(schema, "schema");
    Objects.requireNonNull(decode, "decode");
    if (row.size() != schema.size()) {
      throw new IllegalArgumentException(
          "Row has " + row.size() + " values but the schema has " + schema.size() + " fields");
    }
    Map<String, Object> record = new LinkedHashMap<>();
    for (int i = 0; i < schema.size(); i++) {
      Object value = row.get(i);
      if (value != null) {
        record.put(decode.apply(schema.field(i).name()), value);
      }
    }
    return record;
  }

  /**
   * Convert records to rows, one row per record in the same order.
   *
   * @param records
   *          the application records
   * @param schema
   *          the target schema
   * @param encode
   *          application key to storage name
   * @return the rows
   */
  public static List<StorageRow> recordsToRows(List<? extends Map<String, ?>> records, SchemaDescriptor schema,
      Function<String, String> encode) {
    Objects.requireNonNull(records, "records");
    List<StorageRow> rows = new ArrayList<>(records.size());
    for (Map<String, ?> record : records) {
      rows.add(recordToRow(record, schema, encode));
    }
    return rows;
  }

  /**
   * Convert rows to records, one record per row in the same order.
   *
   * @param rows
   *          the storage rows
   * @param schema
   *          the schema describing the rows
   * @param decode
   *          storage name to application key
   * @return the records
   */
  public static List<Map<String, Object>> rowsToRecords(List<StorageRow> rows, SchemaDescriptor schema,
      Function<String, String> decode) {
    Objects.requireNonNull(rows, "rows");
    List<Map<String, Object>> records = new ArrayList<>(rows.size());
    for (StorageRow row : rows) {
      records.add(rowToRecord(row, schema, decode));
    }
    return records;
  }

  /**
   * Coerce a record value to a value the storage engine understands.
   *
   * @param value
   *          the record value (may be {@code null})
   * @param type
   *          the type of the field receiving the value
   * @return the enum name for enum constants, the string form of any other value bound for a
   *         {@link ScalarType#STRING} field, otherwise {@code value}
   */
  static Object toStorageValue(Object value, ScalarType type) {
    if (value instanceof Enum<?> constant) {
      return constant.name();
    }
    if (value != null && type == ScalarType.STRING && !(value instanceof CharSequence)) {
      return value.toString();
    }
    return value;
  }

  private static String lookupKey(String name) {
    return name == null ? null : name.toLowerCase(Locale.ROOT);
  }
}
