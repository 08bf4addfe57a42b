package se.alipsa.jrecmap.engine;

import static org.junit.jupiter.api.Assertions.*;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.sql.Date;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;
import java.util.function.Function;
import org.junit.jupiter.api.Test;
import se.alipsa.jrecmap.model.Field;
import se.alipsa.jrecmap.model.ScalarType;
import se.alipsa.jrecmap.model.SchemaDescriptor;
import se.alipsa.jrecmap.model.StorageRow;

/** Unit tests for {@link RecordConverter}. */
class RecordConverterTest {

  private static final Function<String, String> UPPER = s -> s.toUpperCase(Locale.ROOT);
  private static final Function<String, String> LOWER = s -> s.toLowerCase(Locale.ROOT);

  private enum Department {
    ENGINEERING, SALES
  }

  private static final SchemaDescriptor EMPLOYEE = SchemaDescriptor.of(new Field("ID", ScalarType.INTEGER, false),
      new Field("NAME", ScalarType.STRING, false), new Field("DEPARTMENT", ScalarType.STRING, true),
      new Field("AGE", ScalarType.INTEGER, true));

  @Test
  void placesValuesInSchemaOrder() {
    Map<String, Object> record = new LinkedHashMap<>();
    record.put("age", 42);
    record.put("name", "Ada");
    record.put("id", 7);
    record.put("department", "Engineering");

    StorageRow row = RecordConverter.recordToRow(record, EMPLOYEE, UPPER);
    assertEquals(StorageRow.of(7, "Ada", "Engineering", 42), row);
  }

  @Test
  void missingOptionalKeyBecomesNullSlot() {
    StorageRow row = RecordConverter.recordToRow(Map.of("id", 1, "name", "Bob"), EMPLOYEE, UPPER);
    assertEquals(4, row.size());
    assertTrue(row.isNullAt(2));
    assertTrue(row.isNullAt(3));
  }

  @Test
  void nullSlotIsOmittedFromRecord() {
    Map<String, Object> record = RecordConverter.rowToRecord(StorageRow.of(1, "Bob", null, null), EMPLOYEE, LOWER);
    assertEquals(Map.of("id", 1, "name", "Bob"), record);
    assertFalse(record.containsKey("age"));
    assertFalse(record.containsKey("department"));
  }

  @Test
  void recordKeysFollowSchemaOrder() {
    Map<String, Object> record = RecordConverter.rowToRecord(StorageRow.of(1, "Bob", "Sales", 30), EMPLOYEE, LOWER);
    assertEquals(List.of("id", "name", "department", "age"), List.copyOf(record.keySet()));
  }

  @Test
  void matchesFieldNamesCaseInsensitively() {
    // encode keeps the mixed case key as is, the field is upper case
    StorageRow row = RecordConverter.recordToRow(Map.of("Name", "Ada", "ID", 3), EMPLOYEE, Function.identity());
    assertEquals(StorageRow.of(3, "Ada", null, null), row);
  }

  @Test
  void ignoresKeysNotInSchema() {
    Map<String, Object> record = Map.of("id", 1, "name", "Ada", "salary", 100_000, "nickname", "countess");
    StorageRow row = RecordConverter.recordToRow(record, EMPLOYEE, UPPER);
    assertEquals(StorageRow.of(1, "Ada", null, null), row);
  }

  @Test
  void nullValueIsTreatedAsAbsent() {
    Map<String, Object> record = new HashMap<>();
    record.put("id", 1);
    record.put("name", "Ada");
    record.put("age", null);
    StorageRow row = RecordConverter.recordToRow(record, EMPLOYEE, UPPER);
    assertTrue(row.isNullAt(3));
    assertFalse(RecordConverter.rowToRecord(row, EMPLOYEE, LOWER).containsKey("age"));
  }

  @Test
  void enumValuesAreStoredByName() {
    StorageRow row = RecordConverter.recordToRow(Map.of("id", 1, "name", "Ada", "department", Department.SALES),
        EMPLOYEE, UPPER);
    assertEquals("SALES", row.get(2));
  }

  @Test
  void otherValuesPassThroughUnchanged() {
    BigDecimal amount = new BigDecimal("12.50");
    Date date = Date.valueOf("2024-02-03");
    assertSame(amount, RecordConverter.toStorageValue(amount, ScalarType.DECIMAL));
    assertSame(date, RecordConverter.toStorageValue(date, ScalarType.DATE));
    assertEquals(Boolean.TRUE, RecordConverter.toStorageValue(true, ScalarType.BOOLEAN));
    assertNull(RecordConverter.toStorageValue(null, ScalarType.STRING));
    assertEquals("ENGINEERING", RecordConverter.toStorageValue(Department.ENGINEERING, ScalarType.STRING));
  }

  @Test
  void stringFieldsTakeTheStringFormOfOtherValues() {
    UUID id = UUID.fromString("123e4567-e89b-12d3-a456-426614174000");
    assertEquals(id.toString(), RecordConverter.toStorageValue(id, ScalarType.STRING));
    assertEquals("x", RecordConverter.toStorageValue('x', ScalarType.STRING));
    assertEquals("12345678901234567890",
        RecordConverter.toStorageValue(new BigInteger("12345678901234567890"), ScalarType.STRING));

    SchemaDescriptor schema = SchemaResolver.infer(Map.of("ref", id), UPPER);
    StorageRow row = RecordConverter.recordToRow(Map.of("ref", id), schema, UPPER);
    schema.validate(row);
    assertEquals(StorageRow.of(id.toString()), row);
  }

  @Test
  void usesSuppliedFunctionsOnly() {
    SchemaDescriptor schema = SchemaDescriptor.of(new Field("col_id", ScalarType.INTEGER, false),
        new Field("col_name", ScalarType.STRING, true));
    Function<String, String> encode = k -> "col_" + k;
    Function<String, String> decode = n -> n.substring("col_".length());

    StorageRow row = RecordConverter.recordToRow(Map.of("id", 5, "name", "Eve"), schema, encode);
    assertEquals(StorageRow.of(5, "Eve"), row);
    assertEquals(Map.of("id", 5, "name", "Eve"), RecordConverter.rowToRecord(row, schema, decode));
  }

  @Test
  void decodeIsAppliedEvenWhenItDoesNotInvertEncode() {
    SchemaDescriptor schema = SchemaDescriptor.of(new Field("ID", ScalarType.INTEGER, false));
    Map<String, Object> record = RecordConverter.rowToRecord(StorageRow.of(9), schema, n -> "key:" + n);
    assertEquals(Map.of("key:ID", 9), record);
  }

  @Test
  void rejectsRowOfWrongLength() {
    assertThrows(IllegalArgumentException.class,
        () -> RecordConverter.rowToRecord(StorageRow.of(1, "Ada"), EMPLOYEE, LOWER));
  }

  @Test
  void batchConversionsPreserveOrder() {
    List<Map<String, Object>> records = List.of(Map.of("id", 1, "name", "Ada"),
        Map.of("id", 2, "name", "Bob", "age", 31), Map.of("id", 3, "name", "Cy", "department", "Sales"));

    List<StorageRow> rows = RecordConverter.recordsToRows(records, EMPLOYEE, UPPER);
    assertEquals(List.of(StorageRow.of(1, "Ada", null, null), StorageRow.of(2, "Bob", null, 31),
        StorageRow.of(3, "Cy", "Sales", null)), rows);

    assertEquals(records, RecordConverter.rowsToRecords(rows, EMPLOYEE, LOWER));
    assertTrue(RecordConverter.recordsToRows(List.of(), EMPLOYEE, UPPER).isEmpty());
  }

  @Test
  void recordsAreFreshCopies() {
    Map<String, Object> input = new HashMap<>(Map.of("id", 1, "name", "Ada"));
    StorageRow row = RecordConverter.recordToRow(input, EMPLOYEE, UPPER);
    input.put("name", "Changed");
    assertEquals("Ada", row.get(1));
    assertThrows(UnsupportedOperationException.class, () -> row.values().set(0, 2));
  }
}
