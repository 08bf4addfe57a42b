package jrecmap;

import static org.junit.jupiter.api.Assertions.*;

import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Date;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import se.alipsa.jrecmap.RecordSession;
import se.alipsa.jrecmap.SaveMode;
import se.alipsa.jrecmap.SessionConfig;
import se.alipsa.jrecmap.TableColumns;
import se.alipsa.jrecmap.engine.ParquetTable;
import se.alipsa.jrecmap.engine.RemoteTable;
import se.alipsa.jrecmap.model.Field;
import se.alipsa.jrecmap.model.ScalarType;
import se.alipsa.jrecmap.model.SchemaDescriptor;
import se.alipsa.jrecmap.model.StorageRow;

/** Saving record tables as Parquet files and reading them back. */
public class ParquetSessionTest {

  @TempDir
  Path dir;

  RecordSession session;

  @BeforeEach
  void open() {
    session = RecordSession.open(SessionConfig.fromUrl("jrecmap:" + dir.toAbsolutePath()));
  }

  @AfterEach
  void close() {
    session.close();
  }

  private static Map<String, Object> person(int id, String name, Integer age) {
    Map<String, Object> m = new LinkedHashMap<>();
    m.put("id", id);
    if (name != null) {
      m.put("name", name);
    }
    if (age != null) {
      m.put("age", age);
    }
    return m;
  }

  private static final SchemaDescriptor PEOPLE = SchemaDescriptor.of(new Field("ID", ScalarType.INTEGER, false),
      new Field("NAME", ScalarType.STRING, true), new Field("AGE", ScalarType.INTEGER, true));

  @Test
  void savedRecordsReadBackWithAbsentKeys() {
    RemoteTable people = session.createRecords(List.of(person(1, "Alice", 30), person(2, "Bob", null),
        person(3, null, 25)), PEOPLE);
    ParquetTable saved = session.saveAsTable(people, "people");

    assertTrue(Files.exists(dir.resolve("people.parquet")));
    assertEquals(PEOPLE, saved.schema());
    assertEquals(3, session.count(saved));

    List<Map<String, Object>> records = session.collect(session.table("PEOPLE"));
    assertEquals(List.of(person(1, "Alice", 30), person(2, "Bob", null), person(3, null, 25)), records);
    assertFalse(records.get(1).containsKey("age"));
    assertFalse(records.get(2).containsKey("name"));
  }

  @Test
  void takeReturnsLeadingRecords() {
    RemoteTable people = session.createRecords(List.of(person(1, "A", 1), person(2, "B", 2), person(3, "C", 3)),
        PEOPLE);
    ParquetTable saved = session.saveAsTable(people, "people");
    assertEquals(List.of(person(1, "A", 1), person(2, "B", 2)), session.take(saved, 2));
    assertEquals(3, session.take(saved, 10).size());
    assertTrue(session.take(saved, 0).isEmpty());
    assertThrows(IllegalArgumentException.class, () -> session.take(saved, -1));
  }

  @Test
  void saveModes() {
    RemoteTable first = session.createRecords(List.of(person(1, "A", null)), PEOPLE);
    RemoteTable second = session.createRecords(List.of(person(2, "B", null)), PEOPLE);
    session.saveAsTable(first, "PEOPLE");

    assertThrows(IllegalArgumentException.class, () -> session.saveAsTable(second, "people"));

    ParquetTable ignored = session.saveAsTable(second, "people", SaveMode.IGNORE);
    assertEquals(1, ignored.count());
    assertEquals("PEOPLE", ignored.name());

    ParquetTable appended = session.saveAsTable(second, "people", SaveMode.APPEND);
    assertEquals(List.of(person(1, "A", null), person(2, "B", null)), session.collect(appended));

    ParquetTable overwritten = session.saveAsTable(second, "people", SaveMode.OVERWRITE);
    assertEquals(List.of(person(2, "B", null)), session.collect(overwritten));
  }

  @Test
  void appendRequiresMatchingSchema() {
    session.saveAsTable(session.createRecords(List.of(person(1, "A", 2)), PEOPLE), "people");
    RemoteTable other = session.createRecords(List.of(Map.of("id", 1)));
    assertThrows(IllegalArgumentException.class, () -> session.saveAsTable(other, "people", SaveMode.APPEND));
  }

  @Test
  void missingTableIsReported() {
    IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> session.table("nope"));
    assertEquals("Table not found: nope", e.getMessage());
    assertThrows(IllegalArgumentException.class,
        () -> session.saveAsTable(session.createRecords(List.of(person(1, null, null)), PEOPLE), " "));
  }

  @Test
  void facadeReadsTheFileSchema() {
    ParquetTable saved = session.saveAsTable(session.createRecords(List.of(person(1, "A", 2)), PEOPLE), "people");
    TableColumns columns = session.columns(saved);
    assertEquals(3, columns.size());
    assertEquals(List.of("id", "name", "age"), List.copyOf(columns.keySet()));
    assertEquals("AGE", columns.get("age").name());
    assertEquals(2, columns.get("age").position());
    assertNull(columns.get("salary"));

    SchemaDescriptor wider = SchemaDescriptor.of(new Field("ID", ScalarType.INTEGER, false),
        new Field("NAME", ScalarType.STRING, true), new Field("AGE", ScalarType.INTEGER, true),
        new Field("SALARY", ScalarType.INTEGER, true));
    session.saveAsTable(session.createTable(List.of(StorageRow.of(1, "A", 2, 100)), wider), "people",
        SaveMode.OVERWRITE);
    assertEquals(4, columns.size());
    assertNotNull(columns.get("salary"));
  }

  @Test
  void valueTypesSurviveStorage() {
    Map<String, Object> record = new HashMap<>();
    record.put("id", 7L);
    record.put("amount", new BigDecimal("19.99"));
    record.put("ratio", 0.25d);
    record.put("active", Boolean.TRUE);
    record.put("born", Date.valueOf("1990-05-06"));
    record.put("seen", Timestamp.valueOf("2024-01-02 03:04:05"));
    ParquetTable saved = session.saveAsTable(session.createRecords(List.of(record)), "values");

    Map<String, Object> back = session.collect(saved).get(0);
    assertEquals(7L, back.get("id"));
    assertEquals(0, new BigDecimal("19.99").compareTo((BigDecimal) back.get("amount")));
    assertEquals(0.25d, back.get("ratio"));
    assertEquals(Boolean.TRUE, back.get("active"));
    assertEquals(Date.valueOf("1990-05-06"), back.get("born"));
    assertEquals(Timestamp.valueOf("2024-01-02 03:04:05"), back.get("seen"));
  }

  @Test
  void localDatesSurviveStorage() {
    Map<String, Object> record = Map.of("id", 1, "born", LocalDate.of(2024, 1, 2));
    ParquetTable saved = session.saveAsTable(session.createRecords(List.of(record)), "dates");
    List<Map<String, Object>> back = session.collect(saved);
    assertEquals(List.of(record), back);
    assertInstanceOf(LocalDate.class, back.get(0).get("born"));
  }

  @Test
  void instantsSurviveStorage() {
    Map<String, Object> record = Map.of("id", 1, "seen", Instant.parse("2024-01-02T03:04:05.678Z"));
    ParquetTable saved = session.saveAsTable(session.createRecords(List.of(record)), "instants");
    List<Map<String, Object>> back = session.collect(saved);
    assertEquals(List.of(record), back);
    assertInstanceOf(Instant.class, back.get(0).get("seen"));
  }

  @Test
  void localDateTimesSurviveStorage() {
    Map<String, Object> record = Map.of("id", 1, "logged", LocalDateTime.of(2024, 1, 2, 3, 4, 5, 678_000_000));
    ParquetTable saved = session.saveAsTable(session.createRecords(List.of(record)), "logged");
    List<Map<String, Object>> back = session.collect(saved);
    assertEquals(List.of(record), back);
    assertInstanceOf(LocalDateTime.class, back.get(0).get("logged"));

    ParquetTable appended = session.saveAsTable(session.createRecords(List.of(record)), "logged", SaveMode.APPEND);
    assertEquals(List.of(record, record), session.collect(appended));
  }

  @Test
  void closedSessionRejectsWork() {
    RemoteTable table = session.createRecords(List.of(person(1, "A", 2)), PEOPLE);
    session.close();
    assertTrue(session.isClosed());
    assertThrows(IllegalStateException.class, () -> session.collect(table));
    assertThrows(IllegalStateException.class, () -> session.table("people"));
    assertThrows(IllegalStateException.class, () -> session.saveAsTable(table, "people"));
  }
}
