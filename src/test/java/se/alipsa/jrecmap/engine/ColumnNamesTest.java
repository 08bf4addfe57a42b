package se.alipsa.jrecmap.engine;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import org.junit.jupiter.api.Test;
import se.alipsa.jrecmap.UnsupportedColumnNameException;

/** Unit tests for {@link ColumnNames}. */
class ColumnNamesTest {

  @Test
  void parsesUnquotedName() {
    ColumnNames.ParsedColumnName parsed = ColumnNames.parse("DEPT");
    assertEquals("DEPT", parsed.columnName());
    assertEquals("DEPT", parsed.unquoted());
    assertNull(parsed.quoted());
    assertFalse(parsed.isQuoted());
  }

  @Test
  void parsesQuotedAggregateName() {
    ColumnNames.ParsedColumnName parsed = ColumnNames.parse("\"COUNT(DEPT)\"");
    assertEquals("\"COUNT(DEPT)\"", parsed.columnName());
    assertNull(parsed.unquoted());
    assertEquals("COUNT(DEPT)", parsed.quoted());
    assertTrue(parsed.isQuoted());
  }

  @Test
  void parsesQuotedPlainName() {
    ColumnNames.ParsedColumnName parsed = ColumnNames.parse("\"DEPT\"");
    assertNull(parsed.unquoted());
    assertEquals("DEPT", parsed.quoted());
  }

  @Test
  void parsesNullAndEmpty() {
    assertNull(ColumnNames.parse(null));
    ColumnNames.ParsedColumnName empty = ColumnNames.parse("");
    assertEquals("", empty.columnName());
    assertEquals("", empty.unquoted());
    assertNull(empty.quoted());
  }

  @Test
  void singleQuoteCharacterIsNotQuoted() {
    assertEquals("\"", ColumnNames.parse("\"").unquoted());
    assertEquals("\"", ColumnNames.normalize("\""));
  }

  @Test
  void unquotedNamesPassThrough() {
    for (String name : List.of("DEPT", "EMPLOYEE_ID", "SIMPLE", "mixedCase", "a1")) {
      assertEquals(name, ColumnNames.normalize(name));
    }
  }

  @Test
  void normalizesAggregateNames() {
    assertEquals("COUNT-DEPT", ColumnNames.normalize("\"COUNT(DEPT)\""));
    assertEquals("AVG-SALARY", ColumnNames.normalize("\"AVG(SALARY)\""));
    assertEquals("SUM-AMOUNT", ColumnNames.normalize("\"SUM(AMOUNT)\""));
    assertEquals("MAX-DATE", ColumnNames.normalize("\"MAX(DATE)\""));
    assertEquals("MIN-ID", ColumnNames.normalize("\"MIN(ID)\""));
    assertEquals("STDDEV-X1", ColumnNames.normalize("\"STDDEV(X1)\""));
  }

  @Test
  void rejectsQuotedPlainNames() {
    UnsupportedColumnNameException e = assertThrows(UnsupportedColumnNameException.class,
        () -> ColumnNames.normalize("\"DEPT\""));
    assertTrue(e.getMessage().contains("Quoted column names are not supported"));
    assertEquals("\"DEPT\"", e.getColumnName());
    assertThrows(UnsupportedColumnNameException.class, () -> ColumnNames.normalize("\"EMPLOYEE_NAME\""));
  }

  @Test
  void rejectsMalformedAggregates() {
    assertThrows(UnsupportedColumnNameException.class, () -> ColumnNames.normalize("\"COUNT\""));
    assertThrows(UnsupportedColumnNameException.class, () -> ColumnNames.normalize("\"COUNT()\""));
    assertThrows(UnsupportedColumnNameException.class, () -> ColumnNames.normalize("\"\""));
  }

  @Test
  void nullAndEmptyNormalizeToThemselves() {
    assertNull(ColumnNames.normalize(null));
    assertEquals("", ColumnNames.normalize(""));
  }
}
