package se.alipsa.jrecmap.engine;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import se.alipsa.jrecmap.UnsupportedColumnNameException;

/**
 * Utility methods for column names returned by the storage engine.
 *
 * <p>
 * Computed and aggregate columns come back double quoted, e.g. {@code "COUNT(DEPT)"}. Such names are turned into
 * plain identifiers of the form {@code COUNT-DEPT}. Any other quoted name is rejected since stripping the quotes
 * could make it collide with an unquoted column.
 * </p>
 */
public final class ColumnNames {

  private static final Pattern FUNCTION_CALL = Pattern.compile("(\\w+)\\((.+)\\)");

  private ColumnNames() {
  }

  /**
   * Split a raw column name into its quoted or unquoted part.
   *
   * @param columnName
   *          the raw column name (may be {@code null})
   * @return the parsed name, or {@code null} when {@code columnName} is {@code null}
   */
  public static ParsedColumnName parse(String columnName) {
    if (columnName == null) {
      return null;
    }
    if (isQuoted(columnName)) {
      return new ParsedColumnName(columnName, null, columnName.substring(1, columnName.length() - 1));
    }
    return new ParsedColumnName(columnName, columnName, null);
  }

  /**
   * Turn a raw column name into a plain identifier.
   *
   * @param columnName
   *          the raw column name (may be {@code null})
   * @return the unquoted name unchanged, {@code WORD-ARGS} for a quoted {@code WORD(ARGS)}, or {@code null} for
   *         {@code null} input
   * @throws UnsupportedColumnNameException
   *           if the name is quoted but not shaped like a function call
   */
  public static String normalize(String columnName) {
    ParsedColumnName parsed = parse(columnName);
    if (parsed == null) {
      return null;
    }
    if (parsed.unquoted() != null) {
      return parsed.unquoted();
    }
    return aggregateName(parsed).orElseThrow(() -> new UnsupportedColumnNameException(columnName));
  }

  /**
   * Normalize a quoted aggregate name without failing on other names.
   *
   * @param columnName
   *          the raw column name (may be {@code null})
   * @return the normalized name when {@code columnName} is a quoted aggregate such as {@code "COUNT(DEPT)"},
   *         otherwise an empty optional
   */
  public static Optional<String> normalizeAggregate(String columnName) {
    ParsedColumnName parsed = parse(columnName);
    return parsed == null ? Optional.empty() : aggregateName(parsed);
  }

  private static Optional<String> aggregateName(ParsedColumnName parsed) {
    if (!parsed.isQuoted()) {
      return Optional.empty();
    }
    Matcher matcher = FUNCTION_CALL.matcher(parsed.quoted());
    if (matcher.matches()) {
      return Optional.of(matcher.group(1) + "-" + matcher.group(2));
    }
    return Optional.empty();
  }

  private static boolean isQuoted(String name) {
    return name.length() >= 2 && name.charAt(0) == '"' && name.charAt(name.length() - 1) == '"';
  }

  /**
   * A raw column name split by quoting. Exactly one of {@code unquoted} and {@code quoted} is set.
   *
   * @param columnName
   *          the raw column name
   * @param unquoted
   *          the name itself when it is not quoted, otherwise {@code null}
   * @param quoted
   *          the text between the quotes when it is quoted, otherwise {@code null}
   */
  public record ParsedColumnName(String columnName, String unquoted, String quoted) {

    /**
     * Check whether the name was quoted.
     *
     * @return {@code true} for a quoted name
     */
    public boolean isQuoted() {
      return quoted != null;
    }
  }
}
