package se.alipsa.jrecmap;

/**
 * What {@link RecordSession#saveAsTable(se.alipsa.jrecmap.engine.RemoteTable, String, SaveMode)} does when the
 * target table already exists.
 */
public enum SaveMode {
  /** Fail with an {@link IllegalArgumentException}. */
  ERROR_IF_EXISTS,
  /** Replace the existing table. */
  OVERWRITE,
  /** Add the rows to the existing table, which must have the same schema. */
  APPEND,
  /** Leave the existing table untouched. */
  IGNORE
}
