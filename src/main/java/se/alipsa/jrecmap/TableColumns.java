package se.alipsa.jrecmap;

import java.util.AbstractMap;
import java.util.AbstractSet;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.BiFunction;
import java.util.function.Function;
import se.alipsa.jrecmap.engine.ColumnNames;
import se.alipsa.jrecmap.engine.RemoteTable;
import se.alipsa.jrecmap.model.ColumnReference;
import se.alipsa.jrecmap.model.SchemaDescriptor;

/**
 * Read-only view of the columns of a {@link RemoteTable}, keyed by application keys.
 *
 * <p>
 * Columns can be looked up by calling the view as a {@link Function} ({@code columns.apply("name")}) or through
 * {@link Map#get(Object)}; both resolve the key the same way and return {@code null} for an unknown column. Iterating
 * the view yields one entry per table column in schema order, keyed by the decoded column name. The table schema is
 * read again on every call, nothing is cached.
 * </p>
 *
 * <p>
 * Equality, hash code and string form are based on the table handle and the key mapper only, not on the columns, so
 * this class deliberately does not follow the general {@link Map#equals(Object)} contract.
 * </p>
 */
public final class TableColumns extends AbstractMap<String, ColumnReference>
    implements Function<String, ColumnReference> {

  private final RemoteTable table;
  private final KeyMapper keyMapper;

  /**
   * Create a column view of a table.
   *
   * @param table
   *          the table handle
   * @param keyMapper
   *          translates between application keys and storage names
   */
  public TableColumns(RemoteTable table, KeyMapper keyMapper) {
    this.table = Objects.requireNonNull(table, "table");
    this.keyMapper = Objects.requireNonNull(keyMapper, "keyMapper");
  }

  /**
   * The wrapped table handle.
   *
   * @return the table
   */
  public RemoteTable table() {
    return table;
  }

  /**
   * The key mapper used to resolve keys.
   *
   * @return the key mapper
   */
  public KeyMapper keyMapper() {
    return keyMapper;
  }

  /**
   * Resolve an application key to a column of the table.
   *
   * @param key
   *          the application key
   * @return the column reference, or {@code null} when the table has no such column
   */
  @Override
  public ColumnReference apply(String key) {
    return resolve(key);
  }

  @Override
  public ColumnReference get(Object key) {
    if (!(key instanceof String name)) {
      return null;
    }
    return resolve(name);
  }

  /**
   * Resolve an application key to a column of the table.
   *
   * @param key
   *          the application key
   * @return the column reference, or an empty optional when the table has no such column
   */
  public Optional<ColumnReference> find(String key) {
    return Optional.ofNullable(resolve(key));
  }

  @Override
  public boolean containsKey(Object key) {
    return get(key) != null;
  }

  @Override
  public int size() {
    return table.schema().size();
  }

  @Override
  public boolean isEmpty() {
    return size() == 0;
  }

  @Override
  public Set<Entry<String, ColumnReference>> entrySet() {
    return new EntryView(entries());
  }

  private ColumnReference resolve(String key) {
    if (key == null) {
      return null;
    }
    String storageName = keyMapper.encode(key);
    SchemaDescriptor schema = table.schema();
    for (String rawName : schema.names()) {
      if (rawName.equals(storageName)
          || ColumnNames.normalizeAggregate(rawName).filter(storageName::equals).isPresent()) {
        return table.column(rawName);
      }
    }
    return null;
  }

  private List<Entry<String, ColumnReference>> entries() {
    SchemaDescriptor schema = table.schema();
    List<Entry<String, ColumnReference>> entries = new ArrayList<>(schema.size());
    for (String rawName : schema.names()) {
      String key = keyMapper.decode(ColumnNames.normalize(rawName));
      entries.add(new SimpleImmutableEntry<>(key, table.column(rawName)));
    }
    return Collections.unmodifiableList(entries);
  }

  @Override
  public ColumnReference put(String key, ColumnReference value) {
    throw readOnly();
  }

  @Override
  public void putAll(Map<? extends String, ? extends ColumnReference> m) {
    throw readOnly();
  }

  @Override
  public ColumnReference remove(Object key) {
    throw readOnly();
  }

  @Override
  public boolean remove(Object key, Object value) {
    throw readOnly();
  }

  @Override
  public void clear() {
    throw readOnly();
  }

  @Override
  public ColumnReference putIfAbsent(String key, ColumnReference value) {
    throw readOnly();
  }

  @Override
  public ColumnReference replace(String key, ColumnReference value) {
    throw readOnly();
  }

  @Override
  public boolean replace(String key, ColumnReference oldValue, ColumnReference newValue) {
    throw readOnly();
  }

  @Override
  public void replaceAll(BiFunction<? super String, ? super ColumnReference, ? extends ColumnReference> function) {
    throw readOnly();
  }

  @Override
  public ColumnReference computeIfAbsent(String key,
      Function<? super String, ? extends ColumnReference> mappingFunction) {
    throw readOnly();
  }

  @Override
  public ColumnReference computeIfPresent(String key,
      BiFunction<? super String, ? super ColumnReference, ? extends ColumnReference> remappingFunction) {
    throw readOnly();
  }

  @Override
  public ColumnReference compute(String key,
      BiFunction<? super String, ? super ColumnReference, ? extends ColumnReference> remappingFunction) {
    throw readOnly();
  }

  @Override
  public ColumnReference merge(String key, ColumnReference value,
      BiFunction<? super ColumnReference, ? super ColumnReference, ? extends ColumnReference> remappingFunction) {
    throw readOnly();
  }

  private UnsupportedOperationException readOnly() {
    return new UnsupportedOperationException("The columns of table " + table.name() + " are read-only");
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof TableColumns other)) {
      return false;
    }
    return table.equals(other.table) && keyMapper.equals(other.keyMapper);
  }

  @Override
  public int hashCode() {
    return Objects.hash(table, keyMapper);
  }

  @Override
  public String toString() {
    return "TableColumns[table=" + table + ", keyMapper=" + keyMapper + "]";
  }

  /** Entry set over one snapshot of the table columns. */
  private static final class EntryView extends AbstractSet<Entry<String, ColumnReference>> {

    private final List<Entry<String, ColumnReference>> entries;

    EntryView(List<Entry<String, ColumnReference>> entries) {
      this.entries = entries;
    }

    @Override
    public Iterator<Entry<String, ColumnReference>> iterator() {
      return entries.iterator();
    }

    @Override
    public int size() {
      return entries.size();
    }
  }
}
