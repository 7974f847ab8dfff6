package com.ryuqq.tabular.adapter.inmemory.store;

import com.ryuqq.tabular.core.exception.StoreException;
import com.ryuqq.tabular.core.filter.Filter;
import com.ryuqq.tabular.core.model.Column;
import com.ryuqq.tabular.core.model.ColumnLayout;
import com.ryuqq.tabular.core.model.ColumnType;
import com.ryuqq.tabular.core.model.Row;
import com.ryuqq.tabular.core.model.TableSchema;
import com.ryuqq.tabular.core.spi.EditSession;
import com.ryuqq.tabular.core.spi.InsertCursor;
import com.ryuqq.tabular.core.spi.RowCursor;
import com.ryuqq.tabular.core.spi.TabularStore;
import com.ryuqq.tabular.core.spi.UpdateCursor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Set;

/**
 * In-memory implementation of {@link TabularStore} SPI for testing and reference purposes.
 *
 * <p>Tables live in a {@link LinkedHashMap} keyed by name; each table keeps its rows in
 * a {@link java.util.TreeMap} keyed by OBJECT_ID so cursors iterate in insertion order.</p>
 *
 * <p><strong>Store Behaviour:</strong></p>
 * <ul>
 *   <li>OBJECT_ID generated on insert, monotonically increasing per table</li>
 *   <li>Writes validated against type, TEXT length and nullability</li>
 *   <li>Cursors fix their matching row set when opened</li>
 *   <li>Edit sessions undo writes by restoring workspace snapshots</li>
 * </ul>
 *
 * <p><strong>Test Hooks:</strong></p>
 * <ul>
 *   <li>{@link #lock(String)}: every write to the table fails as a schema lock would</li>
 *   <li>{@link #failAfterWrites(int)}: the write after the next {@code n} succeeds fails</li>
 *   <li>{@link #rows(String)}: row snapshot for assertions</li>
 * </ul>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>Snapshots cover the whole workspace, so overlapping sessions undo each other's writes</li>
 *   <li>Data lost on process restart</li>
 *   <li>Not suitable for production use</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * InMemoryTabularStore store = new InMemoryTabularStore("orders-db");
 * store.createTable(TableSchema.of("orders",
 *     Column.objectId("OBJECTID"),
 *     Column.of("orderid", ColumnType.INTEGER),
 *     Column.text("supplier", 50)));
 *
 * CrudEngine orders = new CrudEngine(store, "orders");
 * long id = orders.insert(Map.of("orderid", 993, "supplier", "Acme"));
 * </pre>
 *
 * @author Tabular Team
 * @since 1.0.0
 */
public class InMemoryTabularStore implements TabularStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryTabularStore.class);

    private final String workspace;

    /**
     * Tables by name.
     * Replaced wholesale when an edit session restores a snapshot.
     */
    private Map<String, InMemoryTable> tables;

    private final Set<String> lockedTables;

    /**
     * Remaining writes before an injected failure, -1 when disabled.
     */
    private int writesBeforeFailure;

    /**
     * Creates a store bound to the workspace {@code "memory"}.
     */
    public InMemoryTabularStore() {
        this("memory");
    }

    /**
     * Creates an empty store.
     *
     * @param workspace the workspace name
     * @throws IllegalArgumentException if workspace is null or blank
     */
    public InMemoryTabularStore(String workspace) {
        if (workspace == null || workspace.isBlank()) {
            throw new IllegalArgumentException("workspace cannot be null or blank");
        }
        this.workspace = workspace;
        this.tables = new LinkedHashMap<>();
        this.lockedTables = new HashSet<>();
        this.writesBeforeFailure = -1;
    }

    @Override
    public String workspace() {
        return workspace;
    }

    /**
     * Creates an empty table.
     *
     * @param schema the table schema
     * @throws IllegalArgumentException if schema is null
     * @throws StoreException if a table with the same name exists
     */
    public synchronized void createTable(TableSchema schema) {
        if (schema == null) {
            throw new IllegalArgumentException("schema cannot be null");
        }
        if (tables.containsKey(schema.name())) {
            throw new StoreException("Table " + schema.name() + " already exists in workspace " + workspace);
        }
        tables.put(schema.name(), new InMemoryTable(schema));
        log.debug("Created table {} in workspace {}", schema.name(), workspace);
    }

    @Override
    public synchronized TableSchema schema(String table) {
        return table(table).schema;
    }

    @Override
    public synchronized long rowCount(String table, Filter filter) {
        InMemoryTable t = table(table);
        return matchingIds(t, filter).size();
    }

    @Override
    public synchronized RowCursor openReadCursor(String table, List<String> columns, Filter filter) {
        InMemoryTable t = table(table);
        return new InMemoryCursor(t.schema.name(), layoutFor(t, columns, false), matchingIds(t, filter), false);
    }

    @Override
    public synchronized UpdateCursor openUpdateCursor(String table, List<String> columns, Filter filter) {
        InMemoryTable t = table(table);
        return new InMemoryCursor(t.schema.name(), layoutFor(t, columns, false), matchingIds(t, filter), true);
    }

    @Override
    public synchronized InsertCursor openInsertCursor(String table, List<String> columns) {
        InMemoryTable t = table(table);
        return new InMemoryInsertCursor(t.schema.name(), layoutFor(t, columns, true));
    }

    @Override
    public synchronized boolean exists(String table) {
        return table != null && tables.containsKey(table);
    }

    @Override
    public synchronized void deleteEntity(String table) {
        table(table);
        if (lockedTables.contains(table)) {
            throw new StoreException("Cannot acquire a schema lock on " + table);
        }
        tables.remove(table);
        log.debug("Deleted table {} from workspace {}", table, workspace);
    }

    @Override
    public synchronized TableSchema createLike(String template, String newName, List<Column> additionalColumns) {
        InMemoryTable source = table(template);
        if (newName == null || newName.isBlank()) {
            throw new IllegalArgumentException("newName cannot be null or blank");
        }
        if (tables.containsKey(newName)) {
            throw new StoreException("Table " + newName + " already exists in workspace " + workspace);
        }
        List<Column> extra = additionalColumns == null ? List.of() : additionalColumns;
        TableSchema schema;
        try {
            schema = source.schema.copyAs(newName, extra);
        } catch (IllegalArgumentException e) {
            throw new StoreException("Cannot create " + newName + " from " + template + ": " + e.getMessage(), e);
        }
        tables.put(newName, new InMemoryTable(schema));
        log.debug("Created table {} like {} with {} additional columns", newName, template, extra.size());
        return schema;
    }

    @Override
    public EditSession newEditSession() {
        return new InMemoryEditSession(this);
    }

    // ============================================================
    // Test hooks
    // ============================================================

    /**
     * Makes every write to the table fail with a schema-lock {@link StoreException}.
     *
     * @param table the table name
     */
    public synchronized void lock(String table) {
        lockedTables.add(table);
    }

    public synchronized void unlock(String table) {
        lockedTables.remove(table);
    }

    /**
     * Lets the next {@code writes} row writes succeed and fails the one after.
     *
     * <p>The failure is one-shot: after it fires, writes succeed again.</p>
     *
     * @param writes number of writes that still succeed (0 fails the next write)
     * @throws IllegalArgumentException if writes is negative
     */
    public synchronized void failAfterWrites(int writes) {
        if (writes < 0) {
            throw new IllegalArgumentException("writes cannot be negative (current: " + writes + ")");
        }
        this.writesBeforeFailure = writes;
    }

    /**
     * Returns a copy of every row, keyed by column name in schema order.
     *
     * @param table the table name
     * @return row snapshots in OBJECT_ID order
     */
    public synchronized List<Map<String, Object>> rows(String table) {
        InMemoryTable t = table(table);
        List<String> names = t.schema.columnNames();
        List<Map<String, Object>> result = new ArrayList<>();
        for (Object[] row : t.rows.values()) {
            Map<String, Object> map = new LinkedHashMap<>();
            for (int i = 0; i < names.size(); i++) {
                map.put(names.get(i), row[i]);
            }
            result.add(map);
        }
        return result;
    }

    /**
     * Removes every table and resets the test hooks.
     */
    public synchronized void clear() {
        tables.clear();
        lockedTables.clear();
        writesBeforeFailure = -1;
    }

    // ============================================================
    // Snapshot support for InMemoryEditSession
    // ============================================================

    synchronized Map<String, InMemoryTable> snapshot() {
        Map<String, InMemoryTable> copy = new LinkedHashMap<>();
        for (Map.Entry<String, InMemoryTable> entry : tables.entrySet()) {
            copy.put(entry.getKey(), entry.getValue().copy());
        }
        return copy;
    }

    synchronized void restore(Map<String, InMemoryTable> snapshot) {
        this.tables = snapshot;
    }

    // ============================================================
    // Internals
    // ============================================================

    private InMemoryTable table(String table) {
        if (table == null) {
            throw new IllegalArgumentException("table cannot be null");
        }
        InMemoryTable t = tables.get(table);
        if (t == null) {
            throw new StoreException("Table " + table + " does not exist in workspace " + workspace);
        }
        return t;
    }

    private List<Long> matchingIds(InMemoryTable t, Filter filter) {
        Filter effective = filter == null ? Filter.all() : filter;
        for (String column : effective.columns()) {
            if (!t.schema.contains(column)) {
                throw new StoreException(
                    "An invalid SQL statement was used: column " + column + " does not exist in " + t.schema.name()
                );
            }
        }
        List<Long> ids = new ArrayList<>();
        for (Map.Entry<Long, Object[]> entry : t.rows.entrySet()) {
            Object[] row = entry.getValue();
            boolean match;
            try {
                match = effective.matches(column -> t.valueOf(row, column));
            } catch (IllegalArgumentException e) {
                throw new StoreException("An invalid SQL statement was used: " + effective, e);
            }
            if (match) {
                ids.add(entry.getKey());
            }
        }
        return ids;
    }

    /**
     * Resolves requested column names to schema indexes.
     *
     * <p>Null or empty means every column (insert: every editable column) with the
     * geometry column exposed as {@link ColumnLayout#GEOMETRY}.</p>
     */
    private Resolved layoutFor(InMemoryTable t, List<String> columns, boolean insert) {
        List<String> names = new ArrayList<>();
        if (columns == null || columns.isEmpty()) {
            for (Column column : t.schema.columns()) {
                if (insert && !column.editable()) {
                    continue;
                }
                names.add(column.type() == ColumnType.GEOMETRY ? ColumnLayout.GEOMETRY : column.name());
            }
        } else {
            names.addAll(columns);
        }

        int[] indexes = new int[names.size()];
        for (int i = 0; i < names.size(); i++) {
            String name = names.get(i);
            String schemaName = name;
            if (ColumnLayout.isGeometryToken(name)) {
                schemaName = t.schema.geometryColumn().orElseThrow(
                    () -> new StoreException("Table " + t.schema.name() + " has no geometry column")
                );
            }
            indexes[i] = t.indexOf(schemaName);
            if (indexes[i] < 0) {
                throw new StoreException(
                    "A column was specified that does not exist: " + name + " (table " + t.schema.name()
                        + ", column names are case sensitive)"
                );
            }
        }
        ColumnLayout layout;
        try {
            layout = ColumnLayout.of(names);
        } catch (IllegalArgumentException e) {
            throw new StoreException(e.getMessage(), e);
        }
        return new Resolved(layout, indexes);
    }

    private void beforeWrite(String table) {
        if (lockedTables.contains(table)) {
            throw new StoreException("Cannot acquire a schema lock on " + table);
        }
        if (writesBeforeFailure == 0) {
            writesBeforeFailure = -1;
            throw new StoreException("Injected write failure on " + table);
        }
        if (writesBeforeFailure > 0) {
            writesBeforeFailure--;
        }
    }

    private static void check(Column column, Object value) {
        String violation = column.violation(value);
        if (violation != null) {
            throw new StoreException(violation);
        }
    }

    private synchronized Object[] readRow(String table, long id) {
        InMemoryTable t = tables.get(table);
        if (t == null) {
            return null;
        }
        Object[] row = t.rows.get(id);
        return row == null ? null : row.clone();
    }

    private synchronized void writeRow(String table, long id, Resolved resolved, Row row) {
        InMemoryTable t = table(table);
        Object[] current = t.rows.get(id);
        if (current == null) {
            throw new StoreException("Row " + id + " no longer exists in " + table);
        }
        Object[] updated = current.clone();
        for (int i = 0; i < resolved.indexes.length; i++) {
            int schemaIndex = resolved.indexes[i];
            Column column = t.schema.columns().get(schemaIndex);
            Object value = row.get(i);
            if (!column.editable()) {
                if (!Objects.equals(value, current[schemaIndex])) {
                    throw new StoreException("Column " + column.name() + " is not editable");
                }
                continue;
            }
            check(column, value);
            updated[schemaIndex] = value;
        }
        beforeWrite(table);
        t.rows.put(id, updated);
    }

    private synchronized void removeRow(String table, long id) {
        InMemoryTable t = table(table);
        beforeWrite(table);
        t.rows.remove(id);
    }

    private synchronized long appendRow(String table, Resolved resolved, List<?> values) {
        InMemoryTable t = table(table);
        Object[] row = new Object[t.schema.columns().size()];
        Set<Integer> supplied = new HashSet<>();
        for (int i = 0; i < resolved.indexes.length; i++) {
            int schemaIndex = resolved.indexes[i];
            Column column = t.schema.columns().get(schemaIndex);
            if (!column.editable()) {
                throw new StoreException("Column " + column.name() + " is not editable");
            }
            check(column, values.get(i));
            row[schemaIndex] = values.get(i);
            supplied.add(schemaIndex);
        }
        for (int i = 0; i < row.length; i++) {
            if (i != t.idIndex && !supplied.contains(i)) {
                check(t.schema.columns().get(i), null);
            }
        }
        beforeWrite(table);
        long id = ++t.lastId;
        row[t.idIndex] = id;
        t.rows.put(id, row);
        return id;
    }

    private static final class Resolved {
        final ColumnLayout layout;
        final int[] indexes;

        Resolved(ColumnLayout layout, int[] indexes) {
            this.layout = layout;
            this.indexes = indexes;
        }
    }

    /**
     * Read and update cursor over a fixed list of OBJECT_IDs.
     */
    private final class InMemoryCursor implements UpdateCursor {

        private final String table;
        private final Resolved resolved;
        private final List<Long> ids;
        private final boolean writable;
        private int position;
        private Long currentId;
        private Row pending;
        private long pendingId;
        private boolean closed;

        InMemoryCursor(String table, Resolved resolved, List<Long> ids, boolean writable) {
            this.table = table;
            this.resolved = resolved;
            this.ids = ids;
            this.writable = writable;
            this.position = 0;
        }

        @Override
        public ColumnLayout layout() {
            return resolved.layout;
        }

        @Override
        public boolean hasNext() {
            if (pending != null) {
                return true;
            }
            ensureOpen();
            while (position < ids.size()) {
                long id = ids.get(position++);
                Object[] row = readRow(table, id);
                if (row == null) {
                    continue;
                }
                List<Object> values = new ArrayList<>(resolved.indexes.length);
                for (int index : resolved.indexes) {
                    values.add(row[index]);
                }
                currentId = null;
                pending = new Row(resolved.layout, values);
                pendingId = id;
                return true;
            }
            return false;
        }

        @Override
        public Row next() {
            if (!hasNext()) {
                throw new NoSuchElementException("Cursor on " + table + " is exhausted");
            }
            Row row = pending;
            pending = null;
            currentId = pendingId;
            return row;
        }

        @Override
        public void updateRow(Row row) {
            requireWritable();
            if (row == null || row.layout() != resolved.layout) {
                throw new IllegalArgumentException("updateRow expects a row produced by this cursor");
            }
            writeRow(table, currentId, resolved, row);
        }

        @Override
        public void deleteRow() {
            requireWritable();
            removeRow(table, currentId);
            currentId = null;
        }

        private void requireWritable() {
            ensureOpen();
            if (!writable) {
                throw new UnsupportedOperationException("Read cursor cannot write");
            }
            if (currentId == null) {
                throw new IllegalStateException("Cursor on " + table + " is not positioned on a row");
            }
        }

        private void ensureOpen() {
            if (closed) {
                throw new IllegalStateException("Cursor on " + table + " is closed");
            }
        }

        @Override
        public void close() {
            closed = true;
            pending = null;
            currentId = null;
        }
    }

    private final class InMemoryInsertCursor implements InsertCursor {

        private final String table;
        private final Resolved resolved;
        private boolean closed;

        InMemoryInsertCursor(String table, Resolved resolved) {
            this.table = table;
            this.resolved = resolved;
        }

        @Override
        public ColumnLayout layout() {
            return resolved.layout;
        }

        @Override
        public long insertRow(List<?> values) {
            if (closed) {
                throw new IllegalStateException("Insert cursor on " + table + " is closed");
            }
            if (values == null || values.size() != resolved.indexes.length) {
                throw new IllegalArgumentException(
                    "Expected " + resolved.indexes.length + " values for " + resolved.layout.names()
                        + " (current: " + values + ")"
                );
            }
            return appendRow(table, resolved, values);
        }

        @Override
        public void close() {
            closed = true;
        }
    }
}
