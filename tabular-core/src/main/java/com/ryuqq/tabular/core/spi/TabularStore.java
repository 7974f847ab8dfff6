package com.ryuqq.tabular.core.spi;

import com.ryuqq.tabular.core.filter.Filter;
import com.ryuqq.tabular.core.model.Column;
import com.ryuqq.tabular.core.model.TableSchema;

import java.util.List;

/**
 * Tabular Storage SPI: named tables of typed columns reached through cursors.
 *
 * <p>This interface is the only way the engine touches data. It provides schema
 * introspection, counting, the three cursor kinds and the handful of table-level
 * operations the audit logger needs.</p>
 *
 * <p><strong>Responsibilities:</strong></p>
 * <ul>
 *   <li>Schema introspection and row counting</li>
 *   <li>Read, update and insert cursors over a table</li>
 *   <li>Table existence, deletion and creation from a template</li>
 *   <li>Edit sessions bound to this store's workspace</li>
 * </ul>
 *
 * <p><strong>Column Lists:</strong></p>
 * <ul>
 *   <li>{@code null} or empty: every column in schema order</li>
 *   <li>{@link com.ryuqq.tabular.core.model.ColumnLayout#GEOMETRY}: the table's geometry column</li>
 *   <li>Unknown names: {@link com.ryuqq.tabular.core.exception.StoreException}</li>
 * </ul>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>The OBJECT_ID column is generated on insert, monotonically increasing</li>
 *   <li>Writes are validated against the column type, length and nullability</li>
 *   <li>Changes made while an edit operation is open are undone by {@code abortOperation()}</li>
 * </ul>
 *
 * @author Tabular Team
 * @since 1.0.0
 */
public interface TabularStore {

    /**
     * Returns the workspace this store is bound to.
     *
     * <p>The workspace is an explicit property of the store. Every edit session created
     * through {@link #newEditSession()} operates on this workspace.</p>
     *
     * @return workspace name
     */
    String workspace();

    /**
     * Returns the schema of a table.
     *
     * @param table the table name
     * @return the table schema
     * @throws IllegalArgumentException if table is null
     * @throws com.ryuqq.tabular.core.exception.StoreException if the table does not exist
     */
    TableSchema schema(String table);

    /**
     * Counts the rows matching a filter.
     *
     * @param table the table name
     * @param filter the filter ({@link Filter#all()} for every row)
     * @return number of matching rows
     * @throws com.ryuqq.tabular.core.exception.StoreException if the table or a filter column does not exist
     */
    long rowCount(String table, Filter filter);

    /**
     * Opens a read cursor.
     *
     * <p>The set of matching rows is fixed when the cursor opens.</p>
     *
     * @param table the table name
     * @param columns requested columns (null or empty for all)
     * @param filter the filter
     * @return a cursor that must be closed
     * @throws com.ryuqq.tabular.core.exception.StoreException if the table or a column does not exist
     */
    RowCursor openReadCursor(String table, List<String> columns, Filter filter);

    /**
     * Opens an update cursor.
     *
     * @param table the table name
     * @param columns requested columns (null or empty for all)
     * @param filter the filter
     * @return a cursor that must be closed
     * @throws com.ryuqq.tabular.core.exception.StoreException if the table or a column does not exist
     */
    UpdateCursor openUpdateCursor(String table, List<String> columns, Filter filter);

    /**
     * Opens an insert cursor.
     *
     * @param table the table name
     * @param columns columns supplied by each inserted row (null or empty for all editable columns)
     * @return a cursor that must be closed
     * @throws com.ryuqq.tabular.core.exception.StoreException if the table or a column does not exist
     */
    InsertCursor openInsertCursor(String table, List<String> columns);

    /**
     * Checks whether a table exists.
     *
     * @param table the table name
     * @return true if the table exists
     */
    boolean exists(String table);

    /**
     * Deletes a table and all its rows.
     *
     * @param table the table name
     * @throws com.ryuqq.tabular.core.exception.StoreException if the table does not exist
     */
    void deleteEntity(String table);

    /**
     * Creates an empty table with the template's columns followed by additional columns.
     *
     * @param template the template table name
     * @param newName the new table name
     * @param additionalColumns columns appended after the template's (may be empty)
     * @return the schema of the created table
     * @throws com.ryuqq.tabular.core.exception.StoreException if the template is missing or newName exists
     */
    TableSchema createLike(String template, String newName, List<Column> additionalColumns);

    /**
     * Creates a new, closed edit session on this store's workspace.
     *
     * @return a new edit session
     */
    EditSession newEditSession();
}
