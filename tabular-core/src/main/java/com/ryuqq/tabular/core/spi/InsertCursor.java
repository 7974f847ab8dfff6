package com.ryuqq.tabular.core.spi;

import com.ryuqq.tabular.core.model.ColumnLayout;

import java.util.List;

/**
 * Cursor that appends rows to a table.
 *
 * @author Tabular Team
 * @since 1.0.0
 */
public interface InsertCursor extends AutoCloseable {

    /**
     * @return the column layout values are supplied in
     */
    ColumnLayout layout();

    /**
     * Inserts one row.
     *
     * @param values values in {@link #layout()} order
     * @return the generated OBJECT_ID of the new row
     * @throws IllegalArgumentException if the number of values does not match the layout
     * @throws com.ryuqq.tabular.core.exception.StoreException if the store rejects a value
     */
    long insertRow(List<?> values);

    @Override
    void close();
}
