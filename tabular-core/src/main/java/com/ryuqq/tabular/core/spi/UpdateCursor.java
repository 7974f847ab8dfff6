package com.ryuqq.tabular.core.spi;

import com.ryuqq.tabular.core.model.Row;

/**
 * Cursor that can rewrite or delete the row it is positioned on.
 *
 * @author Tabular Team
 * @since 1.0.0
 */
public interface UpdateCursor extends RowCursor {

    /**
     * Writes the values of {@code row} back to the current row.
     *
     * @param row the row returned by the last {@link #next()}, possibly modified
     * @throws IllegalStateException if the cursor is not positioned on a row
     * @throws com.ryuqq.tabular.core.exception.StoreException if the store rejects a value
     */
    void updateRow(Row row);

    /**
     * Deletes the current row.
     *
     * @throws IllegalStateException if the cursor is not positioned on a row
     * @throws com.ryuqq.tabular.core.exception.StoreException if the store refuses the delete
     */
    void deleteRow();
}
