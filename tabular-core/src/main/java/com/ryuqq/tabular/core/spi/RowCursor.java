package com.ryuqq.tabular.core.spi;

import com.ryuqq.tabular.core.model.ColumnLayout;
import com.ryuqq.tabular.core.model.Row;

import java.util.Iterator;

/**
 * Forward-only cursor over the rows of a table.
 *
 * <p>Cursors hold store resources and must be closed, typically with try-with-resources.</p>
 *
 * @author Tabular Team
 * @since 1.0.0
 */
public interface RowCursor extends Iterator<Row>, AutoCloseable {

    /**
     * @return the column layout fixed when the cursor was opened
     */
    ColumnLayout layout();

    /**
     * Drains the cursor and returns how many rows it produced.
     *
     * @return number of remaining rows
     */
    default long drain() {
        long count = 0;
        while (hasNext()) {
            next();
            count++;
        }
        return count;
    }

    @Override
    void close();
}
