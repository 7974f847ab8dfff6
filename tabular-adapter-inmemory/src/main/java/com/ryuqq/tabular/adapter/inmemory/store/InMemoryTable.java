package com.ryuqq.tabular.adapter.inmemory.store;

import com.ryuqq.tabular.core.model.TableSchema;

import java.util.Map;
import java.util.TreeMap;

/**
 * Rows of one in-memory table, keyed by OBJECT_ID in ascending order.
 *
 * <p>Each row is an {@code Object[]} in schema column order. Not thread-safe on its own;
 * {@link InMemoryTabularStore} guards every access.</p>
 */
final class InMemoryTable {

    final TableSchema schema;
    final TreeMap<Long, Object[]> rows;
    final int idIndex;
    long lastId;

    InMemoryTable(TableSchema schema) {
        this.schema = schema;
        this.rows = new TreeMap<>();
        this.idIndex = schema.columnNames().indexOf(schema.idColumn());
        this.lastId = 0;
    }

    private InMemoryTable(InMemoryTable source) {
        this.schema = source.schema;
        this.rows = new TreeMap<>();
        for (Map.Entry<Long, Object[]> entry : source.rows.entrySet()) {
            rows.put(entry.getKey(), entry.getValue().clone());
        }
        this.idIndex = source.idIndex;
        this.lastId = source.lastId;
    }

    InMemoryTable copy() {
        return new InMemoryTable(this);
    }

    int indexOf(String column) {
        return schema.columnNames().indexOf(column);
    }

    Object valueOf(Object[] row, String column) {
        int index = indexOf(column);
        return index < 0 ? null : row[index];
    }
}
