package com.ryuqq.tabular.core.key;

import java.util.List;

/**
 * 대리 기본 키.
 *
 * @author Tabular Team
 * @since 1.0.0
 * @param column OBJECT_ID 컬럼명
 */
public record PrimaryKey(String column) implements Key {

    public PrimaryKey {
        if (column == null || column.isBlank()) {
            throw new IllegalArgumentException("PrimaryKey column cannot be null or blank");
        }
    }

    @Override
    public List<String> columns() {
        return List.of(column);
    }
}
