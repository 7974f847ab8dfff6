package com.ryuqq.tabular.core.key;

import java.util.HashSet;
import java.util.List;

/**
 * 복합 비즈니스 키.
 *
 * <p>컬럼 순서가 보존되며 불변입니다. 저장소가 유일성을 보장하지 않으므로
 * 중복 행은 조회 시점에 {@code MultiplicityException}으로 드러납니다.</p>
 *
 * @author Tabular Team
 * @since 1.0.0
 * @param columns 키 컬럼명 (1개 이상, 중복 불가)
 */
public record CompositeKey(List<String> columns) implements Key {

    public CompositeKey {
        if (columns == null || columns.isEmpty()) {
            throw new IllegalArgumentException("CompositeKey columns cannot be null or empty");
        }
        columns = List.copyOf(columns);
        if (new HashSet<>(columns).size() != columns.size()) {
            throw new IllegalArgumentException("CompositeKey columns must be distinct: " + columns);
        }
    }

    public static CompositeKey of(String... columns) {
        return new CompositeKey(List.of(columns));
    }
}
