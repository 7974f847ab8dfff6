package com.ryuqq.tabular.engine.orm;

import java.util.List;

/**
 * 레코드 멤버와 테이블 컬럼의 비교 결과.
 *
 * @param tableOnly 테이블에만 있는 컬럼
 * @param both 양쪽에 있는 컬럼
 * @param membersOnly 멤버에만 있는 이름 (쓰기 시 저장소가 거부)
 */
public record ColumnComparison(List<String> tableOnly, List<String> both, List<String> membersOnly) {

    public ColumnComparison {
        tableOnly = List.copyOf(tableOnly);
        both = List.copyOf(both);
        membersOnly = List.copyOf(membersOnly);
    }

    public boolean isAligned() {
        return membersOnly.isEmpty();
    }
}
