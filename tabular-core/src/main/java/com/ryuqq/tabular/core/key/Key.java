package com.ryuqq.tabular.core.key;

import java.util.List;

/**
 * 레코드 식별 방식.
 *
 * <p><strong>구현체:</strong></p>
 * <ul>
 *   <li>{@link PrimaryKey}: 저장소가 생성한 대리 키 컬럼 하나</li>
 *   <li>{@link CompositeKey}: 비즈니스 컬럼들의 순서 있는 조합 (유일성은 런타임에 검사)</li>
 * </ul>
 *
 * @author Tabular Team
 * @since 1.0.0
 */
public sealed interface Key permits PrimaryKey, CompositeKey {

    /**
     * 키를 구성하는 컬럼명 (순서 보존).
     *
     * @return 컬럼명 목록
     */
    List<String> columns();
}
