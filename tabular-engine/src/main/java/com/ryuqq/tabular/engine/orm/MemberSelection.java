package com.ryuqq.tabular.engine.orm;

import java.util.EnumSet;
import java.util.Set;

/**
 * {@link RecordMapper#membersAsMap(Set, boolean, boolean)}가 포함할 멤버 그룹.
 *
 * @author Tabular Team
 * @since 1.0.0
 */
public enum MemberSelection {

    /**
     * OBJECT_ID.
     */
    PRIMARY_KEY,

    /**
     * 복합 키 컬럼.
     */
    COMPOSITE_KEY,

    /**
     * 키가 아닌 선언된 멤버.
     */
    DATA;

    public static Set<MemberSelection> all() {
        return EnumSet.allOf(MemberSelection.class);
    }
}
