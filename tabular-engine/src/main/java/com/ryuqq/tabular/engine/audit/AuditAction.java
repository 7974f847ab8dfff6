package com.ryuqq.tabular.engine.audit;

/**
 * 감사 로그 action 값.
 *
 * <p>ADD는 기록되지 않습니다 (새 행 자체가 이력).</p>
 *
 * @author Tabular Team
 * @since 1.0.0
 */
public enum AuditAction {

    ADD("add"),
    UPDATE("update"),
    DELETE("delete");

    private final String value;

    AuditAction(String value) {
        this.value = value;
    }

    /**
     * shadow 테이블 action 컬럼에 기록되는 값.
     *
     * @return 소문자 action 이름
     */
    public String value() {
        return value;
    }

    public boolean isPersisted() {
        return this != ADD;
    }
}
