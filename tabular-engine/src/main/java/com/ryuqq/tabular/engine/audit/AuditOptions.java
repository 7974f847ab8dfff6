package com.ryuqq.tabular.engine.audit;

/**
 * 감사 로그 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>createShadowTable: shadow 테이블이 없으면 첫 기록 시 생성 (기본 true)</li>
 *   <li>actionColumnLength: 생성 시 action 컬럼 길이 (기본 16)</li>
 * </ul>
 *
 * @author Tabular Team
 * @since 1.0.0
 * @param createShadowTable shadow 테이블 자동 생성 여부
 * @param actionColumnLength action 컬럼 길이 (6 이상)
 */
public record AuditOptions(boolean createShadowTable, int actionColumnLength) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: createShadowTable=true, actionColumnLength=16</p>
     */
    public AuditOptions() {
        this(true, 16);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException actionColumnLength가 "update"/"delete"를 담지 못하는 경우
     */
    public AuditOptions {
        if (actionColumnLength < 6) {
            throw new IllegalArgumentException(
                "actionColumnLength must be at least 6 (current: " + actionColumnLength + ")"
            );
        }
    }

    public AuditOptions withCreateShadowTable(boolean createShadowTable) {
        return new AuditOptions(createShadowTable, this.actionColumnLength);
    }

    public AuditOptions withActionColumnLength(int actionColumnLength) {
        return new AuditOptions(this.createShadowTable, actionColumnLength);
    }
}
