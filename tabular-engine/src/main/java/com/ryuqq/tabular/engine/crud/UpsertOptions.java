package com.ryuqq.tabular.engine.crud;

/**
 * upsert 정책 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>forceInsert: 일치하는 행이 있어도 항상 insert</li>
 *   <li>failOnMulti: 일치하는 행이 2개 이상이면 update 대신 MultiplicityException</li>
 *   <li>forbidUpdatePath: 일치하는 행이 있으면 InsertTargetExistsException (insert 전용 호출)</li>
 *   <li>requireUpdate: 일치하는 행이 없으면 NotFoundException (update 전용 호출)</li>
 * </ul>
 *
 * <p>기본값은 모두 false 입니다 (존재하면 모든 일치 행 update, 없으면 insert).</p>
 *
 * @author Tabular Team
 * @since 1.0.0
 * @param forceInsert 항상 insert
 * @param failOnMulti 다건 일치 시 실패
 * @param forbidUpdatePath 존재 시 실패
 * @param requireUpdate 부재 시 실패
 */
public record UpsertOptions(boolean forceInsert, boolean failOnMulti, boolean forbidUpdatePath, boolean requireUpdate) {

    /**
     * 기본 설정 생성자.
     */
    public UpsertOptions() {
        this(false, false, false, false);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException forceInsert와 requireUpdate를 동시에 지정한 경우
     */
    public UpsertOptions {
        if (forceInsert && requireUpdate) {
            throw new IllegalArgumentException("forceInsert and requireUpdate cannot both be set");
        }
    }

    public UpsertOptions withForceInsert(boolean forceInsert) {
        return new UpsertOptions(forceInsert, this.failOnMulti, this.forbidUpdatePath, this.requireUpdate);
    }

    public UpsertOptions withFailOnMulti(boolean failOnMulti) {
        return new UpsertOptions(this.forceInsert, failOnMulti, this.forbidUpdatePath, this.requireUpdate);
    }

    public UpsertOptions withForbidUpdatePath(boolean forbidUpdatePath) {
        return new UpsertOptions(this.forceInsert, this.failOnMulti, forbidUpdatePath, this.requireUpdate);
    }

    public UpsertOptions withRequireUpdate(boolean requireUpdate) {
        return new UpsertOptions(this.forceInsert, this.failOnMulti, this.forbidUpdatePath, requireUpdate);
    }
}
