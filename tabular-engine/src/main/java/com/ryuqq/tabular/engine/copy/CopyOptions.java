package com.ryuqq.tabular.engine.copy;

import java.util.List;

/**
 * 일괄 복사 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>copyGeometry: 원본 geometry도 복사 (기본 true, 양쪽 모두 geometry 컬럼이 있을 때만)</li>
 *   <li>forceInsert: 대상에 같은 행이 있어도 insert (기본 true)</li>
 *   <li>failOnExists: forceInsert가 false일 때 같은 행이 있으면 실패 (기본 true)</li>
 *   <li>expectedRowCount: 원본 일치 행 수 기대값, -1이면 검사 안 함 (기본 -1)</li>
 *   <li>destinationKey: 대상 레코드의 복합 키 (기본 없음 = OBJECT_ID)</li>
 * </ul>
 *
 * @author Tabular Team
 * @since 1.0.0
 * @param copyGeometry geometry 복사 여부
 * @param forceInsert 항상 insert
 * @param failOnExists 존재 시 실패
 * @param expectedRowCount 기대 행 수 (-1 = 무시)
 * @param destinationKey 대상 복합 키 컬럼
 */
public record CopyOptions(
    boolean copyGeometry,
    boolean forceInsert,
    boolean failOnExists,
    long expectedRowCount,
    List<String> destinationKey
) {

    /**
     * 기본 설정 생성자.
     */
    public CopyOptions() {
        this(true, true, true, -1, List.of());
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException expectedRowCount가 -1 미만인 경우
     */
    public CopyOptions {
        if (expectedRowCount < -1) {
            throw new IllegalArgumentException(
                "expectedRowCount must be -1 or a row count (current: " + expectedRowCount + ")"
            );
        }
        destinationKey = destinationKey == null ? List.of() : List.copyOf(destinationKey);
    }

    public CopyOptions withCopyGeometry(boolean copyGeometry) {
        return new CopyOptions(copyGeometry, forceInsert, failOnExists, expectedRowCount, destinationKey);
    }

    public CopyOptions withForceInsert(boolean forceInsert) {
        return new CopyOptions(copyGeometry, forceInsert, failOnExists, expectedRowCount, destinationKey);
    }

    public CopyOptions withFailOnExists(boolean failOnExists) {
        return new CopyOptions(copyGeometry, forceInsert, failOnExists, expectedRowCount, destinationKey);
    }

    public CopyOptions withExpectedRowCount(long expectedRowCount) {
        return new CopyOptions(copyGeometry, forceInsert, failOnExists, expectedRowCount, destinationKey);
    }

    public CopyOptions withDestinationKey(List<String> destinationKey) {
        return new CopyOptions(copyGeometry, forceInsert, failOnExists, expectedRowCount, destinationKey);
    }
}
