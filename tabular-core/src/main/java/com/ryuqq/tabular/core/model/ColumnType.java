package com.ryuqq.tabular.core.model;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Date;

/**
 * 컬럼의 저장 타입.
 *
 * <p>각 타입은 자신이 받아들일 수 있는 Java 값을 알고 있으며,
 * Store 구현체는 쓰기 시점에 {@link #accepts(Object)}로 값을 검증합니다.</p>
 *
 * <p><strong>타입 매핑:</strong></p>
 * <ul>
 *   <li>OBJECT_ID: 저장소가 생성하는 대리 키 (Long)</li>
 *   <li>INTEGER: Short, Integer, Long</li>
 *   <li>DOUBLE: 모든 Number</li>
 *   <li>TEXT: String</li>
 *   <li>DATE: LocalDate, LocalDateTime, Instant, java.util.Date</li>
 *   <li>GEOMETRY: 불투명 객체 (구성/변환은 외부 책임)</li>
 * </ul>
 *
 * @author Tabular Team
 * @since 1.0.0
 */
public enum ColumnType {

    /**
     * 대리 기본 키 (단조 증가, 수정 불가).
     */
    OBJECT_ID,

    /**
     * 정수.
     */
    INTEGER,

    /**
     * 실수.
     */
    DOUBLE,

    /**
     * 문자열 (길이 제한 가능).
     */
    TEXT,

    /**
     * 날짜/시각.
     */
    DATE,

    /**
     * Geometry (SHAPE@ 토큰으로만 접근).
     */
    GEOMETRY;

    /**
     * 값이 이 타입에 저장 가능한지 확인.
     *
     * <p>null은 타입 관점에서 항상 허용됩니다 (nullable 검증은 {@link Column} 책임).</p>
     *
     * @param value 검사할 값
     * @return 저장 가능하면 true
     */
    public boolean accepts(Object value) {
        if (value == null) {
            return true;
        }
        return switch (this) {
            case OBJECT_ID, INTEGER -> value instanceof Long || value instanceof Integer || value instanceof Short;
            case DOUBLE -> value instanceof Number;
            case TEXT -> value instanceof String;
            case DATE -> value instanceof LocalDate || value instanceof LocalDateTime
                || value instanceof Instant || value instanceof Date;
            case GEOMETRY -> true;
        };
    }
}
