package com.ryuqq.tabular.core.model;

/**
 * 테이블 컬럼 정의 (불변 record).
 *
 * <p><strong>속성:</strong></p>
 * <ul>
 *   <li>name: 컬럼명 (대소문자 구분)</li>
 *   <li>type: 저장 타입</li>
 *   <li>nullable: null 허용 여부</li>
 *   <li>editable: 사용자 쓰기 허용 여부 (OBJECT_ID는 항상 false)</li>
 *   <li>length: TEXT 최대 길이 (0이면 제한 없음)</li>
 * </ul>
 *
 * @author Tabular Team
 * @since 1.0.0
 * @param name 컬럼명
 * @param type 컬럼 타입
 * @param nullable null 허용 여부
 * @param editable 쓰기 허용 여부
 * @param length 최대 길이 (TEXT 전용, 0 = 무제한)
 */
public record Column(String name, ColumnType type, boolean nullable, boolean editable, int length) {

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public Column {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Column name cannot be null or blank");
        }
        if (type == null) {
            throw new IllegalArgumentException("Column type cannot be null (column: " + name + ")");
        }
        if (length < 0) {
            throw new IllegalArgumentException("length cannot be negative (column: " + name + ", current: " + length + ")");
        }
        if (type == ColumnType.OBJECT_ID && editable) {
            throw new IllegalArgumentException("OBJECT_ID column cannot be editable: " + name);
        }
    }

    /**
     * 대리 기본 키 컬럼 생성.
     *
     * @param name 컬럼명
     * @return OBJECT_ID 컬럼
     */
    public static Column objectId(String name) {
        return new Column(name, ColumnType.OBJECT_ID, false, false, 0);
    }

    /**
     * nullable, editable 일반 컬럼 생성.
     *
     * @param name 컬럼명
     * @param type 컬럼 타입
     * @return 컬럼
     */
    public static Column of(String name, ColumnType type) {
        return new Column(name, type, true, true, 0);
    }

    /**
     * 길이 제한이 있는 TEXT 컬럼 생성.
     *
     * @param name 컬럼명
     * @param length 최대 길이
     * @return TEXT 컬럼
     */
    public static Column text(String name, int length) {
        return new Column(name, ColumnType.TEXT, true, true, length);
    }

    /**
     * Geometry 컬럼 생성.
     *
     * @param name 컬럼명
     * @return GEOMETRY 컬럼
     */
    public static Column geometry(String name) {
        return new Column(name, ColumnType.GEOMETRY, true, true, 0);
    }

    /**
     * null 불허 사본 생성.
     *
     * @return nullable=false 인 새 Column
     */
    public Column notNull() {
        return new Column(name, type, false, editable, length);
    }

    /**
     * 읽기 전용 사본 생성.
     *
     * @return editable=false 인 새 Column
     */
    public Column readOnly() {
        return new Column(name, type, nullable, false, length);
    }

    /**
     * 값이 이 컬럼에 저장 가능한지 검사하고, 불가하면 사유를 반환.
     *
     * @param value 검사할 값
     * @return 위반 사유, 저장 가능하면 null
     */
    public String violation(Object value) {
        if (value == null) {
            return nullable ? null : "column " + name + " does not allow null";
        }
        if (!type.accepts(value)) {
            return "column " + name + " (" + type + ") cannot store " + value.getClass().getSimpleName();
        }
        if (type == ColumnType.TEXT && length > 0 && ((String) value).length() > length) {
            return "string truncation on column " + name + " (max " + length + ", got " + ((String) value).length() + ")";
        }
        return null;
    }
}
