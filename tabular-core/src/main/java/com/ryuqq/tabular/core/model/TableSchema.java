package com.ryuqq.tabular.core.model;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * 테이블 스키마 (불변 record).
 *
 * <p>컬럼 목록의 순서가 곧 canonical column order이며, 커서와 레코드 멤버는
 * 모두 이 순서를 기준으로 정렬됩니다.</p>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>OBJECT_ID 컬럼은 정확히 1개</li>
 *   <li>GEOMETRY 컬럼은 최대 1개</li>
 *   <li>컬럼명 중복 불가 (대소문자 구분)</li>
 * </ul>
 *
 * @author Tabular Team
 * @since 1.0.0
 * @param name 테이블명
 * @param columns 컬럼 목록 (canonical order)
 */
public record TableSchema(String name, List<Column> columns) {

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 불변식 위반 시
     */
    public TableSchema {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Table name cannot be null or blank");
        }
        if (columns == null || columns.isEmpty()) {
            throw new IllegalArgumentException("columns cannot be null or empty (table: " + name + ")");
        }
        columns = List.copyOf(columns);

        Set<String> seen = new HashSet<>();
        int idCount = 0;
        int geometryCount = 0;
        for (Column column : columns) {
            if (!seen.add(column.name())) {
                throw new IllegalArgumentException("Duplicate column " + column.name() + " in table " + name);
            }
            if (column.type() == ColumnType.OBJECT_ID) {
                idCount++;
            }
            if (column.type() == ColumnType.GEOMETRY) {
                geometryCount++;
            }
        }
        if (idCount != 1) {
            throw new IllegalArgumentException(
                "Table " + name + " must have exactly one OBJECT_ID column (current: " + idCount + ")"
            );
        }
        if (geometryCount > 1) {
            throw new IllegalArgumentException("Table " + name + " has more than one GEOMETRY column");
        }
    }

    /**
     * 컬럼 가변 인자 팩토리.
     *
     * @param name 테이블명
     * @param columns 컬럼들
     * @return TableSchema
     */
    public static TableSchema of(String name, Column... columns) {
        return new TableSchema(name, List.of(columns));
    }

    /**
     * 대리 기본 키 컬럼명.
     *
     * @return OBJECT_ID 컬럼명
     */
    public String idColumn() {
        for (Column column : columns) {
            if (column.type() == ColumnType.OBJECT_ID) {
                return column.name();
            }
        }
        throw new IllegalStateException("unreachable: validated in constructor");
    }

    /**
     * Geometry 컬럼명.
     *
     * @return Geometry 컬럼명 (없으면 empty)
     */
    public Optional<String> geometryColumn() {
        return columns.stream()
            .filter(c -> c.type() == ColumnType.GEOMETRY)
            .map(Column::name)
            .findFirst();
    }

    /**
     * 컬럼 조회 (대소문자 구분).
     *
     * @param columnName 컬럼명
     * @return 컬럼 (없으면 empty)
     */
    public Optional<Column> column(String columnName) {
        return columns.stream().filter(c -> c.name().equals(columnName)).findFirst();
    }

    /**
     * 컬럼 존재 여부 (대소문자 구분).
     *
     * @param columnName 컬럼명
     * @return 존재하면 true
     */
    public boolean contains(String columnName) {
        return column(columnName).isPresent();
    }

    /**
     * 컬럼 존재 여부 (대소문자 무시).
     *
     * @param columnName 컬럼명
     * @return 존재하면 true
     */
    public boolean containsIgnoreCase(String columnName) {
        return columns.stream().anyMatch(c -> c.name().equalsIgnoreCase(columnName));
    }

    /**
     * 모든 컬럼명 (canonical order).
     *
     * @return 컬럼명 목록
     */
    public List<String> columnNames() {
        List<String> names = new ArrayList<>(columns.size());
        for (Column column : columns) {
            names.add(column.name());
        }
        return names;
    }

    /**
     * 일반 데이터 컬럼명 (OBJECT_ID, GEOMETRY 제외, canonical order).
     *
     * @return 데이터 컬럼명 목록
     */
    public List<String> dataColumnNames() {
        List<String> names = new ArrayList<>();
        for (Column column : columns) {
            if (column.type() != ColumnType.OBJECT_ID && column.type() != ColumnType.GEOMETRY) {
                names.add(column.name());
            }
        }
        return names;
    }

    /**
     * 쓰기 가능한 컬럼명 (canonical order).
     *
     * @return editable 컬럼명 목록
     */
    public List<String> editableColumnNames() {
        List<String> names = new ArrayList<>();
        for (Column column : columns) {
            if (column.editable()) {
                names.add(column.name());
            }
        }
        return names;
    }

    /**
     * 컬럼명을 바꾼 새 스키마 (createLike 용).
     *
     * @param newName 새 테이블명
     * @param additional 뒤에 추가할 컬럼들
     * @return 새 TableSchema
     */
    public TableSchema copyAs(String newName, List<Column> additional) {
        List<Column> copied = new ArrayList<>(columns);
        if (additional != null) {
            copied.addAll(additional);
        }
        return new TableSchema(newName, copied);
    }
}
