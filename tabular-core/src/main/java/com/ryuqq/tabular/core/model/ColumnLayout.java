package com.ryuqq.tabular.core.model;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 커서가 열릴 때 한 번 고정되는 컬럼명 ↔ 인덱스 변환표.
 *
 * <p>Geometry는 일반 컬럼명이 아닌 예약 토큰 {@link #GEOMETRY}로 요청합니다.
 * Row는 이 토큰 위치의 값을 {@link Row#geometry()}로만 노출합니다.</p>
 *
 * @author Tabular Team
 * @since 1.0.0
 */
public final class ColumnLayout {

    /**
     * Geometry 예약 토큰.
     */
    public static final String GEOMETRY = "SHAPE@";

    private final List<String> names;
    private final Map<String, Integer> indexes;
    private final int geometryIndex;

    private ColumnLayout(List<String> names) {
        this.names = List.copyOf(names);
        this.indexes = new HashMap<>();
        int geometry = -1;
        for (int i = 0; i < this.names.size(); i++) {
            String name = this.names.get(i);
            if (indexes.putIfAbsent(name, i) != null) {
                throw new IllegalArgumentException("Duplicate column in layout: " + name);
            }
            if (isGeometryToken(name)) {
                geometry = i;
            }
        }
        this.geometryIndex = geometry;
    }

    /**
     * ColumnLayout 생성.
     *
     * @param names 컬럼명 목록 (요청 순서)
     * @return ColumnLayout
     * @throws IllegalArgumentException names가 null이거나 중복이 있는 경우
     */
    public static ColumnLayout of(List<String> names) {
        if (names == null) {
            throw new IllegalArgumentException("names cannot be null");
        }
        return new ColumnLayout(names);
    }

    /**
     * Geometry 예약 토큰인지 확인 (대소문자 무시).
     *
     * @param name 컬럼명
     * @return 토큰이면 true
     */
    public static boolean isGeometryToken(String name) {
        return GEOMETRY.equalsIgnoreCase(name);
    }

    public List<String> names() {
        return names;
    }

    public int size() {
        return names.size();
    }

    public boolean contains(String name) {
        return indexes.containsKey(name);
    }

    public boolean hasGeometry() {
        return geometryIndex >= 0;
    }

    int geometryIndex() {
        return geometryIndex;
    }

    /**
     * 컬럼명의 위치.
     *
     * @param name 컬럼명
     * @return 인덱스
     * @throws IllegalArgumentException 레이아웃에 없는 컬럼인 경우
     */
    public int indexOf(String name) {
        Integer index = indexes.get(name);
        if (index == null) {
            throw new IllegalArgumentException("Column " + name + " is not part of this cursor: " + names);
        }
        return index;
    }

    @Override
    public String toString() {
        return "ColumnLayout{" + names + "}";
    }
}
