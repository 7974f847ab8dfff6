package com.ryuqq.tabular.core.model;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 커서가 반환하는 한 행.
 *
 * <p>위치 기반({@link #get(int)})과 이름 기반({@link #get(String)}) 접근을 모두 지원하며,
 * Geometry는 {@link #geometry()} 전용 접근자로만 다룹니다.</p>
 *
 * <p>Update cursor에서 받은 Row는 값을 변경한 뒤 {@code updateRow(row)}로 되돌려 씁니다.</p>
 *
 * @author Tabular Team
 * @since 1.0.0
 */
public final class Row {

    private final ColumnLayout layout;
    private final Object[] values;

    /**
     * Row 생성.
     *
     * @param layout 컬럼 레이아웃
     * @param values 값 (layout 순서, 복사됨)
     * @throws IllegalArgumentException 크기가 맞지 않는 경우
     */
    public Row(ColumnLayout layout, List<?> values) {
        if (layout == null) {
            throw new IllegalArgumentException("layout cannot be null");
        }
        if (values == null || values.size() != layout.size()) {
            throw new IllegalArgumentException(
                "values must match layout size " + layout.size() + " (current: " + (values == null ? null : values.size()) + ")"
            );
        }
        this.layout = layout;
        this.values = values.toArray();
    }

    public ColumnLayout layout() {
        return layout;
    }

    public Object get(int index) {
        return values[index];
    }

    public Object get(String name) {
        return values[layout.indexOf(name)];
    }

    public void set(int index, Object value) {
        values[index] = value;
    }

    public void set(String name, Object value) {
        values[layout.indexOf(name)] = value;
    }

    /**
     * Geometry 값.
     *
     * @return geometry (레이아웃에 SHAPE@가 없거나 값이 없으면 null)
     */
    public Object geometry() {
        return layout.hasGeometry() ? values[layout.geometryIndex()] : null;
    }

    /**
     * Geometry 값 설정.
     *
     * @param geometry 새 geometry
     * @throws IllegalStateException 레이아웃에 SHAPE@가 없는 경우
     */
    public void setGeometry(Object geometry) {
        if (!layout.hasGeometry()) {
            throw new IllegalStateException("Cursor was opened without " + ColumnLayout.GEOMETRY);
        }
        values[layout.geometryIndex()] = geometry;
    }

    /**
     * 모든 값 (layout 순서, geometry 포함).
     *
     * @return 불변 값 목록 (null 포함 가능)
     */
    public List<Object> values() {
        return Collections.unmodifiableList(Arrays.asList(values.clone()));
    }

    /**
     * 이름 → 값 맵 (layout 순서, geometry 제외).
     *
     * @return 순서가 보존되는 맵
     */
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        for (int i = 0; i < values.length; i++) {
            String name = layout.names().get(i);
            if (!ColumnLayout.isGeometryToken(name)) {
                map.put(name, values[i]);
            }
        }
        return map;
    }

    @Override
    public String toString() {
        return "Row{" + toMap() + (layout.hasGeometry() ? ", geometry=" + geometry() : "") + "}";
    }
}
