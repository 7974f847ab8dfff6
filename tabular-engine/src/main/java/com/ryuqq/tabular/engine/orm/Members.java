package com.ryuqq.tabular.engine.orm;

import com.ryuqq.tabular.core.model.TableSchema;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 레코드 멤버 값 저장소 (2단 구성).
 *
 * <p><strong>구성:</strong></p>
 * <ul>
 *   <li>known: 스키마에 있는 컬럼, 항상 canonical column order로 나열</li>
 *   <li>extras: 스키마에 없는 이름, 선언 순서로 나열</li>
 * </ul>
 *
 * <p>OBJECT_ID와 geometry는 여기에 두지 않습니다 ({@link RecordMapper}가 별도 관리).
 * 선언된 멤버만 읽기/쓰기에 참여하며, 값이 설정되지 않은 멤버는 null 입니다.</p>
 *
 * @author Tabular Team
 * @since 1.0.0
 */
public final class Members {

    private final TableSchema schema;
    private final Map<String, Object> known;
    private final Map<String, Object> extras;

    Members(TableSchema schema) {
        this.schema = schema;
        this.known = new HashMap<>();
        this.extras = new LinkedHashMap<>();
    }

    public boolean isDeclared(String name) {
        return known.containsKey(name) || extras.containsKey(name);
    }

    public boolean isKnown(String name) {
        return schema.contains(name);
    }

    void declare(String name) {
        if (!isDeclared(name)) {
            set(name, null);
        }
    }

    void set(String name, Object value) {
        if (schema.contains(name)) {
            known.put(name, value);
        } else {
            extras.put(name, value);
        }
    }

    public Object get(String name) {
        return known.containsKey(name) ? known.get(name) : extras.get(name);
    }

    /**
     * 타입을 지정한 조회.
     *
     * @param name 멤버명
     * @param type 기대 타입
     * @param <T> 기대 타입
     * @return 값 (없으면 null)
     * @throws IllegalArgumentException 값이 기대 타입이 아닌 경우
     */
    public <T> T get(String name, Class<T> type) {
        Object value = get(name);
        if (value != null && !type.isInstance(value)) {
            throw new IllegalArgumentException(
                "Member " + name + " is " + value.getClass().getSimpleName() + ", not " + type.getSimpleName()
            );
        }
        return type.cast(value);
    }

    /**
     * 선언된 멤버명 (known은 canonical order, 이어서 extras).
     *
     * @return 멤버명 목록
     */
    public List<String> names() {
        List<String> names = new ArrayList<>();
        for (String column : schema.columnNames()) {
            if (known.containsKey(column)) {
                names.add(column);
            }
        }
        names.addAll(extras.keySet());
        return names;
    }

    /**
     * 선언된 known 멤버명 (canonical order).
     *
     * @return 멤버명 목록
     */
    public List<String> knownNames() {
        List<String> names = new ArrayList<>();
        for (String column : schema.columnNames()) {
            if (known.containsKey(column)) {
                names.add(column);
            }
        }
        return names;
    }

    public Map<String, Object> asMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        for (String name : names()) {
            map.put(name, get(name));
        }
        return map;
    }

    void clear(String name) {
        if (known.containsKey(name)) {
            known.put(name, null);
        } else if (extras.containsKey(name)) {
            extras.put(name, null);
        }
    }

    @Override
    public String toString() {
        return "Members{" + asMap() + "}";
    }
}
