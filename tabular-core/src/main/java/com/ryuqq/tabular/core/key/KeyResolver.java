package com.ryuqq.tabular.core.key;

import com.ryuqq.tabular.core.exception.IdentityException;
import com.ryuqq.tabular.core.model.TableSchema;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * 키 명세 해석 및 식별값 존재 여부 판단.
 *
 * <p><strong>해석 규칙:</strong></p>
 * <ul>
 *   <li>빈 목록 또는 [OBJECT_ID 컬럼] → {@link PrimaryKey}</li>
 *   <li>그 외 → {@link CompositeKey} (모든 컬럼이 스키마에 존재해야 함)</li>
 * </ul>
 *
 * <p>컬럼명 비교는 대소문자를 구분합니다.</p>
 *
 * @author Tabular Team
 * @since 1.0.0
 */
public final class KeyResolver {

    // Utility class - prevent instantiation
    private KeyResolver() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 키 명세를 해석.
     *
     * @param schema 대상 테이블 스키마
     * @param columns 키 컬럼명 (null 또는 빈 목록이면 기본 키)
     * @return 해석된 Key
     * @throws IllegalArgumentException schema가 null인 경우
     * @throws IdentityException 스키마에 없는 컬럼이 포함된 경우
     */
    public static Key resolve(TableSchema schema, List<String> columns) {
        if (schema == null) {
            throw new IllegalArgumentException("schema cannot be null");
        }
        if (columns == null || columns.isEmpty()) {
            return new PrimaryKey(schema.idColumn());
        }
        if (columns.size() == 1 && columns.get(0).equals(schema.idColumn())) {
            return new PrimaryKey(schema.idColumn());
        }

        List<String> missing = new ArrayList<>();
        for (String column : columns) {
            if (!schema.contains(column)) {
                missing.add(column);
            }
        }
        if (!missing.isEmpty()) {
            throw new IdentityException(
                "Composite key columns " + missing + " do not exist in table " + schema.name()
                    + ". Column names are case sensitive."
            );
        }
        return new CompositeKey(columns);
    }

    /**
     * 기본 키 값이 있는지 확인.
     *
     * @param schema 테이블 스키마
     * @param values 컬럼명 → 값
     * @return OBJECT_ID 값이 null이 아니면 true
     */
    public static boolean hasPrimaryValue(TableSchema schema, Map<String, ?> values) {
        return values != null && values.get(schema.idColumn()) != null;
    }

    /**
     * 복합 키 값이 하나라도 있는지 확인.
     *
     * <p>부분 키도 식별값으로 인정됩니다 (이후 조회에서 다건이면 실패).</p>
     *
     * @param key 키 (PrimaryKey면 항상 false)
     * @param values 컬럼명 → 값
     * @return 하나 이상의 키 컬럼 값이 null이 아니면 true
     */
    public static boolean hasCompositeValue(Key key, Map<String, ?> values) {
        if (!(key instanceof CompositeKey) || values == null) {
            return false;
        }
        for (String column : key.columns()) {
            if (values.get(column) != null) {
                return true;
            }
        }
        return false;
    }
}
