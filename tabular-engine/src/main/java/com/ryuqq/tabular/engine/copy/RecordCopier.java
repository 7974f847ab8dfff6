package com.ryuqq.tabular.engine.copy;

import com.ryuqq.tabular.core.exception.MultiplicityException;
import com.ryuqq.tabular.core.exception.NotFoundException;
import com.ryuqq.tabular.core.filter.Filter;
import com.ryuqq.tabular.core.model.ColumnLayout;
import com.ryuqq.tabular.core.model.Row;
import com.ryuqq.tabular.core.model.TableSchema;
import com.ryuqq.tabular.core.spi.RowCursor;
import com.ryuqq.tabular.core.spi.TabularStore;
import com.ryuqq.tabular.engine.orm.MapperOptions;
import com.ryuqq.tabular.engine.orm.RecordMapper;
import com.ryuqq.tabular.engine.transaction.TransactionCoordinator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 테이블 간 일괄 행 복사.
 *
 * <p>원본에서 조건에 맞는 행을 읽어 대상 테이블에 레코드로 추가합니다.
 * 모든 추가는 대상 저장소의 edit operation 하나 안에서 실행되며, 한 행이라도 실패하면
 * 이미 복사한 행까지 모두 rollback 됩니다.</p>
 *
 * <p><strong>컬럼 매핑:</strong></p>
 * <ul>
 *   <li>fieldMapping: 원본 컬럼 → 대상 컬럼 (비어 있으면 양쪽에 같은 이름으로 있는 데이터 컬럼)</li>
 *   <li>fixedValues: 모든 대상 행에 넣을 고정 값 (매핑 값보다 우선)</li>
 * </ul>
 *
 * <p>geometry 외에 복사할 값이 모두 null인 원본 행은 경고 로그를 남기고 건너뜁니다.</p>
 *
 * @author Tabular Team
 * @since 1.0.0
 */
public class RecordCopier {

    private static final Logger log = LoggerFactory.getLogger(RecordCopier.class);

    private final TabularStore store;

    /**
     * RecordCopier 생성.
     *
     * @param store 원본과 대상이 있는 저장소
     * @throws IllegalArgumentException store가 null인 경우
     */
    public RecordCopier(TabularStore store) {
        if (store == null) {
            throw new IllegalArgumentException("store cannot be null");
        }
        this.store = store;
    }

    /**
     * 행 복사.
     *
     * @param source 원본 테이블
     * @param destination 대상 테이블
     * @param where 원본 where 절 ({@code *}는 전체)
     * @param fieldMapping 원본 컬럼 → 대상 컬럼 (null 또는 비어 있으면 같은 이름)
     * @param fixedValues 대상 컬럼 → 고정 값 (null 가능)
     * @param options 복사 설정
     * @return 복사한 행 수 (건너뛴 행 제외)
     * @throws NotFoundException 원본에 일치하는 행이 없는 경우
     * @throws MultiplicityException 일치 행 수가 expectedRowCount와 다른 경우
     */
    public int copy(String source, String destination, String where,
                    Map<String, String> fieldMapping, Map<String, ?> fixedValues, CopyOptions options) {
        if (options == null) {
            throw new IllegalArgumentException("options cannot be null");
        }
        Filter filter = Filter.parse(where);
        long matched = store.rowCount(source, filter);
        if (matched == 0) {
            throw new NotFoundException("No row in " + source + " matches " + filter + ", nothing to copy");
        }
        if (options.expectedRowCount() >= 0 && matched != options.expectedRowCount()) {
            throw new MultiplicityException(
                "Copy from " + source + " expected " + options.expectedRowCount() + " rows", matched
            );
        }

        TableSchema sourceSchema = store.schema(source);
        TableSchema destinationSchema = store.schema(destination);
        Map<String, String> mapping = resolveMapping(sourceSchema, destinationSchema, fieldMapping);
        boolean withGeometry = options.copyGeometry()
            && sourceSchema.geometryColumn().isPresent()
            && destinationSchema.geometryColumn().isPresent();

        List<Map<String, Object>> records = readSource(source, filter, mapping, withGeometry, fixedValues);

        MapperOptions mapperOptions = new MapperOptions().withEnableTransactions(false);
        TransactionCoordinator transactions = new TransactionCoordinator(store.newEditSession());
        transactions.run(() -> {
            for (Map<String, Object> values : records) {
                RecordMapper record = new RecordMapper(store, destination, options.destinationKey(), mapperOptions, values);
                record.add(false, options.forceInsert(), options.failOnExists());
            }
        }, true);

        log.info("Copied {} row(s) from {} to {} where {}", records.size(), source, destination, filter);
        return records.size();
    }

    private static Map<String, String> resolveMapping(TableSchema source, TableSchema destination,
                                                      Map<String, String> fieldMapping) {
        Map<String, String> mapping = new LinkedHashMap<>();
        if (fieldMapping == null || fieldMapping.isEmpty()) {
            for (String column : source.dataColumnNames()) {
                if (destination.contains(column) && destination.column(column).get().editable()) {
                    mapping.put(column, column);
                }
            }
        } else {
            mapping.putAll(fieldMapping);
        }
        if (mapping.isEmpty()) {
            throw new IllegalArgumentException(
                "No columns to copy from " + source.name() + " to " + destination.name()
            );
        }
        return mapping;
    }

    private List<Map<String, Object>> readSource(String source, Filter filter, Map<String, String> mapping,
                                                 boolean withGeometry, Map<String, ?> fixedValues) {
        List<String> columns = new ArrayList<>(mapping.keySet());
        if (withGeometry) {
            columns.add(ColumnLayout.GEOMETRY);
        }
        List<Map<String, Object>> records = new ArrayList<>();
        try (RowCursor cursor = store.openReadCursor(source, columns, filter)) {
            while (cursor.hasNext()) {
                Row row = cursor.next();
                Map<String, Object> values = new LinkedHashMap<>();
                for (Map.Entry<String, String> entry : mapping.entrySet()) {
                    values.put(entry.getValue(), row.get(entry.getKey()));
                }
                if (withGeometry) {
                    values.put(ColumnLayout.GEOMETRY, row.geometry());
                }
                if (fixedValues != null) {
                    values.putAll(fixedValues);
                }
                if (!hasAttributeValue(values)) {
                    log.warn("Skipping row {} of {}: every copied column is null", row.values(), source);
                    continue;
                }
                records.add(values);
            }
        }
        return records;
    }

    private static boolean hasAttributeValue(Map<String, Object> values) {
        for (Map.Entry<String, Object> entry : values.entrySet()) {
            if (entry.getValue() != null && !ColumnLayout.isGeometryToken(entry.getKey())) {
                return true;
            }
        }
        return false;
    }
}
