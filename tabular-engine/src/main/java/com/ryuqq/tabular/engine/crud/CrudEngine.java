package com.ryuqq.tabular.engine.crud;

import com.ryuqq.tabular.core.exception.InsertTargetExistsException;
import com.ryuqq.tabular.core.exception.MultiplicityException;
import com.ryuqq.tabular.core.exception.NotFoundException;
import com.ryuqq.tabular.core.exception.PreconditionException;
import com.ryuqq.tabular.core.exception.SchemaMismatchException;
import com.ryuqq.tabular.core.exception.StoreException;
import com.ryuqq.tabular.core.filter.Condition;
import com.ryuqq.tabular.core.filter.Filter;
import com.ryuqq.tabular.core.model.ColumnLayout;
import com.ryuqq.tabular.core.model.Row;
import com.ryuqq.tabular.core.model.TableSchema;
import com.ryuqq.tabular.core.spi.InsertCursor;
import com.ryuqq.tabular.core.spi.RowCursor;
import com.ryuqq.tabular.core.spi.TabularStore;
import com.ryuqq.tabular.core.spi.UpdateCursor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * 테이블 하나에 대한 행 단위 CRUD.
 *
 * <p>모든 접근은 {@link TabularStore} 커서를 통해 이루어지며, 커서는 호출 안에서
 * try-with-resources로 닫힙니다. 트랜잭션은 다루지 않습니다
 * ({@link com.ryuqq.tabular.engine.transaction.TransactionCoordinator} 책임).</p>
 *
 * <p><strong>주요 동작:</strong></p>
 * <ul>
 *   <li>lookup: 단건 조회, 없으면 null 자리값, 다건이면 MultiplicityException</li>
 *   <li>upsert: 후보 키로 insert/update 결정 ({@link UpsertOptions})</li>
 *   <li>delete: 건수 확인 후 삭제, 전체 삭제는 명시적 허용 필요</li>
 * </ul>
 *
 * <p><strong>오류 변환:</strong> 쓰기 중 발생한 {@link StoreException}은
 * 진단 힌트를 담은 {@link SchemaMismatchException}으로 변환됩니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * CrudEngine orders = new CrudEngine(store, "orders");
 * Long id = orders.upsert(
 *     Map.of("orderid", 993, "supplier", "Acme"),
 *     Map.of(),
 *     new UpsertOptions());
 * </pre>
 *
 * @author Tabular Team
 * @since 1.0.0
 */
public class CrudEngine {

    private static final Logger log = LoggerFactory.getLogger(CrudEngine.class);

    static final String WRITE_FAILURE_HINT =
        "This is usually the result of incorrect column names, mismatched data types, string truncation or locking issues";

    private final TabularStore store;
    private final String table;
    private TableSchema schema;

    /**
     * CrudEngine 생성.
     *
     * @param store 저장소
     * @param table 테이블명
     * @throws IllegalArgumentException store 또는 table이 null인 경우
     */
    public CrudEngine(TabularStore store, String table) {
        if (store == null) {
            throw new IllegalArgumentException("store cannot be null");
        }
        if (table == null || table.isBlank()) {
            throw new IllegalArgumentException("table cannot be null or blank");
        }
        this.store = store;
        this.table = table;
    }

    public TabularStore store() {
        return store;
    }

    public String table() {
        return table;
    }

    /**
     * 테이블 스키마 (최초 호출 시 조회 후 캐시).
     *
     * @return 스키마
     */
    public TableSchema schema() {
        if (schema == null) {
            schema = store.schema(table);
        }
        return schema;
    }

    // ============================================================
    // 존재 확인 / 건수
    // ============================================================

    /**
     * 단일 컬럼 값으로 존재 여부 확인.
     *
     * @param column 컬럼명
     * @param value 값 (null이면 false)
     * @return 일치하는 행이 있으면 true
     */
    public boolean existsByKey(String column, Object value) {
        if (value == null) {
            return false;
        }
        return store.rowCount(table, Filter.of(Condition.eq(column, value))) > 0;
    }

    /**
     * 복합 키 값으로 존재 여부 확인.
     *
     * @param keyValues 컬럼명 → 값 (null 값은 무시)
     * @return 일치하는 행이 있으면 true, 유효한 값이 없으면 false
     */
    public boolean existsByCompositeKey(Map<String, ?> keyValues) {
        Filter filter = Filter.of(keyValues);
        if (filter.isAll()) {
            return false;
        }
        return store.rowCount(table, filter) > 0;
    }

    public long count(Filter filter) {
        return store.rowCount(table, filter);
    }

    /**
     * 커서를 끝까지 읽어 행 수를 센다.
     *
     * <p>저장소의 count 대신 실제 스캔 결과가 필요할 때 사용합니다.</p>
     *
     * @param filter 필터
     * @return 스캔된 행 수
     */
    public long scanCount(Filter filter) {
        try (RowCursor cursor = store.openReadCursor(table, List.of(schema().idColumn()), filter)) {
            return cursor.drain();
        }
    }

    // ============================================================
    // 조회
    // ============================================================

    /**
     * 단건 조회.
     *
     * @param columns 반환할 컬럼
     * @param keyValues 일치 조건 (null 값은 무시)
     * @return 컬럼 순서의 값 목록, 일치하는 행이 없으면 같은 길이의 null 목록
     * @throws MultiplicityException 2개 이상의 행이 일치한 경우
     */
    public List<Object> lookup(List<String> columns, Map<String, ?> keyValues) {
        return find(columns, keyValues)
            .orElseGet(() -> Collections.unmodifiableList(Arrays.asList(new Object[columns.size()])));
    }

    /**
     * 단건 조회 ("행 없음"과 "값이 모두 null인 행"을 구분).
     *
     * @param columns 반환할 컬럼
     * @param keyValues 일치 조건 (null 값은 무시)
     * @return 일치하는 행의 값, 없으면 empty
     * @throws MultiplicityException 2개 이상의 행이 일치한 경우
     */
    public Optional<List<Object>> find(List<String> columns, Map<String, ?> keyValues) {
        requireColumns(columns);
        Filter filter = Filter.of(keyValues);
        try (RowCursor cursor = store.openReadCursor(table, columns, filter)) {
            if (!cursor.hasNext()) {
                return Optional.empty();
            }
            Row first = cursor.next();
            if (cursor.hasNext()) {
                long matched = 1 + cursor.drain();
                throw new MultiplicityException("Lookup on " + table + " where " + filter + " expected a single row", matched);
            }
            return Optional.of(first.values());
        }
    }

    /**
     * 다건 조회.
     *
     * @param columns 반환할 컬럼
     * @param keyValues 일치 조건 (null 값은 무시, 비어 있으면 전체)
     * @return 행별 값 목록
     */
    public List<List<Object>> lookupAll(List<String> columns, Map<String, ?> keyValues) {
        requireColumns(columns);
        List<List<Object>> rows = new ArrayList<>();
        try (RowCursor cursor = store.openReadCursor(table, columns, Filter.of(keyValues))) {
            while (cursor.hasNext()) {
                rows.add(cursor.next().values());
            }
        }
        return rows;
    }

    // ============================================================
    // upsert / insert / update
    // ============================================================

    /**
     * 기본 정책으로 upsert.
     *
     * @see #upsert(Map, Map, UpsertOptions)
     */
    public Long upsert(Map<String, ?> filterValues, Map<String, ?> writeValues) {
        return upsert(filterValues, writeValues, new UpsertOptions());
    }

    /**
     * 후보 키로 insert/update를 결정.
     *
     * <p><strong>결정 순서:</strong></p>
     * <ol>
     *   <li>filterValues로 필터 생성, 존재 확인 (빈 필터는 "없음"으로 간주)</li>
     *   <li>없음 + requireUpdate → NotFoundException</li>
     *   <li>있음 + !forceInsert:
     *     <ul>
     *       <li>writeValues 비어 있음 또는 forbidUpdatePath → InsertTargetExistsException</li>
     *       <li>failOnMulti + 2건 이상 → MultiplicityException</li>
     *       <li>일치하는 모든 행에 writeValues 기록, null 반환</li>
     *     </ul>
     *   </li>
     *   <li>그 외 insert: writeValues에 없는 filterValues 키 컬럼(null 제외)을 더해 기록, 새 OBJECT_ID 반환</li>
     * </ol>
     *
     * @param filterValues 후보 키 (컬럼명 → 값, null 값은 필터에서 제외)
     * @param writeValues 기록할 값 (컬럼명 → 값)
     * @param options upsert 정책
     * @return insert 시 새 OBJECT_ID, update 시 null
     * @throws NotFoundException requireUpdate인데 일치 행이 없는 경우
     * @throws InsertTargetExistsException insert가 필요한데 일치 행이 있는 경우
     * @throws MultiplicityException failOnMulti인데 2건 이상 일치한 경우
     * @throws SchemaMismatchException 저장소가 쓰기를 거부한 경우
     */
    public Long upsert(Map<String, ?> filterValues, Map<String, ?> writeValues, UpsertOptions options) {
        if (options == null) {
            throw new IllegalArgumentException("options cannot be null");
        }
        Map<String, ?> write = writeValues == null ? Map.of() : writeValues;
        Filter filter = Filter.of(filterValues);
        long matched = filter.isAll() ? 0 : store.rowCount(table, filter);

        if (matched == 0 && options.requireUpdate()) {
            throw new NotFoundException("No row in " + table + " matches " + filter + " and an update was required");
        }

        if (matched > 0 && !options.forceInsert()) {
            if (write.isEmpty() || options.forbidUpdatePath()) {
                throw new InsertTargetExistsException(
                    "A row matching " + filter + " already exists in " + table + " and an insert was required"
                );
            }
            if (options.failOnMulti() && matched > 1) {
                throw new MultiplicityException("Upsert on " + table + " where " + filter + " expected a single row", matched);
            }
            int updated = write(filter, write);
            log.debug("Upsert updated {} row(s) in {} where {}", updated, table, filter);
            return null;
        }

        long id = insert(insertPayload(filterValues, write));
        log.debug("Upsert inserted row {} into {}", id, table);
        return id;
    }

    /**
     * 한 행 insert.
     *
     * @param values 컬럼명 → 값
     * @return 새 OBJECT_ID
     * @throws IllegalArgumentException values가 비어 있는 경우
     * @throws SchemaMismatchException 저장소가 쓰기를 거부한 경우
     */
    public long insert(Map<String, ?> values) {
        if (values == null || values.isEmpty()) {
            throw new IllegalArgumentException("Nothing to insert into " + table);
        }
        List<String> columns = new ArrayList<>(values.keySet());
        List<Object> row = new ArrayList<>(values.values());
        try (InsertCursor cursor = store.openInsertCursor(table, columns)) {
            return cursor.insertRow(row);
        } catch (StoreException e) {
            throw writeFailure("Insert into " + table + " failed", e);
        }
    }

    /**
     * 같은 컬럼 구성의 여러 행을 커서 하나로 insert.
     *
     * @param columns 컬럼명
     * @param rows 행별 값 (columns 순서)
     * @return 새 OBJECT_ID 목록 (rows 순서)
     * @throws SchemaMismatchException 저장소가 쓰기를 거부한 경우
     */
    public List<Long> insertAll(List<String> columns, List<? extends List<?>> rows) {
        requireColumns(columns);
        List<Long> ids = new ArrayList<>(rows.size());
        try (InsertCursor cursor = store.openInsertCursor(table, columns)) {
            for (List<?> row : rows) {
                ids.add(cursor.insertRow(row));
            }
        } catch (StoreException e) {
            throw writeFailure("Insert of " + rows.size() + " rows into " + table + " failed after " + ids.size(), e);
        }
        return ids;
    }

    /**
     * where 절에 일치하는 모든 행 update.
     *
     * @param where where 절 ({@code *}는 전체)
     * @param values 컬럼명 → 새 값
     * @return update된 행 수
     * @throws SchemaMismatchException 저장소가 쓰기를 거부한 경우
     */
    public int updateWhere(String where, Map<String, ?> values) {
        if (values == null || values.isEmpty()) {
            throw new IllegalArgumentException("Nothing to update in " + table);
        }
        return write(Filter.parse(where), values);
    }

    /**
     * 컬럼 값에 함수들을 차례로 적용해 다시 기록 (일괄 재계산).
     *
     * <p>각 컬럼 값 v는 {@code fn(...f2(f1(v)))}로 바뀝니다. 함수가 던진 예외는 그대로 전파됩니다.</p>
     *
     * @param columns 대상 컬럼
     * @param filter 대상 행 필터
     * @param functions 적용할 함수 (순서대로)
     * @return 기록된 행 수
     * @throws SchemaMismatchException 저장소가 쓰기를 거부한 경우
     */
    @SafeVarargs
    public final int recompute(List<String> columns, Filter filter, UnaryOperator<Object>... functions) {
        requireColumns(columns);
        int updated = 0;
        try (UpdateCursor cursor = store.openUpdateCursor(table, columns, filter)) {
            while (cursor.hasNext()) {
                Row row = cursor.next();
                for (int i = 0; i < columns.size(); i++) {
                    Object value = row.get(i);
                    for (UnaryOperator<Object> function : functions) {
                        value = function.apply(value);
                    }
                    row.set(i, value);
                }
                cursor.updateRow(row);
                updated++;
            }
        } catch (StoreException e) {
            throw writeFailure("Recompute of " + columns + " in " + table + " failed after " + updated + " rows", e);
        }
        return updated;
    }

    /**
     * 키 컬럼 값으로 새 값을 찾아 한 컬럼을 일괄 update (일치하지 않는 행은 그대로 둠).
     *
     * @param values 키 값 → 새 값
     * @param column update할 컬럼
     * @param keyColumn 키 컬럼 (null이면 OBJECT_ID)
     * @param where 대상 행 where 절 ({@code *}는 전체)
     * @return update된 행 수
     * @throws SchemaMismatchException 저장소가 쓰기를 거부한 경우
     * @see #updateFromMap(Map, String, String, String, Object)
     */
    public int updateFromMap(Map<?, ?> values, String column, String keyColumn, String where) {
        return updateFromMap(values, column, keyColumn, where, false, null);
    }

    /**
     * 키 컬럼 값으로 새 값을 찾아 한 컬럼을 일괄 update (일치하지 않는 행은 na로 기록).
     *
     * <p>update 커서 하나로 처리합니다. 정수 키는 boxed 타입과 무관하게 값으로 비교됩니다.
     * column과 keyColumn이 같으면 키 값 자체를 바꿉니다.</p>
     *
     * @param values 키 값 → 새 값
     * @param column update할 컬럼
     * @param keyColumn 키 컬럼 (null이면 OBJECT_ID)
     * @param where 대상 행 where 절 ({@code *}는 전체)
     * @param na 일치하지 않는 행에 기록할 값 (null 가능)
     * @return update된 행 수 (대상 행 전체)
     * @throws SchemaMismatchException 저장소가 쓰기를 거부한 경우
     */
    public int updateFromMap(Map<?, ?> values, String column, String keyColumn, String where, Object na) {
        return updateFromMap(values, column, keyColumn, where, true, na);
    }

    private int updateFromMap(Map<?, ?> values, String column, String keyColumn, String where,
                              boolean fillUnmatched, Object na) {
        if (values == null) {
            throw new IllegalArgumentException("values cannot be null");
        }
        if (column == null || column.isBlank()) {
            throw new IllegalArgumentException("column cannot be null or blank");
        }
        String key = keyColumn == null ? schema().idColumn() : keyColumn;
        Map<Object, Object> lookup = new HashMap<>();
        for (Map.Entry<?, ?> entry : values.entrySet()) {
            lookup.put(normalizeKey(entry.getKey()), entry.getValue());
        }
        boolean selfUpdate = key.equals(column);
        List<String> columns = selfUpdate ? List.of(key) : List.of(key, column);
        int target = selfUpdate ? 0 : 1;

        Filter filter = Filter.parse(where);
        int scanned = 0;
        int updated = 0;
        try (UpdateCursor cursor = store.openUpdateCursor(table, columns, filter)) {
            while (cursor.hasNext()) {
                Row row = cursor.next();
                scanned++;
                Object normalized = normalizeKey(row.get(0));
                if (lookup.containsKey(normalized)) {
                    row.set(target, lookup.get(normalized));
                } else if (fillUnmatched) {
                    row.set(target, na);
                } else {
                    continue;
                }
                cursor.updateRow(row);
                updated++;
            }
        } catch (StoreException e) {
            throw writeFailure("Update of " + column + " in " + table + " by " + key + " failed after " + updated + " rows", e);
        }
        if (scanned == 0) {
            log.warn("No rows in {} matched {}, nothing updated from map", table, filter);
        }
        return updated;
    }

    private static Object normalizeKey(Object key) {
        if (key instanceof Integer || key instanceof Short || key instanceof Byte) {
            return ((Number) key).longValue();
        }
        return key;
    }

    // ============================================================
    // delete
    // ============================================================

    /**
     * 키 값으로 삭제.
     *
     * @param filterValues 일치 조건 (null 값은 무시, 유효한 값이 하나 이상 필요)
     * @param failOnMulti 2건 이상 일치 시 실패
     * @param errorOnNoRows 일치 행이 없으면 실패
     * @return 삭제된 행 수
     * @throws IllegalArgumentException 유효한 조건 값이 없는 경우
     * @throws NotFoundException errorOnNoRows인데 일치 행이 없는 경우
     * @throws MultiplicityException failOnMulti인데 2건 이상 일치한 경우
     */
    public int delete(Map<String, ?> filterValues, boolean failOnMulti, boolean errorOnNoRows) {
        Filter filter = Filter.of(filterValues);
        if (filter.isAll()) {
            throw new IllegalArgumentException(
                "delete on " + table + " needs at least one non-null filter value, use deleteWhere(\"*\", true) to delete every row"
            );
        }
        long matched = store.rowCount(table, filter);
        if (matched == 0) {
            if (errorOnNoRows) {
                throw new NotFoundException("No row in " + table + " matches " + filter + ", nothing to delete");
            }
            return 0;
        }
        if (matched > 1 && failOnMulti) {
            throw new MultiplicityException("Delete on " + table + " where " + filter + " expected a single row", matched);
        }
        return deleteRows(filter);
    }

    /**
     * where 절로 삭제.
     *
     * @param where where 절 ({@code *} 또는 공백은 전체)
     * @param allowAll 전체 삭제 허용
     * @return 삭제된 행 수
     * @throws PreconditionException 전체 삭제인데 allowAll이 false인 경우
     */
    public int deleteWhere(String where, boolean allowAll) {
        Filter filter = Filter.parse(where);
        if (filter.isAll() && !allowAll) {
            throw new PreconditionException(
                "Refusing to delete every row of " + table + " without allowAll (where: " + where + ")"
            );
        }
        int deleted = deleteRows(filter);
        log.info("Deleted {} row(s) from {} where {}", deleted, table, filter);
        return deleted;
    }

    /**
     * 값 조합 목록 중 하나와 일치하는 행 삭제.
     *
     * <p>각 행은 columns 값이 criteria 중 어느 한 조합과 모두 같으면 삭제되며,
     * 여러 조합과 일치해도 한 번만 삭제됩니다. null 기준값은 null 컬럼 값과 일치합니다.</p>
     *
     * @param columns 비교 컬럼
     * @param criteria 값 조합 목록 (각 조합은 columns 순서)
     * @param where 사전 필터 ({@code *}는 전체)
     * @return 삭제된 행 수
     * @throws IllegalArgumentException 조합 길이가 columns와 다른 경우
     */
    public int deleteMatching(List<String> columns, List<? extends List<?>> criteria, String where) {
        requireColumns(columns);
        for (List<?> tuple : criteria) {
            if (tuple.size() != columns.size()) {
                throw new IllegalArgumentException(
                    "Criteria " + tuple + " does not match columns " + columns
                );
            }
        }
        if (criteria.isEmpty()) {
            return 0;
        }
        int deleted = 0;
        try (UpdateCursor cursor = store.openUpdateCursor(table, columns, Filter.parse(where))) {
            while (cursor.hasNext()) {
                Row row = cursor.next();
                if (matchesAny(columns, row, criteria)) {
                    cursor.deleteRow();
                    deleted++;
                }
            }
        }
        return deleted;
    }

    // ============================================================
    // Internals
    // ============================================================

    private int write(Filter filter, Map<String, ?> values) {
        List<String> columns = new ArrayList<>(values.keySet());
        int updated = 0;
        try (UpdateCursor cursor = store.openUpdateCursor(table, columns, filter)) {
            while (cursor.hasNext()) {
                Row row = cursor.next();
                for (Map.Entry<String, ?> entry : values.entrySet()) {
                    row.set(entry.getKey(), entry.getValue());
                }
                cursor.updateRow(row);
                updated++;
            }
        } catch (StoreException e) {
            throw writeFailure("Update of " + table + " where " + filter + " failed after " + updated + " rows", e);
        }
        return updated;
    }

    private static Map<String, Object> insertPayload(Map<String, ?> filterValues, Map<String, ?> write) {
        Map<String, Object> payload = new LinkedHashMap<>(write);
        if (filterValues != null) {
            for (Map.Entry<String, ?> entry : filterValues.entrySet()) {
                if (entry.getValue() != null && !ColumnLayout.isGeometryToken(entry.getKey())) {
                    payload.putIfAbsent(entry.getKey(), entry.getValue());
                }
            }
        }
        return payload;
    }

    private int deleteRows(Filter filter) {
        int deleted = 0;
        try (UpdateCursor cursor = store.openUpdateCursor(table, List.of(schema().idColumn()), filter)) {
            while (cursor.hasNext()) {
                cursor.next();
                cursor.deleteRow();
                deleted++;
            }
        }
        return deleted;
    }

    private static boolean matchesAny(List<String> columns, Row row, List<? extends List<?>> criteria) {
        for (List<?> tuple : criteria) {
            boolean all = true;
            for (int i = 0; i < columns.size() && all; i++) {
                Object expected = tuple.get(i);
                Object actual = row.get(i);
                all = expected == null ? actual == null : Condition.eq(columns.get(i), expected).matches(actual);
            }
            if (all) {
                return true;
            }
        }
        return false;
    }

    private static void requireColumns(List<String> columns) {
        if (columns == null || columns.isEmpty()) {
            throw new IllegalArgumentException("columns cannot be null or empty");
        }
    }

    private static SchemaMismatchException writeFailure(String message, StoreException cause) {
        return new SchemaMismatchException(message + ": " + cause.getMessage() + ". " + WRITE_FAILURE_HINT, cause);
    }
}
