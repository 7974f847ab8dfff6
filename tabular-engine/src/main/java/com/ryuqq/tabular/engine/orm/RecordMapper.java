package com.ryuqq.tabular.engine.orm;

import com.ryuqq.tabular.core.exception.IdentityException;
import com.ryuqq.tabular.core.exception.MultiplicityException;
import com.ryuqq.tabular.core.exception.NotFoundException;
import com.ryuqq.tabular.core.exception.PreconditionException;
import com.ryuqq.tabular.core.key.CompositeKey;
import com.ryuqq.tabular.core.key.Key;
import com.ryuqq.tabular.core.key.KeyResolver;
import com.ryuqq.tabular.core.model.ColumnLayout;
import com.ryuqq.tabular.core.model.TableSchema;
import com.ryuqq.tabular.core.spi.TabularStore;
import com.ryuqq.tabular.engine.audit.AuditAction;
import com.ryuqq.tabular.engine.audit.AuditLogger;
import com.ryuqq.tabular.engine.crud.CrudEngine;
import com.ryuqq.tabular.engine.crud.UpsertOptions;
import com.ryuqq.tabular.engine.transaction.TransactionCoordinator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

/**
 * 테이블 한 행에 대응하는 레코드 객체.
 *
 * <p>테이블명, 키 명세, 멤버 값을 받아 식별자를 해석하고 {@link CrudEngine}으로 읽기/쓰기를
 * 수행합니다. 쓰기는 {@link TransactionCoordinator}로 감싸며, 설정에 따라 변경 전 행을
 * {@link AuditLogger}로 기록합니다.</p>
 *
 * <p><strong>read() 조회 순서:</strong></p>
 * <ol>
 *   <li>OBJECT_ID: 값이 있으면 OBJECT_ID로 조회</li>
 *   <li>복합 키: 1단계 실패 + 키 값이 하나라도 있으면 복합 키로 조회
 *       (다건이면 경고 후 다음 단계)</li>
 *   <li>일반 멤버: 2단계 실패 시 null이 아닌 모든 데이터 멤버로 조회 (다건이면 실패)</li>
 * </ol>
 * <p>{@code read(true)}는 2단계까지만 수행합니다.</p>
 *
 * <p><strong>멤버:</strong> 생성자 값과 {@link #set(String, Object)}로 선언된 이름만
 * 읽기/쓰기에 참여합니다. 복합 키 컬럼은 항상 선언됩니다.
 * {@link #declareAllColumns()}는 테이블의 모든 데이터 컬럼을 선언합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * RecordMapper order = new RecordMapper(store, "orders", List.of("orderid", "supplier"),
 *     new MapperOptions(), Map.of("orderid", 993, "supplier", "Acme"));
 * order.set("total", 100.0);
 * order.add();
 *
 * order.read();
 * order.set("total", 120.0);
 * order.update();
 * </pre>
 *
 * @author Tabular Team
 * @since 1.0.0
 */
public class RecordMapper implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(RecordMapper.class);

    private final String table;
    private final TableSchema schema;
    private final Key key;
    private final List<String> compositeColumns;
    private final MapperOptions options;
    private final CrudEngine engine;
    private final TransactionCoordinator transactions;
    private final AuditLogger auditLogger;
    private final Members members;

    private Long primaryKey;
    private Object geometry;
    private boolean geometryDeclared;
    private boolean loaded;

    /**
     * RecordMapper 생성.
     *
     * @param store 저장소
     * @param table 테이블명
     * @param compositeKey 복합 키 컬럼 (null 또는 빈 목록이면 OBJECT_ID만 사용)
     * @param options 설정
     * @param values 초기 멤버 값 (OBJECT_ID, geometry 포함 가능)
     * @throws IllegalArgumentException store, table, options가 null인 경우
     * @throws IdentityException 복합 키 컬럼이 테이블에 없는 경우
     */
    public RecordMapper(TabularStore store, String table, List<String> compositeKey,
                        MapperOptions options, Map<String, ?> values) {
        if (store == null) {
            throw new IllegalArgumentException("store cannot be null");
        }
        if (options == null) {
            throw new IllegalArgumentException("options cannot be null");
        }
        this.engine = new CrudEngine(store, table);
        this.table = table;
        this.schema = engine.schema();
        this.key = KeyResolver.resolve(schema, compositeKey);
        this.compositeColumns = key instanceof CompositeKey ? key.columns() : List.of();
        this.options = options;
        this.members = new Members(schema);
        for (String column : compositeColumns) {
            members.declare(column);
        }

        if (options.enableTransactions()) {
            this.transactions = new TransactionCoordinator(store.newEditSession());
        } else {
            log.debug("Transactions disabled for {}", table);
            this.transactions = TransactionCoordinator.disabled();
        }
        this.auditLogger = options.enableLog() ? new AuditLogger(store, table, options.audit()) : null;

        if (values != null) {
            for (Map.Entry<String, ?> entry : values.entrySet()) {
                set(entry.getKey(), entry.getValue());
            }
        }
        this.loaded = false;
    }

    /**
     * 기본 설정, 초기 값 없는 RecordMapper 생성.
     *
     * @param store 저장소
     * @param table 테이블명
     * @param compositeKey 복합 키 컬럼 (없으면 OBJECT_ID)
     * @return RecordMapper
     */
    public static RecordMapper of(TabularStore store, String table, String... compositeKey) {
        return new RecordMapper(store, table, Arrays.asList(compositeKey), new MapperOptions(), Map.of());
    }

    // ============================================================
    // 멤버 접근
    // ============================================================

    public String table() {
        return table;
    }

    public TableSchema schema() {
        return schema;
    }

    public Key key() {
        return key;
    }

    public Long primaryKeyValue() {
        return primaryKey;
    }

    /**
     * OBJECT_ID 설정. 식별자가 바뀌므로 loaded가 해제됩니다.
     *
     * @param value OBJECT_ID (Number 또는 null)
     */
    public void setPrimaryKeyValue(Object value) {
        this.primaryKey = toId(value);
        this.loaded = false;
    }

    /**
     * 마지막 식별자 변경 이후 read()가 성공했는지.
     *
     * @return read 성공 여부
     */
    public boolean isLoaded() {
        return loaded;
    }

    public Object geometry() {
        return geometry;
    }

    /**
     * Geometry 설정. 이후 읽기/쓰기에 SHAPE@가 포함됩니다.
     *
     * @param geometry geometry 값
     * @throws IllegalStateException 테이블에 geometry 컬럼이 없는 경우
     */
    public void setGeometry(Object geometry) {
        if (schema.geometryColumn().isEmpty()) {
            throw new IllegalStateException("Table " + table + " has no geometry column");
        }
        this.geometry = geometry;
        this.geometryDeclared = true;
    }

    public Object get(String name) {
        if (name.equals(schema.idColumn())) {
            return primaryKey;
        }
        if (isGeometryName(name)) {
            return geometry;
        }
        return members.get(name);
    }

    public <T> T get(String name, Class<T> type) {
        return members.get(name, type);
    }

    /**
     * 멤버 값 설정 (선언되지 않은 이름이면 선언).
     *
     * <p>OBJECT_ID나 복합 키 컬럼을 바꾸면 loaded가 해제됩니다.</p>
     *
     * @param name 멤버명
     * @param value 값
     * @return this
     */
    public RecordMapper set(String name, Object value) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("member name cannot be null or blank");
        }
        if (name.equals(schema.idColumn())) {
            setPrimaryKeyValue(value);
        } else if (isGeometryName(name)) {
            setGeometry(value);
        } else {
            members.set(name, value);
            if (compositeColumns.contains(name)) {
                loaded = false;
            }
        }
        return this;
    }

    /**
     * 여러 멤버 값 설정.
     *
     * @param values 멤버명 → 값
     * @param existsCheck true면 선언되지 않은 이름을 거부
     * @throws IllegalArgumentException existsCheck인데 선언되지 않은 이름이 있는 경우
     */
    public void setMembers(Map<String, ?> values, boolean existsCheck) {
        if (existsCheck) {
            for (String name : values.keySet()) {
                boolean declared = members.isDeclared(name) || name.equals(schema.idColumn())
                    || (isGeometryName(name) && geometryDeclared);
                if (!declared) {
                    throw new IllegalArgumentException("Member " + name + " does not exist on record of " + table);
                }
            }
        }
        for (Map.Entry<String, ?> entry : values.entrySet()) {
            set(entry.getKey(), entry.getValue());
        }
    }

    /**
     * 테이블의 모든 데이터 컬럼(과 geometry)을 멤버로 선언.
     *
     * @return this
     */
    public RecordMapper declareAllColumns() {
        for (String column : schema.dataColumnNames()) {
            members.declare(column);
        }
        if (schema.geometryColumn().isPresent()) {
            geometryDeclared = true;
        }
        return this;
    }

    public Members members() {
        return members;
    }

    /**
     * 멤버를 맵으로 반환.
     *
     * @param selection 포함할 멤버 그룹
     * @param includeNull null 값 포함 여부
     * @param editableOnly 쓰기 가능한 컬럼만 포함
     * @return 멤버명 → 값 (canonical order, geometry 제외)
     */
    public Map<String, Object> membersAsMap(Set<MemberSelection> selection, boolean includeNull, boolean editableOnly) {
        Map<String, Object> map = new LinkedHashMap<>();
        if (selection.contains(MemberSelection.PRIMARY_KEY)) {
            map.put(schema.idColumn(), primaryKey);
        }
        if (selection.contains(MemberSelection.COMPOSITE_KEY)) {
            for (String column : compositeColumns) {
                map.put(column, members.get(column));
            }
        }
        if (selection.contains(MemberSelection.DATA)) {
            for (String name : members.names()) {
                if (!compositeColumns.contains(name)) {
                    map.put(name, members.get(name));
                }
            }
        }
        if (editableOnly) {
            map.keySet().retainAll(schema.editableColumnNames());
        }
        if (!includeNull) {
            map.values().removeIf(value -> value == null);
        }
        return map;
    }

    /**
     * 멤버와 테이블 컬럼 비교.
     *
     * @return 비교 결과 (OBJECT_ID, geometry 제외)
     */
    public ColumnComparison validateColumns() {
        List<String> tableColumns = schema.dataColumnNames();
        List<String> memberNames = members.names();
        List<String> tableOnly = new ArrayList<>();
        List<String> both = new ArrayList<>();
        for (String column : tableColumns) {
            if (memberNames.contains(column)) {
                both.add(column);
            } else {
                tableOnly.add(column);
            }
        }
        List<String> membersOnly = new ArrayList<>();
        for (String name : memberNames) {
            if (!tableColumns.contains(name)) {
                membersOnly.add(name);
            }
        }
        return new ColumnComparison(tableOnly, both, membersOnly);
    }

    /**
     * 사람이 읽기 위한 멤버 목록.
     *
     * @param includeEmpty null 멤버 포함 여부
     * @param exclude 제외할 멤버명
     * @return 여러 줄 문자열
     */
    public String describe(boolean includeEmpty, String... exclude) {
        Set<String> excluded = new HashSet<>(Arrays.asList(exclude));
        StringBuilder sb = new StringBuilder();
        sb.append(table).append(" (").append(schema.idColumn()).append('=').append(primaryKey)
            .append(loaded ? ", loaded" : "").append(')');
        for (Map.Entry<String, Object> entry : membersAsMap(EnumSet.of(MemberSelection.COMPOSITE_KEY, MemberSelection.DATA), true, false).entrySet()) {
            if (excluded.contains(entry.getKey()) || (!includeEmpty && entry.getValue() == null)) {
                continue;
            }
            sb.append(System.lineSeparator()).append("  ").append(entry.getKey()).append(": ").append(entry.getValue());
        }
        if (geometryDeclared && (includeEmpty || geometry != null)) {
            sb.append(System.lineSeparator()).append("  ").append(ColumnLayout.GEOMETRY).append(": ").append(geometry);
        }
        return sb.toString();
    }

    // ============================================================
    // read
    // ============================================================

    /**
     * 전체 조회 순서로 읽기.
     *
     * @return 읽은 행의 OBJECT_ID, 찾지 못하면 null
     * @throws MultiplicityException 일반 멤버 조회가 2건 이상과 일치한 경우
     */
    public Long read() {
        return read(false);
    }

    /**
     * 읽기.
     *
     * @param keysOnly true면 OBJECT_ID, 복합 키 단계까지만 수행
     * @return 읽은 행의 OBJECT_ID, 찾지 못하면 null
     * @throws MultiplicityException 일반 멤버 조회가 2건 이상과 일치한 경우
     */
    public Long read(boolean keysOnly) {
        List<String> data = dataMemberNames();

        // 1. OBJECT_ID
        if (primaryKey != null) {
            List<String> columns = concat(compositeColumns, data, false);
            if (columns.isEmpty()) {
                columns.add(schema.idColumn());
            }
            Optional<List<Object>> found = engine.find(columns, Map.of(schema.idColumn(), primaryKey));
            if (found.isPresent()) {
                return loadFrom(columns, found.get());
            }
            log.debug("No row in {} with {}={}", table, schema.idColumn(), primaryKey);
        }

        // 2. composite key
        Map<String, Object> keyValues = nonNull(compositeColumns);
        if (!keyValues.isEmpty()) {
            if (engine.existsByCompositeKey(keyValues)) {
                List<String> columns = concat(List.of(), data, true);
                try {
                    Optional<List<Object>> found = engine.find(columns, keyValues);
                    if (found.isPresent()) {
                        return loadFrom(columns, found.get());
                    }
                } catch (MultiplicityException e) {
                    log.warn("Composite key {} matched more than one row in {}, falling back to member search",
                        keyValues, table);
                }
            } else {
                log.warn("Composite key {} is set but no row in {} matches it", keyValues, table);
            }
        }

        if (keysOnly) {
            return null;
        }

        // 3. general members
        Map<String, Object> search = nonNull(data);
        if (search.isEmpty()) {
            log.debug("No member values set on {}, nothing to read", table);
            return null;
        }
        List<String> columns = concat(compositeColumns, data, true);
        Optional<List<Object>> found = engine.find(columns, search);
        return found.map(values -> loadFrom(columns, values)).orElse(null);
    }

    // ============================================================
    // add / update / delete
    // ============================================================

    /**
     * 기본 정책으로 추가 (commit, 존재하면 실패).
     *
     * @return 새 OBJECT_ID
     */
    public Long add() {
        return add(true, false, true);
    }

    /**
     * 추가.
     *
     * <p>복합 키 값(없으면 데이터 멤버 값)으로 존재 여부를 확인한 뒤 upsert 합니다.
     * 감사 로그는 남기지 않습니다.</p>
     *
     * @param commit 자체 트랜잭션으로 commit 할지
     * @param forceInsert 존재해도 insert
     * @param failOnExists 존재하면 실패 (false면 update)
     * @return 새 OBJECT_ID, update 경로면 null
     * @throws PreconditionException 설정된 멤버 값이 없는 경우
     * @throws com.ryuqq.tabular.core.exception.InsertTargetExistsException failOnExists인데 존재하는 경우
     */
    public Long add(boolean commit, boolean forceInsert, boolean failOnExists) {
        Map<String, Object> search = nonNull(compositeColumns);
        if (search.isEmpty()) {
            search = nonNull(dataMemberNames());
        }
        if (search.isEmpty()) {
            throw new PreconditionException("No member values are set on record of " + table + ", nothing to add");
        }
        Map<String, Object> payload = membersAsMap(EnumSet.of(MemberSelection.COMPOSITE_KEY, MemberSelection.DATA), false, false);
        if (geometry != null) {
            payload.put(ColumnLayout.GEOMETRY, geometry);
        }
        Map<String, Object> filter = search;
        UpsertOptions upsert = new UpsertOptions(forceInsert, false, failOnExists, false);
        Long id = mutate("add", () -> engine.upsert(filter, payload, upsert), commit);
        if (id != null) {
            primaryKey = id;
        }
        return id;
    }

    /**
     * 기본 정책으로 update (commit).
     */
    public void update() {
        update(true);
    }

    /**
     * 선언된 쓰기 가능 멤버를 기록.
     *
     * <p>OBJECT_ID가 있으면 OBJECT_ID로, 없으면 복합 키로 대상 행을 찾습니다.
     * null 멤버도 null로 기록되므로 updateReadCheck가 켜져 있으면 read()가 먼저 성공해야 합니다.</p>
     *
     * @param commit 자체 트랜잭션으로 commit 할지
     * @throws PreconditionException read() 없이 호출했거나 쓸 멤버가 없는 경우
     * @throws IdentityException OBJECT_ID도 복합 키 값도 없는 경우
     * @throws NotFoundException 대상 행이 없는 경우
     * @throws MultiplicityException 대상 행이 2건 이상인 경우
     */
    public void update(boolean commit) {
        if (options.updateReadCheck() && !loaded) {
            throw new PreconditionException(
                "update() on " + table + " requires a successful read() first, or updateReadCheck disabled"
            );
        }
        Map<String, Object> identity = identity(true);
        Map<String, Object> payload = membersAsMap(EnumSet.of(MemberSelection.COMPOSITE_KEY, MemberSelection.DATA), true, true);
        if (geometryDeclared) {
            payload.put(ColumnLayout.GEOMETRY, geometry);
        }
        if (payload.isEmpty()) {
            throw new PreconditionException("No editable members declared on record of " + table + ", nothing to update");
        }
        UpsertOptions upsert = new UpsertOptions(false, true, false, true);
        mutate("update", () -> {
            if (auditLogger != null) {
                auditLogger.log(AuditAction.UPDATE, identity);
            }
            return engine.upsert(identity, payload, upsert);
        }, commit);
    }

    /**
     * 기본 정책으로 삭제 (commit, 식별자 필수).
     *
     * @return 삭제했으면 true
     */
    public boolean delete() {
        return delete(true, true);
    }

    /**
     * 삭제.
     *
     * <p>성공하면 키가 아닌 멤버를 모두 null로 비우고 loaded를 해제합니다.</p>
     *
     * @param commit 자체 트랜잭션으로 commit 할지
     * @param errorOnNoKey true면 OBJECT_ID/복합 키가 없을 때 실패, false면 데이터 멤버로 대상 검색
     * @return 삭제했으면 true, 일치하는 행이 없으면 false (rollback 후)
     * @throws IdentityException 대상을 식별할 값이 없는 경우
     * @throws MultiplicityException 대상 행이 2건 이상인 경우
     */
    public boolean delete(boolean commit, boolean errorOnNoKey) {
        Map<String, Object> identity = identity(errorOnNoKey);
        if (identity.isEmpty()) {
            identity = nonNull(dataMemberNames());
        }
        if (identity.isEmpty()) {
            throw new IdentityException("No member values identify the record of " + table + " to delete");
        }
        Map<String, Object> target = identity;
        try {
            mutate("delete", () -> {
                if (auditLogger != null) {
                    auditLogger.log(AuditAction.DELETE, target);
                }
                return engine.delete(target, true, true);
            }, commit);
        } catch (NotFoundException e) {
            log.info("No row in {} matches {}, nothing deleted", table, target);
            return false;
        }

        for (String name : members.names()) {
            if (!compositeColumns.contains(name)) {
                members.clear(name);
            }
        }
        geometry = null;
        loaded = false;
        return true;
    }

    // ============================================================
    // 트랜잭션
    // ============================================================

    /**
     * 이 레코드의 트랜잭션 조정자 (여러 쓰기를 하나로 묶을 때 사용).
     *
     * @return 트랜잭션 조정자
     */
    public TransactionCoordinator transactions() {
        return transactions;
    }

    @Override
    public void close() {
        close(true);
    }

    public void close(boolean commit) {
        transactions.close(commit);
    }

    // ============================================================
    // Internals
    // ============================================================

    private <T> T mutate(String action, Supplier<T> work, boolean commit) {
        return transactions.execute(() -> {
            if (options.requireEditSession()) {
                transactions.requireActive(action + "() on " + table);
            }
            return work.get();
        }, commit);
    }

    /**
     * OBJECT_ID 또는 복합 키 값.
     */
    private Map<String, Object> identity(boolean required) {
        if (primaryKey != null) {
            Map<String, Object> identity = new LinkedHashMap<>();
            identity.put(schema.idColumn(), primaryKey);
            return identity;
        }
        Map<String, Object> keyValues = nonNull(compositeColumns);
        if (keyValues.isEmpty() && required) {
            throw new IdentityException(
                "Record of " + table + " has neither a " + schema.idColumn() + " value nor composite key " + compositeColumns + " values"
            );
        }
        return keyValues;
    }

    private Long loadFrom(List<String> columns, List<Object> values) {
        for (int i = 0; i < columns.size(); i++) {
            String column = columns.get(i);
            Object value = values.get(i);
            if (column.equals(schema.idColumn())) {
                primaryKey = toId(value);
            } else if (ColumnLayout.isGeometryToken(column)) {
                geometry = value;
            } else {
                members.set(column, value);
            }
        }
        loaded = true;
        return primaryKey;
    }

    /**
     * 스키마에 있는, 키가 아닌 선언 멤버.
     */
    private List<String> dataMemberNames() {
        List<String> names = new ArrayList<>();
        for (String name : members.knownNames()) {
            if (!compositeColumns.contains(name)) {
                names.add(name);
            }
        }
        return names;
    }

    private List<String> concat(List<String> keys, List<String> data, boolean withId) {
        List<String> columns = new ArrayList<>(keys);
        columns.addAll(data);
        if (geometryDeclared) {
            columns.add(ColumnLayout.GEOMETRY);
        }
        if (withId) {
            columns.add(schema.idColumn());
        }
        return columns;
    }

    private Map<String, Object> nonNull(List<String> names) {
        Map<String, Object> values = new LinkedHashMap<>();
        for (String name : names) {
            Object value = members.get(name);
            if (value != null) {
                values.put(name, value);
            }
        }
        return values;
    }

    private boolean isGeometryName(String name) {
        return ColumnLayout.isGeometryToken(name) || schema.geometryColumn().map(name::equals).orElse(false);
    }

    private static Long toId(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Long || value instanceof Integer || value instanceof Short) {
            return ((Number) value).longValue();
        }
        throw new IllegalArgumentException("OBJECT_ID must be an integral number (current: " + value + ")");
    }

    @Override
    public String toString() {
        return "RecordMapper{table=" + table + ", " + schema.idColumn() + "=" + primaryKey
            + ", members=" + members.asMap() + ", loaded=" + loaded + "}";
    }
}
