package com.ryuqq.tabular.engine.audit;

import com.ryuqq.tabular.core.exception.AuditConfigurationException;
import com.ryuqq.tabular.core.exception.TransactionStateException;
import com.ryuqq.tabular.core.model.Column;
import com.ryuqq.tabular.core.model.ColumnLayout;
import com.ryuqq.tabular.core.model.ColumnType;
import com.ryuqq.tabular.core.model.TableSchema;
import com.ryuqq.tabular.core.spi.TabularStore;
import com.ryuqq.tabular.engine.crud.CrudEngine;
import com.ryuqq.tabular.engine.transaction.TransactionCoordinator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 변경 직전 행을 shadow 테이블({@code <table>_log})에 기록하는 감사 로거.
 *
 * <p><strong>기록 규칙:</strong></p>
 * <ul>
 *   <li>UPDATE, DELETE만 기록 (ADD는 무시)</li>
 *   <li>변경 전 스냅샷 + action 값을 한 행으로 insert</li>
 *   <li>{@code _log}로 끝나는 테이블 자체는 기록하지 않음</li>
 *   <li>shadow insert는 자체 edit session에서 auto-commit (중첩 트랜잭션)</li>
 * </ul>
 *
 * <p><strong>구성 오류:</strong></p>
 * <ul>
 *   <li>부모 테이블에 action 컬럼이 있으면 {@link AuditConfigurationException}</li>
 *   <li>shadow 테이블에 부모 컬럼이 빠져 있으면 기록 시점에 {@link TransactionStateException}</li>
 * </ul>
 *
 * @author Tabular Team
 * @since 1.0.0
 */
public class AuditLogger {

    private static final Logger log = LoggerFactory.getLogger(AuditLogger.class);

    public static final String SHADOW_SUFFIX = "_log";
    public static final String ACTION_COLUMN = "action";

    private final TabularStore store;
    private final String table;
    private final AuditOptions options;

    /**
     * AuditLogger 생성.
     *
     * @param store 저장소
     * @param table 감사 대상 테이블
     * @param options 감사 설정
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public AuditLogger(TabularStore store, String table, AuditOptions options) {
        if (store == null) {
            throw new IllegalArgumentException("store cannot be null");
        }
        if (table == null || table.isBlank()) {
            throw new IllegalArgumentException("table cannot be null or blank");
        }
        if (options == null) {
            throw new IllegalArgumentException("options cannot be null");
        }
        this.store = store;
        this.table = table;
        this.options = options;
    }

    /**
     * shadow 테이블명.
     *
     * @param table 부모 테이블명
     * @return {@code table + "_log"}
     */
    public static String shadowTableName(String table) {
        return table + SHADOW_SUFFIX;
    }

    public String shadowTable() {
        return shadowTableName(table);
    }

    /**
     * 변경 직전 행을 기록.
     *
     * <p>반드시 실제 변경보다 먼저 호출해야 합니다.</p>
     *
     * @param action 감사 action
     * @param identity 대상 행을 식별하는 값 (OBJECT_ID 또는 복합 키)
     * @return shadow 행을 기록했으면 true
     * @throws AuditConfigurationException 부모 테이블에 action 컬럼이 있는 경우
     * @throws TransactionStateException shadow 테이블 컬럼이 부모와 맞지 않는 경우
     * @throws com.ryuqq.tabular.core.exception.MultiplicityException identity가 2건 이상과 일치한 경우
     */
    public boolean log(AuditAction action, Map<String, ?> identity) {
        if (action == null) {
            throw new IllegalArgumentException("action cannot be null");
        }
        if (!action.isPersisted()) {
            return false;
        }
        if (table.toLowerCase().endsWith(SHADOW_SUFFIX)) {
            log.debug("{} is itself an audit table, not logging {}", table, action.value());
            return false;
        }

        CrudEngine parent = new CrudEngine(store, table);
        TableSchema parentSchema = parent.schema();
        if (parentSchema.containsIgnoreCase(ACTION_COLUMN)) {
            throw new AuditConfigurationException(
                "Table " + table + " has a column named '" + ACTION_COLUMN + "', which is reserved for audit logging"
            );
        }

        String shadow = shadowTable();
        if (!store.exists(shadow)) {
            if (!options.createShadowTable()) {
                log.debug("Audit table {} does not exist, not logging {}", shadow, action.value());
                return false;
            }
            store.createLike(table, shadow, List.of(Column.text(ACTION_COLUMN, options.actionColumnLength())));
            log.info("Created audit table {} for {}", shadow, table);
        }

        TableSchema shadowSchema = store.schema(shadow);
        List<String> columns = snapshotColumns(parentSchema, shadowSchema);

        Optional<List<Object>> snapshot = parent.find(columns, identity);
        if (snapshot.isEmpty()) {
            log.warn("No row in {} matches {}, nothing to log for {}", table, identity, action.value());
            return false;
        }

        Map<String, Object> entry = new LinkedHashMap<>();
        List<Object> values = snapshot.get();
        for (int i = 0; i < columns.size(); i++) {
            entry.put(columns.get(i), values.get(i));
        }
        entry.put(ACTION_COLUMN, action.value());

        CrudEngine shadowEngine = new CrudEngine(store, shadow);
        TransactionCoordinator nested = new TransactionCoordinator(store.newEditSession());
        long id = nested.execute(() -> shadowEngine.insert(entry), true);
        log.debug("Logged {} of {} {} as {} row {}", action.value(), table, identity, shadow, id);
        return true;
    }

    /**
     * 스냅샷 대상 컬럼 (부모의 쓰기 가능 컬럼, geometry는 SHAPE@) 을 구하고 shadow 스키마를 검증.
     */
    private List<String> snapshotColumns(TableSchema parentSchema, TableSchema shadowSchema) {
        List<String> missing = new ArrayList<>();
        List<String> columns = new ArrayList<>();
        for (Column column : parentSchema.columns()) {
            if (!column.editable()) {
                continue;
            }
            if (!shadowSchema.contains(column.name())) {
                missing.add(column.name());
                continue;
            }
            columns.add(column.type() == ColumnType.GEOMETRY ? ColumnLayout.GEOMETRY : column.name());
        }
        if (!shadowSchema.contains(ACTION_COLUMN)) {
            missing.add(ACTION_COLUMN);
        }
        if (!missing.isEmpty()) {
            throw new TransactionStateException(
                "Audit table " + shadowSchema.name() + " does not match " + parentSchema.name()
                    + ", missing columns: " + missing
            );
        }
        return columns;
    }
}
