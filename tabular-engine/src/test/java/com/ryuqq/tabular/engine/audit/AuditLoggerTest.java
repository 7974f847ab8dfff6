package com.ryuqq.tabular.engine.audit;

import com.ryuqq.tabular.adapter.inmemory.store.InMemoryTabularStore;
import com.ryuqq.tabular.core.exception.MultiplicityException;
import com.ryuqq.tabular.core.exception.SchemaMismatchException;
import com.ryuqq.tabular.core.model.Column;
import com.ryuqq.tabular.core.model.ColumnType;
import com.ryuqq.tabular.core.model.TableSchema;
import com.ryuqq.tabular.engine.crud.CrudEngine;
import com.ryuqq.tabular.engine.orm.MapperOptions;
import com.ryuqq.tabular.engine.orm.RecordMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * AuditLogger 유닛 테스트.
 *
 * @author Tabular Team
 * @since 1.0.0
 */
class AuditLoggerTest {

    private InMemoryTabularStore store;
    private AuditLogger logger;

    @BeforeEach
    void setUp() {
        store = new InMemoryTabularStore();
        store.createTable(TableSchema.of("parcels",
            Column.objectId("OBJECTID"),
            Column.text("parcel_no", 10),
            Column.of("area", ColumnType.DOUBLE),
            Column.geometry("Shape")));
        logger = new AuditLogger(store, "parcels", new AuditOptions());
    }

    private long insertParcel(String parcelNo, double area, Object shape) {
        return new CrudEngine(store, "parcels").insert(Map.of("parcel_no", parcelNo, "area", area, "SHAPE@", shape));
    }

    @Test
    void log_ADD는_기록하지_않음() {
        // given
        long id = insertParcel("P-1", 1.0, "POINT (0 0)");

        // when
        boolean logged = logger.log(AuditAction.ADD, Map.of("OBJECTID", id));

        // then
        assertThat(logged).isFalse();
        assertThat(store.exists("parcels_log")).isFalse();
    }

    @Test
    void log_UPDATE_shadow_테이블_생성_후_geometry_포함_기록() {
        // given
        long id = insertParcel("P-1", 1.0, "POINT (0 0)");

        // when
        boolean logged = logger.log(AuditAction.UPDATE, Map.of("OBJECTID", id));

        // then
        assertThat(logged).isTrue();
        assertThat(store.schema("parcels_log").columnNames())
            .containsExactly("OBJECTID", "parcel_no", "area", "Shape", "action");
        List<Map<String, Object>> rows = store.rows("parcels_log");
        assertThat(rows).hasSize(1);
        assertThat(rows.get(0))
            .containsEntry("parcel_no", "P-1")
            .containsEntry("Shape", "POINT (0 0)")
            .containsEntry("action", "update");
    }

    @Test
    void log_actionColumnLength_설정_반영() {
        // given
        long id = insertParcel("P-1", 1.0, "POINT (0 0)");
        AuditLogger wide = new AuditLogger(store, "parcels", new AuditOptions().withActionColumnLength(32));

        // when
        wide.log(AuditAction.DELETE, Map.of("OBJECTID", id));

        // then
        assertThat(store.schema("parcels_log").column("action").orElseThrow().length()).isEqualTo(32);
    }

    @Test
    void log_대상_행_없으면_false() {
        // when
        boolean logged = logger.log(AuditAction.DELETE, Map.of("OBJECTID", 42L));

        // then
        assertThat(logged).isFalse();
        assertThat(store.rows("parcels_log")).isEmpty();
    }

    @Test
    void log_식별자가_여러_행과_일치하면_MultiplicityException() {
        // given
        insertParcel("P-1", 1.0, "POINT (0 0)");
        insertParcel("P-1", 2.0, "POINT (1 1)");

        // when & then
        assertThatThrownBy(() -> logger.log(AuditAction.UPDATE, Map.of("parcel_no", "P-1")))
            .isInstanceOf(MultiplicityException.class);
    }

    @Test
    void log_shadow_테이블_자신은_기록하지_않음() {
        // given
        store.createLike("parcels", "parcels_log", List.of(Column.text("action", 16)));
        AuditLogger shadowLogger = new AuditLogger(store, "parcels_log", new AuditOptions());

        // when
        boolean logged = shadowLogger.log(AuditAction.UPDATE, Map.of("OBJECTID", 1L));

        // then
        assertThat(logged).isFalse();
        assertThat(store.exists("parcels_log_log")).isFalse();
    }

    @Test
    void log_shadow_생성_비활성이면_건너뜀() {
        // given
        long id = insertParcel("P-1", 1.0, "POINT (0 0)");
        AuditLogger passive = new AuditLogger(store, "parcels", new AuditOptions().withCreateShadowTable(false));

        // when
        boolean logged = passive.log(AuditAction.UPDATE, Map.of("OBJECTID", id));

        // then
        assertThat(logged).isFalse();
        assertThat(store.exists("parcels_log")).isFalse();
    }

    @Test
    void 부모_쓰기_실패시_감사_행도_함께_rollback() {
        // given
        long id = insertParcel("P-1", 1.0, "POINT (0 0)");
        store.createLike("parcels", "parcels_log", List.of(Column.text("action", 16)));
        RecordMapper parcel = new RecordMapper(store, "parcels", List.of(),
            new MapperOptions().withEnableLog(true), Map.of("OBJECTID", id));
        parcel.declareAllColumns();
        parcel.read();

        // when
        parcel.set("parcel_no", "P-1-too-long-for-column");

        // then
        assertThatThrownBy(parcel::update).isInstanceOf(SchemaMismatchException.class);
        assertThat(store.rows("parcels_log")).isEmpty();
        assertThat(store.rows("parcels").get(0)).containsEntry("parcel_no", "P-1");
    }

    @Test
    void AuditOptions_action_컬럼_길이_6_미만이면_IllegalArgumentException() {
        // when & then
        assertThatThrownBy(() -> new AuditOptions(true, 5)).isInstanceOf(IllegalArgumentException.class);
    }
}
