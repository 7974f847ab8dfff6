package com.ryuqq.tabular.adapter.inmemory.store;

import com.ryuqq.tabular.core.exception.StoreException;
import com.ryuqq.tabular.core.filter.Filter;
import com.ryuqq.tabular.core.model.Column;
import com.ryuqq.tabular.core.model.ColumnLayout;
import com.ryuqq.tabular.core.model.ColumnType;
import com.ryuqq.tabular.core.model.Row;
import com.ryuqq.tabular.core.model.TableSchema;
import com.ryuqq.tabular.core.spi.InsertCursor;
import com.ryuqq.tabular.core.spi.RowCursor;
import com.ryuqq.tabular.core.spi.UpdateCursor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * InMemoryTabularStore 테스트.
 *
 * <ul>
 *   <li>insert: OBJECT_ID 생성, 타입/길이/null 검증</li>
 *   <li>cursor: 컬럼 해석, 필터, update/delete</li>
 *   <li>createLike, lock, failAfterWrites</li>
 * </ul>
 *
 * @author Tabular Team
 * @since 1.0.0
 */
class InMemoryTabularStoreTest {

    private InMemoryTabularStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryTabularStore("test");
        store.createTable(TableSchema.of("parcels",
            Column.objectId("OBJECTID"),
            Column.text("parcel_no", 5).notNull(),
            Column.of("area", ColumnType.DOUBLE),
            Column.geometry("Shape")));
    }

    private long insert(String parcelNo, Double area) {
        try (InsertCursor cursor = store.openInsertCursor("parcels", List.of("parcel_no", "area"))) {
            return cursor.insertRow(Arrays.asList(parcelNo, area));
        }
    }

    // ========== insert ==========

    @Test
    void insertRow_GeneratesIncreasingIds() {
        // When
        long first = insert("P-1", 1.0);
        long second = insert("P-2", 2.0);

        // Then
        assertEquals(1L, first);
        assertEquals(2L, second);
        assertEquals(2, store.rowCount("parcels", Filter.all()));
    }

    @Test
    void insertRow_DefaultColumns_ExcludeObjectIdAndExposeShape() {
        // When
        try (InsertCursor cursor = store.openInsertCursor("parcels", null)) {
            assertEquals(List.of("parcel_no", "area", ColumnLayout.GEOMETRY), cursor.layout().names());
            cursor.insertRow(Arrays.asList("P-1", 1.0, "POINT (0 0)"));
        }

        // Then
        assertEquals("POINT (0 0)", store.rows("parcels").get(0).get("Shape"));
    }

    @Test
    void insertRow_TooLongText_ThrowsStoreException() {
        // When & Then
        StoreException exception = assertThrows(StoreException.class, () -> insert("P-123456", 1.0));
        assertTrue(exception.getMessage().contains("string truncation"));
        assertEquals(0, store.rowCount("parcels", Filter.all()));
    }

    @Test
    void insertRow_WrongType_ThrowsStoreException() {
        // When & Then
        assertThrows(StoreException.class, () -> {
            try (InsertCursor cursor = store.openInsertCursor("parcels", List.of("parcel_no", "area"))) {
                cursor.insertRow(List.of("P-1", "large"));
            }
        });
    }

    @Test
    void insertRow_MissingRequiredColumn_ThrowsStoreException() {
        // When & Then
        assertThrows(StoreException.class, () -> {
            try (InsertCursor cursor = store.openInsertCursor("parcels", List.of("area"))) {
                cursor.insertRow(List.of(1.0));
            }
        });
    }

    @Test
    void openInsertCursor_UnknownColumn_ThrowsStoreException() {
        // When & Then
        StoreException exception = assertThrows(StoreException.class,
            () -> store.openInsertCursor("parcels", List.of("Parcel_No")));
        assertTrue(exception.getMessage().contains("does not exist"));
    }

    @Test
    void openInsertCursor_ObjectId_ThrowsStoreException() {
        // When & Then
        assertThrows(StoreException.class, () -> {
            try (InsertCursor cursor = store.openInsertCursor("parcels", List.of("OBJECTID", "parcel_no"))) {
                cursor.insertRow(List.of(5L, "P-1"));
            }
        });
    }

    // ========== cursors ==========

    @Test
    void readCursor_FiltersAndProjects() {
        // Given
        insert("P-1", 10.0);
        insert("P-2", 20.0);
        insert("P-3", 30.0);

        // When
        try (RowCursor cursor = store.openReadCursor("parcels", List.of("parcel_no"), Filter.parse("area >= 20"))) {
            // Then
            assertEquals(2, cursor.drain());
        }
        try (RowCursor cursor = store.openReadCursor("parcels", List.of("parcel_no", "OBJECTID"), Filter.parse("area > 25"))) {
            Row row = cursor.next();
            assertEquals("P-3", row.get("parcel_no"));
            assertEquals(3L, row.get("OBJECTID"));
            assertFalse(cursor.hasNext());
        }
    }

    @Test
    void readCursor_FilterOnUnknownColumn_ThrowsStoreException() {
        // When & Then
        assertThrows(StoreException.class, () -> store.rowCount("parcels", Filter.parse("owner = 'Kim'")));
    }

    @Test
    void readCursor_CannotWrite() {
        // Given
        insert("P-1", 10.0);

        // When & Then
        try (RowCursor cursor = store.openReadCursor("parcels", null, Filter.all())) {
            UpdateCursor asUpdate = (UpdateCursor) cursor;
            asUpdate.next();
            assertThrows(UnsupportedOperationException.class, asUpdate::deleteRow);
        }
        assertEquals(1, store.rowCount("parcels", Filter.all()));
    }

    @Test
    void updateCursor_UpdatesAndDeletes() {
        // Given
        insert("P-1", 10.0);
        insert("P-2", 20.0);

        // When
        try (UpdateCursor cursor = store.openUpdateCursor("parcels", List.of("parcel_no", "area"), Filter.all())) {
            Row first = cursor.next();
            first.set("area", 11.0);
            cursor.updateRow(first);
            cursor.next();
            cursor.deleteRow();
        }

        // Then
        List<Map<String, Object>> rows = store.rows("parcels");
        assertEquals(1, rows.size());
        assertEquals(11.0, rows.get(0).get("area"));
    }

    @Test
    void updateCursor_ChangingObjectId_ThrowsStoreException() {
        // Given
        insert("P-1", 10.0);

        // When & Then
        try (UpdateCursor cursor = store.openUpdateCursor("parcels", List.of("OBJECTID"), Filter.all())) {
            Row row = cursor.next();
            row.set(0, 99L);
            assertThrows(StoreException.class, () -> cursor.updateRow(row));
        }
    }

    @Test
    void updateCursor_BeforeNext_ThrowsException() {
        // When & Then
        try (UpdateCursor cursor = store.openUpdateCursor("parcels", null, Filter.all())) {
            assertThrows(IllegalStateException.class, cursor::deleteRow);
        }
    }

    // ========== schema operations ==========

    @Test
    void createLike_CopiesSchemaWithAdditionalColumns() {
        // When
        TableSchema shadow = store.createLike("parcels", "parcels_log", List.of(Column.text("action", 16)));

        // Then
        assertTrue(store.exists("parcels_log"));
        assertEquals(List.of("OBJECTID", "parcel_no", "area", "Shape", "action"), shadow.columnNames());
        assertEquals(0, store.rowCount("parcels_log", Filter.all()));
        assertThrows(StoreException.class, () -> store.createLike("parcels", "parcels_log", List.of()));
    }

    @Test
    void deleteEntity_RemovesTable() {
        // When
        store.deleteEntity("parcels");

        // Then
        assertFalse(store.exists("parcels"));
        assertThrows(StoreException.class, () -> store.schema("parcels"));
    }

    // ========== test hooks ==========

    @Test
    void lock_FailsWritesUntilUnlocked() {
        // Given
        store.lock("parcels");

        // When & Then
        StoreException exception = assertThrows(StoreException.class, () -> insert("P-1", 1.0));
        assertTrue(exception.getMessage().contains("lock"));
        store.unlock("parcels");
        assertDoesNotThrow(() -> insert("P-1", 1.0));
    }

    @Test
    void failAfterWrites_FailsOnceAfterGivenWrites() {
        // Given
        store.failAfterWrites(1);

        // When & Then
        assertDoesNotThrow(() -> insert("P-1", 1.0));
        assertThrows(StoreException.class, () -> insert("P-2", 2.0));
        assertDoesNotThrow(() -> insert("P-3", 3.0));
        assertEquals(2, store.rowCount("parcels", Filter.all()));
    }

    @Test
    void failAfterWrites_Negative_ThrowsException() {
        // When & Then
        assertThrows(IllegalArgumentException.class, () -> store.failAfterWrites(-1));
    }
}
