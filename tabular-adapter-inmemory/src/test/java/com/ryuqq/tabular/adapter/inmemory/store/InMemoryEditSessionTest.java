package com.ryuqq.tabular.adapter.inmemory.store;

import com.ryuqq.tabular.core.filter.Filter;
import com.ryuqq.tabular.core.model.Column;
import com.ryuqq.tabular.core.model.TableSchema;
import com.ryuqq.tabular.core.session.EditSessionState;
import com.ryuqq.tabular.core.spi.EditSession;
import com.ryuqq.tabular.core.spi.InsertCursor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * InMemoryEditSession 테스트.
 *
 * @author Tabular Team
 * @since 1.0.0
 */
class InMemoryEditSessionTest {

    private InMemoryTabularStore store;
    private EditSession session;

    @BeforeEach
    void setUp() {
        store = new InMemoryTabularStore("test");
        store.createTable(TableSchema.of("items", Column.objectId("OBJECTID"), Column.text("name", 20)));
        session = store.newEditSession();
    }

    private void insert(String name) {
        try (InsertCursor cursor = store.openInsertCursor("items", List.of("name"))) {
            cursor.insertRow(List.of(name));
        }
    }

    private long count() {
        return store.rowCount("items", Filter.all());
    }

    @Test
    void stopEditing_Save_KeepsWrites() {
        // Given
        session.startEditing();
        session.startOperation();
        insert("a");

        // When
        session.stopOperation();
        session.stopEditing(true);

        // Then
        assertEquals(1, count());
        assertEquals(EditSessionState.CLOSED, session.state());
    }

    @Test
    void stopEditing_Discard_RestoresSessionStart() {
        // Given
        insert("before");
        session.startEditing();
        session.startOperation();
        insert("a");
        session.stopOperation();

        // When
        session.stopEditing(false);

        // Then
        assertEquals(1, count());
        assertEquals("before", store.rows("items").get(0).get("name"));
    }

    @Test
    void abortOperation_RestoresOperationStartOnly() {
        // Given
        session.startEditing();
        session.startOperation();
        insert("kept");
        session.stopOperation();
        session.startOperation();
        insert("aborted");

        // When
        session.abortOperation();
        session.stopEditing(true);

        // Then
        assertEquals(1, count());
        assertEquals("kept", store.rows("items").get(0).get("name"));
    }

    @Test
    void abortOperation_RestoresCreatedTables() {
        // Given
        session.startEditing();
        session.startOperation();
        store.createLike("items", "items_log", List.of(Column.text("action", 16)));

        // When
        session.abortOperation();

        // Then
        assertFalse(store.exists("items_log"));
    }

    @Test
    void state_FollowsLifecycle() {
        // When & Then
        assertFalse(session.isEditing());
        session.startEditing();
        assertTrue(session.isEditing());
        assertFalse(session.isOperationOpen());
        session.startOperation();
        assertTrue(session.isOperationOpen());
        assertEquals("test", session.workspace());
    }

    @Test
    void startOperation_BeforeEditing_ThrowsException() {
        // When & Then
        assertThrows(IllegalStateException.class, session::startOperation);
    }

    @Test
    void stopOperation_WithoutOperation_ThrowsException() {
        // Given
        session.startEditing();

        // When & Then
        assertThrows(IllegalStateException.class, session::stopOperation);
    }
}
