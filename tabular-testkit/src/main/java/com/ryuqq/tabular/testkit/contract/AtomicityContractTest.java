package com.ryuqq.tabular.testkit.contract;

import com.ryuqq.tabular.core.exception.SchemaMismatchException;
import com.ryuqq.tabular.core.exception.TransactionStateException;
import com.ryuqq.tabular.core.filter.Filter;
import com.ryuqq.tabular.engine.copy.CopyOptions;
import com.ryuqq.tabular.engine.copy.RecordCopier;
import com.ryuqq.tabular.engine.crud.CrudEngine;
import com.ryuqq.tabular.engine.orm.MapperOptions;
import com.ryuqq.tabular.engine.orm.RecordMapper;
import com.ryuqq.tabular.engine.transaction.TransactionCoordinator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test for atomic writes.
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>Atomic commit: several writes in one transaction all persist</li>
 *   <li>Rollback: a failure part way through leaves the table unchanged</li>
 *   <li>Store failure: an injected write failure rolls back earlier writes</li>
 *   <li>Nested begin commits the open session first</li>
 *   <li>Copy: all rows or none</li>
 * </ul>
 *
 * @author Tabular Team
 * @since 1.0.0
 */
public abstract class AtomicityContractTest extends AbstractContractTest {

    protected CrudEngine orders;
    protected TransactionCoordinator transactions;

    /**
     * Makes the store fail the write that follows the next {@code writes} successful ones.
     *
     * @param writes number of writes that still succeed
     */
    protected abstract void failAfterWrites(int writes);

    @BeforeEach
    void setUpTransactions() {
        orders = new CrudEngine(store, ORDERS);
        transactions = new TransactionCoordinator(store.newEditSession());
    }

    @Test
    void testAtomicCommit_WhenBothSucceed_BothPersisted() {
        // When
        transactions.run(() -> {
            orders.insert(Map.of("orderid", 1, "supplier", "Acme"));
            orders.insert(Map.of("orderid", 2, "supplier", "Acme"));
        }, true);

        // Then
        assertRowCount(ORDERS, 2);
        assertFalse(transactions.isActive());
    }

    @Test
    void testRollback_WhenFunctionFailsMidway_TableUnchanged() {
        // Given
        insertOrder(1, "Acme", 10.0);
        insertOrder(2, "Acme", 20.0);
        insertOrder(3, "Acme", 30.0);
        List<Map<String, Object>> before = snapshot(ORDERS);

        // When
        IllegalStateException e = assertThrows(IllegalStateException.class, () -> transactions.execute(
            () -> orders.recompute(List.of("total"), Filter.all(), value -> {
                if ((Double) value > 15.0) {
                    throw new IllegalStateException("total too large: " + value);
                }
                return (Double) value * 2;
            }), true));

        // Then
        assertTrue(e.getMessage().startsWith("total too large"));
        assertEquals(before, snapshot(ORDERS));
        assertFalse(transactions.isActive());
    }

    @Test
    void testRollback_WhenStoreFailsMidway_EarlierWritesUndone() {
        // Given
        failAfterWrites(2);

        // When
        assertThrows(SchemaMismatchException.class, () -> transactions.run(() -> {
            orders.insert(Map.of("orderid", 1, "supplier", "Acme"));
            orders.insert(Map.of("orderid", 2, "supplier", "Acme"));
            orders.insert(Map.of("orderid", 3, "supplier", "Acme"));
        }, true));

        // Then
        assertRowCount(ORDERS, 0);
    }

    @Test
    void testBegin_WhenAlreadyEditing_CommitsPreviousWork() {
        // Given
        transactions.begin();
        insertOrder(1, "Acme", 10.0);

        // When
        transactions.begin();
        insertOrder(2, "Acme", 20.0);
        transactions.rollback();

        // Then
        assertEquals(List.of(List.of(1)), orders.lookupAll(List.of("orderid"), Map.of()));
    }

    @Test
    void testClose_WithoutCommit_RollsBack() {
        // Given
        transactions.begin();
        insertOrder(1, "Acme", 10.0);

        // When
        transactions.close(false);

        // Then
        assertRowCount(ORDERS, 0);
    }

    @Test
    void testMapperWrites_InSharedTransaction_CommitTogether() {
        // Given
        MapperOptions options = new MapperOptions().withEnableTransactions(false);
        RecordMapper first = new RecordMapper(store, ORDERS, List.of("orderid"), options, Map.of("orderid", 1));
        RecordMapper second = new RecordMapper(store, ORDERS, List.of("orderid"), options, Map.of("orderid", 2));

        // When
        transactions.run(() -> {
            first.add(false, false, true);
            second.add(false, false, true);
        }, true);

        // Then
        assertRowCount(ORDERS, 2);
    }

    @Test
    void testRequireEditSession_WithoutOpenSession_ThrowsTransactionState() {
        // Given
        MapperOptions options = new MapperOptions()
            .withEnableTransactions(false)
            .withRequireEditSession(true);
        RecordMapper record = new RecordMapper(store, ORDERS, List.of("orderid"), options, Map.of("orderid", 1));

        // When & Then
        assertThrows(TransactionStateException.class, () -> record.add(false, false, true));
        assertRowCount(ORDERS, 0);
    }

    @Test
    void testCopy_WhenAllRowsSucceed_CopiesEveryRow() {
        // Given
        insertOrder(1, "Acme", 10.0);
        insertOrder(2, "Acme", 20.0);
        insertOrder(3, "Other", 30.0);

        // When
        int copied = new RecordCopier(store).copy(ORDERS, ORDER_ARCHIVE, "supplier='Acme'",
            null, Map.of("archived_by", "nightly"), new CopyOptions());

        // Then
        assertEquals(2, copied);
        assertEquals(List.of(List.of(1, "nightly"), List.of(2, "nightly")),
            new CrudEngine(store, ORDER_ARCHIVE).lookupAll(List.of("orderid", "archived_by"), Map.of()));
    }

    @Test
    void testCopy_WhenStoreFailsMidway_CopiesNothing() {
        // Given
        insertOrder(1, "Acme", 10.0);
        insertOrder(2, "Acme", 20.0);
        insertOrder(3, "Acme", 30.0);
        failAfterWrites(1);

        // When
        assertThrows(SchemaMismatchException.class, () -> new RecordCopier(store).copy(
            ORDERS, ORDER_ARCHIVE, "*", null, null, new CopyOptions()));

        // Then
        assertRowCount(ORDER_ARCHIVE, 0);
        assertRowCount(ORDERS, 3);
    }
}
