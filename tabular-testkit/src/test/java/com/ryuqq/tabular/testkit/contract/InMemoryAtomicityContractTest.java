package com.ryuqq.tabular.testkit.contract;

import com.ryuqq.tabular.adapter.inmemory.store.InMemoryTabularStore;
import com.ryuqq.tabular.core.model.TableSchema;
import com.ryuqq.tabular.core.spi.TabularStore;

import java.util.List;

/**
 * Runs {@link AtomicityContractTest} against the in-memory store.
 */
class InMemoryAtomicityContractTest extends AtomicityContractTest {

    private InMemoryTabularStore inMemory;

    @Override
    protected TabularStore createStore(List<TableSchema> tables) {
        inMemory = InMemoryStores.withTables(tables);
        return inMemory;
    }

    @Override
    protected void failAfterWrites(int writes) {
        inMemory.failAfterWrites(writes);
    }
}
