package com.ryuqq.tabular.testkit.contract;

import com.ryuqq.tabular.core.model.TableSchema;
import com.ryuqq.tabular.core.spi.TabularStore;

import java.util.List;

/**
 * Runs {@link CrudContractTest} against the in-memory store.
 */
class InMemoryCrudContractTest extends CrudContractTest {

    @Override
    protected TabularStore createStore(List<TableSchema> tables) {
        return InMemoryStores.withTables(tables);
    }
}
