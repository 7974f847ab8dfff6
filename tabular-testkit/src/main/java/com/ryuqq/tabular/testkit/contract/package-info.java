/**
 * Contract tests every {@link com.ryuqq.tabular.core.spi.TabularStore} adapter must pass.
 *
 * <p>Adapters extend each suite and implement
 * {@link com.ryuqq.tabular.testkit.contract.AbstractContractTest#createStore(java.util.List)}.</p>
 */
package com.ryuqq.tabular.testkit.contract;
