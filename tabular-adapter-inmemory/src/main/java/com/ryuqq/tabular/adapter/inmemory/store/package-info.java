/**
 * In-memory implementation of the tabular store and edit session SPIs.
 *
 * <p>Rows are held in memory and edit sessions roll back by restoring workspace
 * snapshots. Intended for tests and as a reference for real adapters.</p>
 *
 * @since 1.0.0
 * @author Tabular Team
 */
package com.ryuqq.tabular.adapter.inmemory.store;
