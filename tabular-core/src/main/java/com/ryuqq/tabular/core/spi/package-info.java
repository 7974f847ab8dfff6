/**
 * Service Provider Interfaces implemented by tabular store adapters.
 *
 * <h2>Interfaces</h2>
 * <ul>
 *   <li>{@link com.ryuqq.tabular.core.spi.TabularStore} - Schema, counting, cursors, table management</li>
 *   <li>{@link com.ryuqq.tabular.core.spi.RowCursor} - Forward-only read cursor</li>
 *   <li>{@link com.ryuqq.tabular.core.spi.UpdateCursor} - Cursor that rewrites or deletes rows</li>
 *   <li>{@link com.ryuqq.tabular.core.spi.InsertCursor} - Cursor that appends rows</li>
 *   <li>{@link com.ryuqq.tabular.core.spi.EditSession} - Edit session and edit operation primitive</li>
 * </ul>
 *
 * <h2>Implementations</h2>
 * <ul>
 *   <li>{@code tabular-adapter-inmemory} - Reference implementation for tests</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Tabular Team
 */
package com.ryuqq.tabular.core.spi;
