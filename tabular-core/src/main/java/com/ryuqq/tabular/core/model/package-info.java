/**
 * Table structure and row representation.
 *
 * <h2>Schema</h2>
 * <ul>
 *   <li>{@link com.ryuqq.tabular.core.model.TableSchema} - Named, ordered column list (canonical column order)</li>
 *   <li>{@link com.ryuqq.tabular.core.model.Column} - Name, type, nullability, editability, length</li>
 *   <li>{@link com.ryuqq.tabular.core.model.ColumnType} - Storage types and the Java values they accept</li>
 * </ul>
 *
 * <h2>Rows</h2>
 * <ul>
 *   <li>{@link com.ryuqq.tabular.core.model.ColumnLayout} - Name to index translation fixed at cursor open</li>
 *   <li>{@link com.ryuqq.tabular.core.model.Row} - Positional and named access plus a geometry accessor</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Tabular Team
 */
package com.ryuqq.tabular.core.model;
