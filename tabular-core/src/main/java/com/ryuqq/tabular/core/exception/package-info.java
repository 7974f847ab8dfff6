/**
 * Error taxonomy of the persistence layer.
 *
 * <ul>
 *   <li>{@link com.ryuqq.tabular.core.exception.IdentityException} - Unknown key columns or no usable identity</li>
 *   <li>{@link com.ryuqq.tabular.core.exception.MultiplicityException} - More rows matched than allowed</li>
 *   <li>{@link com.ryuqq.tabular.core.exception.NotFoundException} - No row matched where one was required</li>
 *   <li>{@link com.ryuqq.tabular.core.exception.SchemaMismatchException} - Store rejected a write</li>
 *   <li>{@link com.ryuqq.tabular.core.exception.InsertTargetExistsException} - Insert required but the row exists</li>
 *   <li>{@link com.ryuqq.tabular.core.exception.TransactionStateException} - Missing edit session or diverged audit table</li>
 *   <li>{@link com.ryuqq.tabular.core.exception.PreconditionException} - Caller precondition violated</li>
 *   <li>{@link com.ryuqq.tabular.core.exception.AuditConfigurationException} - Table cannot be audited</li>
 *   <li>{@link com.ryuqq.tabular.core.exception.StoreException} - Raised by store implementations</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Tabular Team
 */
package com.ryuqq.tabular.core.exception;
