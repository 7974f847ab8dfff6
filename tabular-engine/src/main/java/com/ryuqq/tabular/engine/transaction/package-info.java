/**
 * Edit session 기반 트랜잭션 조정.
 *
 * <p>실패한 쓰기는 항상 rollback 되며 원래 예외가 그대로 전파됩니다.</p>
 *
 * @since 1.0.0
 * @author Tabular Team
 */
package com.ryuqq.tabular.engine.transaction;
