/**
 * Edit session 상태 머신.
 *
 * <p>{@link com.ryuqq.tabular.core.session.EditSessionState}와
 * {@link com.ryuqq.tabular.core.session.SessionTransition}은 모든 EditSession 구현체가
 * 공유하는 전이 규칙을 정의합니다.</p>
 *
 * @since 1.0.0
 * @author Tabular Team
 */
package com.ryuqq.tabular.core.session;
