/**
 * 레코드 식별: 대리 기본 키와 복합 비즈니스 키.
 *
 * <p>{@link com.ryuqq.tabular.core.key.KeyResolver}가 키 명세를 스키마에 대해 검증하고
 * {@link com.ryuqq.tabular.core.key.Key} 구현체로 해석합니다.</p>
 *
 * @since 1.0.0
 * @author Tabular Team
 */
package com.ryuqq.tabular.core.key;
