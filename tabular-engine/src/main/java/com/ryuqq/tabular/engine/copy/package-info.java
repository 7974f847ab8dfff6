/**
 * 테이블 간 일괄 복사 (all-or-nothing).
 *
 * @since 1.0.0
 * @author Tabular Team
 */
package com.ryuqq.tabular.engine.copy;
