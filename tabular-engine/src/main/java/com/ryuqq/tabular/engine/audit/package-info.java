/**
 * update/delete 직전 행을 {@code <table>_log} shadow 테이블에 남기는 감사 로그.
 *
 * @since 1.0.0
 * @author Tabular Team
 */
package com.ryuqq.tabular.engine.audit;
