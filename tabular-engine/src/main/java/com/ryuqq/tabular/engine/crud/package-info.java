/**
 * 테이블 단위 CRUD 엔진과 upsert 정책.
 *
 * @since 1.0.0
 * @author Tabular Team
 */
package com.ryuqq.tabular.engine.crud;
