/**
 * 레코드 매퍼 (ORM).
 *
 * <p><strong>주요 구성요소:</strong></p>
 * <ul>
 *   <li>{@link com.ryuqq.tabular.engine.orm.RecordMapper} - 한 행에 대응하는 레코드, 3단계 read, add/update/delete</li>
 *   <li>{@link com.ryuqq.tabular.engine.orm.Members} - 스키마 순서 멤버 + 스키마 밖 멤버</li>
 *   <li>{@link com.ryuqq.tabular.engine.orm.MapperOptions} - 트랜잭션, 감사 로그, read 검사 설정</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Tabular Team
 */
package com.ryuqq.tabular.engine.orm;
