package com.ryuqq.tabular.core.session;

/**
 * Edit session의 생명주기 상태.
 *
 * <p><strong>상태 전이 규칙:</strong></p>
 * <ul>
 *   <li>CLOSED → EDITING (startEditing)</li>
 *   <li>EDITING → OPERATION (startOperation)</li>
 *   <li>OPERATION → EDITING (stopOperation / abortOperation)</li>
 *   <li>EDITING → CLOSED (stopEditing)</li>
 *   <li>OPERATION → CLOSED (stopEditing, 열린 operation은 저장 여부에 따라 반영 또는 폐기)</li>
 * </ul>
 *
 * <p><strong>상태 전이 다이어그램:</strong></p>
 * <pre>
 * CLOSED ──startEditing──► EDITING ──startOperation──► OPERATION
 *    ▲                        │  ▲                          │
 *    └────stopEditing─────────┘  └──stop/abortOperation─────┘
 *
 * 금지된 전이:
 * - CLOSED → OPERATION ❌ (편집 시작 전 operation 불가)
 * - OPERATION → OPERATION ❌ (operation 중첩 불가)
 * </pre>
 *
 * @author Tabular Team
 * @since 1.0.0
 */
public enum EditSessionState {

    /**
     * 편집 중이 아님.
     */
    CLOSED,

    /**
     * 편집 세션 열림, operation 없음.
     */
    EDITING,

    /**
     * 편집 세션 안에서 operation 진행 중.
     */
    OPERATION;

    /**
     * 편집 세션이 열려 있는지 확인.
     *
     * @return EDITING 또는 OPERATION이면 true
     */
    public boolean isEditing() {
        return this != CLOSED;
    }
}
