package com.ryuqq.tabular.core.session;

/**
 * Edit session 상태 전이 검증 및 실행.
 *
 * <p>{@link com.ryuqq.tabular.core.spi.EditSession} 구현체는 모든 상태 변경을
 * 이 클래스를 통해 수행하여 operation 중첩과 같은 잘못된 호출을 차단합니다.</p>
 *
 * <p><strong>허용되는 전이:</strong></p>
 * <ul>
 *   <li>CLOSED → EDITING</li>
 *   <li>EDITING → OPERATION</li>
 *   <li>EDITING → CLOSED</li>
 *   <li>OPERATION → EDITING</li>
 *   <li>OPERATION → CLOSED</li>
 * </ul>
 *
 * @author Tabular Team
 * @since 1.0.0
 */
public final class SessionTransition {

    // Utility class - prevent instantiation
    private SessionTransition() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 상태 전이가 유효한지 검증.
     *
     * @param from 현재 상태
     * @param to 전이할 상태
     * @throws IllegalArgumentException from 또는 to가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static void validate(EditSessionState from, EditSessionState to) {
        if (from == null || to == null) {
            throw new IllegalArgumentException("States cannot be null (from: " + from + ", to: " + to + ")");
        }

        boolean valid = switch (from) {
            case CLOSED -> to == EditSessionState.EDITING;
            case EDITING -> to == EditSessionState.OPERATION || to == EditSessionState.CLOSED;
            case OPERATION -> to == EditSessionState.EDITING || to == EditSessionState.CLOSED;
        };

        if (!valid) {
            throw new IllegalStateException(
                String.format("Invalid edit session transition: %s → %s", from, to)
            );
        }
    }

    /**
     * 상태 전이 실행 (검증 후).
     *
     * @param current 현재 상태
     * @param next 다음 상태
     * @return 전이된 상태 (next)
     * @throws IllegalArgumentException current 또는 next가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static EditSessionState transition(EditSessionState current, EditSessionState next) {
        validate(current, next);
        return next;
    }
}
