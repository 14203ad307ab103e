package com.ryuqq.delegator.core.statemachine;

/**
 * 단계 전이 검증 및 실행.
 *
 * <p><strong>허용되는 전이:</strong></p>
 * <ul>
 *   <li>AWAITING_STUDY → AWAITING_STUDY (Study 재시도), AWAITING_CODE, EXHAUSTED, FAILED</li>
 *   <li>AWAITING_CODE → AWAITING_CODE (Code 재시도), AWAITING_VERIFY, EXHAUSTED, FAILED</li>
 *   <li>AWAITING_VERIFY → AWAITING_CODE (반려), AWAITING_STUDY (재분석), DONE, FAILED</li>
 * </ul>
 *
 * <p><strong>불변식:</strong> 종료 상태(DONE, EXHAUSTED, FAILED)에서는 어떤 상태로도 전이 불가</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class PhaseTransition {

    // Utility class - prevent instantiation
    private PhaseTransition() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 단계 전이가 유효한지 검증.
     *
     * @param from 현재 단계
     * @param to 전이할 단계
     * @throws IllegalArgumentException from 또는 to가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static void validate(Phase from, Phase to) {
        if (from == null || to == null) {
            throw new IllegalArgumentException("Phases cannot be null (from: " + from + ", to: " + to + ")");
        }

        if (from.isTerminal()) {
            throw new IllegalStateException(
                String.format("Cannot transition from terminal phase: %s → %s", from, to)
            );
        }

        boolean valid = switch (from) {
            case AWAITING_STUDY -> to == Phase.AWAITING_STUDY || to == Phase.AWAITING_CODE
                || to == Phase.EXHAUSTED || to == Phase.FAILED;
            case AWAITING_CODE -> to == Phase.AWAITING_CODE || to == Phase.AWAITING_VERIFY
                || to == Phase.EXHAUSTED || to == Phase.FAILED;
            case AWAITING_VERIFY -> to == Phase.AWAITING_CODE || to == Phase.AWAITING_STUDY
                || to == Phase.DONE || to == Phase.FAILED;
            case DONE, EXHAUSTED, FAILED -> false;
        };

        if (!valid) {
            throw new IllegalStateException(
                String.format("Invalid phase transition: %s → %s", from, to)
            );
        }
    }

    /**
     * 단계 전이 실행 (검증 후).
     *
     * @param current 현재 단계
     * @param next 다음 단계
     * @return 전이된 단계 (next)
     * @throws IllegalArgumentException current 또는 next가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static Phase transition(Phase current, Phase next) {
        validate(current, next);
        return next;
    }
}
