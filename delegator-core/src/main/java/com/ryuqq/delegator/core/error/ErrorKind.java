package com.ryuqq.delegator.core.error;

/**
 * 오케스트레이션 오류 분류.
 *
 * <p><strong>전파 정책:</strong></p>
 * <ul>
 *   <li>{@link #INVALID_PAIRING}, {@link #MALFORMED_INPUTS}: 오케스트레이션 내부 버그 → 치명적, 재시도 불가</li>
 *   <li>{@link #DELEGATION_FAILURE}: 전문 에이전트 실패 → 반복 예산 내에서 재시도</li>
 *   <li>{@link #BUDGET_EXHAUSTED}: 승인 없이 반복 예산 소진 → 미완료 종료 (크래시 아님)</li>
 * </ul>
 *
 * <p>{@code fatal}은 "오케스트레이션 자체가 잘못됨"(로그/입력 오류)을,
 * {@code retryable}은 "관측 단계에서 Policy가 예산 안에서 다시 위임함"을 뜻합니다.
 * 따라서 {@link #DELEGATION_FAILURE}를 담은 {@code FinishAction}은 해당 역할의 예산이
 * 이미 소진되었거나(Study 실패 포함) 복구 불가 오류가 난 종료 상태이며,
 * {@code isFatal()}이 false여도 다시 step해서 재시도되지 않습니다.</p>
 *
 * <p>어떤 경우에도 예외는 Controller 경계를 넘지 않으며,
 * {@code FinishAction}의 errorKind로 보고됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum ErrorKind {

    /**
     * 관측 결과가 대기 중인 위임의 역할과 맞지 않거나, 대기 중인 위임 없이 나타남.
     */
    INVALID_PAIRING(true, false),

    /**
     * 전문 에이전트가 FAILURE 또는 ErrorObservation을 반환함.
     *
     * <p>종료 행동에 실린 경우: Study 실패 예산 소진 또는 복구 불가 오류 (종료, 재시도 없음).</p>
     */
    DELEGATION_FAILURE(false, true),

    /**
     * 반복 횟수가 maxIterations에 도달함.
     */
    BUDGET_EXHAUSTED(false, false),

    /**
     * 위임 입력 구성 시 필수 필드 누락 (Policy 버그).
     */
    MALFORMED_INPUTS(true, false);

    private final boolean fatal;
    private final boolean retryable;

    ErrorKind(boolean fatal, boolean retryable) {
        this.fatal = fatal;
        this.retryable = retryable;
    }

    /**
     * 치명적 오류인지 확인.
     *
     * @return 오케스트레이션 자체의 결함을 나타내면 true
     */
    public boolean isFatal() {
        return fatal;
    }

    /**
     * 재시도 루프로 복귀 가능한지 확인.
     *
     * @return 재시도 가능하면 true
     */
    public boolean isRetryable() {
        return retryable;
    }
}
