package com.ryuqq.delegator.core.event;

import com.ryuqq.delegator.core.error.ErrorKind;

/**
 * 오케스트레이션 종료 행동.
 *
 * <p><strong>두 가지 형태:</strong></p>
 * <ul>
 *   <li>완료 (completed=true): 검증 승인, errorKind는 null</li>
 *   <li>미완료 (completed=false): errorKind로 종료 사유 표시
 *       (BUDGET_EXHAUSTED, DELEGATION_FAILURE, INVALID_PAIRING, MALFORMED_INPUTS)</li>
 * </ul>
 *
 * @param summary 사람이 읽을 수 있는 결과 요약
 * @param completed 작업 완료 여부
 * @param errorKind 미완료 사유 (completed=true이면 null)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record FinishAction(
    String summary,
    boolean completed,
    ErrorKind errorKind
) implements Action {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException summary가 비어있거나 completed와 errorKind가 모순되는 경우
     */
    public FinishAction {
        if (summary == null || summary.isBlank()) {
            throw new IllegalArgumentException("summary cannot be null or blank");
        }
        if (completed && errorKind != null) {
            throw new IllegalArgumentException("completed finish cannot carry errorKind (current: " + errorKind + ")");
        }
        if (!completed && errorKind == null) {
            throw new IllegalArgumentException("incomplete finish requires errorKind");
        }
    }

    /**
     * 완료 종료 생성.
     *
     * @param summary 결과 요약
     * @return FinishAction (completed=true)
     */
    public static FinishAction completed(String summary) {
        return new FinishAction(summary, true, null);
    }

    /**
     * 미완료 종료 생성.
     *
     * @param errorKind 종료 사유
     * @param summary 결과 요약
     * @return FinishAction (completed=false)
     */
    public static FinishAction incomplete(ErrorKind errorKind, String summary) {
        return new FinishAction(summary, false, errorKind);
    }

    /**
     * 치명적 오케스트레이션 오류로 종료되었는지 확인.
     *
     * <p>false여도 FinishAction은 항상 최종 결과입니다. BUDGET_EXHAUSTED와
     * DELEGATION_FAILURE(Study 실패 포함)는 오케스트레이터 오류가 아닌 미완료 종료입니다.</p>
     *
     * @return INVALID_PAIRING 또는 MALFORMED_INPUTS로 종료된 경우 true
     */
    public boolean isFatal() {
        return errorKind != null && errorKind.isFatal();
    }
}
