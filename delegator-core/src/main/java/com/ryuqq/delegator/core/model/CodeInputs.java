package com.ryuqq.delegator.core.model;

import com.ryuqq.delegator.core.error.MalformedInputsException;

/**
 * Code 위임 입력.
 *
 * @param task 대상 작업 (필수)
 * @param studySummary Study 단계 요약 (필수, 빈 문자열 불가)
 * @param verifierFeedback 직전 검증 피드백 (재시도 시, null 가능)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record CodeInputs(
    Task task,
    String studySummary,
    String verifierFeedback
) implements DelegationInputs {

    /**
     * Compact Constructor.
     *
     * @throws MalformedInputsException task 또는 studySummary가 누락된 경우
     */
    public CodeInputs {
        if (task == null) {
            throw MalformedInputsException.missingField("CODE", "task");
        }
        if (studySummary == null || studySummary.isBlank()) {
            throw MalformedInputsException.missingField("CODE", "studySummary");
        }
        // verifierFeedback는 null 허용
    }

    @Override
    public Role role() {
        return Role.CODE;
    }

    /**
     * 검증 피드백 포함 여부.
     *
     * @return verifierFeedback가 비어있지 않으면 true
     */
    public boolean hasFeedback() {
        return verifierFeedback != null && !verifierFeedback.isBlank();
    }
}
