package com.ryuqq.delegator.core.model;

import com.ryuqq.delegator.core.error.MalformedInputsException;

/**
 * Verify 위임 입력.
 *
 * @param task 대상 작업 (필수)
 * @param studySummary Study 단계 요약 (필수, 빈 문자열 불가)
 * @param changes 검증할 최신 Code 출력 (null 가능)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record VerifyInputs(
    Task task,
    String studySummary,
    String changes
) implements DelegationInputs {

    /**
     * Compact Constructor.
     *
     * @throws MalformedInputsException task 또는 studySummary가 누락된 경우
     */
    public VerifyInputs {
        if (task == null) {
            throw MalformedInputsException.missingField("VERIFY", "task");
        }
        if (studySummary == null || studySummary.isBlank()) {
            throw MalformedInputsException.missingField("VERIFY", "studySummary");
        }
    }

    @Override
    public Role role() {
        return Role.VERIFY;
    }
}
