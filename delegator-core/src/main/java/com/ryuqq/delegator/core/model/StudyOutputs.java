package com.ryuqq.delegator.core.model;

/**
 * Study 위임 출력.
 *
 * @param summary 작업 분석 요약 (필수)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record StudyOutputs(String summary) implements DelegationOutputs {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException summary가 null이거나 빈 문자열인 경우
     */
    public StudyOutputs {
        if (summary == null || summary.isBlank()) {
            throw new IllegalArgumentException("summary cannot be null or blank");
        }
    }

    @Override
    public Role role() {
        return Role.STUDY;
    }
}
