package com.ryuqq.delegator.core.model;

import com.ryuqq.delegator.core.error.MalformedInputsException;

/**
 * Study 위임 입력.
 *
 * <p>최초 분석은 task만 전달합니다. 검증 단계에서 재분석을 요청한 경우
 * 직전 요약(priorSummary)과 검증 피드백(feedback)을 함께 전달합니다.</p>
 *
 * @param task 대상 작업 (필수)
 * @param priorSummary 직전 분석 요약 (재분석 시, null 가능)
 * @param feedback 재분석 사유 (재분석 시, null 가능)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record StudyInputs(
    Task task,
    String priorSummary,
    String feedback
) implements DelegationInputs {

    /**
     * Compact Constructor.
     *
     * @throws MalformedInputsException task가 null인 경우
     */
    public StudyInputs {
        if (task == null) {
            throw MalformedInputsException.missingField("STUDY", "task");
        }
    }

    /**
     * 최초 분석 입력 생성.
     *
     * @param task 대상 작업
     * @return StudyInputs 인스턴스
     */
    public static StudyInputs of(Task task) {
        return new StudyInputs(task, null, null);
    }

    @Override
    public Role role() {
        return Role.STUDY;
    }

    /**
     * 재분석 요청인지 확인.
     *
     * @return priorSummary가 있으면 true
     */
    public boolean isRestudy() {
        return priorSummary != null && !priorSummary.isBlank();
    }
}
