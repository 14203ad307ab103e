package com.ryuqq.delegator.core.model;

/**
 * 역할별 위임 입력.
 *
 * <p>역할마다 필수 필드가 다르므로 역할별 record로 분리하고,
 * Sealed interface로 모든 케이스를 컴파일 타임에 고정합니다.</p>
 *
 * <ul>
 *   <li>{@link StudyInputs}: task (+ 재분석 시 priorSummary, feedback)</li>
 *   <li>{@link CodeInputs}: task, studySummary, verifierFeedback(선택)</li>
 *   <li>{@link VerifyInputs}: task, studySummary, changes(선택)</li>
 * </ul>
 *
 * <p>필수 필드가 누락되면 {@link com.ryuqq.delegator.core.error.MalformedInputsException}이 발생합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public sealed interface DelegationInputs permits StudyInputs, CodeInputs, VerifyInputs {

    /**
     * 입력이 속한 역할.
     *
     * @return 역할
     */
    Role role();

    /**
     * 대상 작업.
     *
     * @return 작업 (non-null)
     */
    Task task();
}
