package com.ryuqq.delegator.core.model;

/**
 * 위임 대상 전문 에이전트 역할.
 *
 * <p>Orchestrator가 위임할 수 있는 역할은 세 가지로 고정되어 있으며,
 * 역할마다 입력/출력 스키마가 정해져 있습니다.</p>
 *
 * <ul>
 *   <li>{@link #STUDY}: 작업 분석 및 요약 ({@code StudyInputs → StudyOutputs})</li>
 *   <li>{@link #CODE}: 변경 사항 작성 ({@code CodeInputs → CodeOutputs})</li>
 *   <li>{@link #VERIFY}: 변경 사항 검증 ({@code VerifyInputs → VerifyOutputs})</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum Role {

    /**
     * 작업 분석.
     */
    STUDY,

    /**
     * 코드 작성.
     */
    CODE,

    /**
     * 검증.
     */
    VERIFY
}
