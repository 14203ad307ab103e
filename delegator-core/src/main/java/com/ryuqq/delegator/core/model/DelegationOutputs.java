package com.ryuqq.delegator.core.model;

/**
 * 역할별 위임 출력.
 *
 * <ul>
 *   <li>{@link StudyOutputs}: summary</li>
 *   <li>{@link CodeOutputs}: diffOrFiles</li>
 *   <li>{@link VerifyOutputs}: approved, feedback, restudyRequested</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public sealed interface DelegationOutputs permits StudyOutputs, CodeOutputs, VerifyOutputs {

    /**
     * 출력을 생성한 역할.
     *
     * @return 역할
     */
    Role role();
}
