package com.ryuqq.delegator.core.spi;

import com.ryuqq.delegator.core.event.DelegateAction;
import com.ryuqq.delegator.core.event.Observation;
import com.ryuqq.delegator.core.model.Role;

/**
 * 전문 에이전트 호출 SPI.
 *
 * <p>Orchestrator는 에이전트를 직접 호출하지 않습니다.
 * 위임을 실행하는 호출자(세션 러너)가 이 인터페이스로 에이전트를 호출하고,
 * 반환된 Observation을 Event Log에 추가합니다.</p>
 *
 * <p><strong>계약:</strong></p>
 * <ul>
 *   <li>하나의 DelegateAction에 대해 정확히 하나의 Observation 반환</li>
 *   <li>STUDY → {@code StudyOutputs{summary}}</li>
 *   <li>CODE → {@code CodeOutputs{diffOrFiles}}</li>
 *   <li>VERIFY → {@code VerifyOutputs{approved, feedback}}</li>
 *   <li>예외를 던지면 호출자가 복구 가능한 ErrorObservation으로 변환</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface SpecialistAgent {

    /**
     * 담당 역할.
     *
     * @return 역할
     */
    Role role();

    /**
     * 위임 처리.
     *
     * @param action 이 에이전트의 역할로 발행된 위임
     * @return 위임 결과 (DelegateObservation 또는 ErrorObservation)
     */
    Observation handle(DelegateAction action);
}
