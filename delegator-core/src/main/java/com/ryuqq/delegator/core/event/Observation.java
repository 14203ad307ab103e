package com.ryuqq.delegator.core.event;

/**
 * 위임 실행 결과 관측.
 *
 * <p>호출자는 하나의 {@link DelegateAction}마다 정확히 하나의 Observation을 로그에 추가해야 합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public sealed interface Observation extends Event permits DelegateObservation, ErrorObservation {
}
