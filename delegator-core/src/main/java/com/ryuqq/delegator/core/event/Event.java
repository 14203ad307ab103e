package com.ryuqq.delegator.core.event;

/**
 * Event Log에 기록되는 이벤트.
 *
 * <p>Event Log는 이 이벤트들의 append-only 순서열이며, Orchestrator의 유일한 상태입니다.
 * 단계, 반복 횟수, 요약 등은 모두 로그에서 매번 다시 계산됩니다.</p>
 *
 * <ul>
 *   <li>{@link TaskSubmitted}: 작업 접수 (로그의 첫 이벤트, 정확히 한 번)</li>
 *   <li>{@link Action}: Controller가 반환하는 다음 행동 ({@link DelegateAction}, {@link FinishAction})</li>
 *   <li>{@link Observation}: 위임 실행 결과 ({@link DelegateObservation}, {@link ErrorObservation})</li>
 * </ul>
 *
 * <p>모든 구현은 불변 record입니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public sealed interface Event permits TaskSubmitted, Action, Observation {
}
