package com.ryuqq.delegator.application.controller;

import com.ryuqq.delegator.core.event.Action;
import com.ryuqq.delegator.core.event.Event;
import com.ryuqq.delegator.core.spi.EventLog;

import java.util.List;

/**
 * 위임 오케스트레이션 진입점.
 *
 * <p>호출할 때마다 Event Log 전체를 읽어 상태를 재구성하고, 다음 행동 하나를 반환합니다.
 * 호출 간에 어떤 상태도 보관하지 않으며, 위임 실행(전문 에이전트 호출)은 호출자의 몫입니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * log.append(TaskSubmitted.of(Task.of("add endpoint")));
 * Action action = controller.step(log);
 * while (action instanceof DelegateAction delegation) {
 *     log.append(delegation);
 *     log.append(agents.get(delegation.role()).handle(delegation));
 *     action = controller.step(log);
 * }
 * FinishAction result = (FinishAction) action;
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface DelegationController {

    /**
     * 다음 행동 결정.
     *
     * <p><strong>보장 사항:</strong></p>
     * <ul>
     *   <li>예외를 던지지 않음: 모든 오류는 {@code FinishAction}의 errorKind로 보고</li>
     *   <li>결정적: 같은 로그에 대해 항상 같은 결과</li>
     *   <li>로그가 대기 중인 위임으로 끝나면 새 DelegateAction을 반환하지 않음</li>
     *   <li>로그 불일치 시 위임하지 않고 치명적 FinishAction 반환</li>
     * </ul>
     *
     * @param log 작업 시작부터의 전체 이벤트 목록
     * @return DelegateAction 또는 FinishAction (non-null)
     */
    Action step(List<? extends Event> log);

    /**
     * Event Log의 현재 스냅샷으로 다음 행동 결정.
     *
     * @param log Event Log
     * @return DelegateAction 또는 FinishAction (non-null)
     */
    default Action step(EventLog log) {
        return step(log == null ? null : log.read());
    }
}
