package com.ryuqq.delegator.application.session;

import com.ryuqq.delegator.core.event.FinishAction;
import com.ryuqq.delegator.core.model.Task;
import com.ryuqq.delegator.core.spi.EventLog;

/**
 * 위임 세션 실행기 (호출자 측 루프).
 *
 * <p>Controller에게 다음 행동을 묻고, 위임을 전문 에이전트에게 실행시킨 뒤,
 * 결과를 Event Log에 추가하는 과정을 FinishAction이 나올 때까지 반복합니다.</p>
 *
 * <p><strong>세션 흐름:</strong></p>
 * <pre>
 * run(log, task)
 *   ↓
 * 로그가 비어있으면 TaskSubmitted 추가 (비어있지 않으면 이어서 진행)
 *   ↓
 * loop:
 *   1. 로그가 대기 중인 위임으로 끝나면 (크래시 복구) 그 위임을 다시 실행
 *   2. 아니면 controller.step(log) → Action, 로그에 추가
 *   3. FinishAction → 종료
 *   4. DelegateAction → 역할별 SpecialistAgent 실행 → Observation 추가
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface DelegationSession {

    /**
     * 세션을 끝까지 실행.
     *
     * @param log 세션의 Event Log (비어있거나, 이전 세션을 이어갈 로그)
     * @param task 접수할 작업 (로그가 비어있을 때만 사용)
     * @return 최종 결과
     * @throws IllegalArgumentException log가 null이거나, 빈 로그에 task가 null인 경우
     */
    FinishAction run(EventLog log, Task task);
}
