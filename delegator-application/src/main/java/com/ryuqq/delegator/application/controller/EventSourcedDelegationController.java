package com.ryuqq.delegator.application.controller;

import com.ryuqq.delegator.core.error.ErrorKind;
import com.ryuqq.delegator.core.error.OrchestrationException;
import com.ryuqq.delegator.core.event.Action;
import com.ryuqq.delegator.core.event.DelegateAction;
import com.ryuqq.delegator.core.event.Event;
import com.ryuqq.delegator.core.event.FinishAction;
import com.ryuqq.delegator.core.policy.DelegationBudget;
import com.ryuqq.delegator.core.policy.PhasePolicy;
import com.ryuqq.delegator.core.reconstruct.DerivedState;
import com.ryuqq.delegator.core.reconstruct.StateReconstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Event Log 기반 {@link DelegationController} 구현체.
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * step(log)
 *   1. StateReconstructor.reconstruct(log) → DerivedState
 *      - InvalidPairing / MalformedInputs → 치명적 FinishAction
 *   2. 대기 중인 위임 존재 → 치명적 FinishAction (INVALID_PAIRING)
 *   3. PhasePolicy.decide(task, state) → Action
 *      - MalformedInputs → 치명적 FinishAction
 *      - 예상치 못한 RuntimeException → 치명적 FinishAction (MALFORMED_INPUTS)
 * </pre>
 *
 * <p>부수 효과는 로깅뿐이며, 인스턴스 간/호출 간 공유 상태가 없어 thread-safe합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class EventSourcedDelegationController implements DelegationController {

    private static final Logger log = LoggerFactory.getLogger(EventSourcedDelegationController.class);

    private final StateReconstructor reconstructor;
    private final PhasePolicy policy;

    /**
     * 기본 예산 생성자.
     */
    public EventSourcedDelegationController() {
        this(new DelegationBudget());
    }

    /**
     * 예산 지정 생성자.
     *
     * @param budget 위임 예산
     * @throws IllegalArgumentException budget이 null인 경우
     */
    public EventSourcedDelegationController(DelegationBudget budget) {
        this(new StateReconstructor(), new PhasePolicy(budget));
    }

    /**
     * 생성자 (구성 요소 주입).
     *
     * @param reconstructor 상태 재구성기
     * @param policy 단계 정책
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public EventSourcedDelegationController(StateReconstructor reconstructor, PhasePolicy policy) {
        if (reconstructor == null) {
            throw new IllegalArgumentException("reconstructor cannot be null");
        }
        if (policy == null) {
            throw new IllegalArgumentException("policy cannot be null");
        }
        this.reconstructor = reconstructor;
        this.policy = policy;
    }

    @Override
    public Action step(List<? extends Event> events) {
        if (events == null) {
            return fatal(ErrorKind.MALFORMED_INPUTS, "event log cannot be null");
        }

        DerivedState state;
        try {
            state = reconstructor.reconstruct(events);
        } catch (OrchestrationException e) {
            return fatal(e.kind(), e.getMessage());
        } catch (RuntimeException e) {
            log.error("Unexpected failure while reconstructing {} event(s)", events.size(), e);
            return fatal(ErrorKind.MALFORMED_INPUTS, "state reconstruction failed: " + e.getMessage());
        }

        if (state.hasOutstandingDelegation()) {
            return fatal(ErrorKind.INVALID_PAIRING,
                state.pendingRole() + " delegation is still outstanding; append its observation before stepping");
        }

        Action action;
        try {
            action = policy.decide(state.task(), state);
        } catch (OrchestrationException e) {
            return fatal(e.kind(), e.getMessage());
        } catch (RuntimeException e) {
            log.error("Policy failed in phase {} (iteration {})", state.phase(), state.iteration(), e);
            return fatal(ErrorKind.MALFORMED_INPUTS, "policy failed: " + e.getMessage());
        }

        if (action instanceof DelegateAction delegation) {
            log.debug("Delegating to {} (phase={}, iteration={})", delegation.role(), state.phase(), state.iteration());
        } else if (action instanceof FinishAction finish) {
            log.info("Orchestration finished: completed={}, errorKind={}, summary={}",
                finish.completed(), finish.errorKind(), finish.summary());
        }
        return action;
    }

    private static FinishAction fatal(ErrorKind kind, String message) {
        log.warn("Orchestration halted ({}): {}", kind, message);
        return FinishAction.incomplete(kind, "Orchestration error [" + kind + "]: " + message);
    }
}
