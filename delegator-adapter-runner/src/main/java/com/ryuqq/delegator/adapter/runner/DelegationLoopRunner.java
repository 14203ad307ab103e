package com.ryuqq.delegator.adapter.runner;

import com.ryuqq.delegator.application.controller.DelegationController;
import com.ryuqq.delegator.application.session.DelegationSession;
import com.ryuqq.delegator.core.error.OrchestrationException;
import com.ryuqq.delegator.core.event.Action;
import com.ryuqq.delegator.core.event.DelegateAction;
import com.ryuqq.delegator.core.event.ErrorObservation;
import com.ryuqq.delegator.core.event.Event;
import com.ryuqq.delegator.core.event.FinishAction;
import com.ryuqq.delegator.core.event.Observation;
import com.ryuqq.delegator.core.event.TaskSubmitted;
import com.ryuqq.delegator.core.model.Role;
import com.ryuqq.delegator.core.model.Task;
import com.ryuqq.delegator.core.reconstruct.StateReconstructor;
import com.ryuqq.delegator.core.spi.EventLog;
import com.ryuqq.delegator.core.spi.SpecialistAgent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * 위임 루프 러너 구현체.
 *
 * <p>Controller가 반환한 위임을 역할별 {@link SpecialistAgent}로 실행하고,
 * 결과를 Event Log에 추가하는 과정을 FinishAction이 나올 때까지 반복합니다.</p>
 *
 * <p><strong>책임:</strong></p>
 * <ul>
 *   <li>Controller가 반환한 Action을 로그에 추가</li>
 *   <li>위임 실행 및 타임아웃 적용 (delegationTimeoutMs)</li>
 *   <li>에이전트 예외/타임아웃 → 복구 가능한 ErrorObservation 변환</li>
 *   <li>대기 중인 위임으로 끝난 로그 재개 (크래시 복구, 로그가 일관된 경우에만)</li>
 * </ul>
 *
 * <p><strong>동시성:</strong> 한 세션 안에서는 항상 하나의 위임만 실행됩니다.
 * 위임 실행 스레드는 타임아웃 적용을 위한 단일 스레드 풀이며,
 * 타임아웃 후에도 응답하지 않는 에이전트가 스레드를 붙잡으면 풀을 새로 만듭니다.
 * 여러 세션을 동시에 돌리려면 세션마다 러너를 만들어야 합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class DelegationLoopRunner implements DelegationSession {

    private static final Logger log = LoggerFactory.getLogger(DelegationLoopRunner.class);

    private final DelegationController controller;
    private final Map<Role, SpecialistAgent> agents;
    private final SessionRunnerConfig config;
    private final StateReconstructor reconstructor = new StateReconstructor();
    private volatile ExecutorService delegationExecutor;

    /**
     * 생성자 (기본 설정 사용).
     *
     * @param controller 위임 Controller
     * @param agents 역할별 전문 에이전트 (STUDY, CODE, VERIFY 각 하나)
     * @throws IllegalArgumentException 의존성이 null이거나 역할이 누락/중복된 경우
     */
    public DelegationLoopRunner(DelegationController controller, Collection<? extends SpecialistAgent> agents) {
        this(controller, agents, new SessionRunnerConfig());
    }

    /**
     * 생성자.
     *
     * @param controller 위임 Controller
     * @param agents 역할별 전문 에이전트 (STUDY, CODE, VERIFY 각 하나)
     * @param config 설정
     * @throws IllegalArgumentException 의존성이 null이거나 역할이 누락/중복된 경우
     */
    public DelegationLoopRunner(DelegationController controller,
                                Collection<? extends SpecialistAgent> agents,
                                SessionRunnerConfig config) {
        if (controller == null) {
            throw new IllegalArgumentException("controller cannot be null");
        }
        if (agents == null) {
            throw new IllegalArgumentException("agents cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.controller = controller;
        this.agents = indexByRole(agents);
        this.config = config;
        this.delegationExecutor = Executors.newSingleThreadExecutor();
    }

    @Override
    public FinishAction run(EventLog eventLog, Task task) {
        if (eventLog == null) {
            throw new IllegalArgumentException("eventLog cannot be null");
        }
        if (eventLog.isEmpty()) {
            if (task == null) {
                throw new IllegalArgumentException("task cannot be null for a new session");
            }
            eventLog.append(TaskSubmitted.of(task));
            log.info("Session started: goal={}", task.goal());
        } else {
            log.info("Session resumed from {} event(s)", eventLog.size());
        }

        while (true) {
            List<Event> events = eventLog.read();
            Event last = events.get(events.size() - 1);

            // 1. 크래시 등으로 관측 결과 없이 남은 위임 → 다시 실행
            //    (일관되지 않은 로그면 실행하지 않고 Controller가 오류로 종료)
            if (last instanceof DelegateAction outstanding && isResumable(events, outstanding)) {
                log.info("Re-executing outstanding {} delegation", outstanding.role());
                eventLog.append(execute(outstanding));
                continue;
            }

            // 2. 다음 행동 결정
            Action action = controller.step(events);

            // 3. 종료
            if (action instanceof FinishAction finish) {
                if (!finish.equals(last)) {
                    eventLog.append(finish);
                }
                log.info("Session finished: completed={}, errorKind={}", finish.completed(), finish.errorKind());
                return finish;
            }

            // 4. 위임 기록 후 실행
            DelegateAction delegation = (DelegateAction) action;
            eventLog.append(delegation);
            eventLog.append(execute(delegation));
        }
    }

    /**
     * Runner 종료 (리소스 정리).
     *
     * <p>진행 중인 위임이 끝나도록 shutdownTimeoutMs 동안 대기한 뒤 강제 종료합니다.</p>
     *
     * @throws InterruptedException shutdown 대기 중 인터럽트 발생 시
     */
    public void shutdown() throws InterruptedException {
        ExecutorService executor = delegationExecutor;
        executor.shutdown();
        if (!executor.awaitTermination(config.shutdownTimeoutMs(), TimeUnit.MILLISECONDS)) {
            executor.shutdownNow();
        }
    }

    /**
     * 위임 1건 실행.
     *
     * <p>에이전트 예외와 타임아웃은 복구 가능한 ErrorObservation으로 변환되어
     * Policy의 재시도 예산 안에서 처리됩니다.</p>
     *
     * @param delegation 실행할 위임
     * @return 로그에 추가할 관측 결과
     * @throws IllegalStateException 실행 대기 중 인터럽트된 경우 (세션 취소)
     */
    private Observation execute(DelegateAction delegation) {
        SpecialistAgent agent = agents.get(delegation.role());
        long startNanos = System.nanoTime();
        Future<Observation> future = delegationExecutor.submit(() -> agent.handle(delegation));

        try {
            Observation observation = future.get(config.delegationTimeoutMs(), TimeUnit.MILLISECONDS);
            if (observation == null) {
                log.warn("{} agent returned no observation", delegation.role());
                return ErrorObservation.recoverable(delegation.role() + " agent returned no observation");
            }
            log.info("{} delegation answered in {}ms: {}", delegation.role(),
                TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos), observation.getClass().getSimpleName());
            return observation;

        } catch (TimeoutException e) {
            future.cancel(true);
            replaceExecutor();
            log.warn("{} delegation timed out after {}ms", delegation.role(), config.delegationTimeoutMs());
            return ErrorObservation.recoverable(
                delegation.role() + " delegation timed out after " + config.delegationTimeoutMs() + "ms");

        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            log.error("{} agent failed", delegation.role(), cause);
            return ErrorObservation.recoverable(delegation.role() + " agent failed: " + describe(cause));

        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Session interrupted during " + delegation.role() + " delegation", e);
        }
    }

    /**
     * 로그 끝의 대기 위임이 앞선 이력과 짝이 맞는지 확인.
     *
     * @param events 대기 위임으로 끝나는 로그
     * @param outstanding 마지막 위임
     * @return 재실행해도 되면 true
     */
    private boolean isResumable(List<Event> events, DelegateAction outstanding) {
        try {
            return reconstructor.reconstruct(events).pendingRole() == outstanding.role();
        } catch (OrchestrationException e) {
            log.warn("Outstanding {} delegation not re-executed: {}", outstanding.role(), e.getMessage());
            return false;
        }
    }

    // 인터럽트를 무시하는 에이전트가 스레드를 계속 점유해도 다음 위임은 새 스레드에서 실행
    private void replaceExecutor() {
        ExecutorService stuck = delegationExecutor;
        delegationExecutor = Executors.newSingleThreadExecutor();
        stuck.shutdownNow();
    }

    private static Map<Role, SpecialistAgent> indexByRole(Collection<? extends SpecialistAgent> agents) {
        Map<Role, SpecialistAgent> byRole = new EnumMap<>(Role.class);
        for (SpecialistAgent agent : agents) {
            if (agent == null || agent.role() == null) {
                throw new IllegalArgumentException("agent and its role cannot be null");
            }
            if (byRole.putIfAbsent(agent.role(), agent) != null) {
                throw new IllegalArgumentException("duplicate agent for role " + agent.role());
            }
        }
        for (Role role : Role.values()) {
            if (!byRole.containsKey(role)) {
                throw new IllegalArgumentException("missing agent for role " + role);
            }
        }
        return byRole;
    }

    private static String describe(Throwable cause) {
        String message = cause.getMessage();
        return message == null || message.isBlank() ? cause.getClass().getSimpleName() : message;
    }
}
