package com.ryuqq.delegator.testkit.fixture;

import com.ryuqq.delegator.core.event.DelegateAction;
import com.ryuqq.delegator.core.event.DelegateObservation;
import com.ryuqq.delegator.core.event.Observation;
import com.ryuqq.delegator.core.model.DelegationOutputs;
import com.ryuqq.delegator.core.model.Role;
import com.ryuqq.delegator.core.spi.SpecialistAgent;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.function.Function;

/**
 * 미리 정한 응답을 순서대로 돌려주는 테스트용 전문 에이전트.
 *
 * <p>응답이 하나만 남으면 이후 호출에도 같은 응답을 반복합니다.
 * 받은 위임은 {@link #received()}로 확인할 수 있습니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * ScriptedSpecialistAgent verifier = ScriptedSpecialistAgent.of(Role.VERIFY)
 *     .thenSucceed(VerifyOutputs.rejected("missing tests"))
 *     .thenSucceed(VerifyOutputs.approved("LGTM"));
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ScriptedSpecialistAgent implements SpecialistAgent {

    private final Role role;
    private final Deque<Function<DelegateAction, Observation>> script = new ArrayDeque<>();
    private final List<DelegateAction> received = new ArrayList<>();

    private ScriptedSpecialistAgent(Role role) {
        if (role == null) {
            throw new IllegalArgumentException("role cannot be null");
        }
        this.role = role;
    }

    /**
     * 역할로 빈 스크립트 에이전트 생성.
     *
     * @param role 담당 역할
     * @return 에이전트
     */
    public static ScriptedSpecialistAgent of(Role role) {
        return new ScriptedSpecialistAgent(role);
    }

    /**
     * 성공 응답 추가.
     *
     * @param outputs 출력
     * @return this
     */
    public ScriptedSpecialistAgent thenSucceed(DelegationOutputs outputs) {
        DelegateObservation observation = DelegateObservation.success(outputs);
        return then(action -> observation);
    }

    /**
     * 실패 응답 추가.
     *
     * @param message 실패 사유
     * @return this
     */
    public ScriptedSpecialistAgent thenFail(String message) {
        DelegateObservation observation = DelegateObservation.failure(role, message);
        return then(action -> observation);
    }

    /**
     * 예외 발생 응답 추가.
     *
     * @param failure 던질 예외
     * @return this
     */
    public ScriptedSpecialistAgent thenThrow(RuntimeException failure) {
        return then(action -> {
            throw failure;
        });
    }

    /**
     * 임의 응답 추가.
     *
     * @param response 위임 → 관측 함수
     * @return this
     */
    public synchronized ScriptedSpecialistAgent then(Function<DelegateAction, Observation> response) {
        if (response == null) {
            throw new IllegalArgumentException("response cannot be null");
        }
        script.addLast(response);
        return this;
    }

    @Override
    public Role role() {
        return role;
    }

    @Override
    public Observation handle(DelegateAction action) {
        Function<DelegateAction, Observation> response;
        synchronized (this) {
            received.add(action);
            if (script.isEmpty()) {
                throw new IllegalStateException(role + " agent has no scripted response");
            }
            response = script.size() > 1 ? script.pollFirst() : script.peekFirst();
        }
        return response.apply(action);
    }

    /**
     * 지금까지 받은 위임 목록.
     *
     * @return 받은 순서대로의 위임 (복사본)
     */
    public synchronized List<DelegateAction> received() {
        return List.copyOf(received);
    }
}
