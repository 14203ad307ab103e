package com.ryuqq.delegator.application.controller;

import com.ryuqq.delegator.core.error.ErrorKind;
import com.ryuqq.delegator.core.error.InvalidPairingException;
import com.ryuqq.delegator.core.event.Action;
import com.ryuqq.delegator.core.event.DelegateAction;
import com.ryuqq.delegator.core.event.DelegateObservation;
import com.ryuqq.delegator.core.event.Event;
import com.ryuqq.delegator.core.event.FinishAction;
import com.ryuqq.delegator.core.event.TaskSubmitted;
import com.ryuqq.delegator.core.model.CodeInputs;
import com.ryuqq.delegator.core.model.CodeOutputs;
import com.ryuqq.delegator.core.model.DelegationStatus;
import com.ryuqq.delegator.core.model.Role;
import com.ryuqq.delegator.core.model.StudyInputs;
import com.ryuqq.delegator.core.model.StudyOutputs;
import com.ryuqq.delegator.core.model.Task;
import com.ryuqq.delegator.core.model.VerifyInputs;
import com.ryuqq.delegator.core.model.VerifyOutputs;
import com.ryuqq.delegator.core.policy.DelegationBudget;
import com.ryuqq.delegator.core.policy.PhasePolicy;
import com.ryuqq.delegator.core.reconstruct.DerivedState;
import com.ryuqq.delegator.core.reconstruct.StateReconstructor;
import com.ryuqq.delegator.core.spi.EventLog;
import com.ryuqq.delegator.testkit.fixture.EventLogBuilder;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * EventSourcedDelegationController 테스트.
 *
 * <p>step(log)의 결정 규칙과 오류 분류를 검증합니다:</p>
 * <ul>
 *   <li>시나리오 A~F: 접수, Study 성공, 예산 내 반려, 예산 소진, 승인, 역할 불일치</li>
 *   <li>결정성: 같은 로그 → 같은 Action</li>
 *   <li>미결 위임이 있으면 새 위임 없이 INVALID_PAIRING 종료</li>
 *   <li>어떤 예외도 step 밖으로 나가지 않음</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class EventSourcedDelegationControllerTest {

    @Mock
    private StateReconstructor reconstructor;

    @Mock
    private PhasePolicy policy;

    private final DelegationController controller = new EventSourcedDelegationController();

    // ========== 시나리오 ==========

    @Test
    void 시나리오A_접수만_있으면_Study_위임() {
        // given
        EventLogBuilder log = EventLogBuilder.forTask("add endpoint");

        // when
        Action action = controller.step(log.build());

        // then
        assertThat(action).isEqualTo(DelegateAction.of(StudyInputs.of(log.task())));
    }

    @Test
    void 시나리오B_Study_성공후_요약과_함께_Code_위임() {
        // given
        EventLogBuilder log = EventLogBuilder.forTask("add endpoint").studySucceeds("S");

        // when
        Action action = controller.step(log.build());

        // then
        assertThat(action).isEqualTo(DelegateAction.of(new CodeInputs(log.task(), "S", null)));
    }

    @Test
    void 시나리오C_예산내_반려후_피드백과_함께_Code_재위임() {
        // given: iteration=1, maxIterations=3
        EventLogBuilder log = EventLogBuilder.forTask("add endpoint")
            .studySucceeds("S")
            .codeSucceeds("diff-1")
            .verifyRejects("missing tests");

        // when
        Action action = controller.step(log.build());

        // then
        assertThat(action).isInstanceOf(DelegateAction.class);
        DelegateAction delegation = (DelegateAction) action;
        assertThat(delegation.role()).isEqualTo(Role.CODE);
        assertThat(delegation.inputs()).isEqualTo(new CodeInputs(log.task(), "S", "missing tests"));
    }

    @Test
    void 시나리오D_예산_소진시_미완료_종료() {
        // given: iteration=3=maxIterations
        List<Event> events = EventLogBuilder.forTask("add endpoint")
            .studySucceeds("S")
            .rejectedCycles(3, "missing tests")
            .build();

        // when
        Action action = controller.step(events);

        // then
        assertThat(action).isInstanceOf(FinishAction.class);
        FinishAction finish = (FinishAction) action;
        assertThat(finish.completed()).isFalse();
        assertThat(finish.errorKind()).isEqualTo(ErrorKind.BUDGET_EXHAUSTED);
        assertThat(finish.isFatal()).isFalse();
        assertThat(finish.summary()).contains("missing tests");
    }

    @Test
    void 시나리오E_승인시_완료_종료() {
        // given
        List<Event> events = EventLogBuilder.forTask("add endpoint")
            .studySucceeds("S")
            .codeSucceeds("diff-1")
            .verifyApproves("LGTM")
            .build();

        // when
        Action action = controller.step(events);

        // then
        assertThat(action).isEqualTo(FinishAction.completed("LGTM"));
    }

    @Test
    void 시나리오F_역할_불일치_관측은_INVALID_PAIRING() {
        // given: Code 위임에 Verify 관측
        List<Event> events = EventLogBuilder.forTask("add endpoint")
            .studySucceeds("S")
            .codeRequested()
            .observation(Role.VERIFY, VerifyOutputs.approved("LGTM"), DelegationStatus.SUCCESS)
            .build();

        // when
        Action action = controller.step(events);

        // then
        assertThat(action).isInstanceOf(FinishAction.class);
        FinishAction finish = (FinishAction) action;
        assertThat(finish.errorKind()).isEqualTo(ErrorKind.INVALID_PAIRING);
        assertThat(finish.isFatal()).isTrue();
        assertThat(finish.summary()).startsWith("Orchestration error [INVALID_PAIRING]");
    }

    // ========== 추가 흐름 ==========

    @Test
    void step_Study_실패시_DELEGATION_FAILURE_종료() {
        // given
        List<Event> events = EventLogBuilder.forTask("add endpoint")
            .studyFails("repository not found")
            .build();

        // when
        FinishAction finish = (FinishAction) controller.step(events);

        // then
        assertThat(finish.completed()).isFalse();
        assertThat(finish.errorKind()).isEqualTo(ErrorKind.DELEGATION_FAILURE);
        assertThat(finish.summary()).contains("repository not found");
        assertThat(finish.isFatal()).isFalse();
    }

    @Test
    void step_기록된_Study_실패_종료는_치명적이지_않아도_재시도하지_않음() {
        // given
        FinishAction recorded = FinishAction.incomplete(
            ErrorKind.DELEGATION_FAILURE, "Study failed after 1 attempt(s): repository not found");
        List<Event> events = EventLogBuilder.forTask("add endpoint")
            .studyFails("repository not found")
            .finish(recorded)
            .build();

        // when
        Action action = controller.step(events);

        // then
        assertThat(action).isEqualTo(recorded);
    }

    @Test
    void step_복구불가_오류는_DELEGATION_FAILURE_종료() {
        // given
        List<Event> events = EventLogBuilder.forTask("add endpoint")
            .studySucceeds("S")
            .codeRequested()
            .error("sandbox destroyed", false)
            .build();

        // when
        FinishAction finish = (FinishAction) controller.step(events);

        // then
        assertThat(finish.errorKind()).isEqualTo(ErrorKind.DELEGATION_FAILURE);
        assertThat(finish.summary()).isEqualTo("CODE delegation failed: sandbox destroyed");
    }

    @Test
    void step_재분석_요청시_이전_요약과_피드백으로_Study_위임() {
        // given
        EventLogBuilder log = EventLogBuilder.forTask("add endpoint")
            .studySucceeds("S")
            .codeSucceeds("diff-1")
            .verifyRequestsRestudy("analysed the wrong module");

        // when
        DelegateAction delegation = (DelegateAction) controller.step(log.build());

        // then
        assertThat(delegation.inputs())
            .isEqualTo(new StudyInputs(log.task(), "S", "analysed the wrong module"));
    }

    @Test
    void step_Verify에_최신_변경내용_전달() {
        // given
        List<Event> events = EventLogBuilder.forTask("add endpoint")
            .studySucceeds("S")
            .codeSucceeds("diff --git a/Health.java b/Health.java")
            .build();

        // when
        DelegateAction delegation = (DelegateAction) controller.step(events);

        // then
        assertThat(delegation.role()).isEqualTo(Role.VERIFY);
        assertThat(((VerifyInputs) delegation.inputs()).changes())
            .isEqualTo("diff --git a/Health.java b/Health.java");
    }

    @Test
    void step_기록된_종료는_그대로_반환() {
        // given
        FinishAction recorded = FinishAction.completed("LGTM");
        List<Event> events = EventLogBuilder.forTask("add endpoint")
            .studySucceeds("S")
            .codeSucceeds("diff-1")
            .verifyApproves("LGTM")
            .finish(recorded)
            .build();

        // when & then
        assertThat(controller.step(events)).isEqualTo(recorded);
    }

    @Test
    void step_예산_설정_반영() {
        // given
        DelegationController strict = new EventSourcedDelegationController(new DelegationBudget(1, 1));
        List<Event> events = EventLogBuilder.forTask("add endpoint")
            .studySucceeds("S")
            .rejectedCycles(1, "missing tests")
            .build();

        // when
        FinishAction finish = (FinishAction) strict.step(events);

        // then
        assertThat(finish.errorKind()).isEqualTo(ErrorKind.BUDGET_EXHAUSTED);
    }

    // ========== 속성 ==========

    @Test
    void step_같은_로그는_항상_같은_Action() {
        // given
        List<Event> events = EventLogBuilder.forTask("add endpoint")
            .studySucceeds("S")
            .codeSucceeds("diff-1")
            .verifyRejects("missing tests")
            .build();

        // when
        Action first = controller.step(events);
        Action second = controller.step(List.copyOf(events));

        // then
        assertThat(first).isEqualTo(second);
    }

    @Test
    void step_미결_위임이_있으면_새_위임없이_INVALID_PAIRING() {
        // given
        List<Event> events = EventLogBuilder.forTask("add endpoint")
            .studySucceeds("S")
            .codeRequested()
            .build();

        // when
        Action action = controller.step(events);

        // then
        assertThat(action).isInstanceOf(FinishAction.class);
        assertThat(((FinishAction) action).errorKind()).isEqualTo(ErrorKind.INVALID_PAIRING);
        assertThat(((FinishAction) action).summary()).contains("CODE delegation is still outstanding");
    }

    @Test
    void step_항상_거부하는_검증자와의_루프는_예산내_종료() {
        // given
        int maxIterations = 3;
        DelegationController bounded = new EventSourcedDelegationController(new DelegationBudget(maxIterations, 1));
        List<Event> events = new ArrayList<>(EventLogBuilder.forTask("add endpoint").build());
        int delegations = 0;

        // when
        Action action = bounded.step(events);
        while (action instanceof DelegateAction delegation) {
            delegations++;
            events.add(delegation);
            events.add(alwaysRejecting(delegation.role()));
            action = bounded.step(events);
        }

        // then: Study 1회 + (Code, Verify) x maxIterations
        assertThat(delegations).isEqualTo(1 + 2 * maxIterations);
        assertThat(((FinishAction) action).errorKind()).isEqualTo(ErrorKind.BUDGET_EXHAUSTED);
    }

    @Test
    void step_EventLog_오버로드는_스냅샷으로_결정() {
        // given
        EventLog eventLog = mock(EventLog.class);
        when(eventLog.read()).thenReturn(List.of(TaskSubmitted.of(Task.of("add endpoint"))));

        // when
        Action action = controller.step(eventLog);

        // then
        assertThat(action).isInstanceOf(DelegateAction.class);
        verify(eventLog).read();
    }

    // ========== 오류 분류 ==========

    @Test
    void step_null_로그는_MALFORMED_INPUTS() {
        // when
        FinishAction finish = (FinishAction) controller.step((List<Event>) null);

        // then
        assertThat(finish.errorKind()).isEqualTo(ErrorKind.MALFORMED_INPUTS);
        assertThat(((FinishAction) controller.step((EventLog) null)).errorKind())
            .isEqualTo(ErrorKind.MALFORMED_INPUTS);
    }

    @Test
    void step_접수_없는_로그는_MALFORMED_INPUTS() {
        // when
        FinishAction finish = (FinishAction) controller.step(List.of());

        // then
        assertThat(finish.errorKind()).isEqualTo(ErrorKind.MALFORMED_INPUTS);
        assertThat(finish.isFatal()).isTrue();
    }

    @Test
    void step_재구성_도메인예외는_종류_그대로_분류() {
        // given
        DelegationController mocked = new EventSourcedDelegationController(reconstructor, policy);
        when(reconstructor.reconstruct(anyList())).thenThrow(new InvalidPairingException("broken pairing"));

        // when
        FinishAction finish = (FinishAction) mocked.step(List.of());

        // then
        assertThat(finish.errorKind()).isEqualTo(ErrorKind.INVALID_PAIRING);
        assertThat(finish.summary()).contains("broken pairing");
        verify(policy, never()).decide(any(), any());
    }

    @Test
    void step_예상치_못한_예외도_밖으로_나가지_않음() {
        // given
        DelegationController mocked = new EventSourcedDelegationController(reconstructor, policy);
        Task task = Task.of("add endpoint");
        when(reconstructor.reconstruct(anyList())).thenReturn(DerivedState.initial(task));
        when(policy.decide(any(), any())).thenThrow(new NullPointerException("boom"));

        // when
        FinishAction finish = (FinishAction) mocked.step(List.of(TaskSubmitted.of(task)));

        // then
        assertThat(finish.errorKind()).isEqualTo(ErrorKind.MALFORMED_INPUTS);
        assertThat(finish.summary()).contains("policy failed: boom");
    }

    @Test
    void constructor_null_의존성은_예외() {
        assertThatThrownBy(() -> new EventSourcedDelegationController(null, new PhasePolicy()))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new EventSourcedDelegationController(new StateReconstructor(), null))
            .isInstanceOf(IllegalArgumentException.class);
    }

    private static DelegateObservation alwaysRejecting(Role role) {
        return switch (role) {
            case STUDY -> DelegateObservation.success(new StudyOutputs("S"));
            case CODE -> DelegateObservation.success(new CodeOutputs("diff"));
            case VERIFY -> DelegateObservation.success(VerifyOutputs.rejected("still wrong"));
        };
    }
}
