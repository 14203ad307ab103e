package com.ryuqq.delegator.core.policy;

import com.ryuqq.delegator.core.error.ErrorKind;
import com.ryuqq.delegator.core.error.MalformedInputsException;
import com.ryuqq.delegator.core.event.Action;
import com.ryuqq.delegator.core.event.DelegateAction;
import com.ryuqq.delegator.core.event.FinishAction;
import com.ryuqq.delegator.core.model.CodeInputs;
import com.ryuqq.delegator.core.model.StudyInputs;
import com.ryuqq.delegator.core.model.Task;
import com.ryuqq.delegator.core.model.VerifyInputs;
import com.ryuqq.delegator.core.reconstruct.DerivedState;
import com.ryuqq.delegator.core.statemachine.Phase;
import com.ryuqq.delegator.core.statemachine.PhaseTransition;

/**
 * 다음 행동 결정 정책.
 *
 * <p>재구성된 상태만 보고 다음 행동을 고르는 순수 함수입니다.
 * 결과는 항상 {@link DelegateAction} 또는 {@link FinishAction}입니다.</p>
 *
 * <p><strong>결정 테이블 (우선순위 순):</strong></p>
 * <ol>
 *   <li>로그에 FinishAction이 이미 있음 → 그대로 반환</li>
 *   <li>AWAITING_STUDY → Study {task} (재분석이면 {task, priorSummary, feedback}),
 *       Study 예산 소진 시 미완료 종료 (DELEGATION_FAILURE)</li>
 *   <li>AWAITING_CODE → Code {task, studySummary, verifierFeedback?}</li>
 *   <li>AWAITING_VERIFY → Verify {task, studySummary, changes}</li>
 *   <li>DONE → 완료 종료</li>
 *   <li>반려 후 iteration &gt;= maxIterations → 미완료 종료 (BUDGET_EXHAUSTED)</li>
 *   <li>FAILED → 미완료 종료 (DELEGATION_FAILURE)</li>
 * </ol>
 *
 * <p>입력은 검증 생성자로 만들어지므로, 필수 필드가 빠진 상태로 위임하려 하면
 * {@link MalformedInputsException}이 발생합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class PhasePolicy {

    private final DelegationBudget budget;

    /**
     * 기본 예산 생성자.
     */
    public PhasePolicy() {
        this(new DelegationBudget());
    }

    /**
     * 생성자.
     *
     * @param budget 위임 예산
     * @throws IllegalArgumentException budget이 null인 경우
     */
    public PhasePolicy(DelegationBudget budget) {
        if (budget == null) {
            throw new IllegalArgumentException("budget cannot be null");
        }
        this.budget = budget;
    }

    /**
     * 다음 행동 결정.
     *
     * @param task 대상 작업
     * @param state 재구성된 상태
     * @return DelegateAction 또는 FinishAction
     * @throws IllegalArgumentException task 또는 state가 null인 경우
     * @throws IllegalStateException 관측 결과를 기다리는 위임이 있는 경우
     * @throws MalformedInputsException 위임 입력의 필수 필드가 없는 경우
     */
    public Action decide(Task task, DerivedState state) {
        if (task == null) {
            throw new IllegalArgumentException("task cannot be null");
        }
        if (state == null) {
            throw new IllegalArgumentException("state cannot be null");
        }
        if (state.hasRecordedFinish()) {
            return state.recordedFinish();
        }
        if (state.hasOutstandingDelegation()) {
            throw new IllegalStateException(
                "Cannot decide while " + state.pendingRole() + " delegation is outstanding"
            );
        }

        return switch (state.phase()) {
            case AWAITING_STUDY -> decideStudy(task, state);
            case AWAITING_CODE -> decideCode(task, state);
            case AWAITING_VERIFY -> DelegateAction.of(
                new VerifyInputs(task, state.studySummary(), emptyToNull(state.latestChanges()))
            );
            case DONE -> FinishAction.completed(approvalSummary(state));
            case EXHAUSTED -> exhausted(state);
            case FAILED -> FinishAction.incomplete(ErrorKind.DELEGATION_FAILURE, failureSummary(state));
        };
    }

    /**
     * 적용 중인 예산.
     *
     * @return 위임 예산
     */
    public DelegationBudget budget() {
        return budget;
    }

    private Action decideStudy(Task task, DerivedState state) {
        if (state.studyFailures() >= budget.maxStudyAttempts()) {
            PhaseTransition.validate(Phase.AWAITING_STUDY, Phase.FAILED);
            return FinishAction.incomplete(ErrorKind.DELEGATION_FAILURE, String.format(
                "Study failed after %d attempt(s): %s", state.studyFailures(), failureSummary(state)));
        }
        if (!state.isRestudy()) {
            return DelegateAction.of(StudyInputs.of(task));
        }
        if (state.iteration() >= budget.maxIterations()) {
            PhaseTransition.validate(Phase.AWAITING_STUDY, Phase.EXHAUSTED);
            return exhausted(state);
        }
        return DelegateAction.of(
            new StudyInputs(task, state.studySummary(), emptyToNull(state.verifierFeedback()))
        );
    }

    private Action decideCode(Task task, DerivedState state) {
        if (state.iteration() >= budget.maxIterations()) {
            PhaseTransition.validate(Phase.AWAITING_CODE, Phase.EXHAUSTED);
            return exhausted(state);
        }
        return DelegateAction.of(
            new CodeInputs(task, state.studySummary(), emptyToNull(state.verifierFeedback()))
        );
    }

    private FinishAction exhausted(DerivedState state) {
        String lastFeedback = state.hasVerifierFeedback() ? state.verifierFeedback() : failureSummary(state);
        return FinishAction.incomplete(ErrorKind.BUDGET_EXHAUSTED, String.format(
            "Not approved after %d of %d iteration(s); last feedback: %s",
            state.iteration(), budget.maxIterations(), lastFeedback));
    }

    private static String approvalSummary(DerivedState state) {
        String note = state.approvalNote();
        if (note != null && !note.isBlank()) {
            return note;
        }
        return String.format("Approved after %d retry(ies)", state.iteration());
    }

    private static String failureSummary(DerivedState state) {
        String detail = state.failureDetail();
        return detail == null || detail.isBlank() ? "no failure detail reported" : detail;
    }

    private static String emptyToNull(String value) {
        return value == null || value.isEmpty() ? null : value;
    }
}
