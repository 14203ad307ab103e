package com.ryuqq.delegator.core.reconstruct;

import com.ryuqq.delegator.core.error.InvalidPairingException;
import com.ryuqq.delegator.core.error.MalformedInputsException;
import com.ryuqq.delegator.core.event.DelegateAction;
import com.ryuqq.delegator.core.event.DelegateObservation;
import com.ryuqq.delegator.core.event.ErrorObservation;
import com.ryuqq.delegator.core.event.Event;
import com.ryuqq.delegator.core.event.FinishAction;
import com.ryuqq.delegator.core.event.TaskSubmitted;
import com.ryuqq.delegator.core.model.CodeOutputs;
import com.ryuqq.delegator.core.model.Role;
import com.ryuqq.delegator.core.model.StudyOutputs;
import com.ryuqq.delegator.core.model.Task;
import com.ryuqq.delegator.core.model.VerifyOutputs;
import com.ryuqq.delegator.core.statemachine.Phase;
import com.ryuqq.delegator.core.statemachine.PhaseTransition;

import java.util.List;

/**
 * Event Log → DerivedState 재구성기.
 *
 * <p>로그를 처음부터 순서대로 한 번 훑으며 작은 누산기를 갱신합니다.
 * 부수 효과가 없는 순수 함수이므로 같은 로그는 항상 같은 상태를 만들고,
 * 크래시 복구와 감사(audit)에 그대로 사용할 수 있습니다.</p>
 *
 * <p><strong>재구성 규칙:</strong></p>
 * <pre>
 * Study  SUCCESS                → studySummary 설정, AWAITING_CODE
 * Study  FAILURE / 복구 가능 오류 → studyFailures++, AWAITING_STUDY
 * Code   SUCCESS                → latestChanges 기록, AWAITING_VERIFY
 * Code   FAILURE / 복구 가능 오류 → iteration++, AWAITING_CODE
 * Verify SUCCESS approved=true  → DONE
 * Verify SUCCESS approved=false → iteration++, verifierFeedback 기록,
 *                                 AWAITING_CODE (재분석 요청 시 AWAITING_STUDY)
 * Verify FAILURE / 복구 가능 오류 → iteration++, verifierFeedback 기록, AWAITING_CODE
 * 복구 불가 ErrorObservation     → FAILED
 * </pre>
 *
 * <p><strong>오류:</strong></p>
 * <ul>
 *   <li>첫 이벤트가 TaskSubmitted가 아니거나 중복 접수 → {@link MalformedInputsException}</li>
 *   <li>역할 불일치, 대기 위임 없는 관측, 중첩 위임, 단계에 맞지 않는 위임,
 *       종료 이후 이벤트 → {@link InvalidPairingException}</li>
 * </ul>
 *
 * <p>로그가 대기 중인 위임으로 끝나는 것은 오류가 아닙니다 (pendingRole로 표시).
 * 그 상태에서 새 위임을 발행하지 않는 것은 Controller의 책임입니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class StateReconstructor {

    /**
     * 로그에서 현재 상태 재구성.
     *
     * @param log 작업 시작부터의 전체 이벤트 목록
     * @return 재구성된 상태
     * @throws IllegalArgumentException log가 null인 경우
     * @throws MalformedInputsException 작업 접수 이벤트가 없거나 중복된 경우
     * @throws InvalidPairingException 위임/관측 쌍이 맞지 않는 경우
     */
    public DerivedState reconstruct(List<? extends Event> log) {
        if (log == null) {
            throw new IllegalArgumentException("log cannot be null");
        }
        if (log.isEmpty() || !(log.get(0) instanceof TaskSubmitted submitted)) {
            throw new MalformedInputsException("log must start with TaskSubmitted");
        }

        Accumulator acc = new Accumulator(submitted.task());
        for (int index = 1; index < log.size(); index++) {
            acc.apply(index, log.get(index));
        }
        return acc.toState();
    }

    /**
     * 재구성 중 상태를 담는 누산기 (reconstruct 호출마다 새로 생성).
     */
    private static final class Accumulator {

        private final Task task;
        private Phase phase = Phase.AWAITING_STUDY;
        private int iteration;
        private String studySummary = "";
        private String verifierFeedback = "";
        private String latestChanges = "";
        private int studyFailures;
        private Role pendingRole;
        private FinishAction recordedFinish;
        private String failureDetail;
        private String approvalNote;

        private Accumulator(Task task) {
            this.task = task;
        }

        private void apply(int index, Event event) {
            if (event == null) {
                throw new InvalidPairingException("event #" + index + " is null");
            }
            if (recordedFinish != null) {
                throw new InvalidPairingException("event #" + index + " recorded after FinishAction");
            }

            if (event instanceof TaskSubmitted) {
                throw new MalformedInputsException("task submitted more than once (event #" + index + ")");
            } else if (event instanceof DelegateAction action) {
                onAction(index, action);
            } else if (event instanceof FinishAction finish) {
                if (pendingRole != null) {
                    throw new InvalidPairingException(String.format(
                        "event #%d: FinishAction recorded while %s delegation is outstanding", index, pendingRole));
                }
                recordedFinish = finish;
            } else if (event instanceof DelegateObservation observation) {
                Role role = takePending(index, observation.role());
                onObservation(role, observation);
            } else if (event instanceof ErrorObservation error) {
                Role role = takePending(index, null);
                onError(role, error);
            }
        }

        private void onAction(int index, DelegateAction action) {
            if (pendingRole != null) {
                throw new InvalidPairingException(String.format(
                    "event #%d: %s delegation issued while %s delegation is outstanding",
                    index, action.role(), pendingRole));
            }
            if (phase.isTerminal()) {
                throw new InvalidPairingException(String.format(
                    "event #%d: %s delegation issued after terminal phase %s", index, action.role(), phase));
            }
            if (action.role() != phase.expectedRole()) {
                throw new InvalidPairingException(String.format(
                    "event #%d: %s delegation issued in phase %s", index, action.role(), phase));
            }
            pendingRole = action.role();
        }

        /**
         * 대기 중인 위임을 관측 결과와 짝지음.
         *
         * @param index 이벤트 위치
         * @param observedRole 관측 결과의 역할 (ErrorObservation이면 null)
         * @return 짝지어진 위임 역할
         */
        private Role takePending(int index, Role observedRole) {
            if (pendingRole == null) {
                throw new InvalidPairingException(String.format(
                    "event #%d: observation without a pending delegation", index));
            }
            if (observedRole != null && observedRole != pendingRole) {
                throw new InvalidPairingException(String.format(
                    "event #%d: %s observation does not match pending %s delegation",
                    index, observedRole, pendingRole));
            }
            Role role = pendingRole;
            pendingRole = null;
            return role;
        }

        private void onObservation(Role role, DelegateObservation observation) {
            if (!observation.isSuccess()) {
                onFailure(role, failureMessage(observation), observation);
                return;
            }
            switch (role) {
                case STUDY -> {
                    studySummary = ((StudyOutputs) observation.outputs()).summary();
                    moveTo(Phase.AWAITING_CODE);
                }
                case CODE -> {
                    latestChanges = ((CodeOutputs) observation.outputs()).diffOrFiles();
                    moveTo(Phase.AWAITING_VERIFY);
                }
                case VERIFY -> {
                    VerifyOutputs verdict = (VerifyOutputs) observation.outputs();
                    if (verdict.approved()) {
                        approvalNote = verdict.feedback();
                        moveTo(Phase.DONE);
                    } else {
                        iteration++;
                        verifierFeedback = orDefault(verdict.feedback(), "rejected without feedback");
                        moveTo(verdict.restudyRequested() ? Phase.AWAITING_STUDY : Phase.AWAITING_CODE);
                    }
                }
            }
        }

        private void onError(Role role, ErrorObservation error) {
            if (!error.recoverable()) {
                failureDetail = role + " delegation failed: " + error.message();
                moveTo(Phase.FAILED);
                return;
            }
            onFailure(role, error.message(), null);
        }

        private void onFailure(Role role, String message, DelegateObservation observation) {
            failureDetail = role + " delegation failed: " + message;
            switch (role) {
                case STUDY -> {
                    studyFailures++;
                    moveTo(Phase.AWAITING_STUDY);
                }
                case CODE -> {
                    iteration++;
                    moveTo(Phase.AWAITING_CODE);
                }
                case VERIFY -> {
                    iteration++;
                    verifierFeedback = verifyFeedbackOf(observation, message);
                    moveTo(Phase.AWAITING_CODE);
                }
            }
        }

        private void moveTo(Phase next) {
            try {
                phase = PhaseTransition.transition(phase, next);
            } catch (IllegalStateException e) {
                throw new InvalidPairingException(e.getMessage());
            }
        }

        private DerivedState toState() {
            return new DerivedState(task, phase, iteration, studySummary, verifierFeedback,
                latestChanges, studyFailures, pendingRole, recordedFinish, failureDetail, approvalNote);
        }

        private static String failureMessage(DelegateObservation observation) {
            return orDefault(observation.message(), "status FAILURE");
        }

        private static String verifyFeedbackOf(DelegateObservation observation, String message) {
            if (observation != null && observation.outputs() instanceof VerifyOutputs verdict
                && verdict.feedback() != null && !verdict.feedback().isBlank()) {
                return verdict.feedback();
            }
            return message;
        }

        private static String orDefault(String value, String fallback) {
            return value == null || value.isBlank() ? fallback : value;
        }
    }
}
