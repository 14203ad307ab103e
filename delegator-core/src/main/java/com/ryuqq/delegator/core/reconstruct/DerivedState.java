package com.ryuqq.delegator.core.reconstruct;

import com.ryuqq.delegator.core.event.FinishAction;
import com.ryuqq.delegator.core.model.Role;
import com.ryuqq.delegator.core.model.Task;
import com.ryuqq.delegator.core.statemachine.Phase;

/**
 * Event Log에서 계산된 현재 상태.
 *
 * <p>저장되지 않으며 {@code step()} 호출마다 다시 계산됩니다.
 * 따라서 저장된 상태와 로그가 어긋날 수 없습니다.</p>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>studySummary는 명시적 재분석 없이 한 번 설정되면 바뀌지 않음</li>
 *   <li>iteration은 감소하지 않음</li>
 * </ul>
 *
 * @param task 접수된 작업
 * @param phase 현재 단계
 * @param iteration 승인 없이 끝난 Code→Verify 주기 수 (Code 실패 포함)
 * @param studySummary 마지막 Study 성공 요약 (없으면 빈 문자열)
 * @param verifierFeedback 마지막 Verify 반려/실패 피드백 (없으면 빈 문자열)
 * @param latestChanges 마지막 Code 성공 출력 (없으면 빈 문자열)
 * @param studyFailures Study 실패 횟수
 * @param pendingRole 관측 결과를 기다리는 위임 역할 (없으면 null)
 * @param recordedFinish 로그에 이미 기록된 종료 행동 (없으면 null)
 * @param failureDetail 마지막 위임 실패 사유 (없으면 null)
 * @param approvalNote 승인 시 검증 피드백 (없으면 null)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record DerivedState(
    Task task,
    Phase phase,
    int iteration,
    String studySummary,
    String verifierFeedback,
    String latestChanges,
    int studyFailures,
    Role pendingRole,
    FinishAction recordedFinish,
    String failureDetail,
    String approvalNote
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 필수 필드 누락 또는 음수 카운터
     */
    public DerivedState {
        if (task == null) {
            throw new IllegalArgumentException("task cannot be null");
        }
        if (phase == null) {
            throw new IllegalArgumentException("phase cannot be null");
        }
        if (iteration < 0) {
            throw new IllegalArgumentException("iteration must be non-negative (current: " + iteration + ")");
        }
        if (studyFailures < 0) {
            throw new IllegalArgumentException("studyFailures must be non-negative (current: " + studyFailures + ")");
        }
        if (studySummary == null || verifierFeedback == null || latestChanges == null) {
            throw new IllegalArgumentException("summary, feedback and changes use empty string instead of null");
        }
    }

    /**
     * 작업 접수 직후의 초기 상태.
     *
     * @param task 접수된 작업
     * @return AWAITING_STUDY 단계의 DerivedState
     */
    public static DerivedState initial(Task task) {
        return new DerivedState(task, Phase.AWAITING_STUDY, 0, "", "", "", 0, null, null, null, null);
    }

    /**
     * Study 요약 존재 여부.
     *
     * @return studySummary가 비어있지 않으면 true
     */
    public boolean hasStudySummary() {
        return !studySummary.isEmpty();
    }

    /**
     * 검증 피드백 존재 여부.
     *
     * @return verifierFeedback가 비어있지 않으면 true
     */
    public boolean hasVerifierFeedback() {
        return !verifierFeedback.isEmpty();
    }

    /**
     * 관측 결과를 기다리는 위임이 있는지 확인.
     *
     * @return 대기 중인 위임이 있으면 true
     */
    public boolean hasOutstandingDelegation() {
        return pendingRole != null;
    }

    /**
     * 로그에 종료 행동이 기록되었는지 확인.
     *
     * @return FinishAction이 기록되었으면 true
     */
    public boolean hasRecordedFinish() {
        return recordedFinish != null;
    }

    /**
     * 검증자가 요청한 재분석 대기 중인지 확인.
     *
     * @return Study 요약이 이미 있는데 AWAITING_STUDY인 경우 true
     */
    public boolean isRestudy() {
        return phase == Phase.AWAITING_STUDY && hasStudySummary();
    }
}
