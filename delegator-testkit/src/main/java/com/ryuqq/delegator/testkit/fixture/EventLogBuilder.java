package com.ryuqq.delegator.testkit.fixture;

import com.ryuqq.delegator.core.event.DelegateAction;
import com.ryuqq.delegator.core.event.DelegateObservation;
import com.ryuqq.delegator.core.event.ErrorObservation;
import com.ryuqq.delegator.core.event.Event;
import com.ryuqq.delegator.core.event.FinishAction;
import com.ryuqq.delegator.core.event.TaskSubmitted;
import com.ryuqq.delegator.core.model.CodeInputs;
import com.ryuqq.delegator.core.model.CodeOutputs;
import com.ryuqq.delegator.core.model.DelegationOutputs;
import com.ryuqq.delegator.core.model.DelegationStatus;
import com.ryuqq.delegator.core.model.Role;
import com.ryuqq.delegator.core.model.StudyInputs;
import com.ryuqq.delegator.core.model.StudyOutputs;
import com.ryuqq.delegator.core.model.Task;
import com.ryuqq.delegator.core.model.VerifyInputs;
import com.ryuqq.delegator.core.model.VerifyOutputs;
import com.ryuqq.delegator.core.spi.EventLog;

import java.util.ArrayList;
import java.util.List;

/**
 * 테스트용 Event Log 시나리오 빌더.
 *
 * <p>위임/관측 쌍을 한 줄씩 기록하며, 위임 입력은 지금까지 기록된 요약/피드백으로 채웁니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * List&lt;Event&gt; log = EventLogBuilder.forTask("add endpoint")
 *     .studySucceeds("S")
 *     .codeSucceeds("diff --git a/Api.java b/Api.java")
 *     .verifyRejects("missing tests")
 *     .build();
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class EventLogBuilder {

    private final Task task;
    private final List<Event> events = new ArrayList<>();
    private String summary;
    private String feedback;
    private String changes;

    private EventLogBuilder(Task task) {
        this.task = task;
        events.add(TaskSubmitted.of(task));
    }

    /**
     * 작업 목표로 빌더 생성.
     *
     * @param goal 작업 목표
     * @return 빌더 (TaskSubmitted 기록됨)
     */
    public static EventLogBuilder forTask(String goal) {
        return new EventLogBuilder(Task.of(goal));
    }

    /**
     * 작업으로 빌더 생성.
     *
     * @param task 작업
     * @return 빌더 (TaskSubmitted 기록됨)
     */
    public static EventLogBuilder forTask(Task task) {
        return new EventLogBuilder(task);
    }

    /**
     * 접수된 작업.
     *
     * @return 작업
     */
    public Task task() {
        return task;
    }

    /**
     * Study 위임만 기록 (관측 결과 없음).
     *
     * @return this
     */
    public EventLogBuilder studyRequested() {
        StudyInputs inputs = summary == null
            ? StudyInputs.of(task)
            : new StudyInputs(task, summary, feedback);
        return add(DelegateAction.of(inputs));
    }

    /**
     * Code 위임만 기록 (관측 결과 없음).
     *
     * @return this
     */
    public EventLogBuilder codeRequested() {
        return add(DelegateAction.of(new CodeInputs(task, summary, feedback)));
    }

    /**
     * Verify 위임만 기록 (관측 결과 없음).
     *
     * @return this
     */
    public EventLogBuilder verifyRequested() {
        return add(DelegateAction.of(new VerifyInputs(task, summary, changes)));
    }

    /**
     * Study 위임 + 성공 관측.
     *
     * @param studySummary 분석 요약
     * @return this
     */
    public EventLogBuilder studySucceeds(String studySummary) {
        studyRequested();
        summary = studySummary;
        return add(DelegateObservation.success(new StudyOutputs(studySummary)));
    }

    /**
     * Study 위임 + 실패 관측.
     *
     * @param message 실패 사유
     * @return this
     */
    public EventLogBuilder studyFails(String message) {
        studyRequested();
        return add(DelegateObservation.failure(Role.STUDY, message));
    }

    /**
     * Code 위임 + 성공 관측.
     *
     * @param diffOrFiles 변경 내용
     * @return this
     */
    public EventLogBuilder codeSucceeds(String diffOrFiles) {
        codeRequested();
        changes = diffOrFiles;
        return add(DelegateObservation.success(new CodeOutputs(diffOrFiles)));
    }

    /**
     * Code 위임 + 실패 관측.
     *
     * @param message 실패 사유
     * @return this
     */
    public EventLogBuilder codeFails(String message) {
        codeRequested();
        return add(DelegateObservation.failure(Role.CODE, message));
    }

    /**
     * Verify 위임 + 승인.
     *
     * @param note 승인 메모
     * @return this
     */
    public EventLogBuilder verifyApproves(String note) {
        verifyRequested();
        return add(DelegateObservation.success(VerifyOutputs.approved(note)));
    }

    /**
     * Verify 위임 + 반려.
     *
     * @param rejection 반려 사유
     * @return this
     */
    public EventLogBuilder verifyRejects(String rejection) {
        verifyRequested();
        feedback = rejection;
        return add(DelegateObservation.success(VerifyOutputs.rejected(rejection)));
    }

    /**
     * Verify 위임 + 재분석 요청.
     *
     * @param reason 재분석 사유
     * @return this
     */
    public EventLogBuilder verifyRequestsRestudy(String reason) {
        verifyRequested();
        feedback = reason;
        return add(DelegateObservation.success(VerifyOutputs.restudy(reason)));
    }

    /**
     * Verify 위임 + 실패 관측 (status=FAILURE, 피드백 포함).
     *
     * @param failureFeedback 실패 피드백
     * @return this
     */
    public EventLogBuilder verifyFails(String failureFeedback) {
        verifyRequested();
        feedback = failureFeedback;
        return add(new DelegateObservation(Role.VERIFY, VerifyOutputs.rejected(failureFeedback),
            DelegationStatus.FAILURE, failureFeedback));
    }

    /**
     * Code 위임 → 성공 → Verify 반려를 count회 반복.
     *
     * @param count 반복 횟수
     * @param rejection 반려 사유
     * @return this
     */
    public EventLogBuilder rejectedCycles(int count, String rejection) {
        for (int i = 0; i < count; i++) {
            codeSucceeds("attempt-" + (i + 1));
            verifyRejects(rejection);
        }
        return this;
    }

    /**
     * 임의의 관측 결과 기록 (역할 불일치 등 비정상 시나리오용).
     *
     * @param role 관측 역할
     * @param outputs 출력 (null 가능)
     * @param status 상태
     * @return this
     */
    public EventLogBuilder observation(Role role, DelegationOutputs outputs, DelegationStatus status) {
        return add(new DelegateObservation(role, outputs, status, null));
    }

    /**
     * ErrorObservation 기록.
     *
     * @param message 오류 메시지
     * @param recoverable 복구 가능 여부
     * @return this
     */
    public EventLogBuilder error(String message, boolean recoverable) {
        return add(new ErrorObservation(message, recoverable));
    }

    /**
     * FinishAction 기록.
     *
     * @param finish 종료 행동
     * @return this
     */
    public EventLogBuilder finish(FinishAction finish) {
        return add(finish);
    }

    /**
     * 임의 이벤트 기록.
     *
     * @param event 이벤트
     * @return this
     */
    public EventLogBuilder add(Event event) {
        events.add(event);
        return this;
    }

    /**
     * 불변 이벤트 목록 생성.
     *
     * @return 기록된 이벤트 목록
     */
    public List<Event> build() {
        return List.copyOf(events);
    }

    /**
     * 기록된 이벤트를 주어진 Event Log에 추가.
     *
     * @param log 대상 Event Log
     * @return 같은 Event Log
     */
    public EventLog appendTo(EventLog log) {
        for (Event event : events) {
            log.append(event);
        }
        return log;
    }
}
