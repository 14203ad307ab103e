package com.ryuqq.delegator.core.event;

import com.ryuqq.delegator.core.model.Task;

/**
 * 작업 접수 이벤트.
 *
 * @param task 접수된 작업
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record TaskSubmitted(Task task) implements Event {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException task가 null인 경우
     */
    public TaskSubmitted {
        if (task == null) {
            throw new IllegalArgumentException("task cannot be null");
        }
    }

    /**
     * TaskSubmitted 생성.
     *
     * @param task 접수된 작업
     * @return TaskSubmitted 인스턴스
     */
    public static TaskSubmitted of(Task task) {
        return new TaskSubmitted(task);
    }
}
