package com.ryuqq.delegator.core.model;

/**
 * 오케스트레이션 대상 작업.
 *
 * <p>세션 시작 시 한 번 생성되며 이후 변경되지 않습니다.
 * Event Log의 첫 번째 이벤트({@code TaskSubmitted})로 기록됩니다.</p>
 *
 * <p><strong>예시:</strong></p>
 * <pre>
 * Task task = Task.of("add endpoint");
 * Task withContext = Task.of("add endpoint", "GET /api/orders/{id}, Spring MVC");
 * </pre>
 *
 * @param goal 작업 목표 (필수)
 * @param context 부가 컨텍스트 (선택, null 가능)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record Task(
    String goal,
    String context
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException goal이 null이거나 빈 문자열인 경우
     */
    public Task {
        if (goal == null || goal.isBlank()) {
            throw new IllegalArgumentException("goal cannot be null or blank");
        }
        // context는 null 허용
    }

    /**
     * 컨텍스트 없이 Task 생성.
     *
     * @param goal 작업 목표
     * @return Task 인스턴스
     */
    public static Task of(String goal) {
        return new Task(goal, null);
    }

    /**
     * 컨텍스트 포함 Task 생성.
     *
     * @param goal 작업 목표
     * @param context 부가 컨텍스트
     * @return Task 인스턴스
     */
    public static Task of(String goal, String context) {
        return new Task(goal, context);
    }

    /**
     * 컨텍스트 존재 여부.
     *
     * @return context가 비어있지 않으면 true
     */
    public boolean hasContext() {
        return context != null && !context.isBlank();
    }
}
