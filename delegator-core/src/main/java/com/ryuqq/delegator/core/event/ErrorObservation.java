package com.ryuqq.delegator.core.event;

/**
 * 위임 실행 환경 오류.
 *
 * <p>타임아웃, 에이전트 예외 등 전문 에이전트가 정상적인 결과를 내지 못한 경우 기록됩니다.
 * 대기 중인 위임에 대한 관측으로 간주됩니다.</p>
 *
 * <ul>
 *   <li>recoverable=true: DelegationFailure로 재시도 루프에 복귀</li>
 *   <li>recoverable=false: 재시도 없이 미완료 종료</li>
 * </ul>
 *
 * @param message 오류 메시지
 * @param recoverable 복구 가능 여부
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record ErrorObservation(
    String message,
    boolean recoverable
) implements Observation {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException message가 null이거나 빈 문자열인 경우
     */
    public ErrorObservation {
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("message cannot be null or blank");
        }
    }

    /**
     * 복구 가능한 오류 생성.
     *
     * @param message 오류 메시지
     * @return ErrorObservation (recoverable=true)
     */
    public static ErrorObservation recoverable(String message) {
        return new ErrorObservation(message, true);
    }

    /**
     * 복구 불가능한 오류 생성.
     *
     * @param message 오류 메시지
     * @return ErrorObservation (recoverable=false)
     */
    public static ErrorObservation fatal(String message) {
        return new ErrorObservation(message, false);
    }
}
