package com.ryuqq.delegator.core.error;

/**
 * 오케스트레이션 계약 위반 예외의 기반 클래스.
 *
 * <p>Reconstructor와 Policy 내부에서만 발생하며,
 * Controller가 포착하여 치명적 {@code FinishAction}으로 변환합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public abstract class OrchestrationException extends RuntimeException {

    private final ErrorKind kind;

    /**
     * 생성자.
     *
     * @param kind 오류 분류
     * @param message 오류 메시지
     */
    protected OrchestrationException(ErrorKind kind, String message) {
        super(message);
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        this.kind = kind;
    }

    /**
     * 오류 분류 조회.
     *
     * @return 오류 분류
     */
    public ErrorKind kind() {
        return kind;
    }
}
