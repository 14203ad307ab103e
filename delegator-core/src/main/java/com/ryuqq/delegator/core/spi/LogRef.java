package com.ryuqq.delegator.core.spi;

/**
 * Event Log 내 이벤트 위치.
 *
 * @param sequence 0부터 시작하는 추가 순번 (추가 순서대로 단조 증가)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record LogRef(long sequence) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException sequence가 음수인 경우
     */
    public LogRef {
        if (sequence < 0) {
            throw new IllegalArgumentException("sequence must be non-negative (current: " + sequence + ")");
        }
    }

    /**
     * LogRef 생성.
     *
     * @param sequence 추가 순번
     * @return LogRef 인스턴스
     */
    public static LogRef of(long sequence) {
        return new LogRef(sequence);
    }
}
