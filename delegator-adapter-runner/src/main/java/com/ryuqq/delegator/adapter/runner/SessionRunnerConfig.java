package com.ryuqq.delegator.adapter.runner;

/**
 * 세션 러너 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>delegationTimeoutMs: 위임 1건당 최대 실행 시간 (기본 300000ms = 5분).
 *       초과 시 복구 가능한 ErrorObservation으로 기록되어 재시도 예산을 소모합니다.</li>
 *   <li>shutdownTimeoutMs: shutdown() 시 진행 중인 위임 대기 시간 (기본 60000ms)</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param delegationTimeoutMs 위임 타임아웃 (밀리초, 양수여야 함)
 * @param shutdownTimeoutMs 종료 대기 시간 (밀리초, 0 이상)
 */
public record SessionRunnerConfig(long delegationTimeoutMs, long shutdownTimeoutMs) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: delegationTimeoutMs=300000ms (5분), shutdownTimeoutMs=60000ms (1분)</p>
     */
    public SessionRunnerConfig() {
        this(300_000, 60_000);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public SessionRunnerConfig {
        if (delegationTimeoutMs <= 0) {
            throw new IllegalArgumentException(
                "delegationTimeoutMs must be positive (current: " + delegationTimeoutMs + ")"
            );
        }
        if (shutdownTimeoutMs < 0) {
            throw new IllegalArgumentException(
                "shutdownTimeoutMs must be non-negative (current: " + shutdownTimeoutMs + ")"
            );
        }
    }

    /**
     * delegationTimeoutMs만 변경한 새 인스턴스 생성.
     *
     * @param delegationTimeoutMs 새로운 위임 타임아웃 (밀리초)
     * @return 새 SessionRunnerConfig 인스턴스
     */
    public SessionRunnerConfig withDelegationTimeoutMs(long delegationTimeoutMs) {
        return new SessionRunnerConfig(delegationTimeoutMs, this.shutdownTimeoutMs);
    }

    /**
     * shutdownTimeoutMs만 변경한 새 인스턴스 생성.
     *
     * @param shutdownTimeoutMs 새로운 종료 대기 시간 (밀리초)
     * @return 새 SessionRunnerConfig 인스턴스
     */
    public SessionRunnerConfig withShutdownTimeoutMs(long shutdownTimeoutMs) {
        return new SessionRunnerConfig(this.delegationTimeoutMs, shutdownTimeoutMs);
    }
}
