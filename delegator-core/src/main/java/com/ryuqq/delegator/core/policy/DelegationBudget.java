package com.ryuqq.delegator.core.policy;

/**
 * 위임 예산 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>maxIterations: 승인 없이 허용되는 Code→Verify 주기 수 (기본 3)</li>
 *   <li>maxStudyAttempts: Study 시도 횟수 (기본 1 = 첫 Study 실패 시 종료)</li>
 * </ul>
 *
 * <p><strong>예시:</strong> maxIterations=3이면 Code는 최대 3번 시도되고,
 * 세 번째 반려 후 BUDGET_EXHAUSTED로 종료됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param maxIterations 반복 예산 (1 이상)
 * @param maxStudyAttempts Study 시도 예산 (1 이상)
 */
public record DelegationBudget(int maxIterations, int maxStudyAttempts) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: maxIterations=3, maxStudyAttempts=1</p>
     */
    public DelegationBudget() {
        this(3, 1);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public DelegationBudget {
        if (maxIterations <= 0) {
            throw new IllegalArgumentException(
                "maxIterations must be positive (current: " + maxIterations + ")"
            );
        }
        if (maxStudyAttempts <= 0) {
            throw new IllegalArgumentException(
                "maxStudyAttempts must be positive (current: " + maxStudyAttempts + ")"
            );
        }
    }

    /**
     * maxIterations만 변경한 새 인스턴스 생성.
     *
     * @param maxIterations 새로운 반복 예산
     * @return 새 DelegationBudget 인스턴스
     */
    public DelegationBudget withMaxIterations(int maxIterations) {
        return new DelegationBudget(maxIterations, this.maxStudyAttempts);
    }

    /**
     * maxStudyAttempts만 변경한 새 인스턴스 생성.
     *
     * @param maxStudyAttempts 새로운 Study 시도 예산
     * @return 새 DelegationBudget 인스턴스
     */
    public DelegationBudget withMaxStudyAttempts(int maxStudyAttempts) {
        return new DelegationBudget(this.maxIterations, maxStudyAttempts);
    }
}
