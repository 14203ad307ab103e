package com.ryuqq.delegator.core.model;

/**
 * Verify 위임 출력.
 *
 * <p>restudyRequested는 검증자가 Study 요약 자체가 부족하다고 판단한 경우에만 true이며,
 * 이 경우 다음 위임은 Code가 아닌 Study(재분석)가 됩니다.</p>
 *
 * @param approved 승인 여부
 * @param feedback 검증 피드백 (null 가능)
 * @param restudyRequested 재분석 요청 여부 (approved=true와 함께 쓸 수 없음)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record VerifyOutputs(
    boolean approved,
    String feedback,
    boolean restudyRequested
) implements DelegationOutputs {

    public VerifyOutputs {
        if (approved && restudyRequested) {
            throw new IllegalArgumentException("approved verdict cannot request a restudy");
        }
    }

    /**
     * 승인 출력 생성.
     *
     * @param feedback 승인 메모 (null 가능)
     * @return VerifyOutputs 인스턴스
     */
    public static VerifyOutputs approved(String feedback) {
        return new VerifyOutputs(true, feedback, false);
    }

    /**
     * 반려 출력 생성.
     *
     * @param feedback 반려 사유
     * @return VerifyOutputs 인스턴스
     */
    public static VerifyOutputs rejected(String feedback) {
        return new VerifyOutputs(false, feedback, false);
    }

    /**
     * 재분석 요청 출력 생성.
     *
     * @param feedback 재분석 사유
     * @return VerifyOutputs 인스턴스
     */
    public static VerifyOutputs restudy(String feedback) {
        return new VerifyOutputs(false, feedback, true);
    }

    @Override
    public Role role() {
        return Role.VERIFY;
    }
}
