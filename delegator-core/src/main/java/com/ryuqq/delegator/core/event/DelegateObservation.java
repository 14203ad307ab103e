package com.ryuqq.delegator.core.event;

import com.ryuqq.delegator.core.model.DelegationOutputs;
import com.ryuqq.delegator.core.model.DelegationStatus;
import com.ryuqq.delegator.core.model.Role;

/**
 * 위임 실행 결과.
 *
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>SUCCESS인 경우 outputs 필수</li>
 *   <li>outputs가 있으면 outputs의 역할이 role과 같아야 함</li>
 *   <li>FAILURE인 경우 outputs는 선택 (예: Verify 실패 시 피드백 전달)</li>
 * </ul>
 *
 * @param role 결과를 보고한 역할
 * @param outputs 역할별 출력 (FAILURE 시 null 가능)
 * @param status 실행 상태
 * @param message 실패 사유 등 부가 메시지 (null 가능)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record DelegateObservation(
    Role role,
    DelegationOutputs outputs,
    DelegationStatus status,
    String message
) implements Observation {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 필수 필드 누락 또는 역할 불일치
     */
    public DelegateObservation {
        if (role == null) {
            throw new IllegalArgumentException("role cannot be null");
        }
        if (status == null) {
            throw new IllegalArgumentException("status cannot be null");
        }
        if (status.isSuccess() && outputs == null) {
            throw new IllegalArgumentException("outputs cannot be null for SUCCESS observation");
        }
        if (outputs != null && outputs.role() != role) {
            throw new IllegalArgumentException(
                String.format("%s observation cannot carry %s outputs", role, outputs.role())
            );
        }
    }

    /**
     * 성공 관측 생성 (역할은 outputs에서 결정).
     *
     * @param outputs 역할별 출력
     * @return DelegateObservation (SUCCESS)
     */
    public static DelegateObservation success(DelegationOutputs outputs) {
        if (outputs == null) {
            throw new IllegalArgumentException("outputs cannot be null for SUCCESS observation");
        }
        return new DelegateObservation(outputs.role(), outputs, DelegationStatus.SUCCESS, null);
    }

    /**
     * 실패 관측 생성.
     *
     * @param role 실패한 역할
     * @param message 실패 사유
     * @return DelegateObservation (FAILURE)
     */
    public static DelegateObservation failure(Role role, String message) {
        return new DelegateObservation(role, null, DelegationStatus.FAILURE, message);
    }

    /**
     * 성공 여부.
     *
     * @return SUCCESS이면 true
     */
    public boolean isSuccess() {
        return status.isSuccess();
    }
}
