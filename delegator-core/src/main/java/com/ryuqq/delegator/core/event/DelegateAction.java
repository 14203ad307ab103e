package com.ryuqq.delegator.core.event;

import com.ryuqq.delegator.core.error.MalformedInputsException;
import com.ryuqq.delegator.core.model.DelegationInputs;
import com.ryuqq.delegator.core.model.Role;

/**
 * 전문 에이전트 위임 행동.
 *
 * <p><strong>예시:</strong></p>
 * <pre>
 * DelegateAction action = DelegateAction.of(StudyInputs.of(task));
 * // action.role() == Role.STUDY
 * </pre>
 *
 * @param role 위임 역할
 * @param inputs 역할별 입력 (role과 일치해야 함)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record DelegateAction(
    Role role,
    DelegationInputs inputs
) implements Action {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException role이 null인 경우
     * @throws MalformedInputsException inputs가 누락되었거나 role과 맞지 않는 경우
     */
    public DelegateAction {
        if (role == null) {
            throw new IllegalArgumentException("role cannot be null");
        }
        if (inputs == null) {
            throw new MalformedInputsException(role + " delegation requires inputs");
        }
        if (inputs.role() != role) {
            throw new MalformedInputsException(
                String.format("%s delegation cannot carry %s inputs", role, inputs.role())
            );
        }
    }

    /**
     * 입력의 역할로 위임 행동 생성.
     *
     * @param inputs 역할별 입력
     * @return DelegateAction 인스턴스
     * @throws MalformedInputsException inputs가 null인 경우
     */
    public static DelegateAction of(DelegationInputs inputs) {
        if (inputs == null) {
            throw new MalformedInputsException("delegation requires inputs");
        }
        return new DelegateAction(inputs.role(), inputs);
    }
}
