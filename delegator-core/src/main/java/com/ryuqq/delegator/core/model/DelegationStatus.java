package com.ryuqq.delegator.core.model;

/**
 * 위임 결과 상태.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum DelegationStatus {

    /**
     * 전문 에이전트가 출력을 정상적으로 반환함.
     */
    SUCCESS,

    /**
     * 전문 에이전트가 실패를 보고함 (재시도 대상).
     */
    FAILURE;

    /**
     * 성공 여부 확인.
     *
     * @return SUCCESS인 경우 true
     */
    public boolean isSuccess() {
        return this == SUCCESS;
    }
}
