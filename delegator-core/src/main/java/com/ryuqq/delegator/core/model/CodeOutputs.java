package com.ryuqq.delegator.core.model;

/**
 * Code 위임 출력.
 *
 * @param diffOrFiles 변경 내용 (diff 또는 파일 목록, 직렬화 형식은 에이전트 재량)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record CodeOutputs(String diffOrFiles) implements DelegationOutputs {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException diffOrFiles가 null인 경우
     */
    public CodeOutputs {
        if (diffOrFiles == null) {
            throw new IllegalArgumentException("diffOrFiles cannot be null");
        }
    }

    @Override
    public Role role() {
        return Role.CODE;
    }
}
