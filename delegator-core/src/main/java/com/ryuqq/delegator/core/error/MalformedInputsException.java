package com.ryuqq.delegator.core.error;

/**
 * 위임 입력 구성 시 필수 필드 누락.
 *
 * <p>외부 실패가 아니라 Policy 또는 작업 접수 단계의 계약 위반을 의미하므로 항상 치명적입니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class MalformedInputsException extends OrchestrationException {

    /**
     * 생성자.
     *
     * @param message 오류 메시지
     */
    public MalformedInputsException(String message) {
        super(ErrorKind.MALFORMED_INPUTS, message);
    }

    /**
     * 필수 필드 누락 예외 생성.
     *
     * @param role 위임 역할 이름
     * @param field 누락된 필드 이름
     * @return MalformedInputsException 인스턴스
     */
    public static MalformedInputsException missingField(String role, String field) {
        return new MalformedInputsException(role + " inputs require '" + field + "'");
    }
}
