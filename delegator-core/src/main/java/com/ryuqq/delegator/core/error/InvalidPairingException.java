package com.ryuqq.delegator.core.error;

/**
 * 위임/관측 쌍이 맞지 않는 로그.
 *
 * <p><strong>발생 조건:</strong></p>
 * <ul>
 *   <li>관측 결과의 역할이 대기 중인 위임의 역할과 다름</li>
 *   <li>대기 중인 위임 없이 관측 결과가 나타남</li>
 *   <li>이전 위임이 끝나기 전에 새 위임이 기록됨</li>
 *   <li>현재 단계가 기대하지 않는 역할로 위임함</li>
 *   <li>FinishAction 이후에 이벤트가 기록됨</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class InvalidPairingException extends OrchestrationException {

    /**
     * 생성자.
     *
     * @param message 오류 메시지
     */
    public InvalidPairingException(String message) {
        super(ErrorKind.INVALID_PAIRING, message);
    }
}
