package com.ryuqq.delegator.core.statemachine;

import com.ryuqq.delegator.core.model.Role;

/**
 * 위임 오케스트레이션 단계.
 *
 * <p><strong>상태 전이 다이어그램:</strong></p>
 * <pre>
 * AWAITING_STUDY ──► AWAITING_CODE ──► AWAITING_VERIFY ──► DONE
 *    ▲    │  ▲            │  ▲               │
 *    │    │  └──(재시도)──┘  └───(반려)───────┤
 *    │    │                                   │
 *    └────┼────────────(재분석 요청)──────────┘
 *         │
 *         ├─► FAILED     (Study 예산 소진, 복구 불가 오류)
 *         └─► EXHAUSTED  (반복 예산 소진)
 * </pre>
 *
 * <p>DONE, EXHAUSTED, FAILED는 종료 상태이며 모두 {@code FinishAction}으로 귀결됩니다.
 * 유일한 순환(AWAITING_VERIFY → AWAITING_CODE)은 maxIterations로 제한됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum Phase {

    /**
     * Study 위임 대기 (초기 상태).
     */
    AWAITING_STUDY(Role.STUDY),

    /**
     * Code 위임 대기.
     */
    AWAITING_CODE(Role.CODE),

    /**
     * Verify 위임 대기.
     */
    AWAITING_VERIFY(Role.VERIFY),

    /**
     * 검증 승인 완료.
     */
    DONE(null),

    /**
     * 승인 없이 반복 예산 소진.
     */
    EXHAUSTED(null),

    /**
     * 재시도 불가능한 위임 실패.
     */
    FAILED(null);

    private final Role expectedRole;

    Phase(Role expectedRole) {
        this.expectedRole = expectedRole;
    }

    /**
     * 종료 상태인지 확인.
     *
     * @return DONE, EXHAUSTED, FAILED인 경우 true
     */
    public boolean isTerminal() {
        return expectedRole == null;
    }

    /**
     * 이 단계에서 위임해야 할 역할.
     *
     * @return 위임 역할
     * @throws IllegalStateException 종료 상태인 경우
     */
    public Role expectedRole() {
        if (expectedRole == null) {
            throw new IllegalStateException("Terminal phase has no delegation role: " + this);
        }
        return expectedRole;
    }

    /**
     * 역할이 위임 대기 중인 단계.
     *
     * @param role 역할
     * @return 해당 역할을 기다리는 단계
     */
    public static Phase awaiting(Role role) {
        if (role == null) {
            throw new IllegalArgumentException("role cannot be null");
        }
        return switch (role) {
            case STUDY -> AWAITING_STUDY;
            case CODE -> AWAITING_CODE;
            case VERIFY -> AWAITING_VERIFY;
        };
    }
}
