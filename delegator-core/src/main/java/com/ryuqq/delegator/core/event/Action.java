package com.ryuqq.delegator.core.event;

/**
 * Controller가 반환하는 다음 행동.
 *
 * <p>{@code step()}의 결과는 항상 {@link DelegateAction} 또는 {@link FinishAction} 중 하나입니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public sealed interface Action extends Event permits DelegateAction, FinishAction {

    /**
     * 종료 행동인지 확인.
     *
     * @return FinishAction이면 true
     */
    default boolean isFinish() {
        return this instanceof FinishAction;
    }
}
