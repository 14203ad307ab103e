/**
 * Orchestrator Adapter Runner - 호출자 측 위임 루프.
 *
 * <ul>
 *   <li>{@link com.ryuqq.delegator.adapter.runner.DelegationLoopRunner} - step → 위임 실행 → 관측 추가 반복</li>
 *   <li>{@link com.ryuqq.delegator.adapter.runner.SessionRunnerConfig} - 타임아웃 설정</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.delegator.adapter.runner;
