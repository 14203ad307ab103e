/**
 * Delegation Controller - 오케스트레이션 진입점.
 *
 * <h2>핵심 인터페이스</h2>
 * <ul>
 *   <li>{@link com.ryuqq.delegator.application.controller.DelegationController} - step(log) → Action</li>
 *   <li>{@link com.ryuqq.delegator.application.controller.EventSourcedDelegationController} - 재구성 + 정책 기반 구현</li>
 * </ul>
 *
 * <h2>설계 원칙</h2>
 * <ul>
 *   <li><strong>Event Sourcing:</strong> 현재 단계는 저장하지 않고 매번 로그에서 계산</li>
 *   <li><strong>예외 경계:</strong> step()은 예외를 던지지 않고 항상 Action을 반환</li>
 *   <li><strong>무부수효과:</strong> 위임 실행은 호출자(세션 러너)가 담당</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.delegator.application.controller;
