/**
 * Delegator 테스트 지원 모듈.
 *
 * <p>어댑터와 애플리케이션 테스트에서 공유하는 도구를 제공합니다.</p>
 *
 * <ul>
 *   <li>{@code fixture} - Event Log 시나리오 빌더, 스크립트 기반 전문 에이전트</li>
 *   <li>{@code contract} - EventLog 구현체 공통 Contract Test</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.delegator.testkit;
