/**
 * Delegation phase state machine package.
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.delegator.core.statemachine.Phase} - Delegation phases (enum)</li>
 *   <li>{@link com.ryuqq.delegator.core.statemachine.PhaseTransition} - Transition validation</li>
 * </ul>
 *
 * <h2>Transition Rules</h2>
 * <pre>
 * AWAITING_STUDY  → AWAITING_CODE → AWAITING_VERIFY → DONE
 * AWAITING_VERIFY → AWAITING_CODE  (rejected, bounded by maxIterations)
 * AWAITING_VERIFY → AWAITING_STUDY (re-study requested)
 * any non-terminal → EXHAUSTED | FAILED
 *
 * Forbidden:
 * - DONE / EXHAUSTED / FAILED → * (terminal phases)
 * </pre>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.delegator.core.statemachine;
