/**
 * Service Provider Interfaces supplied by the calling environment.
 *
 * <ul>
 *   <li>{@link com.ryuqq.delegator.core.spi.EventLog} - Append-only ordered event storage</li>
 *   <li>{@link com.ryuqq.delegator.core.spi.SpecialistAgent} - Study / Code / Verify agent invocation</li>
 * </ul>
 *
 * <p>The orchestrator core never calls a SpecialistAgent itself; only the session
 * runner in {@code delegator-adapter-runner} does.</p>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.delegator.core.spi;
