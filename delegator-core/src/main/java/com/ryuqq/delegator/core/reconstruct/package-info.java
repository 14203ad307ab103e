/**
 * State reconstruction from the Event Log.
 *
 * <p>{@link com.ryuqq.delegator.core.reconstruct.StateReconstructor} replays the log into a
 * {@link com.ryuqq.delegator.core.reconstruct.DerivedState}. Nothing in this package is
 * stored; the same log always yields the same state.</p>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.delegator.core.reconstruct;
