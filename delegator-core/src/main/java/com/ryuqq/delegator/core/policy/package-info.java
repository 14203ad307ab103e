/**
 * Next-action policy and retry budgets.
 *
 * <p>{@link com.ryuqq.delegator.core.policy.PhasePolicy} maps a reconstructed
 * state to exactly one action. It never reads the log itself.</p>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.delegator.core.policy;
