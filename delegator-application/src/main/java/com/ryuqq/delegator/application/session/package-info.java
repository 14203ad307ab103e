/**
 * Caller-side session port.
 *
 * <p>Implemented by {@code delegator-adapter-runner}.</p>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.delegator.application.session;
