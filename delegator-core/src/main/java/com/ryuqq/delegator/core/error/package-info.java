/**
 * Error taxonomy for orchestration failures.
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.delegator.core.error;
