/**
 * In-memory Event Log adapter.
 *
 * <p>Reference implementation of {@link com.ryuqq.delegator.core.spi.EventLog}
 * for tests and single-process sessions. Any other storage medium qualifies as long as
 * it passes {@code AbstractEventLogContractTest} from {@code delegator-testkit}.</p>
 *
 * @see com.ryuqq.delegator.core.spi.EventLog
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.delegator.adapter.inmemory.log;
