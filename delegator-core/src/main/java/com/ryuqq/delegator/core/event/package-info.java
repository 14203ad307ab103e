/**
 * Event Log entry types.
 *
 * <p>This package defines the sealed event hierarchy that forms the orchestrator's
 * only persisted state.</p>
 *
 * <h2>Sealed Hierarchy</h2>
 * <ul>
 *   <li>{@link com.ryuqq.delegator.core.event.TaskSubmitted} - Task intake (first entry, exactly once)</li>
 *   <li>{@link com.ryuqq.delegator.core.event.Action} - DelegateAction | FinishAction</li>
 *   <li>{@link com.ryuqq.delegator.core.event.Observation} - DelegateObservation | ErrorObservation</li>
 * </ul>
 *
 * <h2>Usage Example</h2>
 * <pre>
 * log.append(TaskSubmitted.of(Task.of("add endpoint")));
 * log.append(DelegateAction.of(StudyInputs.of(task)));
 * log.append(DelegateObservation.success(new StudyOutputs("controller lives in api module")));
 * </pre>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.delegator.core.event;
