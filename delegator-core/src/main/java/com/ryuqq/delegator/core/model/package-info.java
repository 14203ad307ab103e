/**
 * Delegation value objects.
 *
 * <p>Every role has its own input and output record. Required fields are checked in
 * the compact constructor, so a malformed delegation cannot be built at all.</p>
 *
 * <table>
 *   <caption>Role schemas</caption>
 *   <tr><th>Role</th><th>Inputs</th><th>Outputs</th></tr>
 *   <tr><td>STUDY</td><td>task, priorSummary?, feedback?</td><td>summary</td></tr>
 *   <tr><td>CODE</td><td>task, studySummary, verifierFeedback?</td><td>diffOrFiles</td></tr>
 *   <tr><td>VERIFY</td><td>task, studySummary, changes?</td><td>approved, feedback, restudyRequested</td></tr>
 * </table>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.delegator.core.model;
