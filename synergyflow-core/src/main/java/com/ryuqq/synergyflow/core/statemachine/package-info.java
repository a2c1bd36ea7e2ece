/**
 * Approval workflow state machine package.
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.synergyflow.core.statemachine.WorkflowState} - Record lifecycle states</li>
 *   <li>{@link com.ryuqq.synergyflow.core.statemachine.WorkflowAction} - Caller-supplied triggers</li>
 *   <li>{@link com.ryuqq.synergyflow.core.statemachine.StateMachine} - Legal transition graph</li>
 * </ul>
 *
 * <h2>Transition Rules</h2>
 * <pre>
 * draft    --submit-----------&gt; review
 * review   --approve----------&gt; approved
 * review   --reject-----------&gt; rejected
 * review   --return_to_draft--&gt; draft
 * approved --realize----------&gt; realized
 * approved --reject-----------&gt; rejected
 * rejected --return_to_draft--&gt; draft
 *
 * realized: no outgoing edges (terminal)
 * rejected: reopenable through return_to_draft only
 * </pre>
 *
 * <h2>Usage Example</h2>
 * <pre>
 * Optional&lt;WorkflowState&gt; next = StateMachine.nextState(WorkflowState.DRAFT, WorkflowAction.SUBMIT);
 *
 * // Throws InvalidTransitionException
 * StateMachine.transition(recordId, WorkflowState.REALIZED, WorkflowAction.REJECT);
 * </pre>
 *
 * @since 1.0.0
 * @author SynergyFlow Team
 */
package com.ryuqq.synergyflow.core.statemachine;
