/**
 * Transition log entities.
 *
 * <ul>
 *   <li>{@link com.ryuqq.synergyflow.core.transition.WorkflowTransition} - committed, immutable audit event</li>
 *   <li>{@link com.ryuqq.synergyflow.core.transition.TransitionDraft} - candidate handed to the store's conditional append</li>
 *   <li>{@link com.ryuqq.synergyflow.core.transition.CurrentState} - state derived from the latest transition ({@code draft}/0 when empty)</li>
 * </ul>
 *
 * @since 1.0.0
 * @author SynergyFlow Team
 */
package com.ryuqq.synergyflow.core.transition;
