/**
 * Workflow error taxonomy.
 *
 * <p>All errors are unchecked and extend
 * {@link com.ryuqq.synergyflow.core.exception.WorkflowException}, which carries the record,
 * the observed state and the attempted action so callers can decide whether to retry or
 * prompt the user.</p>
 *
 * <ul>
 *   <li>{@link com.ryuqq.synergyflow.core.exception.InvalidTransitionException} - illegal action, never retried</li>
 *   <li>{@link com.ryuqq.synergyflow.core.exception.ConcurrentTransitionException} - race detected, re-read and retry</li>
 *   <li>{@link com.ryuqq.synergyflow.core.exception.TransitionNotFoundException} - no transition at the requested sequence</li>
 *   <li>{@link com.ryuqq.synergyflow.core.exception.StoreUnavailableException} - transient store failure, propagated</li>
 * </ul>
 *
 * <p>Argument validation failures (null or malformed input) use {@link java.lang.IllegalArgumentException}.</p>
 *
 * @since 1.0.0
 * @author SynergyFlow Team
 */
package com.ryuqq.synergyflow.core.exception;
