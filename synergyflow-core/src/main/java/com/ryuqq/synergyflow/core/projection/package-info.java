/**
 * Read-only projections over current state and transition history.
 *
 * <p>Everything in this package is a pure function with no I/O. It can be re-derived at
 * any time and stores nothing.</p>
 *
 * <ul>
 *   <li>{@link com.ryuqq.synergyflow.core.projection.StageProjector} - per-stage status from the current state alone</li>
 *   <li>{@link com.ryuqq.synergyflow.core.projection.StageMilestones} - first transition that entered each state</li>
 *   <li>{@link com.ryuqq.synergyflow.core.projection.TimelineEntry} - audit timeline rows</li>
 *   <li>{@link com.ryuqq.synergyflow.core.projection.StateSummary} - per-state record counts</li>
 * </ul>
 *
 * @since 1.0.0
 * @author SynergyFlow Team
 */
package com.ryuqq.synergyflow.core.projection;
