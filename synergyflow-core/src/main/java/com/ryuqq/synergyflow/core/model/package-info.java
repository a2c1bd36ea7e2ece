/**
 * Core value objects of the approval workflow.
 *
 * <h2>Value Objects</h2>
 * <ul>
 *   <li>{@link com.ryuqq.synergyflow.core.model.RecordId} - Owning record (synergy) identifier</li>
 *   <li>{@link com.ryuqq.synergyflow.core.model.Actor} - Authenticated actor (id + display label)</li>
 * </ul>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Immutability:</strong> All value objects are immutable</li>
 *   <li><strong>Validation:</strong> Constructor validation ensures data integrity</li>
 *   <li><strong>Pure Java:</strong> No external dependencies</li>
 * </ul>
 *
 * @since 1.0.0
 * @author SynergyFlow Team
 */
package com.ryuqq.synergyflow.core.model;
