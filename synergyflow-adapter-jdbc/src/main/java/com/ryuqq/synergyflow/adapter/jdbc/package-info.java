/**
 * PostgreSQL transition log store.
 *
 * <ul>
 *   <li>{@link com.ryuqq.synergyflow.adapter.jdbc.JdbcTransitionLogStore} - conditional append over JDBC</li>
 *   <li>{@link com.ryuqq.synergyflow.adapter.jdbc.TransitionLogSchema} - Flyway migrations</li>
 * </ul>
 *
 * @author SynergyFlow Team
 * @since 1.0.0
 */
package com.ryuqq.synergyflow.adapter.jdbc;
