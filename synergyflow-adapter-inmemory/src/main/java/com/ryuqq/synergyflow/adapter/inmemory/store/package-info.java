/**
 * In-memory transition log store.
 *
 * <p>{@link com.ryuqq.synergyflow.adapter.inmemory.store.InMemoryTransitionLogStore} implements
 * the {@link com.ryuqq.synergyflow.core.spi.TransitionLogStore} SPI with per-record atomic
 * compare-and-append. It passes the same contract tests as the JDBC store.</p>
 *
 * @author SynergyFlow Team
 * @since 1.0.0
 */
package com.ryuqq.synergyflow.adapter.inmemory.store;
