/**
 * Service Provider Interface (SPI) package.
 *
 * <p>Defines the persistence port that infrastructure adapters implement.</p>
 *
 * <h2>SPI Interfaces</h2>
 * <ul>
 *   <li>{@link com.ryuqq.synergyflow.core.spi.TransitionLogStore} - append-only transition log with compare-and-append</li>
 *   <li>{@link com.ryuqq.synergyflow.core.spi.AppendResult} - outcome of a conditional append</li>
 * </ul>
 *
 * <h2>Implementation Responsibility</h2>
 * <p>Adapter modules (synergyflow-adapter-inmemory, synergyflow-adapter-jdbc) provide the
 * implementations. Each one must pass the contract tests shipped in synergyflow-testkit.</p>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Hexagonal Architecture:</strong> Core defines interfaces, adapters provide implementations</li>
 *   <li><strong>No pessimistic locks:</strong> correctness relies on the atomic conditional append only</li>
 * </ul>
 *
 * @since 1.0.0
 * @author SynergyFlow Team
 */
package com.ryuqq.synergyflow.core.spi;
