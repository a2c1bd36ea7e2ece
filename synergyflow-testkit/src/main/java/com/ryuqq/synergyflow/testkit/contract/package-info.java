/**
 * Reusable contract test suites.
 *
 * <p>Adapters extend {@link com.ryuqq.synergyflow.testkit.contract.AbstractTransitionLogStoreContractTest}
 * and {@link com.ryuqq.synergyflow.testkit.contract.AbstractWorkflowEngineContractTest} to prove they
 * honor the store and engine contracts.</p>
 *
 * @author SynergyFlow Team
 * @since 1.0.0
 */
package com.ryuqq.synergyflow.testkit.contract;
