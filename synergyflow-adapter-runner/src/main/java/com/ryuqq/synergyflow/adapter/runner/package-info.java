/**
 * Runner Adapter Layer - WorkflowEngine 구현체.
 *
 * <h2>구성 요소</h2>
 * <ul>
 *   <li>{@link com.ryuqq.synergyflow.adapter.runner.OptimisticWorkflowRunner} - 낙관적 동시성 엔진</li>
 *   <li>{@link com.ryuqq.synergyflow.adapter.runner.EngineConfig} - 충돌 재시도 설정</li>
 *   <li>{@link com.ryuqq.synergyflow.adapter.runner.BackoffCalculator} - 재시도 대기 시간 계산</li>
 *   <li>{@link com.ryuqq.synergyflow.adapter.runner.TransitionChainAuditor} - 저장된 체인 감사</li>
 * </ul>
 *
 * <h2>아키텍처 위치</h2>
 * <pre>
 * adapter-runner (OptimisticWorkflowRunner)
 *   ↓ implements
 * application (WorkflowEngine interface)
 *   ↓ depends on
 * core (StateMachine, WorkflowTransition, TransitionLogStore SPI)
 * </pre>
 *
 * @author SynergyFlow Team
 * @since 1.0.0
 */
package com.ryuqq.synergyflow.adapter.runner;
