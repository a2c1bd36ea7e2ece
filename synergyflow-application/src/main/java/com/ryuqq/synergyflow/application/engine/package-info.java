/**
 * SynergyFlow Application Layer - 워크플로우 엔진 포트.
 *
 * <p>레코드 상태 변경 요청을 수락하는 엔진 인터페이스와 요청/조회 모델을 정의합니다.</p>
 *
 * <h2>핵심 타입</h2>
 * <ul>
 *   <li>{@link com.ryuqq.synergyflow.application.engine.WorkflowEngine} - 전이 적용 및 조회</li>
 *   <li>{@link com.ryuqq.synergyflow.application.engine.TransitionRequest} - 상태 변경 요청</li>
 *   <li>{@link com.ryuqq.synergyflow.application.engine.WorkflowStatus} - 화면 표시용 상태</li>
 * </ul>
 *
 * <h2>설계 원칙</h2>
 * <ul>
 *   <li><strong>헥사고날 아키텍처:</strong> 구현체는 adapter-runner 모듈에 위치</li>
 *   <li><strong>불변성:</strong> 요청과 조회 모델은 불변 record</li>
 * </ul>
 *
 * @author SynergyFlow Team
 * @since 1.0.0
 */
package com.ryuqq.synergyflow.application.engine;
