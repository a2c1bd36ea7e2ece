package com.ryuqq.synergyflow.adapter.runner;

/**
 * 워크플로우 엔진 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>maxConflictRetries: sequence 충돌 시 내부 재시도 횟수 (기본 3, 0이면 재시도 없음)</li>
 *   <li>retryBaseDelayMs: 첫 재시도 전 대기 시간 (기본 10ms)</li>
 *   <li>retryMaxDelayMs: 재시도 대기 시간 상한 (기본 200ms)</li>
 *   <li>jitterFactor: 대기 시간에 더하는 무작위 비율 (기본 0.2)</li>
 * </ul>
 *
 * <p>충돌은 같은 레코드를 동시에 수정할 때만 발생하므로 짧은 대기와 적은 재시도로 충분합니다.
 * 요청 스레드가 대기하므로 retryMaxDelayMs를 크게 잡지 마세요.</p>
 *
 * @author SynergyFlow Team
 * @since 1.0.0
 * @param maxConflictRetries 최대 재시도 횟수 (0 이상)
 * @param retryBaseDelayMs 기본 대기 시간 (밀리초, 양수)
 * @param retryMaxDelayMs 최대 대기 시간 (밀리초, retryBaseDelayMs 이상)
 * @param jitterFactor Jitter 비율 (0.0 ~ 1.0)
 */
public record EngineConfig(int maxConflictRetries, long retryBaseDelayMs, long retryMaxDelayMs, double jitterFactor) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: maxConflictRetries=3, retryBaseDelayMs=10, retryMaxDelayMs=200, jitterFactor=0.2</p>
     */
    public EngineConfig() {
        this(3, 10, 200, 0.2);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public EngineConfig {
        if (maxConflictRetries < 0) {
            throw new IllegalArgumentException(
                "maxConflictRetries must be >= 0 (current: " + maxConflictRetries + ")"
            );
        }
        if (retryBaseDelayMs <= 0) {
            throw new IllegalArgumentException(
                "retryBaseDelayMs must be positive (current: " + retryBaseDelayMs + ")"
            );
        }
        if (retryMaxDelayMs < retryBaseDelayMs) {
            throw new IllegalArgumentException(
                "retryMaxDelayMs must be >= retryBaseDelayMs (base: " + retryBaseDelayMs
                    + ", max: " + retryMaxDelayMs + ")"
            );
        }
        if (jitterFactor < 0.0 || jitterFactor > 1.0) {
            throw new IllegalArgumentException(
                "jitterFactor must be between 0.0 and 1.0 (current: " + jitterFactor + ")"
            );
        }
    }

    /**
     * maxConflictRetries만 변경한 새 인스턴스 생성.
     *
     * @param maxConflictRetries 새로운 재시도 횟수
     * @return 새 EngineConfig 인스턴스
     */
    public EngineConfig withMaxConflictRetries(int maxConflictRetries) {
        return new EngineConfig(maxConflictRetries, retryBaseDelayMs, retryMaxDelayMs, jitterFactor);
    }

    /**
     * 대기 시간 범위만 변경한 새 인스턴스 생성.
     *
     * @param retryBaseDelayMs 새로운 기본 대기 시간
     * @param retryMaxDelayMs 새로운 최대 대기 시간
     * @return 새 EngineConfig 인스턴스
     */
    public EngineConfig withRetryDelays(long retryBaseDelayMs, long retryMaxDelayMs) {
        return new EngineConfig(maxConflictRetries, retryBaseDelayMs, retryMaxDelayMs, jitterFactor);
    }

    /**
     * jitterFactor만 변경한 새 인스턴스 생성.
     *
     * @param jitterFactor 새로운 Jitter 비율
     * @return 새 EngineConfig 인스턴스
     */
    public EngineConfig withJitterFactor(double jitterFactor) {
        return new EngineConfig(maxConflictRetries, retryBaseDelayMs, retryMaxDelayMs, jitterFactor);
    }

    /**
     * 이 설정의 대기 시간 계산기.
     *
     * @return BackoffCalculator
     */
    public BackoffCalculator backoff() {
        return new BackoffCalculator(retryBaseDelayMs, retryMaxDelayMs, jitterFactor);
    }
}
