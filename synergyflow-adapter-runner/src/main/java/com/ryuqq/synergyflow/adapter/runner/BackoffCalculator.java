package com.ryuqq.synergyflow.adapter.runner;

import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * sequence 충돌 재시도 전 대기 시간.
 *
 * <p>n번째 재시도는 baseDelayMs를 n-1번 두 배로 늘린 값을 기준으로 하며, maxDelayMs에서 멈춥니다.
 * 기준값의 jitterFactor 비율 이내에서 무작위 값을 더해, 같은 레코드에서 진 작성자들이
 * 다음 시도에서 다시 같은 sequence를 노리지 않도록 합니다.</p>
 *
 * <p>기본 설정 (10ms, 200ms, 0.2)에서 재시도 1~3의 기준값은 10, 20, 40ms입니다.</p>
 *
 * @param baseDelayMs 첫 재시도 기준 대기 시간 (밀리초, 양수)
 * @param maxDelayMs 대기 시간 상한 (밀리초, baseDelayMs 이상)
 * @param jitterFactor 기준값 대비 무작위 추가 비율 (0.0 ~ 1.0)
 * @param random [0, 1) 범위 난수 공급자
 *
 * @author SynergyFlow Team
 * @since 1.0.0
 */
public record BackoffCalculator(long baseDelayMs, long maxDelayMs, double jitterFactor, DoubleSupplier random) {

    /**
     * ThreadLocalRandom을 사용하는 생성자.
     *
     * @param baseDelayMs 첫 재시도 기준 대기 시간
     * @param maxDelayMs 대기 시간 상한
     * @param jitterFactor 무작위 추가 비율
     */
    public BackoffCalculator(long baseDelayMs, long maxDelayMs, double jitterFactor) {
        this(baseDelayMs, maxDelayMs, jitterFactor, () -> ThreadLocalRandom.current().nextDouble());
    }

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public BackoffCalculator {
        if (baseDelayMs <= 0) {
            throw new IllegalArgumentException("baseDelayMs must be positive (current: " + baseDelayMs + ")");
        }
        if (maxDelayMs < baseDelayMs) {
            throw new IllegalArgumentException(
                "maxDelayMs must be >= baseDelayMs (base: " + baseDelayMs + ", max: " + maxDelayMs + ")"
            );
        }
        if (jitterFactor < 0.0 || jitterFactor > 1.0) {
            throw new IllegalArgumentException("jitterFactor must be between 0.0 and 1.0 (current: " + jitterFactor + ")");
        }
        if (random == null) {
            throw new IllegalArgumentException("random cannot be null");
        }
    }

    /**
     * 재시도 전 대기 시간.
     *
     * @param retry 재시도 번호 (1부터 시작)
     * @return 대기 시간 (밀리초, baseDelayMs 이상 maxDelayMs 이하)
     * @throws IllegalArgumentException retry가 양수가 아닌 경우
     */
    public long calculate(int retry) {
        if (retry <= 0) {
            throw new IllegalArgumentException("retry must be positive (current: " + retry + ")");
        }
        long delay = baseDelayMs;
        for (int doubled = 1; doubled < retry && delay < maxDelayMs; doubled++) {
            // 곱하기 전에 상한과 비교해야 long overflow가 없음
            delay = delay > maxDelayMs / 2 ? maxDelayMs : delay * 2;
        }
        long jitter = (long) (delay * jitterFactor * random.getAsDouble());
        return delay + Math.min(jitter, maxDelayMs - delay);
    }
}
