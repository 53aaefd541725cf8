package com.ryuqq.relay.adapter.runner;

import com.ryuqq.relay.core.retry.RetryConfig;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Exponential Backoff with Jitter 계산기.
 *
 * <p>재시도 간격을 지수적으로 증가시키되, Jitter를 추가하여
 * 동시에 실패한 호출들이 같은 시점에 재시도하지 않도록 합니다.</p>
 *
 * <p><strong>알고리즘:</strong></p>
 * <pre>
 * delay(i) = min(maxDelay, baseDelay * backoffMultiplier^i) * (1 + uniform(0, jitterFraction))
 * </pre>
 * <p>{@code i}는 0부터 시작하며, {@code delay(i)}는 (i+1)번째 시도 이후 (i+2)번째 시도 전 대기 시간입니다.</p>
 *
 * <p><strong>예시 (baseDelay=1s, multiplier=2.0, maxDelay=60s, jitterFraction=0.1):</strong></p>
 * <ul>
 *   <li>i=0: 1000ms ~ 1100ms</li>
 *   <li>i=1: 2000ms ~ 2200ms</li>
 *   <li>i=2: 4000ms ~ 4400ms</li>
 *   <li>i=6: 64000ms → 60000ms로 제한 후 jitter 적용 (60000ms ~ 66000ms)</li>
 * </ul>
 *
 * @author Relay Team
 * @since 1.0.0
 */
public class BackoffCalculator {

    private final DoubleSupplier random;

    /**
     * {@link ThreadLocalRandom} 기반 계산기 생성.
     */
    public BackoffCalculator() {
        this(() -> ThreadLocalRandom.current().nextDouble());
    }

    /**
     * 난수 공급자를 지정하여 생성 (결정적 테스트용).
     *
     * @param random [0.0, 1.0) 범위의 난수 공급자
     */
    public BackoffCalculator(DoubleSupplier random) {
        if (random == null) {
            throw new IllegalArgumentException("random cannot be null");
        }
        this.random = random;
    }

    /**
     * 재시도 지연 시간 계산.
     *
     * @param config 재시도 설정
     * @param retryIndex 재시도 인덱스 (0부터 시작)
     * @return 재시도 전 대기 시간
     * @throws IllegalArgumentException config가 null이거나 retryIndex가 음수인 경우
     */
    public Duration calculate(RetryConfig config, int retryIndex) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (retryIndex < 0) {
            throw new IllegalArgumentException(
                "retryIndex must be non-negative (current: " + retryIndex + ")"
            );
        }

        // 1. 지수적 백오프 (overflow 시 Infinity가 되므로 min으로 제한)
        double exponentialNanos = config.baseDelay().toNanos() * Math.pow(config.backoffMultiplier(), retryIndex);
        double cappedNanos = Math.min(exponentialNanos, config.maxDelay().toNanos());

        // 2. Jitter 적용 (1 + uniform(0, jitterFraction))
        double u = random.getAsDouble();
        if (u < 0.0 || u >= 1.0) {
            throw new IllegalStateException("random must return a value in [0.0, 1.0) (current: " + u + ")");
        }
        double jittered = cappedNanos * (1.0 + u * config.jitterFraction());

        return Duration.ofNanos((long) jittered);
    }
}
