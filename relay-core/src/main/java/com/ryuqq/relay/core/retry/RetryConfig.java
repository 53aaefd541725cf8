package com.ryuqq.relay.core.retry;

import com.ryuqq.relay.core.exception.ConfigurationException;

import java.time.Duration;

/**
 * 재시도 설정 (불변 record).
 *
 * <p>호출 유형(Capability)당 하나의 인스턴스를 두며, 같은 Capability의 Provider들이 공유할 수 있습니다.</p>
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>maxAttempts: 최초 호출을 포함한 최대 시도 횟수 (기본 3)</li>
 *   <li>baseDelay: 첫 재시도 전 기본 지연 (기본 1초)</li>
 *   <li>maxDelay: 지연 상한, jitter 적용 전 기준 (기본 60초)</li>
 *   <li>backoffMultiplier: 지수 백오프 배수 (기본 2.0)</li>
 *   <li>jitterFraction: 지연에 더해지는 무작위 비율 상한, [0, 1) (기본 0.1)</li>
 *   <li>attemptTimeout: 시도 1회의 최대 실행 시간, 0이면 제한 없음 (기본 0)</li>
 * </ul>
 *
 * <p><strong>예시 (기본값):</strong> 1차 실패 후 1.0~1.1초, 2차 실패 후 2.0~2.2초 대기, 3차 실패 시 종료</p>
 *
 * @author Relay Team
 * @since 1.0.0
 * @param maxAttempts 최대 시도 횟수 (1 이상)
 * @param baseDelay 기본 지연 (양수)
 * @param maxDelay 최대 지연 (baseDelay 이상)
 * @param backoffMultiplier 백오프 배수 (1.0 이상)
 * @param jitterFraction jitter 비율 (0.0 이상 1.0 미만)
 * @param attemptTimeout 시도당 타임아웃 (0 = 제한 없음, 그 외 1ms 이상)
 */
public record RetryConfig(
    int maxAttempts,
    Duration baseDelay,
    Duration maxDelay,
    double backoffMultiplier,
    double jitterFraction,
    Duration attemptTimeout
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: maxAttempts=3, baseDelay=1s, maxDelay=60s, backoffMultiplier=2.0, jitterFraction=0.1,
     * attemptTimeout=0 (제한 없음)</p>
     */
    public RetryConfig() {
        this(3, Duration.ofSeconds(1), Duration.ofSeconds(60), 2.0, 0.1);
    }

    /**
     * 시도당 타임아웃 없는 설정 생성자.
     */
    public RetryConfig(int maxAttempts, Duration baseDelay, Duration maxDelay,
                       double backoffMultiplier, double jitterFraction) {
        this(maxAttempts, baseDelay, maxDelay, backoffMultiplier, jitterFraction, Duration.ZERO);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws ConfigurationException 파라미터 검증 실패 시
     */
    public RetryConfig {
        if (maxAttempts < 1) {
            throw new ConfigurationException(
                "maxAttempts must be >= 1 (current: " + maxAttempts + ")"
            );
        }
        if (baseDelay == null || baseDelay.isZero() || baseDelay.isNegative()) {
            throw new ConfigurationException(
                "baseDelay must be positive (current: " + baseDelay + ")"
            );
        }
        if (maxDelay == null || maxDelay.compareTo(baseDelay) < 0) {
            throw new ConfigurationException(
                "maxDelay must be >= baseDelay (base: " + baseDelay + ", max: " + maxDelay + ")"
            );
        }
        if (Double.isNaN(backoffMultiplier) || backoffMultiplier < 1.0) {
            throw new ConfigurationException(
                "backoffMultiplier must be >= 1.0 (current: " + backoffMultiplier + ")"
            );
        }
        if (Double.isNaN(jitterFraction) || jitterFraction < 0.0 || jitterFraction >= 1.0) {
            throw new ConfigurationException(
                "jitterFraction must be in [0.0, 1.0) (current: " + jitterFraction + ")"
            );
        }
        if (attemptTimeout == null || attemptTimeout.isNegative()
            || (!attemptTimeout.isZero() && attemptTimeout.toMillis() < 1)) {
            throw new ConfigurationException(
                "attemptTimeout must be 0 or >= 1ms (current: " + attemptTimeout + ")"
            );
        }
    }

    /**
     * 시도당 타임아웃 적용 여부.
     *
     * @return attemptTimeout이 0보다 크면 true
     */
    public boolean hasAttemptTimeout() {
        return !attemptTimeout.isZero();
    }

    /**
     * 재시도 없이 한 번만 시도하는 설정.
     *
     * @return maxAttempts=1 설정
     */
    public static RetryConfig noRetry() {
        return new RetryConfig().withMaxAttempts(1);
    }

    public RetryConfig withMaxAttempts(int maxAttempts) {
        return new RetryConfig(maxAttempts, baseDelay, maxDelay, backoffMultiplier, jitterFraction, attemptTimeout);
    }

    public RetryConfig withBaseDelay(Duration baseDelay) {
        return new RetryConfig(maxAttempts, baseDelay, maxDelay, backoffMultiplier, jitterFraction, attemptTimeout);
    }

    public RetryConfig withMaxDelay(Duration maxDelay) {
        return new RetryConfig(maxAttempts, baseDelay, maxDelay, backoffMultiplier, jitterFraction, attemptTimeout);
    }

    public RetryConfig withBackoffMultiplier(double backoffMultiplier) {
        return new RetryConfig(maxAttempts, baseDelay, maxDelay, backoffMultiplier, jitterFraction, attemptTimeout);
    }

    public RetryConfig withJitterFraction(double jitterFraction) {
        return new RetryConfig(maxAttempts, baseDelay, maxDelay, backoffMultiplier, jitterFraction, attemptTimeout);
    }

    public RetryConfig withAttemptTimeout(Duration attemptTimeout) {
        return new RetryConfig(maxAttempts, baseDelay, maxDelay, backoffMultiplier, jitterFraction, attemptTimeout);
    }
}
