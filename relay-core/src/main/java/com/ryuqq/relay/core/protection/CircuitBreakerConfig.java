package com.ryuqq.relay.core.protection;

import com.ryuqq.relay.core.exception.ConfigurationException;

import java.time.Duration;

/**
 * Circuit Breaker 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>failureThreshold: OPEN으로 전이하는 연속 실패 횟수 (기본 5)</li>
 *   <li>openTimeout: OPEN 유지 시간, 경과 후 HALF_OPEN 시험 호출 허용 (기본 60초)</li>
 * </ul>
 *
 * @author Relay Team
 * @since 1.0.0
 * @param failureThreshold 연속 실패 임계값 (1 이상)
 * @param openTimeout OPEN 유지 시간 (양수)
 */
public record CircuitBreakerConfig(
    int failureThreshold,
    Duration openTimeout
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: failureThreshold=5, openTimeout=60s</p>
     */
    public CircuitBreakerConfig() {
        this(5, Duration.ofSeconds(60));
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws ConfigurationException 파라미터 검증 실패 시
     */
    public CircuitBreakerConfig {
        if (failureThreshold < 1) {
            throw new ConfigurationException(
                "failureThreshold must be >= 1 (current: " + failureThreshold + ")"
            );
        }
        if (openTimeout == null || openTimeout.isZero() || openTimeout.isNegative()) {
            throw new ConfigurationException(
                "openTimeout must be positive (current: " + openTimeout + ")"
            );
        }
    }

    public CircuitBreakerConfig withFailureThreshold(int failureThreshold) {
        return new CircuitBreakerConfig(failureThreshold, openTimeout);
    }

    public CircuitBreakerConfig withOpenTimeout(Duration openTimeout) {
        return new CircuitBreakerConfig(failureThreshold, openTimeout);
    }
}
