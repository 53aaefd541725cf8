package com.ryuqq.relay.core.config;

import com.ryuqq.relay.core.protection.CircuitBreakerConfig;
import com.ryuqq.relay.core.retry.RetryConfig;

/**
 * Capability 단위 보호 설정 (불변 record).
 *
 * @author Relay Team
 * @since 1.0.0
 * @param retry 재시도 설정
 * @param breaker Circuit Breaker 설정
 */
public record CapabilitySettings(
    RetryConfig retry,
    CircuitBreakerConfig breaker
) {

    public CapabilitySettings() {
        this(new RetryConfig(), new CircuitBreakerConfig());
    }

    public CapabilitySettings {
        if (retry == null) {
            throw new IllegalArgumentException("retry cannot be null");
        }
        if (breaker == null) {
            throw new IllegalArgumentException("breaker cannot be null");
        }
    }

    public CapabilitySettings withRetry(RetryConfig retry) {
        return new CapabilitySettings(retry, breaker);
    }

    public CapabilitySettings withBreaker(CircuitBreakerConfig breaker) {
        return new CapabilitySettings(retry, breaker);
    }
}
