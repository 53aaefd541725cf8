package com.ryuqq.relay.core.health;

import com.ryuqq.relay.core.model.Capability;
import com.ryuqq.relay.core.model.ProviderName;
import com.ryuqq.relay.core.protection.CircuitBreakerState;

import java.time.Instant;
import java.util.Set;

/**
 * Provider 하나의 헬스 정보 (불변 record).
 *
 * @param providerName Provider 이름
 * @param capabilities Provider가 제공하는 Capability 목록
 * @param circuitState Circuit Breaker 상태
 * @param status 헬스 분류
 * @param consecutiveFailures 연속 실패 횟수
 * @param lastFailureTime 마지막 실패 시각 (nullable)
 * @param probeResult Liveness Probe 결과
 * @param lastChecked 조회 시각
 *
 * @author Relay Team
 * @since 1.0.0
 */
public record ProviderHealth(
    ProviderName providerName,
    Set<Capability<?, ?>> capabilities,
    CircuitBreakerState circuitState,
    ProviderStatus status,
    int consecutiveFailures,
    Instant lastFailureTime,
    ProbeResult probeResult,
    Instant lastChecked
) {

    public ProviderHealth {
        if (providerName == null) {
            throw new IllegalArgumentException("providerName cannot be null");
        }
        if (capabilities == null || capabilities.isEmpty()) {
            throw new IllegalArgumentException("capabilities cannot be null or empty");
        }
        if (circuitState == null) {
            throw new IllegalArgumentException("circuitState cannot be null");
        }
        if (status == null) {
            throw new IllegalArgumentException("status cannot be null");
        }
        if (probeResult == null) {
            throw new IllegalArgumentException("probeResult cannot be null");
        }
        if (lastChecked == null) {
            throw new IllegalArgumentException("lastChecked cannot be null");
        }
        capabilities = Set.copyOf(capabilities);
    }
}
