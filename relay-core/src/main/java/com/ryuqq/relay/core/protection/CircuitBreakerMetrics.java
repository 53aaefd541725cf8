package com.ryuqq.relay.core.protection;

import com.ryuqq.relay.core.model.ProviderName;

import java.time.Instant;

/**
 * Circuit Breaker 상태 스냅샷.
 *
 * <p><strong>불변식:</strong> {@code state == OPEN}이면 {@code lastFailureTime}과 {@code openedSince}는 null이 아닙니다.</p>
 *
 * @param providerName Provider 이름
 * @param state 현재 상태
 * @param consecutiveFailures 연속 실패 횟수
 * @param lastFailureTime 마지막 실패 시각 (없으면 null)
 * @param openedSince CLOSED를 벗어난 시각, HALF_OPEN → OPEN 재전이 시에도 유지 (CLOSED이면 null)
 *
 * @author Relay Team
 * @since 1.0.0
 */
public record CircuitBreakerMetrics(
    ProviderName providerName,
    CircuitBreakerState state,
    int consecutiveFailures,
    Instant lastFailureTime,
    Instant openedSince
) {

    public CircuitBreakerMetrics {
        if (providerName == null) {
            throw new IllegalArgumentException("providerName cannot be null");
        }
        if (state == null) {
            throw new IllegalArgumentException("state cannot be null");
        }
        if (consecutiveFailures < 0) {
            throw new IllegalArgumentException("consecutiveFailures must be non-negative (current: " + consecutiveFailures + ")");
        }
        if (state == CircuitBreakerState.OPEN && (lastFailureTime == null || openedSince == null)) {
            throw new IllegalArgumentException("OPEN state requires lastFailureTime and openedSince");
        }
    }

    /**
     * CLOSED 초기 상태 스냅샷.
     *
     * @param providerName Provider 이름
     * @return 실패 이력이 없는 CLOSED 스냅샷
     */
    public static CircuitBreakerMetrics closed(ProviderName providerName) {
        return new CircuitBreakerMetrics(providerName, CircuitBreakerState.CLOSED, 0, null, null);
    }
}
