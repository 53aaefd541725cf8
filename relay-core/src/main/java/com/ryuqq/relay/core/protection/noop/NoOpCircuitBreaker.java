package com.ryuqq.relay.core.protection.noop;

import com.ryuqq.relay.core.model.ProviderName;
import com.ryuqq.relay.core.protection.CircuitBreaker;
import com.ryuqq.relay.core.protection.CircuitBreakerMetrics;
import com.ryuqq.relay.core.protection.CircuitBreakerPermit;
import com.ryuqq.relay.core.protection.CircuitBreakerState;

import java.util.Optional;

/**
 * Circuit Breaker NoOp 구현.
 *
 * <p>모든 요청을 항상 허용하며, 상태 추적을 하지 않습니다.
 * 테스트 환경이나 보호 없이 호출할 Provider에 사용합니다.</p>
 *
 * <p><strong>동작 방식:</strong></p>
 * <ul>
 *   <li>tryAcquire(): 항상 추적하지 않는 permit 반환</li>
 *   <li>recordSuccess() / recordFailure() / releasePermit(): 아무 동작 안 함</li>
 *   <li>getState(): 항상 CLOSED 반환</li>
 *   <li>reset(): 아무 동작 안 함</li>
 * </ul>
 *
 * @author Relay Team
 * @since 1.0.0
 */
public final class NoOpCircuitBreaker implements CircuitBreaker {

    private final ProviderName providerName;

    public NoOpCircuitBreaker(ProviderName providerName) {
        if (providerName == null) {
            throw new IllegalArgumentException("providerName cannot be null");
        }
        this.providerName = providerName;
    }

    @Override
    public ProviderName providerName() {
        return providerName;
    }

    @Override
    public Optional<CircuitBreakerPermit> tryAcquire() {
        return Optional.of(CircuitBreakerPermit.untracked(providerName));
    }

    @Override
    public void recordSuccess(CircuitBreakerPermit permit) {
        // NoOp
    }

    @Override
    public void recordFailure(CircuitBreakerPermit permit, Throwable throwable) {
        // NoOp
    }

    @Override
    public void releasePermit(CircuitBreakerPermit permit) {
        // NoOp
    }

    @Override
    public CircuitBreakerState getState() {
        return CircuitBreakerState.CLOSED;
    }

    @Override
    public CircuitBreakerMetrics metrics() {
        return CircuitBreakerMetrics.closed(providerName);
    }

    @Override
    public void reset() {
        // NoOp
    }
}
