package com.ryuqq.relay.core.protection;

import com.ryuqq.relay.core.model.ProviderName;

/**
 * Circuit Breaker가 허용한 호출 1건의 통과 증표.
 *
 * <p>{@link CircuitBreaker#tryAcquire()}가 발급하며, 호출이 끝나면 같은 permit으로
 * {@link CircuitBreaker#recordSuccess(CircuitBreakerPermit)},
 * {@link CircuitBreaker#recordFailure(CircuitBreakerPermit, Throwable)},
 * {@link CircuitBreaker#releasePermit(CircuitBreakerPermit)} 중 하나를 정확히 한 번 호출합니다.</p>
 *
 * <p>HALF_OPEN 상태에서는 시험 호출 permit의 결과만 상태를 전이시킵니다.
 * 그보다 먼저 발급된 permit의 결과는 늦게 도착한 결과로 취급됩니다.</p>
 *
 * @param providerName 발급한 Circuit Breaker의 Provider 이름
 * @param sequence Circuit Breaker 내에서 단조 증가하는 발급 번호
 * @param trial HALF_OPEN 시험 호출 permit 여부
 *
 * @author Relay Team
 * @since 1.0.0
 */
public record CircuitBreakerPermit(
    ProviderName providerName,
    long sequence,
    boolean trial
) {

    public CircuitBreakerPermit {
        if (providerName == null) {
            throw new IllegalArgumentException("providerName cannot be null");
        }
        if (sequence < 0) {
            throw new IllegalArgumentException("sequence must be non-negative (current: " + sequence + ")");
        }
    }

    /**
     * 상태를 추적하지 않는 Circuit Breaker용 permit.
     *
     * @param providerName Provider 이름
     * @return 시험 호출이 아닌 permit (sequence 0)
     */
    public static CircuitBreakerPermit untracked(ProviderName providerName) {
        return new CircuitBreakerPermit(providerName, 0L, false);
    }
}
