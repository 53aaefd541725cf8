package com.ryuqq.relay.core.protection;

import com.ryuqq.relay.core.model.ProviderName;

/**
 * Circuit Breaker 생성 팩토리.
 *
 * <p>Registry가 Provider 이름을 처음 등록할 때 한 번 호출합니다.</p>
 *
 * @author Relay Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface CircuitBreakerFactory {

    /**
     * Provider 전용 Circuit Breaker 생성.
     *
     * @param providerName Provider 이름
     * @param config Capability 설정에서 가져온 Circuit Breaker 설정
     * @return 새 Circuit Breaker
     */
    CircuitBreaker create(ProviderName providerName, CircuitBreakerConfig config);
}
