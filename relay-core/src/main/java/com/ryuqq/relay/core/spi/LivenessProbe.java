package com.ryuqq.relay.core.spi;

/**
 * 경량 생존 확인 SPI.
 *
 * <p>HealthAggregator가 주기적으로 호출합니다. 요청 경로에는 참여하지 않으며,
 * 결과는 Circuit Breaker 상태에 반영되지 않습니다.</p>
 *
 * @author Relay Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface LivenessProbe {

    /**
     * 생존 확인.
     *
     * @return 응답 가능하면 true
     * @throws Exception 확인 실패 시 (false와 동일하게 취급)
     */
    boolean isAlive() throws Exception;
}
