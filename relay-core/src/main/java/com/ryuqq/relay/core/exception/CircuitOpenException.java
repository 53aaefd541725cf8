package com.ryuqq.relay.core.exception;

import com.ryuqq.relay.core.model.ProviderName;

/**
 * Circuit Breaker OPEN 상태로 인한 호출 거부.
 *
 * <p>Provider와 통신하지 않고 즉시 발생합니다. Fallback 체인에서는 실패로 집계되지만,
 * Circuit Breaker의 새로운 실패로는 집계되지 않습니다.</p>
 *
 * @author Relay Team
 * @since 1.0.0
 */
public class CircuitOpenException extends ProviderException {

    public static final String ERROR_CODE = "RELAY-CIRCUIT-OPEN";

    public CircuitOpenException(ProviderName providerName) {
        super(ERROR_CODE, FailureCategory.CIRCUIT_OPEN, providerName, "Circuit breaker is OPEN for " + providerName, null);
    }
}
