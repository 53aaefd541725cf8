package com.ryuqq.relay.core.outcome;

import com.ryuqq.relay.core.model.Capability;
import com.ryuqq.relay.core.model.ProviderName;

import java.time.Duration;

/**
 * 단일 Provider 시도 기록 (로깅/텔레메트리 전용, Relay가 보관하지 않음).
 *
 * @param capability 호출한 Capability
 * @param providerName Provider 이름
 * @param attemptIndex 시도 인덱스 (0부터 시작)
 * @param result 시도 결과
 * @param elapsed 소요 시간
 *
 * @author Relay Team
 * @since 1.0.0
 */
public record InvocationAttempt(
    Capability<?, ?> capability,
    ProviderName providerName,
    int attemptIndex,
    AttemptResult result,
    Duration elapsed
) {

    public InvocationAttempt {
        if (capability == null) {
            throw new IllegalArgumentException("capability cannot be null");
        }
        if (providerName == null) {
            throw new IllegalArgumentException("providerName cannot be null");
        }
        if (attemptIndex < 0) {
            throw new IllegalArgumentException("attemptIndex must be non-negative (current: " + attemptIndex + ")");
        }
        if (result == null) {
            throw new IllegalArgumentException("result cannot be null");
        }
        if (elapsed == null || elapsed.isNegative()) {
            throw new IllegalArgumentException("elapsed cannot be null or negative");
        }
    }
}
