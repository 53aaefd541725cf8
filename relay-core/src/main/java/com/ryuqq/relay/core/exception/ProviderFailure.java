package com.ryuqq.relay.core.exception;

import com.ryuqq.relay.core.model.ProviderName;

/**
 * Fallback 체인에서 기록된 Provider별 실패.
 *
 * @param providerName 실패한 Provider
 * @param reason 실패 사유
 * @param error 마지막 오류
 * @param attempts Provider 호출 횟수 (OPEN으로 생략된 경우 0)
 *
 * @author Relay Team
 * @since 1.0.0
 */
public record ProviderFailure(
    ProviderName providerName,
    FailureReason reason,
    ProviderException error,
    int attempts
) {

    public ProviderFailure {
        if (providerName == null) {
            throw new IllegalArgumentException("providerName cannot be null");
        }
        if (reason == null) {
            throw new IllegalArgumentException("reason cannot be null");
        }
        if (error == null) {
            throw new IllegalArgumentException("error cannot be null");
        }
        if (attempts < 0) {
            throw new IllegalArgumentException("attempts must be non-negative (current: " + attempts + ")");
        }
    }

    /**
     * 진단용 한 줄 요약.
     *
     * @return "provider: REASON after n attempt(s) - message"
     */
    public String describe() {
        return providerName + ": " + reason + " after " + attempts + " attempt(s) - " + error.getMessage();
    }
}
