package com.ryuqq.relay.core.exception;

/**
 * Fallback 체인 내 개별 Provider 실패 사유.
 *
 * @author Relay Team
 * @since 1.0.0
 */
public enum FailureReason {

    /** Circuit Breaker OPEN으로 호출 생략. */
    CIRCUIT_OPEN,

    /** 일시적 오류가 재시도 예산을 모두 소진. */
    RETRIES_EXHAUSTED,

    /** 영구적 오류로 재시도 없이 중단. */
    PERMANENT_ERROR,

    /** 응답이 검증기에 의해 거부됨. */
    INVALID_RESPONSE
}
