package com.ryuqq.relay.core.exception;

/**
 * 실패 분류.
 *
 * <p>각 분류는 호출자가 최종 사용자에게 노출할 수 있는 조치 안내 문구를 함께 제공합니다.
 * 메시지 현지화는 호출자의 책임입니다.</p>
 *
 * @author Relay Team
 * @since 1.0.0
 */
public enum FailureCategory {

    /**
     * 설정 오류 (Provider 미등록, 잘못된 재시도/차단기 설정).
     */
    CONFIGURATION("Check the provider registration and retry/breaker configuration"),

    /**
     * 일시적 Provider 오류 (타임아웃, 연결 실패, Rate Limit).
     */
    TRANSIENT("The provider is temporarily unavailable, retry later"),

    /**
     * 영구적 Provider 오류 (인증 실패, 잘못된 요청, 지원하지 않는 입력).
     */
    PERMANENT("Check API credentials and request parameters"),

    /**
     * Circuit Breaker OPEN으로 호출 생략.
     */
    CIRCUIT_OPEN("Service temporarily degraded, the provider is being isolated after repeated failures"),

    /**
     * Fallback 체인 전체 실패.
     */
    EXHAUSTED("All providers failed, consider returning a cached or placeholder result"),

    /**
     * 호출자에 의한 취소.
     */
    CANCELLED("The invocation was cancelled by the caller");

    private final String guidance;

    FailureCategory(String guidance) {
        this.guidance = guidance;
    }

    /**
     * 조치 안내 문구 조회.
     *
     * @return 안내 문구 (영문)
     */
    public String guidance() {
        return guidance;
    }

    /**
     * 재시도로 해결될 가능성이 있는 분류인지 확인.
     *
     * @return TRANSIENT인 경우 true
     */
    public boolean isRetryable() {
        return this == TRANSIENT;
    }
}
