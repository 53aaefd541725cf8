package com.ryuqq.relay.core.exception;

import com.ryuqq.relay.core.model.ProviderName;

/**
 * 일시적 Provider 오류 (재시도 대상).
 *
 * <p><strong>예시:</strong></p>
 * <ul>
 *   <li>네트워크 타임아웃, 연결 실패</li>
 *   <li>Rate Limit 초과 (429 Too Many Requests)</li>
 *   <li>서버 일시 장애 (500, 502, 503)</li>
 * </ul>
 *
 * <p>재시도되며, 재시도 소진 시 Circuit Breaker 실패로 집계됩니다.</p>
 *
 * @author Relay Team
 * @since 1.0.0
 */
public class TransientProviderException extends ProviderException {

    public static final String ERROR_CODE = "RELAY-TRANSIENT";

    private final Integer statusCode;

    public TransientProviderException(String message) {
        this(null, message, null, null);
    }

    public TransientProviderException(String message, Throwable cause) {
        this(null, message, null, cause);
    }

    /**
     * @param providerName Provider 이름 (null 허용)
     * @param message 오류 메시지
     * @param statusCode 벤더 응답 상태 코드 (null 허용)
     * @param cause 원인 (null 허용)
     */
    public TransientProviderException(ProviderName providerName, String message, Integer statusCode, Throwable cause) {
        super(ERROR_CODE, FailureCategory.TRANSIENT, providerName, message, cause);
        this.statusCode = statusCode;
    }

    /**
     * 벤더 응답 상태 코드.
     *
     * @return 상태 코드 (없으면 null)
     */
    public Integer getStatusCode() {
        return statusCode;
    }
}
