package com.ryuqq.relay.core.exception;

import com.ryuqq.relay.core.model.ProviderName;

/**
 * 영구적 Provider 오류 (재시도 불가).
 *
 * <p><strong>예시:</strong></p>
 * <ul>
 *   <li>인증 실패 (401, 403)</li>
 *   <li>잘못된 요청 (400)</li>
 *   <li>지원하지 않는 입력</li>
 * </ul>
 *
 * <p>재시도하지 않고 즉시 다음 Provider로 넘어가지만, Circuit Breaker 실패로는 집계됩니다.</p>
 *
 * @author Relay Team
 * @since 1.0.0
 */
public class PermanentProviderException extends ProviderException {

    public static final String ERROR_CODE = "RELAY-PERMANENT";

    private final Integer statusCode;

    public PermanentProviderException(String message) {
        this(null, message, null, null);
    }

    public PermanentProviderException(String message, Throwable cause) {
        this(null, message, null, cause);
    }

    public PermanentProviderException(ProviderName providerName, String message, Integer statusCode, Throwable cause) {
        this(ERROR_CODE, providerName, message, statusCode, cause);
    }

    protected PermanentProviderException(String errorCode, ProviderName providerName, String message,
                                         Integer statusCode, Throwable cause) {
        super(errorCode, FailureCategory.PERMANENT, providerName, message, cause);
        this.statusCode = statusCode;
    }

    public Integer getStatusCode() {
        return statusCode;
    }
}
