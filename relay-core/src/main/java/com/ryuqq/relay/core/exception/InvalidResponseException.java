package com.ryuqq.relay.core.exception;

import com.ryuqq.relay.core.model.ProviderName;

/**
 * 응답 유효성 검증 실패.
 *
 * <p>Provider가 예외 없이 응답했지만 호출자가 제공한 검증기가 거부한 경우(빈 데이터, 잘못된 페이로드)입니다.
 * 영구 실패로 취급되어 재시도하지 않으며 Circuit Breaker 실패로 집계됩니다.</p>
 *
 * @author Relay Team
 * @since 1.0.0
 */
public class InvalidResponseException extends PermanentProviderException {

    public static final String ERROR_CODE = "RELAY-INVALID-RESPONSE";

    public InvalidResponseException(ProviderName providerName) {
        super(ERROR_CODE, providerName, "Provider " + providerName + " returned a response rejected by the validator", null, null);
    }
}
