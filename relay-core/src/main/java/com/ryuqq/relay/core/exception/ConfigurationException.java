package com.ryuqq.relay.core.exception;

/**
 * 설정 오류.
 *
 * <p>요청한 Capability에 등록된 Provider가 없거나, 재시도/차단기 설정 값이 잘못된 경우 발생합니다.
 * 해당 호출에 대해 치명적이며 재시도하지 않습니다.</p>
 *
 * @author Relay Team
 * @since 1.0.0
 */
public class ConfigurationException extends RelayException {

    public static final String ERROR_CODE = "RELAY-CONFIG";

    public ConfigurationException(String message) {
        this(ERROR_CODE, message, null);
    }

    public ConfigurationException(String message, Throwable cause) {
        this(ERROR_CODE, message, cause);
    }

    protected ConfigurationException(String errorCode, String message, Throwable cause) {
        super(errorCode, FailureCategory.CONFIGURATION, message, cause);
    }
}
