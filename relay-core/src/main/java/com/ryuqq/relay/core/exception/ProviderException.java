package com.ryuqq.relay.core.exception;

import com.ryuqq.relay.core.model.ProviderName;

/**
 * 단일 Provider 호출 실패의 공통 상위 타입.
 *
 * <p>연동 코드(벤더별 HTTP/SDK 호출)는 {@link TransientProviderException} 또는
 * {@link PermanentProviderException}을 던져 재시도 가능 여부를 명시할 수 있습니다.
 * Provider 이름은 연동 코드가 모를 수 있으므로 null을 허용합니다.</p>
 *
 * @author Relay Team
 * @since 1.0.0
 */
public abstract class ProviderException extends RelayException {

    private final ProviderName providerName;

    protected ProviderException(String errorCode, FailureCategory category, ProviderName providerName,
                                String message, Throwable cause) {
        super(errorCode, category, message, cause);
        this.providerName = providerName;
    }

    /**
     * 실패한 Provider 이름.
     *
     * @return Provider 이름 (알 수 없는 경우 null)
     */
    public ProviderName getProviderName() {
        return providerName;
    }
}
