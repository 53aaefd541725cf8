package com.ryuqq.relay.core.exception;

import com.ryuqq.relay.core.model.ProviderName;

/**
 * 등록되지 않은 Provider 조회.
 *
 * @author Relay Team
 * @since 1.0.0
 */
public class ProviderNotFoundException extends RelayException {

    public static final String ERROR_CODE = "RELAY-NOT-FOUND";

    private final ProviderName providerName;

    public ProviderNotFoundException(ProviderName providerName) {
        super(ERROR_CODE, FailureCategory.CONFIGURATION, "Provider not found: " + providerName, null);
        this.providerName = providerName;
    }

    public ProviderName getProviderName() {
        return providerName;
    }
}
