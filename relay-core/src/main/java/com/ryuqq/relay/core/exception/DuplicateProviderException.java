package com.ryuqq.relay.core.exception;

import com.ryuqq.relay.core.model.Capability;
import com.ryuqq.relay.core.model.ProviderName;

/**
 * 동일한 (Capability, Provider) 쌍의 중복 등록.
 *
 * @author Relay Team
 * @since 1.0.0
 */
public class DuplicateProviderException extends ConfigurationException {

    public static final String ERROR_CODE = "RELAY-CONFIG-DUPLICATE";

    private final Capability<?, ?> capability;
    private final ProviderName providerName;

    public DuplicateProviderException(Capability<?, ?> capability, ProviderName providerName) {
        super(ERROR_CODE, "Provider " + providerName + " is already registered for capability " + capability, null);
        this.capability = capability;
        this.providerName = providerName;
    }

    public Capability<?, ?> getCapability() {
        return capability;
    }

    public ProviderName getProviderName() {
        return providerName;
    }
}
