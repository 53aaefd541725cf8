package com.ryuqq.relay.core.config;

import com.ryuqq.relay.core.model.Capability;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Relay 전체 설정 (불변 record).
 *
 * <p>시작 시 한 번 구성되어 Registry 생성자에 주입됩니다.
 * Capability별 설정이 없으면 기본 설정({@code defaults})을 사용합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * RelaySettings settings = new RelaySettings()
 *     .withCapability("llm.quick", new CapabilitySettings()
 *         .withRetry(new RetryConfig().withMaxAttempts(2))
 *         .withBreaker(new CircuitBreakerConfig().withFailureThreshold(2)));
 * }</pre>
 *
 * @author Relay Team
 * @since 1.0.0
 * @param defaults 기본 Capability 설정
 * @param capabilities Capability 이름별 설정
 * @param health HealthAggregator 설정
 */
public record RelaySettings(
    CapabilitySettings defaults,
    Map<String, CapabilitySettings> capabilities,
    HealthSettings health
) {

    public RelaySettings() {
        this(new CapabilitySettings(), Map.of(), new HealthSettings());
    }

    public RelaySettings {
        if (defaults == null) {
            throw new IllegalArgumentException("defaults cannot be null");
        }
        if (capabilities == null) {
            throw new IllegalArgumentException("capabilities cannot be null");
        }
        if (health == null) {
            throw new IllegalArgumentException("health cannot be null");
        }
        capabilities = Map.copyOf(capabilities);
    }

    /**
     * Capability에 적용할 설정 조회.
     *
     * @param capability Capability
     * @return Capability 전용 설정, 없으면 기본 설정
     */
    public CapabilitySettings settingsFor(Capability<?, ?> capability) {
        if (capability == null) {
            throw new IllegalArgumentException("capability cannot be null");
        }
        return capabilities.getOrDefault(capability.getName(), defaults);
    }

    public RelaySettings withDefaults(CapabilitySettings defaults) {
        return new RelaySettings(defaults, capabilities, health);
    }

    public RelaySettings withCapability(String capabilityName, CapabilitySettings settings) {
        if (capabilityName == null || capabilityName.isBlank()) {
            throw new IllegalArgumentException("capabilityName cannot be null or blank");
        }
        Map<String, CapabilitySettings> updated = new LinkedHashMap<>(capabilities);
        updated.put(capabilityName, settings);
        return new RelaySettings(defaults, updated, health);
    }

    public RelaySettings withHealth(HealthSettings health) {
        return new RelaySettings(defaults, capabilities, health);
    }
}
