package com.ryuqq.relay.core.config;

import com.ryuqq.relay.core.exception.ConfigurationException;

import java.time.Duration;

/**
 * HealthAggregator 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>pollInterval: 폴링 간격 (기본 30초)</li>
 *   <li>openGracePeriod: OPEN 상태를 DEGRADED로 분류하기 전 유예 기간 (기본 5분)</li>
 *   <li>probeEnabled: Liveness Probe 실행 여부 (기본 true)</li>
 *   <li>probeTimeout: Probe 1회의 최대 실행 시간, 초과 시 실패로 기록 (기본 5초)</li>
 * </ul>
 *
 * @author Relay Team
 * @since 1.0.0
 * @param pollInterval 폴링 간격 (1ms 이상)
 * @param openGracePeriod OPEN 유예 기간 (0 이상)
 * @param probeEnabled Probe 실행 여부
 * @param probeTimeout Probe 타임아웃 (1ms 이상)
 */
public record HealthSettings(
    Duration pollInterval,
    Duration openGracePeriod,
    boolean probeEnabled,
    Duration probeTimeout
) {

    private static final Duration DEFAULT_PROBE_TIMEOUT = Duration.ofSeconds(5);

    public HealthSettings() {
        this(Duration.ofSeconds(30), Duration.ofMinutes(5), true);
    }

    public HealthSettings(Duration pollInterval, Duration openGracePeriod, boolean probeEnabled) {
        this(pollInterval, openGracePeriod, probeEnabled, DEFAULT_PROBE_TIMEOUT);
    }

    public HealthSettings {
        // 스케줄러는 밀리초 단위로 동작
        if (pollInterval == null || pollInterval.toMillis() < 1) {
            throw new ConfigurationException(
                "pollInterval must be >= 1ms (current: " + pollInterval + ")"
            );
        }
        if (openGracePeriod == null || openGracePeriod.isNegative()) {
            throw new ConfigurationException(
                "openGracePeriod must be non-negative (current: " + openGracePeriod + ")"
            );
        }
        if (probeTimeout == null || probeTimeout.toMillis() < 1) {
            throw new ConfigurationException(
                "probeTimeout must be >= 1ms (current: " + probeTimeout + ")"
            );
        }
    }

    public HealthSettings withPollInterval(Duration pollInterval) {
        return new HealthSettings(pollInterval, openGracePeriod, probeEnabled, probeTimeout);
    }

    public HealthSettings withOpenGracePeriod(Duration openGracePeriod) {
        return new HealthSettings(pollInterval, openGracePeriod, probeEnabled, probeTimeout);
    }

    public HealthSettings withProbeEnabled(boolean probeEnabled) {
        return new HealthSettings(pollInterval, openGracePeriod, probeEnabled, probeTimeout);
    }

    public HealthSettings withProbeTimeout(Duration probeTimeout) {
        return new HealthSettings(pollInterval, openGracePeriod, probeEnabled, probeTimeout);
    }
}
