package com.ryuqq.relay.core.health;

import com.ryuqq.relay.core.model.Capability;
import com.ryuqq.relay.core.model.ProviderName;

import java.time.Instant;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * 전체 Provider 헬스 스냅샷 (불변).
 *
 * <p>폴링 1회의 결과이며, 다음 폴링 결과로 대체됩니다.</p>
 *
 * <p><strong>전체 상태 판정:</strong></p>
 * <ul>
 *   <li>사용 가능한 Provider(HEALTHY, HALF_OPEN)가 없는 Capability가 있으면 UNHEALTHY</li>
 *   <li>HEALTHY가 아닌 Provider가 하나라도 있으면 DEGRADED</li>
 *   <li>그 외 HEALTHY</li>
 * </ul>
 *
 * @param takenAt 스냅샷 생성 시각
 * @param providers Provider별 헬스 (등록 순서 유지)
 * @param unavailableCapabilities 사용 가능한 Provider가 없는 Capability
 * @param overall 전체 상태
 *
 * @author Relay Team
 * @since 1.0.0
 */
public record HealthSnapshot(
    Instant takenAt,
    Map<ProviderName, ProviderHealth> providers,
    Set<Capability<?, ?>> unavailableCapabilities,
    HealthStatus overall
) {

    public HealthSnapshot {
        if (takenAt == null) {
            throw new IllegalArgumentException("takenAt cannot be null");
        }
        if (providers == null) {
            throw new IllegalArgumentException("providers cannot be null");
        }
        if (unavailableCapabilities == null) {
            throw new IllegalArgumentException("unavailableCapabilities cannot be null");
        }
        if (overall == null) {
            throw new IllegalArgumentException("overall cannot be null");
        }
        providers = Collections.unmodifiableMap(new LinkedHashMap<>(providers));
        unavailableCapabilities = Collections.unmodifiableSet(new LinkedHashSet<>(unavailableCapabilities));
    }

    /**
     * Provider 헬스 목록으로 스냅샷 생성 (전체 상태 계산 포함).
     *
     * @param takenAt 스냅샷 생성 시각
     * @param healths Provider 헬스 목록
     * @return 스냅샷
     */
    public static HealthSnapshot of(Instant takenAt, Collection<ProviderHealth> healths) {
        if (healths == null) {
            throw new IllegalArgumentException("healths cannot be null");
        }

        Map<ProviderName, ProviderHealth> providers = new LinkedHashMap<>();
        Set<Capability<?, ?>> allCapabilities = new LinkedHashSet<>();
        Set<Capability<?, ?>> usableCapabilities = new LinkedHashSet<>();
        boolean allHealthy = true;

        for (ProviderHealth health : healths) {
            providers.put(health.providerName(), health);
            allCapabilities.addAll(health.capabilities());
            if (health.status().isUsable()) {
                usableCapabilities.addAll(health.capabilities());
            }
            if (health.status() != ProviderStatus.HEALTHY) {
                allHealthy = false;
            }
        }

        Set<Capability<?, ?>> unavailable = new LinkedHashSet<>(allCapabilities);
        unavailable.removeAll(usableCapabilities);

        HealthStatus overall;
        if (!unavailable.isEmpty()) {
            overall = HealthStatus.UNHEALTHY;
        } else if (!allHealthy) {
            overall = HealthStatus.DEGRADED;
        } else {
            overall = HealthStatus.HEALTHY;
        }
        return new HealthSnapshot(takenAt, providers, unavailable, overall);
    }

    /**
     * Readiness 판정.
     *
     * @return UNHEALTHY가 아니면 true
     */
    public boolean isReady() {
        return overall != HealthStatus.UNHEALTHY;
    }

    /**
     * Provider 헬스 조회.
     *
     * @param name Provider 이름
     * @return Provider 헬스 (없으면 empty)
     */
    public Optional<ProviderHealth> provider(ProviderName name) {
        return Optional.ofNullable(providers.get(name));
    }
}
