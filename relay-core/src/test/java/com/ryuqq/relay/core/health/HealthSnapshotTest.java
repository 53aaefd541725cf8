package com.ryuqq.relay.core.health;

import com.ryuqq.relay.core.model.Capability;
import com.ryuqq.relay.core.model.ProviderName;
import com.ryuqq.relay.core.protection.CircuitBreakerState;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * HealthSnapshot 전체 상태 판정 테스트.
 *
 * @author Relay Team
 * @since 1.0.0
 */
class HealthSnapshotTest {

    private static final Instant NOW = Instant.parse("2025-01-01T00:00:00Z");
    private static final Capability<String, String> QUICK = Capability.of("llm.quick");
    private static final Capability<String, String> QUOTE = Capability.of("data.equity-quote");

    @Test
    void 모든_Provider가_HEALTHY면_HEALTHY() {
        // when
        HealthSnapshot snapshot = HealthSnapshot.of(NOW, List.of(
            health("deepseek", ProviderStatus.HEALTHY, QUICK),
            health("yahoo", ProviderStatus.HEALTHY, QUOTE)
        ));

        // then
        assertThat(snapshot.overall()).isEqualTo(HealthStatus.HEALTHY);
        assertThat(snapshot.unavailableCapabilities()).isEmpty();
        assertThat(snapshot.isReady()).isTrue();
    }

    @Test
    void 일부_Provider가_OPEN이어도_대체_Provider가_있으면_DEGRADED() {
        // when
        HealthSnapshot snapshot = HealthSnapshot.of(NOW, List.of(
            health("deepseek", ProviderStatus.OPEN, QUICK),
            health("kimi", ProviderStatus.HEALTHY, QUICK)
        ));

        // then
        assertThat(snapshot.overall()).isEqualTo(HealthStatus.DEGRADED);
        assertThat(snapshot.isReady()).isTrue();
    }

    @Test
    void 사용_가능한_Provider가_없는_Capability가_있으면_UNHEALTHY() {
        // when
        HealthSnapshot snapshot = HealthSnapshot.of(NOW, List.of(
            health("deepseek", ProviderStatus.DEGRADED, QUICK),
            health("kimi", ProviderStatus.PROBE_FAILED, QUICK),
            health("yahoo", ProviderStatus.HEALTHY, QUOTE)
        ));

        // then
        assertThat(snapshot.overall()).isEqualTo(HealthStatus.UNHEALTHY);
        assertThat(snapshot.unavailableCapabilities()).containsExactly(QUICK);
        assertThat(snapshot.isReady()).isFalse();
    }

    @Test
    void HALF_OPEN은_사용_가능으로_간주() {
        // when
        HealthSnapshot snapshot = HealthSnapshot.of(NOW, List.of(
            health("deepseek", ProviderStatus.HALF_OPEN, QUICK)
        ));

        // then
        assertThat(snapshot.overall()).isEqualTo(HealthStatus.DEGRADED);
        assertThat(snapshot.unavailableCapabilities()).isEmpty();
    }

    @Test
    void Provider_조회() {
        // given
        HealthSnapshot snapshot = HealthSnapshot.of(NOW, List.of(health("deepseek", ProviderStatus.HEALTHY, QUICK)));

        // then
        assertThat(snapshot.provider(ProviderName.of("deepseek"))).isPresent();
        assertThat(snapshot.provider(ProviderName.of("missing"))).isEmpty();
    }

    @Test
    void Provider가_없으면_HEALTHY() {
        assertThat(HealthSnapshot.of(NOW, List.of()).overall()).isEqualTo(HealthStatus.HEALTHY);
    }

    private static ProviderHealth health(String name, ProviderStatus status, Capability<?, ?> capability) {
        CircuitBreakerState state = switch (status) {
            case OPEN, DEGRADED -> CircuitBreakerState.OPEN;
            case HALF_OPEN -> CircuitBreakerState.HALF_OPEN;
            default -> CircuitBreakerState.CLOSED;
        };
        return new ProviderHealth(
            ProviderName.of(name),
            Set.of(capability),
            state,
            status,
            0,
            null,
            status == ProviderStatus.PROBE_FAILED ? ProbeResult.FAILED : ProbeResult.SKIPPED,
            NOW
        );
    }
}
