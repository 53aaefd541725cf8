package com.ryuqq.relay.core.protection;

import com.ryuqq.relay.core.exception.ConfigurationException;
import com.ryuqq.relay.core.model.ProviderName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

/**
 * CircuitBreakerMetrics / CircuitBreakerConfig 테스트.
 *
 * @author Relay Team
 * @since 1.0.0
 */
class CircuitBreakerMetricsTest {

    private static final ProviderName PROVIDER = ProviderName.of("kimi");

    @Test
    void constructor_OpenWithoutLastFailureTime_ThrowsException() {
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> new CircuitBreakerMetrics(PROVIDER, CircuitBreakerState.OPEN, 2, null, Instant.now())
        );
        assertTrue(exception.getMessage().contains("OPEN state requires"));
    }

    @Test
    void constructor_OpenWithTimes_CreatesMetrics() {
        // Given
        Instant now = Instant.parse("2025-01-01T00:00:00Z");

        // When
        CircuitBreakerMetrics metrics = new CircuitBreakerMetrics(PROVIDER, CircuitBreakerState.OPEN, 2, now, now);

        // Then
        assertEquals(2, metrics.consecutiveFailures());
        assertEquals(now, metrics.openedSince());
    }

    @Test
    void constructor_NegativeFailures_ThrowsException() {
        assertThrows(
            IllegalArgumentException.class,
            () -> new CircuitBreakerMetrics(PROVIDER, CircuitBreakerState.CLOSED, -1, null, null)
        );
    }

    @Test
    void config_Defaults() {
        // When
        CircuitBreakerConfig config = new CircuitBreakerConfig();

        // Then
        assertEquals(5, config.failureThreshold());
        assertEquals(Duration.ofSeconds(60), config.openTimeout());
    }

    @Test
    void config_InvalidValues_ThrowConfigurationException() {
        assertThrows(ConfigurationException.class, () -> new CircuitBreakerConfig().withFailureThreshold(0));
        assertThrows(ConfigurationException.class, () -> new CircuitBreakerConfig().withOpenTimeout(Duration.ZERO));
        assertThrows(ConfigurationException.class, () -> new CircuitBreakerConfig().withOpenTimeout(null));
    }
}
