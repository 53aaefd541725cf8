package com.ryuqq.relay.testkit.contract;

import com.ryuqq.relay.core.exception.CircuitOpenException;
import com.ryuqq.relay.core.exception.TransientProviderException;
import com.ryuqq.relay.core.model.ProviderName;
import com.ryuqq.relay.core.protection.CircuitBreaker;
import com.ryuqq.relay.core.protection.CircuitBreakerConfig;
import com.ryuqq.relay.core.protection.CircuitBreakerMetrics;
import com.ryuqq.relay.core.protection.CircuitBreakerPermit;
import com.ryuqq.relay.core.protection.CircuitBreakerState;
import com.ryuqq.relay.testkit.fixture.ManualClock;
import com.ryuqq.relay.testkit.fixture.ScriptedProvider;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract test suite for {@link CircuitBreaker} implementations.
 *
 * <p>Every breaker implementation extends this class and supplies a factory method.
 * The suite runs against a {@link ManualClock} so OPEN timeouts are deterministic.</p>
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>CLOSED → OPEN exactly on the N-th consecutive failure</li>
 *   <li>OPEN rejects without contacting the provider</li>
 *   <li>OPEN → HALF_OPEN on the first acquire after openTimeout, single trial admitted</li>
 *   <li>HALF_OPEN trial success closes, trial failure re-opens</li>
 *   <li>Only the trial permit decides HALF_OPEN; earlier permits are treated as late results</li>
 *   <li>releasePermit() frees the trial slot without touching counters</li>
 *   <li>Late results while OPEN, reset(), metrics invariants</li>
 * </ul>
 *
 * <p><strong>Usage:</strong></p>
 * <pre>
 * class MyCircuitBreakerContractTest extends AbstractCircuitBreakerContractTest {
 *     {@literal @}Override
 *     protected CircuitBreaker createCircuitBreaker(ProviderName name, CircuitBreakerConfig config, Clock clock) {
 *         return new MyCircuitBreaker(name, config, clock);
 *     }
 * }
 * </pre>
 *
 * @author Relay Team
 * @since 1.0.0
 */
public abstract class AbstractCircuitBreakerContractTest {

    protected static final ProviderName PROVIDER = ProviderName.of("contract-provider");
    protected static final int FAILURE_THRESHOLD = 3;
    protected static final Duration OPEN_TIMEOUT = Duration.ofSeconds(30);

    protected ManualClock clock;
    protected CircuitBreaker breaker;

    /**
     * Creates the breaker under test.
     *
     * @param providerName protected provider
     * @param config breaker configuration
     * @param clock time source the breaker must use
     * @return a fresh CLOSED breaker
     */
    protected abstract CircuitBreaker createCircuitBreaker(ProviderName providerName,
                                                           CircuitBreakerConfig config,
                                                           Clock clock);

    @BeforeEach
    void setUpBreaker() {
        clock = new ManualClock();
        breaker = createCircuitBreaker(PROVIDER, new CircuitBreakerConfig(FAILURE_THRESHOLD, OPEN_TIMEOUT), clock);
    }

    // ===================================================================
    // CLOSED
    // ===================================================================

    @Test
    void testInitialState_IsClosedWithoutFailures() {
        CircuitBreakerMetrics metrics = breaker.metrics();

        assertEquals(CircuitBreakerState.CLOSED, breaker.getState());
        assertEquals(PROVIDER, breaker.providerName());
        assertEquals(0, metrics.consecutiveFailures());
        assertNull(metrics.lastFailureTime());
        assertTrue(breaker.tryAcquire().isPresent(), "CLOSED circuit should allow requests");
    }

    @Test
    void testClosed_PermitIsNotTrial() {
        CircuitBreakerPermit permit = acquire();

        assertFalse(permit.trial());
        assertEquals(PROVIDER, permit.providerName());
    }

    @Test
    void testClosed_OpensExactlyOnThresholdFailure() {
        // Given: threshold - 1 failures
        for (int i = 0; i < FAILURE_THRESHOLD - 1; i++) {
            recordAdmittedFailure();
            assertEquals(CircuitBreakerState.CLOSED, breaker.getState(),
                "Circuit should stay CLOSED after " + (i + 1) + " failures");
        }

        // When: N-th failure
        recordAdmittedFailure();

        // Then
        CircuitBreakerMetrics metrics = breaker.metrics();
        assertEquals(CircuitBreakerState.OPEN, metrics.state());
        assertEquals(FAILURE_THRESHOLD, metrics.consecutiveFailures());
        assertEquals(clock.instant(), metrics.lastFailureTime());
        assertEquals(clock.instant(), metrics.openedSince());
    }

    @Test
    void testClosed_SuccessResetsConsecutiveFailures() {
        // Given
        recordAdmittedFailure();
        recordAdmittedFailure();

        // When
        breaker.recordSuccess(acquire());

        // Then: threshold - 1 further failures keep it CLOSED
        assertEquals(0, breaker.metrics().consecutiveFailures());
        recordAdmittedFailure();
        recordAdmittedFailure();
        assertEquals(CircuitBreakerState.CLOSED, breaker.getState());
    }

    @Test
    void testClosed_LastFailureTimeUpdatedOnEveryFailure() {
        recordAdmittedFailure();
        Instant later = clock.advance(Duration.ofSeconds(5));
        recordAdmittedFailure();

        assertEquals(later, breaker.metrics().lastFailureTime());
    }

    // ===================================================================
    // OPEN
    // ===================================================================

    @Test
    void testOpen_RejectsBeforeTimeout() {
        tripOpen();
        clock.advance(OPEN_TIMEOUT.minusMillis(1));

        assertTrue(breaker.tryAcquire().isEmpty(), "OPEN circuit should reject requests before openTimeout");
        assertEquals(CircuitBreakerState.OPEN, breaker.getState());
    }

    @Test
    void testOpen_CallDoesNotContactProvider() {
        // Given
        tripOpen();
        ScriptedProvider<String, String> provider = ScriptedProvider.alwaysReturning("answer");

        // When & Then
        CircuitOpenException exception = assertThrows(
            CircuitOpenException.class,
            () -> breaker.call(provider, "payload")
        );
        assertEquals(PROVIDER, exception.getProviderName());
        assertEquals(0, provider.getCallCount(), "Provider must not be contacted while OPEN");
        assertEquals(FAILURE_THRESHOLD, breaker.metrics().consecutiveFailures(),
            "Rejected calls must not change counters");
    }

    @Test
    void testOpen_LateSuccessDoesNotClose() {
        CircuitBreakerPermit earlier = acquire();
        tripOpen();

        breaker.recordSuccess(earlier);

        assertEquals(CircuitBreakerState.OPEN, breaker.getState());
        assertEquals(FAILURE_THRESHOLD, breaker.metrics().consecutiveFailures());
    }

    @Test
    void testOpen_LateFailureIncrementsCounterOnly() {
        // Given
        CircuitBreakerPermit earlier = acquire();
        tripOpen();
        Instant openedAt = clock.instant();
        clock.advance(Duration.ofSeconds(10));

        // When
        breaker.recordFailure(earlier, new TransientProviderException("late"));

        // Then
        CircuitBreakerMetrics metrics = breaker.metrics();
        assertEquals(CircuitBreakerState.OPEN, metrics.state());
        assertEquals(FAILURE_THRESHOLD + 1, metrics.consecutiveFailures());
        assertEquals(openedAt, metrics.lastFailureTime(), "Late failure must not extend the OPEN window");
    }

    // ===================================================================
    // HALF_OPEN
    // ===================================================================

    @Test
    void testOpen_FirstAcquireAfterTimeoutIsSingleTrial() {
        // Given
        tripOpen();
        clock.advance(OPEN_TIMEOUT);

        // When
        Optional<CircuitBreakerPermit> first = breaker.tryAcquire();
        Optional<CircuitBreakerPermit> second = breaker.tryAcquire();

        // Then
        assertTrue(first.isPresent(), "First acquire after openTimeout should be admitted as the trial");
        assertTrue(first.get().trial(), "Permit admitted in HALF_OPEN is marked as the trial");
        assertTrue(second.isEmpty(), "Only one trial call is admitted in HALF_OPEN");
        assertEquals(CircuitBreakerState.HALF_OPEN, breaker.getState());
    }

    @Test
    void testHalfOpen_TrialSuccessCloses() {
        // Given
        tripOpen();
        clock.advance(OPEN_TIMEOUT);
        CircuitBreakerPermit trial = acquire();

        // When
        breaker.recordSuccess(trial);

        // Then
        CircuitBreakerMetrics metrics = breaker.metrics();
        assertEquals(CircuitBreakerState.CLOSED, metrics.state());
        assertEquals(0, metrics.consecutiveFailures());
        assertNull(metrics.openedSince());
        assertTrue(breaker.tryAcquire().isPresent());
    }

    @Test
    void testHalfOpen_TrialFailureReopens() {
        // Given
        tripOpen();
        Instant openedAt = clock.instant();
        Instant trialAt = clock.advance(OPEN_TIMEOUT);
        CircuitBreakerPermit trial = acquire();

        // When
        breaker.recordFailure(trial, new TransientProviderException("still down"));

        // Then
        CircuitBreakerMetrics metrics = breaker.metrics();
        assertEquals(CircuitBreakerState.OPEN, metrics.state());
        assertEquals(trialAt, metrics.lastFailureTime());
        assertEquals(openedAt, metrics.openedSince(), "openedSince is kept across re-trips");
        assertTrue(breaker.tryAcquire().isEmpty(), "Re-opened circuit waits a full openTimeout again");
    }

    @Test
    void testHalfOpen_LateSuccessFromEarlierPermitDoesNotClose() {
        // Given: permit admitted while CLOSED, circuit trips, trial admitted
        CircuitBreakerPermit earlier = acquire();
        tripOpen();
        clock.advance(OPEN_TIMEOUT);
        CircuitBreakerPermit trial = acquire();

        // When
        breaker.recordSuccess(earlier);

        // Then
        assertEquals(CircuitBreakerState.HALF_OPEN, breaker.getState(),
            "Only the trial result may close a HALF_OPEN circuit");
        assertTrue(breaker.tryAcquire().isEmpty(), "Trial slot is still taken");

        breaker.recordSuccess(trial);
        assertEquals(CircuitBreakerState.CLOSED, breaker.getState());
    }

    @Test
    void testHalfOpen_LateFailureFromEarlierPermitDoesNotReopen() {
        // Given
        CircuitBreakerPermit earlier = acquire();
        tripOpen();
        Instant openedAt = clock.instant();
        clock.advance(OPEN_TIMEOUT);
        CircuitBreakerPermit trial = acquire();

        // When
        breaker.recordFailure(earlier, new TransientProviderException("late"));

        // Then
        CircuitBreakerMetrics metrics = breaker.metrics();
        assertEquals(CircuitBreakerState.HALF_OPEN, metrics.state(),
            "Only the trial result may re-open a HALF_OPEN circuit");
        assertEquals(FAILURE_THRESHOLD + 1, metrics.consecutiveFailures());
        assertEquals(openedAt, metrics.lastFailureTime(), "Late failure must not move lastFailureTime");

        breaker.recordSuccess(trial);
        assertEquals(CircuitBreakerState.CLOSED, breaker.getState(), "Trial success still closes the circuit");
        assertEquals(0, breaker.metrics().consecutiveFailures());
    }

    @Test
    void testHalfOpen_ReleasingEarlierPermitKeepsTrialSlot() {
        // Given
        CircuitBreakerPermit earlier = acquire();
        tripOpen();
        clock.advance(OPEN_TIMEOUT);
        acquire();

        // When
        breaker.releasePermit(earlier);

        // Then
        assertTrue(breaker.tryAcquire().isEmpty(), "Only releasing the trial permit frees the slot");
    }

    @Test
    void testHalfOpen_ReleasePermitFreesTrialSlot() {
        // Given
        tripOpen();
        clock.advance(OPEN_TIMEOUT);
        CircuitBreakerPermit trial = acquire();
        CircuitBreakerMetrics before = breaker.metrics();

        // When
        breaker.releasePermit(trial);

        // Then
        CircuitBreakerMetrics after = breaker.metrics();
        assertEquals(CircuitBreakerState.HALF_OPEN, after.state());
        assertEquals(before.consecutiveFailures(), after.consecutiveFailures());
        assertEquals(before.lastFailureTime(), after.lastFailureTime());
        assertTrue(breaker.tryAcquire().isPresent(), "Released trial slot can be taken again");
    }

    @Test
    void testHalfOpen_ConcurrentAcquireAdmitsExactlyOne() throws Exception {
        // Given
        tripOpen();
        clock.advance(OPEN_TIMEOUT);
        int threads = 16;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Boolean>> results = new ArrayList<>();

        try {
            // When
            for (int i = 0; i < threads; i++) {
                results.add(executor.submit(() -> {
                    start.await();
                    return breaker.tryAcquire().isPresent();
                }));
            }
            start.countDown();

            int admitted = 0;
            for (Future<Boolean> result : results) {
                if (result.get(5, TimeUnit.SECONDS)) {
                    admitted++;
                }
            }

            // Then
            assertEquals(1, admitted, "Exactly one concurrent caller should be admitted as the trial");
        } finally {
            executor.shutdownNow();
        }
    }

    // ===================================================================
    // reset / metrics
    // ===================================================================

    @Test
    void testReset_ClosesAndClearsHistory() {
        tripOpen();

        breaker.reset();

        CircuitBreakerMetrics metrics = breaker.metrics();
        assertEquals(CircuitBreakerState.CLOSED, metrics.state());
        assertEquals(0, metrics.consecutiveFailures());
        assertNull(metrics.lastFailureTime());
        assertTrue(breaker.tryAcquire().isPresent());
    }

    @Test
    void testCall_RecordsProviderOutcome() throws Exception {
        // Given
        ScriptedProvider<String, String> provider = ScriptedProvider.<String, String>create()
            .thenThrow(new TransientProviderException("503"))
            .thenReturn("answer");

        // When & Then
        assertThrows(TransientProviderException.class, () -> breaker.call(provider, "payload"));
        assertEquals(1, breaker.metrics().consecutiveFailures());

        assertEquals("answer", breaker.call(provider, "payload"));
        assertEquals(0, breaker.metrics().consecutiveFailures());
        assertEquals(2, provider.getCallCount());
    }

    // ===================================================================
    // Helpers
    // ===================================================================

    protected CircuitBreakerPermit acquire() {
        Optional<CircuitBreakerPermit> permit = breaker.tryAcquire();
        assertTrue(permit.isPresent(), "Expected the call to be admitted");
        return permit.get();
    }

    protected void recordAdmittedFailure() {
        breaker.recordFailure(acquire(), new TransientProviderException("failure"));
    }

    protected void tripOpen() {
        for (int i = 0; i < FAILURE_THRESHOLD; i++) {
            recordAdmittedFailure();
        }
        assertEquals(CircuitBreakerState.OPEN, breaker.getState());
    }
}
