package com.ryuqq.relay.adapter.inmemory.protection;

import com.ryuqq.relay.core.model.ProviderName;
import com.ryuqq.relay.core.protection.CircuitBreaker;
import com.ryuqq.relay.core.protection.CircuitBreakerConfig;
import com.ryuqq.relay.core.protection.CircuitBreakerMetrics;
import com.ryuqq.relay.core.protection.CircuitBreakerPermit;
import com.ryuqq.relay.core.protection.CircuitBreakerState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 연속 실패 기반 In-Memory Circuit Breaker.
 *
 * <p>Provider 하나의 상태를 프로세스 메모리에 유지합니다.
 * 모든 확인-변경 구간은 인스턴스 전용 {@link ReentrantLock} 안에서 실행되며,
 * Provider 호출 중에는 락을 잡지 않습니다.</p>
 *
 * <p><strong>상태 전이:</strong></p>
 * <ul>
 *   <li>CLOSED: 실패 시 연속 실패 횟수 증가, failureThreshold 도달 시 OPEN. 성공 시 0으로 초기화</li>
 *   <li>OPEN: 마지막 실패 후 openTimeout 경과 시 다음 tryAcquire()가 HALF_OPEN으로 전이하며 시험 호출로 허용됨</li>
 *   <li>HALF_OPEN: 시험 호출 1건만 허용. 시험 호출 permit의 결과가 성공이면 CLOSED, 실패면 OPEN</li>
 * </ul>
 *
 * <p><strong>늦게 도착한 결과</strong> (OPEN 중 결과, HALF_OPEN 중 시험 호출이 아닌 permit의 결과):</p>
 * <ul>
 *   <li>성공: 무시 (CLOSED로 전이하지 않음)</li>
 *   <li>실패: 연속 실패 횟수만 증가 (OPEN 유지 시간 연장 없음)</li>
 * </ul>
 *
 * @author Relay Team
 * @since 1.0.0
 */
public final class InMemoryCircuitBreaker implements CircuitBreaker {

    private static final Logger log = LoggerFactory.getLogger(InMemoryCircuitBreaker.class);

    private static final long NO_TRIAL = -1L;

    private final ProviderName providerName;
    private final CircuitBreakerConfig config;
    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();

    private CircuitBreakerState state = CircuitBreakerState.CLOSED;
    private int consecutiveFailures;
    private Instant lastFailureTime;
    private Instant openedSince;
    private long nextSequence;
    private long trialSequence = NO_TRIAL;

    public InMemoryCircuitBreaker(ProviderName providerName, CircuitBreakerConfig config) {
        this(providerName, config, Clock.systemUTC());
    }

    public InMemoryCircuitBreaker(ProviderName providerName, CircuitBreakerConfig config, Clock clock) {
        if (providerName == null) {
            throw new IllegalArgumentException("providerName cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.providerName = providerName;
        this.config = config;
        this.clock = clock;
    }

    @Override
    public ProviderName providerName() {
        return providerName;
    }

    @Override
    public Optional<CircuitBreakerPermit> tryAcquire() {
        lock.lock();
        try {
            switch (state) {
                case CLOSED:
                    return Optional.of(new CircuitBreakerPermit(providerName, nextSequence++, false));
                case OPEN:
                    Duration sinceLastFailure = Duration.between(lastFailureTime, clock.instant());
                    if (sinceLastFailure.compareTo(config.openTimeout()) < 0) {
                        return Optional.empty();
                    }
                    state = CircuitBreakerState.HALF_OPEN;
                    log.info("Circuit breaker {} OPEN -> HALF_OPEN after {}ms, admitting trial call",
                        providerName, sinceLastFailure.toMillis());
                    return Optional.of(issueTrial());
                case HALF_OPEN:
                    if (trialSequence != NO_TRIAL) {
                        return Optional.empty();
                    }
                    return Optional.of(issueTrial());
                default:
                    throw new IllegalStateException("Unknown circuit breaker state: " + state);
            }
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void recordSuccess(CircuitBreakerPermit permit) {
        requirePermit(permit);
        lock.lock();
        try {
            switch (state) {
                case CLOSED:
                    consecutiveFailures = 0;
                    break;
                case HALF_OPEN:
                    if (!isTrial(permit)) {
                        log.debug("Circuit breaker {} ignoring late success of permit {} while HALF_OPEN",
                            providerName, permit.sequence());
                        break;
                    }
                    state = CircuitBreakerState.CLOSED;
                    consecutiveFailures = 0;
                    openedSince = null;
                    trialSequence = NO_TRIAL;
                    log.info("Circuit breaker {} HALF_OPEN -> CLOSED, trial call succeeded", providerName);
                    break;
                case OPEN:
                    log.debug("Circuit breaker {} ignoring late success while OPEN", providerName);
                    break;
                default:
                    throw new IllegalStateException("Unknown circuit breaker state: " + state);
            }
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void recordFailure(CircuitBreakerPermit permit, Throwable throwable) {
        requirePermit(permit);
        lock.lock();
        try {
            Instant now = clock.instant();
            switch (state) {
                case CLOSED:
                    consecutiveFailures++;
                    lastFailureTime = now;
                    if (consecutiveFailures >= config.failureThreshold()) {
                        state = CircuitBreakerState.OPEN;
                        openedSince = now;
                        log.warn("Circuit breaker {} CLOSED -> OPEN after {} consecutive failures (last error: {})",
                            providerName, consecutiveFailures, describe(throwable));
                    }
                    break;
                case HALF_OPEN:
                    if (!isTrial(permit)) {
                        consecutiveFailures++;
                        break;
                    }
                    state = CircuitBreakerState.OPEN;
                    consecutiveFailures++;
                    lastFailureTime = now;
                    trialSequence = NO_TRIAL;
                    log.warn("Circuit breaker {} HALF_OPEN -> OPEN, trial call failed (error: {})",
                        providerName, describe(throwable));
                    break;
                case OPEN:
                    consecutiveFailures++;
                    break;
                default:
                    throw new IllegalStateException("Unknown circuit breaker state: " + state);
            }
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void releasePermit(CircuitBreakerPermit permit) {
        requirePermit(permit);
        lock.lock();
        try {
            if (state == CircuitBreakerState.HALF_OPEN && isTrial(permit)) {
                trialSequence = NO_TRIAL;
            }
        } finally {
            lock.unlock();
        }
    }

    @Override
    public CircuitBreakerState getState() {
        lock.lock();
        try {
            return state;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public CircuitBreakerMetrics metrics() {
        lock.lock();
        try {
            return new CircuitBreakerMetrics(providerName, state, consecutiveFailures, lastFailureTime, openedSince);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void reset() {
        lock.lock();
        try {
            CircuitBreakerState previous = state;
            state = CircuitBreakerState.CLOSED;
            consecutiveFailures = 0;
            lastFailureTime = null;
            openedSince = null;
            trialSequence = NO_TRIAL;
            log.info("Circuit breaker {} reset ({} -> CLOSED)", providerName, previous);
        } finally {
            lock.unlock();
        }
    }

    /**
     * 설정 조회.
     *
     * @return Circuit Breaker 설정
     */
    public CircuitBreakerConfig getConfig() {
        return config;
    }

    // lock 보유 상태에서만 호출
    private CircuitBreakerPermit issueTrial() {
        CircuitBreakerPermit permit = new CircuitBreakerPermit(providerName, nextSequence++, true);
        trialSequence = permit.sequence();
        return permit;
    }

    private boolean isTrial(CircuitBreakerPermit permit) {
        return permit.trial() && permit.sequence() == trialSequence;
    }

    private void requirePermit(CircuitBreakerPermit permit) {
        if (permit == null) {
            throw new IllegalArgumentException("permit cannot be null");
        }
        if (!providerName.equals(permit.providerName())) {
            throw new IllegalArgumentException(
                "permit was issued by " + permit.providerName() + ", not " + providerName);
        }
    }

    private static String describe(Throwable throwable) {
        return throwable == null ? "none" : throwable.getClass().getSimpleName() + ": " + throwable.getMessage();
    }
}
