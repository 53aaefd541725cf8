package com.ryuqq.relay.adapter.runner;

import com.ryuqq.relay.application.health.HealthQuery;
import com.ryuqq.relay.core.config.HealthSettings;
import com.ryuqq.relay.core.health.HealthSnapshot;
import com.ryuqq.relay.core.health.ProbeResult;
import com.ryuqq.relay.core.health.ProviderHealth;
import com.ryuqq.relay.core.health.ProviderStatus;
import com.ryuqq.relay.core.model.Capability;
import com.ryuqq.relay.core.model.ProviderName;
import com.ryuqq.relay.core.protection.CircuitBreakerMetrics;
import com.ryuqq.relay.core.registry.ProviderDescriptor;
import com.ryuqq.relay.core.registry.ProviderRegistry;
import com.ryuqq.relay.core.spi.LivenessProbe;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Provider 헬스 집계기.
 *
 * <p>주기적으로 모든 Provider의 Circuit Breaker 상태와 Liveness Probe 결과를 조회하여
 * 불변 {@link HealthSnapshot}을 생성합니다. 보고 전용이며 Circuit Breaker 상태를 변경하지 않습니다.</p>
 *
 * <p><strong>주요 기능:</strong></p>
 * <ul>
 *   <li>고정 지연(fixed-delay) 폴링: 단일 daemon 스레드 ({@link #start()} / {@link #stop()})</li>
 *   <li>즉시 폴링: {@link #poll()}</li>
 *   <li>최신 스냅샷 조회: {@link #getHealth()} (폴링 이력이 없으면 1회 폴링)</li>
 * </ul>
 *
 * <p><strong>분류 규칙:</strong></p>
 * <ul>
 *   <li>OPEN이 openGracePeriod보다 오래 지속 → DEGRADED</li>
 *   <li>유예 기간 이내의 OPEN → OPEN</li>
 *   <li>HALF_OPEN → HALF_OPEN</li>
 *   <li>CLOSED + Probe 실패 → PROBE_FAILED</li>
 *   <li>그 외 → HEALTHY</li>
 * </ul>
 *
 * <p><strong>예외 처리:</strong></p>
 * <ul>
 *   <li>Probe 예외: PROBE_FAILED로 기록하고 WARN 로그</li>
 *   <li>Probe 타임아웃: probeTimeout 안에 응답하지 않으면 작업을 취소하고 PROBE_FAILED로 기록</li>
 *   <li>폴링 중 예외: ERROR 로그 후 다음 주기에 계속 진행</li>
 * </ul>
 *
 * @author Relay Team
 * @since 1.0.0
 */
public final class HealthAggregator implements HealthQuery {

    private static final Logger log = LoggerFactory.getLogger(HealthAggregator.class);

    private static final String THREAD_NAME = "relay-health-poller";
    private static final String PROBE_THREAD_PREFIX = "relay-health-probe-";

    private final ProviderRegistry registry;
    private final HealthSettings settings;
    private final Clock clock;
    private final AtomicReference<HealthSnapshot> latest = new AtomicReference<>();
    private final AtomicInteger probeThreadCount = new AtomicInteger();
    private final ExecutorService probeExecutor = Executors.newCachedThreadPool(runnable -> {
        Thread thread = new Thread(runnable, PROBE_THREAD_PREFIX + probeThreadCount.incrementAndGet());
        thread.setDaemon(true);
        return thread;
    });

    private ScheduledExecutorService scheduler;

    public HealthAggregator(ProviderRegistry registry, HealthSettings settings) {
        this(registry, settings, Clock.systemUTC());
    }

    public HealthAggregator(ProviderRegistry registry, HealthSettings settings, Clock clock) {
        if (registry == null) {
            throw new IllegalArgumentException("registry cannot be null");
        }
        if (settings == null) {
            throw new IllegalArgumentException("settings cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.registry = registry;
        this.settings = settings;
        this.clock = clock;
    }

    /**
     * 주기적 폴링 시작.
     *
     * @throws IllegalStateException 이미 실행 중인 경우
     */
    public synchronized void start() {
        if (scheduler != null) {
            throw new IllegalStateException("HealthAggregator is already running");
        }
        ScheduledExecutorService created = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, THREAD_NAME);
            thread.setDaemon(true);
            return thread;
        });
        long intervalMs = settings.pollInterval().toMillis();
        try {
            created.scheduleWithFixedDelay(this::scheduledPoll, 0, intervalMs, TimeUnit.MILLISECONDS);
        } catch (RuntimeException e) {
            created.shutdownNow();
            throw e;
        }
        scheduler = created;
        log.info("HealthAggregator started: pollInterval={}ms, openGracePeriod={}ms, probeEnabled={}, probeTimeout={}ms",
            intervalMs, settings.openGracePeriod().toMillis(), settings.probeEnabled(),
            settings.probeTimeout().toMillis());
    }

    /**
     * 주기적 폴링 중지.
     *
     * <p>진행 중인 폴링이 끝날 때까지 최대 5초 대기한 후 강제 종료합니다.</p>
     *
     * @throws InterruptedException 종료 대기 중 인터럽트 발생 시
     */
    public void stop() throws InterruptedException {
        ScheduledExecutorService running;
        synchronized (this) {
            running = scheduler;
            scheduler = null;
        }
        if (running == null) {
            return;
        }
        running.shutdown();
        if (!running.awaitTermination(5, TimeUnit.SECONDS)) {
            running.shutdownNow();
        }
        log.info("HealthAggregator stopped");
    }

    public synchronized boolean isRunning() {
        return scheduler != null;
    }

    @Override
    public HealthSnapshot getHealth() {
        HealthSnapshot snapshot = latest.get();
        if (snapshot == null) {
            return poll();
        }
        return snapshot;
    }

    /**
     * 즉시 폴링하여 스냅샷 갱신.
     *
     * @return 새 스냅샷
     */
    public HealthSnapshot poll() {
        Instant now = clock.instant();

        // 1. Provider 이름별로 Descriptor 묶기 (등록 순서 유지)
        Map<ProviderName, List<ProviderDescriptor<?, ?>>> byName = new LinkedHashMap<>();
        for (ProviderDescriptor<?, ?> descriptor : registry.descriptors()) {
            byName.computeIfAbsent(descriptor.name(), name -> new ArrayList<>()).add(descriptor);
        }

        // 2. Provider별 상태 조회 및 분류
        List<ProviderHealth> healths = new ArrayList<>(byName.size());
        for (Map.Entry<ProviderName, List<ProviderDescriptor<?, ?>>> entry : byName.entrySet()) {
            healths.add(inspect(entry.getKey(), entry.getValue(), now));
        }

        // 3. 스냅샷 교체
        HealthSnapshot snapshot = HealthSnapshot.of(now, healths);
        latest.set(snapshot);
        log.debug("Health poll completed: overall={}, providers={}, unavailable={}",
            snapshot.overall(), healths.size(), snapshot.unavailableCapabilities());
        return snapshot;
    }

    private ProviderHealth inspect(ProviderName name, List<ProviderDescriptor<?, ?>> descriptors, Instant now) {
        CircuitBreakerMetrics metrics = registry.circuitBreaker(name).metrics();

        Set<Capability<?, ?>> capabilities = new LinkedHashSet<>();
        LivenessProbe probe = null;
        for (ProviderDescriptor<?, ?> descriptor : descriptors) {
            capabilities.add(descriptor.capability());
            if (probe == null && descriptor.hasProbe()) {
                probe = descriptor.probe();
            }
        }

        ProbeResult probeResult = settings.probeEnabled() && probe != null
            ? runProbe(name, probe)
            : ProbeResult.SKIPPED;

        return new ProviderHealth(
            name,
            capabilities,
            metrics.state(),
            classify(metrics, probeResult, now),
            metrics.consecutiveFailures(),
            metrics.lastFailureTime(),
            probeResult,
            now
        );
    }

    private ProviderStatus classify(CircuitBreakerMetrics metrics, ProbeResult probeResult, Instant now) {
        switch (metrics.state()) {
            case OPEN:
                Duration openFor = Duration.between(metrics.openedSince(), now);
                return openFor.compareTo(settings.openGracePeriod()) > 0 ? ProviderStatus.DEGRADED : ProviderStatus.OPEN;
            case HALF_OPEN:
                return ProviderStatus.HALF_OPEN;
            case CLOSED:
                return probeResult == ProbeResult.FAILED ? ProviderStatus.PROBE_FAILED : ProviderStatus.HEALTHY;
            default:
                throw new IllegalStateException("Unknown circuit breaker state: " + metrics.state());
        }
    }

    private ProbeResult runProbe(ProviderName name, LivenessProbe probe) {
        long timeoutMs = settings.probeTimeout().toMillis();
        Future<Boolean> future = probeExecutor.submit(probe::isAlive);
        try {
            if (Boolean.TRUE.equals(future.get(timeoutMs, TimeUnit.MILLISECONDS))) {
                return ProbeResult.ALIVE;
            }
            log.warn("Liveness probe for {} reported not alive", name);
            return ProbeResult.FAILED;
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("Liveness probe for {} timed out after {}ms", name, timeoutMs);
            return ProbeResult.FAILED;
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            log.warn("Liveness probe for {} was interrupted", name);
            return ProbeResult.FAILED;
        } catch (ExecutionException e) {
            log.warn("Liveness probe for {} failed", name, e.getCause());
            return ProbeResult.FAILED;
        }
    }

    private void scheduledPoll() {
        try {
            poll();
        } catch (RuntimeException e) {
            log.error("Health poll failed, continuing with next poll", e);
        }
    }
}
