package com.ryuqq.relay.adapter.runner;

import com.ryuqq.relay.application.invoker.ProviderInvoker;
import com.ryuqq.relay.core.exception.AllProvidersFailedException;
import com.ryuqq.relay.core.exception.ConfigurationException;
import com.ryuqq.relay.core.exception.FailureReason;
import com.ryuqq.relay.core.exception.ProviderFailure;
import com.ryuqq.relay.core.model.Capability;
import com.ryuqq.relay.core.model.ProviderName;
import com.ryuqq.relay.core.outcome.Fail;
import com.ryuqq.relay.core.outcome.Ok;
import com.ryuqq.relay.core.outcome.Outcome;
import com.ryuqq.relay.core.outcome.Retry;
import com.ryuqq.relay.core.protection.CircuitBreaker;
import com.ryuqq.relay.core.registry.ProviderDescriptor;
import com.ryuqq.relay.core.registry.ProviderRegistry;
import com.ryuqq.relay.core.retry.DefaultErrorClassifier;
import com.ryuqq.relay.core.retry.ErrorClassifier;
import com.ryuqq.relay.core.spi.InvocationListener;
import com.ryuqq.relay.core.spi.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.function.Supplier;

/**
 * Fallback 체인 기반 ProviderInvoker 구현체.
 *
 * <p>Capability에 등록된 Provider를 rank 순서대로 시도하며, 각 Provider 호출은
 * Circuit Breaker → RetryPolicy → Provider 함수 순서로 보호됩니다.</p>
 *
 * <p><strong>처리 흐름:</strong></p>
 * <ol>
 *   <li>registry.listFor(capability)로 체인 조회 (비어 있으면 ConfigurationException)</li>
 *   <li>Provider별 RetryPolicy 생성 (Provider override 또는 Capability 설정)</li>
 *   <li>Circuit Breaker로 재시도 루프 전체를 감싸 실행</li>
 *   <li>성공 시 즉시 반환 (이후 Provider는 호출하지 않음)</li>
 *   <li>실패 시 ProviderFailure 기록 후 다음 Provider</li>
 *   <li>모두 실패 시 AllProvidersFailedException (체인 순서의 실패 목록)</li>
 * </ol>
 *
 * <p><strong>Outcome → 실패 사유 매핑:</strong></p>
 * <ul>
 *   <li>Retry → RETRIES_EXHAUSTED</li>
 *   <li>Fail → CIRCUIT_OPEN / PERMANENT_ERROR / INVALID_RESPONSE</li>
 * </ul>
 *
 * <p><strong>동시성:</strong> 상태를 갖지 않으며 여러 스레드에서 동시에 호출할 수 있습니다.
 * 공유 상태는 Registry가 소유한 Circuit Breaker뿐입니다.</p>
 *
 * @author Relay Team
 * @since 1.0.0
 */
public final class FallbackInvoker implements ProviderInvoker {

    private static final Logger log = LoggerFactory.getLogger(FallbackInvoker.class);

    private final ProviderRegistry registry;
    private final ErrorClassifier classifier;
    private final BackoffCalculator backoffCalculator;
    private final Sleeper sleeper;
    private final InvocationListener listener;
    private final ExecutorService attemptExecutor;

    /**
     * 기본 구성으로 생성.
     *
     * <p>기본값: DefaultErrorClassifier, BackoffCalculator(ThreadLocalRandom), ThreadSleeper,
     * LoggingInvocationListener, 공유 attempt executor</p>
     *
     * @param registry Provider Registry
     */
    public FallbackInvoker(ProviderRegistry registry) {
        this(registry, new DefaultErrorClassifier(), new BackoffCalculator(), new ThreadSleeper(),
            new LoggingInvocationListener());
    }

    public FallbackInvoker(
        ProviderRegistry registry,
        ErrorClassifier classifier,
        BackoffCalculator backoffCalculator,
        Sleeper sleeper,
        InvocationListener listener
    ) {
        this(registry, classifier, backoffCalculator, sleeper, listener, RetryPolicy.sharedAttemptExecutor());
    }

    public FallbackInvoker(
        ProviderRegistry registry,
        ErrorClassifier classifier,
        BackoffCalculator backoffCalculator,
        Sleeper sleeper,
        InvocationListener listener,
        ExecutorService attemptExecutor
    ) {
        if (registry == null) {
            throw new IllegalArgumentException("registry cannot be null");
        }
        if (classifier == null) {
            throw new IllegalArgumentException("classifier cannot be null");
        }
        if (backoffCalculator == null) {
            throw new IllegalArgumentException("backoffCalculator cannot be null");
        }
        if (sleeper == null) {
            throw new IllegalArgumentException("sleeper cannot be null");
        }
        if (listener == null) {
            throw new IllegalArgumentException("listener cannot be null");
        }
        if (attemptExecutor == null) {
            throw new IllegalArgumentException("attemptExecutor cannot be null");
        }
        this.registry = registry;
        this.classifier = classifier;
        this.backoffCalculator = backoffCalculator;
        this.sleeper = sleeper;
        this.listener = listener;
        this.attemptExecutor = attemptExecutor;
    }

    @Override
    public <Q, R> R invoke(Capability<Q, R> capability, Q payload, Supplier<Optional<R>> cachedResponse) {
        if (capability == null) {
            throw new IllegalArgumentException("capability cannot be null");
        }
        if (cachedResponse == null) {
            throw new IllegalArgumentException("cachedResponse cannot be null");
        }

        // 1. 체인 조회
        List<ProviderDescriptor<Q, R>> chain = registry.listFor(capability);
        if (chain.isEmpty()) {
            throw new ConfigurationException("No providers registered for capability " + capability);
        }

        // 2. 순서대로 시도
        List<ProviderFailure> failures = new ArrayList<>();
        for (ProviderDescriptor<Q, R> descriptor : chain) {
            CircuitBreaker breaker = registry.circuitBreaker(descriptor.name());
            RetryPolicy retryPolicy = new RetryPolicy(
                registry.retryConfigFor(descriptor), classifier, backoffCalculator, sleeper, listener, attemptExecutor);

            Outcome<R> outcome = breaker.execute(() -> retryPolicy.execute(descriptor, payload, cachedResponse));

            if (outcome instanceof Ok<R> ok) {
                if (!failures.isEmpty()) {
                    log.info("Capability {} served by fallback provider {} after {} failed provider(s)",
                        capability, descriptor.name(), failures.size());
                }
                return ok.value();
            }

            ProviderFailure failure = toFailure(descriptor.name(), outcome);
            failures.add(failure);
            log.warn("Provider {} failed for {}: {} ({})",
                descriptor.name(), capability, failure.describe(), failure.error().getGuidance());
        }

        // 3. 모두 실패
        AllProvidersFailedException exception = new AllProvidersFailedException(capability, failures);
        log.error("All providers failed for {}: {}", capability, exception.getMessage());
        throw exception;
    }

    private static ProviderFailure toFailure(ProviderName name, Outcome<?> outcome) {
        if (outcome instanceof Retry<?> retry) {
            return new ProviderFailure(name, FailureReason.RETRIES_EXHAUSTED, retry.error(), retry.attempts());
        }
        if (outcome instanceof Fail<?> fail) {
            return new ProviderFailure(name, fail.reason(), fail.error(), fail.attempts());
        }
        throw new IllegalStateException("Unexpected outcome type: " + outcome.getClass().getName());
    }
}
