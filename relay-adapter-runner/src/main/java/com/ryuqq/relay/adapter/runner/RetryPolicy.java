package com.ryuqq.relay.adapter.runner;

import com.ryuqq.relay.core.exception.FailureReason;
import com.ryuqq.relay.core.exception.InvalidResponseException;
import com.ryuqq.relay.core.exception.InvocationCancelledException;
import com.ryuqq.relay.core.exception.PermanentProviderException;
import com.ryuqq.relay.core.exception.TransientProviderException;
import com.ryuqq.relay.core.model.ProviderName;
import com.ryuqq.relay.core.outcome.AttemptResult;
import com.ryuqq.relay.core.outcome.Fail;
import com.ryuqq.relay.core.outcome.InvocationAttempt;
import com.ryuqq.relay.core.outcome.Ok;
import com.ryuqq.relay.core.outcome.Outcome;
import com.ryuqq.relay.core.outcome.Retry;
import com.ryuqq.relay.core.registry.ProviderDescriptor;
import com.ryuqq.relay.core.retry.DefaultErrorClassifier;
import com.ryuqq.relay.core.retry.ErrorClassifier;
import com.ryuqq.relay.core.retry.FailureKind;
import com.ryuqq.relay.core.retry.RetryConfig;
import com.ryuqq.relay.core.spi.InvocationListener;
import com.ryuqq.relay.core.spi.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.InterruptedIOException;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Provider 1건에 대한 재시도 루프.
 *
 * <p>일시적 오류만 재시도하며, 영구 오류와 검증 실패는 즉시 중단합니다.
 * {@code maxAttempts}는 첫 시도를 포함한 최대 시도 횟수입니다.</p>
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * for attempt in 1..maxAttempts:
 *   (attempt &gt; 1) 캐시 훅 조회 → 값이 있으면 Ok.cached 반환
 *   (attempt &gt; 1) backoff 대기 (Sleeper)
 *   Provider 호출
 *     ├─ 성공 + 검증 통과 → Ok
 *     ├─ 성공 + 검증 실패 → Fail(INVALID_RESPONSE)
 *     ├─ TRANSIENT 오류   → 다음 시도 (시도 타임아웃 포함)
 *     └─ PERMANENT 오류   → Fail(PERMANENT_ERROR)
 * 모든 시도 소진 → Retry(마지막 일시적 오류)
 * </pre>
 *
 * <p><strong>시도 타임아웃:</strong> {@code attemptTimeout}이 0보다 크면 Provider 호출을 attempt executor에서
 * 실행하고 {@code Future.get(timeout)}으로 기다립니다. 시간이 초과되면 작업을 취소(interrupt)하고
 * {@link TransientProviderException}으로 처리하므로 재시도 및 Fallback 대상이 됩니다.
 * 0이면 호출 스레드에서 직접 실행합니다.</p>
 *
 * <p><strong>취소:</strong> 호출 또는 대기 중 인터럽트되면 인터럽트 플래그를 복원하고
 * {@link InvocationCancelledException}을 던집니다.</p>
 *
 * <p>Circuit Breaker는 이 루프 전체를 감싸므로, 재시도를 소진한 호출은 실패 1회로 집계됩니다.</p>
 *
 * @author Relay Team
 * @since 1.0.0
 */
public final class RetryPolicy {

    private static final Logger log = LoggerFactory.getLogger(RetryPolicy.class);

    private static final String ATTEMPT_THREAD_PREFIX = "relay-attempt-";

    private final RetryConfig config;
    private final ErrorClassifier classifier;
    private final BackoffCalculator backoffCalculator;
    private final Sleeper sleeper;
    private final InvocationListener listener;
    private final ExecutorService attemptExecutor;

    /**
     * 기본 구성으로 생성 (DefaultErrorClassifier, ThreadSleeper, 리스너 없음).
     *
     * @param config 재시도 설정
     */
    public RetryPolicy(RetryConfig config) {
        this(config, new DefaultErrorClassifier(), new BackoffCalculator(), new ThreadSleeper(), InvocationListener.noOp());
    }

    public RetryPolicy(
        RetryConfig config,
        ErrorClassifier classifier,
        BackoffCalculator backoffCalculator,
        Sleeper sleeper,
        InvocationListener listener
    ) {
        this(config, classifier, backoffCalculator, sleeper, listener, sharedAttemptExecutor());
    }

    /**
     * 전체 구성 생성자.
     *
     * @param config 재시도 설정
     * @param classifier 오류 분류기
     * @param backoffCalculator 백오프 계산기
     * @param sleeper 재시도 대기
     * @param listener 시도 결과 리스너
     * @param attemptExecutor attemptTimeout 적용 시 Provider 호출을 실행할 executor
     */
    public RetryPolicy(
        RetryConfig config,
        ErrorClassifier classifier,
        BackoffCalculator backoffCalculator,
        Sleeper sleeper,
        InvocationListener listener,
        ExecutorService attemptExecutor
    ) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
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
        this.config = config;
        this.classifier = classifier;
        this.backoffCalculator = backoffCalculator;
        this.sleeper = sleeper;
        this.listener = listener;
        this.attemptExecutor = attemptExecutor;
    }

    /**
     * attemptTimeout 적용 시 기본으로 사용하는 공유 executor.
     *
     * <p>daemon 스레드를 필요할 때 생성하는 cached pool이며 JVM 종료를 막지 않습니다.</p>
     *
     * @return 프로세스 전역 attempt executor
     */
    public static ExecutorService sharedAttemptExecutor() {
        return SharedAttemptExecutor.INSTANCE;
    }

    /**
     * 캐시 훅 없이 실행.
     *
     * @param descriptor 호출할 Provider
     * @param payload 요청 페이로드
     * @return Ok / Retry(재시도 소진) / Fail(영구 오류, 검증 실패)
     * @throws InvocationCancelledException 호출 스레드가 인터럽트된 경우
     */
    public <Q, R> Outcome<R> execute(ProviderDescriptor<Q, R> descriptor, Q payload) {
        return execute(descriptor, payload, Optional::empty);
    }

    /**
     * 재시도 루프 실행.
     *
     * @param descriptor 호출할 Provider
     * @param payload 요청 페이로드
     * @param cachedResponse 재시도 대기 직전마다 조회하는 캐시 훅
     * @return Ok / Retry(재시도 소진) / Fail(영구 오류, 검증 실패)
     * @throws InvocationCancelledException 호출 스레드가 인터럽트된 경우
     */
    public <Q, R> Outcome<R> execute(ProviderDescriptor<Q, R> descriptor, Q payload,
                                     Supplier<Optional<R>> cachedResponse) {
        if (descriptor == null) {
            throw new IllegalArgumentException("descriptor cannot be null");
        }
        if (cachedResponse == null) {
            throw new IllegalArgumentException("cachedResponse cannot be null");
        }

        ProviderName name = descriptor.name();
        int maxAttempts = config.maxAttempts();
        TransientProviderException lastTransient = null;

        for (int attempt = 0; attempt < maxAttempts; attempt++) {
            // 1. 재시도 전: 캐시 훅 조회 후 backoff 대기
            if (attempt > 0) {
                Optional<R> cached = cachedResponse.get();
                if (cached != null && cached.isPresent()) {
                    log.info("Using cached response for {} on {} instead of retry {}/{}",
                        descriptor.capability(), name, attempt + 1, maxAttempts);
                    return Ok.cached(cached.get(), attempt);
                }
                Duration delay = backoffCalculator.calculate(config, attempt - 1);
                log.warn("Retry {}/{} for {} on {} after {}ms: {}",
                    attempt + 1, maxAttempts, descriptor.capability(), name, delay.toMillis(),
                    lastTransient.getMessage());
                sleep(name, delay);
            }

            if (Thread.currentThread().isInterrupted()) {
                throw new InvocationCancelledException("Invocation of " + name + " was cancelled before attempt " + (attempt + 1));
            }

            // 2. Provider 호출
            long startNanos = System.nanoTime();
            try {
                R response = callProvider(descriptor, payload);
                if (!descriptor.validator().isValid(response)) {
                    notify(descriptor, attempt, AttemptResult.PERMANENT_FAILURE, startNanos);
                    return new Fail<>(new InvalidResponseException(name), FailureReason.INVALID_RESPONSE, attempt + 1);
                }
                notify(descriptor, attempt, AttemptResult.SUCCESS, startNanos);
                return Ok.of(response, attempt + 1);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new InvocationCancelledException("Invocation of " + name + " was interrupted", e);
            } catch (InvocationCancelledException e) {
                throw e;
            } catch (Exception e) {
                if (e instanceof InterruptedIOException || Thread.currentThread().isInterrupted()) {
                    Thread.currentThread().interrupt();
                    throw new InvocationCancelledException("Invocation of " + name + " was interrupted", e);
                }

                // 3. 오류 분류
                if (classifier.classify(e) == FailureKind.TRANSIENT) {
                    lastTransient = asTransient(name, e);
                    notify(descriptor, attempt, AttemptResult.TRANSIENT_FAILURE, startNanos);
                } else {
                    notify(descriptor, attempt, AttemptResult.PERMANENT_FAILURE, startNanos);
                    return new Fail<>(asPermanent(name, e), FailureReason.PERMANENT_ERROR, attempt + 1);
                }
            }
        }

        log.debug("Retries exhausted for {} on {} after {} attempts", descriptor.capability(), name, maxAttempts);
        return new Retry<>(lastTransient, maxAttempts);
    }

    /**
     * 재시도 전 대기 시간 조회.
     *
     * @param retryIndex 재시도 인덱스 (0부터 시작)
     * @return 대기 시간
     */
    public Duration delayBefore(int retryIndex) {
        return backoffCalculator.calculate(config, retryIndex);
    }

    public RetryConfig getConfig() {
        return config;
    }

    private <Q, R> R callProvider(ProviderDescriptor<Q, R> descriptor, Q payload) throws Exception {
        if (!config.hasAttemptTimeout()) {
            return descriptor.function().call(payload);
        }

        long timeoutMs = config.attemptTimeout().toMillis();
        Future<R> future = attemptExecutor.submit(() -> descriptor.function().call(payload));
        try {
            return future.get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new TransientProviderException(
                descriptor.name(), "Attempt timed out after " + timeoutMs + "ms", null, e);
        } catch (InterruptedException e) {
            future.cancel(true);
            throw e;
        } catch (ExecutionException e) {
            throw unwrap(descriptor.name(), e);
        }
    }

    // 작업 스레드 인터럽트: 호출자 취소가 아닌 일시적 오류
    private static Exception unwrap(ProviderName name, ExecutionException e) {
        Throwable cause = e.getCause();
        if (cause instanceof InterruptedException || cause instanceof InterruptedIOException) {
            return new TransientProviderException(name, "Attempt worker was interrupted", null, cause);
        }
        if (cause instanceof Exception) {
            return (Exception) cause;
        }
        if (cause instanceof Error) {
            throw (Error) cause;
        }
        return e;
    }

    private void sleep(ProviderName name, Duration delay) {
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InvocationCancelledException("Retry backoff for " + name + " was interrupted", e);
        }
    }

    private void notify(ProviderDescriptor<?, ?> descriptor, int attempt, AttemptResult result, long startNanos) {
        Duration elapsed = Duration.ofNanos(Math.max(0L, System.nanoTime() - startNanos));
        try {
            listener.onAttempt(new InvocationAttempt(descriptor.capability(), descriptor.name(), attempt, result, elapsed));
        } catch (RuntimeException e) {
            log.warn("InvocationListener failed for {} attempt {}", descriptor.name(), attempt + 1, e);
        }
    }

    private static TransientProviderException asTransient(ProviderName name, Exception e) {
        if (e instanceof TransientProviderException) {
            return (TransientProviderException) e;
        }
        return new TransientProviderException(name, messageOf(e), null, e);
    }

    private static PermanentProviderException asPermanent(ProviderName name, Exception e) {
        if (e instanceof PermanentProviderException) {
            return (PermanentProviderException) e;
        }
        return new PermanentProviderException(name, messageOf(e), null, e);
    }

    private static String messageOf(Exception e) {
        String message = e.getMessage();
        return message == null ? e.getClass().getSimpleName() : e.getClass().getSimpleName() + ": " + message;
    }

    private static final class SharedAttemptExecutor {

        private static final AtomicInteger THREAD_COUNT = new AtomicInteger();

        private static final ExecutorService INSTANCE = Executors.newCachedThreadPool(runnable -> {
            Thread thread = new Thread(runnable, ATTEMPT_THREAD_PREFIX + THREAD_COUNT.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }
}
