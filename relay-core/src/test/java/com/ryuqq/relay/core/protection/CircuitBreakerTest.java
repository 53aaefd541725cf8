package com.ryuqq.relay.core.protection;

import com.ryuqq.relay.core.exception.CircuitOpenException;
import com.ryuqq.relay.core.exception.FailureReason;
import com.ryuqq.relay.core.exception.InvocationCancelledException;
import com.ryuqq.relay.core.exception.PermanentProviderException;
import com.ryuqq.relay.core.exception.TransientProviderException;
import com.ryuqq.relay.core.model.ProviderName;
import com.ryuqq.relay.core.outcome.Fail;
import com.ryuqq.relay.core.outcome.Ok;
import com.ryuqq.relay.core.outcome.Outcome;
import com.ryuqq.relay.core.outcome.Retry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Answers;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

/**
 * CircuitBreaker default 메서드(call / execute) 테스트.
 *
 * <p>허용된 호출 1건당 발급받은 permit으로 recordSuccess / recordFailure / releasePermit 중
 * 정확히 하나가 호출되는지 검증합니다.</p>
 *
 * @author Relay Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("CircuitBreaker default 메서드 테스트")
class CircuitBreakerTest {

    private static final ProviderName PROVIDER = ProviderName.of("deepseek");
    private static final CircuitBreakerPermit PERMIT = new CircuitBreakerPermit(PROVIDER, 7L, false);

    @Mock(answer = Answers.CALLS_REAL_METHODS)
    private CircuitBreaker breaker;

    @AfterEach
    void clearInterrupt() {
        Thread.interrupted();
    }

    // ============================================================
    // call(ProviderFunction, payload)
    // ============================================================

    @Test
    void call_허용되면_Provider_결과를_반환하고_성공을_기록함() throws Exception {
        // given
        doReturn(Optional.of(PERMIT)).when(breaker).tryAcquire();

        // when
        String result = breaker.call(prompt -> prompt + " answered", "question");

        // then
        assertThat(result).isEqualTo("question answered");
        verify(breaker).recordSuccess(PERMIT);
        verify(breaker, never()).recordFailure(any(), any());
        verify(breaker, never()).releasePermit(any());
    }

    @Test
    void call_거부되면_Provider를_호출하지_않고_CircuitOpenException() {
        // given
        doReturn(Optional.empty()).when(breaker).tryAcquire();
        doReturn(PROVIDER).when(breaker).providerName();
        AtomicBoolean called = new AtomicBoolean(false);

        // when & then
        assertThatThrownBy(() -> breaker.call(payload -> {
            called.set(true);
            return payload;
        }, "question"))
            .isInstanceOf(CircuitOpenException.class)
            .hasMessageContaining("deepseek");
        assertThat(called).isFalse();
        verify(breaker, never()).recordFailure(any(), any());
    }

    @Test
    void call_Provider_예외는_실패_기록_후_그대로_전파됨() {
        // given
        doReturn(Optional.of(PERMIT)).when(breaker).tryAcquire();
        TransientProviderException error = new TransientProviderException("503");

        // when & then
        assertThatThrownBy(() -> breaker.call(payload -> {
            throw error;
        }, "question")).isSameAs(error);
        verify(breaker).recordFailure(PERMIT, error);
        verify(breaker, never()).recordSuccess(any());
    }

    @Test
    void call_인터럽트되면_permit만_반환하고_InvocationCancelledException() {
        // given
        doReturn(Optional.of(PERMIT)).when(breaker).tryAcquire();
        doReturn(PROVIDER).when(breaker).providerName();

        // when & then
        assertThatThrownBy(() -> breaker.call(payload -> {
            throw new InterruptedException();
        }, "question")).isInstanceOf(InvocationCancelledException.class);
        assertThat(Thread.currentThread().isInterrupted()).isTrue();
        verify(breaker).releasePermit(PERMIT);
        verify(breaker, never()).recordFailure(any(), any());
        verify(breaker, never()).recordSuccess(any());
    }

    // ============================================================
    // execute(Supplier<Outcome>)
    // ============================================================

    @Test
    void execute_Ok이면_성공_기록() {
        // given
        doReturn(Optional.of(PERMIT)).when(breaker).tryAcquire();

        // when
        Outcome<String> outcome = breaker.execute(() -> Ok.of("answer", 2));

        // then
        assertThat(outcome.isOk()).isTrue();
        verify(breaker).recordSuccess(PERMIT);
    }

    @Test
    void execute_캐시_결과이면_permit만_반환() {
        // given
        doReturn(Optional.of(PERMIT)).when(breaker).tryAcquire();

        // when
        Outcome<String> outcome = breaker.execute(() -> Ok.cached("cached", 1));

        // then
        assertThat(((Ok<String>) outcome).fromCache()).isTrue();
        verify(breaker).releasePermit(PERMIT);
        verify(breaker, never()).recordSuccess(any());
        verify(breaker, never()).recordFailure(any(), any());
    }

    @Test
    void execute_재시도_소진이면_실패_1회_기록() {
        // given
        doReturn(Optional.of(PERMIT)).when(breaker).tryAcquire();
        TransientProviderException error = new TransientProviderException("429");

        // when
        Outcome<String> outcome = breaker.execute(() -> new Retry<>(error, 3));

        // then
        assertThat(outcome.isRetry()).isTrue();
        verify(breaker).recordFailure(PERMIT, error);
    }

    @Test
    void execute_영구_실패이면_실패_기록() {
        // given
        doReturn(Optional.of(PERMIT)).when(breaker).tryAcquire();
        PermanentProviderException error = new PermanentProviderException("401");

        // when
        breaker.execute(() -> new Fail<>(error, FailureReason.PERMANENT_ERROR, 1));

        // then
        verify(breaker).recordFailure(PERMIT, error);
    }

    @Test
    void execute_거부되면_호출하지_않고_rejected_반환() {
        // given
        doReturn(Optional.empty()).when(breaker).tryAcquire();
        doReturn(PROVIDER).when(breaker).providerName();
        AtomicBoolean called = new AtomicBoolean(false);

        // when
        Outcome<String> outcome = breaker.execute(() -> {
            called.set(true);
            return Ok.of("answer", 1);
        });

        // then
        assertThat(called).isFalse();
        assertThat(outcome).isInstanceOf(Fail.class);
        assertThat(((Fail<String>) outcome).reason()).isEqualTo(FailureReason.CIRCUIT_OPEN);
        assertThat(outcome.attempts()).isZero();
    }

    @Test
    void execute_취소되면_permit만_반환하고_전파() {
        // given
        doReturn(Optional.of(PERMIT)).when(breaker).tryAcquire();

        // when & then
        assertThatThrownBy(() -> breaker.execute(() -> {
            throw new InvocationCancelledException("cancelled");
        })).isInstanceOf(InvocationCancelledException.class);
        verify(breaker).releasePermit(PERMIT);
        verify(breaker, never()).recordFailure(any(), any());
    }

    @Test
    void execute_예상치_못한_런타임_예외는_실패_기록_후_전파() {
        // given
        doReturn(Optional.of(PERMIT)).when(breaker).tryAcquire();
        IllegalStateException error = new IllegalStateException("bug");

        // when & then
        assertThatThrownBy(() -> breaker.execute(() -> {
            throw error;
        })).isSameAs(error);
        verify(breaker).recordFailure(PERMIT, error);
        verify(breaker, never()).releasePermit(any());
    }
}
