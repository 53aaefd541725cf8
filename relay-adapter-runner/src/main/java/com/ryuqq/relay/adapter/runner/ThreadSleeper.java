package com.ryuqq.relay.adapter.runner;

import com.ryuqq.relay.core.spi.Sleeper;

import java.time.Duration;

/**
 * {@link Thread#sleep(long, int)} 기반 Sleeper.
 *
 * <p>호출 스레드만 대기시키며, 인터럽트 시 {@link InterruptedException}을 그대로 전파합니다.</p>
 *
 * @author Relay Team
 * @since 1.0.0
 */
public final class ThreadSleeper implements Sleeper {

    @Override
    public void sleep(Duration duration) throws InterruptedException {
        if (duration == null) {
            throw new IllegalArgumentException("duration cannot be null");
        }
        if (duration.isZero() || duration.isNegative()) {
            return;
        }
        long millis = duration.toMillis();
        int nanos = (int) (duration.minusMillis(millis).toNanos());
        Thread.sleep(millis, nanos);
    }
}
