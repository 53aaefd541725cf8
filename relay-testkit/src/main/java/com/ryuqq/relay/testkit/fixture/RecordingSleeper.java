package com.ryuqq.relay.testkit.fixture;

import com.ryuqq.relay.core.spi.Sleeper;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * {@link Sleeper} that records requested delays instead of blocking.
 *
 * <p>Optionally advances a {@link ManualClock} by each delay, and can be told to
 * raise {@link InterruptedException} on a given sleep to simulate cancellation.</p>
 *
 * @author Relay Team
 * @since 1.0.0
 */
public final class RecordingSleeper implements Sleeper {

    private final ManualClock clock;
    private final List<Duration> sleeps = Collections.synchronizedList(new ArrayList<>());
    private volatile int interruptAt = -1;

    public RecordingSleeper() {
        this(null);
    }

    /**
     * @param clock clock advanced by every recorded delay (nullable)
     */
    public RecordingSleeper(ManualClock clock) {
        this.clock = clock;
    }

    /**
     * Makes the sleep with the given 0-based index throw {@link InterruptedException}.
     *
     * @param sleepIndex index of the sleep to interrupt
     * @return this sleeper
     */
    public RecordingSleeper interruptOnSleep(int sleepIndex) {
        if (sleepIndex < 0) {
            throw new IllegalArgumentException("sleepIndex must be non-negative (current: " + sleepIndex + ")");
        }
        this.interruptAt = sleepIndex;
        return this;
    }

    @Override
    public void sleep(Duration duration) throws InterruptedException {
        int index;
        synchronized (sleeps) {
            index = sleeps.size();
            sleeps.add(duration);
        }
        if (index == interruptAt) {
            throw new InterruptedException("sleep " + index + " interrupted");
        }
        if (clock != null) {
            clock.advance(duration);
        }
    }

    public List<Duration> getSleeps() {
        synchronized (sleeps) {
            return List.copyOf(sleeps);
        }
    }

    public int getSleepCount() {
        return sleeps.size();
    }

    public Duration totalSlept() {
        return getSleeps().stream().reduce(Duration.ZERO, Duration::plus);
    }
}
