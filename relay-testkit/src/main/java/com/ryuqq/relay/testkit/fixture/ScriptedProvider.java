package com.ryuqq.relay.testkit.fixture;

import com.ryuqq.relay.core.spi.ProviderFunction;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * {@link ProviderFunction} that plays back a script of results and errors.
 *
 * <p>Each call consumes the next step. Once the script is exhausted the last step repeats.</p>
 *
 * <pre>{@code
 * ScriptedProvider<String, String> provider = ScriptedProvider.<String, String>create()
 *     .thenThrow(new TransientProviderException("429"))
 *     .thenReturn("answer");
 * }</pre>
 *
 * @param <Q> request payload type
 * @param <R> response type
 * @author Relay Team
 * @since 1.0.0
 */
public final class ScriptedProvider<Q, R> implements ProviderFunction<Q, R> {

    /**
     * One scripted call.
     *
     * @param <Q> request payload type
     * @param <R> response type
     */
    @FunctionalInterface
    public interface Step<Q, R> {
        R run(Q payload) throws Exception;
    }

    private final List<Step<Q, R>> steps = new ArrayList<>();
    private final List<Q> payloads = new CopyOnWriteArrayList<>();
    private final AtomicInteger calls = new AtomicInteger();

    private ScriptedProvider() {
    }

    public static <Q, R> ScriptedProvider<Q, R> create() {
        return new ScriptedProvider<>();
    }

    public static <Q, R> ScriptedProvider<Q, R> alwaysReturning(R response) {
        return ScriptedProvider.<Q, R>create().thenReturn(response);
    }

    public static <Q, R> ScriptedProvider<Q, R> alwaysThrowing(Exception error) {
        return ScriptedProvider.<Q, R>create().thenThrow(error);
    }

    public synchronized ScriptedProvider<Q, R> thenReturn(R response) {
        steps.add(payload -> response);
        return this;
    }

    public synchronized ScriptedProvider<Q, R> thenThrow(Exception error) {
        if (error == null) {
            throw new IllegalArgumentException("error cannot be null");
        }
        steps.add(payload -> {
            throw error;
        });
        return this;
    }

    public synchronized ScriptedProvider<Q, R> thenAnswer(Step<Q, R> step) {
        if (step == null) {
            throw new IllegalArgumentException("step cannot be null");
        }
        steps.add(step);
        return this;
    }

    @Override
    public R call(Q payload) throws Exception {
        int index = calls.getAndIncrement();
        payloads.add(payload);
        Step<Q, R> step;
        synchronized (this) {
            if (steps.isEmpty()) {
                throw new IllegalStateException("ScriptedProvider has no scripted steps");
            }
            step = steps.get(Math.min(index, steps.size() - 1));
        }
        return step.run(payload);
    }

    public int getCallCount() {
        return calls.get();
    }

    public List<Q> getPayloads() {
        return Collections.unmodifiableList(new ArrayList<>(payloads));
    }
}
