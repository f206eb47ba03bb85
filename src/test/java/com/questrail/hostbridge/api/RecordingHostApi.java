package com.questrail.hostbridge.api;

import com.questrail.hostbridge.command.CommandKind;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Test host that records every call in order.
 *
 * <p>Answers with {@code {"command": <name>, "call": <n>}} unless a behaviour
 * is installed for the command. Fails the test run (via {@link #overlapDetected()})
 * if two calls ever overlap.</p>
 */
public final class RecordingHostApi implements HostApi {

    public record Call(CommandKind kind, Map<String, Object> parameters, String threadName) {}

    @FunctionalInterface
    public interface Behaviour {
        Map<String, Object> apply(Map<String, Object> parameters) throws HostException;
    }

    private final List<Call> calls = new ArrayList<>();
    private final Map<CommandKind, Behaviour> behaviours = new ConcurrentHashMap<>();
    private final AtomicInteger inFlight = new AtomicInteger();
    private volatile boolean overlap;
    private volatile CountDownLatch callLatch = new CountDownLatch(0);

    public RecordingHostApi on(CommandKind kind, Behaviour behaviour) {
        behaviours.put(kind, behaviour);
        return this;
    }

    /**
     * Arm a latch released after {@code count} more calls complete.
     */
    public void expectCalls(int count) {
        callLatch = new CountDownLatch(count);
    }

    public boolean awaitCalls(long timeout, TimeUnit unit) throws InterruptedException {
        return callLatch.await(timeout, unit);
    }

    @Override
    public Map<String, Object> invoke(CommandKind kind, Map<String, Object> parameters) throws HostException {
        if (inFlight.incrementAndGet() > 1) {
            overlap = true;
        }
        int callNumber;
        synchronized (calls) {
            calls.add(new Call(kind, parameters, Thread.currentThread().getName()));
            callNumber = calls.size();
        }
        try {
            Behaviour behaviour = behaviours.get(kind);
            if (behaviour != null) {
                return behaviour.apply(parameters);
            }
            return Map.of("command", kind.wireName(), "call", callNumber);
        } finally {
            inFlight.decrementAndGet();
            callLatch.countDown();
        }
    }

    public List<Call> calls() {
        synchronized (calls) {
            return new ArrayList<>(calls);
        }
    }

    public List<CommandKind> kinds() {
        return calls().stream().map(Call::kind).toList();
    }

    public boolean overlapDetected() {
        return overlap;
    }
}
