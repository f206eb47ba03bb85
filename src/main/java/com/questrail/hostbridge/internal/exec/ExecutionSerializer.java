package com.questrail.hostbridge.internal.exec;

import com.questrail.hostbridge.api.HostApi;
import com.questrail.hostbridge.api.HostException;
import com.questrail.hostbridge.command.Command;
import com.questrail.hostbridge.internal.time.MonotonicClock;
import com.questrail.hostbridge.internal.time.SystemMonotonicClock;
import com.questrail.hostbridge.internal.time.SystemWallClock;
import com.questrail.hostbridge.internal.time.WallClock;
import com.questrail.hostbridge.model.CommandResponse;
import com.questrail.hostbridge.model.ErrorKind;
import com.questrail.hostbridge.observability.CommandExecutionEvent;
import com.questrail.hostbridge.observability.HostBridgeErrorEvent;
import com.questrail.hostbridge.observability.HostBridgeObservabilitySink;
import com.questrail.hostbridge.observability.NullObservabilitySink;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * ExecutionSerializer
 * =============================================================================
 * The single consumer of the task queue and the <strong>only</strong> caller of
 * the {@link HostApi}.
 *
 * <h2>Threading Model</h2>
 * One dedicated thread takes tasks from an unbounded FIFO queue and runs each
 * to completion before starting the next. Any number of producer threads may
 * {@link #submit} concurrently. This guarantees:
 * <ul>
 *   <li>No two host calls ever overlap</li>
 *   <li>Host calls happen in exactly the order tasks were enqueued, whatever
 *       transport they came from</li>
 *   <li>A slow host call delays everything queued behind it</li>
 * </ul>
 *
 * <h2>Ownership</h2>
 * The host is handed over at construction and never exposed again.
 *
 * <h2>Failure isolation</h2>
 * A {@link HostException}, or any other throwable escaping the host
 * (including {@link Error}s such as {@link StackOverflowError}), is converted
 * into a {@link CommandResponse.Failure}. Nothing thrown by a single task stops
 * the loop.
 *
 * <h2>Lifecycle</h2>
 * <pre>
 *   NEW --start()--> RUNNING --shutdown()--> DRAINING --queue empty--> STOPPED
 *                                                   \--grace expired--/
 * </pre>
 * Once {@code DRAINING}, new submissions are refused. Tasks still queued when
 * the grace period expires are failed with {@link ErrorKind#UNAVAILABLE}.
 */
public final class ExecutionSerializer {

    public enum State {
        NEW,
        RUNNING,
        DRAINING,
        STOPPED
    }

    private static final long POLL_INTERVAL_MILLIS = 50;
    private static final Duration FORCED_STOP_JOIN = Duration.ofSeconds(1);

    private final HostApi host;
    private final MonotonicClock clock;
    private final WallClock wallClock;
    private final HostBridgeObservabilitySink observabilitySink;

    private final BlockingQueue<Queued> queue = new LinkedBlockingQueue<>();
    private final Object lifecycleLock = new Object();
    private final AtomicLong executedCount = new AtomicLong();

    private volatile State state = State.NEW;
    private volatile Thread worker;
    private long nextSequence = 1; // guarded by lifecycleLock

    private record Queued(long sequence, ExecutionTask task, long enqueuedNanos) {}

    public ExecutionSerializer(HostApi host,
                               MonotonicClock clock,
                               WallClock wallClock,
                               HostBridgeObservabilitySink observabilitySink)
    {
        this.host = Objects.requireNonNull(host, "host");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.observabilitySink = Objects.requireNonNullElse(observabilitySink, NullObservabilitySink.INSTANCE);
    }

    public ExecutionSerializer(HostApi host, HostBridgeObservabilitySink observabilitySink)
    {
        this(host, SystemMonotonicClock.INSTANCE, SystemWallClock.INSTANCE, observabilitySink);
    }

    /**
     * Starts the serializer thread.
     * Idempotent: only the first call on a {@code NEW} serializer has an effect.
     */
    public void start() {
        synchronized (lifecycleLock) {
            if (state != State.NEW) {
                return;
            }
            state = State.RUNNING;
            Thread thread = new Thread(this::runLoop, "host-bridge-serializer");
            worker = thread;
            thread.start();
        }
    }

    /**
     * Enqueue a task behind everything submitted before it.
     *
     * <p>Safe to call from any thread. If the serializer is not running the task
     * is refused; a refused correlated task is completed immediately with
     * {@link ErrorKind#UNAVAILABLE}.</p>
     *
     * @return {@code true} if the task was queued
     */
    public boolean submit(ExecutionTask task) {
        Objects.requireNonNull(task, "task");
        synchronized (lifecycleLock) {
            if (state == State.RUNNING) {
                queue.add(new Queued(nextSequence++, task, clock.nowNanos()));
                return true;
            }
        }
        if (task instanceof ExecutionTask.Correlated correlated) {
            correlated.complete(CommandResponse.failure(ErrorKind.UNAVAILABLE, "Host bridge is not accepting commands"));
        }
        return false;
    }

    /**
     * Stop admitting tasks, let the queue drain for up to {@code gracePeriod},
     * then stop the thread.
     *
     * <p>Idempotent and safe to call when nothing is queued. Blocks until the
     * serializer thread has exited or could not be stopped.</p>
     *
     * @return number of queued tasks that were abandoned without execution
     */
    public int shutdown(Duration gracePeriod) {
        Objects.requireNonNull(gracePeriod, "gracePeriod");

        Thread thread;
        synchronized (lifecycleLock) {
            if (state == State.NEW) {
                state = State.STOPPED;
                return 0;
            }
            if (state == State.RUNNING) {
                state = State.DRAINING;
            }
            thread = worker;
        }

        if (thread != null && thread != Thread.currentThread()) {
            join(thread, gracePeriod);
            if (thread.isAlive()) {
                state = State.STOPPED;
                thread.interrupt();
                join(thread, FORCED_STOP_JOIN);
            }
        }
        state = State.STOPPED;
        return abandonQueued();
    }

    public State state() {
        return state;
    }

    public boolean isRunning() {
        return state == State.RUNNING;
    }

    public int queuedTaskCount() {
        return queue.size();
    }

    public long executedCount() {
        return executedCount.get();
    }

    /**
     * Main loop - runs on the serializer thread.
     */
    private void runLoop() {
        while (true) {
            // Read the state before polling: an empty poll while DRAINING means nothing more can arrive.
            State observed = state;
            if (observed == State.STOPPED) {
                return;
            }

            final Queued next;
            try {
                next = queue.poll(POLL_INTERVAL_MILLIS, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                // Only shutdown() ends the loop; a stray interrupt while running is not a stop request.
                if (state == State.RUNNING) {
                    continue;
                }
                Thread.currentThread().interrupt();
                return;
            }

            if (next == null) {
                if (observed == State.DRAINING) {
                    return;
                }
                continue;
            }

            try {
                execute(next);
            } catch (Throwable t) {
                // Last resort: the loop outlives anything a single task throws.
                if (next.task() instanceof ExecutionTask.Correlated correlated) {
                    correlated.complete(CommandResponse.failure(ErrorKind.HOST_ERROR, describe(t)));
                }
                observabilitySink.onError(new HostBridgeErrorEvent(
                    wallClock.now(),
                    "Task processing error",
                    t
                ));
            }
        }
    }

    /**
     * Invokes the host for one task and routes the outcome.
     */
    private void execute(Queued queued) {
        Command command = queued.task().command();

        long startedNanos = clock.nowNanos();
        CommandResponse outcome = invokeHost(command);
        long finishedNanos = clock.nowNanos();
        executedCount.incrementAndGet();

        // Write the handle first so the waiting caller is released before observability runs.
        if (queued.task() instanceof ExecutionTask.Correlated correlated) {
            correlated.complete(outcome);
        }

        observabilitySink.onCommandExecuted(new CommandExecutionEvent(
            wallClock.now(),
            queued.sequence(),
            command,
            outcome,
            Duration.ofNanos(Math.max(0, startedNanos - queued.enqueuedNanos())),
            Duration.ofNanos(Math.max(0, finishedNanos - startedNanos))
        ));
    }

    private CommandResponse invokeHost(Command command) {
        try {
            Map<String, Object> result = host.invoke(command.kind(), command.parameters());
            return CommandResponse.success(result);
        } catch (HostException e) {
            return CommandResponse.failure(ErrorKind.HOST_ERROR, describe(e));
        } catch (Throwable t) {
            // Errors included: a host that overflows its stack or fails class init must not stop the loop.
            observabilitySink.onError(new HostBridgeErrorEvent(
                wallClock.now(),
                "Host raised an unexpected exception for " + command.name(),
                t
            ));
            return CommandResponse.failure(ErrorKind.HOST_ERROR, describe(t));
        }
    }

    private int abandonQueued() {
        List<Queued> leftovers = new ArrayList<>();
        queue.drainTo(leftovers);
        for (Queued queued : leftovers) {
            if (queued.task() instanceof ExecutionTask.Correlated correlated) {
                correlated.complete(CommandResponse.failure(
                    ErrorKind.UNAVAILABLE, "Host bridge shut down before the command was executed"));
            }
        }
        if (!leftovers.isEmpty()) {
            observabilitySink.onError(new HostBridgeErrorEvent(
                wallClock.now(),
                leftovers.size() + " queued command(s) abandoned at shutdown",
                null
            ));
        }
        return leftovers.size();
    }

    private static String describe(Throwable t) {
        String message = t.getMessage();
        return message == null || message.isBlank() ? t.getClass().getSimpleName() : message;
    }

    private static void join(Thread thread, Duration timeout) {
        try {
            thread.join(Math.max(1, timeout.toMillis()));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
