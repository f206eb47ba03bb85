package com.questrail.hostbridge.dispatch;

import com.questrail.hostbridge.api.Transport;
import com.questrail.hostbridge.command.ClassificationEntry;
import com.questrail.hostbridge.command.CommandClassifier;
import com.questrail.hostbridge.command.CommandRequest;
import com.questrail.hostbridge.internal.exec.ExecutionSerializer;
import com.questrail.hostbridge.internal.exec.ExecutionTask;
import com.questrail.hostbridge.internal.time.Cancellable;
import com.questrail.hostbridge.internal.time.MonotonicClock;
import com.questrail.hostbridge.internal.time.MonotonicScheduler;
import com.questrail.hostbridge.internal.time.WallClock;
import com.questrail.hostbridge.model.CommandResponse;
import com.questrail.hostbridge.model.ErrorKind;
import com.questrail.hostbridge.observability.CommandRejectedEvent;
import com.questrail.hostbridge.observability.HostBridgeErrorEvent;
import com.questrail.hostbridge.observability.HostBridgeObservabilitySink;
import com.questrail.hostbridge.observability.NullObservabilitySink;

import java.net.SocketAddress;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/**
 * CommandDispatcher
 * =============================================================================
 * Transport-neutral front door to the {@link ExecutionSerializer}.
 *
 * <h2>Inbound path</h2>
 * <pre>
 *   CommandRequest
 *        → CommandClassifier      (unknown / not allowed → rejected here)
 *            → ExecutionTask
 *                → ExecutionSerializer queue
 * </pre>
 *
 * <h2>Request/response (TCP)</h2>
 * {@link #request} returns a stage that completes exactly once: with the host
 * outcome, with an immediate rejection, or with {@link ErrorKind#TIMEOUT} once
 * the response timeout elapses. A timeout does not cancel the queued task; it
 * still executes and its outcome is discarded.
 *
 * <h2>Fire-and-forget (UDP)</h2>
 * {@link #fireAndForget} never waits and never produces a response. Rejections
 * are only reported to observability.
 */
public final class CommandDispatcher
{
    public static final Duration DEFAULT_RESPONSE_TIMEOUT = Duration.ofSeconds(10);

    static final String TIMEOUT_MESSAGE = "Timeout waiting for operation to complete";

    private final CommandClassifier classifier;
    private final ExecutionSerializer serializer;
    private final MonotonicScheduler scheduler;
    private final MonotonicClock clock;
    private final WallClock wallClock;
    private final Duration responseTimeout;
    private final HostBridgeObservabilitySink observabilitySink;

    public CommandDispatcher(CommandClassifier classifier,
                             ExecutionSerializer serializer,
                             MonotonicScheduler scheduler,
                             MonotonicClock clock,
                             WallClock wallClock,
                             Duration responseTimeout,
                             HostBridgeObservabilitySink observabilitySink)
    {
        this.classifier = Objects.requireNonNull(classifier, "classifier");
        this.serializer = Objects.requireNonNull(serializer, "serializer");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.responseTimeout = Objects.requireNonNull(responseTimeout, "responseTimeout");
        this.observabilitySink = Objects.requireNonNullElse(observabilitySink, NullObservabilitySink.INSTANCE);

        if (responseTimeout.isNegative() || responseTimeout.isZero()) {
            throw new IllegalArgumentException("responseTimeout must be positive");
        }
    }

    /**
     * Classify a request against the table for the transport it arrived on.
     */
    public Admission admit(CommandRequest request)
    {
        Objects.requireNonNull(request, "request");

        Optional<ClassificationEntry> entry = classifier.classify(request.name());
        if (entry.isEmpty()) {
            return new Admission.Rejected(CommandResponse.failure(
                    ErrorKind.UNKNOWN_COMMAND, "Unknown command: " + request.name()));
        }
        if (!entry.get().allows(request.transport())) {
            return new Admission.Rejected(CommandResponse.failure(
                    ErrorKind.TRANSPORT_NOT_ALLOWED,
                    "Command '" + request.name() + "' is not allowed over " + request.transport()));
        }
        return new Admission.Admitted(request.toCommand(entry.get().kind()));
    }

    /**
     * Submit a request whose outcome the caller will wait for.
     *
     * @param remote caller address, for observability; may be {@code null}
     * @return a stage completed exactly once, never exceptionally
     */
    public CompletionStage<CommandResponse> request(CommandRequest request, SocketAddress remote)
    {
        Admission admission = admit(request);
        if (admission instanceof Admission.Rejected rejected) {
            reportRejected(request.transport(), request.name(), rejected.failure(), remote);
            return CompletableFuture.completedFuture(rejected.failure());
        }

        ExecutionTask.Correlated task = ExecutionTask.correlated(((Admission.Admitted) admission).command());
        CompletableFuture<CommandResponse> response = new CompletableFuture<>();

        Cancellable timeout = scheduler.scheduleAfter(responseTimeout, clock, () -> {
            if (response.complete(CommandResponse.failure(ErrorKind.TIMEOUT, TIMEOUT_MESSAGE))) {
                observabilitySink.onError(new HostBridgeErrorEvent(
                        wallClock.now(),
                        "Timed out after " + responseTimeout.toMillis() + " ms waiting for " + request.name(),
                        null));
            }
        });

        task.completion().whenComplete((outcome, failure) -> {
            timeout.cancel();
            response.complete(outcome != null
                    ? outcome
                    : CommandResponse.failure(ErrorKind.HOST_ERROR, String.valueOf(failure)));
        });

        if (!serializer.submit(task)) {
            reportRejected(request.transport(), request.name(),
                    CommandResponse.failure(ErrorKind.UNAVAILABLE, "Host bridge is not accepting commands"), remote);
        }
        return response;
    }

    /**
     * Submit a request nobody waits for.
     *
     * @return {@code true} if the command was queued for execution
     */
    public boolean fireAndForget(CommandRequest request, SocketAddress remote)
    {
        Admission admission = admit(request);
        if (admission instanceof Admission.Rejected rejected) {
            reportRejected(request.transport(), request.name(), rejected.failure(), remote);
            return false;
        }

        if (!serializer.submit(ExecutionTask.fireAndForget(((Admission.Admitted) admission).command()))) {
            reportRejected(request.transport(), request.name(),
                    CommandResponse.failure(ErrorKind.UNAVAILABLE, "Host bridge is not accepting commands"), remote);
            return false;
        }
        return true;
    }

    /**
     * Record a message that could not be decoded and build the envelope a
     * request/response transport should send back.
     */
    public CommandResponse.Failure rejectMalformed(Transport transport, String reason, SocketAddress remote)
    {
        CommandResponse.Failure failure = CommandResponse.failure(ErrorKind.PARSE_ERROR, reason);
        reportRejected(transport, null, failure, remote);
        return failure;
    }

    public Duration responseTimeout()
    {
        return responseTimeout;
    }

    private void reportRejected(Transport transport,
                                String commandName,
                                CommandResponse.Failure failure,
                                SocketAddress remote)
    {
        observabilitySink.onCommandRejected(new CommandRejectedEvent(
                wallClock.now(),
                transport,
                commandName,
                failure.kind(),
                failure.message(),
                remote));
    }
}
