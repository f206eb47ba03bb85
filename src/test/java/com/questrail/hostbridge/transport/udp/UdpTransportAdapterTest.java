package com.questrail.hostbridge.transport.udp;

import com.questrail.hostbridge.api.RecordingHostApi;
import com.questrail.hostbridge.api.Transport;
import com.questrail.hostbridge.codec.impl.JacksonCommandDecoder;
import com.questrail.hostbridge.command.CommandClassifier;
import com.questrail.hostbridge.command.CommandKind;
import com.questrail.hostbridge.dispatch.CommandDispatcher;
import com.questrail.hostbridge.internal.exec.ExecutionSerializer;
import com.questrail.hostbridge.model.ErrorKind;
import com.questrail.hostbridge.observability.CommandRejectedEvent;
import com.questrail.hostbridge.observability.RecordingObservabilitySink;
import com.questrail.hostbridge.observability.TransportObservabilityEvent;
import com.questrail.hostbridge.time.DeterministicScheduler;
import com.questrail.hostbridge.time.ManualMonotonicClock;
import com.questrail.hostbridge.transport.FakeDatagramEndpoint;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class UdpTransportAdapterTest {

    private static final SocketAddress SENDER = new InetSocketAddress("127.0.0.1", 41000);

    private RecordingHostApi host;
    private RecordingObservabilitySink sink;
    private ExecutionSerializer serializer;
    private FakeDatagramEndpoint endpoint;
    private UdpTransportAdapter adapter;

    @BeforeEach
    void setUp() {
        host = new RecordingHostApi();
        sink = new RecordingObservabilitySink();
        serializer = new ExecutionSerializer(host, sink);
        ManualMonotonicClock clock = new ManualMonotonicClock();
        CommandDispatcher dispatcher = new CommandDispatcher(
                CommandClassifier.defaultTable(), serializer, new DeterministicScheduler(clock), clock,
                () -> Instant.EPOCH, Duration.ofSeconds(10), sink);
        endpoint = new FakeDatagramEndpoint();
        adapter = new UdpTransportAdapter(dispatcher, endpoint, new JacksonCommandDecoder(), () -> Instant.EPOCH, sink);

        serializer.start();
        adapter.start();
    }

    @AfterEach
    void tearDown() {
        adapter.stop();
        serializer.shutdown(Duration.ofSeconds(1));
    }

    @Test
    void eligibleDatagramInvokesTheHostExactlyOnce() throws Exception {
        host.expectCalls(1);

        endpoint.injectDatagram(SENDER, "{\"type\":\"set_track_volume\",\"params\":{\"track_index\":0,\"volume\":0.6}}");

        assertTrue(host.awaitCalls(2, TimeUnit.SECONDS));
        // Settle: nothing else may follow.
        serializer.shutdown(Duration.ofSeconds(1));
        assertEquals(List.of(CommandKind.SET_TRACK_VOLUME), host.kinds());
        assertEquals(0.6, host.calls().get(0).parameters().get("volume"));
    }

    @Test
    void criticalCommandOverUdpIsNeverExecuted() {
        endpoint.injectDatagram(SENDER, "{\"type\":\"delete_track\",\"params\":{\"track\":0}}");
        serializer.shutdown(Duration.ofSeconds(1));

        assertTrue(host.calls().isEmpty());
        assertTrue(sink.executions().isEmpty(), "nothing may be reported as executed");

        CommandRejectedEvent rejected = sink.rejections().get(0);
        assertEquals(ErrorKind.TRANSPORT_NOT_ALLOWED, rejected.kind());
        assertEquals(SENDER, rejected.remote());
    }

    @Test
    void malformedDatagramsAreDroppedAndTheLoopKeepsGoing() throws Exception {
        host.expectCalls(1);

        endpoint.injectDatagram(SENDER, "{\"type\":\"set_track_mute\"");
        endpoint.injectDatagram(SENDER, "not json at all");
        endpoint.injectDatagram(SENDER, new byte[0]);
        endpoint.injectDatagram(SENDER, "{\"type\":\"no_such_command\"}");
        endpoint.injectDatagram(SENDER, "{\"type\":\"set_track_mute\",\"params\":{\"track_index\":1,\"mute\":true}}");

        assertTrue(host.awaitCalls(2, TimeUnit.SECONDS));
        assertEquals(List.of(CommandKind.SET_TRACK_MUTE), host.kinds());

        List<ErrorKind> kinds = sink.rejections().stream().map(CommandRejectedEvent::kind).toList();
        assertEquals(List.of(ErrorKind.PARSE_ERROR, ErrorKind.PARSE_ERROR, ErrorKind.PARSE_ERROR,
                ErrorKind.UNKNOWN_COMMAND), kinds);
        assertTrue(sink.rejections().stream().allMatch(r -> r.transport() == Transport.UDP));
    }

    @Test
    void burstIsExecutedInArrivalOrder() throws Exception {
        host.expectCalls(50);

        for (int i = 0; i < 50; i++) {
            endpoint.injectDatagram(SENDER,
                    "{\"type\":\"set_device_parameter\",\"params\":{\"parameter_index\":" + i + "}}");
        }

        assertTrue(host.awaitCalls(2, TimeUnit.SECONDS));
        for (int i = 0; i < 50; i++) {
            assertEquals(i, host.calls().get(i).parameters().get("parameter_index"));
        }
    }

    @Test
    void lifecycleIsReported() {
        adapter.stop();

        List<TransportObservabilityEvent> events = sink.eventsOfType(TransportObservabilityEvent.class);
        assertEquals(TransportObservabilityEvent.Kind.UP, events.get(0).kind());
        assertEquals(FakeDatagramEndpoint.LOCAL, events.get(0).address());
        assertEquals(TransportObservabilityEvent.Kind.DOWN, events.get(1).kind());
        assertTrue(events.stream().allMatch(e -> e.transport() == Transport.UDP));
    }
}
