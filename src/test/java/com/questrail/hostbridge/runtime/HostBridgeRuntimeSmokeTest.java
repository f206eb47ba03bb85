package com.questrail.hostbridge.runtime;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.questrail.hostbridge.api.HostApi;
import com.questrail.hostbridge.api.RecordingHostApi;
import com.questrail.hostbridge.command.CommandKind;
import com.questrail.hostbridge.config.HostBridgeConfig;
import com.questrail.hostbridge.internal.exec.ExecutionSerializer;
import com.questrail.hostbridge.observability.RecordingObservabilitySink;
import com.questrail.hostbridge.observability.TransportObservabilityEvent;
import com.questrail.hostbridge.sim.SimulatedSessionHost;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.net.DatagramPacket;
import java.net.DatagramSocket;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Set;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end over real loopback sockets on ephemeral ports.
 */
class HostBridgeRuntimeSmokeTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final RecordingObservabilitySink sink = new RecordingObservabilitySink();
    private HostBridgeRuntime runtime;

    @AfterEach
    void tearDown() {
        if (runtime != null) {
            runtime.stop();
        }
    }

    private HostBridgeRuntime start(HostApi host) {
        HostBridgeConfig config = HostBridgeConfig.builder()
            .withTcpPort(0)
            .withUdpPort(0)
            .withShutdownGracePeriod(Duration.ofSeconds(1))
            .build();

        runtime = HostBridgeRuntime.builder()
            .withConfig(config)
            .withHost(host)
            .withObservabilitySink(sink)
            .build();
        runtime.start();
        return runtime;
    }

    private static final class Client implements AutoCloseable {
        private final Socket socket;
        private final BufferedReader reader;
        private final OutputStream out;

        Client(InetSocketAddress address) throws IOException {
            socket = new Socket(address.getAddress(), address.getPort());
            socket.setSoTimeout(5_000);
            reader = new BufferedReader(new InputStreamReader(socket.getInputStream(), StandardCharsets.UTF_8));
            out = socket.getOutputStream();
        }

        void send(String text) throws IOException {
            out.write(text.getBytes(StandardCharsets.UTF_8));
            out.flush();
        }

        String readLine() throws IOException {
            return reader.readLine();
        }

        @Override
        public void close() throws IOException {
            socket.close();
        }
    }

    private JsonNode call(Client client, String json) throws IOException {
        client.send(json);
        return mapper.readTree(client.readLine());
    }

    private static void sendDatagram(InetSocketAddress address, String json) throws IOException {
        byte[] bytes = json.getBytes(StandardCharsets.UTF_8);
        try (DatagramSocket socket = new DatagramSocket()) {
            socket.send(new DatagramPacket(bytes, bytes.length, address.getAddress(), address.getPort()));
        }
    }

    @Test
    void twoTcpClientsGetTheirOwnCorrelatedResults() throws Exception {
        RecordingHostApi host = new RecordingHostApi();
        start(host);
        InetSocketAddress tcp = (InetSocketAddress) runtime.tcpAddress();

        try (Client a = new Client(tcp); Client b = new Client(tcp)) {
            a.send("{\"type\":\"get_session_info\"}");
            b.send("{\"type\":\"get_session_info\"}");

            JsonNode ra = mapper.readTree(a.readLine());
            JsonNode rb = mapper.readTree(b.readLine());

            assertEquals("success", ra.get("status").asText());
            assertEquals("success", rb.get("status").asText());
            assertEquals(Set.of(1, 2), Set.of(ra.get("result").get("call").asInt(), rb.get("result").get("call").asInt()));
        }
        assertFalse(host.overlapDetected());
    }

    @Test
    void messageSplitAcrossWritesIsAnsweredOnce() throws Exception {
        start(new RecordingHostApi());
        InetSocketAddress tcp = (InetSocketAddress) runtime.tcpAddress();

        try (Client client = new Client(tcp)) {
            String message = "{\"type\":\"get_all_tracks\",\"params\":{}}";
            for (char c : message.toCharArray()) {
                client.send(String.valueOf(c));
            }
            JsonNode response = mapper.readTree(client.readLine());
            assertEquals("get_all_tracks", response.get("result").get("command").asText());

            // The next response is for the next request, not a duplicate.
            JsonNode second = call(client, "{\"type\":\"get_session_info\"}");
            assertEquals("get_session_info", second.get("result").get("command").asText());
        }
    }

    @Test
    void malformedTcpInputGetsAParseErrorAndTheConnectionSurvives() throws Exception {
        start(new RecordingHostApi());
        InetSocketAddress tcp = (InetSocketAddress) runtime.tcpAddress();

        try (Client client = new Client(tcp)) {
            JsonNode stray = call(client, "definitely not json\n");
            assertEquals("parse_error", stray.get("kind").asText());

            JsonNode invalid = call(client, "{\"type\": get_session_info}");
            assertEquals("parse_error", invalid.get("kind").asText());

            JsonNode notAllowed = call(client, "{\"type\":\"nope\"}");
            assertEquals("unknown_command", notAllowed.get("kind").asText());

            JsonNode ok = call(client, "{\"type\":\"get_session_info\"}");
            assertEquals("success", ok.get("status").asText());
        }
    }

    @Test
    void udpControlsReachTheHostAndCriticalDatagramsDoNot() throws Exception {
        start(SimulatedSessionHost.withDemoSession());
        InetSocketAddress tcp = (InetSocketAddress) runtime.tcpAddress();
        InetSocketAddress udp = (InetSocketAddress) runtime.udpAddress();

        sendDatagram(udp, "{\"type\":\"delete_track\",\"params\":{\"track_index\":0}}");
        sendDatagram(udp, "{\"type\":\"set_track_volume\",\"params\":{\"track_index\":0,\"volume\":0.3}}");

        try (Client client = new Client(tcp)) {
            JsonNode track = null;
            long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
            while (System.nanoTime() < deadline) {
                track = call(client, "{\"type\":\"get_track_info\",\"params\":{\"track_index\":0}}").get("result");
                if (track.get("volume").asDouble() == 0.3) {
                    break;
                }
                Thread.sleep(20);
            }
            assertNotNull(track);
            assertEquals(0.3, track.get("volume").asDouble(), "UDP volume change should land");

            JsonNode session = call(client, "{\"type\":\"get_session_info\"}").get("result");
            assertEquals(2, session.get("track_count").asInt(), "UDP delete_track must never execute");
        }
    }

    @Test
    void stopIsIdempotentAndReportsTransportsDown() throws Exception {
        start(new RecordingHostApi());
        InetSocketAddress tcp = (InetSocketAddress) runtime.tcpAddress();

        try (Client client = new Client(tcp)) {
            assertEquals("success", call(client, "{\"type\":\"get_session_info\"}").get("status").asText());

            runtime.stop();
            runtime.stop();

            // Server closed the connection.
            assertNull(client.readLine());
        }

        assertEquals(ExecutionSerializer.State.STOPPED, runtime.serializer().state());
        long downs = sink.eventsOfType(TransportObservabilityEvent.class).stream()
            .filter(e -> e.kind() == TransportObservabilityEvent.Kind.DOWN)
            .count();
        assertEquals(2, downs);
    }

    @Test
    void hostSeesCommandsOnlyOnTheSerializerThread() throws Exception {
        RecordingHostApi host = new RecordingHostApi();
        start(host);
        host.expectCalls(1);

        sendDatagram((InetSocketAddress) runtime.udpAddress(), "{\"type\":\"fire_clip\",\"params\":{}}");

        assertTrue(host.awaitCalls(5, TimeUnit.SECONDS));
        assertEquals(CommandKind.FIRE_CLIP, host.calls().get(0).kind());
        assertEquals("host-bridge-serializer", host.calls().get(0).threadName());
    }
}
