package com.questrail.hostbridge.codec.impl;

import com.questrail.hostbridge.api.Transport;
import com.questrail.hostbridge.codec.CommandDecodeException;
import com.questrail.hostbridge.command.CommandRequest;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class JacksonCommandDecoderTest {

    private static final Instant NOW = Instant.parse("2026-01-01T00:00:00Z");

    private final JacksonCommandDecoder decoder = new JacksonCommandDecoder();

    private CommandRequest decode(String json) {
        return decoder.decode(json.getBytes(StandardCharsets.UTF_8), Transport.TCP, NOW);
    }

    private String failure(String json) {
        return assertThrows(CommandDecodeException.class, () -> decode(json)).getMessage();
    }

    @Test
    void decodesTypeParamsAndStampsTransport() {
        CommandRequest request = decode(
                "{\"type\":\"set_device_parameter\",\"params\":{\"track_index\":1,\"device_index\":0,"
                        + "\"parameter_index\":2,\"value\":0.25}}");

        assertEquals("set_device_parameter", request.name());
        assertEquals(Transport.TCP, request.transport());
        assertEquals(NOW, request.receivedAt());
        assertEquals(1, request.parameters().get("track_index"));
        assertEquals(0.25, request.parameters().get("value"));
    }

    @Test
    void parameterOrderIsPreserved() {
        CommandRequest request = decode("{\"type\":\"x\",\"params\":{\"z\":1,\"a\":2,\"m\":3}}");

        assertEquals(List.of("z", "a", "m"), List.copyOf(request.parameters().keySet()));
    }

    @Test
    void nestedValuesBecomePlainJavaCollections() {
        CommandRequest request = decode(
                "{\"type\":\"add_notes_to_clip\",\"params\":{\"notes\":[{\"pitch\":60,\"mute\":false}],\"label\":null}}");

        Object notes = request.parameters().get("notes");
        assertInstanceOf(List.class, notes);
        assertEquals(Map.of("pitch", 60, "mute", false), ((List<?>) notes).get(0));
        assertTrue(request.parameters().containsKey("label"));
        assertNull(request.parameters().get("label"));
    }

    @Test
    void missingOrNullParamsMeansNoParameters() {
        assertTrue(decode("{\"type\":\"get_session_info\"}").parameters().isEmpty());
        assertTrue(decode("{\"type\":\"get_session_info\",\"params\":null}").parameters().isEmpty());
    }

    @Test
    void unknownTopLevelFieldsAreIgnored() {
        CommandRequest request = decode("{\"id\":7,\"type\":\"get_session_info\",\"extra\":[1,2]}");

        assertEquals("get_session_info", request.name());
    }

    @Test
    void nameIsNotValidatedHere() {
        // Classification is the dispatcher's job.
        assertEquals("no_such_command", decode("{\"type\":\"no_such_command\"}").name());
    }

    @Test
    void invalidJsonIsAParseError() {
        assertTrue(failure("{\"type\":").startsWith("Invalid JSON"));
        assertTrue(failure("{type: get_session_info}").startsWith("Invalid JSON"));
    }

    @Test
    void trailingContentIsAParseError() {
        assertTrue(failure("{\"type\":\"a\"} {\"type\":\"b\"}").startsWith("Invalid JSON"));
    }

    @Test
    void emptyPayloadIsAParseError() {
        assertEquals("Empty message", failure(""));
        assertEquals("Empty message", failure("   "));
    }

    @Test
    void nonObjectIsAParseError() {
        assertEquals("Message must be a JSON object", failure("[1,2,3]"));
        assertEquals("Message must be a JSON object", failure("\"get_session_info\""));
    }

    @Test
    void missingOrBlankTypeIsAParseError() {
        assertEquals("Message is missing a command 'type'", failure("{\"params\":{}}"));
        assertEquals("Message is missing a command 'type'", failure("{\"type\":\"  \"}"));
        assertEquals("Message is missing a command 'type'", failure("{\"type\":42}"));
    }

    @Test
    void nonObjectParamsIsAParseError() {
        assertEquals("'params' must be a JSON object", failure("{\"type\":\"a\",\"params\":[1]}"));
        assertEquals("'params' must be a JSON object", failure("{\"type\":\"a\",\"params\":\"x\"}"));
    }
}
