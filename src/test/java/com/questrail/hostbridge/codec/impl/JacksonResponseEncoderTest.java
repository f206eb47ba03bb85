package com.questrail.hostbridge.codec.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.questrail.hostbridge.model.CommandResponse;
import com.questrail.hostbridge.model.ErrorKind;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class JacksonResponseEncoderTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final JacksonResponseEncoder encoder = new JacksonResponseEncoder(mapper);

    private JsonNode encode(CommandResponse response) throws Exception {
        return mapper.readTree(encoder.encode(response));
    }

    @Test
    void successEnvelopeCarriesTheResult() throws Exception {
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("tempo", 128.0);
        result.put("tracks", List.of(Map.of("name", "Bass")));

        JsonNode json = encode(CommandResponse.success(result));

        assertEquals("success", json.get("status").asText());
        assertEquals(128.0, json.get("result").get("tempo").asDouble());
        assertEquals("Bass", json.get("result").get("tracks").get(0).get("name").asText());
        assertFalse(json.has("message"));
    }

    @Test
    void emptyResultIsAnEmptyObject() throws Exception {
        JsonNode json = encode(CommandResponse.success(null));

        assertTrue(json.get("result").isObject());
        assertEquals(0, json.get("result").size());
    }

    @Test
    void errorEnvelopeCarriesMessageAndKind() throws Exception {
        JsonNode json = encode(CommandResponse.failure(ErrorKind.UNKNOWN_COMMAND, "Unknown command: set_volume"));

        assertEquals("error", json.get("status").asText());
        assertEquals("Unknown command: set_volume", json.get("message").asText());
        assertEquals("unknown_command", json.get("kind").asText());
        assertFalse(json.has("result"));
    }

    @Test
    void everyErrorKindHasADistinctWireName() throws Exception {
        for (ErrorKind kind : ErrorKind.values()) {
            JsonNode json = encode(CommandResponse.failure(kind, "m"));
            assertEquals(kind.wireName(), json.get("kind").asText());
        }
    }

    @Test
    void blankFailureMessageFallsBackToTheKind() throws Exception {
        JsonNode json = encode(CommandResponse.failure(ErrorKind.HOST_ERROR, " "));

        assertEquals("host_error", json.get("message").asText());
    }

    @Test
    void unencodableResultBecomesAHostError() throws Exception {
        // Jackson cannot serialize a bean with no properties by default.
        JsonNode json = encode(CommandResponse.success(Map.of("handle", new Object())));

        assertEquals("error", json.get("status").asText());
        assertEquals("host_error", json.get("kind").asText());
        assertTrue(json.get("message").asText().startsWith("Result could not be encoded"));
    }

    @Test
    void outputIsASingleLine() {
        String text = new String(encoder.encode(CommandResponse.success(Map.of("a", "b\nc"))),
                java.nio.charset.StandardCharsets.UTF_8);

        assertFalse(text.contains("\n"));
    }
}
