package com.questrail.hostbridge.codec.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.questrail.hostbridge.api.Transport;
import com.questrail.hostbridge.codec.CommandDecodeException;
import com.questrail.hostbridge.codec.CommandDecoder;
import com.questrail.hostbridge.command.CommandRequest;

import java.io.IOException;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * JacksonCommandDecoder
 * -----------------------------------------------------------------------------
 * Decodes {@code {"type": "<command-name>", "params": {...}}} requests.
 *
 * <p>Rules:</p>
 * <ul>
 *   <li>the payload must hold exactly one JSON object; trailing tokens fail</li>
 *   <li>{@code type} must be a non-blank string</li>
 *   <li>{@code params} may be absent or {@code null} (empty parameters),
 *       otherwise it must be an object; its key order is preserved</li>
 *   <li>other top-level fields are ignored</li>
 * </ul>
 */
public final class JacksonCommandDecoder implements CommandDecoder
{
    static final String FIELD_TYPE = "type";
    static final String FIELD_PARAMS = "params";

    private static final TypeReference<LinkedHashMap<String, Object>> PARAMS_TYPE = new TypeReference<>() {};

    private final ObjectMapper mapper;

    public JacksonCommandDecoder()
    {
        this(new ObjectMapper());
    }

    public JacksonCommandDecoder(ObjectMapper mapper)
    {
        this.mapper = Objects.requireNonNull(mapper, "mapper").copy()
                .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    }

    @Override
    public CommandRequest decode(byte[] payload, Transport transport, Instant receivedAt)
    {
        Objects.requireNonNull(payload, "payload");

        final JsonNode root;
        try {
            root = mapper.readTree(payload);
        }
        catch (JsonProcessingException e) {
            throw new CommandDecodeException("Invalid JSON: " + e.getOriginalMessage(), e);
        }
        catch (IOException e) {
            throw new CommandDecodeException("Unreadable message: " + e.getMessage(), e);
        }

        if (root == null || root.isMissingNode()) {
            throw new CommandDecodeException("Empty message");
        }
        if (!root.isObject()) {
            throw new CommandDecodeException("Message must be a JSON object");
        }

        JsonNode typeNode = root.get(FIELD_TYPE);
        if (typeNode == null || !typeNode.isTextual() || typeNode.asText().isBlank()) {
            throw new CommandDecodeException("Message is missing a command 'type'");
        }

        return new CommandRequest(typeNode.asText(), readParams(root.get(FIELD_PARAMS)), transport, receivedAt);
    }

    private Map<String, Object> readParams(JsonNode paramsNode)
    {
        if (paramsNode == null || paramsNode.isNull()) {
            return Map.of();
        }
        if (!paramsNode.isObject()) {
            throw new CommandDecodeException("'params' must be a JSON object");
        }
        return mapper.convertValue(paramsNode, PARAMS_TYPE);
    }
}
