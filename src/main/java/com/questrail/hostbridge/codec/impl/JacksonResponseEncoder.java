package com.questrail.hostbridge.codec.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.questrail.hostbridge.codec.ResponseEncoder;
import com.questrail.hostbridge.model.CommandResponse;
import com.questrail.hostbridge.model.ErrorKind;

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Writes {@link CommandResponse} values as compact UTF-8 JSON.
 */
public final class JacksonResponseEncoder implements ResponseEncoder
{
    private final ObjectMapper mapper;

    public JacksonResponseEncoder()
    {
        this(new ObjectMapper());
    }

    public JacksonResponseEncoder(ObjectMapper mapper)
    {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    @Override
    public byte[] encode(CommandResponse response)
    {
        Objects.requireNonNull(response, "response");
        try {
            return mapper.writeValueAsBytes(toTree(response));
        }
        catch (JsonProcessingException e) {
            // Host results are arbitrary objects; fall back to an envelope that always encodes.
            CommandResponse.Failure fallback = CommandResponse.failure(
                    ErrorKind.HOST_ERROR, "Result could not be encoded: " + e.getOriginalMessage());
            return fallbackBytes(fallback);
        }
    }

    private static Map<String, Object> toTree(CommandResponse response)
    {
        Map<String, Object> tree = new LinkedHashMap<>();
        tree.put("status", response.status());
        if (response instanceof CommandResponse.Success success) {
            tree.put("result", success.result());
        }
        else {
            CommandResponse.Failure failure = (CommandResponse.Failure) response;
            tree.put("message", failure.message());
            tree.put("kind", failure.kind().wireName());
        }
        return tree;
    }

    private byte[] fallbackBytes(CommandResponse.Failure failure)
    {
        try {
            return mapper.writeValueAsBytes(toTree(failure));
        }
        catch (JsonProcessingException e) {
            return ("{\"status\":\"error\",\"message\":\"Result could not be encoded\",\"kind\":\""
                    + failure.kind().wireName() + "\"}").getBytes(StandardCharsets.UTF_8);
        }
    }
}
