package com.questrail.hostbridge.command;

import com.questrail.hostbridge.api.Transport;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A complete, syntactically valid inbound message whose command name has not
 * been classified yet.
 *
 * <p>Produced by a transport's decoder; turned into a {@link Command} once the
 * classifier has admitted it.</p>
 */
public record CommandRequest(
    String name,
    Map<String, Object> parameters,
    Transport transport,
    Instant receivedAt
) {
    public CommandRequest {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(transport, "transport");
        Objects.requireNonNull(receivedAt, "receivedAt");
        parameters = parameters == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
    }

    /**
     * Bind this request to the kind the classifier resolved its name to.
     */
    public Command toCommand(CommandKind kind) {
        Objects.requireNonNull(kind, "kind");
        if (!kind.wireName().equals(name)) {
            throw new IllegalArgumentException("Request '" + name + "' does not match " + kind);
        }
        return new Command(kind, parameters, transport, receivedAt);
    }
}
