package com.questrail.hostbridge.command;

import com.questrail.hostbridge.api.Transport;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A classified, immutable command ready for execution against the host.
 *
 * <p>Parameters keep the order in which they appeared on the wire. Nested
 * values are whatever the decoder produced (maps, lists, strings, numbers,
 * booleans, or {@code null}) and are treated as read-only.</p>
 */
public record Command(
    CommandKind kind,
    Map<String, Object> parameters,
    Transport transport,
    Instant receivedAt
) {
    public Command {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(transport, "transport");
        Objects.requireNonNull(receivedAt, "receivedAt");
        parameters = parameters == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
    }

    public String name() {
        return kind.wireName();
    }
}
