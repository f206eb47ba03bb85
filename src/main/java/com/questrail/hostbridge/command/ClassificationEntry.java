package com.questrail.hostbridge.command;

import com.questrail.hostbridge.api.Transport;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * One row of the classification table.
 *
 * <p>Invariants enforced on construction:</p>
 * <ul>
 *   <li>TCP is always allowed (it is the superset transport)</li>
 *   <li>a {@link Criticality#CRITICAL} command is never UDP-eligible</li>
 * </ul>
 */
public record ClassificationEntry(
    CommandKind kind,
    Set<Transport> allowedTransports,
    Criticality criticality
) {
    public ClassificationEntry {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(allowedTransports, "allowedTransports");
        Objects.requireNonNull(criticality, "criticality");

        if (!allowedTransports.contains(Transport.TCP)) {
            throw new IllegalArgumentException(kind + ": TCP must always be allowed");
        }
        if (allowedTransports.contains(Transport.UDP) && criticality == Criticality.CRITICAL) {
            throw new IllegalArgumentException(kind + ": critical commands cannot be UDP-eligible");
        }
        allowedTransports = Collections.unmodifiableSet(EnumSet.copyOf(allowedTransports));
    }

    public static ClassificationEntry tcpOnly(CommandKind kind, Criticality criticality) {
        return new ClassificationEntry(kind, EnumSet.of(Transport.TCP), criticality);
    }

    public static ClassificationEntry udpEligible(CommandKind kind) {
        return new ClassificationEntry(kind, EnumSet.of(Transport.TCP, Transport.UDP), Criticality.REVERSIBLE);
    }

    public String commandName() {
        return kind.wireName();
    }

    public boolean allows(Transport transport) {
        return allowedTransports.contains(transport);
    }
}
