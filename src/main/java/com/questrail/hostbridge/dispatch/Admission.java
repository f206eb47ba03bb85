package com.questrail.hostbridge.dispatch;

import com.questrail.hostbridge.command.Command;
import com.questrail.hostbridge.model.CommandResponse;

import java.util.Objects;

/**
 * Result of checking an inbound request against the classification table.
 */
public sealed interface Admission permits Admission.Admitted, Admission.Rejected
{
    /** The request names a known command permitted on its transport. */
    record Admitted(Command command) implements Admission {
        public Admitted {
            Objects.requireNonNull(command, "command");
        }
    }

    /** The request must not reach the serializer. */
    record Rejected(CommandResponse.Failure failure) implements Admission {
        public Rejected {
            Objects.requireNonNull(failure, "failure");
        }
    }
}
