package com.questrail.hostbridge.observability;

import com.questrail.hostbridge.command.Command;
import com.questrail.hostbridge.model.CommandResponse;

import java.time.Duration;
import java.time.Instant;

/**
 * Record of one completed host invocation.
 *
 * @param sequence  position in the serializer's submission order, starting at 1
 * @param queueWait time between enqueue and the start of execution
 * @param execution time spent inside the host call
 */
public record CommandExecutionEvent(
    Instant timestamp,
    long sequence,
    Command command,
    CommandResponse outcome,
    Duration queueWait,
    Duration execution
) {
}
