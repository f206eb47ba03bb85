package com.questrail.hostbridge.internal.time;

/**
 * Minimal cancellation handle for scheduled tasks.
 */
public interface Cancellable
{
    /**
     * Attempt to cancel the scheduled task.
     *
     * @return {@code true} if cancellation succeeded; {@code false} if the task
     *         was already executed or previously cancelled.
     */
    boolean cancel();
}
