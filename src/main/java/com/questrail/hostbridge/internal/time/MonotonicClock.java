package com.questrail.hostbridge.internal.time;

/**
 * MonotonicClock
 * =============================================================================
 * Time source for response timeouts and latency measurement.
 *
 * <h2>Binding invariant</h2>
 * Anything that decides behavior (timeouts, shutdown grace) uses a monotonic
 * source. Wall-clock time is for observability only.
 */
public interface MonotonicClock
{
    /**
     * Returns a monotonically increasing tick value in nanoseconds.
     *
     * <p>Values are only meaningful for elapsed time computations.</p>
     */
    long nowNanos();
}
