package com.questrail.mcumgr.internal.time;

/**
 * MonotonicClock
 * =============================================================================
 * Time source for request timeouts.
 *
 * <p>Timeouts are measured on a monotonic clock so that wall-clock
 * adjustments (NTP steps, manual changes) can neither fire them early nor
 * postpone them indefinitely.</p>
 */
public interface MonotonicClock
{
    /**
     * Returns a monotonically non-decreasing tick value in nanoseconds. Only
     * differences between two readings are meaningful.
     */
    long nowNanos();
}
