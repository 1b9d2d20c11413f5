package com.questrail.mcumgr.config;

import java.time.Duration;
import java.util.Objects;

/**
 * McuMgrTimingPolicy
 * -----------------------------------------------------------------------------
 * Operational timing for a client runtime.
 *
 * <ul>
 *   <li><b>defaultTimeout</b>: how long a request waits for its response when
 *       the caller does not pass a timeout.</li>
 *   <li><b>shutdownGrace</b>: how long {@code stop()} waits for the timeout
 *       scheduler to drain before forcing it down.</li>
 * </ul>
 *
 * <p>Only scheduling is controlled here. Timed-out requests are reported to
 * the caller and never retried.</p>
 */
public record McuMgrTimingPolicy(
        Duration defaultTimeout,
        Duration shutdownGrace
) {
    public McuMgrTimingPolicy {
        Objects.requireNonNull(defaultTimeout, "defaultTimeout");
        Objects.requireNonNull(shutdownGrace, "shutdownGrace");

        if (defaultTimeout.isNegative()) {
            throw new IllegalArgumentException("defaultTimeout must be non-negative");
        }
        if (shutdownGrace.isNegative()) {
            throw new IllegalArgumentException("shutdownGrace must be non-negative");
        }
    }

    /**
     * 40 s request timeout, 5 s shutdown grace.
     */
    public static McuMgrTimingPolicy defaults() {
        return new McuMgrTimingPolicy(Duration.ofSeconds(40), Duration.ofSeconds(5));
    }

    public static McuMgrTimingPolicy withDefaultTimeout(Duration defaultTimeout) {
        return new McuMgrTimingPolicy(defaultTimeout, defaults().shutdownGrace());
    }
}
