package com.questrail.penman.internal.time;

import java.time.Instant;

/**
 * WallClock
 * =============================================================================
 * Wall-clock source used strictly for timestamping observability events.
 *
 * <p>No codec decision depends on the time; tests substitute a fixed clock
 * to make emitted events comparable.</p>
 */
@FunctionalInterface
public interface WallClock
{
    /**
     * Returns the current wall-clock time.
     */
    Instant now();
}
