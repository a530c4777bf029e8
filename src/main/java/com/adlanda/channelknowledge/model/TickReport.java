package com.adlanda.channelknowledge.model;

import java.time.Duration;

/**
 * What one orchestrator tick did.
 *
 * {@code expired} is null when housekeeping did not run on this tick.
 */
public record TickReport(
        long tick,
        int channelsPolled,
        int itemsStaged,
        int fetchFailures,
        int scored,
        int accepted,
        int indexed,
        int syncFailures,
        boolean syncAborted,
        Integer expired,
        Duration duration
) {

    public boolean housekeepingRan() {
        return expired != null;
    }
}
