package com.adlanda.channelknowledge.model;

import java.time.Duration;

/**
 * Polling tier derived from a channel's priority (1-10).
 */
public enum Tier {
    CRITICAL(9, Duration.ofMinutes(15)),
    HIGH(7, Duration.ofMinutes(30)),
    NORMAL(5, Duration.ofHours(1)),
    LOW(1, Duration.ofHours(2));

    private final int minPriority;
    private final Duration defaultInterval;

    Tier(int minPriority, Duration defaultInterval) {
        this.minPriority = minPriority;
        this.defaultInterval = defaultInterval;
    }

    public Duration defaultInterval() {
        return defaultInterval;
    }

    public static Tier fromPriority(int priority) {
        for (Tier tier : values()) {
            if (priority >= tier.minPriority) {
                return tier;
            }
        }
        return LOW;
    }
}
