package com.adlanda.channelknowledge.model;

/**
 * Where a channel sits in its polling cycle at a given instant.
 */
public enum PollState {
    NEVER_FETCHED,
    POLLING_DUE,
    RECENTLY_POLLED;

    public boolean isDue() {
        return this != RECENTLY_POLLED;
    }
}
