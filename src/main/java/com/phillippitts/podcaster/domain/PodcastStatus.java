package com.phillippitts.podcaster.domain;

/**
 * Lifecycle state of a podcast. {@link #PROCESSING} is the only non-terminal state.
 */
public enum PodcastStatus {
    PROCESSING,
    SUCCESS,
    FAILED;

    public boolean isTerminal() {
        return this != PROCESSING;
    }
}
