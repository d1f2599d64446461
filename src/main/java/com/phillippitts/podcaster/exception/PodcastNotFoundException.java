package com.phillippitts.podcaster.exception;

/**
 * Thrown when a podcast does not exist or is not owned by the caller.
 */
public class PodcastNotFoundException extends PodcasterException {

    private final String podcastId;

    public PodcastNotFoundException(String podcastId) {
        super("Podcast not found: " + podcastId);
        this.podcastId = podcastId;
    }

    public String getPodcastId() {
        return podcastId;
    }
}
