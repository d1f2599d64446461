package com.phillippitts.podcaster.exception;

/**
 * Thrown when a create or edit request is rejected before any state is written.
 */
public class InvalidPodcastRequestException extends PodcasterException {

    private final String reason;

    public InvalidPodcastRequestException(String reason) {
        super("Invalid podcast request: " + reason);
        this.reason = reason;
    }

    public String getReason() {
        return reason;
    }
}
