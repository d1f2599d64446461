package com.phillippitts.podcaster.service.orchestration.event;

import com.phillippitts.podcaster.domain.PodcastStatus;

import java.time.Instant;
import java.util.Objects;

/**
 * Published after a pipeline run has written its final status.
 *
 * @param podcastId    podcast the run belonged to
 * @param pipeline     "generate" or "regenerate"
 * @param status       final status, SUCCESS or FAILED
 * @param errorMessage persisted error message, null on success
 * @param timestamp    when the final status was written
 */
public record PodcastFinishedEvent(
        String podcastId,
        String pipeline,
        PodcastStatus status,
        String errorMessage,
        Instant timestamp
) {

    public PodcastFinishedEvent {
        Objects.requireNonNull(podcastId, "podcastId must not be null");
        Objects.requireNonNull(status, "status must not be null");
        Objects.requireNonNull(timestamp, "timestamp must not be null");
    }

    public boolean succeeded() {
        return status == PodcastStatus.SUCCESS;
    }
}
