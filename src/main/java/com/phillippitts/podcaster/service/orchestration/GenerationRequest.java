package com.phillippitts.podcaster.service.orchestration;

import com.phillippitts.podcaster.domain.SourceReference;

import java.util.Objects;

/**
 * Input of a full generation run.
 */
public record GenerationRequest(String podcastId, SourceReference source, String hostVoiceId, String cohostVoiceId) {

    public GenerationRequest {
        Objects.requireNonNull(podcastId, "podcastId must not be null");
        Objects.requireNonNull(source, "source must not be null");
    }
}
