package com.phillippitts.podcaster.service.orchestration;

import com.phillippitts.podcaster.domain.DialogueSegment;

import java.util.List;
import java.util.Objects;

/**
 * Input of an audio-only regeneration run.
 *
 * @param title new title to write on success, null keeps the current one
 */
public record RegenerationRequest(
        String podcastId,
        List<DialogueSegment> dialogue,
        String hostVoiceId,
        String cohostVoiceId,
        String title
) {

    public RegenerationRequest {
        Objects.requireNonNull(podcastId, "podcastId must not be null");
        dialogue = dialogue == null ? List.of() : List.copyOf(dialogue);
    }
}
