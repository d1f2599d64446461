package com.phillippitts.podcaster.domain;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Ordered dialogue of one podcast. Order is read order, synthesis order and stitch order.
 *
 * @param podcastId owning podcast
 * @param segments  ordered dialogue segments (may be empty while a podcast is processing)
 * @param updatedAt last overwrite time
 */
public record Transcript(String podcastId, List<DialogueSegment> segments, Instant updatedAt) {

    public Transcript {
        Objects.requireNonNull(podcastId, "podcastId must not be null");
        segments = segments == null ? List.of() : List.copyOf(segments);
        Objects.requireNonNull(updatedAt, "updatedAt must not be null");
    }

    public static Transcript empty(String podcastId) {
        return new Transcript(podcastId, List.of(), Instant.now());
    }

    public boolean isEmpty() {
        return segments.isEmpty();
    }
}
