package com.phillippitts.podcaster.domain;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable snapshot of a podcast record.
 *
 * <p>Invariants enforced here: host and cohost differ; a successful podcast has an audio
 * reference, a duration and no error; a failed podcast has an error message.
 */
public record Podcast(
        String id,
        String ownerId,
        String title,
        String summary,
        PodcastStatus status,
        SourceReference source,
        String hostVoiceId,
        String cohostVoiceId,
        String audioReference,
        Integer durationSeconds,
        String errorMessage,
        Instant generatedAt,
        Instant createdAt,
        Instant updatedAt
) {

    public Podcast {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(ownerId, "ownerId must not be null");
        Objects.requireNonNull(status, "status must not be null");
        Objects.requireNonNull(hostVoiceId, "hostVoiceId must not be null");
        Objects.requireNonNull(cohostVoiceId, "cohostVoiceId must not be null");
        if (hostVoiceId.equals(cohostVoiceId)) {
            throw new IllegalArgumentException("Host and cohost voices must differ: " + hostVoiceId);
        }
        if (status == PodcastStatus.SUCCESS && (audioReference == null || durationSeconds == null)) {
            throw new IllegalArgumentException("Successful podcast requires audio and duration");
        }
        if (status == PodcastStatus.SUCCESS && errorMessage != null) {
            throw new IllegalArgumentException("Successful podcast must not carry an error message");
        }
        if (status == PodcastStatus.FAILED && (errorMessage == null || errorMessage.isBlank())) {
            throw new IllegalArgumentException("Failed podcast requires an error message");
        }
    }

    public boolean hasAudio() {
        return audioReference != null;
    }

    public Builder toBuilder() {
        return new Builder(this);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Mutable builder used by the store to derive new snapshots.
     */
    public static final class Builder {
        private String id;
        private String ownerId;
        private String title;
        private String summary;
        private PodcastStatus status = PodcastStatus.PROCESSING;
        private SourceReference source;
        private String hostVoiceId;
        private String cohostVoiceId;
        private String audioReference;
        private Integer durationSeconds;
        private String errorMessage;
        private Instant generatedAt;
        private Instant createdAt;
        private Instant updatedAt;

        private Builder() {
        }

        private Builder(Podcast p) {
            this.id = p.id;
            this.ownerId = p.ownerId;
            this.title = p.title;
            this.summary = p.summary;
            this.status = p.status;
            this.source = p.source;
            this.hostVoiceId = p.hostVoiceId;
            this.cohostVoiceId = p.cohostVoiceId;
            this.audioReference = p.audioReference;
            this.durationSeconds = p.durationSeconds;
            this.errorMessage = p.errorMessage;
            this.generatedAt = p.generatedAt;
            this.createdAt = p.createdAt;
            this.updatedAt = p.updatedAt;
        }

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder ownerId(String ownerId) {
            this.ownerId = ownerId;
            return this;
        }

        public Builder title(String title) {
            this.title = title;
            return this;
        }

        public Builder summary(String summary) {
            this.summary = summary;
            return this;
        }

        public Builder status(PodcastStatus status) {
            this.status = status;
            return this;
        }

        public Builder source(SourceReference source) {
            this.source = source;
            return this;
        }

        public Builder hostVoiceId(String hostVoiceId) {
            this.hostVoiceId = hostVoiceId;
            return this;
        }

        public Builder cohostVoiceId(String cohostVoiceId) {
            this.cohostVoiceId = cohostVoiceId;
            return this;
        }

        public Builder audioReference(String audioReference) {
            this.audioReference = audioReference;
            return this;
        }

        public Builder durationSeconds(Integer durationSeconds) {
            this.durationSeconds = durationSeconds;
            return this;
        }

        public Builder errorMessage(String errorMessage) {
            this.errorMessage = errorMessage;
            return this;
        }

        public Builder generatedAt(Instant generatedAt) {
            this.generatedAt = generatedAt;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder updatedAt(Instant updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        public Podcast build() {
            return new Podcast(id, ownerId, title, summary, status, source, hostVoiceId, cohostVoiceId,
                    audioReference, durationSeconds, errorMessage, generatedAt, createdAt, updatedAt);
        }
    }
}
