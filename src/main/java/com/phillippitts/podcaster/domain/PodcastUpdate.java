package com.phillippitts.podcaster.domain;

import java.time.Instant;

/**
 * Partial update applied to a podcast record. Null fields are left untouched;
 * {@code clearAudio} removes the audio reference and duration.
 */
public record PodcastUpdate(
        String title,
        String summary,
        PodcastStatus status,
        String errorMessage,
        String audioReference,
        Integer durationSeconds,
        boolean clearAudio,
        String hostVoiceId,
        String cohostVoiceId,
        Instant generatedAt
) {

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String title;
        private String summary;
        private PodcastStatus status;
        private String errorMessage;
        private String audioReference;
        private Integer durationSeconds;
        private boolean clearAudio;
        private String hostVoiceId;
        private String cohostVoiceId;
        private Instant generatedAt;

        private Builder() {
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

        public Builder errorMessage(String errorMessage) {
            this.errorMessage = errorMessage;
            return this;
        }

        public Builder audio(String audioReference, int durationSeconds) {
            this.audioReference = audioReference;
            this.durationSeconds = durationSeconds;
            this.clearAudio = false;
            return this;
        }

        public Builder clearAudio() {
            this.audioReference = null;
            this.durationSeconds = null;
            this.clearAudio = true;
            return this;
        }

        public Builder voices(String hostVoiceId, String cohostVoiceId) {
            this.hostVoiceId = hostVoiceId;
            this.cohostVoiceId = cohostVoiceId;
            return this;
        }

        public Builder generatedAt(Instant generatedAt) {
            this.generatedAt = generatedAt;
            return this;
        }

        public PodcastUpdate build() {
            return new PodcastUpdate(title, summary, status, errorMessage, audioReference, durationSeconds,
                    clearAudio, hostVoiceId, cohostVoiceId, generatedAt);
        }
    }
}
