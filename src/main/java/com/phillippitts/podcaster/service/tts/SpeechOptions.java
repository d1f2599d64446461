package com.phillippitts.podcaster.service.tts;

import java.util.Objects;

/**
 * Per-call synthesis options.
 *
 * @param voice  provider voice handle
 * @param format audio container, e.g. "mp3"
 * @param speed  speaking rate multiplier, provider default when null
 */
public record SpeechOptions(String voice, String format, Double speed) {

    public SpeechOptions {
        Objects.requireNonNull(voice, "voice must not be null");
        Objects.requireNonNull(format, "format must not be null");
    }
}
