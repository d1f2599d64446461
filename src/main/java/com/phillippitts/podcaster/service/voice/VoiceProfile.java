package com.phillippitts.podcaster.service.voice;

import com.phillippitts.podcaster.service.tts.TtsProvider;

/**
 * A personality bound to a provider voice.
 *
 * @param personality     persona metadata
 * @param provider        speech provider the handle belongs to
 * @param voiceHandle     provider-specific voice name
 * @param previewAudioUri data URI of a pre-rendered preview, null when unavailable
 */
public record VoiceProfile(Personality personality, TtsProvider provider, String voiceHandle, String previewAudioUri) {

    public String id() {
        return personality.id();
    }

    public String description() {
        return personality.description();
    }

    VoiceProfile withPreview(String uri) {
        return new VoiceProfile(personality, provider, voiceHandle, uri);
    }
}
