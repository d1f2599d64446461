package com.phillippitts.podcaster.service.tts;

/**
 * Text-to-speech provider client.
 *
 * <p>Vendor implementations are registered as Spring beans outside this project. Calls are
 * blocking and may be made concurrently from synthesis worker threads.
 */
public interface SpeechSynthesizer {

    /**
     * Synthesizes one line of speech.
     *
     * @param text    text to speak
     * @param options voice and format
     * @return encoded audio bytes
     * @throws RuntimeException on provider failure
     */
    byte[] synthesize(String text, SpeechOptions options);

    /**
     * Provider whose voice handles this synthesizer accepts.
     */
    TtsProvider activeProvider();
}
