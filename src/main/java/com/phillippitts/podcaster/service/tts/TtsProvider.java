package com.phillippitts.podcaster.service.tts;

/**
 * Speech synthesis providers with a voice table in the catalog.
 */
public enum TtsProvider {
    OPENAI,
    AZURE
}
