package com.phillippitts.podcaster.exception;

/**
 * Thrown when a personality id has no voice handle for the active speech provider.
 */
public class VoiceNotFoundException extends PipelineException {

    private final String personalityId;
    private final String provider;

    public VoiceNotFoundException(String personalityId, String provider) {
        super("No voice configured for personality '" + personalityId + "' on provider " + provider,
                "voices");
        this.personalityId = personalityId;
        this.provider = provider;
    }

    public String getPersonalityId() {
        return personalityId;
    }

    public String getProvider() {
        return provider;
    }
}
