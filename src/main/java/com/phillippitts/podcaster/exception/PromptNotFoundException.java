package com.phillippitts.podcaster.exception;

/**
 * Thrown when the prompt registry has no version for a key, or no active one.
 */
public class PromptNotFoundException extends PodcasterException {

    private final String promptKey;
    private final Integer version;

    public PromptNotFoundException(String promptKey) {
        super("No active prompt for key '" + promptKey + "'");
        this.promptKey = promptKey;
        this.version = null;
    }

    public PromptNotFoundException(String promptKey, int version) {
        super("Prompt '" + promptKey + "' has no version " + version);
        this.promptKey = promptKey;
        this.version = version;
    }

    public String getPromptKey() {
        return promptKey;
    }

    /** Requested version, or null when the active version was asked for. */
    public Integer getVersion() {
        return version;
    }
}
