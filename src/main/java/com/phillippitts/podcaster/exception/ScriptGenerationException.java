package com.phillippitts.podcaster.exception;

/**
 * Thrown when the script prompt returns an error instead of a structured script.
 */
public class ScriptGenerationException extends PipelineException {

    private final String errorType;

    /**
     * @param errorType   prompt error class, e.g. "OutputValidationError"
     * @param description full error description, starting with the error type
     */
    public ScriptGenerationException(String errorType, String description) {
        super("Podcast script generation failed: " + description, "script");
        this.errorType = errorType;
    }

    public String getErrorType() {
        return errorType;
    }
}
