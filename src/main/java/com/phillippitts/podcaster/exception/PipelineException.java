package com.phillippitts.podcaster.exception;

/**
 * Thrown when a stage of the generation pipeline fails and the podcast must be marked failed.
 *
 * <p>The stage name is kept separately from the message so the persisted error text stays
 * readable for end users.
 */
public class PipelineException extends PodcasterException {

    private final String stage;

    public PipelineException(String message, String stage) {
        super(message);
        this.stage = stage;
    }

    public PipelineException(String message, String stage, Throwable cause) {
        super(message, cause);
        this.stage = stage;
    }

    public String getStage() {
        return stage;
    }
}
