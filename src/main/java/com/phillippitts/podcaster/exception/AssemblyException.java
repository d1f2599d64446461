package com.phillippitts.podcaster.exception;

/**
 * Thrown when audio assembly fails: no usable segments, scratch I/O errors,
 * or a failing ffmpeg/ffprobe invocation.
 */
public class AssemblyException extends PipelineException {

    private final String tool;

    public AssemblyException(String message) {
        super(message, "assembly");
        this.tool = "none";
    }

    public AssemblyException(String message, Throwable cause) {
        super(message, "assembly", cause);
        this.tool = "none";
    }

    public AssemblyException(String message, String tool, Throwable cause) {
        super(message, "assembly", cause);
        this.tool = tool;
    }

    public String getTool() {
        return tool;
    }
}
