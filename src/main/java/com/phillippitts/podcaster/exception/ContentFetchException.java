package com.phillippitts.podcaster.exception;

/**
 * Thrown when the source content of a podcast cannot be retrieved.
 */
public class ContentFetchException extends PipelineException {

    private final String source;
    private final int statusCode;

    public ContentFetchException(String source, int statusCode) {
        super("Failed to fetch content from " + source + " (status " + statusCode + ")", "fetch");
        this.source = source;
        this.statusCode = statusCode;
    }

    public ContentFetchException(String source, String reason, Throwable cause) {
        super("Failed to fetch content from " + source + ": " + reason, "fetch", cause);
        this.source = source;
        this.statusCode = -1;
    }

    public String getSource() {
        return source;
    }

    /**
     * @return HTTP status code, or -1 when no response was received
     */
    public int getStatusCode() {
        return statusCode;
    }
}
