package com.phillippitts.podcaster.exception;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fluent builder for {@link AssemblyException} carrying external tool context.
 *
 * <p><b>Usage:</b>
 * <pre>
 * throw AssemblyExceptionBuilder.create("Merge failed")
 *         .tool("ffmpeg")
 *         .exitCode(1)
 *         .durationMs(1500)
 *         .metadata("inputs", 4)
 *         .metadata("stderr", stderrSnippet)
 *         .build();
 * </pre>
 */
public final class AssemblyExceptionBuilder {

    private final String message;
    private String tool;
    private Throwable cause;
    private Integer exitCode;
    private Long durationMs;
    private final Map<String, String> metadata = new LinkedHashMap<>();

    private AssemblyExceptionBuilder(String message) {
        this.message = message;
    }

    /**
     * Creates a new builder with the base error message.
     *
     * @param message base error message (must not be null or empty)
     * @return new builder instance
     */
    public static AssemblyExceptionBuilder create(String message) {
        if (message == null || message.isEmpty()) {
            throw new IllegalArgumentException("message must not be null or empty");
        }
        return new AssemblyExceptionBuilder(message);
    }

    public AssemblyExceptionBuilder tool(String tool) {
        this.tool = tool;
        return this;
    }

    public AssemblyExceptionBuilder cause(Throwable cause) {
        this.cause = cause;
        return this;
    }

    public AssemblyExceptionBuilder exitCode(int exitCode) {
        this.exitCode = exitCode;
        return this;
    }

    public AssemblyExceptionBuilder durationMs(long durationMs) {
        this.durationMs = durationMs;
        return this;
    }

    /**
     * Adds a key-value pair to the message. Null keys or values are ignored.
     */
    public AssemblyExceptionBuilder metadata(String key, Object value) {
        if (key != null && value != null) {
            this.metadata.put(key, String.valueOf(value));
        }
        return this;
    }

    /**
     * Builds the exception. Message format:
     * <pre>
     * {message} (exitCode={code}, durationMs={ms}, {key1}={val1}, ...)
     * </pre>
     */
    public AssemblyException build() {
        return new AssemblyException(buildDetailedMessage(), tool != null ? tool : "unknown", cause);
    }

    private String buildDetailedMessage() {
        boolean hasDetails = exitCode != null || durationMs != null || !metadata.isEmpty();
        if (!hasDetails) {
            return message;
        }

        StringBuilder sb = new StringBuilder(message).append(" (");
        boolean first = true;
        if (exitCode != null) {
            sb.append("exitCode=").append(exitCode);
            first = false;
        }
        if (durationMs != null) {
            if (!first) {
                sb.append(", ");
            }
            sb.append("durationMs=").append(durationMs);
            first = false;
        }
        for (Map.Entry<String, String> entry : metadata.entrySet()) {
            if (!first) {
                sb.append(", ");
            }
            sb.append(entry.getKey()).append('=').append(entry.getValue());
            first = false;
        }
        return sb.append(')').toString();
    }
}
