package com.phillippitts.podcaster.util;

import java.time.Duration;

/**
 * Standard timeout values for external process management.
 *
 * <p>Used by {@link com.phillippitts.podcaster.service.audio.AudioProcessRunner} when
 * running ffmpeg and ffprobe.
 */
public final class ProcessTimeouts {

    /**
     * Time for stream gobbler threads to flush buffered output after the process exits.
     */
    public static final Duration GOBBLER_FLUSH_TIMEOUT = Duration.ofMillis(500);

    /**
     * Best-effort join of gobbler threads during cleanup. They are daemon threads.
     */
    public static final Duration GOBBLER_CLEANUP_TIMEOUT = Duration.ofMillis(100);

    /**
     * Wait after {@link Process#destroy()} before escalating.
     */
    public static final Duration GRACEFUL_SHUTDOWN_TIMEOUT = Duration.ofMillis(500);

    /**
     * Wait after {@link Process#destroyForcibly()}.
     */
    public static final Duration FORCEFUL_SHUTDOWN_TIMEOUT = Duration.ofMillis(1000);

    private ProcessTimeouts() {
        // Utility class - prevent instantiation
    }
}
