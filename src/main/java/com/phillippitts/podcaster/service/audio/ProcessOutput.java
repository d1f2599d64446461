package com.phillippitts.podcaster.service.audio;

/**
 * Captured result of a finished tool invocation.
 */
record ProcessOutput(String stdout, String stderr, int exitCode, long durationMs) {
}
