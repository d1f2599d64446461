package com.phillippitts.podcaster.config.audio;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import java.nio.file.Path;

/**
 * Configuration for the ffmpeg/ffprobe toolchain and audio scratch files.
 *
 * @param ffmpegPath     ffmpeg executable (absolute path or command on PATH)
 * @param ffprobePath    ffprobe executable (absolute path or command on PATH)
 * @param scratchDir     directory for per-job scratch files, the JVM temp dir when unset
 * @param timeoutSeconds max runtime of a single tool invocation
 * @param maxStderrBytes cap on captured stderr
 * @param maxStdoutBytes cap on captured stdout
 * @param format         audio container of segments and assembled output
 */
@Validated
@ConfigurationProperties(prefix = "podcaster.audio")
public record AudioToolsProperties(
        @DefaultValue("ffmpeg") @NotBlank String ffmpegPath,
        @DefaultValue("ffprobe") @NotBlank String ffprobePath,
        String scratchDir,
        @DefaultValue("120") @Positive int timeoutSeconds,
        @DefaultValue("65536") @Positive int maxStderrBytes,
        @DefaultValue("1048576") @Positive int maxStdoutBytes,
        @DefaultValue("mp3") @NotBlank String format
) {

    public Path scratchPath() {
        if (scratchDir == null || scratchDir.isBlank()) {
            return Path.of(System.getProperty("java.io.tmpdir"));
        }
        return Path.of(scratchDir);
    }

    public static AudioToolsProperties withScratchDir(String scratchDir) {
        return new AudioToolsProperties("ffmpeg", "ffprobe", scratchDir, 120, 65536, 1_048_576, "mp3");
    }
}
