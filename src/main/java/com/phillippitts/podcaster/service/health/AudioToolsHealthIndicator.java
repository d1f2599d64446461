package com.phillippitts.podcaster.service.health;

import com.phillippitts.podcaster.config.audio.AudioToolsProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.io.File;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import java.util.function.Function;

/**
 * Health indicator for the ffmpeg and ffprobe binaries used by audio assembly.
 *
 * <p>A configured absolute or relative path is checked directly; a bare command name is
 * looked up on {@code PATH}.
 */
@Component
public class AudioToolsHealthIndicator implements HealthIndicator {

    private final AudioToolsProperties properties;
    private final Function<String, String> environment;

    @Autowired
    public AudioToolsHealthIndicator(AudioToolsProperties properties) {
        this(properties, System::getenv);
    }

    AudioToolsHealthIndicator(AudioToolsProperties properties, Function<String, String> environment) {
        this.properties = properties;
        this.environment = environment;
    }

    @Override
    public Health health() {
        Optional<Path> ffmpeg = locate(properties.ffmpegPath());
        Optional<Path> ffprobe = locate(properties.ffprobePath());

        Health.Builder builder = ffmpeg.isPresent() && ffprobe.isPresent()
                ? Health.up().withDetail("status", "Audio tools accessible")
                : Health.down().withDetail("status", "Missing or inaccessible audio tools");
        return builder
                .withDetail("ffmpeg", formatStatus(properties.ffmpegPath(), ffmpeg))
                .withDetail("ffprobe", formatStatus(properties.ffprobePath(), ffprobe))
                .build();
    }

    Optional<Path> locate(String command) {
        if (command == null || command.isBlank()) {
            return Optional.empty();
        }
        if (command.contains("/") || command.contains(File.separator)) {
            Path path = Path.of(command);
            return isExecutableFile(path) ? Optional.of(path) : Optional.empty();
        }
        String searchPath = environment.apply("PATH");
        if (searchPath == null || searchPath.isBlank()) {
            return Optional.empty();
        }
        for (String dir : searchPath.split(File.pathSeparator)) {
            if (dir.isBlank()) {
                continue;
            }
            Path candidate = Path.of(dir, command);
            if (isExecutableFile(candidate)) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }

    private static boolean isExecutableFile(Path path) {
        return Files.isRegularFile(path) && Files.isExecutable(path);
    }

    private static String formatStatus(String configured, Optional<Path> resolved) {
        return resolved.map(p -> "accessible and executable at " + p)
                .orElse("NOT FOUND: " + configured);
    }
}
