package com.phillippitts.podcaster.service.health;

import com.phillippitts.podcaster.config.audio.AudioToolsProperties;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class AudioToolsHealthIndicatorTest {

    @TempDir
    Path bin;

    private Path executable(String name) throws IOException {
        Path file = Files.writeString(bin.resolve(name), "#!/bin/sh\n");
        assertThat(file.toFile().setExecutable(true)).isTrue();
        return file;
    }

    private static AudioToolsProperties tools(String ffmpeg, String ffprobe) {
        return new AudioToolsProperties(ffmpeg, ffprobe, null, 120, 65536, 1_048_576, "mp3");
    }

    @Test
    void upWhenBothToolsAreExecutable() throws IOException {
        Path ffmpeg = executable("ffmpeg");
        Path ffprobe = executable("ffprobe");

        Health health = new AudioToolsHealthIndicator(tools(ffmpeg.toString(), ffprobe.toString()),
                name -> null).health();

        assertThat(health.getStatus()).isEqualTo(Status.UP);
        assertThat(health.getDetails().get("ffmpeg")).isEqualTo("accessible and executable at " + ffmpeg);
    }

    @Test
    void bareCommandsAreLookedUpOnPath() throws IOException {
        executable("ffmpeg");
        executable("ffprobe");
        Map<String, String> env = Map.of("PATH", "/nonexistent:" + bin);

        Health health = new AudioToolsHealthIndicator(tools("ffmpeg", "ffprobe"), env::get).health();

        assertThat(health.getStatus()).isEqualTo(Status.UP);
        assertThat(health.getDetails().get("ffprobe")).isEqualTo("accessible and executable at " + bin.resolve("ffprobe"));
    }

    @Test
    void downWhenAToolIsMissing() throws IOException {
        Path ffmpeg = executable("ffmpeg");
        Files.writeString(bin.resolve("ffprobe"), "not executable");

        Health health = new AudioToolsHealthIndicator(
                tools(ffmpeg.toString(), bin.resolve("ffprobe").toString()), name -> null).health();

        assertThat(health.getStatus()).isEqualTo(Status.DOWN);
        assertThat(health.getDetails().get("ffprobe")).isEqualTo("NOT FOUND: " + bin.resolve("ffprobe"));
    }

    @Test
    void downWhenPathIsUnset() {
        Health health = new AudioToolsHealthIndicator(tools("ffmpeg", "ffprobe"), name -> null).health();

        assertThat(health.getStatus()).isEqualTo(Status.DOWN);
        assertThat(health.getDetails().get("ffmpeg")).isEqualTo("NOT FOUND: ffmpeg");
    }
}
