package com.phillippitts.podcaster.service.audio;

import com.phillippitts.podcaster.config.audio.AudioToolsProperties;
import com.phillippitts.podcaster.exception.AssemblyException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

class FfmpegToolchainTest {

    @TempDir
    Path dir;

    private AudioToolsProperties props() {
        return new AudioToolsProperties("/opt/ffmpeg", "/opt/ffprobe", dir.toString(), 2, 4096, 4096, "mp3");
    }

    @Test
    void buildsConcatFilterCommandInInputOrder() {
        FfmpegToolchain toolchain = new FfmpegToolchain(props(),
                new AudioTestDoubles.StubProcessFactory(new AudioTestDoubles.TestProcess(
                        AudioTestDoubles.ProcessBehavior.ok(""))));
        Path a = dir.resolve("a.mp3");
        Path b = dir.resolve("b.mp3");
        Path out = dir.resolve("out.mp3");

        List<String> cmd = toolchain.buildMergeCommand(List.of(a, b), out);

        assertThat(cmd).containsExactly(
                "/opt/ffmpeg", "-y", "-hide_banner", "-loglevel", "error",
                "-i", a.toAbsolutePath().toString(),
                "-i", b.toAbsolutePath().toString(),
                "-filter_complex", "[0:a][1:a]concat=n=2:v=0:a=1[out]",
                "-map", "[out]",
                out.toAbsolutePath().toString());
    }

    @Test
    void mergeSucceedsWhenOutputIsWritten() {
        AudioTestDoubles.StubProcessFactory factory = new AudioTestDoubles.StubProcessFactory(
                new AudioTestDoubles.TestProcess(AudioTestDoubles.ProcessBehavior.ok("")), true);
        FfmpegToolchain toolchain = new FfmpegToolchain(props(), factory);
        Path out = dir.resolve("out.mp3");

        toolchain.merge(List.of(dir.resolve("a.mp3")), out);

        assertThat(Files.exists(out)).isTrue();
        assertThat(factory.commands).hasSize(1);
        assertThat(factory.commands.get(0).get(0)).isEqualTo("/opt/ffmpeg");
    }

    @Test
    void mergeFailsWhenNoOutputFileAppears() {
        FfmpegToolchain toolchain = new FfmpegToolchain(props(), new AudioTestDoubles.StubProcessFactory(
                new AudioTestDoubles.TestProcess(AudioTestDoubles.ProcessBehavior.ok(""))));

        assertThatThrownBy(() -> toolchain.merge(List.of(dir.resolve("a.mp3")), dir.resolve("missing.mp3")))
                .isInstanceOf(AssemblyException.class)
                .hasMessageContaining("produced no output file");
    }

    @Test
    void mergeRejectsEmptyInput() {
        FfmpegToolchain toolchain = new FfmpegToolchain(props(), new AudioTestDoubles.FailingProcessFactory());

        AssemblyException error = catchThrowableOfType(
                () -> toolchain.merge(List.of(), dir.resolve("out.mp3")), AssemblyException.class);

        assertThat(error).isNotNull();
        assertThat(error.getTool()).isEqualTo("ffmpeg");
    }

    @Test
    void nonZeroExitCarriesStderrSnippet() {
        FfmpegToolchain toolchain = new FfmpegToolchain(props(), new AudioTestDoubles.StubProcessFactory(
                new AudioTestDoubles.TestProcess(new AudioTestDoubles.ProcessBehavior(
                        "", "Invalid data found when processing input", 1, 0))));

        assertThatThrownBy(() -> toolchain.merge(List.of(dir.resolve("a.mp3")), dir.resolve("out.mp3")))
                .isInstanceOf(AssemblyException.class)
                .hasMessageContaining("ffmpeg Non-zero exit: 1")
                .hasMessageContaining("exitCode=1")
                .hasMessageContaining("Invalid data found");
    }

    @Test
    void probeParsesDuration() {
        AudioTestDoubles.StubProcessFactory factory = new AudioTestDoubles.StubProcessFactory(
                new AudioTestDoubles.TestProcess(AudioTestDoubles.ProcessBehavior.ok(
                        "{\"format\": {\"duration\": \"42.250000\"}}")));
        FfmpegToolchain toolchain = new FfmpegToolchain(props(), factory);

        double seconds = toolchain.probe(dir.resolve("final.mp3"));

        assertThat(seconds).isEqualTo(42.25);
        assertThat(factory.commands.get(0)).startsWith("/opt/ffprobe", "-v", "error")
                .contains("format=duration", "json");
    }

    @Test
    void probeFailsWithoutDuration() {
        FfmpegToolchain toolchain = new FfmpegToolchain(props(), new AudioTestDoubles.StubProcessFactory(
                new AudioTestDoubles.TestProcess(AudioTestDoubles.ProcessBehavior.ok("{\"format\": {}}"))));

        assertThatThrownBy(() -> toolchain.probe(dir.resolve("final.mp3")))
                .isInstanceOf(AssemblyException.class)
                .hasMessageContaining("did not contain a duration");
    }

    @Test
    void missingBinaryIsAnAssemblyError() {
        FfmpegToolchain toolchain = new FfmpegToolchain(props(), new AudioTestDoubles.FailingProcessFactory());

        assertThatThrownBy(() -> toolchain.probe(dir.resolve("final.mp3")))
                .isInstanceOf(AssemblyException.class)
                .hasMessageContaining("ffprobe I/O failure");
    }
}
