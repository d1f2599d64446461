package com.phillippitts.podcaster.service.audio;

import com.phillippitts.podcaster.config.audio.AudioToolsProperties;
import com.phillippitts.podcaster.exception.AssemblyExceptionBuilder;
import com.phillippitts.podcaster.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * {@link AudioToolchain} backed by the ffmpeg and ffprobe command line tools.
 *
 * <p>CLI contract:
 * <pre>
 * ffmpeg -y -hide_banner -loglevel error -i in0 -i in1 ... \
 *        -filter_complex [0:a][1:a]...concat=n=N:v=0:a=1[out] -map [out] output
 * ffprobe -v error -show_entries format=duration -of json file
 * </pre>
 */
@Component
public class FfmpegToolchain implements AudioToolchain {

    private static final Logger LOG = LogManager.getLogger(FfmpegToolchain.class);

    private final AudioToolsProperties properties;
    private final AudioProcessRunner runner;

    @Autowired
    public FfmpegToolchain(AudioToolsProperties properties) {
        this(properties, new DefaultProcessFactory());
    }

    FfmpegToolchain(AudioToolsProperties properties, ProcessFactory processFactory) {
        this.properties = Objects.requireNonNull(properties, "properties");
        this.runner = new AudioProcessRunner(processFactory, properties.maxStdoutBytes(),
                properties.maxStderrBytes());
    }

    @Override
    public void merge(List<Path> orderedInputs, Path output) {
        if (orderedInputs == null || orderedInputs.isEmpty()) {
            throw AssemblyExceptionBuilder.create("Nothing to merge").tool("ffmpeg").build();
        }
        List<String> command = buildMergeCommand(orderedInputs, output);
        LOG.debug("Merging {} files into {}", orderedInputs.size(), output.getFileName());

        runner.run("ffmpeg", command, output.toAbsolutePath().getParent(), timeout());

        if (!Files.isRegularFile(output)) {
            throw AssemblyExceptionBuilder.create("ffmpeg produced no output file")
                    .tool("ffmpeg")
                    .metadata("output", output)
                    .build();
        }
    }

    @Override
    public double probe(Path file) {
        List<String> command = List.of(
                properties.ffprobePath(),
                "-v", "error",
                "-show_entries", "format=duration",
                "-of", "json",
                file.toAbsolutePath().toString());

        ProcessOutput out = runner.run("ffprobe", command, file.toAbsolutePath().getParent(), timeout());
        return FfprobeOutputParser.duration(out.stdout())
                .orElseThrow(() -> AssemblyExceptionBuilder.create("ffprobe output did not contain a duration")
                        .tool("ffprobe")
                        .metadata("stdout", LogSanitizer.truncate(out.stdout(), 200))
                        .build());
    }

    List<String> buildMergeCommand(List<Path> inputs, Path output) {
        List<String> cmd = new ArrayList<>();
        cmd.add(properties.ffmpegPath());
        cmd.add("-y");
        cmd.add("-hide_banner");
        cmd.add("-loglevel");
        cmd.add("error");
        StringBuilder filter = new StringBuilder();
        for (int i = 0; i < inputs.size(); i++) {
            cmd.add("-i");
            cmd.add(inputs.get(i).toAbsolutePath().toString());
            filter.append('[').append(i).append(":a]");
        }
        filter.append("concat=n=").append(inputs.size()).append(":v=0:a=1[out]");
        cmd.add("-filter_complex");
        cmd.add(filter.toString());
        cmd.add("-map");
        cmd.add("[out]");
        cmd.add(output.toAbsolutePath().toString());
        return cmd;
    }

    private Duration timeout() {
        return Duration.ofSeconds(properties.timeoutSeconds());
    }
}
