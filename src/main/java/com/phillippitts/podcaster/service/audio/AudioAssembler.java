package com.phillippitts.podcaster.service.audio;

import com.phillippitts.podcaster.config.audio.AudioToolsProperties;
import com.phillippitts.podcaster.exception.AssemblyException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Builds the final podcast audio from synthesized segments.
 *
 * <p>{@link #stitch} and {@link #duration} work on scratch files in
 * {@code podcaster.audio.scratch-dir}; every scratch file they create, merge output included,
 * is deleted before they return or throw.
 */
@Service
public class AudioAssembler {

    private static final Logger LOG = LogManager.getLogger(AudioAssembler.class);

    private final AudioToolchain toolchain;
    private final AudioToolsProperties properties;

    public AudioAssembler(AudioToolchain toolchain, AudioToolsProperties properties) {
        this.toolchain = Objects.requireNonNull(toolchain, "toolchain");
        this.properties = Objects.requireNonNull(properties, "properties");
    }

    /**
     * Concatenates the buffers, in order, into one audio file and returns its bytes.
     *
     * @param buffers segment audio; null entries are skipped
     * @param jobId   podcast id used to name scratch files
     * @return merged audio
     * @throws AssemblyException if no buffer is usable, scratch I/O fails, or the merge fails
     */
    public byte[] stitch(List<byte[]> buffers, String jobId) {
        List<byte[]> valid = new ArrayList<>();
        if (buffers != null) {
            for (byte[] buffer : buffers) {
                if (buffer != null) {
                    valid.add(buffer);
                }
            }
        }
        if (valid.isEmpty()) {
            throw new AssemblyException("No valid audio segments to stitch for job " + jobId);
        }

        try (ScratchFiles scratch = openScratch(jobId)) {
            List<Path> inputs = new ArrayList<>(valid.size());
            for (int i = 0; i < valid.size(); i++) {
                inputs.add(scratch.write("segment-" + i, valid.get(i)));
            }
            Path output = scratch.reserve("final");

            LOG.info("Stitching {} segments for job {}", inputs.size(), jobId);
            toolchain.merge(inputs, output);

            byte[] merged = Files.readAllBytes(output);
            LOG.info("Stitched audio for job {}: {} bytes", jobId, merged.length);
            return merged;
        } catch (IOException e) {
            throw new AssemblyException("Scratch file I/O failed while stitching job " + jobId, e);
        }
    }

    /**
     * Measures the playback length of an audio buffer.
     *
     * @return duration in whole seconds (rounded), or 0 when it cannot be determined
     */
    public int duration(byte[] audio) {
        if (audio == null || audio.length == 0) {
            return 0;
        }
        try (ScratchFiles scratch = openScratch("duration-probe")) {
            Path probeFile = scratch.write("probe", audio);
            return (int) Math.round(toolchain.probe(probeFile));
        } catch (IOException | RuntimeException e) {
            LOG.warn("Could not determine audio duration; reporting 0: {}", e.getMessage());
            return 0;
        }
    }

    /**
     * Encodes audio as a self-contained data URI reference.
     */
    public String encode(byte[] audio) {
        return AudioDataUri.encode(audio, properties.format());
    }

    private ScratchFiles openScratch(String jobId) {
        return new ScratchFiles(properties.scratchPath(), jobId, properties.format());
    }
}
