package com.phillippitts.podcaster.service.audio;

import com.phillippitts.podcaster.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Scratch files of one assembly step, deleted together on {@link #close()}.
 *
 * <p>Paths are registered before anything is written to them, so partial files left by a
 * failing write or merge are removed as well. Deleting a file that no longer exists is not
 * an error; other deletion failures are logged and never thrown.
 */
final class ScratchFiles implements AutoCloseable {

    private static final Logger LOG = LogManager.getLogger(ScratchFiles.class);

    private final Path directory;
    private final String jobId;
    private final String extension;
    private final List<Path> paths = new ArrayList<>();

    ScratchFiles(Path directory, String jobId, String extension) {
        this.directory = directory;
        this.jobId = LogSanitizer.fileSafe(jobId);
        this.extension = extension;
    }

    /**
     * Reserves a unique path such as {@code audio-<jobId>-segment-3-1a2b3c4d.mp3}.
     */
    Path reserve(String label) {
        String suffix = UUID.randomUUID().toString().replace("-", "").substring(0, 8);
        Path path = directory.resolve("audio-" + jobId + "-" + label + "-" + suffix + "." + extension);
        paths.add(path);
        return path;
    }

    Path write(String label, byte[] data) throws IOException {
        Files.createDirectories(directory);
        Path path = reserve(label);
        Files.write(path, data);
        return path;
    }

    List<Path> paths() {
        return List.copyOf(paths);
    }

    @Override
    public void close() {
        for (Path path : paths) {
            try {
                if (Files.deleteIfExists(path)) {
                    LOG.trace("Deleted scratch file {}", path);
                }
            } catch (IOException e) {
                LOG.warn("Failed to delete scratch file {}: {}", path, e.toString());
            }
        }
        paths.clear();
    }
}
