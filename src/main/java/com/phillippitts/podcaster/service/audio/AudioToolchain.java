package com.phillippitts.podcaster.service.audio;

import java.nio.file.Path;
import java.util.List;

/**
 * External audio tools used during assembly.
 */
public interface AudioToolchain {

    /**
     * Concatenates the input files, in order, into {@code output}.
     *
     * @throws com.phillippitts.podcaster.exception.AssemblyException if the merge fails
     */
    void merge(List<Path> orderedInputs, Path output);

    /**
     * Returns the playback duration of an audio file in seconds.
     *
     * @throws com.phillippitts.podcaster.exception.AssemblyException if the file cannot be probed
     */
    double probe(Path file);
}
