package com.phillippitts.podcaster.exception;

/**
 * Raised for a single dialogue line that could not be synthesized.
 *
 * <p>This failure is soft: the synthesizer logs it and leaves a gap at the segment's index.
 */
public class SegmentSynthesisException extends PodcasterException {

    private final int segmentIndex;

    public SegmentSynthesisException(int segmentIndex, String speaker, Throwable cause) {
        super("Synthesis failed for segment " + segmentIndex + " (speaker: " + speaker + ")", cause);
        this.segmentIndex = segmentIndex;
    }

    public int getSegmentIndex() {
        return segmentIndex;
    }
}
