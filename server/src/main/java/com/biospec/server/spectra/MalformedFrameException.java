package com.biospec.server.spectra;

/**
 * Raised when the rows of a frame have inconsistent lengths.
 */
public class MalformedFrameException extends SpectralProcessingException {
    public MalformedFrameException(String message) {
        super(PipelineStage.REDUCTION, message);
    }
}
