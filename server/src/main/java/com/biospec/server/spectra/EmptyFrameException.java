package com.biospec.server.spectra;

/**
 * Raised when a frame has no rows or no columns.
 */
public class EmptyFrameException extends SpectralProcessingException {
    public EmptyFrameException(String message) {
        super(PipelineStage.REDUCTION, message);
    }
}
