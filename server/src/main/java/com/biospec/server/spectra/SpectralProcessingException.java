package com.biospec.server.spectra;

/**
 * Base class of every error raised by a pipeline stage. The stage that raised
 * it is kept so the caller can report where a frame's run was aborted.
 */
public class SpectralProcessingException extends RuntimeException {
    private final PipelineStage stage;

    public SpectralProcessingException(PipelineStage stage, String message) {
        super(message);
        this.stage = stage;
    }

    public PipelineStage getStage() {
        return stage;
    }
}
