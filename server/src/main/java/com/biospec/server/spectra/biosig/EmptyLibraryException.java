package com.biospec.server.spectra.biosig;

import com.biospec.server.spectra.PipelineStage;
import com.biospec.server.spectra.SpectralProcessingException;

/**
 * Raised when the analyzer receives a library without signatures.
 */
public class EmptyLibraryException extends SpectralProcessingException {
    public EmptyLibraryException(String message) {
        super(PipelineStage.ANALYSIS, message);
    }
}
