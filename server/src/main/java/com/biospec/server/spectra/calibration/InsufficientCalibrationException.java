package com.biospec.server.spectra.calibration;

import com.biospec.server.spectra.PipelineStage;
import com.biospec.server.spectra.SpectralProcessingException;

/**
 * Raised when fewer than two usable calibration anchors are supplied.
 */
public class InsufficientCalibrationException extends SpectralProcessingException {
    public InsufficientCalibrationException(String message) {
        super(PipelineStage.CALIBRATION, message);
    }
}
