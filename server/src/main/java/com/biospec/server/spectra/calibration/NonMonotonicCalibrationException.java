package com.biospec.server.spectra.calibration;

import com.biospec.server.spectra.PipelineStage;
import com.biospec.server.spectra.SpectralProcessingException;

/**
 * Raised when the fitted pixel-to-wavelength curve is not strictly increasing.
 */
public class NonMonotonicCalibrationException extends SpectralProcessingException {
    public NonMonotonicCalibrationException(String message) {
        super(PipelineStage.CALIBRATION, message);
    }
}
