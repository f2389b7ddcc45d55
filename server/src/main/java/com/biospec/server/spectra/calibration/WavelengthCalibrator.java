package com.biospec.server.spectra.calibration;

import com.biospec.server.spectra.PositionUnit;
import com.biospec.server.spectra.Spectrum;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;

/**
 * Replaces pixel positions with wavelengths and drops samples outside the
 * calibration's trusted band. Samples are never extrapolated past the band.
 */
public class WavelengthCalibrator {
    private static final Logger logger = LoggerFactory.getLogger(WavelengthCalibrator.class);

    public Spectrum calibrate(Spectrum rawSpectrum, CalibrationMap calibration) {
        if (rawSpectrum.getUnit() != PositionUnit.PIXEL) {
            throw new IllegalArgumentException("Spectrum is already calibrated");
        }
        if (rawSpectrum.isEmpty()) {
            return new Spectrum(new double[0], new double[0], PositionUnit.NANOMETER);
        }

        calibration.checkIncreasing(rawSpectrum.getMinPosition(), rawSpectrum.getMaxPosition());

        WavelengthRange band = calibration.getTrustedRange();
        int n = rawSpectrum.size();
        double[] wavelengths = new double[n];
        double[] intensities = new double[n];
        boolean[] saturated = new boolean[n];
        int kept = 0;
        for (int i = 0; i < n; i++) {
            double wl = calibration.wavelengthAt(rawSpectrum.positionAt(i));
            if (band.contains(wl)) {
                wavelengths[kept] = wl;
                intensities[kept] = rawSpectrum.intensityAt(i);
                saturated[kept] = rawSpectrum.isSaturatedAt(i);
                kept++;
            }
        }

        if (kept == 0) {
            logger.warn("All {} samples fall outside the trusted band {}", n, band);
        } else if (kept < n) {
            logger.debug("Discarded {} of {} samples outside {}", n - kept, n, band);
        }

        return new Spectrum(Arrays.copyOf(wavelengths, kept), Arrays.copyOf(intensities, kept),
                Arrays.copyOf(saturated, kept), PositionUnit.NANOMETER);
    }
}
