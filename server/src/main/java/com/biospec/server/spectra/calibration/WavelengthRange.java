package com.biospec.server.spectra.calibration;

/**
 * Inclusive wavelength band the sensor is trusted in.
 */
public final class WavelengthRange {
    public static final WavelengthRange VISIBLE = new WavelengthRange(400.0, 700.0);

    private final double minNm;
    private final double maxNm;

    public WavelengthRange(double minNm, double maxNm) {
        if (!Double.isFinite(minNm) || !Double.isFinite(maxNm) || minNm >= maxNm) {
            throw new IllegalArgumentException("Invalid wavelength range [" + minNm + ", " + maxNm + "]");
        }
        this.minNm = minNm;
        this.maxNm = maxNm;
    }

    public double getMinNm() {
        return minNm;
    }

    public double getMaxNm() {
        return maxNm;
    }

    public boolean contains(double wavelengthNm) {
        return wavelengthNm >= minNm && wavelengthNm <= maxNm;
    }

    @Override
    public String toString() {
        return "[" + minNm + ", " + maxNm + "] nm";
    }
}
