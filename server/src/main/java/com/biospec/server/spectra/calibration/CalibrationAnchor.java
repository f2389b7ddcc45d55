package com.biospec.server.spectra.calibration;

/**
 * A known correspondence between a sensor column and a wavelength, usually
 * measured with a reference lamp.
 */
public final class CalibrationAnchor {
    private final double pixel;
    private final double wavelengthNm;

    public CalibrationAnchor(double pixel, double wavelengthNm) {
        if (!Double.isFinite(pixel) || !Double.isFinite(wavelengthNm)) {
            throw new IllegalArgumentException("Anchor values must be finite: (" + pixel + ", " + wavelengthNm + ")");
        }
        this.pixel = pixel;
        this.wavelengthNm = wavelengthNm;
    }

    public double getPixel() {
        return pixel;
    }

    public double getWavelengthNm() {
        return wavelengthNm;
    }

    @Override
    public String toString() {
        return "(" + pixel + " px, " + wavelengthNm + " nm)";
    }
}
