package com.biospec.server.spectra;

import java.util.Arrays;

/**
 * Ordered (position, intensity) samples. Positions are raw pixel indices before
 * calibration and wavelengths in nanometers after it; either way they are
 * strictly increasing. Arrays are copied in and out, instances are immutable.
 */
public class Spectrum {
    private final double[] positions;
    private final double[] intensities;
    private final boolean[] saturated;
    private final PositionUnit unit;

    public Spectrum(double[] positions, double[] intensities, boolean[] saturated, PositionUnit unit) {
        if (positions == null || intensities == null || saturated == null || unit == null) {
            throw new IllegalArgumentException("positions, intensities, saturated and unit are required");
        }
        if (positions.length != intensities.length || positions.length != saturated.length) {
            throw new IllegalArgumentException("positions (" + positions.length + "), intensities ("
                    + intensities.length + ") and saturated (" + saturated.length + ") lengths differ");
        }
        for (int i = 1; i < positions.length; i++) {
            if (!(positions[i] > positions[i - 1])) {
                throw new IllegalArgumentException("positions must be strictly increasing at index " + i);
            }
        }
        this.positions = positions.clone();
        this.intensities = intensities.clone();
        this.saturated = saturated.clone();
        this.unit = unit;
    }

    public Spectrum(double[] positions, double[] intensities, PositionUnit unit) {
        this(positions, intensities, new boolean[positions == null ? 0 : positions.length], unit);
    }

    /**
     * A raw spectrum whose positions are the pixel indices 0..n-1.
     */
    public static Spectrum ofPixels(double[] intensities, boolean[] saturated) {
        double[] pixels = new double[intensities.length];
        for (int i = 0; i < pixels.length; i++) {
            pixels[i] = i;
        }
        return new Spectrum(pixels, intensities, saturated, PositionUnit.PIXEL);
    }

    public int size() {
        return positions.length;
    }

    public boolean isEmpty() {
        return positions.length == 0;
    }

    public double positionAt(int i) {
        return positions[i];
    }

    public double intensityAt(int i) {
        return intensities[i];
    }

    public boolean isSaturatedAt(int i) {
        return saturated[i];
    }

    public double[] getPositions() {
        return positions.clone();
    }

    public double[] getIntensities() {
        return intensities.clone();
    }

    /**
     * The same samples with intensities rescaled to [0, 1] between their
     * minimum and maximum. A flat spectrum maps to all zeros.
     */
    public Spectrum normalized() {
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (double v : intensities) {
            min = Math.min(min, v);
            max = Math.max(max, v);
        }
        double range = max - min;
        double[] scaled = new double[intensities.length];
        if (range > 0.0) {
            for (int i = 0; i < scaled.length; i++) {
                scaled[i] = (intensities[i] - min) / range;
            }
        }
        return new Spectrum(positions, scaled, saturated, unit);
    }

    public PositionUnit getUnit() {
        return unit;
    }

    public double getMinPosition() {
        return positions.length == 0 ? Double.NaN : positions[0];
    }

    public double getMaxPosition() {
        return positions.length == 0 ? Double.NaN : positions[positions.length - 1];
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Spectrum)) {
            return false;
        }
        Spectrum other = (Spectrum) o;
        return unit == other.unit
                && Arrays.equals(positions, other.positions)
                && Arrays.equals(intensities, other.intensities)
                && Arrays.equals(saturated, other.saturated);
    }

    @Override
    public int hashCode() {
        int h = unit.hashCode();
        h = 31 * h + Arrays.hashCode(positions);
        h = 31 * h + Arrays.hashCode(intensities);
        return 31 * h + Arrays.hashCode(saturated);
    }

    @Override
    public String toString() {
        return "Spectrum{size=" + positions.length + ", unit=" + unit + ", range=[" + getMinPosition() + ", "
                + getMaxPosition() + "]}";
    }
}
