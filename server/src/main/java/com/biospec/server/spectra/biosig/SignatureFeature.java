package com.biospec.server.spectra.biosig;

import java.util.Objects;

/**
 * One expected band of a signature: where it should appear, how far a
 * detected peak may sit from it, and how much it counts toward the score.
 */
public final class SignatureFeature {
    private final double wavelengthNm;
    private final double toleranceNm;
    private final double weight;

    public SignatureFeature(double wavelengthNm, double toleranceNm, double weight) {
        if (!Double.isFinite(wavelengthNm)) {
            throw new IllegalArgumentException("wavelengthNm must be finite");
        }
        if (!(toleranceNm > 0.0) || Double.isInfinite(toleranceNm)) {
            throw new IllegalArgumentException("toleranceNm must be positive, got " + toleranceNm);
        }
        if (!(weight > 0.0) || Double.isInfinite(weight)) {
            throw new IllegalArgumentException("weight must be positive, got " + weight);
        }
        this.wavelengthNm = wavelengthNm;
        this.toleranceNm = toleranceNm;
        this.weight = weight;
    }

    public double getWavelengthNm() {
        return wavelengthNm;
    }

    public double getToleranceNm() {
        return toleranceNm;
    }

    public double getWeight() {
        return weight;
    }

    /**
     * 1.0 for an exact match, falling linearly to 0.0 at the tolerance boundary.
     */
    public double matchQuality(double peakWavelengthNm) {
        double distance = Math.abs(peakWavelengthNm - wavelengthNm);
        if (distance >= toleranceNm) {
            return 0.0;
        }
        return 1.0 - distance / toleranceNm;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof SignatureFeature)) {
            return false;
        }
        SignatureFeature that = (SignatureFeature) o;
        return Double.compare(that.wavelengthNm, wavelengthNm) == 0
                && Double.compare(that.toleranceNm, toleranceNm) == 0
                && Double.compare(that.weight, weight) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(wavelengthNm, toleranceNm, weight);
    }

    @Override
    public String toString() {
        return "(" + wavelengthNm + " nm +/- " + toleranceNm + ", w=" + weight + ")";
    }
}
