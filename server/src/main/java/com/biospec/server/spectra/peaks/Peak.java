package com.biospec.server.spectra.peaks;

import java.util.Objects;

/**
 * A detected emission/absorption feature of a calibrated spectrum.
 * A saturated peak reached the sensor ceiling, so its true prominence is unknown.
 */
public final class Peak {
    private final double centerWavelengthNm;
    private final double centerIntensity;
    private final double fullWidthHalfMaxNm;
    private final double prominence;
    private final boolean saturated;

    public Peak(double centerWavelengthNm, double centerIntensity, double fullWidthHalfMaxNm, double prominence,
            boolean saturated) {
        this.centerWavelengthNm = centerWavelengthNm;
        this.centerIntensity = centerIntensity;
        this.fullWidthHalfMaxNm = fullWidthHalfMaxNm;
        this.prominence = prominence;
        this.saturated = saturated;
    }

    public double getCenterWavelengthNm() {
        return centerWavelengthNm;
    }

    public double getCenterIntensity() {
        return centerIntensity;
    }

    public double getFullWidthHalfMaxNm() {
        return fullWidthHalfMaxNm;
    }

    public double getProminence() {
        return prominence;
    }

    public boolean isSaturated() {
        return saturated;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Peak)) {
            return false;
        }
        Peak peak = (Peak) o;
        return Double.compare(peak.centerWavelengthNm, centerWavelengthNm) == 0
                && Double.compare(peak.centerIntensity, centerIntensity) == 0
                && Double.compare(peak.fullWidthHalfMaxNm, fullWidthHalfMaxNm) == 0
                && Double.compare(peak.prominence, prominence) == 0
                && saturated == peak.saturated;
    }

    @Override
    public int hashCode() {
        return Objects.hash(centerWavelengthNm, centerIntensity, fullWidthHalfMaxNm, prominence, saturated);
    }

    @Override
    public String toString() {
        return String.format("Peak{%.2f nm, intensity=%.1f, fwhm=%.2f nm, prominence=%.1f%s}", centerWavelengthNm,
                centerIntensity, fullWidthHalfMaxNm, prominence, saturated ? ", saturated" : "");
    }
}
