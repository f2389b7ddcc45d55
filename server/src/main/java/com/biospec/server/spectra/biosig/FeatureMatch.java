package com.biospec.server.spectra.biosig;

import com.biospec.server.spectra.peaks.Peak;

import java.util.Objects;

/**
 * A signature feature together with the peak that satisfied it.
 */
public final class FeatureMatch {
    private final SignatureFeature feature;
    private final Peak peak;
    private final double quality;

    public FeatureMatch(SignatureFeature feature, Peak peak, double quality) {
        this.feature = feature;
        this.peak = peak;
        this.quality = quality;
    }

    public SignatureFeature getFeature() {
        return feature;
    }

    public Peak getPeak() {
        return peak;
    }

    public double getQuality() {
        return quality;
    }

    public double getContribution() {
        return feature.getWeight() * quality;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof FeatureMatch)) {
            return false;
        }
        FeatureMatch that = (FeatureMatch) o;
        return Double.compare(that.quality, quality) == 0 && feature.equals(that.feature) && peak.equals(that.peak);
    }

    @Override
    public int hashCode() {
        return Objects.hash(feature, peak, quality);
    }
}
