package com.biospec.server.spectra.biosig;

import com.biospec.server.spectra.peaks.Peak;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Score of one signature against a peak list, in [0, 1], with the matches
 * that produced it.
 */
public final class SignatureMatch {
    private final String signatureName;
    private final double score;
    private final List<FeatureMatch> matches;

    public SignatureMatch(String signatureName, double score, List<FeatureMatch> matches) {
        this.signatureName = signatureName;
        this.score = score;
        this.matches = Collections.unmodifiableList(new ArrayList<>(matches));
    }

    public String getSignatureName() {
        return signatureName;
    }

    public double getScore() {
        return score;
    }

    public List<FeatureMatch> getMatches() {
        return matches;
    }

    /**
     * Peaks that contributed to the score, in feature order. A peak claimed by
     * two features of the same signature appears once.
     */
    public List<Peak> getContributingPeaks() {
        List<Peak> peaks = new ArrayList<>();
        for (FeatureMatch m : matches) {
            if (!peaks.contains(m.getPeak())) {
                peaks.add(m.getPeak());
            }
        }
        return peaks;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof SignatureMatch)) {
            return false;
        }
        SignatureMatch that = (SignatureMatch) o;
        return Double.compare(that.score, score) == 0 && signatureName.equals(that.signatureName)
                && matches.equals(that.matches);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * signatureName.hashCode() + Double.hashCode(score)) + matches.hashCode();
    }

    @Override
    public String toString() {
        return String.format("%s=%.3f (%d features matched)", signatureName, score, matches.size());
    }
}
