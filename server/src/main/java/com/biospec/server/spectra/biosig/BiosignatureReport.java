package com.biospec.server.spectra.biosig;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Terminal artifact of one pipeline run: a score per library signature in
 * library order, plus the overall confidence level.
 */
public final class BiosignatureReport {
    private final Map<String, SignatureMatch> matches;
    private final double detectionThreshold;
    private final ConfidenceLevel confidence;

    public BiosignatureReport(List<SignatureMatch> matches, double detectionThreshold) {
        Map<String, SignatureMatch> byName = new LinkedHashMap<>();
        int detected = 0;
        for (SignatureMatch m : matches) {
            byName.put(m.getSignatureName(), m);
            if (m.getScore() >= detectionThreshold) {
                detected++;
            }
        }
        this.matches = Collections.unmodifiableMap(byName);
        this.detectionThreshold = detectionThreshold;
        this.confidence = ConfidenceLevel.forDetectedCount(detected);
    }

    public Map<String, SignatureMatch> getMatches() {
        return matches;
    }

    public SignatureMatch get(String signatureName) {
        return matches.get(signatureName);
    }

    /**
     * Score of the named signature; 0.0 for a name the library does not contain.
     */
    public double scoreOf(String signatureName) {
        SignatureMatch m = matches.get(signatureName);
        return m == null ? 0.0 : m.getScore();
    }

    public List<String> getDetectedSignatures() {
        List<String> names = new ArrayList<>();
        for (SignatureMatch m : matches.values()) {
            if (m.getScore() >= detectionThreshold) {
                names.add(m.getSignatureName());
            }
        }
        return names;
    }

    public double getDetectionThreshold() {
        return detectionThreshold;
    }

    public ConfidenceLevel getConfidence() {
        return confidence;
    }

    public String getInterpretation() {
        return confidence.getInterpretation();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof BiosignatureReport)) {
            return false;
        }
        BiosignatureReport that = (BiosignatureReport) o;
        return Double.compare(that.detectionThreshold, detectionThreshold) == 0
                && new ArrayList<>(matches.values()).equals(new ArrayList<>(that.matches.values()));
    }

    @Override
    public int hashCode() {
        return 31 * new ArrayList<>(matches.values()).hashCode() + Double.hashCode(detectionThreshold);
    }

    @Override
    public String toString() {
        return "BiosignatureReport{" + confidence + ", " + matches.values() + "}";
    }
}
