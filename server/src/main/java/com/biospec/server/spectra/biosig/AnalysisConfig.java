package com.biospec.server.spectra.biosig;

public final class AnalysisConfig {
    public static final double DEFAULT_DETECTION_THRESHOLD = 0.5;

    // a signature counts as detected when its score reaches this value
    private final double detectionThreshold;

    public AnalysisConfig(double detectionThreshold) {
        if (!(detectionThreshold > 0.0 && detectionThreshold <= 1.0)) {
            throw new IllegalArgumentException("detectionThreshold must be in (0, 1], got " + detectionThreshold);
        }
        this.detectionThreshold = detectionThreshold;
    }

    public static AnalysisConfig defaults() {
        return new AnalysisConfig(DEFAULT_DETECTION_THRESHOLD);
    }

    public double getDetectionThreshold() {
        return detectionThreshold;
    }

    @Override
    public String toString() {
        return "AnalysisConfig{detectionThreshold=" + detectionThreshold + "}";
    }
}
