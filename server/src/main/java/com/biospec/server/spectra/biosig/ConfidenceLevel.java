package com.biospec.server.spectra.biosig;

/**
 * Overall verdict of a report, from how many signatures were detected.
 */
public enum ConfidenceLevel {
    NONE("No biosignatures detected"),
    LOW("Weak biosignature detected"),
    MEDIUM("Multiple biosignatures detected"),
    HIGH("Strong biosignature pattern detected");

    private final String interpretation;

    ConfidenceLevel(String interpretation) {
        this.interpretation = interpretation;
    }

    public String getInterpretation() {
        return interpretation;
    }

    public static ConfidenceLevel forDetectedCount(int detected) {
        if (detected <= 0) {
            return NONE;
        }
        if (detected == 1) {
            return LOW;
        }
        if (detected == 2) {
            return MEDIUM;
        }
        return HIGH;
    }
}
