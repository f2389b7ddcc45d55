package com.biospec.server.spectra;

import java.util.Locale;

/**
 * Column-collapse strategy used by {@link FrameReducer}.
 */
public enum ReductionMode {
    SUM("sum"),
    MEAN("mean"),
    MAX("max"),
    ROI_MEAN("roi-mean"),
    MEDIAN("median"),
    CENTER_ROW("center-row");

    private final String key;

    ReductionMode(String key) {
        this.key = key;
    }

    public String getKey() {
        return key;
    }

    /**
     * Resolves a configuration key such as "roi-mean". Case and surrounding
     * whitespace are ignored; underscores are accepted in place of dashes.
     */
    public static ReductionMode fromKey(String key) {
        if (key == null || key.trim().isEmpty()) {
            throw new IllegalArgumentException("Reduction mode key is empty");
        }
        String normalized = key.trim().toLowerCase(Locale.ROOT).replace('_', '-');
        for (ReductionMode mode : values()) {
            if (mode.key.equals(normalized)) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unknown reduction mode '" + key + "'");
    }
}
