package com.biospec.server.spectra.peaks;

import java.util.Locale;

/**
 * Local background estimator used by the peak detector. The moving estimators
 * use the configured window; {@link #POLYNOMIAL} fits one cubic to the whole
 * spectrum and ignores it.
 */
public enum BaselineMethod {
    MOVING_MINIMUM("moving-minimum"),
    MOVING_MEDIAN("moving-median"),
    POLYNOMIAL("polynomial");

    static final int POLYNOMIAL_DEGREE = 3;

    private final String key;

    BaselineMethod(String key) {
        this.key = key;
    }

    public String getKey() {
        return key;
    }

    public double[] estimate(double[] values, int window) {
        switch (this) {
            case MOVING_MEDIAN:
                return SignalFilters.movingMedian(values, window);
            case POLYNOMIAL:
                return SignalFilters.polynomialFit(values, POLYNOMIAL_DEGREE);
            case MOVING_MINIMUM:
            default:
                return SignalFilters.movingMinimum(values, window);
        }
    }

    public static BaselineMethod fromKey(String key) {
        if (key == null || key.trim().isEmpty()) {
            throw new IllegalArgumentException("Baseline method key is empty");
        }
        String normalized = key.trim().toLowerCase(Locale.ROOT).replace('_', '-');
        for (BaselineMethod method : values()) {
            if (method.key.equals(normalized)) {
                return method;
            }
        }
        throw new IllegalArgumentException("Unknown baseline method '" + key + "'");
    }
}
