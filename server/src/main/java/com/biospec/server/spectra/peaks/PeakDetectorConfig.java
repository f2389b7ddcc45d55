package com.biospec.server.spectra.peaks;

/**
 * Immutable peak detector thresholds. Passed into every detect call so
 * concurrent runs with different settings never share state.
 */
public final class PeakDetectorConfig {
    public static final double DEFAULT_MIN_PROMINENCE = 50.0;
    public static final double DEFAULT_MIN_SEPARATION_NM = 1.0;
    public static final int DEFAULT_BASELINE_WINDOW = 201;
    public static final int DEFAULT_SMOOTHING_WINDOW = 5;

    private final double minProminence;
    private final double minSeparationNm;
    private final int baselineWindow;
    private final BaselineMethod baselineMethod;
    private final int smoothingWindow;

    public PeakDetectorConfig(double minProminence, double minSeparationNm, int baselineWindow,
            BaselineMethod baselineMethod, int smoothingWindow) {
        if (!(minProminence >= 0.0) || Double.isInfinite(minProminence)) {
            throw new IllegalArgumentException("minProminence must be a finite value >= 0, got " + minProminence);
        }
        if (!(minSeparationNm >= 0.0) || Double.isInfinite(minSeparationNm)) {
            throw new IllegalArgumentException("minSeparationNm must be a finite value >= 0, got " + minSeparationNm);
        }
        if (baselineWindow < 1) {
            throw new IllegalArgumentException("baselineWindow must be >= 1, got " + baselineWindow);
        }
        if (smoothingWindow < 1) {
            throw new IllegalArgumentException("smoothingWindow must be >= 1 (1 disables smoothing), got "
                    + smoothingWindow);
        }
        if (baselineMethod == null) {
            throw new IllegalArgumentException("baselineMethod is required");
        }
        this.minProminence = minProminence;
        this.minSeparationNm = minSeparationNm;
        this.baselineWindow = baselineWindow;
        this.baselineMethod = baselineMethod;
        this.smoothingWindow = smoothingWindow;
    }

    public static PeakDetectorConfig defaults() {
        return new PeakDetectorConfig(DEFAULT_MIN_PROMINENCE, DEFAULT_MIN_SEPARATION_NM, DEFAULT_BASELINE_WINDOW,
                BaselineMethod.MOVING_MINIMUM, DEFAULT_SMOOTHING_WINDOW);
    }

    public PeakDetectorConfig withMinProminence(double value) {
        return new PeakDetectorConfig(value, minSeparationNm, baselineWindow, baselineMethod, smoothingWindow);
    }

    public PeakDetectorConfig withMinSeparationNm(double value) {
        return new PeakDetectorConfig(minProminence, value, baselineWindow, baselineMethod, smoothingWindow);
    }

    public PeakDetectorConfig withSmoothingWindow(int value) {
        return new PeakDetectorConfig(minProminence, minSeparationNm, baselineWindow, baselineMethod, value);
    }

    public PeakDetectorConfig withBaseline(BaselineMethod method, int window) {
        return new PeakDetectorConfig(minProminence, minSeparationNm, window, method, smoothingWindow);
    }

    public double getMinProminence() {
        return minProminence;
    }

    public double getMinSeparationNm() {
        return minSeparationNm;
    }

    public int getBaselineWindow() {
        return baselineWindow;
    }

    public BaselineMethod getBaselineMethod() {
        return baselineMethod;
    }

    public int getSmoothingWindow() {
        return smoothingWindow;
    }

    public boolean isSmoothingEnabled() {
        return smoothingWindow > 1;
    }

    @Override
    public String toString() {
        return "PeakDetectorConfig{minProminence=" + minProminence + ", minSeparationNm=" + minSeparationNm
                + ", baselineWindow=" + baselineWindow + ", baselineMethod=" + baselineMethod.getKey()
                + ", smoothingWindow=" + smoothingWindow + "}";
    }
}
