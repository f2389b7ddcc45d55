package com.biospec.server.spectra;

/**
 * Immutable settings of the frame reducer. The ROI band only applies to
 * {@link ReductionMode#ROI_MEAN}; a null centre row means the frame's middle row.
 */
public final class ReductionConfig {
    public static final int DEFAULT_ROI_HALF_HEIGHT = 8;

    private final ReductionMode mode;
    private final Integer roiCenterRow;
    private final int roiHalfHeight;

    public ReductionConfig(ReductionMode mode, Integer roiCenterRow, int roiHalfHeight) {
        if (mode == null) {
            throw new IllegalArgumentException("mode is required");
        }
        if (roiCenterRow != null && roiCenterRow < 0) {
            throw new IllegalArgumentException("roiCenterRow must be >= 0, got " + roiCenterRow);
        }
        if (roiHalfHeight < 0) {
            throw new IllegalArgumentException("roiHalfHeight must be >= 0, got " + roiHalfHeight);
        }
        this.mode = mode;
        this.roiCenterRow = roiCenterRow;
        this.roiHalfHeight = roiHalfHeight;
    }

    public static ReductionConfig defaults() {
        return new ReductionConfig(ReductionMode.ROI_MEAN, null, DEFAULT_ROI_HALF_HEIGHT);
    }

    public static ReductionConfig of(ReductionMode mode) {
        return new ReductionConfig(mode, null, DEFAULT_ROI_HALF_HEIGHT);
    }

    public ReductionMode getMode() {
        return mode;
    }

    public Integer getRoiCenterRow() {
        return roiCenterRow;
    }

    public int getRoiHalfHeight() {
        return roiHalfHeight;
    }

    @Override
    public String toString() {
        return "ReductionConfig{mode=" + mode.getKey() + ", roiCenterRow=" + roiCenterRow + ", roiHalfHeight="
                + roiHalfHeight + "}";
    }
}
