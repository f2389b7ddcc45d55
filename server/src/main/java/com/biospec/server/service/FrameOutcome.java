package com.biospec.server.service;

import com.biospec.server.spectra.PipelineStage;
import com.biospec.server.spectra.pipeline.PipelineResult;

/**
 * Result of one frame in a batch: either a measurement or the reason the
 * frame's run was aborted.
 */
public final class FrameOutcome {
    private final int index;
    private final Measurement measurement;
    private final PipelineStage failedStage;
    private final String error;

    private FrameOutcome(int index, Measurement measurement, PipelineStage failedStage, String error) {
        this.index = index;
        this.measurement = measurement;
        this.failedStage = failedStage;
        this.error = error;
    }

    public static FrameOutcome success(int index, Measurement measurement) {
        return new FrameOutcome(index, measurement, null, null);
    }

    public static FrameOutcome failure(int index, PipelineStage stage, String error) {
        return new FrameOutcome(index, null, stage, error);
    }

    public int getIndex() {
        return index;
    }

    public boolean isSuccess() {
        return measurement != null;
    }

    public Measurement getMeasurement() {
        return measurement;
    }

    public PipelineResult getResult() {
        return measurement == null ? null : measurement.getResult();
    }

    public PipelineStage getFailedStage() {
        return failedStage;
    }

    public String getError() {
        return error;
    }
}
