package com.biospec.server.spectra;

public enum PipelineStage {
    REDUCTION,
    CALIBRATION,
    PEAK_DETECTION,
    ANALYSIS
}
