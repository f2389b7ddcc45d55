package com.biospec.server.spectra.pipeline;

import com.biospec.server.spectra.Frame;
import com.biospec.server.spectra.ReductionConfig;
import com.biospec.server.spectra.biosig.AnalysisConfig;
import com.biospec.server.spectra.biosig.SignatureLibrary;
import com.biospec.server.spectra.calibration.CalibrationMap;
import com.biospec.server.spectra.peaks.PeakDetectorConfig;

/**
 * Everything a pipeline run needs besides the frame itself. Built once from
 * the configuration and shared read-only by all worker threads.
 */
public final class PipelineSettings {
    public static final int DEFAULT_WORKER_THREADS = 2;

    private final ReductionConfig reduction;
    private final CalibrationMap calibration;
    private final PeakDetectorConfig peaks;
    private final AnalysisConfig analysis;
    private final SignatureLibrary library;
    private final int bitDepth;
    private final int workerThreads;

    public PipelineSettings(ReductionConfig reduction, CalibrationMap calibration, PeakDetectorConfig peaks,
            AnalysisConfig analysis, SignatureLibrary library, int bitDepth, int workerThreads) {
        if (reduction == null || calibration == null || peaks == null || analysis == null || library == null) {
            throw new IllegalArgumentException("reduction, calibration, peaks, analysis and library are required");
        }
        if (workerThreads < 1) {
            throw new IllegalArgumentException("workerThreads must be >= 1, got " + workerThreads);
        }
        if (bitDepth < 1 || bitDepth > 31) {
            throw new IllegalArgumentException("bitDepth must be in [1, 31], got " + bitDepth);
        }
        this.reduction = reduction;
        this.calibration = calibration;
        this.peaks = peaks;
        this.analysis = analysis;
        this.library = library;
        this.bitDepth = bitDepth;
        this.workerThreads = workerThreads;
    }

    public PipelineSettings(CalibrationMap calibration, SignatureLibrary library) {
        this(ReductionConfig.defaults(), calibration, PeakDetectorConfig.defaults(), AnalysisConfig.defaults(),
                library, Frame.DEFAULT_BIT_DEPTH, DEFAULT_WORKER_THREADS);
    }

    public ReductionConfig getReduction() {
        return reduction;
    }

    public CalibrationMap getCalibration() {
        return calibration;
    }

    public PeakDetectorConfig getPeaks() {
        return peaks;
    }

    public AnalysisConfig getAnalysis() {
        return analysis;
    }

    public SignatureLibrary getLibrary() {
        return library;
    }

    public int getBitDepth() {
        return bitDepth;
    }

    public int getWorkerThreads() {
        return workerThreads;
    }
}
