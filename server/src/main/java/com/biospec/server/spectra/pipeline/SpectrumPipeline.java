package com.biospec.server.spectra.pipeline;

import com.biospec.server.spectra.Frame;
import com.biospec.server.spectra.FrameReducer;
import com.biospec.server.spectra.ReductionConfig;
import com.biospec.server.spectra.Spectrum;
import com.biospec.server.spectra.biosig.AnalysisConfig;
import com.biospec.server.spectra.biosig.BiosignatureAnalyzer;
import com.biospec.server.spectra.biosig.BiosignatureReport;
import com.biospec.server.spectra.biosig.SignatureFeature;
import com.biospec.server.spectra.biosig.SignatureLibrary;
import com.biospec.server.spectra.calibration.CalibrationAnchor;
import com.biospec.server.spectra.calibration.CalibrationMap;
import com.biospec.server.spectra.calibration.WavelengthCalibrator;
import com.biospec.server.spectra.calibration.WavelengthRange;
import com.biospec.server.spectra.peaks.PeakDetector;
import com.biospec.server.spectra.peaks.PeakDetectorConfig;
import com.biospec.server.spectra.peaks.PeakList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;

/**
 * Frame -> raw spectrum -> calibrated spectrum -> peaks -> report.
 *
 * Stage errors propagate unchanged and no partial result is returned. The
 * pipeline holds no mutable state, so one instance serves concurrent runs.
 */
public class SpectrumPipeline {
    private static final Logger logger = LoggerFactory.getLogger(SpectrumPipeline.class);

    private final FrameReducer reducer;
    private final WavelengthCalibrator calibrator;
    private final PeakDetector detector;
    private final BiosignatureAnalyzer analyzer;

    public SpectrumPipeline() {
        this(new FrameReducer(), new WavelengthCalibrator(), new PeakDetector(), new BiosignatureAnalyzer());
    }

    public SpectrumPipeline(FrameReducer reducer, WavelengthCalibrator calibrator, PeakDetector detector,
            BiosignatureAnalyzer analyzer) {
        this.reducer = reducer;
        this.calibrator = calibrator;
        this.detector = detector;
        this.analyzer = analyzer;
    }

    public PipelineResult runPipeline(Frame frame, CalibrationMap calibration, PeakDetectorConfig peakConfig,
            SignatureLibrary library) {
        return runPipeline(frame, ReductionConfig.defaults(), calibration, peakConfig, library,
                AnalysisConfig.defaults());
    }

    public PipelineResult runPipeline(Frame frame, PipelineSettings settings) {
        return runPipeline(frame, settings.getReduction(), settings.getCalibration(), settings.getPeaks(),
                settings.getLibrary(), settings.getAnalysis());
    }

    public PipelineResult runPipeline(Frame frame, ReductionConfig reduction, CalibrationMap calibration,
            PeakDetectorConfig peakConfig, SignatureLibrary library, AnalysisConfig analysis) {
        long start = System.nanoTime();

        Spectrum raw = reducer.reduce(frame, reduction);
        Spectrum calibrated = calibrator.calibrate(raw, calibration);
        PeakList peaks = detector.detect(calibrated, peakConfig);
        if (peaks.isEmpty()) {
            logger.warn("No peaks found in {} calibrated samples", calibrated.size());
        }
        BiosignatureReport report = analyzer.analyze(peaks, library, analysis);

        if (logger.isDebugEnabled()) {
            logger.debug("Pipeline finished in {} us: {} columns, {} calibrated samples, {} peaks, {}",
                    (System.nanoTime() - start) / 1000, raw.size(), calibrated.size(), peaks.size(),
                    report.getConfidence());
        }
        return new PipelineResult(raw, calibrated, peaks, report);
    }

    public static CalibrationMap loadCalibration(List<CalibrationAnchor> anchors) {
        return CalibrationMap.fit(anchors);
    }

    public static CalibrationMap loadCalibration(List<CalibrationAnchor> anchors, WavelengthRange trustedRange,
            int maxDegree) {
        return CalibrationMap.fit(anchors, trustedRange, maxDegree);
    }

    public static SignatureLibrary loadSignatureLibrary(Map<String, List<SignatureFeature>> definitions) {
        SignatureLibrary library = SignatureLibrary.fromDefinitions(definitions);
        logger.info("Loaded signature library with {} signatures", library.size());
        return library;
    }
}
