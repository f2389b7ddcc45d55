package com.biospec.server.spectra.pipeline;

import com.biospec.server.spectra.Frame;
import com.biospec.server.spectra.ReductionConfig;
import com.biospec.server.spectra.ReductionMode;
import com.biospec.server.spectra.biosig.AnalysisConfig;
import com.biospec.server.spectra.biosig.SignatureFeature;
import com.biospec.server.spectra.biosig.SignatureLibrary;
import com.biospec.server.spectra.calibration.CalibrationAnchor;
import com.biospec.server.spectra.calibration.CalibrationMap;
import com.biospec.server.spectra.calibration.WavelengthRange;
import com.biospec.server.spectra.peaks.BaselineMethod;
import com.biospec.server.spectra.peaks.PeakDetectorConfig;
import com.biospec.server.util.ConfigSourceResolver;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads pipeline_config.json into {@link PipelineSettings}. Absent fields take
 * the defaults of the corresponding config classes.
 */
public class PipelineConfigLoader {

    private static final Logger logger = LoggerFactory.getLogger(PipelineConfigLoader.class);

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ConfigRoot {
        public ReductionNode reduction;
        public Integer bitDepth;
        public CalibrationNode calibration;
        public PeaksNode peaks;
        public AnalysisNode analysis;
        public List<SignatureNode> signatures;
        public Integer workerThreads;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ReductionNode {
        public String mode;
        public Integer roiCenterRow;
        public Integer roiHalfHeight;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class CalibrationNode {
        public List<AnchorNode> anchors;
        public Double minWavelengthNm;
        public Double maxWavelengthNm;
        public Integer maxDegree;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class AnchorNode {
        public Double pixel;
        public Double wavelengthNm;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class PeaksNode {
        public Double minProminence;
        public Double minSeparationNm;
        public Integer baselineWindow;
        public String baselineMethod;
        public Integer smoothingWindow;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class AnalysisNode {
        public Double detectionThreshold;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class SignatureNode {
        public String name;
        public List<FeatureNode> features;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class FeatureNode {
        public Double wavelengthNm;
        public Double toleranceNm;
        public Double weight;
    }

    public static PipelineSettings loadDefault() {
        String source = ConfigSourceResolver.describeConfigSource();
        try (InputStream is = ConfigSourceResolver.openConfig()) {
            PipelineSettings settings = load(is);
            logger.info("Loaded pipeline configuration from {}", source);
            return settings;
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read pipeline configuration from " + source, e);
        }
    }

    public static PipelineSettings load(InputStream is) throws IOException {
        ObjectMapper mapper = new ObjectMapper();
        ConfigRoot root = mapper.readValue(is, ConfigRoot.class);
        return toSettings(root);
    }

    public static PipelineSettings toSettings(ConfigRoot root) {
        if (root == null) {
            throw new IllegalArgumentException("Empty pipeline configuration");
        }
        ReductionConfig reduction = toReduction(root.reduction);
        CalibrationMap calibration = toCalibration(root.calibration);
        PeakDetectorConfig peaks = toPeaks(root.peaks);
        AnalysisConfig analysis = root.analysis != null && root.analysis.detectionThreshold != null
                ? new AnalysisConfig(root.analysis.detectionThreshold)
                : AnalysisConfig.defaults();
        SignatureLibrary library = SpectrumPipeline.loadSignatureLibrary(toDefinitions(root.signatures));
        if (library.isEmpty()) {
            logger.warn("Configuration defines no signatures, every analysis will fail");
        }
        int bitDepth = root.bitDepth != null ? root.bitDepth : Frame.DEFAULT_BIT_DEPTH;
        int workers = root.workerThreads != null ? root.workerThreads : PipelineSettings.DEFAULT_WORKER_THREADS;

        logger.info("Pipeline settings: {}, calibration degree {}, {}, {}, bitDepth={}, workers={}", reduction,
                calibration.getDegree(), peaks, analysis, bitDepth, workers);
        return new PipelineSettings(reduction, calibration, peaks, analysis, library, bitDepth, workers);
    }

    static ReductionConfig toReduction(ReductionNode node) {
        if (node == null) {
            return ReductionConfig.defaults();
        }
        ReductionMode mode = node.mode != null ? ReductionMode.fromKey(node.mode) : ReductionMode.ROI_MEAN;
        int halfHeight = node.roiHalfHeight != null ? node.roiHalfHeight : ReductionConfig.DEFAULT_ROI_HALF_HEIGHT;
        return new ReductionConfig(mode, node.roiCenterRow, halfHeight);
    }

    static CalibrationMap toCalibration(CalibrationNode node) {
        List<CalibrationAnchor> anchors = new ArrayList<>();
        if (node != null && node.anchors != null) {
            for (AnchorNode a : node.anchors) {
                if (a.pixel == null || a.wavelengthNm == null) {
                    throw new IllegalArgumentException("Calibration anchor needs both pixel and wavelengthNm");
                }
                anchors.add(new CalibrationAnchor(a.pixel, a.wavelengthNm));
            }
        }
        double min = WavelengthRange.VISIBLE.getMinNm();
        double max = WavelengthRange.VISIBLE.getMaxNm();
        int maxDegree = CalibrationMap.DEFAULT_MAX_DEGREE;
        if (node != null) {
            min = node.minWavelengthNm != null ? node.minWavelengthNm : min;
            max = node.maxWavelengthNm != null ? node.maxWavelengthNm : max;
            maxDegree = node.maxDegree != null ? node.maxDegree : maxDegree;
        }
        return SpectrumPipeline.loadCalibration(anchors, new WavelengthRange(min, max), maxDegree);
    }

    static PeakDetectorConfig toPeaks(PeaksNode node) {
        PeakDetectorConfig d = PeakDetectorConfig.defaults();
        if (node == null) {
            return d;
        }
        return new PeakDetectorConfig(
                node.minProminence != null ? node.minProminence : d.getMinProminence(),
                node.minSeparationNm != null ? node.minSeparationNm : d.getMinSeparationNm(),
                node.baselineWindow != null ? node.baselineWindow : d.getBaselineWindow(),
                node.baselineMethod != null ? BaselineMethod.fromKey(node.baselineMethod) : d.getBaselineMethod(),
                node.smoothingWindow != null ? node.smoothingWindow : d.getSmoothingWindow());
    }

    static Map<String, List<SignatureFeature>> toDefinitions(List<SignatureNode> nodes) {
        Map<String, List<SignatureFeature>> definitions = new LinkedHashMap<>();
        if (nodes == null) {
            return definitions;
        }
        for (SignatureNode s : nodes) {
            List<SignatureFeature> features = new ArrayList<>();
            if (s.features != null) {
                for (FeatureNode f : s.features) {
                    if (f.wavelengthNm == null || f.toleranceNm == null) {
                        throw new IllegalArgumentException(
                                "Feature of signature '" + s.name + "' needs wavelengthNm and toleranceNm");
                    }
                    features.add(new SignatureFeature(f.wavelengthNm, f.toleranceNm, f.weight != null ? f.weight : 1.0));
                }
            }
            if (definitions.containsKey(s.name)) {
                throw new IllegalArgumentException("Duplicate signature '" + s.name + "'");
            }
            definitions.put(s.name, features);
        }
        return definitions;
    }
}
