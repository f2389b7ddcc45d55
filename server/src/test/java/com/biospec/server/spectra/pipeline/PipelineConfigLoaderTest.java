package com.biospec.server.spectra.pipeline;

import com.biospec.server.spectra.ReductionMode;
import com.biospec.server.spectra.biosig.Signature;
import com.biospec.server.spectra.calibration.InsufficientCalibrationException;
import com.biospec.server.spectra.peaks.BaselineMethod;
import com.biospec.server.spectra.peaks.PeakDetectorConfig;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class PipelineConfigLoaderTest {

    private static InputStream json(String s) {
        return new ByteArrayInputStream(s.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    public void testLoadDefaultConfig() {
        PipelineSettings settings = PipelineConfigLoader.loadDefault();

        assertEquals(ReductionMode.ROI_MEAN, settings.getReduction().getMode());
        assertEquals(8, settings.getReduction().getRoiHalfHeight());
        assertEquals(12, settings.getBitDepth());
        assertEquals(3, settings.getCalibration().getAnchors().size());
        assertEquals(2, settings.getCalibration().getDegree());
        assertEquals(550.0, settings.getCalibration().wavelengthAt(640), 1e-6);
        assertEquals(50.0, settings.getPeaks().getMinProminence());
        assertEquals(BaselineMethod.MOVING_MINIMUM, settings.getPeaks().getBaselineMethod());
        assertEquals(0.5, settings.getAnalysis().getDetectionThreshold());

        List<String> names = new ArrayList<>();
        for (Signature s : settings.getLibrary().getSignatures()) {
            names.add(s.getName());
        }
        assertEquals(List.of("chlorophyll-a", "carotenoid", "generic-organic"), names);
        assertEquals(3, settings.getLibrary().get("chlorophyll-a").getFeatures().size());
    }

    @Test
    public void testMissingSectionsFallBackToDefaults() throws Exception {
        String cfg = "{ \"calibration\": { \"anchors\": [ {\"pixel\": 0, \"wavelengthNm\": 450},"
                + " {\"pixel\": 1280, \"wavelengthNm\": 700} ] },"
                + " \"signatures\": [ {\"name\": \"x\", \"features\": [ {\"wavelengthNm\": 500, \"toleranceNm\": 3} ] } ],"
                + " \"someFutureKey\": true }";
        PipelineSettings settings = PipelineConfigLoader.load(json(cfg));

        PeakDetectorConfig d = PeakDetectorConfig.defaults();
        assertEquals(d.getMinProminence(), settings.getPeaks().getMinProminence());
        assertEquals(d.getBaselineWindow(), settings.getPeaks().getBaselineWindow());
        assertEquals(ReductionMode.ROI_MEAN, settings.getReduction().getMode());
        assertEquals(1, settings.getCalibration().getDegree());
        assertEquals(PipelineSettings.DEFAULT_WORKER_THREADS, settings.getWorkerThreads());
        assertEquals(1.0, settings.getLibrary().get("x").getFeatures().get(0).getWeight());
    }

    @Test
    public void testOverridesAreApplied() throws Exception {
        String cfg = "{ \"reduction\": {\"mode\": \"median\"}, \"bitDepth\": 16, \"workerThreads\": 5,"
                + " \"calibration\": { \"anchors\": [ {\"pixel\": 0, \"wavelengthNm\": 380},"
                + " {\"pixel\": 100, \"wavelengthNm\": 420} ], \"minWavelengthNm\": 350, \"maxWavelengthNm\": 800 },"
                + " \"peaks\": {\"minProminence\": 10, \"baselineMethod\": \"moving-median\", \"smoothingWindow\": 1},"
                + " \"analysis\": {\"detectionThreshold\": 0.9} }";
        PipelineSettings settings = PipelineConfigLoader.load(json(cfg));
        assertEquals(ReductionMode.MEDIAN, settings.getReduction().getMode());
        assertEquals(16, settings.getBitDepth());
        assertEquals(5, settings.getWorkerThreads());
        assertEquals(350.0, settings.getCalibration().getTrustedRange().getMinNm());
        assertEquals(10.0, settings.getPeaks().getMinProminence());
        assertEquals(BaselineMethod.MOVING_MEDIAN, settings.getPeaks().getBaselineMethod());
        assertFalse(settings.getPeaks().isSmoothingEnabled());
        assertEquals(0.9, settings.getAnalysis().getDetectionThreshold());
        assertTrue(settings.getLibrary().isEmpty());
    }

    @Test
    public void testInvalidConfig() {
        String badMode = "{ \"reduction\": {\"mode\": \"average\"}, \"calibration\": { \"anchors\": ["
                + " {\"pixel\": 0, \"wavelengthNm\": 450}, {\"pixel\": 1280, \"wavelengthNm\": 700} ] } }";
        assertThrows(IllegalArgumentException.class, () -> PipelineConfigLoader.load(json(badMode)));

        assertThrows(InsufficientCalibrationException.class, () -> PipelineConfigLoader.load(json("{}")));

        String badAnchor = "{ \"calibration\": { \"anchors\": [ {\"pixel\": 0} ] } }";
        assertThrows(IllegalArgumentException.class, () -> PipelineConfigLoader.load(json(badAnchor)));
    }
}
