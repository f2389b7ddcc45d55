package com.biospec.server.spectra.biosig;

import com.biospec.server.spectra.PipelineStage;
import com.biospec.server.spectra.peaks.Peak;
import com.biospec.server.spectra.peaks.PeakList;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class BiosignatureAnalyzerTest {

    private final BiosignatureAnalyzer analyzer = new BiosignatureAnalyzer();

    private static Peak peak(double nm, double prominence) {
        return new Peak(nm, prominence + 100, 2.0, prominence, false);
    }

    private static SignatureLibrary library() {
        Map<String, List<SignatureFeature>> defs = new LinkedHashMap<>();
        defs.put("chlorophyll-a", Arrays.asList(new SignatureFeature(430, 5, 1.0), new SignatureFeature(662, 5, 1.0),
                new SignatureFeature(680, 6, 0.5)));
        defs.put("carotenoid", Arrays.asList(new SignatureFeature(450, 8, 1.0), new SignatureFeature(480, 8, 1.0)));
        defs.put("generic-organic", Collections.singletonList(new SignatureFeature(420, 15, 1.0)));
        return SignatureLibrary.fromDefinitions(defs);
    }

    @Test
    public void testChlorophyllNearMiss() {
        SignatureLibrary lib = SignatureLibrary.fromDefinitions(Collections.singletonMap("chlorophyll-a",
                Collections.singletonList(new SignatureFeature(680, 5, 1.0))));
        BiosignatureReport report = analyzer.analyze(PeakList.of(Collections.singletonList(peak(679, 300))), lib);

        assertEquals(0.8, report.scoreOf("chlorophyll-a"), 1e-9);
        assertEquals(1, report.get("chlorophyll-a").getContributingPeaks().size());
        assertEquals(679.0, report.get("chlorophyll-a").getContributingPeaks().get(0).getCenterWavelengthNm());

        BiosignatureReport closer = analyzer.analyze(PeakList.of(Collections.singletonList(peak(679.5, 300))), lib);
        assertTrue(closer.scoreOf("chlorophyll-a") > 0.8);
    }

    @Test
    public void testScoreIsWeightNormalized() {
        // 430 exact (w 1.0), 662 missing, 680 exact (w 0.5): 1.5 / 2.5
        PeakList peaks = PeakList.of(Arrays.asList(peak(430, 200), peak(680, 200)));
        BiosignatureReport report = analyzer.analyze(peaks, library());
        assertEquals(0.6, report.scoreOf("chlorophyll-a"), 1e-12);
        assertEquals(2, report.get("chlorophyll-a").getMatches().size());
    }

    @Test
    public void testLinearDecayAndToleranceBoundary() {
        SignatureFeature f = new SignatureFeature(500, 4, 2.0);
        assertEquals(1.0, f.matchQuality(500), 0.0);
        assertEquals(0.5, f.matchQuality(502), 1e-12);
        assertEquals(0.5, f.matchQuality(498), 1e-12);
        assertEquals(0.0, f.matchQuality(504), 0.0);
        assertEquals(0.0, f.matchQuality(510), 0.0);

        SignatureLibrary lib = SignatureLibrary.fromDefinitions(
                Collections.singletonMap("edge", Collections.singletonList(f)));
        BiosignatureReport report = analyzer.analyze(PeakList.of(Collections.singletonList(peak(504, 50))), lib);
        assertEquals(0.0, report.scoreOf("edge"));
        assertTrue(report.get("edge").getMatches().isEmpty());
    }

    @Test
    public void testNoPeaksScoresZeroEverywhere() {
        BiosignatureReport report = analyzer.analyze(PeakList.empty(), library());
        assertEquals(3, report.getMatches().size());
        for (SignatureMatch m : report.getMatches().values()) {
            assertEquals(0.0, m.getScore());
            assertTrue(m.getContributingPeaks().isEmpty());
        }
        assertEquals(ConfidenceLevel.NONE, report.getConfidence());
        assertEquals("No biosignatures detected", report.getInterpretation());
    }

    @Test
    public void testSignaturesMayShareAPeak() {
        // 425 nm is inside generic-organic (420 +/- 15) and chlorophyll-a (430 +/- 5)
        PeakList peaks = PeakList.of(Collections.singletonList(peak(427, 100)));
        BiosignatureReport report = analyzer.analyze(peaks, library());
        assertTrue(report.scoreOf("generic-organic") > 0.0);
        assertTrue(report.scoreOf("chlorophyll-a") > 0.0);
        assertSame(report.get("generic-organic").getContributingPeaks().get(0),
                report.get("chlorophyll-a").getContributingPeaks().get(0));
    }

    @Test
    public void testNearestPeakWithinToleranceIsUsed() {
        PeakList peaks = PeakList.of(Arrays.asList(peak(446, 900), peak(451, 50)));
        BiosignatureReport report = analyzer.analyze(peaks, library());
        FeatureMatch m = report.get("carotenoid").getMatches().get(0);
        assertEquals(451.0, m.getPeak().getCenterWavelengthNm());
        assertEquals(1.0 - 1.0 / 8.0, m.getQuality(), 1e-12);
    }

    @Test
    public void testConfidenceLevels() {
        PeakList all = PeakList.of(Arrays.asList(peak(420, 100), peak(430, 100), peak(450, 100), peak(480, 100),
                peak(662, 100), peak(680, 100)));
        BiosignatureReport report = analyzer.analyze(all, library());
        assertEquals(ConfidenceLevel.HIGH, report.getConfidence());
        assertEquals(Arrays.asList("chlorophyll-a", "carotenoid", "generic-organic"), report.getDetectedSignatures());

        BiosignatureReport one = analyzer.analyze(PeakList.of(Collections.singletonList(peak(420, 100))), library());
        assertEquals(ConfidenceLevel.LOW, one.getConfidence());

        BiosignatureReport strict = analyzer.analyze(all, library(), new AnalysisConfig(1.0));
        assertEquals(ConfidenceLevel.HIGH, strict.getConfidence());

        assertEquals(ConfidenceLevel.MEDIUM, ConfidenceLevel.forDetectedCount(2));
    }

    @Test
    public void testRepeatedAnalysisIsIdentical() {
        PeakList peaks = PeakList.of(Arrays.asList(peak(428.3, 120), peak(455.1, 80), peak(661.2, 300)));
        SignatureLibrary lib = library();
        BiosignatureReport first = analyzer.analyze(peaks, lib);
        BiosignatureReport second = analyzer.analyze(peaks, lib);
        assertEquals(first, second);
        for (String name : first.getMatches().keySet()) {
            assertEquals(Double.doubleToLongBits(first.scoreOf(name)), Double.doubleToLongBits(second.scoreOf(name)));
        }
        assertEquals(Arrays.asList("chlorophyll-a", "carotenoid", "generic-organic"),
                Arrays.asList(first.getMatches().keySet().toArray()));
    }

    @Test
    public void testEmptyLibrary() {
        EmptyLibraryException e = assertThrows(EmptyLibraryException.class,
                () -> analyzer.analyze(PeakList.empty(), SignatureLibrary.of(Collections.emptyList())));
        assertEquals(PipelineStage.ANALYSIS, e.getStage());
        assertThrows(EmptyLibraryException.class, () -> analyzer.analyze(PeakList.empty(), null));
    }

    @Test
    public void testLibraryValidation() {
        assertThrows(IllegalArgumentException.class, () -> new SignatureFeature(500, 0, 1));
        assertThrows(IllegalArgumentException.class, () -> new SignatureFeature(500, 5, -1));
        assertThrows(IllegalArgumentException.class, () -> new Signature("x", Collections.emptyList()));
        assertThrows(IllegalArgumentException.class, () -> new Signature(" ", Collections.singletonList(
                new SignatureFeature(500, 5, 1))));
        Signature s = new Signature("dup", Collections.singletonList(new SignatureFeature(500, 5, 1)));
        assertThrows(IllegalArgumentException.class, () -> SignatureLibrary.of(Arrays.asList(s, s)));
    }
}
