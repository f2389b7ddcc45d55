package com.biospec.util;

import com.biospec.server.spectra.Spectrum;
import com.biospec.server.spectra.biosig.BiosignatureReport;
import com.biospec.server.spectra.biosig.FeatureMatch;
import com.biospec.server.spectra.biosig.SignatureMatch;
import com.biospec.server.spectra.calibration.CalibrationMap;
import com.biospec.server.spectra.peaks.Peak;
import com.biospec.server.spectra.peaks.PeakList;
import com.biospec.server.spectra.pipeline.PipelineResult;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Converts pipeline outputs into nested key/value records (maps, lists,
 * numbers, strings, booleans) so that consumers can render or persist them
 * without the domain types. Key order is stable.
 */
public class SpectralRecords {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    public static Map<String, Object> toRecord(Spectrum spectrum) {
        Map<String, Object> record = new LinkedHashMap<>();
        record.put("unit", spectrum.getUnit().name().toLowerCase(Locale.ROOT));
        record.put("size", spectrum.size());
        record.put("positions", spectrum.getPositions());
        record.put("intensities", spectrum.getIntensities());
        record.put("normalizedIntensities", spectrum.normalized().getIntensities());
        List<Integer> saturated = new ArrayList<>();
        for (int i = 0; i < spectrum.size(); i++) {
            if (spectrum.isSaturatedAt(i)) {
                saturated.add(i);
            }
        }
        record.put("saturatedIndices", saturated);
        return record;
    }

    public static Map<String, Object> toRecord(Peak peak) {
        Map<String, Object> record = new LinkedHashMap<>();
        record.put("centerWavelengthNm", peak.getCenterWavelengthNm());
        record.put("centerIntensity", peak.getCenterIntensity());
        record.put("fullWidthHalfMaxNm", peak.getFullWidthHalfMaxNm());
        record.put("prominence", peak.getProminence());
        record.put("saturated", peak.isSaturated());
        return record;
    }

    public static List<Map<String, Object>> toRecords(PeakList peaks) {
        List<Map<String, Object>> records = new ArrayList<>();
        for (Peak p : peaks) {
            records.add(toRecord(p));
        }
        return records;
    }

    public static Map<String, Object> toRecord(BiosignatureReport report) {
        Map<String, Object> signatures = new LinkedHashMap<>();
        for (SignatureMatch m : report.getMatches().values()) {
            Map<String, Object> sig = new LinkedHashMap<>();
            sig.put("score", m.getScore());
            sig.put("detected", m.getScore() >= report.getDetectionThreshold());
            List<Map<String, Object>> features = new ArrayList<>();
            for (FeatureMatch fm : m.getMatches()) {
                Map<String, Object> f = new LinkedHashMap<>();
                f.put("expectedWavelengthNm", fm.getFeature().getWavelengthNm());
                f.put("toleranceNm", fm.getFeature().getToleranceNm());
                f.put("weight", fm.getFeature().getWeight());
                f.put("quality", fm.getQuality());
                f.put("peak", toRecord(fm.getPeak()));
                features.add(f);
            }
            sig.put("matchedFeatures", features);
            signatures.put(m.getSignatureName(), sig);
        }

        Map<String, Object> record = new LinkedHashMap<>();
        record.put("confidence", report.getConfidence().name().toLowerCase(Locale.ROOT));
        record.put("interpretation", report.getInterpretation());
        record.put("detectionThreshold", report.getDetectionThreshold());
        record.put("detected", report.getDetectedSignatures());
        record.put("signatures", signatures);
        return record;
    }

    public static Map<String, Object> toRecord(CalibrationMap calibration) {
        Map<String, Object> record = new LinkedHashMap<>();
        record.put("degree", calibration.getDegree());
        record.put("pixelCoefficients", calibration.getPixelCoefficients());
        List<Map<String, Object>> anchors = new ArrayList<>();
        calibration.getAnchors().forEach(a -> {
            Map<String, Object> anchor = new LinkedHashMap<>();
            anchor.put("pixel", a.getPixel());
            anchor.put("wavelengthNm", a.getWavelengthNm());
            anchors.add(anchor);
        });
        record.put("anchors", anchors);
        record.put("minWavelengthNm", calibration.getTrustedRange().getMinNm());
        record.put("maxWavelengthNm", calibration.getTrustedRange().getMaxNm());
        return record;
    }

    public static Map<String, Object> toRecord(PipelineResult result) {
        Map<String, Object> record = new LinkedHashMap<>();
        record.put("peaksDetected", result.getPeaks().size());
        record.put("spectrum", toRecord(result.getSpectrum()));
        record.put("peaks", toRecords(result.getPeaks()));
        record.put("biosignatureAnalysis", toRecord(result.getReport()));
        return record;
    }

    /**
     * The record of a logged measurement: sample id and ISO-8601 timestamp
     * ahead of the pipeline result fields.
     */
    public static Map<String, Object> toRecord(PipelineResult result, String sampleId, Instant timestamp) {
        Map<String, Object> record = new LinkedHashMap<>();
        record.put("sampleId", sampleId);
        record.put("timestamp", timestamp.toString());
        record.putAll(toRecord(result));
        return record;
    }

    public static String toJson(Object record) {
        try {
            return MAPPER.writeValueAsString(record);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Record is not serializable: " + e.getMessage(), e);
        }
    }
}
