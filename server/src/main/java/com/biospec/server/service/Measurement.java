package com.biospec.server.service;

import com.biospec.server.spectra.pipeline.PipelineResult;
import com.biospec.util.SpectralRecords;

import java.time.Instant;
import java.util.Map;

/**
 * One analyzed frame: the pipeline result plus the sample it was taken from
 * and when it was analyzed.
 */
public final class Measurement {
    private final String sampleId;
    private final Instant timestamp;
    private final PipelineResult result;

    public Measurement(String sampleId, Instant timestamp, PipelineResult result) {
        this.sampleId = sampleId;
        this.timestamp = timestamp;
        this.result = result;
    }

    public String getSampleId() {
        return sampleId;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public PipelineResult getResult() {
        return result;
    }

    public Map<String, Object> toRecord() {
        return SpectralRecords.toRecord(result, sampleId, timestamp);
    }

    @Override
    public String toString() {
        return "Measurement{" + sampleId + " at " + timestamp + ", " + result.getPeaks().size() + " peaks, "
                + result.getReport().getConfidence() + "}";
    }
}
