package com.biospec.server.service;

import com.biospec.server.spectra.biosig.ConfidenceLevel;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory counters for the current session. Safe to update from worker threads.
 */
public class SessionStatistics {
    private final AtomicLong analyzed = new AtomicLong();
    private final AtomicLong failed = new AtomicLong();
    private final Map<ConfidenceLevel, AtomicLong> byConfidence = new ConcurrentHashMap<>();

    public SessionStatistics() {
        for (ConfidenceLevel level : ConfidenceLevel.values()) {
            byConfidence.put(level, new AtomicLong());
        }
    }

    public void recordSuccess(ConfidenceLevel confidence) {
        analyzed.incrementAndGet();
        byConfidence.get(confidence).incrementAndGet();
    }

    public void recordFailure() {
        failed.incrementAndGet();
    }

    public long getAnalyzed() {
        return analyzed.get();
    }

    public long getFailed() {
        return failed.get();
    }

    public long count(ConfidenceLevel level) {
        return byConfidence.get(level).get();
    }

    public Map<String, Object> snapshot() {
        Map<ConfidenceLevel, Long> levels = new EnumMap<>(ConfidenceLevel.class);
        byConfidence.forEach((k, v) -> levels.put(k, v.get()));

        Map<String, Object> out = new LinkedHashMap<>();
        out.put("totalMeasurements", analyzed.get());
        out.put("failedMeasurements", failed.get());
        for (Map.Entry<ConfidenceLevel, Long> e : levels.entrySet()) {
            out.put(e.getKey().name().toLowerCase(Locale.ROOT) + "Confidence", e.getValue());
        }
        return out;
    }
}
