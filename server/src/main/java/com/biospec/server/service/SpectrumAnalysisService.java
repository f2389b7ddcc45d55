package com.biospec.server.service;

import com.biospec.server.spectra.Frame;
import com.biospec.server.spectra.SpectralProcessingException;
import com.biospec.server.spectra.pipeline.PipelineConfigLoader;
import com.biospec.server.spectra.pipeline.PipelineResult;
import com.biospec.server.spectra.pipeline.PipelineSettings;
import com.biospec.server.spectra.pipeline.SpectrumPipeline;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Owns the reference data loaded at start-up (calibration and signature
 * library) and runs the pipeline for single frames or batches. Batch frames
 * run on a fixed pool; a failing frame is logged and reported without
 * affecting the others.
 */
@Service
public class SpectrumAnalysisService {

    private static final Logger logger = LoggerFactory.getLogger(SpectrumAnalysisService.class);

    private final PipelineSettings settings;
    private final SpectrumPipeline pipeline = new SpectrumPipeline();
    private final SessionStatistics statistics = new SessionStatistics();
    private final AtomicReference<Map<String, Object>> latest = new AtomicReference<>();
    private final AtomicLong sampleSequence = new AtomicLong();
    private final ExecutorService workers;

    public SpectrumAnalysisService() {
        this(PipelineConfigLoader.loadDefault());
    }

    public SpectrumAnalysisService(PipelineSettings settings) {
        this.settings = settings;
        AtomicInteger threadIds = new AtomicInteger();
        this.workers = Executors.newFixedThreadPool(settings.getWorkerThreads(), r -> {
            Thread t = new Thread(r, "spectrum-worker-" + threadIds.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        logger.info("Spectrum analysis service ready: {} signatures, {} worker threads",
                settings.getLibrary().size(), settings.getWorkerThreads());
    }

    public PipelineSettings getSettings() {
        return settings;
    }

    public SessionStatistics getStatistics() {
        return statistics;
    }

    /**
     * The record of the most recent successful analysis, or null before the first one.
     */
    public Map<String, Object> getLatestRecord() {
        return latest.get();
    }

    /**
     * Builds a frame at the configured sensor bit depth.
     */
    public Frame frameOf(int[][] pixels) {
        return new Frame(pixels, settings.getBitDepth());
    }

    public Measurement analyze(Frame frame) {
        return analyze(frame, null);
    }

    /**
     * Runs the pipeline on one frame. Without a sample id the measurement is
     * named {@code sample_NNN} from a per-service sequence.
     */
    public Measurement analyze(Frame frame, String sampleId) {
        String id = sampleId != null && !sampleId.trim().isEmpty()
                ? sampleId.trim()
                : String.format("sample_%03d", sampleSequence.incrementAndGet());
        try {
            PipelineResult result = pipeline.runPipeline(frame, settings);
            Measurement measurement = new Measurement(id, Instant.now(), result);
            statistics.recordSuccess(result.getReport().getConfidence());
            latest.set(measurement.toRecord());
            logger.debug("Analyzed {}", measurement);
            return measurement;
        } catch (SpectralProcessingException e) {
            statistics.recordFailure();
            throw e;
        }
    }

    public List<FrameOutcome> analyzeBatch(List<Frame> frames) {
        return analyzeBatch(frames, null);
    }

    /**
     * Analyzes the frames on the worker pool. {@code sampleIds}, when given,
     * names the frame at the same index.
     */
    public List<FrameOutcome> analyzeBatch(List<Frame> frames, List<String> sampleIds) {
        if (sampleIds != null && sampleIds.size() != frames.size()) {
            throw new IllegalArgumentException(
                    sampleIds.size() + " sample ids given for " + frames.size() + " frames");
        }
        List<Future<Measurement>> futures = new ArrayList<>(frames.size());
        for (int i = 0; i < frames.size(); i++) {
            Frame frame = frames.get(i);
            String sampleId = sampleIds != null ? sampleIds.get(i) : null;
            futures.add(workers.submit(() -> analyze(frame, sampleId)));
        }

        List<FrameOutcome> outcomes = new ArrayList<>(frames.size());
        for (int i = 0; i < futures.size(); i++) {
            try {
                outcomes.add(FrameOutcome.success(i, futures.get(i).get()));
            } catch (ExecutionException e) {
                Throwable cause = e.getCause();
                if (cause instanceof SpectralProcessingException) {
                    SpectralProcessingException spe = (SpectralProcessingException) cause;
                    logger.error("Frame {} failed at {}: {}", i, spe.getStage(), spe.getMessage());
                    outcomes.add(FrameOutcome.failure(i, spe.getStage(), spe.getMessage()));
                } else {
                    logger.error("Frame {} failed unexpectedly", i, cause);
                    statistics.recordFailure();
                    outcomes.add(FrameOutcome.failure(i, null, String.valueOf(cause)));
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("Interrupted while waiting for frame " + i, e);
            }
        }
        logger.info("Batch of {} frames done: {} succeeded", frames.size(),
                outcomes.stream().filter(FrameOutcome::isSuccess).count());
        return outcomes;
    }

    @PreDestroy
    public void shutdown() {
        workers.shutdown();
        try {
            if (!workers.awaitTermination(5, TimeUnit.SECONDS)) {
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            workers.shutdownNow();
            Thread.currentThread().interrupt();
        }
        logger.info("Session summary: {}", statistics.snapshot());
    }
}
