package com.biospec.server.controller;

import com.biospec.server.service.Measurement;
import com.biospec.server.service.SpectrumAnalysisService;
import com.biospec.server.spectra.Frame;
import com.biospec.server.spectra.SpectralProcessingException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Collections;
import java.util.Map;

@RestController
public class AnalysisController {

    private static final Logger logger = LoggerFactory.getLogger(AnalysisController.class);
    private final SpectrumAnalysisService analysisService;

    public AnalysisController(SpectrumAnalysisService analysisService) {
        this.analysisService = analysisService;
    }

    public static class FrameRequest {
        public int[][] pixels;
        // optional, defaults to the configured sensor bit depth
        public Integer bitDepth;
        public String sampleId;
    }

    @PostMapping("/analyze-frame")
    public ResponseEntity<?> analyze(@RequestBody FrameRequest request) {
        if (request == null || request.pixels == null) {
            return ResponseEntity.badRequest().body("Missing frame pixels.");
        }

        logger.info("Received frame of {} rows.", request.pixels.length);

        try {
            Frame frame = request.bitDepth != null
                    ? new Frame(request.pixels, request.bitDepth)
                    : analysisService.frameOf(request.pixels);
            Measurement measurement = analysisService.analyze(frame, request.sampleId);
            return ResponseEntity.ok(measurement.toRecord());
        } catch (SpectralProcessingException e) {
            logger.warn("Frame rejected at {}: {}", e.getStage(), e.getMessage());
            return ResponseEntity.badRequest().body(e.getStage() + ": " + e.getMessage());
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(e.getMessage());
        }
    }

    @GetMapping("/latest")
    public ResponseEntity<Map<String, Object>> latest() {
        Map<String, Object> record = analysisService.getLatestRecord();
        if (record == null) {
            return ResponseEntity.ok(Collections.singletonMap("status", "no_data"));
        }
        return ResponseEntity.ok(record);
    }

    @GetMapping("/stats")
    public ResponseEntity<Map<String, Object>> stats() {
        return ResponseEntity.ok(analysisService.getStatistics().snapshot());
    }
}
