package com.biospec.server.tools;

import com.biospec.server.service.FrameOutcome;
import com.biospec.server.service.SpectrumAnalysisService;
import com.biospec.server.spectra.Frame;
import com.biospec.server.spectra.biosig.BiosignatureReport;
import com.biospec.server.spectra.biosig.SignatureMatch;
import com.biospec.server.spectra.pipeline.PipelineConfigLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Offline tool that runs the pipeline over every CSV frame in a directory.
 * Each line of a file is one sensor row of comma-separated integer samples.
 * Usage: FrameBatchAnalyzer <frameDir>
 */
public class FrameBatchAnalyzer {

    private static final Logger logger = LoggerFactory.getLogger(FrameBatchAnalyzer.class);

    public static void main(String[] args) {
        if (args.length < 1) {
            System.err.println("Usage: FrameBatchAnalyzer <frameDir>");
            System.exit(1);
        }

        File dir = new File(args[0]);
        if (!dir.isDirectory()) {
            System.err.println("Invalid frame directory: " + args[0]);
            System.exit(1);
        }

        SpectrumAnalysisService service = new SpectrumAnalysisService(PipelineConfigLoader.loadDefault());
        try {
            List<Path> files = listFrameFiles(dir.toPath());
            logger.info("Analyzing {} frame files from {}", files.size(), dir.getAbsolutePath());

            List<Frame> frames = new ArrayList<>();
            List<String> sampleIds = new ArrayList<>();
            for (Path file : files) {
                frames.add(readFrame(file, service.getSettings().getBitDepth()));
                sampleIds.add(sampleIdOf(file));
            }

            List<FrameOutcome> outcomes = service.analyzeBatch(frames, sampleIds);
            for (FrameOutcome outcome : outcomes) {
                logger.info("{}: {}", sampleIds.get(outcome.getIndex()), summarize(outcome));
            }
            logger.info("Session: {}", service.getStatistics().snapshot());
        } catch (IOException e) {
            logger.error("Failed to read frames", e);
            System.exit(2);
        } finally {
            service.shutdown();
        }
    }

    static List<Path> listFrameFiles(Path dir) throws IOException {
        List<Path> files = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir, "*.csv")) {
            for (Path p : stream) {
                files.add(p);
            }
        }
        files.sort(null);
        return files;
    }

    static String sampleIdOf(Path file) {
        String name = file.getFileName().toString();
        return name.endsWith(".csv") ? name.substring(0, name.length() - 4) : name;
    }

    static Frame readFrame(Path file, int bitDepth) throws IOException {
        List<int[]> rows = new ArrayList<>();
        int lineNo = 0;
        for (String line : Files.readAllLines(file, StandardCharsets.UTF_8)) {
            lineNo++;
            String trimmed = line.trim();
            if (trimmed.isEmpty() || trimmed.startsWith("#")) {
                continue;
            }
            String[] parts = trimmed.split(",");
            int[] row = new int[parts.length];
            for (int i = 0; i < parts.length; i++) {
                try {
                    row[i] = Integer.parseInt(parts[i].trim());
                } catch (NumberFormatException e) {
                    throw new IOException(file.getFileName() + " line " + lineNo + ": bad sample '" + parts[i] + "'",
                            e);
                }
            }
            rows.add(row);
        }
        try {
            return new Frame(rows.toArray(new int[0][]), bitDepth);
        } catch (IllegalArgumentException e) {
            throw new IOException(file.getFileName() + ": " + e.getMessage(), e);
        }
    }

    static String summarize(FrameOutcome outcome) {
        if (!outcome.isSuccess()) {
            return "FAILED at " + outcome.getFailedStage() + " (" + outcome.getError() + ")";
        }
        BiosignatureReport report = outcome.getResult().getReport();
        StringBuilder sb = new StringBuilder();
        sb.append(report.getConfidence()).append(" - ").append(report.getInterpretation());
        sb.append(" [").append(outcome.getResult().getPeaks().size()).append(" peaks]");
        for (SignatureMatch m : report.getMatches().values()) {
            sb.append(String.format(" %s=%.2f", m.getSignatureName(), m.getScore()));
        }
        return sb.toString();
    }
}
