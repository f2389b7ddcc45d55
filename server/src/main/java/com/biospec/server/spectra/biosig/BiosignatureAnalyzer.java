package com.biospec.server.spectra.biosig;

import com.biospec.server.spectra.peaks.Peak;
import com.biospec.server.spectra.peaks.PeakList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Scores every library signature against a peak list.
 *
 * Each feature looks up the nearest peak within its tolerance and contributes
 * weight * quality, quality falling linearly from 1 at the expected wavelength
 * to 0 at the tolerance edge. The sum is divided by the signature's total
 * weight. Signatures are scored independently, so two of them may claim the
 * same physical peak.
 */
public class BiosignatureAnalyzer {
    private static final Logger logger = LoggerFactory.getLogger(BiosignatureAnalyzer.class);

    public BiosignatureReport analyze(PeakList peaks, SignatureLibrary library) {
        return analyze(peaks, library, AnalysisConfig.defaults());
    }

    public BiosignatureReport analyze(PeakList peaks, SignatureLibrary library, AnalysisConfig config) {
        if (library == null || library.isEmpty()) {
            throw new EmptyLibraryException("No signatures configured for biosignature analysis");
        }

        List<SignatureMatch> results = new ArrayList<>();
        for (Signature signature : library.getSignatures()) {
            results.add(score(signature, peaks));
        }

        BiosignatureReport report = new BiosignatureReport(results, config.getDetectionThreshold());
        logger.debug("Analyzed {} peaks against {} signatures: {}", peaks.size(), library.size(),
                report.getConfidence());
        return report;
    }

    static SignatureMatch score(Signature signature, PeakList peaks) {
        List<FeatureMatch> matches = new ArrayList<>();
        double sum = 0.0;
        for (SignatureFeature feature : signature.getFeatures()) {
            Optional<Peak> nearest = peaks.nearest(feature.getWavelengthNm(), feature.getToleranceNm());
            if (!nearest.isPresent()) {
                continue;
            }
            double quality = feature.matchQuality(nearest.get().getCenterWavelengthNm());
            if (quality <= 0.0) {
                continue;
            }
            FeatureMatch match = new FeatureMatch(feature, nearest.get(), quality);
            matches.add(match);
            sum += match.getContribution();
        }
        double score = Math.max(0.0, Math.min(1.0, sum / signature.getTotalWeight()));
        return new SignatureMatch(signature.getName(), score, matches);
    }
}
