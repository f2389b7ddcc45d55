package com.biospec.server.spectra.peaks;

import com.biospec.server.spectra.PositionUnit;
import com.biospec.server.spectra.Spectrum;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Finds emission peaks in a calibrated spectrum.
 *
 * Steps: optional moving-average smoothing, local baseline by moving minimum
 * or median or a polynomial fit, local maxima whose rise above the baseline
 * reaches the minimum prominence, parabolic refinement of the centre (the
 * midpoint for a flat, clipped top), FWHM by walking outward to
 * half prominence, and finally merging of candidates closer than the minimum
 * separation. Degenerate spectra (flat, all zero, fewer than 3 samples) give an
 * empty list instead of an error.
 */
public class PeakDetector {
    private static final Logger logger = LoggerFactory.getLogger(PeakDetector.class);
    private static final double PLATEAU_TOLERANCE = 1e-9;

    public PeakList detect(Spectrum spectrum, PeakDetectorConfig config) {
        if (spectrum.getUnit() != PositionUnit.NANOMETER) {
            throw new IllegalArgumentException("Peak detection needs a wavelength-calibrated spectrum");
        }
        int n = spectrum.size();
        if (n < 3) {
            return PeakList.empty();
        }

        double[] positions = spectrum.getPositions();
        double[] smoothed = SignalFilters.movingAverage(spectrum.getIntensities(), config.getSmoothingWindow());
        double[] baseline = config.getBaselineMethod().estimate(smoothed, config.getBaselineWindow());

        List<Peak> candidates = new ArrayList<>();
        for (int i = 1; i < n - 1; i++) {
            boolean rising = smoothed[i] > smoothed[i - 1] && !level(smoothed[i], smoothed[i - 1]);
            if (!rising || (smoothed[i + 1] > smoothed[i] && !level(smoothed[i + 1], smoothed[i]))) {
                continue;
            }
            // a flat top (clipped line) spans [i, last]
            int last = i;
            while (last + 1 < n && level(smoothed[last + 1], smoothed[i])) {
                last++;
            }
            if (last + 1 < n && smoothed[last + 1] > smoothed[i]) {
                // a step on a rising flank, the maximum is further right
                i = last;
                continue;
            }
            int mid = (i + last) / 2;
            double rise = smoothed[i] - baseline[mid];
            if (rise > 0.0 && rise >= config.getMinProminence()) {
                candidates.add(buildPeak(spectrum, positions, smoothed, baseline, i, last));
            }
            i = last;
        }

        if (logger.isDebugEnabled()) {
            logger.debug("{} candidate maxima over {} samples ({} to {} nm)", candidates.size(), n, positions[0],
                    positions[n - 1]);
        }

        return PeakList.of(mergeCandidates(candidates, config.getMinSeparationNm()));
    }

    // smoothing leaves round-off on a clipped top, so plateau samples compare with a relative tolerance
    static boolean level(double a, double b) {
        return Math.abs(a - b) <= PLATEAU_TOLERANCE * Math.max(1.0, Math.max(Math.abs(a), Math.abs(b)));
    }

    private static Peak buildPeak(Spectrum spectrum, double[] positions, double[] smoothed, double[] baseline,
            int first, int last) {
        if (first == last) {
            return refinedPeak(spectrum, positions, smoothed, baseline, first);
        }

        // plateau: centre halfway between its first and last sample
        int mid = (first + last) / 2;
        double center = (first + last) % 2 == 0
                ? positions[mid]
                : (positions[mid] + positions[mid + 1]) / 2.0;
        double apex = smoothed[first];
        double prominence = apex - baseline[mid];

        double halfLevel = baseline[mid] + prominence / 2.0;
        double fwhm = halfLevelCrossing(positions, smoothed, last, halfLevel, 1)
                - halfLevelCrossing(positions, smoothed, first, halfLevel, -1);

        boolean saturated = false;
        for (int j = first; j <= last && !saturated; j++) {
            saturated = spectrum.isSaturatedAt(j);
        }
        return new Peak(center, apex, fwhm, prominence, saturated);
    }

    private static Peak refinedPeak(Spectrum spectrum, double[] positions, double[] smoothed, double[] baseline,
            int i) {
        double left = smoothed[i - 1];
        double apex = smoothed[i];
        double right = smoothed[i + 1];

        // vertex of the parabola through the three samples, in samples relative to i
        double denom = left - 2.0 * apex + right;
        double delta = denom < 0.0 ? 0.5 * (left - right) / denom : 0.0;
        delta = Math.max(-0.5, Math.min(0.5, delta));

        double center;
        if (delta >= 0.0) {
            center = positions[i] + delta * (positions[i + 1] - positions[i]);
        } else {
            center = positions[i] + delta * (positions[i] - positions[i - 1]);
        }
        double centerIntensity = apex - 0.25 * (left - right) * delta;
        double prominence = centerIntensity - baseline[i];

        double halfLevel = baseline[i] + prominence / 2.0;
        double fwhm = halfLevelCrossing(positions, smoothed, i, halfLevel, 1)
                - halfLevelCrossing(positions, smoothed, i, halfLevel, -1);

        return new Peak(center, centerIntensity, fwhm, prominence, spectrum.isSaturatedAt(i));
    }

    /**
     * Walks from {@code apex} in {@code direction} until the signal drops to
     * {@code level}, returning the linearly interpolated crossing position.
     * Reaching the edge of the spectrum returns the edge position.
     */
    static double halfLevelCrossing(double[] positions, double[] values, int apex, double level, int direction) {
        int j = apex;
        while (j + direction >= 0 && j + direction < values.length) {
            int next = j + direction;
            if (values[next] <= level) {
                double span = values[j] - values[next];
                double fraction = span > 0.0 ? (values[j] - level) / span : 0.0;
                return positions[j] + fraction * (positions[next] - positions[j]);
            }
            j = next;
        }
        return positions[j];
    }

    /**
     * Keeps the most significant candidate of every group closer than
     * {@code minSeparationNm}. Significance is prominence, then narrower FWHM.
     */
    static List<Peak> mergeCandidates(List<Peak> candidates, double minSeparationNm) {
        List<Peak> ranked = new ArrayList<>(candidates);
        ranked.sort(PeakOrdering.BY_SIGNIFICANCE);

        List<Peak> accepted = new ArrayList<>();
        for (Peak candidate : ranked) {
            boolean tooClose = false;
            for (Peak kept : accepted) {
                if (Math.abs(kept.getCenterWavelengthNm() - candidate.getCenterWavelengthNm()) < minSeparationNm) {
                    tooClose = true;
                    break;
                }
            }
            if (tooClose) {
                logger.trace("Merged {} into a stronger neighbour", candidate);
            } else {
                accepted.add(candidate);
            }
        }
        accepted.sort(PeakOrdering.BY_WAVELENGTH);
        return accepted;
    }
}
