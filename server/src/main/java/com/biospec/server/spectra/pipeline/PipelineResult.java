package com.biospec.server.spectra.pipeline;

import com.biospec.server.spectra.Spectrum;
import com.biospec.server.spectra.biosig.BiosignatureReport;
import com.biospec.server.spectra.peaks.PeakList;

/**
 * Outputs of one successful pipeline run.
 */
public final class PipelineResult {
    private final Spectrum rawSpectrum;
    private final Spectrum spectrum;
    private final PeakList peaks;
    private final BiosignatureReport report;

    public PipelineResult(Spectrum rawSpectrum, Spectrum spectrum, PeakList peaks, BiosignatureReport report) {
        this.rawSpectrum = rawSpectrum;
        this.spectrum = spectrum;
        this.peaks = peaks;
        this.report = report;
    }

    public Spectrum getRawSpectrum() {
        return rawSpectrum;
    }

    /**
     * The calibrated spectrum.
     */
    public Spectrum getSpectrum() {
        return spectrum;
    }

    public PeakList getPeaks() {
        return peaks;
    }

    public BiosignatureReport getReport() {
        return report;
    }
}
