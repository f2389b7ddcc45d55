package com.biospec.server.spectra.peaks;

import java.util.Comparator;

final class PeakOrdering {

    static final Comparator<Peak> BY_WAVELENGTH = Comparator.comparingDouble(Peak::getCenterWavelengthNm);

    // strongest first; equal prominence keeps the sharper feature
    static final Comparator<Peak> BY_SIGNIFICANCE = Comparator.comparingDouble(Peak::getProminence).reversed()
            .thenComparingDouble(Peak::getFullWidthHalfMaxNm)
            .thenComparingDouble(Peak::getCenterWavelengthNm);

    private PeakOrdering() {
    }
}
