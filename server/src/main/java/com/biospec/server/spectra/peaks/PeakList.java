package com.biospec.server.spectra.peaks;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;

/**
 * Peaks sorted by ascending centre wavelength.
 */
public final class PeakList implements Iterable<Peak> {
    private static final PeakList EMPTY = new PeakList(Collections.emptyList());

    private final List<Peak> peaks;

    private PeakList(List<Peak> peaks) {
        this.peaks = peaks;
    }

    public static PeakList empty() {
        return EMPTY;
    }

    /**
     * Builds a list from peaks in any order; they are sorted by wavelength.
     */
    public static PeakList of(List<Peak> peaks) {
        if (peaks == null || peaks.isEmpty()) {
            return EMPTY;
        }
        List<Peak> sorted = new ArrayList<>(peaks);
        sorted.sort(PeakOrdering.BY_WAVELENGTH);
        return new PeakList(Collections.unmodifiableList(sorted));
    }

    public int size() {
        return peaks.size();
    }

    public boolean isEmpty() {
        return peaks.isEmpty();
    }

    public Peak get(int index) {
        return peaks.get(index);
    }

    public List<Peak> asList() {
        return peaks;
    }

    /**
     * The peak closest to {@code wavelengthNm} within {@code toleranceNm}.
     * Equal distances prefer the higher prominence, then the lower wavelength.
     */
    public Optional<Peak> nearest(double wavelengthNm, double toleranceNm) {
        Peak best = null;
        double bestDistance = Double.POSITIVE_INFINITY;
        for (Peak p : peaks) {
            double d = Math.abs(p.getCenterWavelengthNm() - wavelengthNm);
            if (d > toleranceNm) {
                continue;
            }
            if (d < bestDistance || (d == bestDistance && p.getProminence() > best.getProminence())) {
                best = p;
                bestDistance = d;
            }
        }
        return Optional.ofNullable(best);
    }

    @Override
    public Iterator<Peak> iterator() {
        return peaks.iterator();
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof PeakList && peaks.equals(((PeakList) o).peaks));
    }

    @Override
    public int hashCode() {
        return peaks.hashCode();
    }

    @Override
    public String toString() {
        return "PeakList" + peaks;
    }
}
