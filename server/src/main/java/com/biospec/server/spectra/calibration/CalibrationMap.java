package com.biospec.server.spectra.calibration;

import org.apache.commons.math3.analysis.polynomials.PolynomialFunction;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.QRDecomposition;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.apache.commons.math3.linear.SingularMatrixException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

/**
 * Pixel-to-wavelength mapping fitted through a set of anchors.
 *
 * The polynomial is fitted by least squares in a centred, scaled coordinate
 * t = (pixel - center) / scale, which keeps the normal equations well
 * conditioned for cubic fits over a 1280 column sensor. Degree follows the
 * anchor count: 2 anchors give a line, 3-4 a quadratic, 5 or more a cubic,
 * never above {@code maxDegree}.
 */
public final class CalibrationMap {
    private static final Logger logger = LoggerFactory.getLogger(CalibrationMap.class);

    public static final int DEFAULT_MAX_DEGREE = 3;

    private final List<CalibrationAnchor> anchors;
    private final WavelengthRange trustedRange;
    private final int degree;
    private final double center;
    private final double scale;
    private final PolynomialFunction polynomial;
    private final PolynomialFunction derivative;

    private CalibrationMap(List<CalibrationAnchor> anchors, WavelengthRange trustedRange, int degree, double center,
            double scale, PolynomialFunction polynomial) {
        this.anchors = anchors;
        this.trustedRange = trustedRange;
        this.degree = degree;
        this.center = center;
        this.scale = scale;
        this.polynomial = polynomial;
        this.derivative = polynomial.polynomialDerivative();
    }

    public static CalibrationMap fit(List<CalibrationAnchor> anchors) {
        return fit(anchors, WavelengthRange.VISIBLE, DEFAULT_MAX_DEGREE);
    }

    public static CalibrationMap fit(List<CalibrationAnchor> anchors, WavelengthRange trustedRange, int maxDegree) {
        if (maxDegree < 1 || maxDegree > DEFAULT_MAX_DEGREE) {
            throw new IllegalArgumentException("maxDegree must be in [1, 3], got " + maxDegree);
        }
        if (trustedRange == null) {
            throw new IllegalArgumentException("trustedRange is required");
        }
        if (anchors == null || anchors.size() < 2) {
            throw new InsufficientCalibrationException("At least 2 calibration anchors are required, got "
                    + (anchors == null ? 0 : anchors.size()));
        }

        List<CalibrationAnchor> sorted = new ArrayList<>(anchors);
        sorted.sort(Comparator.comparingDouble(CalibrationAnchor::getPixel));

        int distinctPixels = 1;
        for (int i = 1; i < sorted.size(); i++) {
            if (sorted.get(i).getPixel() != sorted.get(i - 1).getPixel()) {
                distinctPixels++;
            }
        }
        if (distinctPixels < 2) {
            throw new InsufficientCalibrationException("Calibration anchors must cover at least 2 distinct pixels");
        }

        int degree = Math.min(degreeFor(sorted.size()), maxDegree);
        degree = Math.min(degree, distinctPixels - 1);

        double minPx = sorted.get(0).getPixel();
        double maxPx = sorted.get(sorted.size() - 1).getPixel();
        double center = (minPx + maxPx) / 2.0;
        double scale = (maxPx - minPx) / 2.0;

        RealMatrix design = new Array2DRowRealMatrix(sorted.size(), degree + 1);
        RealVector target = new ArrayRealVector(sorted.size());
        for (int i = 0; i < sorted.size(); i++) {
            double t = (sorted.get(i).getPixel() - center) / scale;
            double power = 1.0;
            for (int k = 0; k <= degree; k++) {
                design.setEntry(i, k, power);
                power *= t;
            }
            target.setEntry(i, sorted.get(i).getWavelengthNm());
        }

        double[] coefficients;
        try {
            coefficients = new QRDecomposition(design).getSolver().solve(target).toArray();
        } catch (SingularMatrixException e) {
            throw new InsufficientCalibrationException(
                    "Calibration anchors do not determine a degree " + degree + " fit: " + e.getMessage());
        }

        CalibrationMap map = new CalibrationMap(Collections.unmodifiableList(sorted), trustedRange, degree, center,
                scale, new PolynomialFunction(coefficients));
        map.checkIncreasing(minPx, maxPx);

        logger.debug("Fitted degree {} calibration through {} anchors, {} nm at px {} to {} nm at px {}", degree,
                sorted.size(), map.wavelengthAt(minPx), minPx, map.wavelengthAt(maxPx), maxPx);
        return map;
    }

    static int degreeFor(int anchorCount) {
        if (anchorCount <= 2) {
            return 1;
        }
        if (anchorCount <= 4) {
            return 2;
        }
        return 3;
    }

    public double wavelengthAt(double pixel) {
        return polynomial.value((pixel - center) / scale);
    }

    /**
     * d(wavelength)/d(pixel) in nm per pixel.
     */
    public double dispersionAt(double pixel) {
        return derivative.value((pixel - center) / scale) / scale;
    }

    /**
     * Verifies the curve strictly increases over [fromPixel, toPixel], sampling
     * the derivative at every pixel and half pixel.
     *
     * @throws NonMonotonicCalibrationException if the slope is not positive somewhere
     */
    public void checkIncreasing(double fromPixel, double toPixel) {
        int steps = (int) Math.ceil((toPixel - fromPixel) * 2.0);
        for (int i = 0; i <= steps; i++) {
            double px = Math.min(toPixel, fromPixel + i * 0.5);
            double slope = dispersionAt(px);
            if (!(slope > 0.0)) {
                throw new NonMonotonicCalibrationException(String.format(
                        "Calibration is not increasing at pixel %.1f (slope %.6f nm/px)", px, slope));
            }
        }
    }

    public List<CalibrationAnchor> getAnchors() {
        return anchors;
    }

    public WavelengthRange getTrustedRange() {
        return trustedRange;
    }

    public int getDegree() {
        return degree;
    }

    /**
     * Coefficients in powers of pixel, lowest first, expanded from the scaled fit.
     */
    public double[] getPixelCoefficients() {
        double[] scaled = polynomial.getCoefficients();
        double[] result = new double[scaled.length];
        // expand sum a_k * ((x - c) / s)^k with binomial terms
        for (int k = 0; k < scaled.length; k++) {
            double factor = scaled[k] / Math.pow(scale, k);
            for (int j = 0; j <= k; j++) {
                result[j] += factor * binomial(k, j) * Math.pow(-center, k - j);
            }
        }
        return result;
    }

    private static double binomial(int n, int k) {
        double r = 1.0;
        for (int i = 1; i <= k; i++) {
            r = r * (n - k + i) / i;
        }
        return r;
    }

    @Override
    public String toString() {
        return "CalibrationMap{degree=" + degree + ", anchors=" + anchors + ", trustedRange=" + trustedRange + "}";
    }
}
