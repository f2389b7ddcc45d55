package com.biospec.server.spectra.peaks;

import org.apache.commons.math3.analysis.polynomials.PolynomialFunction;
import org.apache.commons.math3.fitting.PolynomialCurveFitter;
import org.apache.commons.math3.fitting.WeightedObservedPoints;
import org.apache.commons.math3.stat.descriptive.rank.Median;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Centred sliding-window filters. Windows are truncated at the array edges, so
 * the output always has the input's length.
 */
public class SignalFilters {

    /**
     * Moving average over {@code window} samples. A window of 1 or less
     * returns a copy of the input.
     */
    public static double[] movingAverage(double[] values, int window) {
        if (window <= 1 || values.length == 0) {
            return values.clone();
        }
        int half = window / 2;
        double[] prefix = new double[values.length + 1];
        for (int i = 0; i < values.length; i++) {
            prefix[i + 1] = prefix[i] + values[i];
        }
        double[] out = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            int lo = Math.max(0, i - half);
            int hi = Math.min(values.length - 1, i + half);
            out[i] = (prefix[hi + 1] - prefix[lo]) / (hi - lo + 1);
        }
        return out;
    }

    /**
     * Moving minimum over {@code window} samples using a monotonic deque.
     */
    public static double[] movingMinimum(double[] values, int window) {
        if (window <= 1 || values.length == 0) {
            return values.clone();
        }
        int half = window / 2;
        double[] out = new double[values.length];
        Deque<Integer> deque = new ArrayDeque<>();
        int next = 0;
        for (int i = 0; i < values.length; i++) {
            int hi = Math.min(values.length - 1, i + half);
            while (next <= hi) {
                while (!deque.isEmpty() && values[deque.peekLast()] >= values[next]) {
                    deque.pollLast();
                }
                deque.addLast(next);
                next++;
            }
            int lo = i - half;
            while (deque.peekFirst() < lo) {
                deque.pollFirst();
            }
            out[i] = values[deque.peekFirst()];
        }
        return out;
    }

    /**
     * Moving median over {@code window} samples.
     */
    public static double[] movingMedian(double[] values, int window) {
        if (window <= 1 || values.length == 0) {
            return values.clone();
        }
        int half = window / 2;
        Median median = new Median();
        double[] out = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            int lo = Math.max(0, i - half);
            int hi = Math.min(values.length - 1, i + half);
            out[i] = median.evaluate(values, lo, hi - lo + 1);
        }
        return out;
    }

    /**
     * Least-squares polynomial of the given degree through every sample,
     * evaluated at each sample. The abscissa is the sample index mapped onto
     * [-1, 1]; the degree drops when there are too few samples to support it.
     */
    public static double[] polynomialFit(double[] values, int degree) {
        int n = values.length;
        int effective = Math.min(degree, n - 1);
        if (effective < 1) {
            return values.clone();
        }
        WeightedObservedPoints observations = new WeightedObservedPoints();
        for (int i = 0; i < n; i++) {
            observations.add(scaledIndex(i, n), values[i]);
        }
        PolynomialFunction polynomial = new PolynomialFunction(
                PolynomialCurveFitter.create(effective).fit(observations.toList()));
        double[] out = new double[n];
        for (int i = 0; i < n; i++) {
            out[i] = polynomial.value(scaledIndex(i, n));
        }
        return out;
    }

    private static double scaledIndex(int i, int n) {
        return 2.0 * i / (n - 1) - 1.0;
    }
}
