package com.biospec.server.spectra.calibration;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

public class CalibrationMapTest {

    private static CalibrationAnchor a(double px, double nm) {
        return new CalibrationAnchor(px, nm);
    }

    @Test
    public void testLinearThroughTwoAnchors() {
        CalibrationMap map = CalibrationMap.fit(Arrays.asList(a(0, 450), a(1280, 700)));
        assertEquals(1, map.getDegree());
        assertEquals(450.0, map.wavelengthAt(0), 1e-9);
        assertEquals(575.0, map.wavelengthAt(640), 1e-9);
        assertEquals(550.0, map.wavelengthAt(512), 1e-9);
        assertEquals(250.0 / 1280.0, map.dispersionAt(100), 1e-12);

        double[] coeffs = map.getPixelCoefficients();
        assertEquals(450.0, coeffs[0], 1e-9);
        assertEquals(250.0 / 1280.0, coeffs[1], 1e-12);
    }

    @Test
    public void testDegreeFollowsAnchorCount() {
        assertEquals(1, CalibrationMap.degreeFor(2));
        assertEquals(2, CalibrationMap.degreeFor(3));
        assertEquals(2, CalibrationMap.degreeFor(4));
        assertEquals(3, CalibrationMap.degreeFor(5));
        assertEquals(3, CalibrationMap.degreeFor(12));

        List<CalibrationAnchor> five = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            five.add(a(i * 300, 400 + i * 70));
        }
        assertEquals(3, CalibrationMap.fit(five).getDegree());
        assertEquals(1, CalibrationMap.fit(five, WavelengthRange.VISIBLE, 1).getDegree());
    }

    @Test
    public void testCubicRecoversKnownCurve() {
        List<CalibrationAnchor> anchors = new ArrayList<>();
        for (int px = 0; px <= 1200; px += 200) {
            anchors.add(a(px, cubic(px)));
        }
        CalibrationMap map = CalibrationMap.fit(anchors);
        assertEquals(3, map.getDegree());
        for (int px = 0; px <= 1200; px += 37) {
            assertEquals(cubic(px), map.wavelengthAt(px), 1e-6);
        }
        double[] coeffs = map.getPixelCoefficients();
        assertEquals(401.0, coeffs[0], 1e-6);
        assertEquals(0.21, coeffs[1], 1e-9);
    }

    private static double cubic(double px) {
        return 401.0 + 0.21 * px + 2.0e-5 * px * px - 5.0e-9 * px * px * px;
    }

    @Test
    public void testLeastSquaresAveragesNoisyAnchors() {
        List<CalibrationAnchor> anchors = Arrays.asList(a(0, 400.5), a(0, 399.5), a(1000, 650.5), a(1000, 649.5));
        CalibrationMap map = CalibrationMap.fit(anchors);
        // four anchors on two pixels only support a line
        assertEquals(1, map.getDegree());
        assertEquals(400.0, map.wavelengthAt(0), 1e-9);
        assertEquals(650.0, map.wavelengthAt(1000), 1e-9);
    }

    @Test
    public void testAnchorOrderDoesNotMatter() {
        CalibrationMap sorted = CalibrationMap.fit(Arrays.asList(a(0, 400), a(640, 550), a(1279, 700)));
        CalibrationMap shuffled = CalibrationMap.fit(Arrays.asList(a(1279, 700), a(0, 400), a(640, 550)));
        assertEquals(sorted.wavelengthAt(333), shuffled.wavelengthAt(333), 1e-9);
        assertEquals(0.0, sorted.getAnchors().get(0).getPixel());
    }

    @Test
    public void testInsufficientAnchors() {
        assertThrows(InsufficientCalibrationException.class, () -> CalibrationMap.fit(null));
        assertThrows(InsufficientCalibrationException.class, () -> CalibrationMap.fit(Collections.emptyList()));
        assertThrows(InsufficientCalibrationException.class,
                () -> CalibrationMap.fit(Collections.singletonList(a(10, 500))));
        assertThrows(InsufficientCalibrationException.class,
                () -> CalibrationMap.fit(Arrays.asList(a(10, 500), a(10, 510))));
    }

    @Test
    public void testDecreasingFitIsNonMonotonic() {
        assertThrows(NonMonotonicCalibrationException.class,
                () -> CalibrationMap.fit(Arrays.asList(a(0, 700), a(1280, 400))));
    }

    @Test
    public void testTurningPointInsideAnchorSpan() {
        // quadratic through these anchors peaks near pixel 917
        assertThrows(NonMonotonicCalibrationException.class,
                () -> CalibrationMap.fit(Arrays.asList(a(0, 400), a(500, 600), a(1000, 650))));
    }

    @Test
    public void testRandomValidMapsAreMonotonic() {
        Random rnd = new Random(7);
        WavelengthRange wide = new WavelengthRange(300, 800);
        for (int trial = 0; trial < 50; trial++) {
            double slope = 0.15 + 0.1 * rnd.nextDouble();
            double curvature = (rnd.nextDouble() - 0.5) * 1.0e-4;
            int n = 2 + rnd.nextInt(7);
            List<CalibrationAnchor> anchors = new ArrayList<>();
            anchors.add(a(0, 400));
            anchors.add(a(1279, 400 + slope * 1279 + curvature * 1279 * 1279));
            for (int i = 2; i < n; i++) {
                double px = 1 + rnd.nextInt(1277);
                anchors.add(a(px, 400 + slope * px + curvature * px * px));
            }
            CalibrationMap map = CalibrationMap.fit(anchors, wide, 3);
            double prev = map.wavelengthAt(0);
            for (int px = 1; px < 1280; px++) {
                double wl = map.wavelengthAt(px);
                assertTrue(wl > prev, "trial " + trial + " not increasing at " + px);
                prev = wl;
            }
        }
    }

    @Test
    public void testInvalidSettings() {
        List<CalibrationAnchor> anchors = Arrays.asList(a(0, 400), a(100, 500));
        assertThrows(IllegalArgumentException.class, () -> CalibrationMap.fit(anchors, WavelengthRange.VISIBLE, 4));
        assertThrows(IllegalArgumentException.class, () -> CalibrationMap.fit(anchors, WavelengthRange.VISIBLE, 0));
        assertThrows(IllegalArgumentException.class, () -> new WavelengthRange(700, 400));
        assertThrows(IllegalArgumentException.class, () -> new CalibrationAnchor(Double.NaN, 400));
    }
}
