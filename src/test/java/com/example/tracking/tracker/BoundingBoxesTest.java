package com.example.tracking.tracker;

import org.junit.Test;

import static org.junit.Assert.*;

public class BoundingBoxesTest {

    private static final double EPS = 1e-9;

    @Test
    public void testIouIdenticalBoxes() {
        double[] box = {100, 100, 200, 200};
        assertEquals(1.0, BoundingBoxes.iou(box, box.clone()), EPS);
    }

    @Test
    public void testIouDisjointBoxes() {
        assertEquals(0.0, BoundingBoxes.iou(new double[]{100, 100, 200, 200}, new double[]{300, 300, 400, 400}), EPS);
    }

    @Test
    public void testIouPartialOverlap() {
        // 交集 50x100=5000，并集 10000+10000-5000=15000
        double iou = BoundingBoxes.iou(new double[]{100, 100, 200, 200}, new double[]{150, 100, 250, 200});
        assertEquals(5000.0 / 15000.0, iou, EPS);
    }

    @Test
    public void testIouTouchingEdgesIsZero() {
        assertEquals(0.0, BoundingBoxes.iou(new double[]{0, 0, 10, 10}, new double[]{10, 0, 20, 10}), EPS);
    }

    @Test
    public void testIouDegenerateUnionIsZero() {
        assertEquals(0.0, BoundingBoxes.iou(new double[]{5, 5, 5, 5}, new double[]{5, 5, 5, 5}), EPS);
        assertEquals(0.0, BoundingBoxes.iou(new double[]{Double.NaN, 0, 10, 10}, new double[]{0, 0, 10, 10}), EPS);
    }

    @Test
    public void testToObservation() {
        double[] z = BoundingBoxes.toObservation(new double[]{100, 100, 200, 200});
        assertArrayEquals(new double[]{150, 150, 10000, 1.0}, z, EPS);

        double[] wide = BoundingBoxes.toObservation(new double[]{0, 0, 40, 10});
        assertEquals(4.0, wide[3], EPS);
    }

    @Test
    public void testToObservationZeroHeightUsesUnitAspect() {
        double[] z = BoundingBoxes.toObservation(new double[]{0, 5, 10, 5});
        assertEquals(0.0, z[2], EPS);
        assertEquals(1.0, z[3], EPS);
    }

    @Test
    public void testFromObservationZeroWidthGivesZeroHeight() {
        double[] box = BoundingBoxes.fromObservation(50, 60, 0, 1);
        assertArrayEquals(new double[]{50, 60, 50, 60}, box, EPS);
    }

    @Test
    public void testRoundTrip() {
        double[][] boxes = {
                {100, 100, 200, 200},
                {0, 0, 1, 1},
                {12.5, 40.25, 98.75, 300.5},
                {-50, -20, 30, 10},
                {640, 360, 1280, 370}
        };
        for (double[] box : boxes) {
            double[] z = BoundingBoxes.toObservation(box);
            double[] back = BoundingBoxes.fromObservation(z[0], z[1], z[2], z[3]);
            assertArrayEquals(box, back, 1e-6);
        }
    }

    @Test
    public void testCenterAndFinite() {
        assertArrayEquals(new double[]{150, 75}, BoundingBoxes.center(new double[]{100, 50, 200, 100}), EPS);
        assertTrue(BoundingBoxes.isFinite(new double[]{1, 2, 3, 4}));
        assertFalse(BoundingBoxes.isFinite(new double[]{1, Double.NaN, 3, 4}));
        assertFalse(BoundingBoxes.isFinite(new double[]{1, 2, Double.POSITIVE_INFINITY, 4}));
    }
}
