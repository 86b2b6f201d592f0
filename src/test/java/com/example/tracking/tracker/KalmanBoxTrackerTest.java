package com.example.tracking.tracker;

import org.junit.Test;

import java.util.List;

import static org.junit.Assert.*;

public class KalmanBoxTrackerTest {

    private static final double[] BOX = {100, 100, 200, 200};

    @Test
    public void testInitialState() {
        KalmanBoxTracker tracker = new KalmanBoxTracker(7, BOX, 30);

        assertEquals(7, tracker.getId());
        assertEquals(0, tracker.getAge());
        assertEquals(0, tracker.getHits());
        assertEquals(0, tracker.getHitStreak());
        assertEquals(0, tracker.getTimeSinceUpdate());
        assertArrayEquals(BOX, tracker.currentBox(), 1e-6);
        assertArrayEquals(new double[]{0, 0}, tracker.getVelocity(), 0.0);
    }

    @Test
    public void testPredictAdvancesCounters() {
        KalmanBoxTracker tracker = new KalmanBoxTracker(0, BOX, 30);

        double[] predicted = tracker.predict();

        assertEquals(1, tracker.getAge());
        assertEquals(1, tracker.getTimeSinceUpdate());
        assertEquals(4, predicted.length);
        // 初始速度为0，预测框不变
        assertArrayEquals(BOX, predicted, 1e-6);
    }

    @Test
    public void testCorrectResetsTimeSinceUpdate() {
        KalmanBoxTracker tracker = new KalmanBoxTracker(0, BOX, 30);
        tracker.predict();

        tracker.correct(new double[]{105, 105, 205, 205});

        assertEquals(1, tracker.getHits());
        assertEquals(1, tracker.getHitStreak());
        assertEquals(0, tracker.getTimeSinceUpdate());
        double[] box = tracker.currentBox();
        assertTrue(box[0] > 100 && box[0] <= 105);
    }

    @Test
    public void testHitStreakResetAfterMissedFrame() {
        KalmanBoxTracker tracker = new KalmanBoxTracker(0, BOX, 30);
        tracker.predict();
        tracker.correct(BOX);
        tracker.predict();
        tracker.correct(BOX);
        assertEquals(2, tracker.getHitStreak());

        // 本帧未匹配，streak 保留到下一次预测
        tracker.predict();
        assertEquals(2, tracker.getHitStreak());
        assertEquals(1, tracker.getTimeSinceUpdate());

        tracker.predict();
        assertEquals(0, tracker.getHitStreak());
        assertEquals(2, tracker.getTimeSinceUpdate());
        assertEquals(2, tracker.getHits());
    }

    @Test
    public void testVelocityConvergesForConstantMotion() {
        KalmanBoxTracker tracker = new KalmanBoxTracker(0, BOX, 30);
        for (int frame = 1; frame <= 10; frame++) {
            tracker.predict();
            double dx = 5.0 * frame;
            tracker.correct(new double[]{100 + dx, 100, 200 + dx, 200});
        }

        double[] velocity = tracker.getVelocity();
        assertEquals(5.0, velocity[0], 0.5);
        assertEquals(0.0, velocity[1], 0.5);

        // 下一帧预测应继续向右移动
        double[] predicted = tracker.predict();
        assertEquals(155.0, predicted[0], 2.0);
    }

    @Test
    public void testShrinkingBoxDoesNotPredictNegativeArea() {
        KalmanBoxTracker tracker = new KalmanBoxTracker(0, BOX, 30);
        tracker.predict();
        tracker.correct(new double[]{145, 145, 155, 155});

        for (int i = 0; i < 5; i++) {
            double[] predicted = tracker.predict();
            assertTrue(BoundingBoxes.isFinite(predicted));
            assertTrue(predicted[2] > predicted[0]);
            assertTrue(predicted[3] > predicted[1]);
        }
    }

    @Test
    public void testCurrentBoxHasNoSideEffects() {
        KalmanBoxTracker tracker = new KalmanBoxTracker(0, BOX, 30);
        tracker.currentBox();
        tracker.currentBox();
        assertEquals(0, tracker.getAge());
        assertEquals(0, tracker.getTimeSinceUpdate());
    }

    @Test
    public void testHistoryIsBounded() {
        KalmanBoxTracker tracker = new KalmanBoxTracker(0, BOX, 3);
        for (int frame = 1; frame <= 5; frame++) {
            tracker.predict();
            double dx = 10.0 * frame;
            tracker.correct(new double[]{100 + dx, 100, 200 + dx, 200});
            tracker.recordCenter();
        }

        List<double[]> history = tracker.getHistory();
        assertEquals(3, history.size());
        // 最新点在最后
        assertTrue(history.get(2)[0] > history.get(1)[0]);
        assertTrue(history.get(1)[0] > history.get(0)[0]);
        assertArrayEquals(BoundingBoxes.center(tracker.currentBox()), history.get(2), 1e-9);
    }
}
