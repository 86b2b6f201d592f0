package com.example.tracking.util;

import com.example.tracking.dto.Detection;
import org.junit.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.Assert.*;

public class DetectionSanitizerTest {

    @Test
    public void testValidDetectionsKeptInOrder() {
        Detection a = new Detection(new double[]{0, 0, 10, 10}, "person", 0.9);
        Detection b = new Detection(new double[]{20, 20, 30, 30}, "car", 0.0);

        DetectionSanitizer.Result result = DetectionSanitizer.sanitize(Arrays.asList(a, b));

        assertEquals(Arrays.asList(a, b), result.getDetections());
        assertEquals(0, result.getDropped());
    }

    @Test
    public void testInvalidDetectionsDropped() {
        List<Detection> detections = Arrays.asList(
                new Detection(null, "person", 0.5),
                new Detection(new double[]{0, 0, 10}, "person", 0.5),
                new Detection(new double[]{0, 0, Double.NaN, 10}, "person", 0.5),
                new Detection(new double[]{10, 0, 5, 10}, "person", 0.5),
                new Detection(new double[]{0, 10, 10, 10}, "person", 0.5),
                new Detection(new double[]{0, 0, 10, 10}, "person", 1.2),
                new Detection(new double[]{0, 0, 10, 10}, "person", Double.NaN),
                null,
                new Detection(new double[]{0, 0, 10, 10}, "person", 1.0));

        DetectionSanitizer.Result result = DetectionSanitizer.sanitize(detections);

        assertEquals(1, result.getDetections().size());
        assertEquals(8, result.getDropped());
    }

    @Test
    public void testMissingLabelDefaultsToUnknown() {
        Detection detection = new Detection(new double[]{0, 0, 10, 10}, null, 0.7);

        DetectionSanitizer.Result result = DetectionSanitizer.sanitize(Arrays.asList(detection));

        assertEquals(DetectionSanitizer.UNKNOWN_LABEL, result.getDetections().get(0).getClassLabel());
        assertArrayEquals(new double[]{0, 0, 10, 10}, result.getDetections().get(0).getBbox(), 0.0);
        assertEquals(0.7, result.getDetections().get(0).getConfidence(), 0.0);
    }

    @Test
    public void testCallerDetectionNotModified() {
        boolean[][] mask = new boolean[][]{{true}};
        Detection detection = new Detection(new double[]{0, 0, 10, 10}, null, 0.7);
        detection.setMask(mask);

        Detection cleaned = DetectionSanitizer.sanitize(Arrays.asList(detection)).getDetections().get(0);

        assertNull(detection.getClassLabel());
        assertNotSame(detection, cleaned);
        assertSame(mask, cleaned.getMask());
    }

    @Test
    public void testNullListIsEmpty() {
        DetectionSanitizer.Result result = DetectionSanitizer.sanitize(null);
        assertTrue(result.getDetections().isEmpty());
        assertEquals(0, result.getDropped());
    }
}
