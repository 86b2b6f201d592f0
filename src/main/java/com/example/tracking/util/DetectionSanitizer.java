package com.example.tracking.util;

import com.example.tracking.dto.Detection;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * 检测结果清洗：丢弃非法检测，保留合法检测的原有顺序
 */
@Slf4j
public final class DetectionSanitizer {

    public static final String UNKNOWN_LABEL = "unknown";

    private DetectionSanitizer() {
    }

    public static Result sanitize(List<Detection> detections) {
        if (detections == null || detections.isEmpty()) {
            return new Result(new ArrayList<>(), 0);
        }

        List<Detection> valid = new ArrayList<>(detections.size());
        int dropped = 0;
        for (Detection detection : detections) {
            if (isValid(detection)) {
                valid.add(detection.getClassLabel() != null ? detection : withUnknownLabel(detection));
            } else {
                dropped++;
                log.debug("丢弃非法检测: {}", detection);
            }
        }
        return new Result(valid, dropped);
    }

    /**
     * 不修改调用方的对象，复制一份再补默认标签
     */
    private static Detection withUnknownLabel(Detection detection) {
        Detection copy = new Detection(detection.getBbox().clone(), UNKNOWN_LABEL, detection.getConfidence());
        copy.setMask(detection.getMask());
        return copy;
    }

    /**
     * 边界框为4个有限值且 x1 < x2、y1 < y2，置信度在 [0, 1] 内
     */
    public static boolean isValid(Detection detection) {
        if (detection == null) {
            return false;
        }
        double[] bbox = detection.getBbox();
        if (bbox == null || bbox.length != 4) {
            return false;
        }
        for (double v : bbox) {
            if (!Double.isFinite(v)) {
                return false;
            }
        }
        if (bbox[2] <= bbox[0] || bbox[3] <= bbox[1]) {
            return false;
        }
        double confidence = detection.getConfidence();
        return confidence >= 0.0 && confidence <= 1.0;
    }

    @Value
    public static class Result {
        List<Detection> detections;
        int dropped;
    }
}
