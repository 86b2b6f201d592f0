package com.example.tracking.tracker;

/**
 * 边界框几何工具
 * <p>
 * 边界框统一使用 [x1, y1, x2, y2] 格式，观测向量使用 [cx, cy, s, r]：
 * - cx, cy: 中心点坐标
 * - s: 面积
 * - r: 宽高比 (w / h)
 */
public final class BoundingBoxes {

    private BoundingBoxes() {
    }

    /**
     * 边界框转观测向量 [cx, cy, s, r]
     */
    public static double[] toObservation(double[] bbox) {
        double w = bbox[2] - bbox[0];
        double h = bbox[3] - bbox[1];
        double cx = bbox[0] + w / 2.0;
        double cy = bbox[1] + h / 2.0;
        double s = w * h;
        double r = h > 0 ? w / h : 1.0;
        return new double[]{cx, cy, s, r};
    }

    /**
     * 观测向量 [cx, cy, s, r] 转边界框
     */
    public static double[] fromObservation(double cx, double cy, double s, double r) {
        double w = Math.sqrt(s * r);
        double h = w > 0 ? s / w : 0.0;
        return new double[]{
                cx - w / 2.0,
                cy - h / 2.0,
                cx + w / 2.0,
                cy + h / 2.0
        };
    }

    /**
     * 计算两个边界框的IoU，并集面积不大于0时返回0
     */
    public static double iou(double[] bbox1, double[] bbox2) {
        double x1 = Math.max(bbox1[0], bbox2[0]);
        double y1 = Math.max(bbox1[1], bbox2[1]);
        double x2 = Math.min(bbox1[2], bbox2[2]);
        double y2 = Math.min(bbox1[3], bbox2[3]);

        double intersection = Math.max(0.0, x2 - x1) * Math.max(0.0, y2 - y1);
        double area1 = (bbox1[2] - bbox1[0]) * (bbox1[3] - bbox1[1]);
        double area2 = (bbox2[2] - bbox2[0]) * (bbox2[3] - bbox2[1]);
        double union = area1 + area2 - intersection;

        // NaN 也走这里
        if (!(union > 0)) {
            return 0.0;
        }
        return intersection / union;
    }

    public static double[] center(double[] bbox) {
        return new double[]{(bbox[0] + bbox[2]) / 2.0, (bbox[1] + bbox[3]) / 2.0};
    }

    public static boolean isFinite(double[] bbox) {
        for (double v : bbox) {
            if (!Double.isFinite(v)) {
                return false;
            }
        }
        return true;
    }
}
