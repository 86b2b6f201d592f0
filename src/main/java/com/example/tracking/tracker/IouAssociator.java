package com.example.tracking.tracker;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 基于IoU的检测-跟踪器关联
 * <p>
 * 以IoU构造代价矩阵，用匈牙利算法求总IoU最大的一对一分配，再剔除低于阈值的配对。
 */
@Slf4j
public class IouAssociator {

    private final double iouThreshold;

    public IouAssociator(double iouThreshold) {
        this.iouThreshold = iouThreshold;
    }

    /**
     * @param detections 当前帧检测框 [x1, y1, x2, y2]
     * @param predicted  跟踪器预测框 [x1, y1, x2, y2]
     */
    public AssociationResult associate(List<double[]> detections, List<double[]> predicted) {
        int numDetections = detections.size();
        int numTrackers = predicted.size();

        if (numTrackers == 0) {
            List<Integer> allDetections = new ArrayList<>(numDetections);
            for (int d = 0; d < numDetections; d++) {
                allDetections.add(d);
            }
            return new AssociationResult(Collections.emptyList(), allDetections, Collections.emptyList());
        }

        double[][] iouMatrix = new double[numDetections][numTrackers];
        double[][] cost = new double[numDetections][numTrackers];
        for (int d = 0; d < numDetections; d++) {
            for (int t = 0; t < numTrackers; t++) {
                iouMatrix[d][t] = BoundingBoxes.iou(detections.get(d), predicted.get(t));
                // 最大化IoU等价于最小化负IoU
                cost[d][t] = -iouMatrix[d][t];
            }
        }

        int[] assignment = HungarianAlgorithm.solve(cost);

        List<AssociationResult.Match> matches = new ArrayList<>();
        boolean[] detectionMatched = new boolean[numDetections];
        boolean[] trackerMatched = new boolean[numTrackers];

        for (int d = 0; d < numDetections; d++) {
            int t = assignment[d];
            if (t < 0) {
                continue;
            }
            double iou = iouMatrix[d][t];
            if (iou < iouThreshold) {
                log.trace("配对 det={} trk={} IoU={} 低于阈值 {}", d, t, iou, iouThreshold);
                continue;
            }
            matches.add(new AssociationResult.Match(d, t, iou));
            detectionMatched[d] = true;
            trackerMatched[t] = true;
        }

        List<Integer> unmatchedDetections = new ArrayList<>();
        for (int d = 0; d < numDetections; d++) {
            if (!detectionMatched[d]) {
                unmatchedDetections.add(d);
            }
        }
        List<Integer> unmatchedTrackers = new ArrayList<>();
        for (int t = 0; t < numTrackers; t++) {
            if (!trackerMatched[t]) {
                unmatchedTrackers.add(t);
            }
        }

        return new AssociationResult(matches, unmatchedDetections, unmatchedTrackers);
    }

    public double getIouThreshold() {
        return iouThreshold;
    }
}
