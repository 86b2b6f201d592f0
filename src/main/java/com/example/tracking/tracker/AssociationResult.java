package com.example.tracking.tracker;

import lombok.Value;

import java.util.List;

/**
 * 检测与跟踪器的关联结果
 * <p>
 * matches / unmatchedDetections / unmatchedTrackers 三者互不相交，覆盖所有检测和跟踪器下标。
 */
@Value
public class AssociationResult {

    List<Match> matches;

    /** 未匹配检测下标（升序） */
    List<Integer> unmatchedDetections;

    /** 未匹配跟踪器下标（升序） */
    List<Integer> unmatchedTrackers;

    @Value
    public static class Match {
        int detectionIndex;
        int trackerIndex;
        double iou;
    }
}
