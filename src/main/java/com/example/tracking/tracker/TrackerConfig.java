package com.example.tracking.tracker;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * 跟踪器参数，构造后不可变
 */
@Getter
@ToString
@EqualsAndHashCode
public final class TrackerConfig {

    public static final int DEFAULT_MAX_AGE = 1;
    public static final int DEFAULT_MIN_HITS = 3;
    public static final double DEFAULT_IOU_THRESHOLD = 0.3;
    public static final int DEFAULT_HISTORY_LENGTH = 30;

    /** 未匹配多少帧后删除 */
    private final int maxAge;

    /** 确认所需的连续命中次数 */
    private final int minHits;

    /** 匹配所需的最小IoU */
    private final double iouThreshold;

    /** 轨迹点上限 */
    private final int historyLength;

    public TrackerConfig(int maxAge, int minHits, double iouThreshold, int historyLength) {
        if (maxAge < 0) {
            throw new IllegalArgumentException("maxAge不能为负数: " + maxAge);
        }
        if (minHits < 0) {
            throw new IllegalArgumentException("minHits不能为负数: " + minHits);
        }
        if (!(iouThreshold >= 0.0 && iouThreshold <= 1.0)) {
            throw new IllegalArgumentException("iouThreshold必须在[0, 1]范围内: " + iouThreshold);
        }
        if (historyLength < 1) {
            throw new IllegalArgumentException("historyLength必须大于0: " + historyLength);
        }
        this.maxAge = maxAge;
        this.minHits = minHits;
        this.iouThreshold = iouThreshold;
        this.historyLength = historyLength;
    }

    public TrackerConfig(int maxAge, int minHits, double iouThreshold) {
        this(maxAge, minHits, iouThreshold, DEFAULT_HISTORY_LENGTH);
    }

    public static TrackerConfig defaults() {
        return new TrackerConfig(DEFAULT_MAX_AGE, DEFAULT_MIN_HITS, DEFAULT_IOU_THRESHOLD, DEFAULT_HISTORY_LENGTH);
    }
}
