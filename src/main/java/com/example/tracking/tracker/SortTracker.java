package com.example.tracking.tracker;

import com.example.tracking.dto.Detection;
import com.example.tracking.dto.Track;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * SORT 多目标跟踪器
 * <p>
 * 每帧流程：预测 → IoU关联 → 修正已匹配跟踪器 → 为未匹配检测创建跟踪器 → 删除过期跟踪器 → 输出已确认目标。
 * <p>
 * 非线程安全：同一实例的 {@link #update(List)} 不能并发调用，ID计数器仅属于当前实例。
 */
@Slf4j
public class SortTracker {

    static final String UNKNOWN_LABEL = "unknown";

    private final TrackerConfig config;
    private final IouAssociator associator;

    private List<KalmanBoxTracker> trackers = new ArrayList<>();
    private int frameCount;
    private int nextId;

    public SortTracker(TrackerConfig config) {
        this.config = config;
        this.associator = new IouAssociator(config.getIouThreshold());
    }

    public SortTracker() {
        this(TrackerConfig.defaults());
    }

    /**
     * 处理一帧检测结果
     *
     * @param detections 当前帧检测（顺序不影响结果正确性）
     * @return 当前帧输出的跟踪目标
     */
    public List<Track> update(List<Detection> detections) {
        if (detections == null) {
            detections = Collections.emptyList();
        }
        frameCount++;

        // 1. 预测，丢弃数值退化的跟踪器
        List<KalmanBoxTracker> alive = new ArrayList<>(trackers.size());
        List<double[]> predicted = new ArrayList<>(trackers.size());
        for (KalmanBoxTracker tracker : trackers) {
            double[] box = tracker.predict();
            if (BoundingBoxes.isFinite(box)) {
                alive.add(tracker);
                predicted.add(box);
            } else {
                log.debug("跟踪器 #{} 预测结果非有限值，已丢弃", tracker.getId());
            }
        }
        trackers = alive;

        // 2. 关联
        List<double[]> detectionBoxes = new ArrayList<>(detections.size());
        for (Detection detection : detections) {
            detectionBoxes.add(detection.getBbox());
        }
        AssociationResult association = associator.associate(detectionBoxes, predicted);

        // 3. 修正已匹配跟踪器，同时记录本帧对应的检测（新建的跟踪器不算匹配）
        Map<Integer, Detection> detectionByTrackerId = new HashMap<>();
        for (AssociationResult.Match match : association.getMatches()) {
            KalmanBoxTracker tracker = trackers.get(match.getTrackerIndex());
            Detection detection = detections.get(match.getDetectionIndex());
            tracker.correct(detection.getBbox());
            detectionByTrackerId.put(tracker.getId(), detection);
        }

        // 4. 为未匹配检测创建跟踪器
        for (int detectionIndex : association.getUnmatchedDetections()) {
            Detection detection = detections.get(detectionIndex);
            KalmanBoxTracker tracker = new KalmanBoxTracker(nextId++, detection.getBbox(), config.getHistoryLength());
            trackers.add(tracker);
            log.debug("创建跟踪器 #{} ({})", tracker.getId(), detection.getClassLabel());
        }

        // 5. 删除过期跟踪器
        List<KalmanBoxTracker> surviving = new ArrayList<>(trackers.size());
        for (KalmanBoxTracker tracker : trackers) {
            if (tracker.getTimeSinceUpdate() > config.getMaxAge()) {
                log.debug("跟踪器 #{} 已 {} 帧未匹配，删除", tracker.getId(), tracker.getTimeSinceUpdate());
            } else {
                surviving.add(tracker);
            }
        }
        trackers = surviving;

        // 6. 输出
        List<Track> result = new ArrayList<>();
        for (KalmanBoxTracker tracker : trackers) {
            tracker.recordCenter();

            TrackStatus status = statusOf(tracker);
            if (status != TrackStatus.CONFIRMED) {
                continue;
            }

            Detection detection = detectionByTrackerId.get(tracker.getId());
            result.add(Track.builder()
                    .id(tracker.getId())
                    .bbox(tracker.currentBox())
                    .classLabel(detection != null ? detection.getClassLabel() : UNKNOWN_LABEL)
                    .confidence(detection != null ? detection.getConfidence() : 0.0)
                    .age(tracker.getAge())
                    .hits(tracker.getHits())
                    .hitStreak(tracker.getHitStreak())
                    .timeSinceUpdate(tracker.getTimeSinceUpdate())
                    .velocity(tracker.getVelocity())
                    .history(tracker.getHistory())
                    .status(status)
                    .build());
        }

        log.trace("第{}帧: 检测 {} 个, 存活跟踪器 {} 个, 输出 {} 个",
                frameCount, detections.size(), trackers.size(), result.size());
        return result;
    }

    /**
     * 启动宽限期按整个跟踪器已处理的帧数计算，而不是单个目标的age
     */
    private TrackStatus statusOf(KalmanBoxTracker tracker) {
        if (tracker.getHitStreak() >= config.getMinHits() || frameCount <= config.getMinHits()) {
            return TrackStatus.CONFIRMED;
        }
        return TrackStatus.TENTATIVE;
    }

    /**
     * 清空所有跟踪器、帧计数和ID计数
     */
    public void reset() {
        trackers = new ArrayList<>();
        frameCount = 0;
        nextId = 0;
    }

    public TrackerConfig getConfig() {
        return config;
    }

    public int getFrameCount() {
        return frameCount;
    }

    public int getLiveTrackCount() {
        return trackers.size();
    }

    public int getTotalTracksCreated() {
        return nextId;
    }
}
