package com.example.tracking.config;

import com.example.tracking.tracker.TrackerConfig;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * SORT 跟踪器默认参数，新建会话未指定参数时使用
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "tracking.sort")
public class SortTrackerProperties {

    private int maxAge = TrackerConfig.DEFAULT_MAX_AGE;
    private int minHits = TrackerConfig.DEFAULT_MIN_HITS;
    private double iouThreshold = TrackerConfig.DEFAULT_IOU_THRESHOLD;
    private int historyLength = TrackerConfig.DEFAULT_HISTORY_LENGTH;

    /**
     * 转换为跟踪器参数，非法值在这里抛出 IllegalArgumentException
     */
    public TrackerConfig toTrackerConfig() {
        return new TrackerConfig(maxAge, minHits, iouThreshold, historyLength);
    }
}
