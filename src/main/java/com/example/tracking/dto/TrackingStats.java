package com.example.tracking.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 跟踪统计信息
 */
@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class TrackingStats {

    /** 开始时间 */
    private LocalDateTime startTime;

    /** 最后一次更新时间 */
    private LocalDateTime lastUpdateTime;

    /** 总跟踪帧数 */
    private int totalFrames;

    /** 有效检测总数 */
    private long totalDetections;

    /** 丢弃的非法检测总数 */
    private long droppedDetections;

    /** 创建过的跟踪目标总数 */
    private int totalTracksCreated;

    /** 当前存活的跟踪器数量（含未确认） */
    private int liveTracks;

    /** 单帧最大输出目标数 */
    private int maxTrackCount;

    /** 平均每帧检测数 */
    private double avgDetectionsPerFrame;

    /** 平均每帧输出目标数 */
    private double avgTracksPerFrame;

    /** 平均检测置信度 */
    private double avgConfidence;

    /** 累计跟踪耗时（毫秒） */
    private long processingTimeMs;

    /** 跟踪吞吐量（帧/秒） */
    private double fps;
}
