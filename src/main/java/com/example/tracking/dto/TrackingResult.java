package com.example.tracking.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

/**
 * 离线序列跟踪结果DTO
 */
@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class TrackingResult {

    /** 是否成功 */
    private boolean success;

    /** 错误信息 */
    private String error;

    /** 消息信息 */
    private String message;

    /** 处理开始时间 */
    private LocalDateTime startTime;

    /** 处理结束时间 */
    private LocalDateTime endTime;

    /** 总处理时间（毫秒） */
    private long processingTimeMs;

    /** 总帧数 */
    private int totalFrames;

    /** 单帧最大目标数 */
    private int maxTrackCount;

    /** 每帧的跟踪目标（帧号从1开始） */
    private Map<Integer, List<Track>> tracksByFrame;

    /** 跟踪统计信息 */
    private TrackingStats stats;
}
