package com.example.tracking.dto;

import lombok.Data;

import java.time.LocalDateTime;
import java.util.List;

@Data
public class StreamTrackingResult {

    /**
     * 会话ID
     */
    private String sessionId;

    /**
     * 会话内已处理帧数（含本帧）
     */
    private Integer frameNumber;

    /**
     * 调用方帧序号
     */
    private Integer frameIndex;

    /**
     * 时间戳
     */
    private LocalDateTime timestamp;

    /**
     * 本帧有效检测数
     */
    private Integer detectionCount = 0;

    /**
     * 本帧被丢弃的非法检测数
     */
    private Integer droppedDetections = 0;

    /**
     * 本帧输出的跟踪目标数
     */
    private Integer trackCount = 0;

    /**
     * 处理时间（毫秒）
     */
    private Long processingTimeMs = 0L;

    /**
     * 跟踪目标列表
     */
    private List<Track> tracks;
}
