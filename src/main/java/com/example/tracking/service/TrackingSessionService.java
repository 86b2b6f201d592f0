package com.example.tracking.service;

import com.example.tracking.dto.FrameRequest;
import com.example.tracking.dto.SequenceTrackingRequest;
import com.example.tracking.dto.StreamTrackingResult;
import com.example.tracking.dto.TrackerSettings;
import com.example.tracking.dto.TrackingResult;
import com.example.tracking.dto.TrackingSessionInfo;
import com.example.tracking.dto.TrackingStats;
import reactor.core.publisher.Mono;

/**
 * 跟踪会话服务接口
 * <p>
 * 每个会话对应一路视频流，拥有独立的跟踪器和ID计数器。
 */
public interface TrackingSessionService {

    /**
     * 创建跟踪会话
     *
     * @param settings 跟踪参数，为null或字段为null时使用默认值
     * @return 会话信息
     */
    Mono<TrackingSessionInfo> createSession(TrackerSettings settings);

    /**
     * 提交一帧检测结果
     *
     * @param sessionId 会话ID
     * @param request   帧检测
     * @return 本帧跟踪结果
     */
    Mono<StreamTrackingResult> processFrame(String sessionId, FrameRequest request);

    /**
     * 获取会话统计信息
     */
    Mono<TrackingStats> getSessionStats(String sessionId);

    /**
     * 关闭会话
     *
     * @return 会话最终统计信息
     */
    Mono<TrackingStats> closeSession(String sessionId);

    /**
     * 使用新的跟踪器处理整段检测序列
     */
    Mono<TrackingResult> trackSequence(SequenceTrackingRequest request);

    /**
     * 当前活跃会话数
     */
    int getActiveSessionCount();

    /**
     * 回收空闲会话
     *
     * @return 回收的会话数
     */
    int evictIdleSessions();
}
