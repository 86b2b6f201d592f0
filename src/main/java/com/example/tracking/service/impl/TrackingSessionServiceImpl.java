package com.example.tracking.service.impl;

import com.example.tracking.config.TrackingSessionProperties;
import com.example.tracking.dto.Detection;
import com.example.tracking.dto.FrameRequest;
import com.example.tracking.dto.SequenceTrackingRequest;
import com.example.tracking.dto.StreamTrackingResult;
import com.example.tracking.dto.Track;
import com.example.tracking.dto.TrackerSettings;
import com.example.tracking.dto.TrackingResult;
import com.example.tracking.dto.TrackingSessionInfo;
import com.example.tracking.dto.TrackingStats;
import com.example.tracking.exception.SessionNotFoundException;
import com.example.tracking.service.TrackingSessionService;
import com.example.tracking.tracker.SortTracker;
import com.example.tracking.tracker.TrackerConfig;
import com.example.tracking.util.DetectionSanitizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

@Slf4j
@Service
@RequiredArgsConstructor
public class TrackingSessionServiceImpl implements TrackingSessionService {

    private final TrackerConfig defaultTrackerConfig;
    private final TrackingSessionProperties sessionProperties;

    private final Map<String, TrackingSession> sessions = new ConcurrentHashMap<>();

    @Override
    public Mono<TrackingSessionInfo> createSession(TrackerSettings settings) {
        return Mono.fromCallable(() -> {
            TrackerConfig config = resolveConfig(settings);

            String sessionId = UUID.randomUUID().toString();
            TrackingSession session = new TrackingSession(new SortTracker(config));

            // 上限检查和登记必须是一个原子操作
            synchronized (sessions) {
                if (sessions.size() >= sessionProperties.getMaxSessions()) {
                    throw new IllegalStateException("跟踪会话数已达上限: " + sessionProperties.getMaxSessions());
                }
                sessions.put(sessionId, session);
            }

            log.info("创建跟踪会话 {}，参数: {}", sessionId, config);

            return TrackingSessionInfo.builder()
                    .sessionId(sessionId)
                    .createdAt(session.stats.getStartTime())
                    .settings(toSettings(config))
                    .build();
        });
    }

    @Override
    public Mono<StreamTrackingResult> processFrame(String sessionId, FrameRequest request) {
        return Mono.fromCallable(() -> {
            TrackingSession session = requireSession(sessionId);

            DetectionSanitizer.Result sanitized = DetectionSanitizer.sanitize(request.getDetections());
            if (sanitized.getDropped() > 0) {
                log.warn("会话 {} 丢弃 {} 个非法检测", sessionId, sanitized.getDropped());
            }

            StreamTrackingResult result = new StreamTrackingResult();
            result.setSessionId(sessionId);
            result.setFrameIndex(request.getFrameIndex());

            // 同一会话的帧必须串行进入跟踪器
            synchronized (session) {
                long start = System.nanoTime();
                List<Track> tracks = session.tracker.update(sanitized.getDetections());
                long elapsedNanos = System.nanoTime() - start;

                session.record(sanitized, tracks, elapsedNanos);

                result.setFrameNumber(session.tracker.getFrameCount());
                result.setTracks(tracks);
                result.setTrackCount(tracks.size());
                result.setProcessingTimeMs(elapsedNanos / 1_000_000L);
            }

            result.setTimestamp(LocalDateTime.now());
            result.setDetectionCount(sanitized.getDetections().size());
            result.setDroppedDetections(sanitized.getDropped());
            return result;
        }).subscribeOn(Schedulers.boundedElastic());
    }

    @Override
    public Mono<TrackingStats> getSessionStats(String sessionId) {
        return Mono.fromCallable(() -> {
            TrackingSession session = requireSession(sessionId);
            synchronized (session) {
                return session.snapshot();
            }
        });
    }

    @Override
    public Mono<TrackingStats> closeSession(String sessionId) {
        return Mono.fromCallable(() -> {
            TrackingSession session = sessions.remove(sessionId);
            if (session == null) {
                throw new SessionNotFoundException(sessionId);
            }
            TrackingStats stats;
            synchronized (session) {
                stats = session.snapshot();
            }
            log.info("关闭跟踪会话 {}，共处理 {} 帧，创建 {} 个目标",
                    sessionId, stats.getTotalFrames(), stats.getTotalTracksCreated());
            return stats;
        });
    }

    @Override
    public Mono<TrackingResult> trackSequence(SequenceTrackingRequest request) {
        return Mono.fromCallable(() -> {
            TrackerConfig config = resolveConfig(request.getSettings());
            TrackingSession run = new TrackingSession(new SortTracker(config));

            log.info("开始序列跟踪，共 {} 帧，参数: {}", request.getFrames().size(), config);

            Map<Integer, List<Track>> tracksByFrame = new LinkedHashMap<>();
            for (List<Detection> frame : request.getFrames()) {
                DetectionSanitizer.Result sanitized = DetectionSanitizer.sanitize(frame);

                long start = System.nanoTime();
                List<Track> tracks = run.tracker.update(sanitized.getDetections());
                run.record(sanitized, tracks, System.nanoTime() - start);

                tracksByFrame.put(run.tracker.getFrameCount(), tracks);
            }

            TrackingStats stats = run.snapshot();
            if (stats.getDroppedDetections() > 0) {
                log.warn("序列跟踪丢弃 {} 个非法检测", stats.getDroppedDetections());
            }
            LocalDateTime endTime = LocalDateTime.now();

            log.info("序列跟踪完成: {} 帧，创建 {} 个目标，{} fps",
                    stats.getTotalFrames(), stats.getTotalTracksCreated(), String.format("%.1f", stats.getFps()));

            return TrackingResult.builder()
                    .success(true)
                    .message("序列跟踪处理完成")
                    .startTime(stats.getStartTime())
                    .endTime(endTime)
                    .processingTimeMs(Duration.between(stats.getStartTime(), endTime).toMillis())
                    .totalFrames(stats.getTotalFrames())
                    .maxTrackCount(stats.getMaxTrackCount())
                    .tracksByFrame(tracksByFrame)
                    .stats(stats)
                    .build();
        }).subscribeOn(Schedulers.boundedElastic());
    }

    @Override
    public int getActiveSessionCount() {
        return sessions.size();
    }

    @Override
    @Scheduled(fixedDelayString = "${tracking.session.cleanup-interval-ms:60000}")
    public int evictIdleSessions() {
        LocalDateTime cutoff = LocalDateTime.now().minus(sessionProperties.getIdleTimeout());
        int evicted = 0;
        for (Map.Entry<String, TrackingSession> entry : sessions.entrySet()) {
            if (!entry.getValue().lastActivity.isAfter(cutoff)
                    && sessions.remove(entry.getKey(), entry.getValue())) {
                evicted++;
                log.info("回收空闲跟踪会话 {}", entry.getKey());
            }
        }
        return evicted;
    }

    private TrackingSession requireSession(String sessionId) {
        TrackingSession session = sessions.get(sessionId);
        if (session == null) {
            throw new SessionNotFoundException(sessionId);
        }
        return session;
    }

    /**
     * 合并请求参数和默认参数，非法值抛出 IllegalArgumentException
     */
    private TrackerConfig resolveConfig(TrackerSettings settings) {
        if (settings == null) {
            return defaultTrackerConfig;
        }
        return new TrackerConfig(
                settings.getMaxAge() != null ? settings.getMaxAge() : defaultTrackerConfig.getMaxAge(),
                settings.getMinHits() != null ? settings.getMinHits() : defaultTrackerConfig.getMinHits(),
                settings.getIouThreshold() != null ? settings.getIouThreshold() : defaultTrackerConfig.getIouThreshold(),
                settings.getHistoryLength() != null ? settings.getHistoryLength() : defaultTrackerConfig.getHistoryLength()
        );
    }

    private static TrackerSettings toSettings(TrackerConfig config) {
        return new TrackerSettings(config.getMaxAge(), config.getMinHits(),
                config.getIouThreshold(), config.getHistoryLength());
    }

    /**
     * 会话状态：跟踪器和累计统计
     */
    private static class TrackingSession {
        final SortTracker tracker;
        final TrackingStats stats;
        double confidenceSum;
        long totalTracksEmitted;
        long trackingNanos;
        volatile LocalDateTime lastActivity;

        TrackingSession(SortTracker tracker) {
            this.tracker = tracker;
            this.stats = new TrackingStats();
            this.stats.setStartTime(LocalDateTime.now());
            this.lastActivity = stats.getStartTime();
        }

        void record(DetectionSanitizer.Result sanitized, List<Track> tracks, long elapsedNanos) {
            for (Detection detection : sanitized.getDetections()) {
                confidenceSum += detection.getConfidence();
            }
            stats.setTotalFrames(stats.getTotalFrames() + 1);
            stats.setTotalDetections(stats.getTotalDetections() + sanitized.getDetections().size());
            stats.setDroppedDetections(stats.getDroppedDetections() + sanitized.getDropped());
            stats.setMaxTrackCount(Math.max(stats.getMaxTrackCount(), tracks.size()));
            totalTracksEmitted += tracks.size();
            trackingNanos += elapsedNanos;

            lastActivity = LocalDateTime.now();
            stats.setLastUpdateTime(lastActivity);
        }

        TrackingStats snapshot() {
            int frames = stats.getTotalFrames();
            long detections = stats.getTotalDetections();
            return TrackingStats.builder()
                    .startTime(stats.getStartTime())
                    .lastUpdateTime(stats.getLastUpdateTime())
                    .totalFrames(frames)
                    .totalDetections(detections)
                    .droppedDetections(stats.getDroppedDetections())
                    .totalTracksCreated(tracker.getTotalTracksCreated())
                    .liveTracks(tracker.getLiveTrackCount())
                    .maxTrackCount(stats.getMaxTrackCount())
                    .avgDetectionsPerFrame(frames > 0 ? (double) detections / frames : 0.0)
                    .avgTracksPerFrame(frames > 0 ? (double) totalTracksEmitted / frames : 0.0)
                    .avgConfidence(detections > 0 ? confidenceSum / detections : 0.0)
                    .processingTimeMs(trackingNanos / 1_000_000L)
                    .fps(trackingNanos > 0 ? frames * 1e9 / trackingNanos : 0.0)
                    .build();
        }
    }
}
