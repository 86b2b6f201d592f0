package com.example.tracking.controller;

import com.example.tracking.config.TrackingSessionProperties;
import com.example.tracking.service.TrackingSessionService;
import com.example.tracking.tracker.TrackerConfig;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.lang.management.ManagementFactory;
import java.lang.management.MemoryMXBean;
import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/api/tracking")
@RequiredArgsConstructor
public class SystemStatusController {

    private final TrackingSessionService trackingSessionService;
    private final TrackerConfig defaultTrackerConfig;
    private final TrackingSessionProperties sessionProperties;

    @Value("${spring.application.name:sort-tracking-service}")
    private String applicationName;

    /**
     * 服务状态检查
     */
    @GetMapping("/status")
    public Mono<ResponseEntity<Map<String, Object>>> getSystemStatus() {
        return Mono.fromCallable(() -> {
            Map<String, Object> status = new HashMap<>();

            try {
                status.put("applicationName", applicationName);
                status.put("timestamp", LocalDateTime.now().toString());
                status.put("status", "RUNNING");

                // 会话信息
                Map<String, Object> sessionInfo = new HashMap<>();
                sessionInfo.put("active", trackingSessionService.getActiveSessionCount());
                sessionInfo.put("max", sessionProperties.getMaxSessions());
                sessionInfo.put("idleTimeoutSeconds", sessionProperties.getIdleTimeout().getSeconds());
                status.put("sessions", sessionInfo);

                // 默认跟踪参数
                Map<String, Object> trackerInfo = new HashMap<>();
                trackerInfo.put("algorithm", "SORT");
                trackerInfo.put("maxAge", defaultTrackerConfig.getMaxAge());
                trackerInfo.put("minHits", defaultTrackerConfig.getMinHits());
                trackerInfo.put("iouThreshold", defaultTrackerConfig.getIouThreshold());
                trackerInfo.put("historyLength", defaultTrackerConfig.getHistoryLength());
                status.put("tracker", trackerInfo);

                // JVM内存信息
                MemoryMXBean memoryBean = ManagementFactory.getMemoryMXBean();
                Map<String, Object> memoryInfo = new HashMap<>();
                memoryInfo.put("heapUsed", memoryBean.getHeapMemoryUsage().getUsed());
                memoryInfo.put("heapMax", memoryBean.getHeapMemoryUsage().getMax());
                memoryInfo.put("nonHeapUsed", memoryBean.getNonHeapMemoryUsage().getUsed());

                Map<String, Object> systemInfo = new HashMap<>();
                systemInfo.put("javaVersion", System.getProperty("java.version"));
                systemInfo.put("processors", Runtime.getRuntime().availableProcessors());
                systemInfo.put("memory", memoryInfo);
                status.put("system", systemInfo);

                return ResponseEntity.ok(status);

            } catch (Exception e) {
                log.error("获取系统状态失败", e);
                status.put("status", "ERROR");
                status.put("error", e.getMessage());
                return ResponseEntity.internalServerError().body(status);
            }
        });
    }
}
