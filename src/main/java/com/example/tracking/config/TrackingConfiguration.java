package com.example.tracking.config;

import com.example.tracking.tracker.TrackerConfig;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 跟踪器配置和初始化
 */
@Slf4j
@Configuration
@RequiredArgsConstructor
public class TrackingConfiguration {

    private final SortTrackerProperties sortProperties;
    private final TrackingSessionProperties sessionProperties;

    /**
     * 默认跟踪器参数，配置非法时启动失败
     */
    @Bean
    public TrackerConfig defaultTrackerConfig() {
        return sortProperties.toTrackerConfig();
    }

    /**
     * 启动时输出跟踪和会话配置
     */
    @Bean
    public CommandLineRunner trackingSetup(TrackerConfig defaultTrackerConfig) {
        return args -> {
            log.info("初始化SORT多目标跟踪服务...");
            log.info("默认跟踪参数: maxAge={}, minHits={}, iouThreshold={}, historyLength={}",
                    defaultTrackerConfig.getMaxAge(), defaultTrackerConfig.getMinHits(),
                    defaultTrackerConfig.getIouThreshold(), defaultTrackerConfig.getHistoryLength());
            log.info("会话上限: {}, 空闲超时: {}, 清理间隔: {}ms",
                    sessionProperties.getMaxSessions(),
                    sessionProperties.getIdleTimeout(),
                    sessionProperties.getCleanupIntervalMs());
            log.info("✅ 跟踪服务初始化完成");
        };
    }
}
