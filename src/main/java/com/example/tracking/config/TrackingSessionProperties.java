package com.example.tracking.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Data
@Configuration
@ConfigurationProperties(prefix = "tracking.session")
public class TrackingSessionProperties {

    /** 最大同时存在的会话数 */
    private int maxSessions = 64;

    /** 会话空闲多久后被回收 */
    private Duration idleTimeout = Duration.ofMinutes(30);

    /** 空闲会话清理间隔（毫秒） */
    private long cleanupIntervalMs = 60_000L;
}
