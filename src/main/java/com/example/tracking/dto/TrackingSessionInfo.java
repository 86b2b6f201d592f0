package com.example.tracking.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 跟踪会话信息
 */
@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class TrackingSessionInfo {

    private String sessionId;

    private LocalDateTime createdAt;

    /** 实际生效的跟踪参数 */
    private TrackerSettings settings;
}
