package com.example.tracking.controller;

import com.example.tracking.dto.FrameRequest;
import com.example.tracking.dto.SequenceTrackingRequest;
import com.example.tracking.dto.TrackerSettings;
import com.example.tracking.exception.SessionNotFoundException;
import com.example.tracking.service.TrackingSessionService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import javax.validation.Valid;
import java.util.HashMap;
import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/api/tracking")
@RequiredArgsConstructor
public class TrackingController {

    private final TrackingSessionService trackingSessionService;

    /**
     * 创建跟踪会话（一路视频流对应一个会话）
     */
    @PostMapping("/sessions")
    public Mono<ResponseEntity<Map<String, Object>>> createSession(
            @Valid @RequestBody(required = false) TrackerSettings settings) {

        return trackingSessionService.createSession(settings)
                .map(session -> {
                    Map<String, Object> response = new HashMap<>();
                    response.put("success", true);
                    response.put("session", session);
                    return ResponseEntity.ok(response);
                })
                .onErrorResume(ex -> errorResponse("创建跟踪会话失败", ex));
    }

    /**
     * 提交一帧检测结果，返回本帧跟踪目标
     */
    @PostMapping("/sessions/{sessionId}/frames")
    public Mono<ResponseEntity<Map<String, Object>>> submitFrame(
            @PathVariable String sessionId,
            @Valid @RequestBody FrameRequest request) {

        return trackingSessionService.processFrame(sessionId, request)
                .map(result -> {
                    Map<String, Object> response = new HashMap<>();
                    response.put("success", true);
                    response.put("result", result);
                    return ResponseEntity.ok(response);
                })
                .onErrorResume(ex -> errorResponse("帧跟踪失败", ex));
    }

    /**
     * 获取会话统计信息
     */
    @GetMapping("/sessions/{sessionId}/stats")
    public Mono<ResponseEntity<Map<String, Object>>> getSessionStats(@PathVariable String sessionId) {
        return trackingSessionService.getSessionStats(sessionId)
                .map(stats -> {
                    Map<String, Object> response = new HashMap<>();
                    response.put("success", true);
                    response.put("stats", stats);
                    return ResponseEntity.ok(response);
                })
                .onErrorResume(ex -> errorResponse("获取会话统计失败", ex));
    }

    /**
     * 关闭会话
     */
    @DeleteMapping("/sessions/{sessionId}")
    public Mono<ResponseEntity<Map<String, Object>>> closeSession(@PathVariable String sessionId) {
        return trackingSessionService.closeSession(sessionId)
                .map(stats -> {
                    Map<String, Object> response = new HashMap<>();
                    response.put("success", true);
                    response.put("message", "跟踪会话已关闭");
                    response.put("stats", stats);
                    return ResponseEntity.ok(response);
                })
                .onErrorResume(ex -> errorResponse("关闭跟踪会话失败", ex));
    }

    /**
     * 离线处理整段检测序列
     */
    @PostMapping("/sequence")
    public Mono<ResponseEntity<Map<String, Object>>> trackSequence(
            @Valid @RequestBody SequenceTrackingRequest request) {

        return trackingSessionService.trackSequence(request)
                .map(result -> {
                    Map<String, Object> response = new HashMap<>();
                    response.put("success", true);
                    response.put("result", result);
                    return ResponseEntity.ok(response);
                })
                .onErrorResume(ex -> errorResponse("序列跟踪失败", ex));
    }

    private Mono<ResponseEntity<Map<String, Object>>> errorResponse(String action, Throwable ex) {
        Map<String, Object> errorResponse = new HashMap<>();
        errorResponse.put("success", false);
        errorResponse.put("error", ex.getMessage());

        if (ex instanceof SessionNotFoundException) {
            log.warn("{}: {}", action, ex.getMessage());
            return Mono.just(ResponseEntity.status(HttpStatus.NOT_FOUND).body(errorResponse));
        }
        if (ex instanceof IllegalStateException) {
            log.warn("{}: {}", action, ex.getMessage());
            return Mono.just(ResponseEntity.status(HttpStatus.CONFLICT).body(errorResponse));
        }
        log.error("{}: {}", action, ex.getMessage(), ex);
        return Mono.just(ResponseEntity.badRequest().body(errorResponse));
    }
}
