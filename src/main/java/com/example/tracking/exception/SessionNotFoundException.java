package com.example.tracking.exception;

public class SessionNotFoundException extends RuntimeException {

    public SessionNotFoundException(String sessionId) {
        super("跟踪会话不存在: " + sessionId);
    }
}
