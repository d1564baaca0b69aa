package com.resultpager.api.exception;

/**
 * 会话不存在，或已因空闲超时被回收，调用方需要重新执行查询。
 */
public class SessionNotFoundException extends RuntimeException {

    private final String sessionId;

    public SessionNotFoundException(String sessionId) {
        super("Session 不存在或已失效: " + sessionId);
        this.sessionId = sessionId;
    }

    public String getSessionId() {
        return sessionId;
    }
}
