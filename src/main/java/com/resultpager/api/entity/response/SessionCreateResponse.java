package com.resultpager.api.entity.response;

public class SessionCreateResponse {

    private final String sessionId;
    private final long createdAt;
    private final int totalRows;
    private final Object firstPage;

    public SessionCreateResponse(String sessionId, long createdAt, int totalRows, Object firstPage) {
        this.sessionId = sessionId;
        this.createdAt = createdAt;
        this.totalRows = totalRows;
        this.firstPage = firstPage;
    }

    public String getSessionId() {
        return sessionId;
    }

    public long getCreatedAt() {
        return createdAt;
    }

    public int getTotalRows() {
        return totalRows;
    }

    /**
     * 首页内容，文本格式时为渲染后的字符串，否则为 PageView
     */
    public Object getFirstPage() {
        return firstPage;
    }
}
