package com.resultpager.session;

/**
 * 活跃会话的概要信息，用于列表展示。
 */
public class SessionSummary {

    private final String sessionId;
    private final String query;
    private final int totalRows;
    private final int currentPage;
    private final int totalPages;
    private final int pageSize;
    private final long ageSeconds;
    private final long idleSeconds;

    SessionSummary(String sessionId,
                   String query,
                   int totalRows,
                   int currentPage,
                   int totalPages,
                   int pageSize,
                   long ageSeconds,
                   long idleSeconds) {
        this.sessionId = sessionId;
        this.query = query;
        this.totalRows = totalRows;
        this.currentPage = currentPage;
        this.totalPages = totalPages;
        this.pageSize = pageSize;
        this.ageSeconds = ageSeconds;
        this.idleSeconds = idleSeconds;
    }

    public String getSessionId() {
        return sessionId;
    }

    /**
     * 截断后的查询文本预览
     */
    public String getQuery() {
        return query;
    }

    public int getTotalRows() {
        return totalRows;
    }

    public int getCurrentPage() {
        return currentPage;
    }

    public int getTotalPages() {
        return totalPages;
    }

    public int getPageSize() {
        return pageSize;
    }

    public long getAgeSeconds() {
        return ageSeconds;
    }

    public long getIdleSeconds() {
        return idleSeconds;
    }
}
