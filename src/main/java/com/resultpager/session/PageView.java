package com.resultpager.session;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 某一页的不可变快照，供不同的输出层自定义渲染。
 */
public class PageView {

    private final String sessionId;
    private final int page;
    private final int totalPages;
    private final int totalRows;
    private final int pageSize;
    private final int showingFrom;
    private final int showingTo;
    private final String showing;
    private final List<String> columns;
    private final List<Map<String, Object>> rows;
    private final boolean hasNext;
    private final boolean hasPrev;

    PageView(String sessionId,
             int page,
             int totalPages,
             int totalRows,
             int pageSize,
             int showingFrom,
             int showingTo,
             List<String> columns,
             List<Map<String, Object>> rows) {
        this.sessionId = sessionId;
        this.page = page;
        this.totalPages = totalPages;
        this.totalRows = totalRows;
        this.pageSize = pageSize;
        this.showingFrom = showingFrom;
        this.showingTo = showingTo;
        this.showing = showingFrom + "-" + showingTo + " of " + totalRows;
        this.columns = columns;
        this.rows = rows;
        this.hasNext = page < totalPages;
        this.hasPrev = page > 1;
    }

    public String getSessionId() {
        return sessionId;
    }

    public int getPage() {
        return page;
    }

    public int getTotalPages() {
        return totalPages;
    }

    public int getTotalRows() {
        return totalRows;
    }

    public int getPageSize() {
        return pageSize;
    }

    /**
     * 本页第一行在整个结果集中的序号（从 1 开始），空结果为 0。
     */
    public int getShowingFrom() {
        return showingFrom;
    }

    public int getShowingTo() {
        return showingTo;
    }

    public String getShowing() {
        return showing;
    }

    public List<String> getColumns() {
        return columns;
    }

    public List<Map<String, Object>> getRows() {
        return rows;
    }

    public boolean hasNext() {
        return hasNext;
    }

    public boolean hasPrev() {
        return hasPrev;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof PageView)) {
            return false;
        }
        PageView that = (PageView) o;
        return page == that.page
                && totalPages == that.totalPages
                && totalRows == that.totalRows
                && pageSize == that.pageSize
                && showingFrom == that.showingFrom
                && showingTo == that.showingTo
                && Objects.equals(sessionId, that.sessionId)
                && Objects.equals(columns, that.columns)
                && Objects.equals(rows, that.rows);
    }

    @Override
    public int hashCode() {
        return Objects.hash(sessionId, page, totalPages, totalRows, pageSize, showingFrom, showingTo, columns, rows);
    }

    @Override
    public String toString() {
        return "PageView{sessionId=" + sessionId + ", page=" + page + "/" + totalPages
                + ", showing=" + showing + "}";
    }
}
