package com.resultpager.session;

import com.google.common.math.IntMath;

import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.LongSupplier;

/**
 * 单个查询结果的分页视图。
 * <p>
 * 行数据在创建时拷贝并冻结，之后只有游标（currentPage）和访问时间会变化。
 * 游标的读改写在本对象的监视器上串行化，同一会话的并发翻页不会读到中间状态。
 * </p>
 */
public class PagedResultSet {

    private final String id;
    private final String query;
    private final List<Map<String, Object>> rows;
    private final List<String> columns;
    private final int pageSize;
    private final long createdAtMillis;
    private final long createdAtNanos;
    private final LongSupplier clock;

    private int currentPage = 1;
    private volatile long lastAccessedNanos;

    private PagedResultSet(String id,
                           String query,
                           List<Map<String, Object>> rows,
                           List<String> columns,
                           int pageSize,
                           LongSupplier clock) {
        if (pageSize <= 0) {
            throw new IllegalArgumentException("pageSize must be positive: " + pageSize);
        }
        this.id = Objects.requireNonNull(id, "id must not be null");
        this.query = Objects.requireNonNull(query, "query must not be null");
        this.rows = rows;
        this.columns = columns;
        this.pageSize = pageSize;
        this.clock = clock;
        this.createdAtMillis = System.currentTimeMillis();
        this.createdAtNanos = clock.getAsLong();
        this.lastAccessedNanos = createdAtNanos;
    }

    /**
     * @param rows     原始行数据，会被拷贝；null 视为空结果
     * @param pageSize 已经过注册表限幅的页大小，必须为正数
     * @param clock    纳秒时钟，用于计算空闲时长
     */
    static PagedResultSet create(String id,
                                 String query,
                                 List<? extends Map<String, ?>> rows,
                                 int pageSize,
                                 LongSupplier clock) {
        List<Map<String, Object>> frozen = freeze(rows);
        return new PagedResultSet(id, query, frozen, collectColumns(frozen), pageSize, clock);
    }

    /**
     * 以新的 ID 复制一个尚未注册的会话，行数据共享。
     */
    PagedResultSet withId(String newId) {
        return new PagedResultSet(newId, query, rows, columns, pageSize, clock);
    }

    /**
     * 返回当前页。
     */
    public synchronized PageView getPage() {
        touch();
        return view();
    }

    /**
     * 跳转到指定页，越界时限幅到 [1, totalPages]。
     */
    public synchronized PageView getPage(int pageNumber) {
        currentPage = clamp(pageNumber);
        return getPage();
    }

    public synchronized PageView nextPage() {
        if (currentPage < getTotalPages()) {
            currentPage++;
        }
        return getPage();
    }

    public synchronized PageView prevPage() {
        if (currentPage > 1) {
            currentPage--;
        }
        return getPage();
    }

    public String getId() {
        return id;
    }

    public String getQuery() {
        return query;
    }

    public List<String> getColumns() {
        return columns;
    }

    public int getTotalRows() {
        return rows.size();
    }

    public int getPageSize() {
        return pageSize;
    }

    public synchronized int getCurrentPage() {
        return currentPage;
    }

    /**
     * 空结果集也保留一页，保证总能渲染。
     */
    public int getTotalPages() {
        return Math.max(1, IntMath.divide(rows.size(), pageSize, RoundingMode.CEILING));
    }

    public long getCreatedAtMillis() {
        return createdAtMillis;
    }

    long ageNanos(long now) {
        return now - createdAtNanos;
    }

    long idleNanos(long now) {
        return now - lastAccessedNanos;
    }

    boolean isExpired(long now, long timeoutNanos) {
        return idleNanos(now) > timeoutNanos;
    }

    private void touch() {
        lastAccessedNanos = clock.getAsLong();
    }

    private int clamp(int pageNumber) {
        return Math.max(1, Math.min(pageNumber, getTotalPages()));
    }

    private PageView view() {
        int totalRows = rows.size();
        int from = Math.min((currentPage - 1) * pageSize, totalRows);
        int to = Math.min(from + pageSize, totalRows);
        return new PageView(
                id,
                currentPage,
                getTotalPages(),
                totalRows,
                pageSize,
                totalRows == 0 ? 0 : from + 1,
                to,
                columns,
                rows.subList(from, to));
    }

    private static List<Map<String, Object>> freeze(List<? extends Map<String, ?>> source) {
        if (source == null || source.isEmpty()) {
            return Collections.emptyList();
        }
        List<Map<String, Object>> copy = new ArrayList<>(source.size());
        for (Map<String, ?> row : source) {
            Objects.requireNonNull(row, "row must not be null");
            copy.add(Collections.unmodifiableMap(new LinkedHashMap<String, Object>(row)));
        }
        return Collections.unmodifiableList(copy);
    }

    // 按首次出现的顺序合并所有行的列名
    private static List<String> collectColumns(List<Map<String, Object>> rows) {
        Set<String> names = new LinkedHashSet<>();
        for (Map<String, Object> row : rows) {
            names.addAll(row.keySet());
        }
        return Collections.unmodifiableList(new ArrayList<>(names));
    }
}
