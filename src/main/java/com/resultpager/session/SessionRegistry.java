package com.resultpager.session;

import com.google.common.base.Ascii;
import com.google.common.base.Preconditions;
import com.google.common.base.Ticker;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.resultpager.api.config.PagerProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * 分页会话注册表，负责会话的创建、查找、删除以及空闲回收。
 * <p>
 * 所有对会话表的修改（插入、删除、回收）以及回收任务的启停状态都由同一把
 * {@link ReentrantLock} 保护。翻页操作也在该锁内完成，会话被删除或回收后
 * 不会再返回它的数据。
 * </p>
 * 回收任务是一个 STOPPED -> RUNNING -> STOPPED 的状态机：
 * 第一次创建会话时启动，某次回收后会话表为空则自行停止，下次创建时重新启动。
 */
@Component
public class SessionRegistry implements DisposableBean {

    private static final Logger LOGGER = LoggerFactory.getLogger(SessionRegistry.class);

    private static final int MAX_ID_ATTEMPTS = 16;

    private static final long NANOS_PER_SECOND = TimeUnit.SECONDS.toNanos(1);

    private enum ReaperState {
        STOPPED,
        RUNNING
    }

    private final PagerProperties.Session settings;
    private final Ticker ticker;
    private final Supplier<String> idGenerator;

    private final Map<String, PagedResultSet> sessions = new HashMap<>();
    private final ReentrantLock lock = new ReentrantLock();
    private final ScheduledExecutorService scheduler;

    // 以下字段均受 lock 保护
    private ReaperState reaperState = ReaperState.STOPPED;
    private ScheduledFuture<?> reaperTask;
    private boolean destroyed;

    @Autowired
    public SessionRegistry(PagerProperties properties) {
        this(properties.getSession(), Ticker.systemTicker(), new SessionIdGenerator());
    }

    public SessionRegistry(PagerProperties.Session settings, Ticker ticker, Supplier<String> idGenerator) {
        Preconditions.checkArgument(settings.getMinPageSize() > 0,
                "min page size must be positive: %s", settings.getMinPageSize());
        Preconditions.checkArgument(settings.getMinPageSize() <= settings.getMaxPageSize(),
                "min page size %s exceeds max page size %s", settings.getMinPageSize(), settings.getMaxPageSize());
        Preconditions.checkArgument(!settings.getIdleTimeout().isNegative() && !settings.getIdleTimeout().isZero(),
                "idle timeout must be positive: %s", settings.getIdleTimeout());
        Preconditions.checkArgument(!settings.getSweepInterval().isNegative() && !settings.getSweepInterval().isZero(),
                "sweep interval must be positive: %s", settings.getSweepInterval());
        this.settings = settings;
        this.ticker = Objects.requireNonNull(ticker, "ticker must not be null");
        this.idGenerator = Objects.requireNonNull(idGenerator, "idGenerator must not be null");
        this.scheduler = Executors.newSingleThreadScheduledExecutor(new ThreadFactoryBuilder()
                .setNameFormat("session-reaper-%d")
                .setDaemon(true)
                .build());
    }

    /**
     * 创建新的分页会话。页大小会被限幅到配置的区间内，为 null 时使用默认值。
     * 空结果集同样可以创建会话，只包含一页空数据。
     */
    public PagedResultSet createSession(String query, List<? extends Map<String, ?>> rows, Integer pageSize) {
        Objects.requireNonNull(query, "query must not be null");
        // 行拷贝放在锁外完成
        PagedResultSet session = PagedResultSet.create(
                idGenerator.get(), query, rows, clampPageSize(pageSize), ticker::read);
        lock.lock();
        try {
            ensureOpen();
            int attempts = 1;
            while (sessions.containsKey(session.getId())) {
                if (attempts++ >= MAX_ID_ATTEMPTS) {
                    throw new IllegalStateException("Unable to allocate a unique session id after " + MAX_ID_ATTEMPTS + " attempts");
                }
                LOGGER.debug("会话 ID 冲突，重新生成: {}", session.getId());
                session = session.withId(idGenerator.get());
            }
            sessions.put(session.getId(), session);
            startReaper();
        } finally {
            lock.unlock();
        }
        LOGGER.info("创建会话: {} ({} 行, 每页 {} 行)", session.getId(), session.getTotalRows(), session.getPageSize());
        return session;
    }

    /**
     * 按 ID 查找会话。仅查找不会刷新访问时间，只有翻页操作才会续期。
     */
    public Optional<PagedResultSet> getSession(String sessionId) {
        lock.lock();
        try {
            return Optional.ofNullable(sessions.get(sessionId));
        } finally {
            lock.unlock();
        }
    }

    public Optional<PageView> currentPage(String sessionId) {
        return withSession(sessionId, PagedResultSet::getPage);
    }

    public Optional<PageView> nextPage(String sessionId) {
        return withSession(sessionId, PagedResultSet::nextPage);
    }

    public Optional<PageView> prevPage(String sessionId) {
        return withSession(sessionId, PagedResultSet::prevPage);
    }

    /**
     * 跳转到指定页，越界页码会被限幅而不是报错。
     */
    public Optional<PageView> gotoPage(String sessionId, int page) {
        return withSession(sessionId, session -> session.getPage(page));
    }

    /**
     * 删除指定会话。
     *
     * @return true 表示会话存在且已删除，false 表示不存在或已过期
     */
    public boolean deleteSession(String sessionId) {
        PagedResultSet removed;
        lock.lock();
        try {
            removed = sessions.remove(sessionId);
        } finally {
            lock.unlock();
        }
        if (removed == null) {
            return false;
        }
        LOGGER.info("删除会话: {}", sessionId);
        return true;
    }

    /**
     * 立即清理所有空闲超时的会话。
     *
     * @return 本次清理的会话数
     */
    public int cleanupExpired() {
        long timeoutNanos = settings.getIdleTimeout().toNanos();
        lock.lock();
        try {
            long now = ticker.read();
            int evicted = 0;
            Iterator<PagedResultSet> it = sessions.values().iterator();
            while (it.hasNext()) {
                PagedResultSet session = it.next();
                if (session.isExpired(now, timeoutNanos)) {
                    it.remove();
                    evicted++;
                    LOGGER.info("会话已过期: {}", session.getId());
                }
            }
            return evicted;
        } finally {
            lock.unlock();
        }
    }

    public List<SessionSummary> listSessions() {
        lock.lock();
        try {
            long now = ticker.read();
            List<PagedResultSet> snapshot = new ArrayList<>(sessions.values());
            snapshot.sort(Comparator.comparingLong((PagedResultSet s) -> s.ageNanos(now)).reversed());
            List<SessionSummary> summaries = new ArrayList<>(snapshot.size());
            for (PagedResultSet session : snapshot) {
                summaries.add(new SessionSummary(
                        session.getId(),
                        Ascii.truncate(session.getQuery(), settings.getQueryPreviewLength(), "..."),
                        session.getTotalRows(),
                        session.getCurrentPage(),
                        session.getTotalPages(),
                        session.getPageSize(),
                        session.ageNanos(now) / NANOS_PER_SECOND,
                        session.idleNanos(now) / NANOS_PER_SECOND));
            }
            return summaries;
        } finally {
            lock.unlock();
        }
    }

    public int activeSessions() {
        lock.lock();
        try {
            return sessions.size();
        } finally {
            lock.unlock();
        }
    }

    public boolean isReaperRunning() {
        lock.lock();
        try {
            return reaperState == ReaperState.RUNNING;
        } finally {
            lock.unlock();
        }
    }

    /**
     * 停止回收任务并丢弃所有会话。
     */
    @Override
    public void destroy() {
        int dropped;
        lock.lock();
        try {
            destroyed = true;
            stopReaper();
            dropped = sessions.size();
            sessions.clear();
        } finally {
            lock.unlock();
        }
        scheduler.shutdownNow();
        LOGGER.info("会话注册表已关闭，丢弃 {} 个会话", dropped);
    }

    /**
     * 回收任务的单次执行：清理过期会话，会话表为空时停止自身。
     * 任何异常（包括 Error）只记录日志，保证后续周期继续运行。
     */
    void sweep() {
        lock.lock();
        try {
            int evicted = cleanupExpired();
            if (evicted > 0) {
                LOGGER.info("清理了 {} 个过期会话", evicted);
            }
            if (sessions.isEmpty()) {
                stopReaper();
            }
        } catch (Throwable ex) {
            // 调度器在任务抛出异常后不会再执行它，这里必须全部吞下
            LOGGER.error("会话回收任务执行失败", ex);
        } finally {
            lock.unlock();
        }
    }

    int clampPageSize(Integer requested) {
        int size = requested == null ? settings.getDefaultPageSize() : requested;
        return Math.max(settings.getMinPageSize(), Math.min(size, settings.getMaxPageSize()));
    }

    private Optional<PageView> withSession(String sessionId, Function<PagedResultSet, PageView> operation) {
        lock.lock();
        try {
            PagedResultSet session = sessions.get(sessionId);
            if (session == null) {
                LOGGER.debug("会话不存在或已过期: {}", sessionId);
                return Optional.empty();
            }
            PageView view = operation.apply(session);
            LOGGER.debug("会话 {} 访问第 {}/{} 页", sessionId, view.getPage(), view.getTotalPages());
            return Optional.of(view);
        } finally {
            lock.unlock();
        }
    }

    // 调用方需持有 lock
    private void startReaper() {
        if (reaperState == ReaperState.RUNNING) {
            return;
        }
        long interval = settings.getSweepInterval().toNanos();
        reaperTask = scheduler.scheduleWithFixedDelay(this::sweep, interval, interval, TimeUnit.NANOSECONDS);
        reaperState = ReaperState.RUNNING;
        LOGGER.debug("会话回收任务已启动，间隔 {}", settings.getSweepInterval());
    }

    // 调用方需持有 lock
    private void stopReaper() {
        if (reaperState == ReaperState.STOPPED) {
            return;
        }
        reaperTask.cancel(false);
        reaperTask = null;
        reaperState = ReaperState.STOPPED;
        LOGGER.debug("会话表为空，回收任务已停止");
    }

    private void ensureOpen() {
        if (destroyed) {
            throw new IllegalStateException("SessionRegistry already destroyed");
        }
    }
}
