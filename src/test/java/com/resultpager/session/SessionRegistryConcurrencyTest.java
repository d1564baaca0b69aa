package com.resultpager.session;

import com.google.common.base.Ticker;
import com.resultpager.api.config.PagerProperties;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * 多线程下的会话注册表行为，使用真实时钟和真实的回收线程。
 */
public class SessionRegistryConcurrencyTest {

    private static final String QUERY = "SELECT * FROM employee";

    private final List<SessionRegistry> registries = new ArrayList<>();

    private SessionRegistry newRegistry(Duration idleTimeout, Duration sweepInterval) {
        PagerProperties.Session settings = new PagerProperties().getSession();
        settings.setIdleTimeout(idleTimeout);
        settings.setSweepInterval(sweepInterval);
        SessionRegistry registry = new SessionRegistry(settings, Ticker.systemTicker(), new SessionIdGenerator());
        registries.add(registry);
        return registry;
    }

    @AfterEach
    void tearDown() {
        registries.forEach(SessionRegistry::destroy);
    }

    @Test
    void concurrentCallersNavigateIndependentSessions() throws Exception {
        SessionRegistry registry = newRegistry(Duration.ofMinutes(5), Duration.ofMinutes(1));
        int threads = 16;
        int rounds = 200;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        ConcurrentLinkedQueue<Throwable> failures = new ConcurrentLinkedQueue<>();
        AtomicInteger pagesServed = new AtomicInteger();

        for (int t = 0; t < threads; t++) {
            pool.submit(() -> {
                try {
                    start.await();
                    for (int i = 0; i < rounds; i++) {
                        int total = ThreadLocalRandom.current().nextInt(0, 120);
                        List<Map<String, Object>> rows = Rows.employees(total);
                        String id = registry.createSession(QUERY, rows, 10).getId();
                        List<Map<String, Object>> visited = new ArrayList<>();
                        PageView view = registry.currentPage(id).orElseThrow();
                        visited.addAll(view.getRows());
                        while (view.hasNext()) {
                            view = registry.nextPage(id).orElseThrow();
                            visited.addAll(view.getRows());
                            pagesServed.incrementAndGet();
                        }
                        assertEquals(rows, visited);
                        assertTrue(registry.deleteSession(id));
                        assertFalse(registry.currentPage(id).isPresent());
                    }
                } catch (Throwable ex) {
                    failures.add(ex);
                }
            });
        }
        start.countDown();
        pool.shutdown();
        assertTrue(pool.awaitTermination(60, TimeUnit.SECONDS));

        assertTrue(failures.isEmpty(), () -> "failures: " + failures);
        assertEquals(0, registry.activeSessions());
        assertTrue(pagesServed.get() > 0);
    }

    @Test
    void concurrentCallersOnSameSessionStayWithinBounds() throws Exception {
        SessionRegistry registry = newRegistry(Duration.ofMinutes(5), Duration.ofMinutes(1));
        String id = registry.createSession(QUERY, Rows.employees(95), 10).getId();
        int threads = 8;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        ConcurrentLinkedQueue<Throwable> failures = new ConcurrentLinkedQueue<>();

        for (int t = 0; t < threads; t++) {
            final boolean forward = t % 2 == 0;
            pool.submit(() -> {
                try {
                    for (int i = 0; i < 2000; i++) {
                        PageView view = forward
                                ? registry.nextPage(id).orElseThrow()
                                : registry.prevPage(id).orElseThrow();
                        int page = view.getPage();
                        assertTrue(page >= 1 && page <= 10, "page out of range: " + page);
                        // 页码与行内容保持一致
                        int expectedFirstId = (page - 1) * 10 + 1;
                        assertEquals(expectedFirstId, view.getRows().get(0).get("id"));
                    }
                } catch (Throwable ex) {
                    failures.add(ex);
                }
            });
        }
        pool.shutdown();
        assertTrue(pool.awaitTermination(60, TimeUnit.SECONDS));
        assertTrue(failures.isEmpty(), () -> "failures: " + failures);
    }

    @Test
    void reaperEvictsStopsAndRestarts() throws Exception {
        SessionRegistry registry = newRegistry(Duration.ofMillis(50), Duration.ofMillis(20));

        String first = registry.createSession(QUERY, Rows.employees(3), 10).getId();
        assertTrue(registry.isReaperRunning());
        assertTrue(await(() -> !registry.getSession(first).isPresent()), "session was not evicted");
        assertTrue(await(() -> !registry.isReaperRunning()), "reaper did not stop");

        String second = registry.createSession(QUERY, Rows.employees(3), 10).getId();
        assertTrue(registry.isReaperRunning());
        assertTrue(await(() -> !registry.getSession(second).isPresent()), "restarted reaper did not evict");
        assertTrue(await(() -> !registry.isReaperRunning()), "reaper did not stop again");
    }

    @Test
    void scheduledReaperSurvivesFailingSweep() throws Exception {
        PagerProperties.Session settings = new PagerProperties().getSession();
        settings.setIdleTimeout(Duration.ofMillis(50));
        settings.setSweepInterval(Duration.ofMillis(20));
        AtomicInteger failuresLeft = new AtomicInteger();
        Ticker failingTicker = new Ticker() {
            @Override
            public long read() {
                if (failuresLeft.getAndUpdate(n -> Math.max(0, n - 1)) > 0) {
                    throw new Error("clock failure");
                }
                return System.nanoTime();
            }
        };
        SessionRegistry registry = new SessionRegistry(settings, failingTicker, new SessionIdGenerator());
        registries.add(registry);

        String id = registry.createSession(QUERY, Rows.employees(3), 10).getId();
        failuresLeft.set(3);
        assertTrue(await(() -> failuresLeft.get() == 0), "sweep never ran");
        assertTrue(await(() -> !registry.getSession(id).isPresent()), "reaper died after a failed sweep");
        assertTrue(await(() -> !registry.isReaperRunning()), "reaper did not stop");
    }

    @Test
    void reaperRunsWheneverSessionsRemain() throws Exception {
        // 超时足够长，只有显式删除会清空会话表
        SessionRegistry registry = newRegistry(Duration.ofMinutes(5), Duration.ofMillis(5));
        int threads = 8;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        ConcurrentLinkedQueue<Throwable> failures = new ConcurrentLinkedQueue<>();

        for (int t = 0; t < threads; t++) {
            final int worker = t;
            pool.submit(() -> {
                try {
                    for (int i = 0; i < 300; i++) {
                        String id = registry.createSession(QUERY, Rows.employees(2), 10).getId();
                        if (ThreadLocalRandom.current().nextBoolean()) {
                            Thread.yield();
                        }
                        // 最后一轮保留会话
                        if (!(worker == 0 && i == 299)) {
                            registry.deleteSession(id);
                        }
                    }
                } catch (Throwable ex) {
                    failures.add(ex);
                }
            });
        }
        pool.shutdown();
        assertTrue(pool.awaitTermination(60, TimeUnit.SECONDS));
        assertTrue(failures.isEmpty(), () -> "failures: " + failures);

        assertEquals(1, registry.activeSessions());
        Optional<PagedResultSet> remaining = registry.listSessions().stream()
                .findFirst()
                .flatMap(summary -> registry.getSession(summary.getSessionId()));
        assertTrue(remaining.isPresent());
        assertTrue(registry.isReaperRunning());
    }

    private static boolean await(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (System.nanoTime() < deadline) {
            if (condition.getAsBoolean()) {
                return true;
            }
            Thread.sleep(10);
        }
        return condition.getAsBoolean();
    }
}
