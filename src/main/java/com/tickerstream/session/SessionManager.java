package com.tickerstream.session;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tickerstream.registry.LiveSourceRegistry;

import jakarta.annotation.PreDestroy;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

public class SessionManager {

    private static final Logger log = LoggerFactory.getLogger(SessionManager.class);

    private final LiveSourceRegistry registry;
    private final Duration pollInterval;
    private final Scheduler pollScheduler;
    private final AtomicLong ids = new AtomicLong();
    private final Map<String, SubscriptionSession> sessions = new ConcurrentHashMap<>();

    public SessionManager(LiveSourceRegistry registry, Duration pollInterval) {
        this(registry, pollInterval, Schedulers.newParallel("watch-poll", 2));
    }

    public SessionManager(LiveSourceRegistry registry, Duration pollInterval, Scheduler pollScheduler) {
        this.registry = registry;
        this.pollInterval = pollInterval;
        this.pollScheduler = pollScheduler;
    }

    public StreamSession openStream() {
        String id = "ws-" + ids.incrementAndGet();
        StreamSession session = new StreamSession(id, registry, () -> remove(id));
        sessions.put(id, session);
        return session;
    }

    public WatchSession openWatch() {
        String id = "watch-" + ids.incrementAndGet();
        WatchSession session = new WatchSession(id, registry, pollInterval, pollScheduler, () -> remove(id));
        sessions.put(id, session);
        return session;
    }

    public int activeSessionCount() {
        return sessions.size();
    }

    public List<SubscriptionSession> sessions() {
        return new ArrayList<>(sessions.values());
    }

    @PreDestroy
    public void shutdown() {
        log.info("EVENT=SESSIONS_SHUTDOWN count={}", sessions.size());
        for (SubscriptionSession session : sessions()) {
            session.teardown().subscribe();
        }
        pollScheduler.dispose();
    }

    private void remove(String id) {
        sessions.remove(id);
    }
}
