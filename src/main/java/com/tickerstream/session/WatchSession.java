package com.tickerstream.session;

import java.time.Duration;
import java.util.Collections;
import java.util.Iterator;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tickerstream.bridge.StreamBridge;
import com.tickerstream.bus.PriceUpdate;
import com.tickerstream.registry.LiveSourceRegistry;

import reactor.core.Disposable;
import reactor.core.Disposables;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

public class WatchSession implements SubscriptionSession {

    private static final Logger log = LoggerFactory.getLogger(WatchSession.class);

    private final String id;
    private final LiveSourceRegistry registry;
    private final Duration pollInterval;
    private final Scheduler pollScheduler;
    private final Runnable onTeardown;
    private final StreamBridge<PriceUpdate> bridge;
    private final Map<String, Disposable> attached = new ConcurrentHashMap<>();
    private final Disposable.Swap poller = Disposables.swap();
    private final AtomicBoolean closed = new AtomicBoolean();

    public WatchSession(String id,
            LiveSourceRegistry registry,
            Duration pollInterval,
            Scheduler pollScheduler,
            Runnable onTeardown) {
        this.id = id;
        this.registry = registry;
        this.pollInterval = pollInterval;
        this.pollScheduler = pollScheduler;
        this.onTeardown = onTeardown;
        this.bridge = new StreamBridge<>(id);
    }

    public Flux<PriceUpdate> updates() {
        return Flux.defer(() -> {
            log.info("EVENT=SESSION_OPEN session={} shape=watch pollMs={}", id, pollInterval.toMillis());
            reconcile();
            poller.update(Flux.interval(pollInterval, pollInterval, pollScheduler)
                    .onBackpressureDrop()
                    .subscribe(tick -> reconcile(),
                            ex -> log.error("EVENT=WATCH_POLL_ERROR session={} message={}", id, ex.getMessage(), ex)));
            return bridge.asFlux();
        }).doFinally(signal -> {
            log.info("EVENT=SESSION_OUTPUT_END session={} signal={}", id, signal);
            teardown().subscribe();
        });
    }

    synchronized void reconcile() {
        if (closed.get()) {
            return;
        }
        Set<String> active = registry.activeSymbols();
        for (String symbol : active) {
            if (!attached.containsKey(symbol)) {
                log.info("EVENT=WATCH_SYMBOL_ADDED session={} symbol={}", id, symbol);
                attached.put(symbol, registry.attach(symbol, bridge::push));
            }
        }
        Iterator<Map.Entry<String, Disposable>> it = attached.entrySet().iterator();
        while (it.hasNext()) {
            Map.Entry<String, Disposable> entry = it.next();
            if (!active.contains(entry.getKey())) {
                log.info("EVENT=WATCH_SYMBOL_REMOVED session={} symbol={}", id, entry.getKey());
                entry.getValue().dispose();
                it.remove();
            }
        }
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public Set<String> symbols() {
        return Collections.unmodifiableSet(new TreeSet<>(attached.keySet()));
    }

    @Override
    public boolean isClosed() {
        return closed.get();
    }

    @Override
    public Mono<Void> teardown() {
        if (!closed.compareAndSet(false, true)) {
            return Mono.empty();
        }
        poller.dispose();
        synchronized (this) {
            attached.values().forEach(Disposable::dispose);
            attached.clear();
        }
        log.info("EVENT=SESSION_TEARDOWN session={}", id);
        bridge.close();
        onTeardown.run();
        return Mono.empty();
    }
}
