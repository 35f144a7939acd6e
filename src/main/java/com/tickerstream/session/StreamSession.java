package com.tickerstream.session;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
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
import com.tickerstream.registry.Symbols;

import reactor.core.Disposable;
import reactor.core.Disposables;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

public class StreamSession implements SubscriptionSession {

    private static final Logger log = LoggerFactory.getLogger(StreamSession.class);

    private final String id;
    private final LiveSourceRegistry registry;
    private final StreamBridge<StreamMessage> bridge;
    private final Runnable onTeardown;
    private final Map<String, Disposable> detachBySymbol = new ConcurrentHashMap<>();
    private final Disposable.Swap actions = Disposables.swap();
    private final AtomicBoolean closed = new AtomicBoolean();

    public StreamSession(String id, LiveSourceRegistry registry, Runnable onTeardown) {
        this.id = id;
        this.registry = registry;
        this.bridge = new StreamBridge<>(id);
        this.onTeardown = onTeardown;
    }

    public Flux<StreamMessage> connect(Flux<ClientAction> clientActions) {
        return Flux.defer(() -> {
            log.info("EVENT=SESSION_OPEN session={} shape=stream", id);
            actions.update(clientActions
                    .concatMap(this::handle)
                    .subscribe(null,
                            ex -> {
                                log.warn("EVENT=SESSION_ACTIONS_ERROR session={} message={}", id, ex.getMessage());
                                teardown().subscribe();
                            },
                            () -> log.info("EVENT=SESSION_ACTIONS_COMPLETE session={}", id)));
            return bridge.asFlux();
        }).doFinally(signal -> {
            log.info("EVENT=SESSION_OUTPUT_END session={} signal={}", id, signal);
            teardown().subscribe();
        });
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public Set<String> symbols() {
        return Collections.unmodifiableSet(new TreeSet<>(detachBySymbol.keySet()));
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
        actions.dispose();
        List<String> held;
        synchronized (this) {
            held = new ArrayList<>(detachBySymbol.keySet());
            detachBySymbol.values().forEach(Disposable::dispose);
            detachBySymbol.clear();
        }
        log.info("EVENT=SESSION_TEARDOWN session={} released={}", id, held);
        Mono<Void> releases = Flux.fromIterable(held)
                .flatMap(registry::release)
                .then()
                .cache();
        releases.subscribe();
        bridge.close();
        onTeardown.run();
        return releases;
    }

    Mono<Void> handle(ClientAction action) {
        if (closed.get()) {
            return Mono.empty();
        }
        if (action == null || action.action() == null || Symbols.isBlank(action.ticker())) {
            log.debug("EVENT=SESSION_ACTION_SKIPPED session={} action={}", id, action);
            return Mono.empty();
        }
        String symbol = Symbols.normalize(action.ticker());
        switch (action.action()) {
            case SUBSCRIBE:
                return subscribe(symbol);
            case UNSUBSCRIBE:
                return unsubscribe(symbol);
            default:
                return Mono.empty();
        }
    }

    private Mono<Void> subscribe(String symbol) {
        if (detachBySymbol.containsKey(symbol)) {
            return Mono.empty();
        }
        // The acquire is subscribed on its own so a teardown that cancels the action pipeline cannot
        // strand the reference it takes.
        Sinks.Empty<Void> settled = Sinks.empty();
        registry.acquire(symbol).subscribe(null,
                ex -> {
                    onAcquireFailed(symbol, ex);
                    settled.tryEmitEmpty();
                },
                () -> {
                    onAcquired(symbol);
                    settled.tryEmitEmpty();
                });
        return settled.asMono();
    }

    private void onAcquired(String symbol) {
        boolean attached = false;
        synchronized (this) {
            if (!closed.get() && !detachBySymbol.containsKey(symbol)) {
                detachBySymbol.put(symbol, registry.attach(symbol, update -> onUpdate(symbol, update)));
                attached = true;
            }
        }
        if (attached) {
            log.info("EVENT=SESSION_SUBSCRIBED session={} symbol={}", id, symbol);
        } else {
            log.info("EVENT=SESSION_SUBSCRIBE_DISCARDED session={} symbol={}", id, symbol);
            registry.release(symbol).subscribe();
        }
    }

    private void onAcquireFailed(String symbol, Throwable ex) {
        log.warn("EVENT=SESSION_SUBSCRIBE_FAILED session={} symbol={} reason={}", id, symbol, ex.getMessage());
        bridge.push(new SubscriptionFailed(symbol, ex.getMessage()));
    }

    private Mono<Void> unsubscribe(String symbol) {
        Disposable detach;
        synchronized (this) {
            detach = detachBySymbol.remove(symbol);
        }
        if (detach == null) {
            return Mono.empty();
        }
        detach.dispose();
        log.info("EVENT=SESSION_UNSUBSCRIBED session={} symbol={}", id, symbol);
        return registry.release(symbol);
    }

    private void onUpdate(String symbol, PriceUpdate update) {
        if (detachBySymbol.containsKey(symbol)) {
            bridge.push(PriceMessage.of(update));
        }
    }
}
