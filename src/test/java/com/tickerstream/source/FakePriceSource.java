package com.tickerstream.source;

import java.time.Duration;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

// Opens and closes complete immediately unless held; prices are emitted on demand.
public class FakePriceSource implements PriceSource {

    private final Map<String, AtomicInteger> opens = new ConcurrentHashMap<>();
    private final Map<String, AtomicInteger> closes = new ConcurrentHashMap<>();
    private final Map<String, FakeHandle> live = new ConcurrentHashMap<>();
    private final Map<String, PendingOpen> pendingOpens = new ConcurrentHashMap<>();
    private final Map<String, Sinks.Empty<Void>> pendingCloses = new ConcurrentHashMap<>();
    private final Set<String> failing = ConcurrentHashMap.newKeySet();
    private volatile boolean holdOpens;
    private volatile boolean holdCloses;
    private volatile boolean failCloses;

    @Override
    public Mono<SourceHandle> open(String symbol, Duration timeout) {
        return Mono.defer(() -> {
            opens.computeIfAbsent(symbol, key -> new AtomicInteger()).incrementAndGet();
            if (failing.contains(symbol)) {
                return Mono.error(new IllegalStateException("feed down for " + symbol));
            }
            FakeHandle handle = new FakeHandle(symbol);
            if (holdOpens) {
                PendingOpen pending = new PendingOpen(handle, Sinks.one());
                pendingOpens.put(symbol, pending);
                return pending.sink().asMono().doOnNext(opened -> live.put(symbol, (FakeHandle) opened));
            }
            live.put(symbol, handle);
            return Mono.just(handle);
        });
    }

    @Override
    public Mono<Void> close(SourceHandle handle) {
        return Mono.defer(() -> {
            closes.computeIfAbsent(handle.symbol(), key -> new AtomicInteger()).incrementAndGet();
            live.remove(handle.symbol(), handle);
            if (failCloses) {
                return Mono.error(new IllegalStateException("close blew up for " + handle.symbol()));
            }
            if (holdCloses) {
                Sinks.Empty<Void> pending = Sinks.empty();
                pendingCloses.put(handle.symbol(), pending);
                return pending.asMono();
            }
            return Mono.empty();
        });
    }

    @Override
    public void onUpdate(SourceHandle handle, PriceCallback callback) {
        ((FakeHandle) handle).callback = callback;
    }

    @Override
    public String name() {
        return "fake";
    }

    public void holdOpens(boolean hold) {
        this.holdOpens = hold;
    }

    public void holdCloses(boolean hold) {
        this.holdCloses = hold;
    }

    public void failCloses(boolean fail) {
        this.failCloses = fail;
    }

    public void failOpensFor(String symbol) {
        failing.add(symbol);
    }

    public void completeOpen(String symbol) {
        PendingOpen pending = pendingOpens.remove(symbol);
        if (pending == null) {
            throw new IllegalStateException("no pending open for " + symbol);
        }
        pending.sink().tryEmitValue(pending.handle());
    }

    public void failOpen(String symbol) {
        PendingOpen pending = pendingOpens.remove(symbol);
        if (pending == null) {
            throw new IllegalStateException("no pending open for " + symbol);
        }
        pending.sink().tryEmitError(new IllegalStateException("feed down for " + symbol));
    }

    public void completeClose(String symbol) {
        Sinks.Empty<Void> pending = pendingCloses.remove(symbol);
        if (pending == null) {
            throw new IllegalStateException("no pending close for " + symbol);
        }
        pending.tryEmitEmpty();
    }

    public boolean emit(String symbol, double price, long timestampMs) {
        FakeHandle handle = live.get(symbol);
        if (handle == null || handle.callback == null) {
            return false;
        }
        handle.callback.onPrice(price, timestampMs);
        return true;
    }

    public int openCount(String symbol) {
        AtomicInteger count = opens.get(symbol);
        return count == null ? 0 : count.get();
    }

    public int closeCount(String symbol) {
        AtomicInteger count = closes.get(symbol);
        return count == null ? 0 : count.get();
    }

    public boolean isLive(String symbol) {
        return live.containsKey(symbol);
    }

    private record PendingOpen(FakeHandle handle, Sinks.One<SourceHandle> sink) {
    }

    static final class FakeHandle implements SourceHandle {

        private final String symbol;
        private volatile PriceCallback callback;

        FakeHandle(String symbol) {
            this.symbol = symbol;
        }

        @Override
        public String symbol() {
            return symbol;
        }

        @Override
        public String sourceName() {
            return "fake";
        }
    }
}
