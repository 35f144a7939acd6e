package com.tickerstream.registry;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeoutException;
import java.util.function.Consumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tickerstream.bus.PriceUpdate;
import com.tickerstream.bus.UpdateBus;
import com.tickerstream.source.PriceSource;
import com.tickerstream.source.SourceHandle;
import com.tickerstream.source.SourceUnavailableException;

import jakarta.annotation.PreDestroy;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

// No collaborator call or callback runs while the monitor is held.
public class LiveSourceRegistry {

    private static final Logger log = LoggerFactory.getLogger(LiveSourceRegistry.class);

    private final PriceSource source;
    private final UpdateBus bus;
    private final Duration openTimeout;
    private final Duration closeTimeout;
    private final Map<String, LiveSourceEntry> entries = new HashMap<>();
    private final Map<String, PriceUpdate> lastValues = new ConcurrentHashMap<>();

    public LiveSourceRegistry(PriceSource source, UpdateBus bus, Duration openTimeout, Duration closeTimeout) {
        this.source = source;
        this.bus = bus;
        this.openTimeout = openTimeout;
        this.closeTimeout = closeTimeout;
    }

    public Mono<Void> acquire(String rawSymbol) {
        return Mono.defer(() -> {
            String symbol = Symbols.normalize(rawSymbol);
            Runnable launch = null;
            Mono<Void> pending;
            synchronized (this) {
                LiveSourceEntry entry = entries.computeIfAbsent(symbol, LiveSourceEntry::new);
                entry.refCount++;
                log.info("EVENT=SOURCE_ACQUIRE symbol={} refCount={} state={}", symbol, entry.refCount, entry.state);
                switch (entry.state) {
                    case OPEN:
                        return Mono.empty();
                    case OPENING:
                        pending = entry.opening;
                        break;
                    case CLOSING:
                        pending = entry.closing.then(Mono.defer(() -> awaitReopen(entry)));
                        break;
                    default:
                        launch = prepareOpen(entry);
                        pending = entry.opening;
                }
            }
            if (launch != null) {
                launch.run();
            }
            return pending;
        });
    }

    public Mono<Void> release(String rawSymbol) {
        return Mono.defer(() -> {
            String symbol = Symbols.normalize(rawSymbol);
            Runnable launch = null;
            Mono<Void> pending;
            synchronized (this) {
                LiveSourceEntry entry = entries.get(symbol);
                if (entry == null) {
                    log.warn("EVENT=REGISTRY_INVARIANT_VIOLATION op=release symbol={} reason=no_entry", symbol);
                    return Mono.empty();
                }
                if (entry.refCount == 0) {
                    if (entry.state == SourceState.CLOSING) {
                        return entry.closing;
                    }
                    log.warn("EVENT=REGISTRY_INVARIANT_VIOLATION op=release symbol={} reason=zero_refcount state={}",
                            symbol, entry.state);
                    return Mono.empty();
                }
                entry.refCount--;
                log.info("EVENT=SOURCE_RELEASE symbol={} refCount={} state={}", symbol, entry.refCount, entry.state);
                if (entry.refCount > 0) {
                    return Mono.empty();
                }
                switch (entry.state) {
                    case OPEN:
                        launch = prepareClose(entry);
                        pending = entry.closing;
                        break;
                    case OPENING:
                        log.info("EVENT=SOURCE_CANCEL_ON_OPEN symbol={}", symbol);
                        pending = entry.opening
                                .onErrorResume(ex -> Mono.empty())
                                .then(Mono.defer(() -> awaitClose(entry)));
                        break;
                    case CLOSING:
                        pending = entry.closing;
                        break;
                    default:
                        pending = Mono.empty();
                }
            }
            if (launch != null) {
                launch.run();
            }
            return pending;
        });
    }

    public Disposable attach(String rawSymbol, Consumer<PriceUpdate> listener) {
        String symbol = Symbols.normalize(rawSymbol);
        return bus.attach(symbol, listener, () -> lastValues.get(symbol));
    }

    public Optional<PriceUpdate> lastValue(String rawSymbol) {
        return Optional.ofNullable(lastValues.get(Symbols.normalize(rawSymbol)));
    }

    public synchronized Set<String> activeSymbols() {
        Set<String> active = new TreeSet<>();
        for (LiveSourceEntry entry : entries.values()) {
            if (entry.state == SourceState.OPEN) {
                active.add(entry.symbol);
            }
        }
        return Collections.unmodifiableSet(active);
    }

    public synchronized int refCount(String rawSymbol) {
        LiveSourceEntry entry = entries.get(Symbols.normalize(rawSymbol));
        return entry == null ? 0 : entry.refCount;
    }

    public synchronized SourceState state(String rawSymbol) {
        LiveSourceEntry entry = entries.get(Symbols.normalize(rawSymbol));
        return entry == null ? SourceState.CLOSED : entry.state;
    }

    public synchronized List<LiveSourceSnapshot> snapshot() {
        List<LiveSourceSnapshot> snapshots = new ArrayList<>();
        for (LiveSourceEntry entry : entries.values()) {
            snapshots.add(entry.snapshot());
        }
        snapshots.sort(Comparator.comparing(LiveSourceSnapshot::symbol));
        return snapshots;
    }

    @PreDestroy
    public void shutdown() {
        List<SourceHandle> handles = new ArrayList<>();
        synchronized (this) {
            for (LiveSourceEntry entry : entries.values()) {
                if (entry.handle != null) {
                    handles.add(entry.handle);
                    entry.handle = null;
                }
                entry.refCount = 0;
                entry.state = SourceState.CLOSED;
            }
            entries.clear();
        }
        log.info("EVENT=REGISTRY_SHUTDOWN handles={}", handles.size());
        try {
            Flux.fromIterable(handles)
                    .flatMap(this::closeQuietly)
                    .then()
                    .block(closeTimeout);
        } catch (RuntimeException ex) {
            log.warn("EVENT=REGISTRY_SHUTDOWN_INCOMPLETE message={}", ex.getMessage());
        }
    }

    private Runnable prepareOpen(LiveSourceEntry entry) {
        Sinks.One<Void> done = Sinks.one();
        entry.state = SourceState.OPENING;
        entry.failure = null;
        entry.opening = done.asMono();
        return () -> {
            log.info("EVENT=SOURCE_OPEN symbol={} source={} timeoutMs={}", entry.symbol, source.name(), openTimeout.toMillis());
            Mono.defer(() -> source.open(entry.symbol, openTimeout))
                    .timeout(openTimeout)
                    .switchIfEmpty(Mono.error(new IllegalStateException("source returned no handle")))
                    .subscribe(handle -> onOpened(entry, handle, done), ex -> onOpenFailed(entry, ex, done));
        };
    }

    private void onOpened(LiveSourceEntry entry, SourceHandle handle, Sinks.One<Void> done) {
        boolean orphaned;
        synchronized (this) {
            orphaned = entries.get(entry.symbol) != entry;
            if (!orphaned) {
                entry.handle = handle;
            }
        }
        if (orphaned) {
            log.warn("EVENT=REGISTRY_INVARIANT_VIOLATION op=open symbol={} reason=entry_discarded", entry.symbol);
            closeQuietly(handle).subscribe();
            done.tryEmitError(new SourceUnavailableException(entry.symbol, "registry discarded " + entry.symbol + " while opening"));
            return;
        }
        source.onUpdate(handle, (price, timestampMs) -> onPrice(entry, handle, price, timestampMs));
        Runnable launch = null;
        synchronized (this) {
            if (entries.get(entry.symbol) != entry) {
                orphaned = true;
            } else if (entry.refCount > 0) {
                entry.state = SourceState.OPEN;
            } else {
                launch = prepareClose(entry);
            }
        }
        if (orphaned) {
            done.tryEmitError(new SourceUnavailableException(entry.symbol, "registry shut down while opening " + entry.symbol));
            return;
        }
        log.info("EVENT=SOURCE_OPENED symbol={} cancelOnOpen={}", entry.symbol, launch != null);
        done.tryEmitEmpty();
        if (launch != null) {
            launch.run();
        }
    }

    private void onOpenFailed(LiveSourceEntry entry, Throwable ex, Sinks.One<Void> done) {
        SourceUnavailableException failure = toUnavailable(entry.symbol, ex);
        int rolledBack;
        synchronized (this) {
            rolledBack = entry.refCount;
            entry.refCount = 0;
            entry.state = SourceState.CLOSED;
            entry.handle = null;
            entry.failure = failure;
            entries.remove(entry.symbol, entry);
        }
        log.warn("EVENT=SOURCE_OPEN_FAILED symbol={} rolledBack={} reason={}", entry.symbol, rolledBack, failure.getMessage());
        done.tryEmitError(failure);
    }

    private Runnable prepareClose(LiveSourceEntry entry) {
        Sinks.One<Void> done = Sinks.one();
        SourceHandle handle = entry.handle;
        entry.state = SourceState.CLOSING;
        entry.closing = done.asMono();
        return () -> {
            log.info("EVENT=SOURCE_CLOSE symbol={}", entry.symbol);
            closeQuietly(handle)
                    .then(Mono.fromRunnable(() -> onClosed(entry, done)))
                    .subscribe();
        };
    }

    private void onClosed(LiveSourceEntry entry, Sinks.One<Void> done) {
        Runnable reopen = null;
        synchronized (this) {
            entry.handle = null;
            if (entry.refCount > 0 && entries.get(entry.symbol) == entry) {
                reopen = prepareOpen(entry);
            } else {
                entry.state = SourceState.CLOSED;
                entries.remove(entry.symbol, entry);
            }
        }
        log.info("EVENT=SOURCE_CLOSED symbol={} reopen={}", entry.symbol, reopen != null);
        done.tryEmitEmpty();
        if (reopen != null) {
            reopen.run();
        }
    }

    private Mono<Void> closeQuietly(SourceHandle handle) {
        return Mono.defer(() -> source.close(handle))
                .timeout(closeTimeout)
                .onErrorResume(ex -> {
                    log.warn("EVENT=SOURCE_CLOSE_FAILED symbol={} message={}", handle.symbol(), ex.getMessage());
                    return Mono.empty();
                });
    }

    private synchronized Mono<Void> awaitReopen(LiveSourceEntry entry) {
        switch (entry.state) {
            case OPENING:
                return entry.opening;
            case CLOSED:
                if (entry.failure != null) {
                    return Mono.error(entry.failure);
                }
                return Mono.empty();
            default:
                return Mono.empty();
        }
    }

    private synchronized Mono<Void> awaitClose(LiveSourceEntry entry) {
        return entry.state == SourceState.CLOSING ? entry.closing : Mono.empty();
    }

    private void onPrice(LiveSourceEntry entry, SourceHandle handle, double price, long timestampMs) {
        if (entry.handle != handle) {
            log.warn("EVENT=REGISTRY_INVARIANT_VIOLATION op=update symbol={} reason=stale_handle", entry.symbol);
            return;
        }
        if (!Double.isFinite(price)) {
            return;
        }
        long ts = timestampMs > 0 ? timestampMs : System.currentTimeMillis();
        PriceUpdate update = new PriceUpdate(entry.symbol, price, ts, handle.sourceName());
        lastValues.put(entry.symbol, update);
        log.debug("EVENT=PRICE_UPDATE symbol={} price={} ts={}", entry.symbol, price, ts);
        bus.publish(update);
    }

    private SourceUnavailableException toUnavailable(String symbol, Throwable ex) {
        if (ex instanceof SourceUnavailableException unavailable) {
            return unavailable;
        }
        if (ex instanceof TimeoutException) {
            return new SourceUnavailableException(symbol,
                    "open of " + symbol + " timed out after " + openTimeout.toMillis() + "ms", ex);
        }
        return new SourceUnavailableException(symbol, "open of " + symbol + " failed: " + ex.getMessage(), ex);
    }
}
