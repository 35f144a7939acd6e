package com.tickerstream.bus;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import jakarta.annotation.PreDestroy;
import reactor.core.Disposable;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

public class UpdateBus {

    private static final Logger log = LoggerFactory.getLogger(UpdateBus.class);

    private final Map<String, List<Registration>> listeners = new ConcurrentHashMap<>();
    private final Scheduler replayScheduler;
    private final boolean ownsScheduler;

    public UpdateBus() {
        this(Schedulers.newParallel("update-bus-replay", 2), true);
    }

    public UpdateBus(Scheduler replayScheduler) {
        this(replayScheduler, false);
    }

    private UpdateBus(Scheduler replayScheduler, boolean ownsScheduler) {
        this.replayScheduler = replayScheduler;
        this.ownsScheduler = ownsScheduler;
    }

    public Disposable attach(String symbol, Consumer<PriceUpdate> listener) {
        return attach(symbol, listener, () -> null);
    }

    public Disposable attach(String symbol, Consumer<PriceUpdate> listener, Supplier<PriceUpdate> replaySource) {
        Registration registration = new Registration(symbol, listener);
        listeners.compute(symbol, (key, current) -> {
            List<Registration> target = current != null ? current : new CopyOnWriteArrayList<>();
            target.add(registration);
            return target;
        });
        // Read only once publishers can see the registration: anything newer is held back, not missed.
        PriceUpdate replayValue = replaySource.get();
        registration.prepareReplay(replayValue);
        log.debug("EVENT=BUS_ATTACH symbol={} replay={}", symbol, replayValue != null);
        if (replayValue != null) {
            replayScheduler.schedule(() -> registration.replay(replayValue));
        } else {
            registration.replay(null);
        }
        return registration;
    }

    public void publish(PriceUpdate update) {
        List<Registration> registrations = listeners.get(update.symbol());
        if (registrations == null) {
            return;
        }
        for (Registration registration : registrations) {
            registration.deliver(update);
        }
    }

    public int listenerCount(String symbol) {
        List<Registration> registrations = listeners.get(symbol);
        return registrations == null ? 0 : registrations.size();
    }

    @PreDestroy
    public void shutdown() {
        listeners.clear();
        if (ownsScheduler) {
            replayScheduler.dispose();
        }
    }

    private void detach(Registration registration) {
        listeners.computeIfPresent(registration.symbol, (key, current) -> {
            current.remove(registration);
            return current.isEmpty() ? null : current;
        });
        log.debug("EVENT=BUS_DETACH symbol={}", registration.symbol);
    }

    private final class Registration implements Disposable {

        private final String symbol;
        private final Consumer<PriceUpdate> listener;
        private final AtomicBoolean disposed = new AtomicBoolean();
        private final Deque<PriceUpdate> heldBack = new ArrayDeque<>();
        private boolean replaying = true;
        private PriceUpdate replayed;

        private Registration(String symbol, Consumer<PriceUpdate> listener) {
            this.symbol = symbol;
            this.listener = listener;
        }

        private void deliver(PriceUpdate update) {
            if (disposed.get()) {
                return;
            }
            synchronized (this) {
                if (replaying) {
                    heldBack.addLast(update);
                    return;
                }
                if (update == replayed) {
                    replayed = null;
                    return;
                }
            }
            invoke(update);
        }

        // A replay value missing from heldBack was published before attach or is still in flight; its
        // live delivery, if one comes, is skipped.
        private synchronized void prepareReplay(PriceUpdate cached) {
            if (cached == null) {
                return;
            }
            if (containsSame(cached)) {
                PriceUpdate dropped;
                do {
                    dropped = heldBack.pollFirst();
                } while (dropped != cached);
            } else {
                heldBack.removeIf(update -> update.timestampMs() < cached.timestampMs());
                replayed = cached;
            }
        }

        private void replay(PriceUpdate cached) {
            if (cached != null) {
                invoke(cached);
            }
            while (true) {
                PriceUpdate next;
                synchronized (this) {
                    next = heldBack.pollFirst();
                    if (next == null) {
                        replaying = false;
                        return;
                    }
                    if (next == replayed) {
                        replayed = null;
                        next = null;
                    }
                }
                if (next != null) {
                    invoke(next);
                }
            }
        }

        private boolean containsSame(PriceUpdate cached) {
            for (PriceUpdate update : heldBack) {
                if (update == cached) {
                    return true;
                }
            }
            return false;
        }

        private void invoke(PriceUpdate update) {
            if (disposed.get()) {
                return;
            }
            try {
                listener.accept(update);
            } catch (RuntimeException ex) {
                log.warn("EVENT=BUS_LISTENER_ERROR symbol={} message={}", symbol, ex.getMessage(), ex);
            }
        }

        @Override
        public void dispose() {
            if (disposed.compareAndSet(false, true)) {
                detach(this);
            }
        }

        @Override
        public boolean isDisposed() {
            return disposed.get();
        }
    }
}
