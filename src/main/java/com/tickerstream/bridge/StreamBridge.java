package com.tickerstream.bridge;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.MonoSink;

public class StreamBridge<T> {

    private static final Logger log = LoggerFactory.getLogger(StreamBridge.class);

    private final String name;
    private final Deque<T> pending = new ArrayDeque<>();
    private MonoSink<T> waiting;
    private boolean closed;

    public StreamBridge(String name) {
        this.name = name;
    }

    public void push(T item) {
        MonoSink<T> consumer;
        synchronized (this) {
            if (closed) {
                log.debug("EVENT=BRIDGE_PUSH_AFTER_CLOSE bridge={}", name);
                return;
            }
            consumer = waiting;
            waiting = null;
            if (consumer == null) {
                pending.addLast(item);
                return;
            }
        }
        consumer.success(item);
    }

    public Mono<T> pull() {
        return Mono.create(sink -> {
            T item;
            synchronized (this) {
                item = closed ? null : pending.pollFirst();
                if (item == null && !closed) {
                    if (waiting != null) {
                        sink.error(new IllegalStateException("bridge " + name + " already has a waiting consumer"));
                        return;
                    }
                    waiting = sink;
                    sink.onCancel(() -> clearWaiting(sink));
                    return;
                }
            }
            if (item != null) {
                sink.success(item);
            } else {
                sink.success();
            }
        });
    }

    public void close() {
        MonoSink<T> consumer;
        int discarded;
        synchronized (this) {
            if (closed) {
                return;
            }
            closed = true;
            consumer = waiting;
            waiting = null;
            discarded = pending.size();
            pending.clear();
        }
        log.debug("EVENT=BRIDGE_CLOSED bridge={} discarded={}", name, discarded);
        if (consumer != null) {
            consumer.success();
        }
    }

    public Flux<T> asFlux() {
        return Mono.defer(this::pull)
                .map(Optional::of)
                .defaultIfEmpty(Optional.empty())
                .repeat()
                .takeWhile(Optional::isPresent)
                .map(Optional::get);
    }

    public synchronized boolean isClosed() {
        return closed;
    }

    public synchronized int pendingCount() {
        return pending.size();
    }

    public String name() {
        return name;
    }

    private synchronized void clearWaiting(MonoSink<T> sink) {
        if (waiting == sink) {
            waiting = null;
        }
    }
}
