package com.tickerstream.registry;

import com.tickerstream.source.SourceHandle;
import com.tickerstream.source.SourceUnavailableException;

import reactor.core.publisher.Mono;

// Guarded by the registry monitor, except handle, which update callbacks read without it.
final class LiveSourceEntry {

    final String symbol;
    int refCount;
    SourceState state = SourceState.CLOSED;
    volatile SourceHandle handle;
    Mono<Void> opening = Mono.empty();
    Mono<Void> closing = Mono.empty();
    SourceUnavailableException failure;

    LiveSourceEntry(String symbol) {
        this.symbol = symbol;
    }

    LiveSourceSnapshot snapshot() {
        return new LiveSourceSnapshot(symbol, refCount, state);
    }
}
