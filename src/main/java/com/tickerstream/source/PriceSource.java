package com.tickerstream.source;

import java.time.Duration;

import reactor.core.publisher.Mono;

public interface PriceSource {

    Mono<SourceHandle> open(String symbol, Duration timeout);

    Mono<Void> close(SourceHandle handle);

    void onUpdate(SourceHandle handle, PriceCallback callback);

    String name();
}
