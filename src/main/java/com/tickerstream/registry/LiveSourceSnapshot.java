package com.tickerstream.registry;

public record LiveSourceSnapshot(
        String symbol,
        int refCount,
        SourceState state) {
}
