package com.tickerstream.bus;

public record PriceUpdate(
        String symbol,
        double price,
        long timestampMs,
        String source) {
}
