package com.tickerstream.source;

@FunctionalInterface
public interface PriceCallback {

    void onPrice(double price, long timestampMs);
}
