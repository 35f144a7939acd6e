package com.tickerstream.session;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public record SubscriptionResult(
        boolean success,
        List<String> tickers,
        Map<String, String> failed) {

    public static SubscriptionResult of(List<String> tickers, Map<String, String> failed) {
        return new SubscriptionResult(
                failed.isEmpty(),
                List.copyOf(tickers),
                Collections.unmodifiableMap(new LinkedHashMap<>(failed)));
    }
}
