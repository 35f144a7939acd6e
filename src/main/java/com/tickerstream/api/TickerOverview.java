package com.tickerstream.api;

import java.util.List;
import java.util.Set;

import com.tickerstream.registry.LiveSourceSnapshot;

public record TickerOverview(
        Set<String> active,
        List<LiveSourceSnapshot> sources,
        int sessions) {
}
