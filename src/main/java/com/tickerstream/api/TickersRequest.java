package com.tickerstream.api;

import java.util.List;

import jakarta.validation.constraints.NotNull;

public record TickersRequest(
        @NotNull List<String> tickers) {
}
