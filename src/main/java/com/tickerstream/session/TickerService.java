package com.tickerstream.session;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tickerstream.registry.LiveSourceRegistry;
import com.tickerstream.registry.Symbols;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

public class TickerService {

    private static final Logger log = LoggerFactory.getLogger(TickerService.class);

    private final LiveSourceRegistry registry;

    public TickerService(LiveSourceRegistry registry) {
        this.registry = registry;
    }

    public Mono<SubscriptionResult> subscribe(List<String> tickers) {
        List<String> symbols = normalize(tickers);
        if (symbols.isEmpty()) {
            return Mono.error(new IllegalArgumentException("tickers must name at least one symbol"));
        }
        return Flux.fromIterable(symbols)
                .flatMapSequential(symbol -> registry.acquire(symbol)
                        .thenReturn(Outcome.ok(symbol))
                        .onErrorResume(ex -> Mono.just(Outcome.failed(symbol, ex.getMessage()))))
                .collectList()
                .map(this::toResult)
                .doOnNext(result -> log.info("EVENT=TICKERS_SUBSCRIBE subscribed={} failed={}",
                        result.tickers(), result.failed().keySet()));
    }

    public Mono<SubscriptionResult> unsubscribe(List<String> tickers) {
        List<String> symbols = normalize(tickers);
        if (symbols.isEmpty()) {
            return Mono.error(new IllegalArgumentException("tickers must name at least one symbol"));
        }
        return Flux.fromIterable(symbols)
                .concatMap(registry::release)
                .then(Mono.fromSupplier(() -> SubscriptionResult.of(symbols, Map.of())))
                .doOnNext(result -> log.info("EVENT=TICKERS_UNSUBSCRIBE unsubscribed={}", result.tickers()));
    }

    public Set<String> activeTickers() {
        return registry.activeSymbols();
    }

    private SubscriptionResult toResult(List<Outcome> outcomes) {
        List<String> subscribed = new ArrayList<>();
        Map<String, String> failed = new LinkedHashMap<>();
        for (Outcome outcome : outcomes) {
            if (outcome.error() == null) {
                subscribed.add(outcome.symbol());
            } else {
                failed.put(outcome.symbol(), outcome.error());
            }
        }
        return SubscriptionResult.of(subscribed, failed);
    }

    private static List<String> normalize(List<String> tickers) {
        Set<String> symbols = new LinkedHashSet<>();
        if (tickers != null) {
            for (String ticker : tickers) {
                if (!Symbols.isBlank(ticker)) {
                    symbols.add(Symbols.normalize(ticker));
                }
            }
        }
        return new ArrayList<>(symbols);
    }

    private record Outcome(String symbol, String error) {

        static Outcome ok(String symbol) {
            return new Outcome(symbol, null);
        }

        static Outcome failed(String symbol, String error) {
            return new Outcome(symbol, error == null ? "unavailable" : error);
        }
    }
}
