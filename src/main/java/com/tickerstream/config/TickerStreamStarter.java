package com.tickerstream.config;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.ApplicationListener;

import com.tickerstream.session.TickerService;

import jakarta.annotation.PreDestroy;
import reactor.core.Disposable;

public class TickerStreamStarter implements ApplicationListener<ApplicationReadyEvent> {

    private static final Logger log = LoggerFactory.getLogger(TickerStreamStarter.class);

    private final TickerStreamProperties properties;
    private final TickerService tickerService;
    private Disposable preload;

    public TickerStreamStarter(TickerStreamProperties properties, TickerService tickerService) {
        this.properties = properties;
        this.tickerService = tickerService;
    }

    @Override
    public void onApplicationEvent(ApplicationReadyEvent event) {
        log.info("EVENT=TICKER_STREAM_READY source={} openTimeoutMs={} pollIntervalMs={} preload={}",
                properties.getSource(),
                properties.getOpenTimeout().toMillis(),
                properties.getPollInterval().toMillis(),
                properties.getPreloadSymbols());
        List<String> symbols = properties.getPreloadSymbols();
        if (symbols == null || symbols.isEmpty()) {
            return;
        }
        preload = tickerService.subscribe(symbols)
                .subscribe(result -> {
                    if (!result.success()) {
                        log.warn("EVENT=PRELOAD_PARTIAL pinned={} failed={}", result.tickers(), result.failed());
                    } else {
                        log.info("EVENT=PRELOAD_DONE pinned={}", result.tickers());
                    }
                }, ex -> log.error("EVENT=PRELOAD_FAILED message={}", ex.getMessage(), ex));
    }

    @PreDestroy
    public void shutdown() {
        if (preload != null) {
            preload.dispose();
        }
    }
}
