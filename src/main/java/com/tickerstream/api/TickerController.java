package com.tickerstream.api;

import java.util.Map;

import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import com.tickerstream.bus.PriceUpdate;
import com.tickerstream.registry.LiveSourceRegistry;
import com.tickerstream.session.SessionManager;
import com.tickerstream.session.SubscriptionResult;
import com.tickerstream.session.TickerService;

import jakarta.validation.Valid;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@RestController
@Validated
public class TickerController {

    private final TickerService tickerService;
    private final LiveSourceRegistry registry;
    private final SessionManager sessionManager;

    public TickerController(TickerService tickerService, LiveSourceRegistry registry, SessionManager sessionManager) {
        this.tickerService = tickerService;
        this.registry = registry;
        this.sessionManager = sessionManager;
    }

    @PostMapping("/api/tickers/subscribe")
    public Mono<SubscriptionResult> subscribe(@Valid @RequestBody TickersRequest request) {
        return tickerService.subscribe(request.tickers());
    }

    @PostMapping("/api/tickers/unsubscribe")
    public Mono<SubscriptionResult> unsubscribe(@Valid @RequestBody TickersRequest request) {
        return tickerService.unsubscribe(request.tickers());
    }

    @GetMapping("/api/tickers")
    public TickerOverview overview() {
        return new TickerOverview(registry.activeSymbols(), registry.snapshot(), sessionManager.activeSessionCount());
    }

    @GetMapping(path = "/api/tickers/watch", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public Flux<ServerSentEvent<PriceUpdate>> watch() {
        return sessionManager.openWatch()
                .updates()
                .map(update -> ServerSentEvent.builder(update)
                        .event("priceUpdate")
                        .build());
    }

    @GetMapping(path = "/health", produces = MediaType.TEXT_PLAIN_VALUE)
    public String health() {
        return "ok";
    }

    @ExceptionHandler(IllegalArgumentException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, String> badRequest(IllegalArgumentException ex) {
        return Map.of("error", String.valueOf(ex.getMessage()));
    }
}
