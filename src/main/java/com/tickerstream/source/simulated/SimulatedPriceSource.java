package com.tickerstream.source.simulated;

import java.time.Duration;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.atomic.AtomicReference;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tickerstream.config.TickerStreamProperties;
import com.tickerstream.source.PriceCallback;
import com.tickerstream.source.PriceSource;
import com.tickerstream.source.SourceHandle;

import jakarta.annotation.PreDestroy;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

public class SimulatedPriceSource implements PriceSource {

    private static final Logger log = LoggerFactory.getLogger(SimulatedPriceSource.class);
    private static final String NAME = "simulated";

    private static final Map<String, Double> BASE_PRICES = Map.of(
            "BTCUSD", 65000.0,
            "ETHUSD", 3500.0,
            "SOLUSD", 150.0,
            "ADAUSD", 0.45);

    private final TickerStreamProperties.Simulated properties;
    private final Scheduler tickScheduler;
    private final Random random = new Random();

    public SimulatedPriceSource(TickerStreamProperties.Simulated properties) {
        this(properties, Schedulers.newParallel("simulated-ticks", 2));
    }

    public SimulatedPriceSource(TickerStreamProperties.Simulated properties, Scheduler tickScheduler) {
        this.properties = properties;
        this.tickScheduler = tickScheduler;
    }

    @Override
    public Mono<SourceHandle> open(String symbol, Duration timeout) {
        return Mono.fromCallable(() -> {
            SimulatedHandle handle = new SimulatedHandle(symbol, BASE_PRICES.getOrDefault(symbol, properties.getStartPrice()));
            Duration interval = properties.getTickInterval();
            handle.ticker = Flux.interval(Duration.ZERO, interval, tickScheduler)
                    .onBackpressureDrop()
                    .subscribe(tick -> handle.tick(nextPrice(handle.lastPrice)),
                            ex -> log.error("EVENT=SIMULATED_TICK_ERROR symbol={} message={}", symbol, ex.getMessage(), ex));
            log.info("EVENT=SIMULATED_SOURCE_OPEN symbol={} startPrice={}", symbol, handle.lastPrice);
            return handle;
        });
    }

    @Override
    public Mono<Void> close(SourceHandle handle) {
        return Mono.fromRunnable(() -> {
            if (handle instanceof SimulatedHandle simulated && simulated.ticker != null) {
                simulated.ticker.dispose();
                log.info("EVENT=SIMULATED_SOURCE_CLOSE symbol={}", handle.symbol());
            }
        });
    }

    @Override
    public void onUpdate(SourceHandle handle, PriceCallback callback) {
        if (handle instanceof SimulatedHandle simulated) {
            simulated.callback.set(callback);
        }
    }

    @Override
    public String name() {
        return NAME;
    }

    @PreDestroy
    public void shutdown() {
        tickScheduler.dispose();
    }

    double nextPrice(double current) {
        double change;
        synchronized (random) {
            change = current * random.nextGaussian() * properties.getVolatility();
        }
        return Math.max(current + change, 0.01);
    }

    private static final class SimulatedHandle implements SourceHandle {

        private final String symbol;
        private final AtomicReference<PriceCallback> callback = new AtomicReference<>();
        private volatile double lastPrice;
        private volatile Disposable ticker;

        private SimulatedHandle(String symbol, double startPrice) {
            this.symbol = symbol;
            this.lastPrice = startPrice;
        }

        private void tick(double price) {
            lastPrice = price;
            PriceCallback current = callback.get();
            if (current != null) {
                current.onPrice(price, System.currentTimeMillis());
            }
        }

        @Override
        public String symbol() {
            return symbol;
        }

        @Override
        public String sourceName() {
            return NAME;
        }
    }
}
