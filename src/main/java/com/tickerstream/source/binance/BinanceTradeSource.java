package com.tickerstream.source.binance;

import java.net.URI;
import java.time.Duration;
import java.util.Locale;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.reactive.socket.WebSocketMessage;
import org.springframework.web.reactive.socket.client.ReactorNettyWebSocketClient;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tickerstream.config.TickerStreamProperties;
import com.tickerstream.source.PriceCallback;
import com.tickerstream.source.PriceSource;
import com.tickerstream.source.SourceHandle;
import com.tickerstream.source.SourceUnavailableException;

import io.netty.channel.ChannelOption;
import jakarta.annotation.PreDestroy;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;
import reactor.netty.http.client.HttpClient;
import reactor.util.retry.Retry;

// Open once the first trade parses; later drops reconnect with backoff until closed.
public class BinanceTradeSource implements PriceSource {

    private static final Logger log = LoggerFactory.getLogger(BinanceTradeSource.class);
    private static final String NAME = "binance";
    private static final String USD = "USD";

    private final TickerStreamProperties.Binance properties;
    private final ObjectMapper objectMapper;
    private final ReactorNettyWebSocketClient webSocketClient;
    private final Scheduler messageScheduler;

    public BinanceTradeSource(TickerStreamProperties.Binance properties, ObjectMapper objectMapper) {
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.webSocketClient = buildClient();
        this.messageScheduler = Schedulers.newParallel("binance-trade-msg", 2);
    }

    @Override
    public Mono<SourceHandle> open(String symbol, Duration timeout) {
        return Mono.<SourceHandle>create(sink -> {
            BinanceHandle handle = new BinanceHandle(symbol, resolveStreamSymbol(symbol));
            handle.connection = connect(handle, () -> sink.success(handle))
                    .subscribe(null, ex -> {
                        log.warn("EVENT=BINANCE_STREAM_FAILED symbol={} opened={} reason={}", symbol, handle.opened, ex.getMessage());
                        sink.error(new SourceUnavailableException(symbol, "trade stream for " + symbol + " failed: " + ex.getMessage(), ex));
                    });
            sink.onCancel(handle::dispose);
        }).timeout(timeout, Mono.error(() -> new SourceUnavailableException(symbol,
                "no trade for " + symbol + " within " + timeout.toMillis() + "ms")));
    }

    @Override
    public Mono<Void> close(SourceHandle handle) {
        return Mono.fromRunnable(() -> {
            if (handle instanceof BinanceHandle binance) {
                binance.dispose();
                log.info("EVENT=BINANCE_STREAM_CLOSE symbol={} stream={}", handle.symbol(), binance.stream);
            }
        });
    }

    @Override
    public void onUpdate(SourceHandle handle, PriceCallback callback) {
        if (handle instanceof BinanceHandle binance) {
            binance.register(callback);
        }
    }

    @Override
    public String name() {
        return NAME;
    }

    @PreDestroy
    public void shutdown() {
        messageScheduler.dispose();
    }

    String resolveStreamSymbol(String symbol) {
        String compact = symbol.toUpperCase(Locale.ROOT).replaceAll("[^A-Z0-9]", "");
        String quoteAsset = properties.getQuoteAsset().toUpperCase(Locale.ROOT);
        if (compact.endsWith(USD) && !USD.equals(quoteAsset)) {
            compact = compact.substring(0, compact.length() - USD.length()) + quoteAsset;
        }
        return compact.toLowerCase(Locale.ROOT);
    }

    static TradeTick parseTrade(ObjectMapper objectMapper, String payload) {
        try {
            JsonNode node = objectMapper.readTree(payload);
            JsonNode dataNode = node.hasNonNull("data") ? node.get("data") : node;
            if (!"trade".equals(dataNode.path("e").asText())) {
                return null;
            }
            double price = Double.parseDouble(dataNode.path("p").asText("NaN"));
            if (!Double.isFinite(price) || price <= 0) {
                return null;
            }
            long tradeTime = dataNode.path("T").asLong(0L);
            long eventTime = dataNode.path("E").asLong(0L);
            long ts = tradeTime > 0 ? tradeTime : eventTime > 0 ? eventTime : System.currentTimeMillis();
            return new TradeTick(dataNode.path("s").asText(), price, ts);
        } catch (Exception ex) {
            log.debug("EVENT=BINANCE_PARSE_FAIL reason={}", ex.getMessage());
            return null;
        }
    }

    private ReactorNettyWebSocketClient buildClient() {
        HttpClient httpClient = HttpClient.create()
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, Math.toIntExact(properties.getConnectTimeout().toMillis()));
        return new ReactorNettyWebSocketClient(httpClient);
    }

    private Mono<Void> connect(BinanceHandle handle, Runnable onFirstTrade) {
        URI uri = URI.create(properties.getWsBaseUrl() + "/" + handle.stream + "@trade");
        return Mono.defer(() -> {
            log.info("EVENT=BINANCE_STREAM_CONNECT symbol={} uri={}", handle.symbol, uri);
            return webSocketClient.execute(uri, session -> session.receive()
                    .map(WebSocketMessage::getPayloadAsText)
                    .publishOn(messageScheduler)
                    .doOnNext(payload -> handle.onPayload(parseTrade(objectMapper, payload), onFirstTrade))
                    .then());
        })
                .then(Mono.<Void>error(() -> new IllegalStateException("trade stream for " + handle.symbol + " ended")))
                .retryWhen(Retry.backoff(Long.MAX_VALUE, properties.getReconnectBackoffMin())
                        .maxBackoff(properties.getReconnectBackoffMax())
                        .jitter(0.3)
                        .filter(ex -> handle.opened && !handle.disposed)
                        .doBeforeRetry(signal -> log.warn("EVENT=BINANCE_STREAM_RECONNECT symbol={} attempt={} reason={}",
                                handle.symbol,
                                signal.totalRetries(),
                                signal.failure().getMessage())));
    }

    record TradeTick(String symbol, double price, long timestampMs) {
    }

    private static final class BinanceHandle implements SourceHandle {

        private final String symbol;
        private final String stream;
        private volatile Disposable connection;
        private volatile boolean opened;
        private volatile boolean disposed;
        private PriceCallback callback;
        private TradeTick heldTick;

        private BinanceHandle(String symbol, String stream) {
            this.symbol = symbol;
            this.stream = stream;
        }

        private void onPayload(TradeTick tick, Runnable onFirstTrade) {
            if (tick == null || disposed) {
                return;
            }
            PriceCallback target;
            synchronized (this) {
                target = callback;
                if (target == null) {
                    heldTick = tick;
                }
            }
            if (!opened) {
                opened = true;
                onFirstTrade.run();
            }
            if (target != null) {
                target.onPrice(tick.price(), tick.timestampMs());
            }
        }

        private void register(PriceCallback priceCallback) {
            TradeTick held;
            synchronized (this) {
                callback = priceCallback;
                held = heldTick;
                heldTick = null;
            }
            if (held != null) {
                priceCallback.onPrice(held.price(), held.timestampMs());
            }
        }

        private void dispose() {
            disposed = true;
            Disposable current = connection;
            if (current != null) {
                current.dispose();
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
