package com.tickerstream.config;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

@Validated
@ConfigurationProperties(prefix = "ticker-stream")
public class TickerStreamProperties {

    private static final Duration MIN_POLL_INTERVAL = Duration.ofMillis(10);
    private static final Duration MAX_POLL_INTERVAL = Duration.ofMillis(200);

    @NotBlank
    private String source = "binance";
    @NotNull
    private Duration openTimeout = Duration.ofSeconds(45);
    @NotNull
    private Duration closeTimeout = Duration.ofSeconds(10);
    @NotNull
    private Duration pollInterval = Duration.ofMillis(100);
    private List<String> preloadSymbols = new ArrayList<>();
    @Valid
    private Binance binance = new Binance();
    @Valid
    private Simulated simulated = new Simulated();

    public String getSource() {
        return source;
    }

    public void setSource(String source) {
        this.source = source;
    }

    public Duration getOpenTimeout() {
        return openTimeout;
    }

    public void setOpenTimeout(Duration openTimeout) {
        this.openTimeout = openTimeout;
    }

    public Duration getCloseTimeout() {
        return closeTimeout;
    }

    public void setCloseTimeout(Duration closeTimeout) {
        this.closeTimeout = closeTimeout;
    }

    public Duration getPollInterval() {
        return pollInterval;
    }

    public void setPollInterval(Duration pollInterval) {
        this.pollInterval = pollInterval;
    }

    public List<String> getPreloadSymbols() {
        return preloadSymbols;
    }

    public void setPreloadSymbols(List<String> preloadSymbols) {
        this.preloadSymbols = preloadSymbols;
    }

    public Binance getBinance() {
        return binance;
    }

    public void setBinance(Binance binance) {
        this.binance = binance;
    }

    public Simulated getSimulated() {
        return simulated;
    }

    public void setSimulated(Simulated simulated) {
        this.simulated = simulated;
    }

    @AssertTrue(message = "poll-interval must be between 10ms and 200ms")
    public boolean isPollIntervalInRange() {
        return pollInterval == null
                || (pollInterval.compareTo(MIN_POLL_INTERVAL) >= 0 && pollInterval.compareTo(MAX_POLL_INTERVAL) <= 0);
    }

    public static class Binance {

        @NotBlank
        private String wsBaseUrl = "wss://stream.binance.com:9443/ws";
        @NotBlank
        private String quoteAsset = "USDT";
        @NotNull
        private Duration connectTimeout = Duration.ofSeconds(10);
        @NotNull
        private Duration reconnectBackoffMin = Duration.ofSeconds(1);
        @NotNull
        private Duration reconnectBackoffMax = Duration.ofSeconds(30);

        public String getWsBaseUrl() {
            return wsBaseUrl;
        }

        public void setWsBaseUrl(String wsBaseUrl) {
            this.wsBaseUrl = wsBaseUrl;
        }

        public String getQuoteAsset() {
            return quoteAsset;
        }

        public void setQuoteAsset(String quoteAsset) {
            this.quoteAsset = quoteAsset;
        }

        public Duration getConnectTimeout() {
            return connectTimeout;
        }

        public void setConnectTimeout(Duration connectTimeout) {
            this.connectTimeout = connectTimeout;
        }

        public Duration getReconnectBackoffMin() {
            return reconnectBackoffMin;
        }

        public void setReconnectBackoffMin(Duration reconnectBackoffMin) {
            this.reconnectBackoffMin = reconnectBackoffMin;
        }

        public Duration getReconnectBackoffMax() {
            return reconnectBackoffMax;
        }

        public void setReconnectBackoffMax(Duration reconnectBackoffMax) {
            this.reconnectBackoffMax = reconnectBackoffMax;
        }
    }

    public static class Simulated {

        @NotNull
        private Duration tickInterval = Duration.ofMillis(500);
        @Positive
        private double startPrice = 100.0;
        @Positive
        private double volatility = 0.001;

        public Duration getTickInterval() {
            return tickInterval;
        }

        public void setTickInterval(Duration tickInterval) {
            this.tickInterval = tickInterval;
        }

        public double getStartPrice() {
            return startPrice;
        }

        public void setStartPrice(double startPrice) {
            this.startPrice = startPrice;
        }

        public double getVolatility() {
            return volatility;
        }

        public void setVolatility(double volatility) {
            this.volatility = volatility;
        }
    }
}
