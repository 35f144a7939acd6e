package com.tickerstream.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tickerstream.bus.UpdateBus;
import com.tickerstream.registry.LiveSourceRegistry;
import com.tickerstream.session.SessionManager;
import com.tickerstream.session.TickerService;
import com.tickerstream.source.PriceSource;
import com.tickerstream.source.binance.BinanceTradeSource;
import com.tickerstream.source.simulated.SimulatedPriceSource;

@Configuration
@EnableConfigurationProperties(TickerStreamProperties.class)
public class TickerStreamConfiguration {

    @Bean
    public UpdateBus updateBus() {
        return new UpdateBus();
    }

    @Bean
    @ConditionalOnProperty(prefix = "ticker-stream", name = "source", havingValue = "binance", matchIfMissing = true)
    public PriceSource binanceTradeSource(TickerStreamProperties properties, ObjectMapper objectMapper) {
        return new BinanceTradeSource(properties.getBinance(), objectMapper);
    }

    @Bean
    @ConditionalOnProperty(prefix = "ticker-stream", name = "source", havingValue = "simulated")
    public PriceSource simulatedPriceSource(TickerStreamProperties properties) {
        return new SimulatedPriceSource(properties.getSimulated());
    }

    @Bean
    public LiveSourceRegistry liveSourceRegistry(PriceSource priceSource, UpdateBus updateBus, TickerStreamProperties properties) {
        return new LiveSourceRegistry(priceSource, updateBus, properties.getOpenTimeout(), properties.getCloseTimeout());
    }

    @Bean
    public SessionManager sessionManager(LiveSourceRegistry registry, TickerStreamProperties properties) {
        return new SessionManager(registry, properties.getPollInterval());
    }

    @Bean
    public TickerService tickerService(LiveSourceRegistry registry) {
        return new TickerService(registry);
    }

    @Bean
    public TickerStreamStarter tickerStreamStarter(TickerStreamProperties properties, TickerService tickerService) {
        return new TickerStreamStarter(properties, tickerService);
    }
}
