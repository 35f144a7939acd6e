package com.tickerstream.api;

import java.util.Map;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.HandlerMapping;
import org.springframework.web.reactive.handler.SimpleUrlHandlerMapping;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tickerstream.session.SessionManager;

@Configuration
public class WebSocketConfig {

    @Bean
    public TickerWebSocketHandler tickerWebSocketHandler(SessionManager sessionManager, ObjectMapper objectMapper) {
        return new TickerWebSocketHandler(sessionManager, objectMapper);
    }

    @Bean
    public HandlerMapping tickerWebSocketMapping(TickerWebSocketHandler handler) {
        return new SimpleUrlHandlerMapping(Map.of("/ws/tickers", handler), -1);
    }
}
