package com.tickerstream.api;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.reactive.socket.WebSocketHandler;
import org.springframework.web.reactive.socket.WebSocketMessage;
import org.springframework.web.reactive.socket.WebSocketSession;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tickerstream.session.ClientAction;
import com.tickerstream.session.SessionManager;
import com.tickerstream.session.StreamMessage;
import com.tickerstream.session.StreamSession;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

public class TickerWebSocketHandler implements WebSocketHandler {

    private static final Logger log = LoggerFactory.getLogger(TickerWebSocketHandler.class);

    private final SessionManager sessionManager;
    private final ObjectMapper objectMapper;

    public TickerWebSocketHandler(SessionManager sessionManager, ObjectMapper objectMapper) {
        this.sessionManager = sessionManager;
        this.objectMapper = objectMapper;
    }

    @Override
    public Mono<Void> handle(WebSocketSession webSocketSession) {
        StreamSession session = sessionManager.openStream();
        log.info("EVENT=WS_SESSION_CONNECTED session={} remote={}", session.id(), webSocketSession.getHandshakeInfo().getRemoteAddress());
        Flux<ClientAction> actions = webSocketSession.receive()
                .filter(message -> message.getType() == WebSocketMessage.Type.TEXT)
                .map(WebSocketMessage::getPayloadAsText)
                .concatMap(payload -> Mono.justOrEmpty(readAction(session.id(), payload)));
        Flux<WebSocketMessage> output = session.connect(actions)
                .concatMap(message -> Mono.justOrEmpty(writeMessage(session.id(), message)))
                .map(webSocketSession::textMessage);
        return webSocketSession.send(output)
                .doFinally(signal -> log.info("EVENT=WS_SESSION_CLOSED session={} signal={}", session.id(), signal));
    }

    ClientAction readAction(String sessionId, String payload) {
        try {
            return objectMapper.readValue(payload, ClientAction.class);
        } catch (JsonProcessingException ex) {
            log.warn("EVENT=WS_ACTION_PARSE_FAIL session={} reason={}", sessionId, ex.getOriginalMessage());
            return null;
        }
    }

    private String writeMessage(String sessionId, StreamMessage message) {
        try {
            return objectMapper.writeValueAsString(message);
        } catch (JsonProcessingException ex) {
            log.error("EVENT=WS_MESSAGE_WRITE_FAIL session={} symbol={} reason={}", sessionId, message.symbol(), ex.getMessage(), ex);
            return null;
        }
    }
}
