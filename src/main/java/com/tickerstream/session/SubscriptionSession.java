package com.tickerstream.session;

import java.util.Set;

import reactor.core.publisher.Mono;

public interface SubscriptionSession {

    String id();

    Set<String> symbols();

    boolean isClosed();

    Mono<Void> teardown();
}
