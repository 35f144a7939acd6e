package com.tickerstream.config;

import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;
import org.springframework.boot.context.event.ApplicationReadyEvent;

import com.tickerstream.session.SubscriptionResult;
import com.tickerstream.session.TickerService;

import reactor.core.publisher.Mono;

class TickerStreamStarterTest {

	@Test
	void pinsPreloadSymbolsWhenReady() {
		TickerStreamProperties properties = new TickerStreamProperties();
		properties.setPreloadSymbols(List.of("BTCUSD", "ETHUSD"));
		TickerService tickerService = mock(TickerService.class);
		when(tickerService.subscribe(anyList()))
				.thenReturn(Mono.just(SubscriptionResult.of(List.of("BTCUSD", "ETHUSD"), Map.of())));

		new TickerStreamStarter(properties, tickerService).onApplicationEvent(mock(ApplicationReadyEvent.class));

		verify(tickerService).subscribe(List.of("BTCUSD", "ETHUSD"));
	}

	@Test
	void nothingToPinWithoutPreloadSymbols() {
		TickerService tickerService = mock(TickerService.class);

		new TickerStreamStarter(new TickerStreamProperties(), tickerService).onApplicationEvent(mock(ApplicationReadyEvent.class));

		verifyNoInteractions(tickerService);
	}
}
