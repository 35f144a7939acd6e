package com.tickerstream.session;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.tickerstream.bus.UpdateBus;
import com.tickerstream.registry.LiveSourceRegistry;
import com.tickerstream.registry.SourceState;
import com.tickerstream.source.FakePriceSource;

import reactor.core.Disposable;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Schedulers;

class StreamSessionTest {

	private FakePriceSource source;
	private UpdateBus bus;
	private LiveSourceRegistry registry;

	@BeforeEach
	void setUp() {
		source = new FakePriceSource();
		bus = new UpdateBus(Schedulers.immediate());
		registry = new LiveSourceRegistry(source, bus, Duration.ofSeconds(2), Duration.ofSeconds(2));
	}

	@AfterEach
	void tearDown() {
		registry.shutdown();
	}

	@Test
	void sessionsShareSourcesAndOnlySeeTheirOwnSymbols() {
		Connected a = connect("ws-1");
		Connected b = connect("ws-2");

		a.send(ClientAction.subscribe("btcusd"));
		a.send(ClientAction.subscribe("ETHUSD"));
		b.send(ClientAction.subscribe("ETHUSD"));

		assertThat(source.openCount("BTCUSD")).isEqualTo(1);
		assertThat(source.openCount("ETHUSD")).isEqualTo(1);
		assertThat(registry.refCount("ETHUSD")).isEqualTo(2);

		source.emit("BTCUSD", 65000.0, 1L);
		source.emit("ETHUSD", 3500.0, 2L);

		assertThat(a.received).containsExactly(
				new PriceMessage("BTCUSD", 65000.0, 1L, "fake"),
				new PriceMessage("ETHUSD", 3500.0, 2L, "fake"));
		assertThat(b.received).containsExactly(new PriceMessage("ETHUSD", 3500.0, 2L, "fake"));
		assertThat(a.session.symbols()).containsExactly("BTCUSD", "ETHUSD");
	}

	@Test
	void updatesArriveInEmissionOrderAndStopAfterUnsubscribe() {
		Connected a = connect("ws-1");
		Connected b = connect("ws-2");
		a.send(ClientAction.subscribe("BTCUSD"));
		a.send(ClientAction.subscribe("ETHUSD"));
		b.send(ClientAction.subscribe("BTCUSD"));

		source.emit("BTCUSD", 50000.0, 1L);
		source.emit("ETHUSD", 3000.0, 2L);
		source.emit("BTCUSD", 50010.0, 3L);
		a.send(ClientAction.unsubscribe("BTCUSD"));
		source.emit("BTCUSD", 50020.0, 4L);

		assertThat(a.received).containsExactly(
				new PriceMessage("BTCUSD", 50000.0, 1L, "fake"),
				new PriceMessage("ETHUSD", 3000.0, 2L, "fake"),
				new PriceMessage("BTCUSD", 50010.0, 3L, "fake"));
		assertThat(b.received).hasSize(3);
	}

	@Test
	void unsubscribeStopsDeliveryWhileOtherHoldersKeepTheSourceOpen() {
		Connected a = connect("ws-1");
		Connected b = connect("ws-2");
		a.send(ClientAction.subscribe("ETHUSD"));
		b.send(ClientAction.subscribe("ETHUSD"));

		a.send(ClientAction.unsubscribe("ethusd"));
		source.emit("ETHUSD", 3600.0, 3L);

		assertThat(a.received).isEmpty();
		assertThat(b.received).hasSize(1);
		assertThat(registry.refCount("ETHUSD")).isEqualTo(1);
		assertThat(source.closeCount("ETHUSD")).isZero();

		b.output.dispose();
		assertThat(source.closeCount("ETHUSD")).isEqualTo(1);
		assertThat(registry.activeSymbols()).isEmpty();
	}

	@Test
	void repeatedSubscribeHoldsASingleReference() {
		Connected a = connect("ws-1");
		a.send(ClientAction.subscribe("SOLUSD"));
		a.send(ClientAction.subscribe(" solusd "));

		assertThat(registry.refCount("SOLUSD")).isEqualTo(1);

		a.send(ClientAction.unsubscribe("SOLUSD"));
		a.send(ClientAction.unsubscribe("SOLUSD"));
		assertThat(registry.refCount("SOLUSD")).isZero();
		assertThat(source.closeCount("SOLUSD")).isEqualTo(1);
	}

	@Test
	void failedSubscribeIsReportedAndOtherSymbolsKeepWorking() {
		source.failOpensFor("DOGEUSD");
		Connected a = connect("ws-1");

		a.send(ClientAction.subscribe("DOGEUSD"));
		a.send(ClientAction.subscribe("BTCUSD"));
		source.emit("BTCUSD", 64000.0, 4L);

		assertThat(a.received).hasSize(2);
		assertThat(a.received.get(0)).isInstanceOf(SubscriptionFailed.class);
		assertThat(a.received.get(0).symbol()).isEqualTo("DOGEUSD");
		assertThat(a.received.get(1)).isEqualTo(new PriceMessage("BTCUSD", 64000.0, 4L, "fake"));
		assertThat(a.session.symbols()).containsExactly("BTCUSD");
		assertThat(registry.refCount("DOGEUSD")).isZero();
	}

	@Test
	void blankAndMalformedActionsAreSkipped() {
		Connected a = connect("ws-1");
		a.send(new ClientAction(null, "BTCUSD"));
		a.send(ClientAction.subscribe("   "));
		a.send(ClientAction.subscribe("ADAUSD"));

		assertThat(a.session.symbols()).containsExactly("ADAUSD");
		assertThat(a.session.isClosed()).isFalse();
	}

	@Test
	void cancellingTheOutputReleasesEverySymbol() {
		Connected a = connect("ws-1");
		a.send(ClientAction.subscribe("BTCUSD"));
		a.send(ClientAction.subscribe("ETHUSD"));

		a.output.dispose();

		assertThat(a.session.isClosed()).isTrue();
		assertThat(a.tornDown).isTrue();
		assertThat(registry.refCount("BTCUSD")).isZero();
		assertThat(registry.refCount("ETHUSD")).isZero();
		assertThat(source.closeCount("BTCUSD")).isEqualTo(1);
		assertThat(source.closeCount("ETHUSD")).isEqualTo(1);
	}

	@Test
	void actionStreamErrorTearsTheSessionDown() {
		Connected a = connect("ws-1");
		a.send(ClientAction.subscribe("BTCUSD"));

		a.actions.tryEmitError(new IllegalStateException("socket reset"));

		assertThat(a.session.isClosed()).isTrue();
		assertThat(a.completed).isTrue();
		assertThat(registry.refCount("BTCUSD")).isZero();
	}

	@Test
	void actionStreamCompletionKeepsPricesFlowing() {
		Connected a = connect("ws-1");
		a.send(ClientAction.subscribe("BTCUSD"));

		a.actions.tryEmitComplete();
		source.emit("BTCUSD", 65100.0, 5L);

		assertThat(a.session.isClosed()).isFalse();
		assertThat(a.received).hasSize(1);
	}

	@Test
	void acquireLandingAfterTeardownIsReleased() {
		source.holdOpens(true);
		Connected a = connect("ws-1");
		a.send(ClientAction.subscribe("ADAUSD"));
		assertThat(registry.state("ADAUSD")).isEqualTo(SourceState.OPENING);

		a.output.dispose();
		source.completeOpen("ADAUSD");

		assertThat(registry.refCount("ADAUSD")).isZero();
		assertThat(source.closeCount("ADAUSD")).isEqualTo(1);
		assertThat(registry.state("ADAUSD")).isEqualTo(SourceState.CLOSED);
	}

	@Test
	void teardownIsIdempotent() {
		Connected a = connect("ws-1");
		a.send(ClientAction.subscribe("BTCUSD"));

		a.session.teardown().block(Duration.ofSeconds(2));
		a.session.teardown().block(Duration.ofSeconds(2));

		assertThat(registry.refCount("BTCUSD")).isZero();
		assertThat(source.closeCount("BTCUSD")).isEqualTo(1);
	}

	private Connected connect(String id) {
		return new Connected(id);
	}

	private final class Connected {

		private final Sinks.Many<ClientAction> actions = Sinks.many().unicast().onBackpressureBuffer();
		private final List<StreamMessage> received = new CopyOnWriteArrayList<>();
		private final AtomicBoolean tornDown = new AtomicBoolean();
		private final AtomicBoolean completed = new AtomicBoolean();
		private final StreamSession session;
		private final Disposable output;

		private Connected(String id) {
			session = new StreamSession(id, registry, () -> tornDown.set(true));
			output = session.connect(actions.asFlux())
					.subscribe(received::add, ex -> completed.set(true), () -> completed.set(true));
		}

		private void send(ClientAction action) {
			actions.tryEmitNext(action);
		}
	}
}
