package com.tickerstream.registry;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class SymbolsTest {

	@Test
	void normalizeTrimsAndUpperCases() {
		assertThat(Symbols.normalize("  btcUsd ")).isEqualTo("BTCUSD");
		assertThat(Symbols.normalize("ETHUSD")).isEqualTo("ETHUSD");
	}

	@Test
	void blankSymbolsAreRejected() {
		assertThat(Symbols.isBlank(null)).isTrue();
		assertThat(Symbols.isBlank(" \t")).isTrue();
		assertThat(Symbols.isBlank("ADAUSD")).isFalse();
		assertThatThrownBy(() -> Symbols.normalize(""))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("blank");
	}
}
