package com.tickerstream.config;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;

import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import jakarta.validation.Validation;
import jakarta.validation.Validator;
import jakarta.validation.ValidatorFactory;

class TickerStreamPropertiesTest {

	private static ValidatorFactory factory;
	private static Validator validator;

	@BeforeAll
	static void setUpValidator() {
		factory = Validation.buildDefaultValidatorFactory();
		validator = factory.getValidator();
	}

	@AfterAll
	static void closeValidator() {
		factory.close();
	}

	@Test
	void defaultsAreValid() {
		TickerStreamProperties properties = new TickerStreamProperties();

		assertThat(validator.validate(properties)).isEmpty();
		assertThat(properties.getPollInterval()).isEqualTo(Duration.ofMillis(100));
		assertThat(properties.getOpenTimeout()).isEqualTo(Duration.ofSeconds(45));
		assertThat(properties.getBinance().getQuoteAsset()).isEqualTo("USDT");
	}

	@Test
	void pollIntervalAboveTwoHundredMillisIsRejected() {
		TickerStreamProperties properties = new TickerStreamProperties();
		properties.setPollInterval(Duration.ofMillis(250));

		assertThat(validator.validate(properties))
				.extracting(violation -> violation.getMessage())
				.containsExactly("poll-interval must be between 10ms and 200ms");
	}

	@Test
	void nestedSettingsAreValidated() {
		TickerStreamProperties properties = new TickerStreamProperties();
		properties.getBinance().setWsBaseUrl(" ");
		properties.getSimulated().setVolatility(0);

		assertThat(validator.validate(properties)).hasSize(2);
	}
}
