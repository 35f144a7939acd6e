package com.tickerstream.session;

import com.fasterxml.jackson.annotation.JsonTypeName;

@JsonTypeName("subscriptionFailed")
public record SubscriptionFailed(
        String symbol,
        String reason) implements StreamMessage {
}
