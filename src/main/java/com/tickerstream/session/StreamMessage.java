package com.tickerstream.session;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = PriceMessage.class, name = "priceUpdate"),
        @JsonSubTypes.Type(value = SubscriptionFailed.class, name = "subscriptionFailed")
})
public interface StreamMessage {

    String symbol();
}
