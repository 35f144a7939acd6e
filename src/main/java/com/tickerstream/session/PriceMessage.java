package com.tickerstream.session;

import com.fasterxml.jackson.annotation.JsonTypeName;
import com.tickerstream.bus.PriceUpdate;

@JsonTypeName("priceUpdate")
public record PriceMessage(
        String symbol,
        double price,
        long timestampMs,
        String source) implements StreamMessage {

    public static PriceMessage of(PriceUpdate update) {
        return new PriceMessage(update.symbol(), update.price(), update.timestampMs(), update.source());
    }
}
