package com.tickerstream.source;

public class SourceUnavailableException extends RuntimeException {

    private final String symbol;

    public SourceUnavailableException(String symbol, String message) {
        super(message);
        this.symbol = symbol;
    }

    public SourceUnavailableException(String symbol, String message, Throwable cause) {
        super(message, cause);
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }
}
