package com.tickerstream.registry;

public enum SourceState {
    CLOSED,
    OPENING,
    OPEN,
    CLOSING
}
