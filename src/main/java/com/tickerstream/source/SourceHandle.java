package com.tickerstream.source;

public interface SourceHandle {

    String symbol();

    String sourceName();
}
