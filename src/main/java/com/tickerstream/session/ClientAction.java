package com.tickerstream.session;

public record ClientAction(
        Action action,
        String ticker) {

    public enum Action {
        SUBSCRIBE,
        UNSUBSCRIBE
    }

    public static ClientAction subscribe(String ticker) {
        return new ClientAction(Action.SUBSCRIBE, ticker);
    }

    public static ClientAction unsubscribe(String ticker) {
        return new ClientAction(Action.UNSUBSCRIBE, ticker);
    }
}
