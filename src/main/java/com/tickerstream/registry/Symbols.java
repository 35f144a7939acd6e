package com.tickerstream.registry;

import java.util.Locale;

public final class Symbols {

    private Symbols() {
    }

    public static String normalize(String raw) {
        if (isBlank(raw)) {
            throw new IllegalArgumentException("symbol must not be blank");
        }
        return raw.trim().toUpperCase(Locale.ROOT);
    }

    public static boolean isBlank(String raw) {
        return raw == null || raw.isBlank();
    }
}
