package com.flexledger.ledger;

import java.util.Locale;

public enum Direction {
    ACQUISITION,
    DISPOSAL;

    /** Maps the export's buy/sell column ({@code BUY}, {@code BOT}, {@code SELL}, {@code SLD}). */
    public static Direction fromBuySell(String value) {
        if (value == null) {
            return null;
        }
        return switch (value.trim().toUpperCase(Locale.ROOT)) {
            case "BUY", "BOT" -> ACQUISITION;
            case "SELL", "SLD" -> DISPOSAL;
            default -> null;
        };
    }
}
