package com.perpetua.backend.model;

import com.perpetua.backend.exception.UnknownInstrumentException;

import java.util.Locale;

/**
 * USDT-margined perpetual contracts the agent is allowed to trade.
 * Parse external symbols once with {@link #fromPair(String)} or {@link #fromSymbol(String)}.
 */
public enum Instrument {
    BTC,
    ETH,
    BNB,
    SOL,
    DOGE;

    public static final String QUOTE = "USDT";

    /** Unified pair notation, e.g. {@code BTC/USDT}. */
    public String pair() {
        return name() + "/" + QUOTE;
    }

    /** Exchange market id, e.g. {@code BTCUSDT}. */
    public String marketId() {
        return name() + QUOTE;
    }

    public static Instrument fromSymbol(String symbol) {
        if (symbol == null || symbol.isBlank()) {
            throw new UnknownInstrumentException("Symbol is required");
        }
        try {
            return Instrument.valueOf(symbol.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new UnknownInstrumentException("Unsupported symbol: " + symbol);
        }
    }

    /** Accepts {@code BTC/USDT}, {@code BTCUSDT} or {@code BTC}. */
    public static Instrument fromPair(String pair) {
        if (pair == null || pair.isBlank()) {
            throw new UnknownInstrumentException("Pair is required");
        }
        String normalized = pair.trim().toUpperCase(Locale.ROOT);
        if (normalized.contains("/")) {
            String[] parts = normalized.split("/");
            if (parts.length != 2 || !QUOTE.equals(parts[1])) {
                throw new UnknownInstrumentException("Unsupported pair: " + pair);
            }
            return fromSymbol(parts[0]);
        }
        if (normalized.endsWith(QUOTE) && normalized.length() > QUOTE.length()) {
            return fromSymbol(normalized.substring(0, normalized.length() - QUOTE.length()));
        }
        return fromSymbol(normalized);
    }
}
