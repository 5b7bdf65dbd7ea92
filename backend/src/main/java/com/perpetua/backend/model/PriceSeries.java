package com.perpetua.backend.model;

import java.util.List;

/**
 * Candles for one instrument and timeframe, oldest first.
 */
public record PriceSeries(Instrument instrument, String timeframe, List<Candle> candles) {

    public PriceSeries {
        candles = candles == null ? List.of() : List.copyOf(candles);
    }

    public int size() {
        return candles.size();
    }

    public boolean isEmpty() {
        return candles.isEmpty();
    }

    public Candle last() {
        return candles.isEmpty() ? null : candles.get(candles.size() - 1);
    }

    /** Bar at {@code size() - 1 - offset}; offset 1 is the last completed bar before the current one. */
    public Candle fromEnd(int offset) {
        int index = candles.size() - 1 - offset;
        return index < 0 ? null : candles.get(index);
    }

    public List<Double> opens() {
        return candles.stream().map(Candle::getOpen).toList();
    }

    public List<Double> highs() {
        return candles.stream().map(Candle::getHigh).toList();
    }

    public List<Double> lows() {
        return candles.stream().map(Candle::getLow).toList();
    }

    public List<Double> closes() {
        return candles.stream().map(Candle::getClose).toList();
    }

    public List<Double> volumes() {
        return candles.stream().map(Candle::getVolume).toList();
    }
}
