package com.perpetua.backend.util;

import com.perpetua.backend.model.Candle;
import com.perpetua.backend.model.Instrument;
import com.perpetua.backend.model.PriceSeries;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

public final class TestCandleFactory {

    private static final Instant START = Instant.parse("2025-01-01T00:00:00Z");

    private TestCandleFactory() {}

    public static List<Candle> trendingCandles(int count, double start, double step) {
        List<Candle> candles = new ArrayList<>();
        double price = start;
        for (int i = 0; i < count; i++) {
            double open = price;
            double close = price + step;
            double high = Math.max(open, close) + Math.abs(step) * 0.3;
            double low = Math.min(open, close) - Math.abs(step) * 0.2;
            candles.add(candle(i, open, high, low, close, 1000 + i * 10));
            price = close;
        }
        return candles;
    }

    public static List<Candle> flatCandles(int count, double price) {
        List<Candle> candles = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            candles.add(candle(i, price, price + 1, price - 1, price, 1000));
        }
        return candles;
    }

    public static PriceSeries series(Instrument instrument, String timeframe, List<Candle> candles) {
        return new PriceSeries(instrument, timeframe, candles);
    }

    public static List<Double> closes(List<Candle> candles) {
        return candles.stream().map(Candle::getClose).toList();
    }

    private static Candle candle(int index, double open, double high, double low, double close, double volume) {
        return Candle.builder()
                .timestamp(START.plus(Duration.ofHours(4L * index)))
                .open(open)
                .high(high)
                .low(low)
                .close(close)
                .volume(volume)
                .build();
    }
}
