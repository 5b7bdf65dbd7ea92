package com.perpetua.backend.service.indicator;

import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Compares the two halves of the lookback window for price/RSI disagreement.
 */
@Service
public class RsiDivergenceService {

    private static final double HIDDEN_RSI_SCALE = 20.0;

    public Divergence detect(List<Double> prices, List<Double> rsi, int lookback) {
        if (prices == null || rsi == null || lookback < 2 || prices.size() < lookback || rsi.size() < lookback) {
            return Divergence.none();
        }
        List<Double> recentPrices = IndicatorInputs.tail(prices, lookback);
        List<Double> recentRsi = IndicatorInputs.tail(rsi, lookback);
        int half = lookback / 2;

        double priceMin1 = min(recentPrices.subList(0, half));
        double priceMin2 = min(recentPrices.subList(half, lookback));
        double priceMax1 = max(recentPrices.subList(0, half));
        double priceMax2 = max(recentPrices.subList(half, lookback));
        double rsiMin1 = min(recentRsi.subList(0, half));
        double rsiMin2 = min(recentRsi.subList(half, lookback));
        double rsiMax1 = max(recentRsi.subList(0, half));
        double rsiMax2 = max(recentRsi.subList(half, lookback));

        if (priceMin2 < priceMin1 && rsiMin2 > rsiMin1) {
            double priceChange = (priceMin1 - priceMin2) / priceMin1;
            double rsiChange = (rsiMin2 - rsiMin1) / 100.0;
            return new Divergence(DivergenceType.BULLISH, Math.min(1.0, (priceChange + rsiChange) * 2));
        }
        if (priceMax2 > priceMax1 && rsiMax2 < rsiMax1) {
            double priceChange = (priceMax2 - priceMax1) / priceMax1;
            double rsiChange = (rsiMax1 - rsiMax2) / 100.0;
            return new Divergence(DivergenceType.BEARISH, Math.min(1.0, (priceChange + rsiChange) * 2));
        }
        if (priceMin2 > priceMin1 && rsiMin2 < rsiMin1) {
            return new Divergence(DivergenceType.HIDDEN_BULLISH, Math.min(1.0, Math.abs(rsiMin1 - rsiMin2) / HIDDEN_RSI_SCALE));
        }
        if (priceMax2 < priceMax1 && rsiMax2 > rsiMax1) {
            return new Divergence(DivergenceType.HIDDEN_BEARISH, Math.min(1.0, Math.abs(rsiMax2 - rsiMax1) / HIDDEN_RSI_SCALE));
        }
        return Divergence.none();
    }

    private double min(List<Double> values) {
        return values.stream().mapToDouble(Double::doubleValue).min().orElse(0.0);
    }

    private double max(List<Double> values) {
        return values.stream().mapToDouble(Double::doubleValue).max().orElse(0.0);
    }

    public enum DivergenceType { NONE, BULLISH, BEARISH, HIDDEN_BULLISH, HIDDEN_BEARISH }

    public record Divergence(DivergenceType type, double strength) {
        public static Divergence none() {
            return new Divergence(DivergenceType.NONE, 0.0);
        }
    }
}
