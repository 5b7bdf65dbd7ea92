package com.perpetua.backend.service.indicator;

import org.springframework.stereotype.Service;

import java.util.List;

@Service
public class VolatilityRegimeService {

    /**
     * Compares the latest ATR-as-percent-of-price with its average over the lookback.
     * ATR and price series are aligned on their last element.
     */
    public VolatilityRegime classify(List<Double> atr, List<Double> prices, int lookback) {
        if (atr == null || prices == null || lookback <= 0 || atr.size() < lookback || prices.size() < lookback) {
            return VolatilityRegime.NORMAL;
        }
        List<Double> recentAtr = IndicatorInputs.tail(atr, lookback);
        List<Double> recentPrices = IndicatorInputs.tail(prices, lookback);
        double[] atrPct = new double[lookback];
        double total = 0.0;
        for (int i = 0; i < lookback; i++) {
            double price = recentPrices.get(i);
            atrPct[i] = price == 0 ? 0.0 : recentAtr.get(i) / price * 100.0;
            total += atrPct[i];
        }
        double current = atrPct[lookback - 1];
        double average = total / lookback;
        if (current < average * 0.5) return VolatilityRegime.LOW;
        if (current < average * 1.2) return VolatilityRegime.NORMAL;
        if (current < average * 2.0) return VolatilityRegime.HIGH;
        return VolatilityRegime.EXTREME;
    }

    public enum VolatilityRegime { LOW, NORMAL, HIGH, EXTREME }
}
