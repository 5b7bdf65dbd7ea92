package com.perpetua.backend.service.indicator;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

@Service
@RequiredArgsConstructor
public class StochRsiService {

    private final RsiService rsiService;
    private final MovingAverageService movingAverageService;

    public List<StochRsiPoint> calculate(List<Double> values) {
        return calculate(values, 14, 14, 3, 3);
    }

    /**
     * Points are aligned on %D. A flat RSI window yields a raw stochastic of 0.
     */
    public List<StochRsiPoint> calculate(List<Double> values, int rsiPeriod, int stochPeriod, int kPeriod, int dPeriod) {
        List<Double> rsi = rsiService.calculate(values, rsiPeriod);
        List<StochRsiPoint> result = new ArrayList<>();
        if (rsi.size() < stochPeriod) {
            return result;
        }
        List<Double> raw = new ArrayList<>();
        for (int i = stochPeriod - 1; i < rsi.size(); i++) {
            List<Double> window = rsi.subList(i - stochPeriod + 1, i + 1);
            double min = window.stream().mapToDouble(Double::doubleValue).min().orElse(0.0);
            double max = window.stream().mapToDouble(Double::doubleValue).max().orElse(0.0);
            double range = max - min;
            raw.add(range == 0 ? 0.0 : (rsi.get(i) - min) / range * 100.0);
        }
        List<Double> k = movingAverageService.sma(raw, kPeriod);
        List<Double> d = movingAverageService.sma(k, dPeriod);
        int rawOffset = raw.size() - d.size();
        int kOffset = k.size() - d.size();
        for (int i = 0; i < d.size(); i++) {
            result.add(new StochRsiPoint(raw.get(i + rawOffset), k.get(i + kOffset), d.get(i)));
        }
        return result;
    }

    public record StochRsiPoint(double stochRsi, double k, double d) {}
}
