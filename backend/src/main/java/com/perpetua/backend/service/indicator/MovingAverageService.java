package com.perpetua.backend.service.indicator;

import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

@Service
public class MovingAverageService {

    /**
     * EMA seeded with the simple average of the first {@code period} values.
     * Returns {@code values.size() - period + 1} points, or none when there is not enough data.
     */
    public List<Double> ema(List<Double> values, int period) {
        List<Double> result = new ArrayList<>();
        if (values == null || period <= 0 || values.size() < period) {
            return result;
        }
        double k = 2.0 / (period + 1);
        double ema = values.subList(0, period).stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
        result.add(ema);
        for (int i = period; i < values.size(); i++) {
            ema = (values.get(i) - ema) * k + ema;
            result.add(ema);
        }
        return result;
    }

    public List<Double> sma(List<Double> values, int period) {
        List<Double> result = new ArrayList<>();
        if (values == null || period <= 0 || values.size() < period) {
            return result;
        }
        double sum = 0.0;
        for (int i = 0; i < values.size(); i++) {
            sum += values.get(i);
            if (i >= period) {
                sum -= values.get(i - period);
            }
            if (i >= period - 1) {
                result.add(sum / period);
            }
        }
        return result;
    }

    public double latest(List<Double> series, double fallback) {
        return series == null || series.isEmpty() ? fallback : series.get(series.size() - 1);
    }
}
