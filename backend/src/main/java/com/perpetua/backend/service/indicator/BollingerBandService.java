package com.perpetua.backend.service.indicator;

import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

@Service
public class BollingerBandService {

    public static final double SQUEEZE_RATIO = 0.7;

    /**
     * Population standard deviation bands, one point per full window.
     */
    public List<BollingerBands> calculate(List<Double> values, int period, double deviation) {
        List<BollingerBands> result = new ArrayList<>();
        if (values == null || period <= 0 || values.size() < period) {
            return result;
        }
        for (int end = period; end <= values.size(); end++) {
            List<Double> window = values.subList(end - period, end);
            double middle = window.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
            double variance = window.stream().mapToDouble(v -> Math.pow(v - middle, 2)).sum() / period;
            double offset = Math.sqrt(variance) * deviation;
            double upper = middle + offset;
            double lower = middle - offset;
            double price = values.get(end - 1);
            double bandwidth = middle > 0 ? (upper - lower) / middle : 0.0;
            double range = upper - lower;
            double percentB = range > 0 ? (price - lower) / range : 0.5;
            result.add(new BollingerBands(upper, middle, lower, bandwidth, percentB));
        }
        return result;
    }

    /**
     * Squeeze when the latest bandwidth sits below 70% of the window average.
     */
    public Squeeze squeeze(List<BollingerBands> bands, int lookback) {
        if (bands == null || lookback <= 0 || bands.size() < lookback) {
            return new Squeeze(false, 50.0);
        }
        List<Double> bandwidths = bands.subList(bands.size() - lookback, bands.size()).stream()
                .map(BollingerBands::bandwidth)
                .toList();
        double current = bandwidths.get(bandwidths.size() - 1);
        double average = bandwidths.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
        List<Double> sorted = bandwidths.stream().sorted().toList();
        int rank = 0;
        while (rank < sorted.size() && sorted.get(rank) < current) {
            rank++;
        }
        double percentile = (double) rank / sorted.size() * 100.0;
        return new Squeeze(current < average * SQUEEZE_RATIO, percentile);
    }

    public record BollingerBands(double upper, double middle, double lower, double bandwidth, double percentB) {}

    public record Squeeze(boolean squeeze, double percentile) {}
}
