package com.perpetua.backend.service.indicator;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

@Service
@RequiredArgsConstructor
public class MacdService {

    public static final int DEFAULT_FAST = 12;
    public static final int DEFAULT_SLOW = 26;
    public static final int DEFAULT_SIGNAL = 9;

    private final MovingAverageService movingAverageService;

    public MacdResult calculate(List<Double> values) {
        return calculate(values, DEFAULT_FAST, DEFAULT_SLOW, DEFAULT_SIGNAL);
    }

    /**
     * MACD line is aligned on the slow EMA; signal and histogram are aligned on the signal EMA.
     */
    public MacdResult calculate(List<Double> values, int fast, int slow, int signal) {
        if (values == null || fast >= slow || values.size() < slow) {
            return new MacdResult(List.of(), List.of(), List.of());
        }
        List<Double> fastEma = movingAverageService.ema(values, fast);
        List<Double> slowEma = movingAverageService.ema(values, slow);
        int offset = slow - fast;
        List<Double> macdLine = new ArrayList<>(slowEma.size());
        for (int i = 0; i < slowEma.size(); i++) {
            macdLine.add(fastEma.get(i + offset) - slowEma.get(i));
        }
        List<Double> signalLine = movingAverageService.ema(macdLine, signal);
        int signalOffset = macdLine.size() - signalLine.size();
        List<Double> histogram = new ArrayList<>(signalLine.size());
        for (int i = 0; i < signalLine.size(); i++) {
            histogram.add(macdLine.get(i + signalOffset) - signalLine.get(i));
        }
        return new MacdResult(macdLine, signalLine, histogram);
    }

    public record MacdResult(List<Double> macd, List<Double> signal, List<Double> histogram) {

        public double latestMacd() {
            return macd.isEmpty() ? 0.0 : macd.get(macd.size() - 1);
        }

        public double latestSignal() {
            return signal.isEmpty() ? 0.0 : signal.get(signal.size() - 1);
        }

        public double latestHistogram() {
            return histogram.isEmpty() ? 0.0 : histogram.get(histogram.size() - 1);
        }

        public Direction histogramTrend() {
            if (histogram.size() < 2) {
                return Direction.NEUTRAL;
            }
            double current = histogram.get(histogram.size() - 1);
            double previous = histogram.get(histogram.size() - 2);
            if (current > previous) return Direction.RISING;
            if (current < previous) return Direction.FALLING;
            return Direction.NEUTRAL;
        }
    }
}
