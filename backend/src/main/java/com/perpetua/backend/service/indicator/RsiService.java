package com.perpetua.backend.service.indicator;

import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

@Service
public class RsiService {

    /**
     * Wilder RSI; one point per value after the first {@code period}.
     */
    public List<Double> calculate(List<Double> values, int period) {
        List<Double> result = new ArrayList<>();
        if (values == null || period <= 0 || values.size() <= period) {
            return result;
        }
        double gain = 0.0;
        double loss = 0.0;
        for (int i = 1; i <= period; i++) {
            double change = values.get(i) - values.get(i - 1);
            if (change > 0) {
                gain += change;
            } else {
                loss -= change;
            }
        }
        double avgGain = gain / period;
        double avgLoss = loss / period;
        result.add(toRsi(avgGain, avgLoss));
        for (int i = period + 1; i < values.size(); i++) {
            double change = values.get(i) - values.get(i - 1);
            double currentGain = change > 0 ? change : 0.0;
            double currentLoss = change < 0 ? -change : 0.0;
            avgGain = ((avgGain * (period - 1)) + currentGain) / period;
            avgLoss = ((avgLoss * (period - 1)) + currentLoss) / period;
            result.add(toRsi(avgGain, avgLoss));
        }
        return result;
    }

    /**
     * Latest RSI change minus the average change over the preceding {@code period - 1} bars.
     */
    public List<Double> momentumAcceleration(List<Double> rsi, int period) {
        List<Double> result = new ArrayList<>();
        if (rsi == null || period < 2 || rsi.size() < period + 1) {
            return result;
        }
        for (int i = period; i < rsi.size(); i++) {
            double currentChange = rsi.get(i) - rsi.get(i - 1);
            double previousChange = rsi.get(i - 1) - rsi.get(i - period);
            result.add(currentChange - previousChange / (period - 1));
        }
        return result;
    }

    private double toRsi(double avgGain, double avgLoss) {
        if (avgLoss == 0) {
            return avgGain == 0 ? 50.0 : 100.0;
        }
        double rs = avgGain / avgLoss;
        return 100.0 - (100.0 / (1.0 + rs));
    }
}
