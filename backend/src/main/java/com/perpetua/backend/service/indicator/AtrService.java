package com.perpetua.backend.service.indicator;

import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

@Service
public class AtrService {

    /**
     * Wilder ATR over true ranges. Returns {@code n - period} points.
     */
    public List<Double> calculate(List<Double> high, List<Double> low, List<Double> close, int period) {
        List<Double> result = new ArrayList<>();
        if (!IndicatorInputs.sameLength(high, low, close) || period <= 0 || close.size() < period + 1) {
            return result;
        }
        List<Double> tr = trueRanges(high, low, close);
        double atr = tr.subList(0, period).stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
        result.add(atr);
        for (int i = period; i < tr.size(); i++) {
            atr = ((atr * (period - 1)) + tr.get(i)) / period;
            result.add(atr);
        }
        return result;
    }

    static List<Double> trueRanges(List<Double> high, List<Double> low, List<Double> close) {
        List<Double> tr = new ArrayList<>(close.size() - 1);
        for (int i = 1; i < close.size(); i++) {
            double prevClose = close.get(i - 1);
            tr.add(Math.max(high.get(i) - low.get(i),
                    Math.max(Math.abs(high.get(i) - prevClose), Math.abs(low.get(i) - prevClose))));
        }
        return tr;
    }
}
