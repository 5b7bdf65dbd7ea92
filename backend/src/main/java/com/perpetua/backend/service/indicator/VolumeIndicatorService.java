package com.perpetua.backend.service.indicator;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

@Service
@RequiredArgsConstructor
public class VolumeIndicatorService {

    public static final double OBV_TREND_DEADBAND = 0.01;

    private final MovingAverageService movingAverageService;

    /**
     * Cumulative VWAP from the first bar, no session reset.
     */
    public List<Double> vwap(List<Double> high, List<Double> low, List<Double> close, List<Double> volume) {
        List<Double> result = new ArrayList<>();
        if (!IndicatorInputs.sameLength(high, low, close, volume)) {
            return result;
        }
        double cumulativeTpv = 0.0;
        double cumulativeVolume = 0.0;
        for (int i = 0; i < close.size(); i++) {
            double typicalPrice = (high.get(i) + low.get(i) + close.get(i)) / 3.0;
            cumulativeTpv += typicalPrice * volume.get(i);
            cumulativeVolume += volume.get(i);
            result.add(cumulativeVolume > 0 ? cumulativeTpv / cumulativeVolume : typicalPrice);
        }
        return result;
    }

    public List<Double> obv(List<Double> close, List<Double> volume) {
        List<Double> result = new ArrayList<>();
        if (!IndicatorInputs.sameLength(close, volume) || close.size() < 2) {
            return result;
        }
        double running = 0.0;
        result.add(running);
        for (int i = 1; i < close.size(); i++) {
            if (close.get(i) > close.get(i - 1)) {
                running += volume.get(i);
            } else if (close.get(i) < close.get(i - 1)) {
                running -= volume.get(i);
            }
            result.add(running);
        }
        return result;
    }

    /**
     * Direction of the last step of an EMA over OBV, ignoring moves inside a 1% band.
     */
    public Direction obvTrend(List<Double> obv, int period) {
        if (obv == null || obv.size() < period + 1) {
            return Direction.NEUTRAL;
        }
        List<Double> smoothed = movingAverageService.ema(obv, period);
        if (smoothed.size() < 2) {
            return Direction.NEUTRAL;
        }
        double current = smoothed.get(smoothed.size() - 1);
        double previous = smoothed.get(smoothed.size() - 2);
        double base = previous == 0 ? 1.0 : Math.abs(previous);
        double change = (current - previous) / base;
        if (change > OBV_TREND_DEADBAND) return Direction.RISING;
        if (change < -OBV_TREND_DEADBAND) return Direction.FALLING;
        return Direction.NEUTRAL;
    }
}
