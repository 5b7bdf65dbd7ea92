package com.perpetua.backend.service.indicator;

import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

@Service
public class AdxService {

    public static final double STRONG_TREND = 25.0;
    public static final double RANGE_BOUND = 20.0;

    /**
     * Wilder-smoothed directional movement. The first ADX value needs {@code 2 * period} bars.
     */
    public List<AdxPoint> calculate(List<Double> high, List<Double> low, List<Double> close, int period) {
        List<AdxPoint> result = new ArrayList<>();
        if (!IndicatorInputs.sameLength(high, low, close) || period <= 0 || close.size() < 2 * period) {
            return result;
        }
        List<Double> tr = AtrService.trueRanges(high, low, close);
        List<Double> dmPlus = new ArrayList<>(tr.size());
        List<Double> dmMinus = new ArrayList<>(tr.size());
        for (int i = 1; i < close.size(); i++) {
            double highDiff = high.get(i) - high.get(i - 1);
            double lowDiff = low.get(i - 1) - low.get(i);
            dmPlus.add((highDiff > lowDiff && highDiff > 0) ? highDiff : 0.0);
            dmMinus.add((lowDiff > highDiff && lowDiff > 0) ? lowDiff : 0.0);
        }

        double smoothTR = sum(tr, period);
        double smoothPlus = sum(dmPlus, period);
        double smoothMinus = sum(dmMinus, period);

        List<double[]> directional = new ArrayList<>();
        for (int i = period - 1; i < tr.size(); i++) {
            if (i > period - 1) {
                smoothTR = smoothTR - (smoothTR / period) + tr.get(i);
                smoothPlus = smoothPlus - (smoothPlus / period) + dmPlus.get(i);
                smoothMinus = smoothMinus - (smoothMinus / period) + dmMinus.get(i);
            }
            double plusDI = smoothTR == 0 ? 0.0 : 100.0 * (smoothPlus / smoothTR);
            double minusDI = smoothTR == 0 ? 0.0 : 100.0 * (smoothMinus / smoothTR);
            double diSum = plusDI + minusDI;
            double dx = diSum == 0 ? 0.0 : (Math.abs(plusDI - minusDI) / diSum) * 100.0;
            directional.add(new double[]{plusDI, minusDI, dx});
        }
        if (directional.size() < period) {
            return result;
        }

        double adx = 0.0;
        for (int i = 0; i < period; i++) {
            adx += directional.get(i)[2];
        }
        adx /= period;
        double[] first = directional.get(period - 1);
        result.add(new AdxPoint(adx, first[0], first[1]));
        for (int i = period; i < directional.size(); i++) {
            double[] point = directional.get(i);
            adx = ((adx * (period - 1)) + point[2]) / period;
            result.add(new AdxPoint(adx, point[0], point[1]));
        }
        return result;
    }

    private double sum(List<Double> values, int count) {
        return values.subList(0, count).stream().mapToDouble(Double::doubleValue).sum();
    }

    public record AdxPoint(double adx, double plusDI, double minusDI) {

        public boolean isStrongTrend() {
            return adx > STRONG_TREND;
        }

        public boolean isRangeBound() {
            return adx < RANGE_BOUND;
        }
    }
}
