package com.perpetua.backend.service.indicator;

import com.perpetua.backend.model.Candle;
import org.springframework.stereotype.Service;

@Service
public class PivotPointService {

    /**
     * Classic floor pivots from one completed bar.
     */
    public PivotPoints calculate(double high, double low, double close) {
        double pivot = (high + low + close) / 3.0;
        double range = high - low;
        return new PivotPoints(
                pivot,
                2 * pivot - low,
                pivot + range,
                2 * pivot - high,
                pivot - range
        );
    }

    public PivotPoints calculate(Candle bar) {
        return calculate(bar.getHigh(), bar.getLow(), bar.getClose());
    }

    public record PivotPoints(double pivot, double r1, double r2, double s1, double s2) {}
}
