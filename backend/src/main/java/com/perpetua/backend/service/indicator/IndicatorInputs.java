package com.perpetua.backend.service.indicator;

import java.util.List;

final class IndicatorInputs {

    private IndicatorInputs() {
    }

    @SafeVarargs
    static boolean sameLength(List<Double>... series) {
        if (series.length == 0 || series[0] == null) {
            return false;
        }
        int size = series[0].size();
        for (List<Double> values : series) {
            if (values == null || values.size() != size) {
                return false;
            }
        }
        return true;
    }

    static List<Double> tail(List<Double> values, int count) {
        return values.subList(Math.max(0, values.size() - count), values.size());
    }
}
