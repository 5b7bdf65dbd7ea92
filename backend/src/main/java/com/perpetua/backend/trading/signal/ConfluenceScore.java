package com.perpetua.backend.trading.signal;

import java.util.List;

public record ConfluenceScore(double bullishPoints, double bearishPoints, List<String> factors, Recommendation recommendation) {

    public ConfluenceScore {
        factors = factors == null ? List.of() : List.copyOf(factors);
    }

    public double netScore() {
        return bullishPoints - bearishPoints;
    }
}
