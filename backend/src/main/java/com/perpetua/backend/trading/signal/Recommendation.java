package com.perpetua.backend.trading.signal;

public enum Recommendation {
    STRONG_BUY,
    BUY,
    NEUTRAL,
    SELL,
    STRONG_SELL;

    public static Recommendation fromNetScore(double netScore, ConfluenceWeights weights) {
        if (netScore >= weights.strongBuyScore()) return STRONG_BUY;
        if (netScore >= weights.buyScore()) return BUY;
        if (netScore <= weights.strongSellScore()) return STRONG_SELL;
        if (netScore <= weights.sellScore()) return SELL;
        return NEUTRAL;
    }
}
