package com.perpetua.backend.trading.signal;

import com.perpetua.backend.service.indicator.RsiDivergenceService.DivergenceType;
import com.perpetua.backend.service.indicator.StochRsiService.StochRsiPoint;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Additive weighted rule set. Each rule adds to the bullish or bearish side and explains itself in a factor line.
 */
public class ConfluenceScorer {

    private final ConfluenceWeights weights;

    public ConfluenceScorer(ConfluenceWeights weights) {
        this.weights = weights;
    }

    public ConfluenceScore score(ConfluenceInputs in) {
        double bullish = 0.0;
        double bearish = 0.0;
        List<String> factors = new ArrayList<>();
        boolean uptrend = in.emaFast() > in.emaSlow();

        if (in.emaFast() > in.emaSlow()) {
            bullish += weights.trendWeight();
            factors.add("Swing trend: bullish (fast EMA above slow EMA)");
        } else if (in.emaFast() < in.emaSlow()) {
            bearish += weights.trendWeight();
            factors.add("Swing trend: bearish (fast EMA below slow EMA)");
        }

        if (in.dailyTrend() == TrendDirection.UP) {
            bullish += weights.dailyTrendWeight();
            factors.add("Daily trend: bullish");
        } else if (in.dailyTrend() == TrendDirection.DOWN) {
            bearish += weights.dailyTrendWeight();
            factors.add("Daily trend: bearish");
        }

        if (in.adx() > weights.adxStrongTrend()) {
            if (uptrend) {
                bullish += weights.adxWeight();
            } else {
                bearish += weights.adxWeight();
            }
            factors.add(format("ADX: %.1f (strong %s trend)", in.adx(), uptrend ? "bullish" : "bearish"));
        } else if (in.adx() < weights.adxRangeBound()) {
            factors.add(format("ADX: %.1f (weak/range-bound)", in.adx()));
        }

        if (in.rsi() < weights.rsiOversold()) {
            bullish += weights.rsiWeight();
            factors.add(format("RSI: %.1f (oversold)", in.rsi()));
        } else if (in.rsi() > weights.rsiOverbought()) {
            bearish += weights.rsiWeight();
            factors.add(format("RSI: %.1f (overbought)", in.rsi()));
        } else if (in.rsi() >= weights.rsiNeutralLow() && in.rsi() <= weights.rsiNeutralHigh()) {
            factors.add(format("RSI: %.1f (neutral zone)", in.rsi()));
        }

        StochRsiPoint stoch = in.stochRsi();
        if (stoch != null) {
            if (stoch.k() < weights.stochOversold() && stoch.k() > stoch.d()) {
                bullish += weights.stochRsiWeight();
                factors.add("StochRSI: bullish crossover from oversold");
            } else if (stoch.k() > weights.stochOverbought() && stoch.k() < stoch.d()) {
                bearish += weights.stochRsiWeight();
                factors.add("StochRSI: bearish crossover from overbought");
            }
        }

        if (in.volumeRatio() > weights.volumeSurgeRatio()) {
            if (uptrend) {
                bullish += weights.volumeWeight();
            } else {
                bearish += weights.volumeWeight();
            }
            factors.add(format("Volume: %.0f%% of average (surge)", in.volumeRatio() * 100));
        }

        if (in.fundingRate() > weights.fundingBearishAbove()) {
            bearish += weights.fundingWeight();
            factors.add(format("Funding: %.3f%% (crowded longs)", in.fundingRate() * 100));
        } else if (in.fundingRate() < weights.fundingBullishBelow()) {
            bullish += weights.fundingWeight();
            factors.add(format("Funding: %.3f%% (shorts paying)", in.fundingRate() * 100));
        }

        if (in.divergence() != null) {
            double points = weights.divergenceWeight() * in.divergence().strength();
            if (in.divergence().type() == DivergenceType.BULLISH) {
                bullish += points;
                factors.add(format("Divergence: bullish (strength %.0f%%)", in.divergence().strength() * 100));
            } else if (in.divergence().type() == DivergenceType.BEARISH) {
                bearish += points;
                factors.add(format("Divergence: bearish (strength %.0f%%)", in.divergence().strength() * 100));
            }
        }

        if (in.pivots() != null && in.currentPrice() > 0) {
            double toSupport = (in.currentPrice() - in.pivots().s1()) / in.currentPrice();
            double toResistance = (in.pivots().r1() - in.currentPrice()) / in.currentPrice();
            if (nearLevel(toSupport)) {
                bullish += weights.pivotWeight();
                factors.add(format("Price at support S1: %.2f", in.pivots().s1()));
            } else if (nearLevel(toResistance)) {
                bearish += weights.pivotWeight();
                factors.add(format("Price at resistance R1: %.2f", in.pivots().r1()));
            }
        }

        if (in.percentB() < weights.percentBLow()) {
            bullish += weights.percentBWeight();
            factors.add("Price near lower Bollinger band");
        } else if (in.percentB() > weights.percentBHigh()) {
            bearish += weights.percentBWeight();
            factors.add("Price near upper Bollinger band");
        }

        return new ConfluenceScore(bullish, bearish, factors, Recommendation.fromNetScore(bullish - bearish, weights));
    }

    /**
     * Stop at the more conservative of S1 and an ATR stop; target at least the minimum reward multiple.
     */
    public SuggestedLevels suggestLevels(double price, double atr, double support, double resistance) {
        double stopLoss = Math.max(support, price - weights.stopAtrMultiple() * atr);
        double minimumTarget = price + weights.minRewardRatio() * (price - stopLoss);
        double structuralTarget = Math.min(resistance, price + weights.targetAtrMultiple() * atr);
        return new SuggestedLevels(stopLoss, Math.max(minimumTarget, structuralTarget));
    }

    private boolean nearLevel(double distance) {
        return distance < weights.pivotProximityAbove() && distance > weights.pivotProximityBelow();
    }

    private static String format(String pattern, Object... args) {
        return String.format(Locale.ROOT, pattern, args);
    }

    public record SuggestedLevels(double stopLoss, double takeProfit) {}
}
