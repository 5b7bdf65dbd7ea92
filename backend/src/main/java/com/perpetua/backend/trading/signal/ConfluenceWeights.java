package com.perpetua.backend.trading.signal;

import com.perpetua.backend.config.TradingProperties;
import lombok.Builder;

/**
 * Factor weights, thresholds and recommendation buckets of the confluence rule set.
 */
@Builder(toBuilder = true)
public record ConfluenceWeights(
        double trendWeight,
        double dailyTrendWeight,
        double adxWeight,
        double rsiWeight,
        double stochRsiWeight,
        double volumeWeight,
        double fundingWeight,
        double divergenceWeight,
        double pivotWeight,
        double percentBWeight,
        double adxStrongTrend,
        double adxRangeBound,
        double rsiOversold,
        double rsiOverbought,
        double rsiNeutralLow,
        double rsiNeutralHigh,
        double stochOversold,
        double stochOverbought,
        double volumeSurgeRatio,
        double fundingBearishAbove,
        double fundingBullishBelow,
        double pivotProximityBelow,
        double pivotProximityAbove,
        double percentBLow,
        double percentBHigh,
        double strongBuyScore,
        double buyScore,
        double sellScore,
        double strongSellScore,
        double stopAtrMultiple,
        double targetAtrMultiple,
        double minRewardRatio
) {

    public static ConfluenceWeights from(TradingProperties.Confluence c) {
        return ConfluenceWeights.builder()
                .trendWeight(c.getTrendWeight())
                .dailyTrendWeight(c.getDailyTrendWeight())
                .adxWeight(c.getAdxWeight())
                .rsiWeight(c.getRsiWeight())
                .stochRsiWeight(c.getStochRsiWeight())
                .volumeWeight(c.getVolumeWeight())
                .fundingWeight(c.getFundingWeight())
                .divergenceWeight(c.getDivergenceWeight())
                .pivotWeight(c.getPivotWeight())
                .percentBWeight(c.getPercentBWeight())
                .adxStrongTrend(c.getAdxStrongTrend())
                .adxRangeBound(c.getAdxRangeBound())
                .rsiOversold(c.getRsiOversold())
                .rsiOverbought(c.getRsiOverbought())
                .rsiNeutralLow(c.getRsiNeutralLow())
                .rsiNeutralHigh(c.getRsiNeutralHigh())
                .stochOversold(c.getStochOversold())
                .stochOverbought(c.getStochOverbought())
                .volumeSurgeRatio(c.getVolumeSurgeRatio())
                .fundingBearishAbove(c.getFundingBearishAbove())
                .fundingBullishBelow(c.getFundingBullishBelow())
                .pivotProximityBelow(c.getPivotProximityBelow())
                .pivotProximityAbove(c.getPivotProximityAbove())
                .percentBLow(c.getPercentBLow())
                .percentBHigh(c.getPercentBHigh())
                .strongBuyScore(c.getStrongBuyScore())
                .buyScore(c.getBuyScore())
                .sellScore(c.getSellScore())
                .strongSellScore(c.getStrongSellScore())
                .stopAtrMultiple(c.getStopAtrMultiple())
                .targetAtrMultiple(c.getTargetAtrMultiple())
                .minRewardRatio(c.getMinRewardRatio())
                .build();
    }

    public static ConfluenceWeights defaults() {
        return from(new TradingProperties.Confluence());
    }
}
