package com.perpetua.backend.trading.signal;

import com.perpetua.backend.model.Instrument;
import com.perpetua.backend.service.indicator.BollingerBandService.BollingerBands;
import com.perpetua.backend.service.indicator.BollingerBandService.Squeeze;
import com.perpetua.backend.service.indicator.Direction;
import com.perpetua.backend.service.indicator.PivotPointService.PivotPoints;
import com.perpetua.backend.service.indicator.RsiDivergenceService.Divergence;
import com.perpetua.backend.service.indicator.StochRsiService.StochRsiPoint;
import com.perpetua.backend.service.indicator.VolatilityRegimeService.VolatilityRegime;
import com.perpetua.backend.trading.signal.ConfluenceScorer.SuggestedLevels;
import lombok.Builder;

import java.time.Instant;
import java.util.List;

/**
 * Multi-timeframe market state for one instrument, recomputed every cycle and never persisted.
 */
@Builder
public record MarketSnapshot(
        Instrument instrument,
        double currentPrice,
        IntradaySeries intraday,
        double emaFast,
        double emaSlow,
        double macd,
        double macdSignal,
        double macdHistogram,
        Direction macdHistogramTrend,
        List<Double> macdSeries,
        double rsi,
        List<Double> rsiSeries,
        double momentumAcceleration,
        double atrFast,
        double atr,
        double adx,
        double plusDI,
        double minusDI,
        BollingerBands bollinger,
        Squeeze squeeze,
        StochRsiPoint stochRsi,
        Divergence divergence,
        double vwap,
        VwapPosition priceVsVwap,
        Direction obvTrend,
        VolatilityRegime volatilityRegime,
        double volumeRatio,
        double openInterest,
        double fundingRate,
        PivotPoints pivots,
        double dailyEmaFast,
        double dailyEmaSlow,
        double dailyAdx,
        TrendDirection dailyTrend,
        PivotPoints dailyPivots,
        ConfluenceScore confluence,
        SuggestedLevels suggestedLevels,
        Instant capturedAt
) {

    public enum VwapPosition { ABOVE, AT, BELOW }

    /**
     * Tail of the 1m series with the fast indicators computed on it, oldest first.
     * {@code currentRsi} is the fast (7) RSI.
     */
    public record IntradaySeries(
            List<Double> closes,
            List<Double> ema20,
            List<Double> macd,
            List<Double> rsi7,
            List<Double> rsi14,
            double currentEma20,
            double currentMacd,
            double currentRsi
    ) {
        public IntradaySeries {
            closes = List.copyOf(closes);
            ema20 = List.copyOf(ema20);
            macd = List.copyOf(macd);
            rsi7 = List.copyOf(rsi7);
            rsi14 = List.copyOf(rsi14);
        }
    }
}
