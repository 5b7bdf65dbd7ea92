package com.perpetua.backend.trading.signal;

import com.perpetua.backend.service.indicator.PivotPointService.PivotPoints;
import com.perpetua.backend.service.indicator.RsiDivergenceService.Divergence;
import com.perpetua.backend.service.indicator.StochRsiService.StochRsiPoint;
import lombok.Builder;

/**
 * Latest indicator readings on the swing timeframe that feed the confluence rule set.
 */
@Builder(toBuilder = true)
public record ConfluenceInputs(
        double currentPrice,
        double emaFast,
        double emaSlow,
        TrendDirection dailyTrend,
        double adx,
        double rsi,
        StochRsiPoint stochRsi,
        double volumeRatio,
        double fundingRate,
        Divergence divergence,
        PivotPoints pivots,
        double percentB
) {}
