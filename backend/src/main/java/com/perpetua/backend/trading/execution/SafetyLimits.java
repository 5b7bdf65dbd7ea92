package com.perpetua.backend.trading.execution;

import com.perpetua.backend.config.TradingProperties;
import lombok.Builder;

import java.time.Duration;

/**
 * Immutable buy-guard thresholds, built once from {@code trading.execution.*}.
 */
@Builder(toBuilder = true)
public record SafetyLimits(
        int minLeverage,
        int maxLeverage,
        double minTradeNotional,
        double minCashReserve,
        double maxPositionFraction,
        double maxPortfolioLeverage,
        double maxDailyLoss,
        double maxWeeklyLoss,
        double maxRiskPerTrade,
        double minRiskReward,
        double liquidationBuffer,
        double maintenanceMarginRate,
        Duration dailyLossWindow,
        Duration weeklyLossWindow,
        boolean enforceModeBudget
) {

    public SafetyLimits {
        if (minLeverage < 1 || maxLeverage < minLeverage) {
            throw new IllegalArgumentException("Invalid leverage bounds [" + minLeverage + ", " + maxLeverage + "]");
        }
        if (dailyLossWindow == null || weeklyLossWindow == null) {
            throw new IllegalArgumentException("Loss windows are required");
        }
    }

    public static SafetyLimits from(TradingProperties.Execution execution) {
        TradingProperties.Safety s = execution.getSafety();
        return new SafetyLimits(
                s.getMinLeverage(),
                s.getMaxLeverage(),
                s.getMinTradeNotional(),
                s.getMinCashReserve(),
                s.getMaxPositionFraction(),
                s.getMaxPortfolioLeverage(),
                s.getMaxDailyLoss(),
                s.getMaxWeeklyLoss(),
                s.getMaxRiskPerTrade(),
                s.getMinRiskReward(),
                s.getLiquidationBuffer(),
                s.getMaintenanceMarginRate(),
                s.getDailyLossWindow(),
                s.getWeeklyLossWindow(),
                execution.isEnforceModeBudget()
        );
    }

    public static SafetyLimits defaults() {
        return from(new TradingProperties.Execution());
    }
}
