package com.perpetua.backend.trading.account;

import java.time.Instant;

/**
 * Read-only risk posture for one evaluation cycle.
 */
public record AccountRiskProfile(
        TradingMode tradingMode,
        double maxRiskPct,
        int maxLeverage,
        int maxPositions,
        double sharpeRatio,
        PerformanceMetrics performance,
        RiskMetrics risk,
        AccountSnapshot account,
        Instant computedAt
) {}
