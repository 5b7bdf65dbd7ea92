package com.perpetua.backend.trading.account;

public record RiskMetrics(
        double totalNotional,
        double portfolioLeverage,
        double marginUsedPercentage,
        double availableMarginPercentage,
        LiquidationRisk liquidationRisk
) {}
