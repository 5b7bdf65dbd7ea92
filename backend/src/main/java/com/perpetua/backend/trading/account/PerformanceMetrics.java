package com.perpetua.backend.trading.account;

import lombok.Builder;

@Builder
public record PerformanceMetrics(
        double winRate,
        double profitFactor,
        double averageWin,
        double averageLoss,
        double largestWin,
        double largestLoss,
        int consecutiveWins,
        int consecutiveLosses,
        double maxDrawdown,
        double currentDrawdown,
        int totalTrades,
        int winningTrades,
        int losingTrades
) {
    public static PerformanceMetrics empty() {
        return PerformanceMetrics.builder().build();
    }
}
