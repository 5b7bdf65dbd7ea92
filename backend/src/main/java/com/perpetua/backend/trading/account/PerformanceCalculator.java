package com.perpetua.backend.trading.account;

import java.util.List;

public class PerformanceCalculator {

    /**
     * Drawdown is measured on the running P&L curve, whose peak starts at zero.
     */
    public PerformanceMetrics calculate(List<Double> realizedPnls) {
        if (realizedPnls == null || realizedPnls.isEmpty()) {
            return PerformanceMetrics.empty();
        }
        int wins = 0;
        int losses = 0;
        double grossWin = 0.0;
        double grossLoss = 0.0;
        double largestWin = 0.0;
        double worstLoss = 0.0;
        int winStreak = 0;
        int lossStreak = 0;
        int maxWinStreak = 0;
        int maxLossStreak = 0;
        double peak = 0.0;
        double running = 0.0;
        double maxDrawdown = 0.0;

        for (Double value : realizedPnls) {
            double pnl = value == null ? 0.0 : value;
            if (pnl > 0) {
                wins++;
                grossWin += pnl;
                largestWin = Math.max(largestWin, pnl);
                winStreak++;
                lossStreak = 0;
                maxWinStreak = Math.max(maxWinStreak, winStreak);
            } else if (pnl < 0) {
                losses++;
                grossLoss += -pnl;
                worstLoss = Math.min(worstLoss, pnl);
                lossStreak++;
                winStreak = 0;
                maxLossStreak = Math.max(maxLossStreak, lossStreak);
            }
            running += pnl;
            peak = Math.max(peak, running);
            maxDrawdown = Math.max(maxDrawdown, drawdown(peak, running));
        }

        int total = realizedPnls.size();
        return PerformanceMetrics.builder()
                .winRate((double) wins / total)
                .profitFactor(grossLoss > 0 ? grossWin / grossLoss : 0.0)
                .averageWin(wins > 0 ? grossWin / wins : 0.0)
                .averageLoss(losses > 0 ? grossLoss / losses : 0.0)
                .largestWin(largestWin)
                .largestLoss(Math.abs(worstLoss))
                .consecutiveWins(maxWinStreak)
                .consecutiveLosses(maxLossStreak)
                .maxDrawdown(maxDrawdown)
                .currentDrawdown(drawdown(peak, running))
                .totalTrades(total)
                .winningTrades(wins)
                .losingTrades(losses)
                .build();
    }

    private double drawdown(double peak, double running) {
        return peak > 0 ? (peak - running) / peak : 0.0;
    }
}
