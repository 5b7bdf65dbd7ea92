package com.perpetua.backend.trading.account;

import java.util.ArrayList;
import java.util.List;

/**
 * Per-trade Sharpe ratio scaled by a fixed trade count rather than by observed trade frequency.
 */
public class SharpeRatioCalculator {

    /** Assumed trades per year; the per-trade ratio is multiplied by its square root. */
    public static final int SHARPE_ANNUALIZATION_TRADES = 100;

    private final double initialCapital;
    private final double riskFreeRate;
    private final int minTrades;

    public SharpeRatioCalculator(double initialCapital, double riskFreeRate, int minTrades) {
        this.initialCapital = initialCapital;
        this.riskFreeRate = riskFreeRate;
        this.minTrades = minTrades;
    }

    /**
     * @param realizedPnls realized P&L of closed positions in close order
     */
    public double calculate(List<Double> realizedPnls) {
        if (realizedPnls == null || realizedPnls.size() < minTrades) {
            return 0.0;
        }
        List<Double> returns = new ArrayList<>();
        double runningCapital = initialCapital;
        for (Double value : realizedPnls) {
            double pnl = value == null ? 0.0 : value;
            if (runningCapital > 0) {
                returns.add(pnl / runningCapital);
                runningCapital += pnl;
            }
        }
        if (returns.size() < minTrades) {
            return 0.0;
        }
        double mean = returns.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
        double variance = returns.stream().mapToDouble(r -> Math.pow(r - mean, 2)).sum() / returns.size();
        double stdDev = Math.sqrt(variance);
        if (stdDev == 0) {
            return 0.0;
        }
        double perTrade = (mean - riskFreeRate) / stdDev;
        return perTrade * Math.sqrt(SHARPE_ANNUALIZATION_TRADES);
    }
}
