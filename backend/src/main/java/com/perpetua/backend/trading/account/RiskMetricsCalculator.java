package com.perpetua.backend.trading.account;

import com.perpetua.backend.service.exchange.ExchangeGateway.ExchangePosition;

import java.util.List;

public class RiskMetricsCalculator {

    public static final double MEDIUM_LEVERAGE = 3.0;
    public static final double HIGH_LEVERAGE = 5.0;
    public static final double MEDIUM_LIQUIDATION_DISTANCE = 0.2;
    public static final double HIGH_LIQUIDATION_DISTANCE = 0.1;

    public RiskMetrics calculate(List<ExchangePosition> positions, double totalEquity) {
        List<ExchangePosition> live = positions == null ? List.of() : positions;
        double totalNotional = live.stream().mapToDouble(p -> Math.abs(p.notional())).sum();
        double marginUsed = live.stream().mapToDouble(ExchangePosition::initialMargin).sum();
        double leverage = totalEquity > 0 ? totalNotional / totalEquity : 0.0;
        double marginUsedPct = totalEquity > 0 ? marginUsed / totalEquity : 0.0;

        LiquidationRisk risk = LiquidationRisk.LOW;
        if (leverage > MEDIUM_LEVERAGE) risk = LiquidationRisk.MEDIUM;
        if (leverage > HIGH_LEVERAGE) risk = LiquidationRisk.HIGH;

        for (ExchangePosition position : live) {
            if (position.liquidationPrice() <= 0 || position.markPrice() <= 0 || position.entryPrice() <= 0) {
                continue;
            }
            double distance = Math.abs(position.markPrice() - position.liquidationPrice()) / position.markPrice();
            if (distance < HIGH_LIQUIDATION_DISTANCE) {
                risk = LiquidationRisk.HIGH;
            } else if (distance < MEDIUM_LIQUIDATION_DISTANCE && risk != LiquidationRisk.HIGH) {
                risk = LiquidationRisk.MEDIUM;
            }
        }
        return new RiskMetrics(totalNotional, leverage, marginUsedPct, 1.0 - marginUsedPct, risk);
    }
}
