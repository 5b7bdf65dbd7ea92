package com.perpetua.backend.trading.execution;

import java.util.List;

/**
 * The eleven buy guards in evaluation order. Each one reads only the {@link GuardContext}
 * and the immutable {@link SafetyLimits}; none of them touches the exchange.
 */
public final class BuyGuards {

    /** Tolerance for boundary-inclusive comparisons on derived doubles. */
    static final double EPSILON = 1e-9;

    private BuyGuards() {
    }

    public static List<BuyGuard> ordered(SafetyLimits limits) {
        return List.of(
                noOpenPosition(),
                leverageBounds(limits),
                minTradeSize(limits),
                cashReserve(limits),
                positionConcentration(limits),
                protectionLevels(),
                lossLimits(limits),
                portfolioLeverage(limits),
                riskPerTrade(limits),
                riskReward(limits),
                liquidationBuffer(limits)
        );
    }

    static BuyGuard noOpenPosition() {
        return ctx -> ctx.hasOpenPosition()
                ? GuardVerdict.reject(GuardCode.NO_OPEN_POSITION, "Position already open for " + ctx.instrument().pair())
                : GuardVerdict.allow();
    }

    static BuyGuard leverageBounds(SafetyLimits limits) {
        return ctx -> {
            int leverage = ctx.order().leverage();
            int max = limits.maxLeverage();
            if (limits.enforceModeBudget() && ctx.profile() != null) {
                max = Math.min(max, ctx.profile().maxLeverage());
            }
            if (leverage < limits.minLeverage() || leverage > max) {
                return GuardVerdict.reject(GuardCode.LEVERAGE_BOUNDS,
                        "Leverage " + leverage + "x outside [" + limits.minLeverage() + ", " + max + "]",
                        (double) max, (double) leverage);
            }
            return GuardVerdict.allow();
        };
    }

    static BuyGuard minTradeSize(SafetyLimits limits) {
        return ctx -> {
            double notional = ctx.notional();
            if (notional + EPSILON < limits.minTradeNotional()) {
                return GuardVerdict.reject(GuardCode.MIN_TRADE_SIZE,
                        String.format("Trade notional $%.2f below minimum $%.2f", notional, limits.minTradeNotional()),
                        limits.minTradeNotional(), notional);
            }
            return GuardVerdict.allow();
        };
    }

    static BuyGuard cashReserve(SafetyLimits limits) {
        return ctx -> {
            double remaining = ctx.freeCash() - ctx.cycleCommittedMargin() - ctx.margin();
            double reserve = limits.minCashReserve() * ctx.totalEquity();
            if (remaining + EPSILON < reserve) {
                return GuardVerdict.reject(GuardCode.CASH_RESERVE,
                        String.format("Insufficient cash: margin $%.2f leaves $%.2f, reserve is $%.2f",
                                ctx.margin(), remaining, reserve),
                        reserve, remaining);
            }
            return GuardVerdict.allow();
        };
    }

    static BuyGuard positionConcentration(SafetyLimits limits) {
        return ctx -> {
            if (ctx.totalEquity() <= 0) {
                return GuardVerdict.reject(GuardCode.POSITION_CONCENTRATION, "No equity available");
            }
            double fraction = ctx.margin() / ctx.totalEquity();
            if (fraction > limits.maxPositionFraction() + EPSILON) {
                return GuardVerdict.reject(GuardCode.POSITION_CONCENTRATION,
                        String.format("Position margin is %.1f%% of equity, max %.1f%%",
                                fraction * 100, limits.maxPositionFraction() * 100),
                        limits.maxPositionFraction(), fraction);
            }
            return GuardVerdict.allow();
        };
    }

    static BuyGuard protectionLevels() {
        return ctx -> {
            double entry = ctx.entryPrice();
            if (ctx.stopLoss() != null && ctx.stopLoss() >= entry) {
                return GuardVerdict.reject(GuardCode.PROTECTION_LEVELS,
                        "Stop-loss " + ctx.stopLoss() + " must be below entry price " + entry,
                        entry, ctx.stopLoss());
            }
            if (ctx.takeProfit() != null && ctx.takeProfit() <= entry) {
                return GuardVerdict.reject(GuardCode.PROTECTION_LEVELS,
                        "Take-profit " + ctx.takeProfit() + " must be above entry price " + entry,
                        entry, ctx.takeProfit());
            }
            return GuardVerdict.allow();
        };
    }

    static BuyGuard lossLimits(SafetyLimits limits) {
        return ctx -> {
            double equity = ctx.totalEquity();
            double daily = ctx.realizedLosses().daily();
            double dailyFloor = -limits.maxDailyLoss() * equity;
            if (daily + EPSILON < dailyFloor) {
                return GuardVerdict.reject(GuardCode.LOSS_LIMITS,
                        String.format("Daily loss limit hit: $%.2f (max -$%.2f)", daily, -dailyFloor),
                        dailyFloor, daily);
            }
            double weekly = ctx.realizedLosses().weekly();
            double weeklyFloor = -limits.maxWeeklyLoss() * equity;
            if (weekly + EPSILON < weeklyFloor) {
                return GuardVerdict.reject(GuardCode.LOSS_LIMITS,
                        String.format("Weekly loss limit hit: $%.2f (max -$%.2f)", weekly, -weeklyFloor),
                        weeklyFloor, weekly);
            }
            return GuardVerdict.allow();
        };
    }

    static BuyGuard portfolioLeverage(SafetyLimits limits) {
        return ctx -> {
            if (ctx.totalEquity() <= 0) {
                return GuardVerdict.reject(GuardCode.PORTFOLIO_LEVERAGE, "No equity available");
            }
            double total = ctx.exchangeOpenNotional() + ctx.cycleAdmittedNotional() + ctx.notional();
            double leverage = total / ctx.totalEquity();
            if (leverage > limits.maxPortfolioLeverage() + EPSILON) {
                return GuardVerdict.reject(GuardCode.PORTFOLIO_LEVERAGE,
                        String.format("Portfolio leverage %.2fx exceeds max %.1fx", leverage, limits.maxPortfolioLeverage()),
                        limits.maxPortfolioLeverage(), leverage);
            }
            return GuardVerdict.allow();
        };
    }

    static BuyGuard riskPerTrade(SafetyLimits limits) {
        return ctx -> {
            if (ctx.stopLoss() == null) {
                return GuardVerdict.allow();
            }
            double maxRisk = limits.maxRiskPerTrade();
            if (limits.enforceModeBudget() && ctx.profile() != null) {
                maxRisk = Math.min(maxRisk, ctx.profile().maxRiskPct());
            }
            double loss = Math.abs(ctx.entryPrice() - ctx.stopLoss()) * ctx.order().amount() * ctx.order().leverage();
            double risk = ctx.totalEquity() > 0 ? loss / ctx.totalEquity() : Double.POSITIVE_INFINITY;
            if (risk > maxRisk + EPSILON) {
                return GuardVerdict.reject(GuardCode.RISK_PER_TRADE,
                        String.format("Risk %.2f%% exceeds max %.2f%%", risk * 100, maxRisk * 100),
                        maxRisk, risk);
            }
            return GuardVerdict.allow();
        };
    }

    static BuyGuard riskReward(SafetyLimits limits) {
        return ctx -> {
            if (ctx.stopLoss() == null || ctx.takeProfit() == null) {
                return GuardVerdict.allow();
            }
            double risk = Math.abs(ctx.entryPrice() - ctx.stopLoss());
            double reward = Math.abs(ctx.takeProfit() - ctx.entryPrice());
            double ratio = reward / risk;
            if (ratio + EPSILON < limits.minRiskReward()) {
                return GuardVerdict.reject(GuardCode.RISK_REWARD,
                        String.format("Risk/reward %.2f below minimum %.2f", ratio, limits.minRiskReward()),
                        limits.minRiskReward(), ratio);
            }
            return GuardVerdict.allow();
        };
    }

    static BuyGuard liquidationBuffer(SafetyLimits limits) {
        return ctx -> {
            double entry = ctx.entryPrice();
            double liquidation = liquidationPrice(entry, ctx.order().leverage(), limits.maintenanceMarginRate());
            double buffer = (entry - liquidation) / entry;
            if (ctx.stopLoss() != null && ctx.stopLoss() <= liquidation) {
                return GuardVerdict.reject(GuardCode.LIQUIDATION_BUFFER,
                        String.format("Stop-loss %.2f is at or below liquidation price %.2f", ctx.stopLoss(), liquidation),
                        liquidation, ctx.stopLoss());
            }
            if (buffer <= limits.liquidationBuffer()) {
                return GuardVerdict.reject(GuardCode.LIQUIDATION_BUFFER,
                        String.format("Liquidation buffer %.1f%% not above minimum %.1f%%",
                                buffer * 100, limits.liquidationBuffer() * 100),
                        limits.liquidationBuffer(), buffer);
            }
            return GuardVerdict.allow();
        };
    }

    /**
     * Long-position approximation of the exchange's liquidation price. It ignores tiered maintenance
     * margin and fees, so it is a heuristic and not the exchange's own figure.
     */
    public static double liquidationPrice(double entryPrice, int leverage, double maintenanceMarginRate) {
        return entryPrice * (1 - 1.0 / leverage + maintenanceMarginRate);
    }
}
