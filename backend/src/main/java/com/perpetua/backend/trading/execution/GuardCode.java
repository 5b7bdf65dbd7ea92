package com.perpetua.backend.trading.execution;

/**
 * Buy guards in evaluation order.
 */
public enum GuardCode {
    NO_OPEN_POSITION,
    LEVERAGE_BOUNDS,
    MIN_TRADE_SIZE,
    CASH_RESERVE,
    POSITION_CONCENTRATION,
    PROTECTION_LEVELS,
    LOSS_LIMITS,
    PORTFOLIO_LEVERAGE,
    RISK_PER_TRADE,
    RISK_REWARD,
    LIQUIDATION_BUFFER
}
