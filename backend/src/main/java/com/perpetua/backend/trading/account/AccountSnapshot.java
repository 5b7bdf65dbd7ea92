package com.perpetua.backend.trading.account;

import com.perpetua.backend.service.exchange.ExchangeGateway.ExchangePosition;

import java.util.List;

/**
 * Live balance and exposures as reported by the exchange at profile time.
 */
public record AccountSnapshot(
        double totalEquity,
        double availableCash,
        double positionsValue,
        double contractValue,
        double returnOnCapital,
        List<ExchangePosition> positions
) {
    public AccountSnapshot {
        positions = positions == null ? List.of() : List.copyOf(positions);
    }
}
