package com.perpetua.backend.service.exchange;

import com.perpetua.backend.model.Instrument;
import com.perpetua.backend.model.PriceSeries;

import java.time.Instant;
import java.util.Collection;
import java.util.List;

/**
 * Client-side contract of the futures exchange. Every call may fail with
 * {@link com.perpetua.backend.exception.ExchangeGatewayException}; no call returns a silent default.
 */
public interface ExchangeGateway {

    AccountBalance fetchBalance(String marginType);

    List<ExchangePosition> fetchPositions(Collection<Instrument> instruments);

    Ticker fetchTicker(Instrument instrument);

    PriceSeries fetchOhlcv(Instrument instrument, String timeframe, int limit);

    double fetchOpenInterest(Instrument instrument);

    double fetchFundingRate(Instrument instrument);

    void setLeverage(int leverage, Instrument instrument);

    OrderFill createMarketOrder(Instrument instrument, OrderSide side, double amount, boolean reduceOnly);

    /**
     * Conditional order that closes the position when {@code stopPrice} trades.
     */
    OrderFill createProtectionOrder(Instrument instrument, OrderType type, OrderSide side, double stopPrice, boolean reduceOnly);

    List<OpenOrder> fetchOpenOrders(Instrument instrument);

    void cancelOrder(String orderId, Instrument instrument);

    enum OrderSide { BUY, SELL }

    enum OrderType {
        MARKET,
        STOP_MARKET,
        TAKE_PROFIT_MARKET;

        public boolean isProtection() {
            return this == STOP_MARKET || this == TAKE_PROFIT_MARKET;
        }
    }

    record AccountBalance(double free, double total) {}

    record ExchangePosition(
            Instrument instrument,
            double contracts,
            double entryPrice,
            double markPrice,
            double liquidationPrice,
            double notional,
            double initialMargin,
            double unrealizedPnl,
            int leverage
    ) {}

    record Ticker(Instrument instrument, double last, Instant timestamp) {}

    record OrderFill(String orderId, String status, double averagePrice, double filledAmount) {}

    record OpenOrder(String orderId, OrderType type, OrderSide side, double stopPrice, double amount) {}
}
