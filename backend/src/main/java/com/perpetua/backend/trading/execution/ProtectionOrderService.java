package com.perpetua.backend.trading.execution;

import com.perpetua.backend.model.Instrument;
import com.perpetua.backend.service.exchange.ExchangeGateway;
import com.perpetua.backend.service.exchange.ExchangeGateway.OpenOrder;
import com.perpetua.backend.service.exchange.ExchangeGateway.OrderSide;
import com.perpetua.backend.service.exchange.ExchangeGateway.OrderType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Stop-loss and take-profit orders on the exchange. Replacement is always cancel-then-recreate.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ProtectionOrderService {

    private final ExchangeGateway exchangeGateway;

    public void replace(Instrument instrument, Double stopLoss, Double takeProfit) {
        int cancelled = cancelAll(instrument);
        if (stopLoss != null) {
            exchangeGateway.createProtectionOrder(instrument, OrderType.STOP_MARKET, OrderSide.SELL, stopLoss, true);
        }
        if (takeProfit != null) {
            exchangeGateway.createProtectionOrder(instrument, OrderType.TAKE_PROFIT_MARKET, OrderSide.SELL, takeProfit, true);
        }
        log.info("Protection for {} replaced ({} cancelled): SL={} TP={}", instrument.pair(), cancelled, stopLoss, takeProfit);
    }

    public int cancelAll(Instrument instrument) {
        int cancelled = 0;
        for (OpenOrder order : exchangeGateway.fetchOpenOrders(instrument)) {
            if (order.type() != null && order.type().isProtection()) {
                exchangeGateway.cancelOrder(order.orderId(), instrument);
                cancelled++;
            }
        }
        return cancelled;
    }
}
