package com.perpetua.backend.service.exchange;

import com.perpetua.backend.model.Instrument;
import com.perpetua.backend.model.PriceSeries;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Market data and account reads go to the real exchange; every order call is simulated.
 * Market orders fill in full at the current last price. Protection orders live in a local book
 * so that cancel-then-recreate behaves as it would on the exchange.
 */
@Slf4j
public class DryRunExchangeGateway implements ExchangeGateway {

    public static final String ORDER_ID_PREFIX = "DRY_RUN_";

    private final ExchangeGateway delegate;
    private final Clock clock;
    private final AtomicLong sequence = new AtomicLong();
    private final Map<Instrument, List<OpenOrder>> protectionOrders = new ConcurrentHashMap<>();

    public DryRunExchangeGateway(ExchangeGateway delegate, Clock clock) {
        this.delegate = delegate;
        this.clock = clock;
    }

    @Override
    public AccountBalance fetchBalance(String marginType) {
        return delegate.fetchBalance(marginType);
    }

    @Override
    public List<ExchangePosition> fetchPositions(Collection<Instrument> instruments) {
        return delegate.fetchPositions(instruments);
    }

    @Override
    public Ticker fetchTicker(Instrument instrument) {
        return delegate.fetchTicker(instrument);
    }

    @Override
    public PriceSeries fetchOhlcv(Instrument instrument, String timeframe, int limit) {
        return delegate.fetchOhlcv(instrument, timeframe, limit);
    }

    @Override
    public double fetchOpenInterest(Instrument instrument) {
        return delegate.fetchOpenInterest(instrument);
    }

    @Override
    public double fetchFundingRate(Instrument instrument) {
        return delegate.fetchFundingRate(instrument);
    }

    @Override
    public void setLeverage(int leverage, Instrument instrument) {
        log.info("[DRY_RUN] Would set leverage {}x for {}", leverage, instrument.pair());
    }

    @Override
    public OrderFill createMarketOrder(Instrument instrument, OrderSide side, double amount, boolean reduceOnly) {
        double price = delegate.fetchTicker(instrument).last();
        String orderId = ORDER_ID_PREFIX + clock.millis();
        log.info("[DRY_RUN] Would execute {} {} {} at ~{} reduceOnly={} id={}",
                side, amount, instrument.pair(), price, reduceOnly, orderId);
        return new OrderFill(orderId, "FILLED", price, amount);
    }

    @Override
    public OrderFill createProtectionOrder(Instrument instrument, OrderType type, OrderSide side, double stopPrice, boolean reduceOnly) {
        if (!type.isProtection()) {
            throw new IllegalArgumentException("Not a protection order type: " + type);
        }
        String orderId = ORDER_ID_PREFIX + type.name() + "_" + clock.millis() + "_" + sequence.incrementAndGet();
        protectionOrders.computeIfAbsent(instrument, key -> new CopyOnWriteArrayList<>())
                .add(new OpenOrder(orderId, type, side, stopPrice, 0.0));
        log.info("[DRY_RUN] Would place {} {} for {} at {} id={}", type, side, instrument.pair(), stopPrice, orderId);
        return new OrderFill(orderId, "NEW", 0.0, 0.0);
    }

    @Override
    public List<OpenOrder> fetchOpenOrders(Instrument instrument) {
        return new ArrayList<>(protectionOrders.getOrDefault(instrument, List.of()));
    }

    @Override
    public void cancelOrder(String orderId, Instrument instrument) {
        List<OpenOrder> orders = protectionOrders.get(instrument);
        if (orders != null) {
            orders.removeIf(order -> order.orderId().equals(orderId));
        }
        log.info("[DRY_RUN] Would cancel order {} for {}", orderId, instrument.pair());
    }
}
