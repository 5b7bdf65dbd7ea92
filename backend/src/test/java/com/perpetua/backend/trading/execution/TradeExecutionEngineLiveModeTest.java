package com.perpetua.backend.trading.execution;

import com.perpetua.backend.model.Instrument;
import com.perpetua.backend.model.Position;
import com.perpetua.backend.model.Position.PositionStatus;
import com.perpetua.backend.model.Trade;
import com.perpetua.backend.model.Trade.Operation;
import com.perpetua.backend.model.Trade.TradeStatus;
import com.perpetua.backend.repository.PositionRepository;
import com.perpetua.backend.repository.TradeRepository;
import com.perpetua.backend.service.MetricsService;
import com.perpetua.backend.service.exchange.DryRunExchangeGateway;
import com.perpetua.backend.service.exchange.ExchangeGateway;
import com.perpetua.backend.service.exchange.ExchangeGateway.OpenOrder;
import com.perpetua.backend.service.exchange.ExchangeGateway.OrderFill;
import com.perpetua.backend.service.exchange.ExchangeGateway.OrderSide;
import com.perpetua.backend.service.exchange.ExchangeGateway.OrderType;
import com.perpetua.backend.service.exchange.ExchangeGateway.Ticker;
import com.perpetua.backend.trading.account.AccountRiskProfile;
import com.perpetua.backend.trading.account.AccountSnapshot;
import com.perpetua.backend.trading.account.PerformanceMetrics;
import com.perpetua.backend.trading.account.TradingMode;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Engine against a gateway that forwards orders, with the exchange's order book held in memory.
 */
@DataJpaTest
class TradeExecutionEngineLiveModeTest {

    private static final Instant NOW = Instant.parse("2025-03-01T12:00:00Z");

    @Autowired
    private TradeRepository tradeRepository;

    @Autowired
    private PositionRepository positionRepository;

    private final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
    private final AtomicReference<Double> lastPrice = new AtomicReference<>(50000.0);
    private final List<OpenOrder> exchangeBook = new CopyOnWriteArrayList<>();
    private final AtomicLong orderIds = new AtomicLong(1000);
    private ExchangeGateway exchange;

    @BeforeEach
    void setUp() {
        exchange = mock(ExchangeGateway.class);
        when(exchange.fetchTicker(any())).thenAnswer(inv -> new Ticker(inv.getArgument(0), lastPrice.get(), NOW));
        when(exchange.createMarketOrder(any(), any(), anyDouble(), anyBoolean())).thenAnswer(inv ->
                new OrderFill(String.valueOf(orderIds.incrementAndGet()), "FILLED", lastPrice.get(), inv.getArgument(2)));
        when(exchange.createProtectionOrder(any(), any(), any(), anyDouble(), anyBoolean())).thenAnswer(inv -> {
            String id = String.valueOf(orderIds.incrementAndGet());
            exchangeBook.add(new OpenOrder(id, inv.getArgument(1), inv.getArgument(2), inv.getArgument(3), 0.0));
            return new OrderFill(id, "NEW", 0.0, 0.0);
        });
        when(exchange.fetchOpenOrders(any())).thenAnswer(inv -> new ArrayList<>(exchangeBook));
        doAnswer(inv -> {
            String id = inv.getArgument(0);
            exchangeBook.removeIf(order -> order.orderId().equals(id));
            return null;
        }).when(exchange).cancelOrder(anyString(), any());
    }

    @Test
    void acknowledgedButUnfilledBuyOpensNothing() {
        when(exchange.createMarketOrder(any(), any(), anyDouble(), anyBoolean()))
                .thenReturn(new OrderFill("123", "NEW", 0.0, 0.0));
        TradeExecutionEngine engine = engineFor(exchange);

        ExecutionResult result = engine.execute(Instrument.BTC, TradeDecision.buy(50000, 0.002, 5, 49000.0, 51500.0), cycle());

        assertThat(result.success()).isFalse();
        assertThat(result.error()).contains("acknowledged without a fill");
        Trade trade = tradeRepository.findAll().get(0);
        assertThat(trade.getStatus()).isEqualTo(TradeStatus.FAILED);
        assertThat(trade.getPositionId()).isNull();
        assertThat(positionRepository.findAll()).isEmpty();
        verify(exchange, times(0)).createProtectionOrder(any(), any(), any(), anyDouble(), anyBoolean());
    }

    @Test
    void unfilledBuyDoesNotBlockTheNextBuy() {
        when(exchange.createMarketOrder(any(), any(), anyDouble(), anyBoolean()))
                .thenReturn(new OrderFill("123", "NEW", 0.0, 0.0))
                .thenReturn(new OrderFill("124", "FILLED", 50000.0, 0.002));
        TradeExecutionEngine engine = engineFor(exchange);
        engine.execute(Instrument.BTC, TradeDecision.buy(50000, 0.002, 5, 49000.0, 51500.0), cycle());

        ExecutionResult second = engine.execute(Instrument.BTC, TradeDecision.buy(50000, 0.002, 5, 49000.0, 51500.0), cycle());

        assertThat(second.success()).isTrue();
        Position position = positionRepository.findFirstBySymbolAndStatus(Instrument.BTC, PositionStatus.OPEN).orElseThrow();
        assertThat(position.getEntryPrice()).isEqualTo(50000.0);
        assertThat(position.getEntryAmount()).isEqualTo(0.002);
    }

    @Test
    void unfilledSellLeavesPositionUntouched() {
        TradeExecutionEngine engine = engineFor(exchange);
        engine.execute(Instrument.BTC, TradeDecision.buy(50000, 0.002, 5, 49000.0, 51500.0), cycle());
        when(exchange.createMarketOrder(any(), eq(OrderSide.SELL), anyDouble(), anyBoolean()))
                .thenReturn(new OrderFill("200", "EXPIRED", 0.0, 0.0));

        ExecutionResult result = engine.execute(Instrument.BTC, TradeDecision.sell(100), cycle());

        assertThat(result.success()).isFalse();
        Position position = positionRepository.findFirstBySymbolAndStatus(Instrument.BTC, PositionStatus.OPEN).orElseThrow();
        assertThat(position.getEntryAmount()).isEqualTo(0.002);
        assertThat(position.getRealizedPnl()).isEqualTo(0.0);
        assertThat(exchangeBook).hasSize(2);
        Trade sell = tradeRepository.findAll().stream()
                .filter(trade -> trade.getOperation() == Operation.SELL)
                .findFirst().orElseThrow();
        assertThat(sell.getStatus()).isEqualTo(TradeStatus.FAILED);
    }

    @Test
    void liveOrdersFollowLeverageReduceOnlyAndCancelThenRecreate() {
        runLifecycle(engineFor(exchange));

        InOrder order = inOrder(exchange);
        order.verify(exchange).setLeverage(5, Instrument.BTC);
        order.verify(exchange).createMarketOrder(Instrument.BTC, OrderSide.BUY, 0.002, false);
        order.verify(exchange).createProtectionOrder(Instrument.BTC, OrderType.STOP_MARKET, OrderSide.SELL, 49000.0, true);
        order.verify(exchange).createProtectionOrder(Instrument.BTC, OrderType.TAKE_PROFIT_MARKET, OrderSide.SELL, 51500.0, true);
        order.verify(exchange).createMarketOrder(eq(Instrument.BTC), eq(OrderSide.SELL), anyDouble(), eq(true));
        order.verify(exchange, times(2)).cancelOrder(anyString(), eq(Instrument.BTC));
        order.verify(exchange).createProtectionOrder(Instrument.BTC, OrderType.STOP_MARKET, OrderSide.SELL, 49800.0, true);
        order.verify(exchange).createProtectionOrder(Instrument.BTC, OrderType.TAKE_PROFIT_MARKET, OrderSide.SELL, 51500.0, true);
        order.verify(exchange).createMarketOrder(eq(Instrument.BTC), eq(OrderSide.SELL), anyDouble(), eq(true));
        order.verify(exchange, times(2)).cancelOrder(anyString(), eq(Instrument.BTC));
        assertThat(exchangeBook).isEmpty();
    }

    @Test
    void dryRunAndLiveProduceTheSameLedger() {
        runLifecycle(engineFor(exchange));
        List<String> live = ledgerState();

        tradeRepository.deleteAll();
        positionRepository.deleteAll();
        lastPrice.set(50000.0);
        ExchangeGateway marketData = mock(ExchangeGateway.class);
        when(marketData.fetchTicker(any())).thenAnswer(inv -> new Ticker(inv.getArgument(0), lastPrice.get(), NOW));
        runLifecycle(engineFor(new DryRunExchangeGateway(marketData, clock)));
        List<String> dryRun = ledgerState();

        assertThat(dryRun).isEqualTo(live);
        assertThat(live).hasSize(5);
    }

    private void runLifecycle(TradeExecutionEngine engine) {
        assertThat(engine.execute(Instrument.BTC, TradeDecision.buy(50000, 0.002, 5, 49000.0, 51500.0), cycle()).success()).isTrue();
        lastPrice.set(51000.0);
        assertThat(engine.execute(Instrument.BTC, TradeDecision.sell(40), cycle()).success()).isTrue();
        assertThat(engine.execute(Instrument.BTC, TradeDecision.hold(49800.0, null), cycle()).success()).isTrue();
        lastPrice.set(49500.0);
        assertThat(engine.execute(Instrument.BTC, TradeDecision.sell(100), cycle()).success()).isTrue();
    }

    private List<String> ledgerState() {
        List<String> state = new ArrayList<>();
        tradeRepository.findAll().stream()
                .sorted(Comparator.comparing(Trade::getId))
                .forEach(trade -> state.add(String.join("|", "trade", String.valueOf(trade.getOperation()),
                        String.valueOf(trade.getStatus()), String.valueOf(trade.getExecutedPrice()),
                        String.valueOf(trade.getExecutedAmount()), String.valueOf(trade.getError()),
                        String.valueOf(trade.getPositionId() != null))));
        positionRepository.findAll()
                .forEach(position -> state.add(String.join("|", "position", String.valueOf(position.getStatus()),
                        String.valueOf(position.getEntryPrice()), String.valueOf(position.getEntryAmount()),
                        String.valueOf(position.getExitPrice()), String.valueOf(position.getExitAmount()),
                        String.valueOf(position.getExitReason()), String.valueOf(position.getRealizedPnl()),
                        String.valueOf(position.getCurrentStopLoss()), String.valueOf(position.getCurrentTakeProfit()))));
        return state;
    }

    private TradeExecutionEngine engineFor(ExchangeGateway gateway) {
        SafetyLimits limits = SafetyLimits.defaults();
        TradeLedger ledger = new TradeLedger(tradeRepository, positionRepository, new TradeStateMachine(), clock);
        return new TradeExecutionEngine(gateway, ledger, new BuyGuardPipeline(limits), limits,
                new ProtectionOrderService(gateway), new MetricsService(new SimpleMeterRegistry()));
    }

    private CycleContext cycle() {
        AccountSnapshot account = new AccountSnapshot(500, 400, 0, 0, 0, List.of());
        AccountRiskProfile profile = new AccountRiskProfile(TradingMode.NORMAL, 0.02, 5, 3, 0.0,
                PerformanceMetrics.empty(), null, account, NOW);
        return new CycleContext("cycle-live", profile, NOW, NOW.plusSeconds(60));
    }
}
