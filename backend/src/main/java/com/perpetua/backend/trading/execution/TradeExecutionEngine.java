package com.perpetua.backend.trading.execution;

import com.perpetua.backend.exception.ExchangeGatewayException;
import com.perpetua.backend.exception.TradingException;
import com.perpetua.backend.model.Instrument;
import com.perpetua.backend.model.Position;
import com.perpetua.backend.model.Position.ExitReason;
import com.perpetua.backend.model.Trade;
import com.perpetua.backend.model.Trade.TradeStatus;
import com.perpetua.backend.service.MetricsService;
import com.perpetua.backend.service.exchange.ExchangeGateway;
import com.perpetua.backend.service.exchange.ExchangeGateway.OrderFill;
import com.perpetua.backend.service.exchange.ExchangeGateway.OrderSide;
import com.perpetua.backend.trading.execution.TradeDecision.BuyOrder;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Carries out one advisor decision for one instrument. Guard evaluation and every exchange
 * mutation run under a single lock, so Buys admitted within a cycle see each other's exposure.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TradeExecutionEngine {

    static final String NO_POSITION_FOR_HOLD = "No open position to update. Treated as Wait.";
    private static final double FILL_TOLERANCE = 1e-9;

    private final ExchangeGateway exchangeGateway;
    private final TradeLedger ledger;
    private final BuyGuardPipeline guardPipeline;
    private final SafetyLimits safetyLimits;
    private final ProtectionOrderService protectionOrderService;
    private final MetricsService metricsService;

    private final ReentrantLock executionLock = new ReentrantLock();

    /**
     * @throws com.perpetua.backend.exception.DecisionValidationException if the decision lacks the
     *         sub-object its operation needs; nothing is recorded in that case
     */
    public ExecutionResult execute(Instrument instrument, TradeDecision decision, CycleContext cycle) {
        decision.requireConsistent();
        Trade trade = ledger.openTrade(instrument, decision);
        executionLock.lock();
        try {
            ledger.markExecuting(trade);
            ExecutionResult result = switch (decision.operation()) {
                case BUY -> buy(instrument, decision, trade, cycle);
                case SELL -> sell(instrument, decision, trade);
                case HOLD -> hold(instrument, decision, trade);
            };
            metricsService.recordTradeOutcome(decision.operation().name(), trade.getStatus().name());
            return result;
        } catch (ExchangeGatewayException e) {
            log.warn("Exchange failure executing {} {}: {}", decision.operation(), instrument.pair(), e.getMessage());
            return failTrade(trade, decision, e.getMessage());
        } catch (TradingException e) {
            log.warn("Execution of {} {} failed: {}", decision.operation(), instrument.pair(), e.getMessage());
            return failTrade(trade, decision, e.getMessage());
        } catch (RuntimeException e) {
            log.error("Unexpected failure executing {} {}", decision.operation(), instrument.pair(), e);
            return failTrade(trade, decision, e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage());
        } finally {
            executionLock.unlock();
        }
    }

    private ExecutionResult buy(Instrument instrument, TradeDecision decision, Trade trade, CycleContext cycle) {
        BuyOrder order = decision.buy();
        boolean hasOpenPosition = ledger.findOpenPosition(instrument).isPresent();
        GuardContext context = GuardContext.builder()
                .instrument(instrument)
                .order(order)
                .stopLoss(decision.stopLoss())
                .takeProfit(decision.takeProfit())
                .price(GuardContext.PriceSource.memoized(() -> exchangeGateway.fetchTicker(instrument).last()))
                .totalEquity(cycle.totalEquity())
                .freeCash(cycle.availableCash())
                .hasOpenPosition(hasOpenPosition)
                .exchangeOpenNotional(cycle.exchangeOpenNotional())
                .cycleAdmittedNotional(cycle.getAdmittedNotional())
                .cycleCommittedMargin(cycle.getCommittedMargin())
                .profile(cycle.getProfile())
                .realizedLosses(new LedgerLosses())
                .build();

        GuardVerdict verdict = guardPipeline.evaluate(context);
        if (!verdict.allowed()) {
            metricsService.recordGuardRejection(verdict.code().name());
            ledger.fail(trade, verdict.message());
            return ExecutionResult.failed(verdict.message());
        }

        exchangeGateway.setLeverage(order.leverage(), instrument);
        OrderFill fill = exchangeGateway.createMarketOrder(instrument, OrderSide.BUY, order.amount(), false);
        metricsService.incrementOrdersPlaced();
        requireFill(instrument, fill);
        Position position = ledger.openPosition(instrument, fill, order.leverage(), decision.stopLoss(), decision.takeProfit());
        double notional = fill.averagePrice() * fill.filledAmount();
        cycle.recordAdmission(notional, notional / order.leverage());
        TradeStatus status = isShort(fill, order.amount()) ? TradeStatus.PARTIAL : TradeStatus.FILLED;
        ledger.complete(trade, status, fill, position.getId(), null);
        log.info("BUY {} filled: id={} amount={} price={} leverage={}x",
                instrument.pair(), fill.orderId(), fill.filledAmount(), fill.averagePrice(), order.leverage());

        String protectionError = null;
        if (decision.hasAdjustment()) {
            try {
                protectionOrderService.replace(instrument, decision.stopLoss(), decision.takeProfit());
            } catch (ExchangeGatewayException e) {
                protectionError = "Protection orders not placed: " + e.getMessage();
                log.error("Position {} for {} is open without protection orders", position.getId(), instrument.pair(), e);
            }
        }
        return new ExecutionResult(true, fill.orderId(), fill.averagePrice(), fill.filledAmount(), protectionError);
    }

    private ExecutionResult sell(Instrument instrument, TradeDecision decision, Trade trade) {
        Optional<Position> open = ledger.findOpenPosition(instrument);
        if (open.isEmpty()) {
            String error = "No open position found for " + instrument.pair();
            ledger.fail(trade, error);
            return ExecutionResult.failed(error);
        }
        Position position = open.get();
        double percentage = decision.sell().percentage();
        double requested = position.getEntryAmount() * percentage / 100.0;

        OrderFill fill = exchangeGateway.createMarketOrder(instrument, OrderSide.SELL, requested, true);
        metricsService.incrementOrdersPlaced();
        requireFill(instrument, fill);
        double pnl = realizedPnl(position, fill);
        boolean shortFill = isShort(fill, requested);

        if (percentage < 100.0 || shortFill) {
            ledger.reducePosition(position, fill.filledAmount(), pnl);
        } else {
            ledger.closePosition(position, fill, pnl, ExitReason.MANUAL);
            try {
                protectionOrderService.cancelAll(instrument);
            } catch (ExchangeGatewayException e) {
                log.warn("Could not cancel leftover protection orders for {}: {}", instrument.pair(), e.getMessage());
            }
        }
        ledger.complete(trade, shortFill ? TradeStatus.PARTIAL : TradeStatus.FILLED, fill, position.getId(), null);
        log.info("SELL {} {}% filled: id={} amount={} price={} pnl={}",
                instrument.pair(), percentage, fill.orderId(), fill.filledAmount(), fill.averagePrice(), pnl);
        return ExecutionResult.filled(fill.orderId(), fill.averagePrice(), fill.filledAmount());
    }

    private ExecutionResult hold(Instrument instrument, TradeDecision decision, Trade trade) {
        if (!decision.hasAdjustment()) {
            ledger.complete(trade, TradeStatus.FILLED, null, null, null);
            log.info("HOLD {}: nothing to do", instrument.pair());
            return ExecutionResult.noOp();
        }
        Optional<Position> open = ledger.findOpenPosition(instrument);
        if (open.isEmpty()) {
            ledger.complete(trade, TradeStatus.FILLED, null, null, NO_POSITION_FOR_HOLD);
            log.info("HOLD {} with adjustments but no open position, treated as wait", instrument.pair());
            return ExecutionResult.noOp();
        }
        Position position = open.get();
        Double stopLoss = decision.stopLoss() != null ? decision.stopLoss() : position.getCurrentStopLoss();
        Double takeProfit = decision.takeProfit() != null ? decision.takeProfit() : position.getCurrentTakeProfit();
        protectionOrderService.replace(instrument, stopLoss, takeProfit);
        ledger.updateProtection(position, decision.stopLoss(), decision.takeProfit());
        ledger.complete(trade, TradeStatus.FILLED, null, position.getId(), null);
        log.info("HOLD {} protection updated: SL={} TP={}", instrument.pair(), stopLoss, takeProfit);
        return ExecutionResult.noOp();
    }

    static double realizedPnl(Position position, OrderFill fill) {
        return (fill.averagePrice() - position.getEntryPrice()) * fill.filledAmount() * position.getEntryLeverage();
    }

    /**
     * An order the exchange acknowledged but did not fill leaves nothing to record against the ledger.
     */
    private static void requireFill(Instrument instrument, OrderFill fill) {
        if (fill == null || fill.filledAmount() <= 0 || fill.averagePrice() <= 0) {
            throw new ExchangeGatewayException(String.format("Order %s for %s was acknowledged without a fill (status=%s)",
                    fill == null ? null : fill.orderId(), instrument.pair(), fill == null ? null : fill.status()));
        }
    }

    private static boolean isShort(OrderFill fill, double requested) {
        return fill.filledAmount() + FILL_TOLERANCE < requested;
    }

    private ExecutionResult failTrade(Trade trade, TradeDecision decision, String error) {
        if (trade.getStatus() != null && trade.getStatus().isTerminal()) {
            // the order went through; the failure came after the ledger was written
            return ExecutionResult.failed(error);
        }
        ledger.fail(trade, error);
        metricsService.recordTradeOutcome(decision.operation().name(), TradeStatus.FAILED.name());
        return ExecutionResult.failed(error);
    }

    private class LedgerLosses implements GuardContext.RealizedLosses {

        @Override
        public double daily() {
            return ledger.realizedPnlWithin(safetyLimits.dailyLossWindow());
        }

        @Override
        public double weekly() {
            return ledger.realizedPnlWithin(safetyLimits.weeklyLossWindow());
        }
    }
}
