package com.perpetua.backend.trading.execution;

import com.perpetua.backend.model.Instrument;
import com.perpetua.backend.model.Position;
import com.perpetua.backend.model.Position.ExitReason;
import com.perpetua.backend.model.Position.PositionStatus;
import com.perpetua.backend.model.Trade;
import com.perpetua.backend.model.Trade.Operation;
import com.perpetua.backend.model.Trade.TradeStatus;
import com.perpetua.backend.repository.PositionRepository;
import com.perpetua.backend.repository.TradeRepository;
import com.perpetua.backend.service.exchange.ExchangeGateway.OrderFill;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Position and trade persistence for the execution engine. Nothing else writes these tables.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TradeLedger {

    private static final List<PositionStatus> REALIZED_STATUSES = List.of(PositionStatus.CLOSED, PositionStatus.LIQUIDATED);
    private static final int MAX_ERROR_LENGTH = 1000;
    private static final int MAX_NOTE_LENGTH = 4000;

    private final TradeRepository tradeRepository;
    private final PositionRepository positionRepository;
    private final TradeStateMachine stateMachine;
    private final Clock clock;

    @Transactional
    public Trade openTrade(Instrument instrument, TradeDecision decision) {
        Trade.TradeBuilder builder = Trade.builder()
                .symbol(instrument)
                .operation(decision.operation())
                .status(TradeStatus.PENDING)
                .stopLoss(decision.stopLoss())
                .takeProfit(decision.takeProfit())
                .advisorNote(truncate(decision.chat(), MAX_NOTE_LENGTH))
                .createdAt(clock.instant());
        if (decision.buy() != null) {
            builder.pricing(decision.buy().pricing())
                    .amount(decision.buy().amount())
                    .leverage(decision.buy().leverage());
        }
        if (decision.sell() != null) {
            builder.percentage(decision.sell().percentage());
        }
        return tradeRepository.save(builder.build());
    }

    /**
     * Audit row for a decision that could not be parsed; stored as a failed Hold.
     */
    @Transactional
    public Trade recordRejectedDecision(Instrument instrument, String error, String rawDecision) {
        Trade trade = Trade.builder()
                .symbol(instrument)
                .operation(Operation.HOLD)
                .status(TradeStatus.FAILED)
                .error(truncate(error, MAX_ERROR_LENGTH))
                .advisorNote(truncate(rawDecision, MAX_NOTE_LENGTH))
                .createdAt(clock.instant())
                .build();
        return tradeRepository.save(trade);
    }

    @Transactional
    public Trade markExecuting(Trade trade) {
        stateMachine.transition(trade, TradeStatus.EXECUTING);
        return tradeRepository.save(trade);
    }

    @Transactional
    public Trade fail(Trade trade, String error) {
        stateMachine.transition(trade, TradeStatus.FAILED);
        trade.setError(truncate(error, MAX_ERROR_LENGTH));
        return tradeRepository.save(trade);
    }

    @Transactional
    public Trade complete(Trade trade, TradeStatus status, OrderFill fill, Long positionId, String note) {
        stateMachine.transition(trade, status);
        trade.setExecutedAt(clock.instant());
        if (fill != null) {
            trade.setExchangeOrderId(fill.orderId());
            trade.setExecutedPrice(fill.averagePrice());
            trade.setExecutedAmount(fill.filledAmount());
        }
        trade.setPositionId(positionId);
        if (note != null) {
            trade.setError(truncate(note, MAX_ERROR_LENGTH));
        }
        return tradeRepository.save(trade);
    }

    @Transactional(readOnly = true)
    public Optional<Position> findOpenPosition(Instrument instrument) {
        return positionRepository.findFirstBySymbolAndStatus(instrument, PositionStatus.OPEN);
    }

    @Transactional
    public Position openPosition(Instrument instrument, OrderFill fill, int leverage, Double stopLoss, Double takeProfit) {
        if (positionRepository.countBySymbolAndStatus(instrument, PositionStatus.OPEN) > 0) {
            throw new IllegalStateException("Open position already exists for " + instrument.pair());
        }
        Position position = Position.builder()
                .symbol(instrument)
                .status(PositionStatus.OPEN)
                .entryPrice(fill.averagePrice())
                .entryAmount(fill.filledAmount())
                .entryLeverage(leverage)
                .entryOrderId(fill.orderId())
                .currentStopLoss(stopLoss)
                .currentTakeProfit(takeProfit)
                .realizedPnl(0.0)
                .openedAt(clock.instant())
                .build();
        Position saved = positionRepository.save(position);
        log.info("Opened position {} {} amount={} entry={} leverage={}x",
                saved.getId(), instrument.pair(), fill.filledAmount(), fill.averagePrice(), leverage);
        return saved;
    }

    @Transactional
    public Position reducePosition(Position position, double filledAmount, double pnl) {
        position.setEntryAmount(position.getEntryAmount() - filledAmount);
        position.setRealizedPnl(position.getRealizedPnl() + pnl);
        Position saved = positionRepository.save(position);
        log.info("Reduced position {} by {} to {} pnl={} total={}",
                saved.getId(), filledAmount, saved.getEntryAmount(), pnl, saved.getRealizedPnl());
        return saved;
    }

    @Transactional
    public Position closePosition(Position position, OrderFill fill, double pnl, ExitReason reason) {
        position.setStatus(PositionStatus.CLOSED);
        position.setExitPrice(fill.averagePrice());
        position.setExitAmount(fill.filledAmount());
        position.setExitOrderId(fill.orderId());
        position.setExitReason(reason);
        position.setRealizedPnl(position.getRealizedPnl() + pnl);
        position.setClosedAt(clock.instant());
        Position saved = positionRepository.save(position);
        log.info("Closed position {} {} exit={} amount={} realizedPnl={}",
                saved.getId(), saved.getSymbol().pair(), fill.averagePrice(), fill.filledAmount(), saved.getRealizedPnl());
        return saved;
    }

    /**
     * Only non-null levels are written.
     */
    @Transactional
    public Position updateProtection(Position position, Double stopLoss, Double takeProfit) {
        if (stopLoss != null) {
            position.setCurrentStopLoss(stopLoss);
        }
        if (takeProfit != null) {
            position.setCurrentTakeProfit(takeProfit);
        }
        return positionRepository.save(position);
    }

    @Transactional(readOnly = true)
    public double realizedPnlWithin(Duration window) {
        Instant since = clock.instant().minus(window);
        return positionRepository.findByStatusInAndClosedAtGreaterThanEqual(REALIZED_STATUSES, since).stream()
                .mapToDouble(p -> p.getRealizedPnl() == null ? 0.0 : p.getRealizedPnl())
                .sum();
    }

    private static String truncate(String value, int max) {
        if (value == null || value.length() <= max) {
            return value;
        }
        return value.substring(0, max);
    }
}
