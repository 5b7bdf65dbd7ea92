package com.perpetua.backend.trading.cycle;

import com.perpetua.backend.model.Instrument;
import com.perpetua.backend.model.Trade.Operation;
import com.perpetua.backend.trading.account.TradingMode;

import java.time.Instant;
import java.util.List;

public record CycleReport(
        String cycleId,
        Instant startedAt,
        Instant finishedAt,
        TradingMode tradingMode,
        List<SymbolOutcome> outcomes
) {

    public CycleReport {
        outcomes = List.copyOf(outcomes);
    }

    public long count(OutcomeStatus status) {
        return outcomes.stream().filter(o -> o.status() == status).count();
    }

    public record SymbolOutcome(
            Instrument instrument,
            OutcomeStatus status,
            Operation operation,
            String orderId,
            String message
    ) {
        static SymbolOutcome skipped(Instrument instrument, String message) {
            return new SymbolOutcome(instrument, OutcomeStatus.SKIPPED, null, null, message);
        }

        static SymbolOutcome failed(Instrument instrument, Operation operation, String message) {
            return new SymbolOutcome(instrument, OutcomeStatus.FAILED, operation, null, message);
        }
    }

    public enum OutcomeStatus {
        EXECUTED,
        FAILED,
        REJECTED_DECISION,
        SKIPPED
    }
}
