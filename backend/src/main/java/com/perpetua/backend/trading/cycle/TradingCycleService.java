package com.perpetua.backend.trading.cycle;

import com.perpetua.backend.config.TradingProperties;
import com.perpetua.backend.exception.CycleInProgressException;
import com.perpetua.backend.exception.DecisionValidationException;
import com.perpetua.backend.model.Instrument;
import com.perpetua.backend.model.Position;
import com.perpetua.backend.service.MetricsService;
import com.perpetua.backend.trading.account.AccountRiskProfile;
import com.perpetua.backend.trading.account.AccountRiskProfiler;
import com.perpetua.backend.trading.cycle.CycleReport.OutcomeStatus;
import com.perpetua.backend.trading.cycle.CycleReport.SymbolOutcome;
import com.perpetua.backend.trading.execution.CycleContext;
import com.perpetua.backend.trading.execution.DecisionParser;
import com.perpetua.backend.trading.execution.ExecutionResult;
import com.perpetua.backend.trading.execution.TradeDecision;
import com.perpetua.backend.trading.execution.TradeExecutionEngine;
import com.perpetua.backend.trading.execution.TradeLedger;
import com.perpetua.backend.trading.signal.MarketSignalAggregator;
import com.perpetua.backend.trading.signal.MarketSnapshot;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One evaluation cycle over the configured instruments: profile the account once, gather
 * market snapshots and advisor decisions in parallel, then execute decisions one symbol at a time.
 */
@Slf4j
@Service
public class TradingCycleService {

    private final AccountRiskProfiler accountRiskProfiler;
    private final MarketSignalAggregator marketSignalAggregator;
    private final TradingAdvisor tradingAdvisor;
    private final DecisionParser decisionParser;
    private final TradeExecutionEngine executionEngine;
    private final TradeLedger ledger;
    private final TradingProperties tradingProperties;
    private final MetricsService metricsService;
    private final Executor cycleExecutor;
    private final Clock clock;

    private final AtomicBoolean running = new AtomicBoolean(false);

    public TradingCycleService(AccountRiskProfiler accountRiskProfiler,
                               MarketSignalAggregator marketSignalAggregator,
                               TradingAdvisor tradingAdvisor,
                               DecisionParser decisionParser,
                               TradeExecutionEngine executionEngine,
                               TradeLedger ledger,
                               TradingProperties tradingProperties,
                               MetricsService metricsService,
                               @Qualifier("cycleExecutor") Executor cycleExecutor,
                               Clock clock) {
        this.accountRiskProfiler = accountRiskProfiler;
        this.marketSignalAggregator = marketSignalAggregator;
        this.tradingAdvisor = tradingAdvisor;
        this.decisionParser = decisionParser;
        this.executionEngine = executionEngine;
        this.ledger = ledger;
        this.tradingProperties = tradingProperties;
        this.metricsService = metricsService;
        this.cycleExecutor = cycleExecutor;
        this.clock = clock;
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * @throws CycleInProgressException if another cycle has not finished yet
     */
    public CycleReport runCycle() {
        if (!running.compareAndSet(false, true)) {
            throw new CycleInProgressException("A trading cycle is already running");
        }
        try {
            return doRunCycle();
        } finally {
            running.set(false);
        }
    }

    private CycleReport doRunCycle() {
        TradingProperties.Cycle settings = tradingProperties.getCycle();
        Instant startedAt = clock.instant();
        Duration deadline = settings.getDeadline();
        AccountRiskProfile profile = accountRiskProfiler.profile();
        CycleContext cycle = new CycleContext(profile, startedAt, startedAt.plus(deadline));
        List<Instrument> instruments = List.copyOf(settings.getInstruments());
        metricsService.incrementCycles();
        log.info("🔄 Cycle {} started: mode={} equity={} instruments={}",
                cycle.getCycleId(), profile.tradingMode(), cycle.totalEquity(), instruments);

        Map<Instrument, CompletableFuture<Proposal>> proposals = new LinkedHashMap<>();
        for (Instrument instrument : instruments) {
            proposals.put(instrument, CompletableFuture.supplyAsync(() -> propose(instrument, cycle), cycleExecutor));
        }

        List<SymbolOutcome> outcomes = new ArrayList<>();
        boolean interrupted = false;
        for (Map.Entry<Instrument, CompletableFuture<Proposal>> entry : proposals.entrySet()) {
            Instrument instrument = entry.getKey();
            CompletableFuture<Proposal> future = entry.getValue();
            if (interrupted) {
                future.cancel(true);
                outcomes.add(SymbolOutcome.skipped(instrument, "Cycle interrupted"));
                continue;
            }
            long remainingMs = Duration.between(clock.instant(), cycle.getDeadline()).toMillis();
            if (remainingMs <= 0) {
                future.cancel(true);
                log.warn("⏱ Cycle deadline passed, skipping {}", instrument.pair());
                outcomes.add(SymbolOutcome.skipped(instrument, "Cycle deadline exceeded"));
                continue;
            }
            try {
                Proposal proposal = future.get(remainingMs, TimeUnit.MILLISECONDS);
                outcomes.add(execute(instrument, proposal, cycle));
            } catch (TimeoutException e) {
                future.cancel(true);
                log.warn("⏱ Cycle deadline reached while preparing {}, skipping", instrument.pair());
                outcomes.add(SymbolOutcome.skipped(instrument, "Cycle deadline exceeded"));
            } catch (ExecutionException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                log.warn("Could not prepare decision for {}: {}", instrument.pair(), cause.getMessage());
                outcomes.add(SymbolOutcome.failed(instrument, null, cause.getMessage()));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                interrupted = true;
                log.warn("Cycle {} interrupted while waiting for {}", cycle.getCycleId(), instrument.pair());
                outcomes.add(SymbolOutcome.skipped(instrument, "Cycle interrupted"));
            }
        }

        CycleReport report = new CycleReport(cycle.getCycleId(), startedAt, clock.instant(), profile.tradingMode(), outcomes);
        log.info("✅ Cycle {} finished: executed={} failed={} rejected={} skipped={}",
                report.cycleId(),
                report.count(OutcomeStatus.EXECUTED),
                report.count(OutcomeStatus.FAILED),
                report.count(OutcomeStatus.REJECTED_DECISION),
                report.count(OutcomeStatus.SKIPPED));
        return report;
    }

    private Proposal propose(Instrument instrument, CycleContext cycle) {
        MarketSnapshot snapshot = marketSignalAggregator.snapshot(instrument);
        Position openPosition = ledger.findOpenPosition(instrument).orElse(null);
        AdvisorRequest request = AdvisorRequest.of(cycle.getCycleId(), snapshot, cycle.getProfile(), openPosition, clock.instant());
        return new Proposal(snapshot, tradingAdvisor.decide(request));
    }

    private SymbolOutcome execute(Instrument instrument, Proposal proposal, CycleContext cycle) {
        TradeDecision decision;
        try {
            decision = decisionParser.parse(proposal.rawDecision());
        } catch (DecisionValidationException e) {
            metricsService.incrementMalformedDecisions();
            log.warn("Malformed decision for {}: {} {}", instrument.pair(), e.getMessage(), e.getViolations());
            ledger.recordRejectedDecision(instrument, e.getMessage(), proposal.rawDecision());
            return new SymbolOutcome(instrument, OutcomeStatus.REJECTED_DECISION, null, null, e.getMessage());
        }
        try {
            ExecutionResult result = executionEngine.execute(instrument, decision, cycle);
            return new SymbolOutcome(instrument,
                    result.success() ? OutcomeStatus.EXECUTED : OutcomeStatus.FAILED,
                    decision.operation(),
                    result.orderId(),
                    result.error());
        } catch (RuntimeException e) {
            log.error("❌ Execution of {} for {} failed", decision.operation(), instrument.pair(), e);
            return SymbolOutcome.failed(instrument, decision.operation(), e.getMessage());
        }
    }

    private record Proposal(MarketSnapshot snapshot, String rawDecision) {}
}
