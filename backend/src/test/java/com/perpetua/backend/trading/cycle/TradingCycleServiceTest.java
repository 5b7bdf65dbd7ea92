package com.perpetua.backend.trading.cycle;

import com.perpetua.backend.config.TradingProperties;
import com.perpetua.backend.exception.ExchangeGatewayException;
import com.perpetua.backend.model.Instrument;
import com.perpetua.backend.model.Trade.Operation;
import com.perpetua.backend.service.MetricsService;
import com.perpetua.backend.trading.account.AccountRiskProfile;
import com.perpetua.backend.trading.account.AccountRiskProfiler;
import com.perpetua.backend.trading.account.AccountSnapshot;
import com.perpetua.backend.trading.account.PerformanceMetrics;
import com.perpetua.backend.trading.account.TradingMode;
import com.perpetua.backend.trading.cycle.CycleReport.OutcomeStatus;
import com.perpetua.backend.trading.cycle.CycleReport.SymbolOutcome;
import com.perpetua.backend.trading.execution.DecisionParser;
import com.perpetua.backend.trading.execution.ExecutionResult;
import com.perpetua.backend.trading.execution.TradeExecutionEngine;
import com.perpetua.backend.trading.execution.TradeLedger;
import com.perpetua.backend.trading.signal.MarketSnapshot;
import com.perpetua.backend.trading.signal.MarketSignalAggregator;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import jakarta.validation.Validation;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.startsWith;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class TradingCycleServiceTest {

    private static final Instant NOW = Instant.parse("2025-03-01T12:00:00Z");

    private AccountRiskProfiler profiler;
    private MarketSignalAggregator aggregator;
    private TradingAdvisor advisor;
    private TradeExecutionEngine engine;
    private TradeLedger ledger;
    private TradingCycleService service;

    @BeforeEach
    void setUp() {
        profiler = mock(AccountRiskProfiler.class);
        aggregator = mock(MarketSignalAggregator.class);
        advisor = mock(TradingAdvisor.class);
        engine = mock(TradeExecutionEngine.class);
        ledger = mock(TradeLedger.class);

        TradingProperties properties = new TradingProperties();
        properties.getCycle().setInstruments(List.of(Instrument.BTC, Instrument.ETH, Instrument.SOL));

        when(profiler.profile()).thenReturn(profile());
        when(ledger.findOpenPosition(any())).thenReturn(Optional.empty());
        for (Instrument instrument : Instrument.values()) {
            when(aggregator.snapshot(instrument)).thenReturn(MarketSnapshot.builder().instrument(instrument).build());
        }

        service = new TradingCycleService(profiler, aggregator, advisor,
                new DecisionParser(Validation.buildDefaultValidatorFactory().getValidator()),
                engine, ledger, properties, new MetricsService(new SimpleMeterRegistry()),
                Runnable::run, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void executesEachInstrumentInOrder() {
        when(advisor.decide(any())).thenReturn("{\"operation\":\"Hold\"}");
        when(engine.execute(any(), any(), any())).thenReturn(ExecutionResult.noOp());

        CycleReport report = service.runCycle();

        assertThat(report.tradingMode()).isEqualTo(TradingMode.NORMAL);
        assertThat(report.outcomes()).extracting(SymbolOutcome::instrument)
                .containsExactly(Instrument.BTC, Instrument.ETH, Instrument.SOL);
        assertThat(report.count(OutcomeStatus.EXECUTED)).isEqualTo(3);
        assertThat(report.outcomes()).extracting(SymbolOutcome::operation).containsOnly(Operation.HOLD);
        verify(profiler, times(1)).profile();
        assertThat(service.isRunning()).isFalse();
    }

    @Test
    void symbolFailureDoesNotStopCycle() {
        when(aggregator.snapshot(Instrument.ETH)).thenThrow(new ExchangeGatewayException("klines unavailable"));
        when(advisor.decide(any())).thenReturn("{\"operation\":\"Hold\"}");
        when(engine.execute(any(), any(), any())).thenReturn(ExecutionResult.noOp());

        CycleReport report = service.runCycle();

        assertThat(report.outcomes()).hasSize(3);
        SymbolOutcome eth = report.outcomes().get(1);
        assertThat(eth.status()).isEqualTo(OutcomeStatus.FAILED);
        assertThat(eth.message()).isEqualTo("klines unavailable");
        assertThat(report.outcomes().get(2).status()).isEqualTo(OutcomeStatus.EXECUTED);
        verify(engine, never()).execute(eq(Instrument.ETH), any(), any());
    }

    @Test
    void malformedDecisionIsAuditedAndSkipped() {
        when(advisor.decide(any())).thenAnswer(inv -> {
            AdvisorRequest request = inv.getArgument(0);
            return request.instrument() == Instrument.BTC
                    ? "{\"operation\":\"Buy\",\"leverage\":\"high\"}"
                    : "{\"operation\":\"Hold\"}";
        });
        when(engine.execute(any(), any(), any())).thenReturn(ExecutionResult.noOp());

        CycleReport report = service.runCycle();

        assertThat(report.outcomes().get(0).status()).isEqualTo(OutcomeStatus.REJECTED_DECISION);
        assertThat(report.count(OutcomeStatus.EXECUTED)).isEqualTo(2);
        verify(ledger).recordRejectedDecision(eq(Instrument.BTC), startsWith("Malformed trade decision"),
                eq("{\"operation\":\"Buy\",\"leverage\":\"high\"}"));
        verify(engine, never()).execute(eq(Instrument.BTC), any(), any());
    }

    @Test
    void failedExecutionReportedAsFailed() {
        when(advisor.decide(any())).thenReturn("{\"operation\":\"Sell\",\"sell\":{\"percentage\":50}}");
        when(engine.execute(any(), any(), any())).thenReturn(ExecutionResult.failed("No open position found"));

        CycleReport report = service.runCycle();

        assertThat(report.count(OutcomeStatus.FAILED)).isEqualTo(3);
        assertThat(report.outcomes()).extracting(SymbolOutcome::message).containsOnly("No open position found");
    }

    @Test
    void overlappingCycleRefused() {
        when(advisor.decide(any())).thenAnswer(inv -> {
            service.runCycle();
            return "{\"operation\":\"Hold\"}";
        });

        CycleReport report = service.runCycle();

        assertThat(report.outcomes()).allSatisfy(outcome -> {
            assertThat(outcome.status()).isEqualTo(OutcomeStatus.FAILED);
            assertThat(outcome.message()).isEqualTo("A trading cycle is already running");
        });
        verify(profiler, times(1)).profile();
        assertThat(service.isRunning()).isFalse();
    }

    @Test
    void advisorSeesCycleIdAndAccountProfile() {
        when(advisor.decide(any())).thenReturn("{\"operation\":\"Hold\"}");
        when(engine.execute(any(), any(), any())).thenReturn(ExecutionResult.noOp());

        CycleReport report = service.runCycle();

        ArgumentCaptor<AdvisorRequest> captor = ArgumentCaptor.forClass(AdvisorRequest.class);
        verify(advisor, times(3)).decide(captor.capture());
        assertThat(captor.getAllValues()).allSatisfy(request -> {
            assertThat(request.cycleId()).isEqualTo(report.cycleId());
            assertThat(request.account().tradingMode()).isEqualTo(TradingMode.NORMAL);
            assertThat(request.openPosition()).isNull();
            assertThat(request.requestedAt()).isEqualTo(NOW);
        });
        assertThat(captor.getAllValues().get(0).pair()).isEqualTo("BTC/USDT");
    }

    @Test
    void symbolsLeftAfterDeadlineAreSkipped() {
        TradingProperties properties = new TradingProperties();
        properties.getCycle().setInstruments(List.of(Instrument.BTC, Instrument.ETH, Instrument.SOL));
        properties.getCycle().setDeadline(Duration.ofSeconds(30));
        SteppingClock clock = new SteppingClock(NOW);
        TradingCycleService slowService = new TradingCycleService(profiler, aggregator, advisor,
                new DecisionParser(Validation.buildDefaultValidatorFactory().getValidator()),
                engine, ledger, properties, new MetricsService(new SimpleMeterRegistry()),
                Runnable::run, clock);
        when(advisor.decide(any())).thenReturn("{\"operation\":\"Hold\"}");
        when(engine.execute(eq(Instrument.BTC), any(), any())).thenAnswer(inv -> {
            clock.advance(Duration.ofSeconds(31));
            return ExecutionResult.noOp();
        });

        CycleReport report = slowService.runCycle();

        assertThat(report.outcomes()).extracting(SymbolOutcome::status)
                .containsExactly(OutcomeStatus.EXECUTED, OutcomeStatus.SKIPPED, OutcomeStatus.SKIPPED);
        assertThat(report.outcomes().get(2).message()).isEqualTo("Cycle deadline exceeded");
        verify(engine, never()).execute(eq(Instrument.ETH), any(), any());
        verify(engine, never()).execute(eq(Instrument.SOL), any(), any());
        assertThat(slowService.isRunning()).isFalse();
    }

    private static AccountRiskProfile profile() {
        AccountSnapshot account = new AccountSnapshot(500, 400, 0, 0, 0, List.of());
        return new AccountRiskProfile(TradingMode.NORMAL, 0.02, 5, 3, 0.0, PerformanceMetrics.empty(),
                null, account, NOW);
    }

    private static final class SteppingClock extends Clock {

        private Instant now;

        SteppingClock(Instant start) {
            this.now = start;
        }

        void advance(Duration step) {
            now = now.plus(step);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
