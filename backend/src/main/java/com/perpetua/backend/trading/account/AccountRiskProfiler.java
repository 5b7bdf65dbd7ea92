package com.perpetua.backend.trading.account;

import com.perpetua.backend.model.Instrument;
import com.perpetua.backend.model.Position;
import com.perpetua.backend.model.Position.PositionStatus;
import com.perpetua.backend.repository.PositionRepository;
import com.perpetua.backend.service.MetricsService;
import com.perpetua.backend.service.exchange.ExchangeGateway;
import com.perpetua.backend.service.exchange.ExchangeGateway.AccountBalance;
import com.perpetua.backend.service.exchange.ExchangeGateway.ExchangePosition;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.EnumSet;
import java.util.List;

/**
 * Builds the per-cycle {@link AccountRiskProfile} from live exchange state and the closed-position history.
 */
@Slf4j
public class AccountRiskProfiler {

    static final List<PositionStatus> CLOSED_STATUSES = List.of(PositionStatus.CLOSED, PositionStatus.LIQUIDATED);

    private final ExchangeGateway exchangeGateway;
    private final PositionRepository positionRepository;
    private final TradingModeTable modeTable;
    private final SharpeRatioCalculator sharpeRatioCalculator;
    private final PerformanceCalculator performanceCalculator;
    private final RiskMetricsCalculator riskMetricsCalculator;
    private final MetricsService metricsService;
    private final double initialCapital;
    private final String marginType;
    private final Clock clock;

    public AccountRiskProfiler(ExchangeGateway exchangeGateway,
                               PositionRepository positionRepository,
                               TradingModeTable modeTable,
                               ProfilerSettings settings,
                               MetricsService metricsService,
                               Clock clock) {
        this.exchangeGateway = exchangeGateway;
        this.positionRepository = positionRepository;
        this.modeTable = modeTable;
        this.initialCapital = settings.initialCapital();
        this.marginType = settings.marginType();
        this.sharpeRatioCalculator = new SharpeRatioCalculator(settings.initialCapital(), settings.riskFreeRate(), settings.minTradesForSharpe());
        this.performanceCalculator = new PerformanceCalculator();
        this.riskMetricsCalculator = new RiskMetricsCalculator();
        this.metricsService = metricsService;
        this.clock = clock;
    }

    public AccountRiskProfile profile() {
        AccountBalance balance = exchangeGateway.fetchBalance(marginType);
        List<ExchangePosition> positions = exchangeGateway.fetchPositions(EnumSet.allOf(Instrument.class));
        List<Double> closedPnls = positionRepository.findByStatusInOrderByClosedAtAsc(CLOSED_STATUSES).stream()
                .map(Position::getRealizedPnl)
                .toList();

        double returnOnCapital = (balance.total() - initialCapital) / initialCapital;
        double positionsValue = positions.stream().mapToDouble(p -> p.initialMargin() + p.unrealizedPnl()).sum();
        double contractValue = positions.stream().mapToDouble(ExchangePosition::contracts).sum();
        AccountSnapshot account = new AccountSnapshot(balance.total(), balance.free(), positionsValue, contractValue,
                returnOnCapital, positions);

        TradingModeTable.ModeBudget budget = modeTable.resolve(returnOnCapital);
        PerformanceMetrics performance = performanceCalculator.calculate(closedPnls);
        RiskMetrics risk = riskMetricsCalculator.calculate(positions, balance.total());
        double sharpe = sharpeRatioCalculator.calculate(closedPnls);

        if (metricsService != null) {
            metricsService.updateRiskGauges(risk.portfolioLeverage(), performance.currentDrawdown());
        }
        log.info("Account profile: equity={} free={} return={} mode={} sharpe={} leverage={} liquidationRisk={}",
                balance.total(), balance.free(), returnOnCapital, budget.mode(), sharpe,
                risk.portfolioLeverage(), risk.liquidationRisk());

        return new AccountRiskProfile(
                budget.mode(),
                budget.maxRiskPct(),
                budget.maxLeverage(),
                budget.maxPositions(),
                sharpe,
                performance,
                risk,
                account,
                clock.instant()
        );
    }

    public record ProfilerSettings(double initialCapital, double riskFreeRate, int minTradesForSharpe, String marginType) {}
}
