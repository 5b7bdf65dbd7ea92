package com.perpetua.backend.config;

import com.perpetua.backend.repository.PositionRepository;
import com.perpetua.backend.service.MetricsService;
import com.perpetua.backend.service.exchange.BinanceFuturesGateway;
import com.perpetua.backend.service.exchange.DryRunExchangeGateway;
import com.perpetua.backend.service.exchange.ExchangeGateway;
import com.perpetua.backend.trading.account.AccountRiskProfiler;
import com.perpetua.backend.trading.account.TradingModeTable;
import com.perpetua.backend.trading.execution.BuyGuardPipeline;
import com.perpetua.backend.trading.execution.SafetyLimits;
import com.perpetua.backend.trading.signal.ConfluenceScorer;
import com.perpetua.backend.trading.signal.ConfluenceWeights;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

import java.time.Clock;

/**
 * Turns the mutable {@link TradingProperties} into the immutable values the trading core is built with.
 */
@Slf4j
@Configuration
public class TradingConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    @Primary
    public ExchangeGateway exchangeGateway(BinanceFuturesGateway binanceFuturesGateway,
                                           TradingProperties tradingProperties,
                                           Clock clock) {
        if (tradingProperties.getExecution().isDryRun()) {
            log.warn("DRY_RUN enabled: orders are simulated, market data and balances come from the exchange");
            return new DryRunExchangeGateway(binanceFuturesGateway, clock);
        }
        log.warn("LIVE trading enabled: orders are sent to the exchange");
        return binanceFuturesGateway;
    }

    @Bean
    public SafetyLimits safetyLimits(TradingProperties tradingProperties) {
        return SafetyLimits.from(tradingProperties.getExecution());
    }

    @Bean
    public BuyGuardPipeline buyGuardPipeline(SafetyLimits safetyLimits) {
        return new BuyGuardPipeline(safetyLimits);
    }

    @Bean
    public TradingModeTable tradingModeTable(TradingProperties tradingProperties) {
        return TradingModeTable.from(tradingProperties.getAccount().getModes());
    }

    @Bean
    public ConfluenceWeights confluenceWeights(TradingProperties tradingProperties) {
        return ConfluenceWeights.from(tradingProperties.getConfluence());
    }

    @Bean
    public ConfluenceScorer confluenceScorer(ConfluenceWeights confluenceWeights) {
        return new ConfluenceScorer(confluenceWeights);
    }

    @Bean
    public AccountRiskProfiler accountRiskProfiler(ExchangeGateway exchangeGateway,
                                                   PositionRepository positionRepository,
                                                   TradingModeTable tradingModeTable,
                                                   TradingProperties tradingProperties,
                                                   MetricsService metricsService,
                                                   Clock clock) {
        TradingProperties.Account account = tradingProperties.getAccount();
        AccountRiskProfiler.ProfilerSettings settings = new AccountRiskProfiler.ProfilerSettings(
                account.getInitialCapital(),
                account.getRiskFreeRate(),
                account.getMinTradesForSharpe(),
                account.getMarginType());
        return new AccountRiskProfiler(exchangeGateway, positionRepository, tradingModeTable, settings, metricsService, clock);
    }
}
