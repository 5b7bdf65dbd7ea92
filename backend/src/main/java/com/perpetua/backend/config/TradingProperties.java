package com.perpetua.backend.config;

import com.perpetua.backend.model.Instrument;
import com.perpetua.backend.trading.account.TradingMode;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Configuration
@ConfigurationProperties(prefix = "trading")
@Data
@Validated
public class TradingProperties {

    @Valid
    private Execution execution = new Execution();

    @Valid
    private Account account = new Account();

    @Valid
    private Confluence confluence = new Confluence();

    @Valid
    private Market market = new Market();

    @Valid
    private Cycle cycle = new Cycle();

    @Data
    public static class Execution {
        /** Simulate every order call instead of sending it to the exchange. */
        private boolean dryRun = true;
        /** Tighten leverage and risk-per-trade guards to the current trading mode. */
        private boolean enforceModeBudget = true;
        @Valid
        private Safety safety = new Safety();
    }

    @Data
    public static class Safety {
        @Min(1)
        private int minLeverage = 1;
        @Min(1)
        private int maxLeverage = 20;
        @Positive
        private double minTradeNotional = 10.0;
        @DecimalMin("0.0") @DecimalMax("1.0")
        private double minCashReserve = 0.25;
        @DecimalMin("0.0") @DecimalMax("1.0")
        private double maxPositionFraction = 0.5;
        @Positive
        private double maxPortfolioLeverage = 5.0;
        @DecimalMin("0.0") @DecimalMax("1.0")
        private double maxDailyLoss = 0.05;
        @DecimalMin("0.0") @DecimalMax("1.0")
        private double maxWeeklyLoss = 0.10;
        @DecimalMin("0.0") @DecimalMax("1.0")
        private double maxRiskPerTrade = 0.03;
        @Positive
        private double minRiskReward = 1.5;
        @DecimalMin("0.0") @DecimalMax("1.0")
        private double liquidationBuffer = 0.15;
        @DecimalMin("0.0") @DecimalMax("1.0")
        private double maintenanceMarginRate = 0.004;
        @NotNull
        private Duration dailyLossWindow = Duration.ofHours(24);
        @NotNull
        private Duration weeklyLossWindow = Duration.ofDays(7);
    }

    @Data
    public static class Account {
        @Positive
        private double initialCapital = 20.0;
        private double riskFreeRate = 0.0001;
        @Min(1)
        private int minTradesForSharpe = 5;
        @NotEmpty
        private String marginType = "future";
        @Valid
        @NotEmpty
        private List<ModeThreshold> modes = defaultModes();
    }

    /**
     * One row of the trading-mode table. A null upper bound matches any return.
     */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ModeThreshold {
        @NotNull
        private TradingMode mode;
        private Double returnUpperBound;
        @Positive
        private double maxRiskPct;
        @Min(1)
        private int maxLeverage;
        @Min(1)
        private int maxPositions;
    }

    @Data
    public static class Confluence {
        private double trendWeight = 2.0;
        private double dailyTrendWeight = 1.5;
        private double adxWeight = 1.5;
        private double rsiWeight = 1.0;
        private double stochRsiWeight = 1.0;
        private double volumeWeight = 0.5;
        private double fundingWeight = 0.5;
        private double divergenceWeight = 1.5;
        private double pivotWeight = 1.0;
        private double percentBWeight = 0.5;

        private double adxStrongTrend = 25.0;
        private double adxRangeBound = 20.0;
        private double rsiOversold = 30.0;
        private double rsiOverbought = 70.0;
        private double rsiNeutralLow = 40.0;
        private double rsiNeutralHigh = 60.0;
        private double stochOversold = 20.0;
        private double stochOverbought = 80.0;
        private double volumeSurgeRatio = 1.2;
        private double fundingBearishAbove = 0.0005;
        private double fundingBullishBelow = -0.0001;
        private double pivotProximityBelow = -0.005;
        private double pivotProximityAbove = 0.01;
        private double percentBLow = 0.2;
        private double percentBHigh = 0.8;

        private double strongBuyScore = 5.0;
        private double buyScore = 2.0;
        private double sellScore = -2.0;
        private double strongSellScore = -5.0;

        private double stopAtrMultiple = 1.5;
        private double targetAtrMultiple = 2.0;
        private double minRewardRatio = 1.5;
    }

    @Data
    public static class Market {
        private String intradayTimeframe = "1m";
        @Min(2)
        private int intradayLimit = 100;
        private String swingTimeframe = "4h";
        @Min(30)
        private int swingLimit = 100;
        private String dailyTimeframe = "1d";
        @Min(2)
        private int dailyLimit = 50;
        private int emaFast = 20;
        private int emaSlow = 50;
        private int rsiPeriod = 14;
        private int intradayRsiFastPeriod = 7;
        @Min(1)
        private int seriesTail = 10;
        private int atrFastPeriod = 3;
        private int atrPeriod = 14;
        private int adxPeriod = 14;
        private int bollingerPeriod = 20;
        private double bollingerStdDev = 2.0;
        private int squeezeLookback = 20;
        private int divergenceLookback = 14;
        private int obvTrendPeriod = 10;
        private int volatilityLookback = 14;
        private double dailyTrendBand = 0.002;
        private double vwapBand = 0.001;
    }

    @Data
    public static class Cycle {
        @NotEmpty
        private List<Instrument> instruments = new ArrayList<>(List.of(Instrument.BTC));
        @NotNull
        private Duration deadline = Duration.ofMinutes(5);
        private boolean schedulerEnabled = false;
        @Positive
        private long intervalSeconds = 300;
        @Min(1)
        private int fetchParallelism = 4;
    }

    static List<ModeThreshold> defaultModes() {
        List<ModeThreshold> modes = new ArrayList<>();
        modes.add(new ModeThreshold(TradingMode.SURVIVAL, -0.10, 0.005, 2, 1));
        modes.add(new ModeThreshold(TradingMode.DEFENSIVE, -0.05, 0.015, 3, 2));
        modes.add(new ModeThreshold(TradingMode.NORMAL, 0.10, 0.02, 5, 3));
        modes.add(new ModeThreshold(TradingMode.OFFENSIVE, 0.20, 0.025, 7, 4));
        modes.add(new ModeThreshold(TradingMode.AGGRESSIVE, null, 0.03, 10, 5));
        return modes;
    }
}
