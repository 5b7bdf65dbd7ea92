package com.perpetua.backend.trading.signal;

import com.perpetua.backend.config.TradingProperties;
import com.perpetua.backend.exception.ExchangeGatewayException;
import com.perpetua.backend.exception.TradingException;
import com.perpetua.backend.model.Candle;
import com.perpetua.backend.model.Instrument;
import com.perpetua.backend.model.PriceSeries;
import com.perpetua.backend.service.exchange.ExchangeGateway;
import com.perpetua.backend.service.indicator.AdxService;
import com.perpetua.backend.service.indicator.AdxService.AdxPoint;
import com.perpetua.backend.service.indicator.AtrService;
import com.perpetua.backend.service.indicator.BollingerBandService;
import com.perpetua.backend.service.indicator.BollingerBandService.BollingerBands;
import com.perpetua.backend.service.indicator.MacdService;
import com.perpetua.backend.service.indicator.MovingAverageService;
import com.perpetua.backend.service.indicator.PivotPointService;
import com.perpetua.backend.service.indicator.PivotPointService.PivotPoints;
import com.perpetua.backend.service.indicator.RsiDivergenceService;
import com.perpetua.backend.service.indicator.RsiDivergenceService.Divergence;
import com.perpetua.backend.service.indicator.RsiService;
import com.perpetua.backend.service.indicator.StochRsiService;
import com.perpetua.backend.service.indicator.StochRsiService.StochRsiPoint;
import com.perpetua.backend.service.indicator.VolatilityRegimeService;
import com.perpetua.backend.service.indicator.VolumeIndicatorService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.function.ToDoubleFunction;

@Slf4j
@Service
@RequiredArgsConstructor
public class MarketSignalAggregator {

    private static final int MOMENTUM_PERIOD = 5;

    private final ExchangeGateway exchangeGateway;
    private final TradingProperties tradingProperties;
    private final ConfluenceScorer confluenceScorer;
    private final MovingAverageService movingAverageService;
    private final MacdService macdService;
    private final RsiService rsiService;
    private final StochRsiService stochRsiService;
    private final AtrService atrService;
    private final AdxService adxService;
    private final BollingerBandService bollingerBandService;
    private final RsiDivergenceService rsiDivergenceService;
    private final VolumeIndicatorService volumeIndicatorService;
    private final VolatilityRegimeService volatilityRegimeService;
    private final PivotPointService pivotPointService;
    private final Clock clock;

    public MarketSnapshot snapshot(Instrument instrument) {
        TradingProperties.Market market = tradingProperties.getMarket();
        PriceSeries intraday = exchangeGateway.fetchOhlcv(instrument, market.getIntradayTimeframe(), market.getIntradayLimit());
        PriceSeries swing = exchangeGateway.fetchOhlcv(instrument, market.getSwingTimeframe(), market.getSwingLimit());
        PriceSeries daily = exchangeGateway.fetchOhlcv(instrument, market.getDailyTimeframe(), market.getDailyLimit());
        if (intraday.isEmpty() || swing.size() < 2 || daily.size() < 2) {
            throw new TradingException("Insufficient market data for " + instrument.pair());
        }
        double openInterest = optional(instrument, "open interest", exchangeGateway::fetchOpenInterest);
        double fundingRate = optional(instrument, "funding rate", exchangeGateway::fetchFundingRate);
        return build(instrument, intraday, swing, daily, openInterest, fundingRate);
    }

    MarketSnapshot build(Instrument instrument, PriceSeries intraday, PriceSeries swing, PriceSeries daily,
                         double openInterest, double fundingRate) {
        TradingProperties.Market market = tradingProperties.getMarket();
        List<Double> closes = swing.closes();
        List<Double> highs = swing.highs();
        List<Double> lows = swing.lows();
        List<Double> volumes = swing.volumes();
        double currentPrice = intraday.last().getClose();

        double emaFast = latest(movingAverageService.ema(closes, market.getEmaFast()));
        double emaSlow = latest(movingAverageService.ema(closes, market.getEmaSlow()));
        MacdService.MacdResult macd = macdService.calculate(closes);
        List<Double> rsiSeries = rsiService.calculate(closes, market.getRsiPeriod());
        List<Double> atrFastSeries = atrService.calculate(highs, lows, closes, market.getAtrFastPeriod());
        List<Double> atrSeries = atrService.calculate(highs, lows, closes, market.getAtrPeriod());
        List<AdxPoint> adxSeries = adxService.calculate(highs, lows, closes, market.getAdxPeriod());
        AdxPoint adx = adxSeries.isEmpty() ? new AdxPoint(0, 0, 0) : adxSeries.get(adxSeries.size() - 1);

        List<BollingerBands> bands = bollingerBandService.calculate(closes, market.getBollingerPeriod(), market.getBollingerStdDev());
        BollingerBands bollinger = bands.isEmpty()
                ? new BollingerBands(currentPrice, currentPrice, currentPrice, 0.0, 0.5)
                : bands.get(bands.size() - 1);
        List<StochRsiPoint> stochSeries = stochRsiService.calculate(closes);
        StochRsiPoint stochRsi = stochSeries.isEmpty() ? new StochRsiPoint(50, 50, 50) : stochSeries.get(stochSeries.size() - 1);
        Divergence divergence = rsiDivergenceService.detect(closes, rsiSeries, market.getDivergenceLookback());

        double vwap = latestOr(volumeIndicatorService.vwap(highs, lows, closes, volumes), closes.get(closes.size() - 1));
        MarketSnapshot.VwapPosition vwapPosition = currentPrice > vwap * (1 + market.getVwapBand())
                ? MarketSnapshot.VwapPosition.ABOVE
                : currentPrice < vwap * (1 - market.getVwapBand()) ? MarketSnapshot.VwapPosition.BELOW : MarketSnapshot.VwapPosition.AT;

        double averageVolume = volumes.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
        double volumeRatio = averageVolume > 0 ? swing.last().getVolume() / averageVolume : 0.0;

        PivotPoints pivots = pivotPointService.calculate(swing.fromEnd(1));
        PivotPoints dailyPivots = pivotPointService.calculate(daily.fromEnd(1));
        List<Double> dailyCloses = daily.closes();
        double dailyEmaFast = latest(movingAverageService.ema(dailyCloses, market.getEmaFast()));
        double dailyEmaSlow = latest(movingAverageService.ema(dailyCloses, market.getEmaSlow()));
        List<AdxPoint> dailyAdxSeries = adxService.calculate(daily.highs(), daily.lows(), dailyCloses, market.getAdxPeriod());
        double dailyAdx = dailyAdxSeries.isEmpty() ? 0.0 : dailyAdxSeries.get(dailyAdxSeries.size() - 1).adx();
        TrendDirection dailyTrend = dailyTrend(dailyEmaFast, dailyEmaSlow, market.getDailyTrendBand());

        double rsi = latestOr(rsiSeries, 50.0);
        double atr = latest(atrSeries);
        ConfluenceScore confluence = confluenceScorer.score(ConfluenceInputs.builder()
                .currentPrice(currentPrice)
                .emaFast(emaFast)
                .emaSlow(emaSlow)
                .dailyTrend(dailyTrend)
                .adx(adx.adx())
                .rsi(rsi)
                .stochRsi(stochRsi)
                .volumeRatio(volumeRatio)
                .fundingRate(fundingRate)
                .divergence(divergence)
                .pivots(pivots)
                .percentB(bollinger.percentB())
                .build());

        int tail = market.getSeriesTail();
        MarketSnapshot snapshot = MarketSnapshot.builder()
                .instrument(instrument)
                .currentPrice(currentPrice)
                .intraday(intradaySeries(intraday.closes(), market))
                .emaFast(emaFast)
                .emaSlow(emaSlow)
                .macd(macd.latestMacd())
                .macdSignal(macd.latestSignal())
                .macdHistogram(macd.latestHistogram())
                .macdHistogramTrend(macd.histogramTrend())
                .macdSeries(tail(macd.macd(), tail))
                .rsi(rsi)
                .rsiSeries(tail(rsiSeries, tail))
                .momentumAcceleration(latest(rsiService.momentumAcceleration(rsiSeries, MOMENTUM_PERIOD)))
                .atrFast(latest(atrFastSeries))
                .atr(atr)
                .adx(adx.adx())
                .plusDI(adx.plusDI())
                .minusDI(adx.minusDI())
                .bollinger(bollinger)
                .squeeze(bollingerBandService.squeeze(bands, market.getSqueezeLookback()))
                .stochRsi(stochRsi)
                .divergence(divergence)
                .vwap(vwap)
                .priceVsVwap(vwapPosition)
                .obvTrend(volumeIndicatorService.obvTrend(volumeIndicatorService.obv(closes, volumes), market.getObvTrendPeriod()))
                .volatilityRegime(volatilityRegimeService.classify(atrSeries, closes, market.getVolatilityLookback()))
                .volumeRatio(volumeRatio)
                .openInterest(openInterest)
                .fundingRate(fundingRate)
                .pivots(pivots)
                .dailyEmaFast(dailyEmaFast)
                .dailyEmaSlow(dailyEmaSlow)
                .dailyAdx(dailyAdx)
                .dailyTrend(dailyTrend)
                .dailyPivots(dailyPivots)
                .confluence(confluence)
                .suggestedLevels(confluenceScorer.suggestLevels(currentPrice, atr, pivots.s1(), pivots.r1()))
                .capturedAt(clock.instant())
                .build();
        log.info("Market snapshot {} price={} bullish={} bearish={} recommendation={}",
                instrument.pair(), currentPrice, confluence.bullishPoints(), confluence.bearishPoints(),
                confluence.recommendation());
        log.debug("Confluence factors for {}: {}", instrument.pair(), confluence.factors());
        return snapshot;
    }

    MarketSnapshot.IntradaySeries intradaySeries(List<Double> closes, TradingProperties.Market market) {
        int tail = market.getSeriesTail();
        List<Double> ema20 = movingAverageService.ema(closes, market.getEmaFast());
        List<Double> macd = macdService.calculate(closes).macd();
        List<Double> rsi7 = rsiService.calculate(closes, market.getIntradayRsiFastPeriod());
        List<Double> rsi14 = rsiService.calculate(closes, market.getRsiPeriod());
        return new MarketSnapshot.IntradaySeries(
                tail(closes, tail),
                tail(ema20, tail),
                tail(macd, tail),
                tail(rsi7, tail),
                tail(rsi14, tail),
                latest(ema20),
                latest(macd),
                latestOr(rsi7, 50.0));
    }

    private static List<Double> tail(List<Double> series, int size) {
        return List.copyOf(series.subList(Math.max(0, series.size() - size), series.size()));
    }

    static TrendDirection dailyTrend(double emaFast, double emaSlow, double band) {
        if (emaFast > emaSlow * (1 + band)) return TrendDirection.UP;
        if (emaFast < emaSlow * (1 - band)) return TrendDirection.DOWN;
        return TrendDirection.SIDEWAYS;
    }

    private double optional(Instrument instrument, String label, ToDoubleFunction<Instrument> fetch) {
        try {
            return fetch.applyAsDouble(instrument);
        } catch (ExchangeGatewayException e) {
            log.warn("Could not fetch {} for {}, scoring it as absent: {}", label, instrument.pair(), e.getMessage());
            return 0.0;
        }
    }

    private double latest(List<Double> series) {
        return movingAverageService.latest(series, 0.0);
    }

    private double latestOr(List<Double> series, double fallback) {
        return movingAverageService.latest(series, fallback);
    }
}
