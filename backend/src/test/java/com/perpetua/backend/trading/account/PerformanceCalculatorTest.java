package com.perpetua.backend.trading.account;

import org.assertj.core.data.Offset;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class PerformanceCalculatorTest {

    private final PerformanceCalculator calculator = new PerformanceCalculator();

    @Test
    void summarizesWinsLossesAndStreaks() {
        PerformanceMetrics metrics = calculator.calculate(List.of(10.0, -5.0, -5.0, 20.0));

        assertThat(metrics.totalTrades()).isEqualTo(4);
        assertThat(metrics.winningTrades()).isEqualTo(2);
        assertThat(metrics.losingTrades()).isEqualTo(2);
        assertThat(metrics.winRate()).isEqualTo(0.5);
        assertThat(metrics.profitFactor()).isCloseTo(3.0, Offset.offset(1e-9));
        assertThat(metrics.averageWin()).isEqualTo(15.0);
        assertThat(metrics.averageLoss()).isEqualTo(5.0);
        assertThat(metrics.largestWin()).isEqualTo(20.0);
        assertThat(metrics.largestLoss()).isEqualTo(5.0);
        assertThat(metrics.consecutiveLosses()).isEqualTo(2);
        assertThat(metrics.consecutiveWins()).isEqualTo(1);
    }

    @Test
    void drawdownMeasuredFromRunningPeak() {
        PerformanceMetrics metrics = calculator.calculate(List.of(10.0, -5.0, -5.0, 20.0));

        assertThat(metrics.maxDrawdown()).isCloseTo(1.0, Offset.offset(1e-9));
        assertThat(metrics.currentDrawdown()).isZero();

        PerformanceMetrics underwater = calculator.calculate(List.of(10.0, -4.0));
        assertThat(underwater.currentDrawdown()).isCloseTo(0.4, Offset.offset(1e-9));
    }

    @Test
    void emptyHistoryYieldsEmptyMetrics() {
        assertThat(calculator.calculate(List.of())).isEqualTo(PerformanceMetrics.empty());
    }
}
