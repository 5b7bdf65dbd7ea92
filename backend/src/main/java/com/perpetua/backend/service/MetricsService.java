package com.perpetua.backend.service;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

@Service
@RequiredArgsConstructor
public class MetricsService {

    private final MeterRegistry meterRegistry;

    private final AtomicLong ordersPlaced = new AtomicLong();
    private final AtomicLong gatewayFailures = new AtomicLong();
    private final ConcurrentHashMap<String, AtomicLong> rejectsByReason = new ConcurrentHashMap<>();
    private final AtomicReference<Double> portfolioLeverage = new AtomicReference<>(0.0);
    private final AtomicReference<Double> currentDrawdown = new AtomicReference<>(0.0);

    private Counter ordersPlacedCounter;
    private Counter gatewayFailuresCounter;
    private Counter cyclesCounter;
    private Counter malformedDecisionsCounter;

    @PostConstruct
    void init() {
        ordersPlacedCounter = Counter.builder("orders_placed_total").register(meterRegistry);
        gatewayFailuresCounter = Counter.builder("exchange_errors_total").register(meterRegistry);
        cyclesCounter = Counter.builder("trading_cycles_total").register(meterRegistry);
        malformedDecisionsCounter = Counter.builder("malformed_decisions_total").register(meterRegistry);
        Gauge.builder("portfolio_leverage", portfolioLeverage, AtomicReference::get).register(meterRegistry);
        Gauge.builder("drawdown_current", currentDrawdown, AtomicReference::get).register(meterRegistry);
    }

    public void incrementOrdersPlaced() {
        ordersPlaced.incrementAndGet();
        if (ordersPlacedCounter != null) {
            ordersPlacedCounter.increment();
        }
    }

    public void incrementGatewayFailures() {
        gatewayFailures.incrementAndGet();
        if (gatewayFailuresCounter != null) {
            gatewayFailuresCounter.increment();
        }
    }

    public void incrementCycles() {
        if (cyclesCounter != null) {
            cyclesCounter.increment();
        }
    }

    public void incrementMalformedDecisions() {
        if (malformedDecisionsCounter != null) {
            malformedDecisionsCounter.increment();
        }
    }

    public void recordGuardRejection(String reason) {
        if (reason == null) {
            return;
        }
        rejectsByReason.computeIfAbsent(reason, key -> new AtomicLong()).incrementAndGet();
        meterRegistry.counter("guard_rejections_total", "reason", reason).increment();
    }

    public void recordTradeOutcome(String operation, String status) {
        meterRegistry.counter("trades_total", "operation", operation, "status", status).increment();
    }

    public void updateRiskGauges(double leverage, double drawdown) {
        portfolioLeverage.set(leverage);
        currentDrawdown.set(drawdown);
    }

    public long getOrdersPlaced() {
        return ordersPlaced.get();
    }

    public long getGatewayFailures() {
        return gatewayFailures.get();
    }

    public Map<String, Long> getRejectsByReason() {
        Map<String, Long> snapshot = new ConcurrentHashMap<>();
        rejectsByReason.forEach((key, value) -> snapshot.put(key, value.get()));
        return snapshot;
    }
}
