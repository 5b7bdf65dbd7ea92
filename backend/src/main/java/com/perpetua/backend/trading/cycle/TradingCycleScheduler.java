package com.perpetua.backend.trading.cycle;

import com.perpetua.backend.exception.CycleInProgressException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "trading.cycle.scheduler-enabled", havingValue = "true")
public class TradingCycleScheduler {

    private final TradingCycleService tradingCycleService;

    @Scheduled(fixedDelayString = "${trading.cycle.interval-seconds:300}000")
    public void runCycle() {
        try {
            tradingCycleService.runCycle();
        } catch (CycleInProgressException e) {
            log.info("Previous cycle still running, skipping this tick");
        } catch (RuntimeException e) {
            log.error("❌ Scheduled trading cycle failed", e);
        }
    }
}
