package com.perpetua.backend.controller;

import com.perpetua.backend.trading.cycle.CycleReport;
import com.perpetua.backend.trading.cycle.TradingCycleService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@Slf4j
@RestController
@RequestMapping("/api/cycle")
@RequiredArgsConstructor
@Tag(name = "Cycle")
public class CycleController {

    private final TradingCycleService tradingCycleService;

    @PostMapping("/run")
    @Operation(summary = "Run one trading cycle now; 409 if a cycle is already running")
    public ResponseEntity<CycleReport> runCycle() {
        log.info("⚡ Manual cycle triggered");
        return ResponseEntity.ok(tradingCycleService.runCycle());
    }
}
