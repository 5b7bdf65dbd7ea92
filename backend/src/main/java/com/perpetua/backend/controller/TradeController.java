package com.perpetua.backend.controller;

import com.perpetua.backend.dto.TradeDTO;
import com.perpetua.backend.model.Instrument;
import com.perpetua.backend.repository.TradeRepository;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/trades")
@RequiredArgsConstructor
@Tag(name = "Trades")
public class TradeController {

    private final TradeRepository tradeRepository;

    /**
     * Latest 50 trades, or every trade of one instrument when {@code symbol} is given
     * ("BTC", "BTCUSDT" or "BTC/USDT").
     */
    @GetMapping
    @Operation(summary = "List recorded trades, newest first")
    public ResponseEntity<List<TradeDTO>> getTrades(@RequestParam(required = false) String symbol) {
        List<TradeDTO> trades = (symbol == null || symbol.isBlank()
                ? tradeRepository.findTop50ByOrderByCreatedAtDesc()
                : tradeRepository.findBySymbolOrderByCreatedAtDesc(Instrument.fromPair(symbol)))
                .stream()
                .map(TradeDTO::from)
                .toList();
        return ResponseEntity.ok(trades);
    }
}
