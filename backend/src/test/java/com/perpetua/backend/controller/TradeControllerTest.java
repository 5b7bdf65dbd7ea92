package com.perpetua.backend.controller;

import com.perpetua.backend.exception.CycleInProgressException;
import com.perpetua.backend.model.Instrument;
import com.perpetua.backend.model.Position;
import com.perpetua.backend.model.Position.PositionStatus;
import com.perpetua.backend.model.Trade;
import com.perpetua.backend.model.Trade.Operation;
import com.perpetua.backend.model.Trade.TradeStatus;
import com.perpetua.backend.repository.PositionRepository;
import com.perpetua.backend.repository.TradeRepository;
import com.perpetua.backend.trading.cycle.TradingCycleService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest({TradeController.class, PositionController.class, CycleController.class})
class TradeControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private TradeRepository tradeRepository;

    @MockBean
    private PositionRepository positionRepository;

    @MockBean
    private TradingCycleService tradingCycleService;

    @Test
    void tradesBySymbolAcceptPairNotation() throws Exception {
        when(tradeRepository.findBySymbolOrderByCreatedAtDesc(Instrument.BTC)).thenReturn(List.of(Trade.builder()
                .id(1L)
                .symbol(Instrument.BTC)
                .operation(Operation.BUY)
                .status(TradeStatus.FILLED)
                .amount(0.002)
                .leverage(5)
                .createdAt(Instant.parse("2025-03-01T12:00:00Z"))
                .build()));

        mockMvc.perform(get("/api/trades").param("symbol", "BTC/USDT"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(1))
                .andExpect(jsonPath("$[0].symbol").value("BTC"))
                .andExpect(jsonPath("$[0].operation").value("BUY"))
                .andExpect(jsonPath("$[0].leverage").value(5));
    }

    @Test
    void unknownSymbolIsBadRequest() throws Exception {
        mockMvc.perform(get("/api/trades").param("symbol", "XRP"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Unsupported symbol: XRP"));
    }

    @Test
    void positionsFilteredByStatus() throws Exception {
        when(positionRepository.findByStatus(PositionStatus.OPEN)).thenReturn(List.of(Position.builder()
                .id(3L)
                .symbol(Instrument.ETH)
                .status(PositionStatus.OPEN)
                .entryPrice(3000.0)
                .entryAmount(0.1)
                .entryLeverage(3)
                .openedAt(Instant.parse("2025-03-01T12:00:00Z"))
                .build()));

        mockMvc.perform(get("/api/positions").param("status", "OPEN"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].pair").value("ETH/USDT"))
                .andExpect(jsonPath("$[0].realizedPnl").value(0.0));
    }

    @Test
    void overlappingCycleIsConflict() throws Exception {
        when(tradingCycleService.runCycle()).thenThrow(new CycleInProgressException("A trading cycle is already running"));

        mockMvc.perform(post("/api/cycle/run"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.message").value("A trading cycle is already running"));
    }
}
