package com.perpetua.backend.dto;

import com.perpetua.backend.model.Position;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PositionDTO {
    private Long id;
    private String symbol;
    private String pair;
    private String status;
    private Double entryPrice;
    private Double entryAmount;
    private Integer leverage;
    private Double stopLoss;
    private Double takeProfit;
    private Double exitPrice;
    private Double exitAmount;
    private String exitReason;
    private Double realizedPnl;
    private Instant openedAt;
    private Instant closedAt;

    public static PositionDTO from(Position position) {
        return PositionDTO.builder()
                .id(position.getId())
                .symbol(position.getSymbol().name())
                .pair(position.getSymbol().pair())
                .status(position.getStatus().name())
                .entryPrice(position.getEntryPrice())
                .entryAmount(position.getEntryAmount())
                .leverage(position.getEntryLeverage())
                .stopLoss(position.getCurrentStopLoss())
                .takeProfit(position.getCurrentTakeProfit())
                .exitPrice(position.getExitPrice())
                .exitAmount(position.getExitAmount())
                .exitReason(position.getExitReason() == null ? null : position.getExitReason().name())
                .realizedPnl(position.getRealizedPnl())
                .openedAt(position.getOpenedAt())
                .closedAt(position.getClosedAt())
                .build();
    }
}
