package com.perpetua.backend.dto;

import com.perpetua.backend.model.Trade;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TradeDTO {
    private Long id;
    private String symbol;
    private String operation;
    private String status;
    private Double pricing;
    private Double amount;
    private Integer leverage;
    private Double percentage;
    private Double stopLoss;
    private Double takeProfit;
    private String exchangeOrderId;
    private Double executedPrice;
    private Double executedAmount;
    private Instant executedAt;
    private String error;
    private String advisorNote;
    private Long positionId;
    private Instant createdAt;

    public static TradeDTO from(Trade trade) {
        return TradeDTO.builder()
                .id(trade.getId())
                .symbol(trade.getSymbol().name())
                .operation(trade.getOperation().name())
                .status(trade.getStatus().name())
                .pricing(trade.getPricing())
                .amount(trade.getAmount())
                .leverage(trade.getLeverage())
                .percentage(trade.getPercentage())
                .stopLoss(trade.getStopLoss())
                .takeProfit(trade.getTakeProfit())
                .exchangeOrderId(trade.getExchangeOrderId())
                .executedPrice(trade.getExecutedPrice())
                .executedAmount(trade.getExecutedAmount())
                .executedAt(trade.getExecutedAt())
                .error(trade.getError())
                .advisorNote(trade.getAdvisorNote())
                .positionId(trade.getPositionId())
                .createdAt(trade.getCreatedAt())
                .build();
    }
}
