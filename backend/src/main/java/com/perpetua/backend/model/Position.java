package com.perpetua.backend.model;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

@Entity
@Table(name = "positions")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Position {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private Instrument symbol;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private PositionStatus status;

    @Column(nullable = false)
    private Double entryPrice;

    // Decreases on partial exits
    @Column(nullable = false)
    private Double entryAmount;

    @Column(nullable = false)
    private Integer entryLeverage;

    private String entryOrderId;

    private Double currentStopLoss;

    private Double currentTakeProfit;

    private Double exitPrice;

    private Double exitAmount;

    private String exitOrderId;

    @Enumerated(EnumType.STRING)
    @Column(length = 16)
    private ExitReason exitReason;

    // Running total, accumulated across partial exits
    @Builder.Default
    @Column(nullable = false)
    private Double realizedPnl = 0.0;

    @Column(nullable = false)
    private Instant openedAt;

    private Instant closedAt;

    private Instant updatedAt;

    @PrePersist
    @PreUpdate
    void touch() {
        updatedAt = Instant.now();
    }

    public boolean isOpen() {
        return status == PositionStatus.OPEN;
    }

    public enum PositionStatus { OPEN, CLOSED, LIQUIDATED }

    public enum ExitReason { MANUAL, STOP_LOSS, TAKE_PROFIT, LIQUIDATION }
}
