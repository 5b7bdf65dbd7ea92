package com.perpetua.backend.model;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

@Entity
@Table(name = "trades")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Trade {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private Instrument symbol;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 8)
    private Operation operation;

    // Requested parameters
    private Double pricing;
    private Double amount;
    private Integer leverage;
    private Double percentage;
    private Double stopLoss;
    private Double takeProfit;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private TradeStatus status;

    private String exchangeOrderId;

    private Double executedPrice;

    private Double executedAmount;

    private Instant executedAt;

    @Column(length = 1000)
    private String error;

    @Column(length = 4000)
    private String advisorNote;

    // Position created or affected by this trade
    private Long positionId;

    @Column(nullable = false, updatable = false)
    private Instant createdAt;

    private Instant updatedAt;

    @PrePersist
    void onCreate() {
        Instant now = Instant.now();
        if (createdAt == null) {
            createdAt = now;
        }
        updatedAt = now;
    }

    @PreUpdate
    void onUpdate() {
        updatedAt = Instant.now();
    }

    public enum Operation { BUY, SELL, HOLD }

    public enum TradeStatus {
        PENDING,
        EXECUTING,
        FILLED,
        PARTIAL,
        FAILED,
        CANCELED;

        public boolean isTerminal() {
            return this != PENDING && this != EXECUTING;
        }

        public boolean canTransitionTo(TradeStatus target) {
            if (target == null) return false;
            return switch (this) {
                case PENDING -> target == EXECUTING || target == FAILED || target == CANCELED;
                case EXECUTING -> target.isTerminal();
                default -> false;
            };
        }
    }
}
