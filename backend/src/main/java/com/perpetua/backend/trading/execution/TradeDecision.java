package com.perpetua.backend.trading.execution;

import com.perpetua.backend.exception.DecisionValidationException;
import com.perpetua.backend.model.Trade.Operation;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;

import java.util.ArrayList;
import java.util.List;

/**
 * Advisor decision for one instrument. Produced by {@link DecisionParser}; instances
 * built directly should call {@link #requireConsistent()} before use.
 */
public record TradeDecision(
        @NotNull Operation operation,
        @Valid BuyOrder buy,
        @Valid SellOrder sell,
        @Valid ProfitAdjustment adjustProfit,
        @Size(max = 4000) String chat
) {

    public static TradeDecision buy(double pricing, double amount, int leverage, Double stopLoss, Double takeProfit) {
        ProfitAdjustment adjustment = stopLoss == null && takeProfit == null ? null : new ProfitAdjustment(stopLoss, takeProfit);
        return new TradeDecision(Operation.BUY, new BuyOrder(pricing, amount, leverage), null, adjustment, null);
    }

    public static TradeDecision sell(double percentage) {
        return new TradeDecision(Operation.SELL, null, new SellOrder(percentage), null, null);
    }

    public static TradeDecision hold(Double stopLoss, Double takeProfit) {
        ProfitAdjustment adjustment = stopLoss == null && takeProfit == null ? null : new ProfitAdjustment(stopLoss, takeProfit);
        return new TradeDecision(Operation.HOLD, null, null, adjustment, null);
    }

    public Double stopLoss() {
        return adjustProfit == null ? null : adjustProfit.stopLoss();
    }

    public Double takeProfit() {
        return adjustProfit == null ? null : adjustProfit.takeProfit();
    }

    public boolean hasAdjustment() {
        return stopLoss() != null || takeProfit() != null;
    }

    /**
     * Checks that the sub-object the operation needs is present.
     *
     * @return this decision, for chaining
     * @throws DecisionValidationException when it is not
     */
    public TradeDecision requireConsistent() {
        List<String> violations = new ArrayList<>();
        if (operation == null) {
            violations.add("operation: must not be null");
        } else if (operation == Operation.BUY && buy == null) {
            violations.add("buy: required when operation is Buy");
        } else if (operation == Operation.SELL && sell == null) {
            violations.add("sell: required when operation is Sell");
        }
        if (!violations.isEmpty()) {
            throw new DecisionValidationException("Inconsistent trade decision", violations);
        }
        return this;
    }

    public record BuyOrder(
            @NotNull @Positive Double pricing,
            @NotNull @Positive Double amount,
            @NotNull Integer leverage
    ) {}

    public record SellOrder(
            @NotNull @Positive @DecimalMax("100") Double percentage
    ) {}

    public record ProfitAdjustment(
            @Positive Double stopLoss,
            @Positive Double takeProfit
    ) {}
}
