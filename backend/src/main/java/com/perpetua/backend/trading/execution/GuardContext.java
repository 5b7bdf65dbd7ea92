package com.perpetua.backend.trading.execution;

import com.perpetua.backend.model.Instrument;
import com.perpetua.backend.trading.account.AccountRiskProfile;
import com.perpetua.backend.trading.execution.TradeDecision.BuyOrder;
import lombok.Builder;

import java.util.function.DoubleSupplier;

/**
 * Everything a buy guard may look at. The live price and the realized loss windows are
 * resolved on first use, so guards that reject early never trigger those reads.
 */
@Builder
public record GuardContext(
        Instrument instrument,
        BuyOrder order,
        Double stopLoss,
        Double takeProfit,
        PriceSource price,
        double totalEquity,
        double freeCash,
        boolean hasOpenPosition,
        double exchangeOpenNotional,
        double cycleAdmittedNotional,
        double cycleCommittedMargin,
        AccountRiskProfile profile,
        RealizedLosses realizedLosses
) {

    /**
     * Guards price the entry at the live ticker, not at the advisor's requested pricing.
     */
    public double entryPrice() {
        return currentPrice();
    }

    public double currentPrice() {
        return price.currentPrice();
    }

    public double notional() {
        return order.amount() * currentPrice();
    }

    public double margin() {
        return notional() / order.leverage();
    }

    @FunctionalInterface
    public interface PriceSource {

        double currentPrice();

        static PriceSource fixed(double price) {
            return () -> price;
        }

        /**
         * Resolves {@code delegate} once and serves the cached value afterwards.
         */
        static PriceSource memoized(DoubleSupplier delegate) {
            return new PriceSource() {
                private Double value;

                @Override
                public double currentPrice() {
                    if (value == null) {
                        value = delegate.getAsDouble();
                    }
                    return value;
                }
            };
        }
    }

    /**
     * Lazily computed sums of realized P&amp;L inside the rolling loss windows.
     */
    public interface RealizedLosses {

        double daily();

        double weekly();
    }
}
