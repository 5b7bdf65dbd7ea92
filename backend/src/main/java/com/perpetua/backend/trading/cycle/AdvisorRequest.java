package com.perpetua.backend.trading.cycle;

import com.perpetua.backend.model.Instrument;
import com.perpetua.backend.model.Position;
import com.perpetua.backend.trading.account.AccountRiskProfile;
import com.perpetua.backend.trading.signal.MarketSnapshot;

import java.time.Instant;

public record AdvisorRequest(
        String cycleId,
        Instrument instrument,
        String pair,
        MarketSnapshot market,
        AccountRiskProfile account,
        OpenPosition openPosition,
        Instant requestedAt
) {

    public static AdvisorRequest of(String cycleId, MarketSnapshot market, AccountRiskProfile account,
                                    Position position, Instant requestedAt) {
        return new AdvisorRequest(cycleId, market.instrument(), market.instrument().pair(), market, account,
                position == null ? null : OpenPosition.from(position), requestedAt);
    }

    public record OpenPosition(
            double entryPrice,
            double amount,
            int leverage,
            Double stopLoss,
            Double takeProfit,
            double realizedPnl,
            Instant openedAt
    ) {
        static OpenPosition from(Position position) {
            return new OpenPosition(
                    position.getEntryPrice(),
                    position.getEntryAmount(),
                    position.getEntryLeverage(),
                    position.getCurrentStopLoss(),
                    position.getCurrentTakeProfit(),
                    position.getRealizedPnl() == null ? 0.0 : position.getRealizedPnl(),
                    position.getOpenedAt());
        }
    }
}
