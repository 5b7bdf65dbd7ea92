package com.perpetua.backend.trading.execution;

import com.perpetua.backend.exception.TradingException;
import com.perpetua.backend.model.Trade;
import com.perpetua.backend.model.Trade.TradeStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

@Slf4j
@Component
public class TradeStateMachine {

    public void transition(Trade trade, TradeStatus target) {
        TradeStatus current = trade.getStatus();
        if (current == null || !current.canTransitionTo(target)) {
            throw new TradingException("Illegal trade transition " + current + " -> " + target
                    + " for trade " + trade.getId());
        }
        trade.setStatus(target);
        log.debug("Trade {} {} -> {}", trade.getId(), current, target);
    }
}
