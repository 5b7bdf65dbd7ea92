package com.perpetua.backend.trading.cycle;

/**
 * Source of trading decisions. Implementations return the raw decision JSON; parsing and
 * validation happen in the cycle.
 */
public interface TradingAdvisor {

    String decide(AdvisorRequest request);
}
