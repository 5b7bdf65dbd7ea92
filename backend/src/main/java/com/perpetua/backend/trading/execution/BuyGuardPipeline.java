package com.perpetua.backend.trading.execution;

import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * Runs the buy guards in order and stops at the first rejection.
 */
@Slf4j
public class BuyGuardPipeline {

    private final List<BuyGuard> guards;

    public BuyGuardPipeline(SafetyLimits limits) {
        this(BuyGuards.ordered(limits));
    }

    public BuyGuardPipeline(List<BuyGuard> guards) {
        this.guards = List.copyOf(guards);
    }

    public GuardVerdict evaluate(GuardContext context) {
        for (int i = 0; i < guards.size(); i++) {
            GuardVerdict verdict = guards.get(i).check(context);
            if (!verdict.allowed()) {
                log.warn("Buy guard {} ({}) rejected {}: {} threshold={} observed={}",
                        i + 1, verdict.code(), context.instrument().pair(), verdict.message(),
                        verdict.threshold(), verdict.observed());
                return verdict;
            }
        }
        log.info("All {} buy guards passed for {}", guards.size(), context.instrument().pair());
        return GuardVerdict.allow();
    }

    public int size() {
        return guards.size();
    }
}
