package com.perpetua.backend.trading.execution;

@FunctionalInterface
public interface BuyGuard {

    GuardVerdict check(GuardContext context);
}
