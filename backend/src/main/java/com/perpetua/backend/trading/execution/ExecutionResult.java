package com.perpetua.backend.trading.execution;

public record ExecutionResult(
        boolean success,
        String orderId,
        Double executedPrice,
        Double executedAmount,
        String error
) {

    public static ExecutionResult filled(String orderId, double executedPrice, double executedAmount) {
        return new ExecutionResult(true, orderId, executedPrice, executedAmount, null);
    }

    public static ExecutionResult noOp() {
        return new ExecutionResult(true, null, null, null, null);
    }

    public static ExecutionResult failed(String error) {
        return new ExecutionResult(false, null, null, null, error);
    }
}
