package com.perpetua.backend.trading.execution;

public record GuardVerdict(
        boolean allowed,
        GuardCode code,
        String message,
        Double threshold,
        Double observed
) {

    private static final GuardVerdict ALLOW = new GuardVerdict(true, null, null, null, null);

    public static GuardVerdict allow() {
        return ALLOW;
    }

    public static GuardVerdict reject(GuardCode code, String message, Double threshold, Double observed) {
        return new GuardVerdict(false, code, message, threshold, observed);
    }

    public static GuardVerdict reject(GuardCode code, String message) {
        return reject(code, message, null, null);
    }
}
