package com.perpetua.backend.trading.account;

public enum TradingMode {
    SURVIVAL,
    DEFENSIVE,
    NORMAL,
    OFFENSIVE,
    AGGRESSIVE
}
