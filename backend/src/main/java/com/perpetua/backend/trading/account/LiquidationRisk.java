package com.perpetua.backend.trading.account;

public enum LiquidationRisk { LOW, MEDIUM, HIGH }
