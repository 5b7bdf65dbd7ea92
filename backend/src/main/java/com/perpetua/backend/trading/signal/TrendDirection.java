package com.perpetua.backend.trading.signal;

public enum TrendDirection { UP, DOWN, SIDEWAYS }
