package com.perpetua.backend.service.indicator;

public enum Direction { RISING, FALLING, NEUTRAL }
